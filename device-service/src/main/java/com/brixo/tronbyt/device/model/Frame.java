package com.brixo.tronbyt.device.model;

/**
 * Imagen lista para entregar a un dispositivo, con los metadatos que viajan
 * junto a ella (cabeceras HTTP o mensajes WebSocket).
 *
 * @param image      bytes webp
 * @param brightness brillo efectivo (0-100)
 * @param dwellSecs  segundos que la imagen permanece en pantalla
 * @param immediate  true si el dispositivo debe interrumpir la imagen actual
 * @param appIname   iname de la app de origen, null para push o placeholder
 */
public record Frame(byte[] image, int brightness, int dwellSecs, boolean immediate, String appIname) {

    /** True si el frame no proviene de una app instalada. */
    public boolean isDetached() {
        return appIname == null;
    }
}
