package com.brixo.tronbyt.device.sync;

/**
 * Aviso entregado a la sesión de un dispositivo: una imagen para mostrar de
 * inmediato, un brillo nuevo o una señal de refresco sin datos.
 */
public interface SyncPayload {

    record Image(byte[] bytes) implements SyncPayload {
    }

    record Brightness(int value) implements SyncPayload {
    }

    record Refresh() implements SyncPayload {
    }
}
