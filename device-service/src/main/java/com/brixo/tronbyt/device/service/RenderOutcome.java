package com.brixo.tronbyt.device.service;

/**
 * Resultado de pasar una app por la caché de renders.
 */
public enum RenderOutcome {
    /** La imagen en caché sigue vigente. */
    FRESH,
    /** Se volvió a renderizar con salida no vacía. */
    RENDERED,
    /** El render terminó bien pero no produjo imagen. */
    EMPTY,
    /** El renderer falló; la imagen anterior queda intacta. */
    FAILED,
    /** App enviada por push: su imagen es la fuente de verdad. */
    PUSHED;

    /** False solo cuando falló el renderer. */
    public boolean succeeded() {
        return this != FAILED;
    }
}
