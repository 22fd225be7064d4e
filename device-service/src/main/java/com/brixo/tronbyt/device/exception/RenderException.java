package com.brixo.tronbyt.device.exception;

/**
 * Fallo del renderer externo. Un render sin salida (cero bytes) no es un
 * fallo: significa que la app no tiene nada que mostrar por ahora.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
