package com.brixo.tronbyt.device.exception;

/**
 * Frame WebSocket del dispositivo que no encaja con ningún mensaje conocido.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
