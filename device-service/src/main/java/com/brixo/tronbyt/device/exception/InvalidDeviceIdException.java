package com.brixo.tronbyt.device.exception;

/**
 * Se lanza cuando un id de dispositivo no tiene exactamente 8 caracteres
 * hexadecimales.
 */
public class InvalidDeviceIdException extends RuntimeException {

    public InvalidDeviceIdException(String deviceId) {
        super("Id de dispositivo inválido: " + deviceId);
    }
}
