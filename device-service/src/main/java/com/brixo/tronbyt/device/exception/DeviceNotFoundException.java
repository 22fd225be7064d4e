package com.brixo.tronbyt.device.exception;

/**
 * Se lanza cuando el dispositivo (o una app suya) no existe en el store.
 */
public class DeviceNotFoundException extends RuntimeException {

    public DeviceNotFoundException(String message) {
        super(message);
    }

    public static DeviceNotFoundException device(String deviceId) {
        return new DeviceNotFoundException("Dispositivo no encontrado: " + deviceId);
    }

    public static DeviceNotFoundException app(String deviceId, String iname) {
        return new DeviceNotFoundException("App %s no encontrada en %s".formatted(iname, deviceId));
    }
}
