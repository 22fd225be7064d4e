package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.exception.InvalidDeviceIdException;

import java.util.regex.Pattern;

/** Validación del formato de id: exactamente 8 caracteres hexadecimales. */
public final class DeviceIds {

    private static final Pattern DEVICE_ID = Pattern.compile("^[a-fA-F0-9]{8}$");

    private DeviceIds() {
    }

    public static boolean isValid(String deviceId) {
        return deviceId != null && DEVICE_ID.matcher(deviceId).matches();
    }

    public static String require(String deviceId) {
        if (!isValid(deviceId)) {
            throw new InvalidDeviceIdException(deviceId);
        }
        return deviceId;
    }
}
