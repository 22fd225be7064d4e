package com.brixo.tronbyt.device.model;

/**
 * Alta de dispositivo. Si no se indica id se genera uno aleatorio.
 */
public record DeviceCreateRequest(String id, String owner, String name, DeviceType type, String timezone) {
}
