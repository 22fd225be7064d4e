package com.brixo.tronbyt.device.model;

/** Canal por el que el dispositivo recibe imágenes. */
public enum ProtocolType {
    HTTP,
    WS
}
