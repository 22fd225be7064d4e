package com.brixo.tronbyt.device.ws;

/**
 * Mensajes JSON que envía el dispositivo por el WebSocket.
 */
public interface ClientMessage {

    /** El dispositivo recibió y encoló la imagen {@code counter}. */
    record Queued(long counter) implements ClientMessage {
    }

    /** El dispositivo empezó a mostrar la imagen {@code counter}. */
    record Displaying(long counter) implements ClientMessage {
    }

    record ClientInfo(String firmwareVersion, String firmwareType, Integer protocolVersion,
            String macAddress) implements ClientMessage {
    }
}
