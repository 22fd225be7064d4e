package com.brixo.tronbyt.device.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mensajes JSON que el servidor envía al dispositivo antes o después de cada
 * imagen binaria.
 */
public interface ServerMessage {

    record DwellSecs(@JsonProperty("dwell_secs") int dwellSecs) implements ServerMessage {
    }

    record Brightness(@JsonProperty("brightness") int brightness) implements ServerMessage {
    }

    record Immediate(@JsonProperty("immediate") boolean immediate) implements ServerMessage {

        public Immediate() {
            this(true);
        }
    }

    record Status(@JsonProperty("status") String status, @JsonProperty("message") String message)
            implements ServerMessage {
    }
}
