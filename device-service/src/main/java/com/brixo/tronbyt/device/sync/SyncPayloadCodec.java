package com.brixo.tronbyt.device.sync;

import com.fasterxml.jackson.annotation.JsonInclude;
import tools.jackson.databind.ObjectMapper;

/**
 * Formato JSON de los avisos publicados entre procesos:
 * {@code {"type":"image","image":"<base64>"}}, {@code {"type":"brightness","brightness":40}}
 * o {@code {"type":"refresh"}}.
 */
public class SyncPayloadCodec {

    private final ObjectMapper objectMapper;

    public SyncPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(SyncPayload payload) {
        Envelope envelope;
        if (payload instanceof SyncPayload.Image image) {
            envelope = new Envelope("image", image.bytes(), null);
        } else if (payload instanceof SyncPayload.Brightness brightness) {
            envelope = new Envelope("brightness", null, brightness.value());
        } else {
            envelope = new Envelope("refresh", null, null);
        }
        return objectMapper.writeValueAsString(envelope);
    }

    /**
     * @throws IllegalArgumentException si el mensaje no es un aviso válido
     */
    public SyncPayload decode(String raw) {
        Envelope envelope = objectMapper.readValue(raw, Envelope.class);
        if (envelope.type() == null) {
            throw new IllegalArgumentException("Aviso sin tipo");
        }
        return switch (envelope.type()) {
            case "image" -> {
                if (envelope.image() == null) {
                    throw new IllegalArgumentException("Aviso de imagen sin bytes");
                }
                yield new SyncPayload.Image(envelope.image());
            }
            case "brightness" -> {
                if (envelope.brightness() == null) {
                    throw new IllegalArgumentException("Aviso de brillo sin valor");
                }
                yield new SyncPayload.Brightness(envelope.brightness());
            }
            case "refresh" -> new SyncPayload.Refresh();
            default -> throw new IllegalArgumentException("Tipo de aviso desconocido: " + envelope.type());
        };
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Envelope(String type, byte[] image, Integer brightness) {
    }
}
