package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.exception.ProtocolViolationException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Traduce los frames de texto del WebSocket a {@link ClientMessage} y los
 * {@link ServerMessage} a JSON.
 *
 * El firmware manda "displaying" de dos formas: {@code {"displaying": 7}} o
 * {@code {"status": "displaying", "counter": 7}}. Ambas se reciben igual.
 */
@Component
public class DeviceMessageCodec {

    private final ObjectMapper objectMapper;

    public DeviceMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClientMessage decode(String text) {
        InboundFrame frame;
        try {
            frame = objectMapper.readValue(text, InboundFrame.class);
        } catch (JacksonException e) {
            throw new ProtocolViolationException("Frame JSON inválido: " + abbreviate(text), e);
        }
        if (frame == null) {
            throw new ProtocolViolationException("Frame vacío");
        }
        if (frame.queued() != null) {
            return new ClientMessage.Queued(frame.queued());
        }
        if (frame.displaying() != null) {
            return new ClientMessage.Displaying(frame.displaying());
        }
        if ("displaying".equals(frame.status()) && frame.counter() != null) {
            return new ClientMessage.Displaying(frame.counter());
        }
        if (frame.clientInfo() != null) {
            InboundClientInfo info = frame.clientInfo();
            return new ClientMessage.ClientInfo(info.firmwareVersion(), info.firmwareType(),
                    info.protocolVersion(), info.macAddress());
        }
        throw new ProtocolViolationException("Mensaje desconocido: " + abbreviate(text));
    }

    public String encode(ServerMessage message) {
        return objectMapper.writeValueAsString(message);
    }

    private static String abbreviate(String text) {
        return text.length() > 120 ? text.substring(0, 120) + "..." : text;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InboundFrame(
            @JsonProperty("queued") Long queued,
            @JsonProperty("displaying") Long displaying,
            @JsonProperty("status") String status,
            @JsonProperty("counter") Long counter,
            @JsonProperty("client_info") InboundClientInfo clientInfo) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InboundClientInfo(
            @JsonProperty("firmware_version") String firmwareVersion,
            @JsonProperty("firmware_type") String firmwareType,
            @JsonProperty("protocol_version") Integer protocolVersion,
            @JsonProperty("mac_address") @JsonAlias("mac") String macAddress) {
    }
}
