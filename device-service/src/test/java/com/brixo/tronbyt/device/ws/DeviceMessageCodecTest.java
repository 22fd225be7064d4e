package com.brixo.tronbyt.device.ws;

import com.brixo.tronbyt.device.exception.ProtocolViolationException;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import static org.junit.jupiter.api.Assertions.*;

class DeviceMessageCodecTest {

    private final DeviceMessageCodec codec = new DeviceMessageCodec(JsonMapper.builder().build());

    @Test
    void decodesAcknowledgments() {
        assertEquals(new ClientMessage.Queued(4), codec.decode("{\"queued\": 4}"));
        assertEquals(new ClientMessage.Displaying(5), codec.decode("{\"displaying\": 5}"));
        assertEquals(new ClientMessage.Displaying(6), codec.decode("{\"status\":\"displaying\",\"counter\":6}"));
    }

    @Test
    void decodesClientInfo() {
        ClientMessage message = codec.decode("{\"client_info\":{\"firmware_version\":\"1.4.2\","
                + "\"firmware_type\":\"ESP32\",\"protocol_version\":2,\"mac\":\"aa:bb:cc\",\"extra\":true}}");

        assertEquals(new ClientMessage.ClientInfo("1.4.2", "ESP32", 2, "aa:bb:cc"), message);
    }

    @Test
    void malformedFramesAreProtocolViolations() {
        assertThrows(ProtocolViolationException.class, () -> codec.decode("not json"));
        assertThrows(ProtocolViolationException.class, () -> codec.decode("{\"hello\":1}"));
        assertThrows(ProtocolViolationException.class, () -> codec.decode("{\"status\":\"displaying\"}"));
    }

    @Test
    void encodesServerMessages() {
        assertEquals("{\"dwell_secs\":15}", codec.encode(new ServerMessage.DwellSecs(15)));
        assertEquals("{\"brightness\":40}", codec.encode(new ServerMessage.Brightness(40)));
        assertEquals("{\"immediate\":true}", codec.encode(new ServerMessage.Immediate()));
    }
}
