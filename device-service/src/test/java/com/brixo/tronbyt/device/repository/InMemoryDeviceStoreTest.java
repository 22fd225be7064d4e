package com.brixo.tronbyt.device.repository;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.exception.StorageWriteConflictException;
import com.brixo.tronbyt.device.model.App;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import com.brixo.tronbyt.device.model.ProtocolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDeviceStoreTest {

    private InMemoryDeviceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDeviceStore(new DeviceDocuments(JsonMapper.builder().build()));
        Device device = new Device("abcd1234", "tester");
        App app = new App("100", "clock", 0);
        app.setRecurrenceStartDate(LocalDate.of(2025, 3, 1));
        device.putApp(app);
        store.save(device);
    }

    @Test
    void readsReturnIndependentCopies() {
        Device first = store.findById("abcd1234").orElseThrow();
        first.setBrightness(5);
        first.getApps().get("100").setEnabled(false);

        Device second = store.findById("abcd1234").orElseThrow();
        assertEquals(Device.DEFAULT_BRIGHTNESS, second.getBrightness());
        assertTrue(second.getApps().get("100").isEnabled());
        assertEquals(LocalDate.of(2025, 3, 1), second.getApps().get("100").getRecurrenceStartDate());
    }

    @Test
    void updateAppliesAllFieldsTogether() {
        Instant seen = Instant.parse("2025-01-01T10:00:00Z");
        store.update("abcd1234",
                FieldUpdate.device("lastAppIndex", 3),
                FieldUpdate.device("lastSeen", seen),
                FieldUpdate.app("100", "lastRender", 1234L),
                FieldUpdate.info("protocolType", ProtocolType.WS));

        Device device = store.findById("abcd1234").orElseThrow();
        assertEquals(3, device.getLastAppIndex());
        assertEquals(seen, device.getLastSeen());
        assertEquals(1234L, device.getApps().get("100").getLastRender());
        assertEquals(ProtocolType.WS, device.getInfo().getProtocolType());
    }

    @Test
    void setAcceptsNullForExistingField() {
        store.update("abcd1234", FieldUpdate.device("pinnedApp", "100"));
        store.update("abcd1234", FieldUpdate.device("pinnedApp", null));

        assertNull(store.findById("abcd1234").orElseThrow().getPinnedApp());
    }

    @Test
    void unknownFieldRejectsWholeUpdate() {
        assertThrows(StorageWriteConflictException.class, () -> store.update("abcd1234",
                FieldUpdate.device("lastAppIndex", 9),
                FieldUpdate.device("noSuchField", 1)));

        assertEquals(0, store.findById("abcd1234").orElseThrow().getLastAppIndex());
    }

    @Test
    void updateOnMissingAppFails() {
        assertThrows(StorageWriteConflictException.class,
                () -> store.update("abcd1234", FieldUpdate.app("999", "enabled", false)));
    }

    @Test
    void updateOnMissingDeviceFails() {
        assertThrows(DeviceNotFoundException.class,
                () -> store.update("ffff0000", FieldUpdate.device("brightness", 10)));
    }

    @Test
    void putAndRemoveApps() {
        store.update("abcd1234", FieldUpdate.putApp(new App("101", "weather", 1)));
        assertEquals(List.of("100", "101"),
                List.copyOf(store.findById("abcd1234").orElseThrow().getApps().keySet()));

        store.update("abcd1234", FieldUpdate.removeApp("100"));
        Device device = store.findById("abcd1234").orElseThrow();
        assertEquals(List.of("101"), List.copyOf(device.getApps().keySet()));
        assertEquals("weather", device.getApps().get("101").getName());

        assertThrows(StorageWriteConflictException.class,
                () -> store.update("abcd1234", FieldUpdate.removeApp("100")));
    }

    @Test
    void deleteAndFindAll() {
        store.save(new Device("0000ffff", "other"));
        assertEquals(2, store.findAll().size());

        assertTrue(store.delete("0000ffff"));
        assertFalse(store.delete("0000ffff"));
        assertEquals(1, store.findAll().size());
    }
}
