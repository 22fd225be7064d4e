package com.brixo.tronbyt.device.repository;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store de dispositivos en memoria, para desarrollo y despliegues de un solo
 * proceso. Se pierde al reiniciar el servicio.
 *
 * Guarda los documentos serializados para que cada lectura sea una copia y
 * cada {@code update} un {@code computeIfPresent} atómico por clave.
 */
@Repository
@ConditionalOnProperty(name = "tronbyt.storage.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryDeviceStore implements DeviceStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();
    private final DeviceDocuments deviceDocuments;

    public InMemoryDeviceStore(DeviceDocuments deviceDocuments) {
        this.deviceDocuments = deviceDocuments;
    }

    @Override
    public Optional<Device> findById(String deviceId) {
        return Optional.ofNullable(documents.get(deviceId)).map(deviceDocuments::read);
    }

    @Override
    public List<Device> findAll() {
        return documents.values().stream().map(deviceDocuments::read).toList();
    }

    @Override
    public Device save(Device device) {
        documents.put(device.getId(), deviceDocuments.write(device));
        return device;
    }

    @Override
    public boolean delete(String deviceId) {
        return documents.remove(deviceId) != null;
    }

    @Override
    public void update(String deviceId, List<FieldUpdate> updates) {
        String result = documents.computeIfPresent(deviceId,
                (id, raw) -> deviceDocuments.applyUpdates(raw, updates));
        if (result == null) {
            throw DeviceNotFoundException.device(deviceId);
        }
    }
}
