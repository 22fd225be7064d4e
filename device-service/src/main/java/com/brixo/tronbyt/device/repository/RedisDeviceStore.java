package com.brixo.tronbyt.device.repository;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.exception.StorageWriteConflictException;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Store de dispositivos sobre Redis, para varios procesos compartiendo estado.
 *
 * Cada dispositivo es un documento JSON en {@code tronbyt:device:<id>}; el set
 * {@code tronbyt:devices} indexa los ids. Las actualizaciones parciales usan
 * WATCH/MULTI/EXEC y se reintentan si otra escritura toca la clave en medio.
 */
@Repository
@ConditionalOnProperty(name = "tronbyt.storage.backend", havingValue = "redis")
public class RedisDeviceStore implements DeviceStore {

    private static final Logger log = LoggerFactory.getLogger(RedisDeviceStore.class);
    private static final String KEY_PREFIX = "tronbyt:device:";
    private static final String INDEX_KEY = "tronbyt:devices";

    private final StringRedisTemplate redis;
    private final DeviceDocuments deviceDocuments;
    private final int maxRetries;

    public RedisDeviceStore(StringRedisTemplate redis, DeviceDocuments deviceDocuments,
            @Value("${tronbyt.storage.redis.max-retries:5}") int maxRetries) {
        this.redis = redis;
        this.deviceDocuments = deviceDocuments;
        this.maxRetries = Math.max(1, maxRetries);
    }

    @Override
    public Optional<Device> findById(String deviceId) {
        String raw = redis.opsForValue().get(key(deviceId));
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(deviceDocuments.read(raw));
    }

    @Override
    public List<Device> findAll() {
        Set<String> ids = redis.opsForSet().members(INDEX_KEY);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> keys = ids.stream().sorted().map(RedisDeviceStore::key).toList();
        List<String> raws = redis.opsForValue().multiGet(keys);
        if (raws == null) {
            return List.of();
        }
        List<Device> devices = new ArrayList<>();
        for (String raw : raws) {
            if (raw == null) {
                continue;
            }
            try {
                devices.add(deviceDocuments.read(raw));
            } catch (RuntimeException e) {
                log.warn("Documento de dispositivo ilegible en Redis, se omite: {}", e.getMessage());
            }
        }
        return devices;
    }

    @Override
    public Device save(Device device) {
        redis.opsForValue().set(key(device.getId()), deviceDocuments.write(device));
        redis.opsForSet().add(INDEX_KEY, device.getId());
        return device;
    }

    @Override
    public boolean delete(String deviceId) {
        redis.opsForSet().remove(INDEX_KEY, deviceId);
        return Boolean.TRUE.equals(redis.delete(key(deviceId)));
    }

    @Override
    public void update(String deviceId, List<FieldUpdate> updates) {
        String key = key(deviceId);
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            List<Object> result = redis.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    String raw = ops.opsForValue().get(key);
                    if (raw == null) {
                        ops.unwatch();
                        throw DeviceNotFoundException.device(deviceId);
                    }
                    String updated;
                    try {
                        updated = deviceDocuments.applyUpdates(raw, updates);
                    } catch (RuntimeException e) {
                        ops.unwatch();
                        throw e;
                    }
                    ops.multi();
                    ops.opsForValue().set(key, updated);
                    return ops.exec();
                }
            });
            if (result != null && !result.isEmpty()) {
                return;
            }
            log.debug("Conflicto de escritura en {} (intento {}/{})", key, attempt, maxRetries);
        }
        throw new StorageWriteConflictException(
                "No se pudo actualizar %s tras %d intentos".formatted(deviceId, maxRetries));
    }

    private static String key(String deviceId) {
        return KEY_PREFIX + Objects.requireNonNull(deviceId);
    }
}
