package com.brixo.tronbyt.device.repository;

import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Acceso a los registros de dispositivos (con sus apps anidadas).
 *
 * Cada lectura devuelve una copia independiente. Las mutaciones parciales se
 * hacen con {@link #update(String, List)}, que aplica todas las asignaciones
 * en una sola transacción en lugar de leer, modificar y guardar el objeto
 * completo.
 */
public interface DeviceStore {

    Optional<Device> findById(String deviceId);

    List<Device> findAll();

    /** Inserta o reemplaza el documento completo del dispositivo. */
    Device save(Device device);

    boolean delete(String deviceId);

    /**
     * Aplica las asignaciones de campos de forma atómica.
     *
     * @throws com.brixo.tronbyt.device.exception.DeviceNotFoundException       si el dispositivo no existe
     * @throws com.brixo.tronbyt.device.exception.StorageWriteConflictException si no se pudo confirmar
     */
    void update(String deviceId, List<FieldUpdate> updates);

    default void update(String deviceId, FieldUpdate... updates) {
        update(deviceId, List.of(updates));
    }
}
