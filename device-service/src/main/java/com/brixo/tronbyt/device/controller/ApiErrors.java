package com.brixo.tronbyt.device.controller;

import com.brixo.tronbyt.device.exception.DeviceNotFoundException;
import com.brixo.tronbyt.device.exception.InvalidDeviceIdException;
import com.brixo.tronbyt.device.exception.StorageWriteConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Traducción de excepciones de dominio a respuestas {@code {"error": "..."}}.
 */
final class ApiErrors {

    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {
    }

    static ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (InvalidDeviceIdException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (DeviceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (StorageWriteConflictException e) {
            log.warn("Conflicto de escritura: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }
}
