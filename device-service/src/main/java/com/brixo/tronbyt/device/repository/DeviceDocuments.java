package com.brixo.tronbyt.device.repository;

import com.brixo.tronbyt.device.exception.StorageWriteConflictException;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.FieldUpdate;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Serializa dispositivos a JSON y aplica actualizaciones por ruta sobre el
 * documento. Lo comparten los stores en memoria y Redis.
 */
@Component
public class DeviceDocuments {

    private final ObjectMapper objectMapper;

    public DeviceDocuments(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Device device) {
        return objectMapper.writeValueAsString(device);
    }

    public Device read(String raw) {
        return objectMapper.readValue(raw, Device.class);
    }

    /**
     * Aplica las asignaciones sobre el JSON crudo y devuelve el nuevo JSON.
     * Un SET solo toca campos que ya existen en el documento, así una ruta
     * mal escrita falla en vez de dejar una propiedad huérfana.
     */
    public String applyUpdates(String raw, List<FieldUpdate> updates) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JacksonException e) {
            throw new StorageWriteConflictException("Documento de dispositivo corrupto", e);
        }
        if (!(root instanceof ObjectNode document)) {
            throw new StorageWriteConflictException("Documento de dispositivo corrupto");
        }
        for (FieldUpdate update : updates) {
            assign(document, update);
        }
        return objectMapper.writeValueAsString(document);
    }

    private void assign(ObjectNode document, FieldUpdate update) {
        List<String> path = update.path();
        ObjectNode parent = document;
        for (String segment : path.subList(0, path.size() - 1)) {
            JsonNode child = parent.get(segment);
            if (!(child instanceof ObjectNode next)) {
                throw new StorageWriteConflictException("Ruta inexistente: " + update.describe());
            }
            parent = next;
        }
        String field = path.get(path.size() - 1);
        switch (update.kind()) {
            case PUT -> parent.set(field, objectMapper.valueToTree(update.value()));
            case REMOVE -> {
                if (parent.remove(field) == null) {
                    throw new StorageWriteConflictException("Entrada inexistente: " + update.describe());
                }
            }
            case SET -> {
                if (!parent.has(field)) {
                    throw new StorageWriteConflictException("Campo inexistente: " + update.describe());
                }
                if (update.value() == null) {
                    parent.putNull(field);
                } else {
                    parent.set(field, objectMapper.valueToTree(update.value()));
                }
            }
        }
    }
}
