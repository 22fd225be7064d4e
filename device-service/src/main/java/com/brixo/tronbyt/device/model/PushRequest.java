package com.brixo.tronbyt.device.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Imagen webp en base64 enviada por push. Con {@code installationID} la imagen
 * queda como app instalada; sin él se muestra una sola vez.
 */
public record PushRequest(
        @JsonProperty("image") String image,
        @JsonProperty("installationID") @JsonAlias("installationId") String installationId) {
}
