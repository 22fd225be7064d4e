package com.brixo.tronbyt.device.service;

import com.brixo.tronbyt.device.model.Frame;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.DigestUtils;

import java.time.Duration;

/**
 * Traduce un {@link Frame} a la respuesta HTTP que espera el firmware.
 */
public final class FrameResponses {

    public static final String BRIGHTNESS_HEADER = "Tronbyt-Brightness";
    public static final String DWELL_HEADER = "Tronbyt-Dwell-Secs";
    public static final String IMMEDIATE_HEADER = "Tronbyt-Immediate";
    public static final MediaType WEBP = MediaType.parseMediaType("image/webp");

    private FrameResponses() {
    }

    public static ResponseEntity<byte[]> of(Frame frame) {
        return of(frame, null);
    }

    /** Igual que {@link #of(Frame)} con un ETag para peticiones condicionales. */
    public static ResponseEntity<byte[]> of(Frame frame, String etag) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .contentType(WEBP)
                .cacheControl(revalidate())
                .header(BRIGHTNESS_HEADER, String.valueOf(frame.brightness()))
                .header(DWELL_HEADER, String.valueOf(frame.dwellSecs()));
        if (frame.immediate()) {
            builder.header(IMMEDIATE_HEADER, "1");
        }
        if (etag != null) {
            builder.eTag(etag);
        }
        return builder.body(frame.image());
    }

    /** ETag fuerte a partir del contenido de la imagen. */
    public static String etag(byte[] image) {
        return "\"" + DigestUtils.md5DigestAsHex(image) + "\"";
    }

    public static ResponseEntity<byte[]> image(byte[] image) {
        return ResponseEntity.ok()
                .contentType(WEBP)
                .cacheControl(revalidate())
                .eTag(etag(image))
                .body(image);
    }

    static CacheControl revalidate() {
        return CacheControl.maxAge(Duration.ZERO).cachePublic().mustRevalidate();
    }
}
