package com.brixo.tronbyt.device.controller;

import com.brixo.tronbyt.device.model.Frame;
import com.brixo.tronbyt.device.service.DeviceIds;
import com.brixo.tronbyt.device.service.FrameResponses;
import com.brixo.tronbyt.device.service.RotationService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.WebRequest;

import java.util.Map;

/**
 * Endpoints que consulta el firmware por HTTP.
 *
 * GET /{deviceId}/next              → siguiente imagen de la rotación
 * GET /{deviceId}/currentapp        → imagen actual sin avanzar (ETag / 304)
 * GET /{deviceId}/{iname}/appwebp   → última imagen de una app concreta
 * GET /{deviceId}/brightness        → brillo efectivo en texto plano
 */
@RestController
public class DeviceImageController {

    private final RotationService rotationService;

    public DeviceImageController(RotationService rotationService) {
        this.rotationService = rotationService;
    }

    @GetMapping("/{deviceId}/next")
    public ResponseEntity<?> next(@PathVariable String deviceId) {
        return ApiErrors.handle(() -> {
            DeviceIds.require(deviceId);
            return FrameResponses.of(rotationService.nextFrame(deviceId));
        });
    }

    @GetMapping("/{deviceId}/currentapp")
    public ResponseEntity<?> currentApp(@PathVariable String deviceId, WebRequest request) {
        return ApiErrors.handle(() -> {
            DeviceIds.require(deviceId);
            Frame frame = rotationService.currentFrame(deviceId);
            String etag = FrameResponses.etag(frame.image());
            if (request.checkNotModified(etag)) {
                return ResponseEntity.status(HttpStatus.NOT_MODIFIED).eTag(etag).build();
            }
            return FrameResponses.of(frame, etag);
        });
    }

    @GetMapping("/{deviceId}/{iname}/appwebp")
    public ResponseEntity<?> appWebp(@PathVariable String deviceId, @PathVariable String iname) {
        return ApiErrors.handle(() -> {
            DeviceIds.require(deviceId);
            return rotationService.appImage(deviceId, iname)
                    .<ResponseEntity<?>>map(FrameResponses::image)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "La app " + iname + " todavía no tiene imagen")));
        });
    }

    @GetMapping("/{deviceId}/brightness")
    public ResponseEntity<?> brightness(@PathVariable String deviceId) {
        return ApiErrors.handle(() -> {
            DeviceIds.require(deviceId);
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(String.valueOf(rotationService.brightness(deviceId)));
        });
    }
}
