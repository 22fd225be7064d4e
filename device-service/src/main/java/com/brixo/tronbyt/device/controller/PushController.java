package com.brixo.tronbyt.device.controller;

import com.brixo.tronbyt.device.model.PushRequest;
import com.brixo.tronbyt.device.service.PushService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.Map;

/**
 * POST /v0/devices/{id}/push → { "image": "<webp base64>", "installationID": "opcional" }
 */
@RestController
@RequestMapping("/v0/devices")
public class PushController {

    private final PushService pushService;

    public PushController(PushService pushService) {
        this.pushService = pushService;
    }

    @PostMapping("/{id}/push")
    public ResponseEntity<?> push(@PathVariable String id, @RequestBody PushRequest request) {
        return ApiErrors.handle(() -> {
            if (request.image() == null || request.image().isBlank()) {
                throw new IllegalArgumentException("Falta la imagen");
            }
            byte[] image = Base64.getDecoder().decode(request.image().trim());
            pushService.push(id, image, request.installationId());
            return ResponseEntity.ok(Map.of("status", "WebP recibido"));
        });
    }
}
