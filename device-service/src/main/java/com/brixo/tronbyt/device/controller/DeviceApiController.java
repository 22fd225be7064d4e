package com.brixo.tronbyt.device.controller;

import com.brixo.tronbyt.device.model.AppInstallRequest;
import com.brixo.tronbyt.device.model.AppUpdateRequest;
import com.brixo.tronbyt.device.model.Device;
import com.brixo.tronbyt.device.model.DeviceCreateRequest;
import com.brixo.tronbyt.device.model.DeviceSettingsRequest;
import com.brixo.tronbyt.device.model.MoveDirection;
import com.brixo.tronbyt.device.service.DeviceAppService;
import com.brixo.tronbyt.device.service.DeviceSettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * API de gestión de dispositivos y sus apps instaladas.
 *
 * GET    /v0/devices                                   → lista
 * POST   /v0/devices                                   → alta
 * GET    /v0/devices/{id}                              → detalle
 * PATCH  /v0/devices/{id}                              → brillo, modos, intersticial...
 * DELETE /v0/devices/{id}                              → baja (borra sus imágenes)
 * GET    /v0/devices/{id}/installations                → apps por orden
 * POST   /v0/devices/{id}/installations                → instala una app
 * PATCH  /v0/devices/{id}/installations/{iname}        → edita una app
 * DELETE /v0/devices/{id}/installations/{iname}        → desinstala
 * POST   /v0/devices/{id}/installations/{iname}/move   → ?direction=up|down
 * POST   /v0/devices/{id}/installations/{iname}/pin    → fija la app
 * DELETE /v0/devices/{id}/pin                          → libera la app fijada
 */
@RestController
@RequestMapping("/v0/devices")
public class DeviceApiController {

    private final DeviceSettingsService deviceSettingsService;
    private final DeviceAppService deviceAppService;

    public DeviceApiController(DeviceSettingsService deviceSettingsService, DeviceAppService deviceAppService) {
        this.deviceSettingsService = deviceSettingsService;
        this.deviceAppService = deviceAppService;
    }

    // ── Dispositivos ─────────────────────────────────────────────────────────

    @GetMapping
    public ResponseEntity<?> listDevices() {
        return ResponseEntity.ok(deviceSettingsService.findAll());
    }

    @PostMapping
    public ResponseEntity<?> createDevice(@RequestBody DeviceCreateRequest request) {
        return ApiErrors.handle(() -> {
            Device device = deviceSettingsService.create(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(device);
        });
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getDevice(@PathVariable String id) {
        return ApiErrors.handle(() -> ResponseEntity.ok(deviceSettingsService.get(id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> updateDevice(@PathVariable String id, @RequestBody DeviceSettingsRequest request) {
        return ApiErrors.handle(() -> ResponseEntity.ok(deviceSettingsService.updateSettings(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteDevice(@PathVariable String id) {
        return ApiErrors.handle(() -> {
            deviceSettingsService.delete(id);
            return ResponseEntity.noContent().build();
        });
    }

    // ── Instalaciones ────────────────────────────────────────────────────────

    @GetMapping("/{id}/installations")
    public ResponseEntity<?> listInstallations(@PathVariable String id) {
        return ApiErrors.handle(() -> ResponseEntity.ok(deviceAppService.list(id)));
    }

    @PostMapping("/{id}/installations")
    public ResponseEntity<?> install(@PathVariable String id, @RequestBody AppInstallRequest request) {
        return ApiErrors.handle(() ->
                ResponseEntity.status(HttpStatus.CREATED).body(deviceAppService.install(id, request)));
    }

    @GetMapping("/{id}/installations/{iname}")
    public ResponseEntity<?> getInstallation(@PathVariable String id, @PathVariable String iname) {
        return ApiErrors.handle(() -> ResponseEntity.ok(deviceAppService.get(id, iname)));
    }

    @PatchMapping("/{id}/installations/{iname}")
    public ResponseEntity<?> updateInstallation(@PathVariable String id, @PathVariable String iname,
            @RequestBody AppUpdateRequest request) {
        return ApiErrors.handle(() -> ResponseEntity.ok(deviceAppService.update(id, iname, request)));
    }

    @DeleteMapping("/{id}/installations/{iname}")
    public ResponseEntity<?> deleteInstallation(@PathVariable String id, @PathVariable String iname) {
        return ApiErrors.handle(() -> {
            deviceAppService.delete(id, iname);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/{id}/installations/{iname}/move")
    public ResponseEntity<?> moveInstallation(@PathVariable String id, @PathVariable String iname,
            @RequestParam String direction) {
        return ApiErrors.handle(() ->
                ResponseEntity.ok(deviceAppService.move(id, iname, MoveDirection.parse(direction))));
    }

    @PostMapping("/{id}/installations/{iname}/pin")
    public ResponseEntity<?> pin(@PathVariable String id, @PathVariable String iname) {
        return ApiErrors.handle(() -> {
            deviceAppService.pin(id, iname);
            return ResponseEntity.noContent().build();
        });
    }

    @DeleteMapping("/{id}/pin")
    public ResponseEntity<?> unpin(@PathVariable String id) {
        return ApiErrors.handle(() -> {
            deviceAppService.unpin(id);
            return ResponseEntity.noContent().build();
        });
    }
}
