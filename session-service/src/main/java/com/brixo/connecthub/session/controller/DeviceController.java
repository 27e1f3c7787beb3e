package com.brixo.connecthub.session.controller;

import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.Device;
import com.brixo.connecthub.session.model.DeviceActionRequest;
import com.brixo.connecthub.session.service.DeviceActionService;
import com.brixo.connecthub.session.service.DeviceRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * API del registro de dispositivos.
 *
 * GET  /api/devices              → lista todos los dispositivos conocidos
 * GET  /api/devices/{id}         → un dispositivo por su id
 * POST /api/devices/{id}/actions → { "action": "PING" | "RING" | "SEND_CLIPBOARD" | "SHARE_URL", "argument"?: ... }
 */
@RestController
@RequestMapping("/api/devices")
public class DeviceController {

    private final DeviceRegistryService deviceRegistryService;
    private final DeviceActionService deviceActionService;

    public DeviceController(DeviceRegistryService deviceRegistryService,
            DeviceActionService deviceActionService) {
        this.deviceRegistryService = deviceRegistryService;
        this.deviceActionService = deviceActionService;
    }

    /** Lista todos los dispositivos ordenados por id. */
    @GetMapping
    public ResponseEntity<List<Device>> getAllDevices() {
        return ResponseEntity.ok(deviceRegistryService.snapshot());
    }

    @GetMapping("/{id}")
    public ResponseEntity<Device> getDevice(@PathVariable String id) {
        return deviceRegistryService.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /** Lanza una acción sobre un dispositivo emparejado. */
    @PostMapping("/{id}/actions")
    public CompletableFuture<ResponseEntity<CommandResult>> perform(@PathVariable String id,
            @RequestBody DeviceActionRequest request) {
        return deviceActionService.perform(id, request.action(), request.argument())
                .thenApply(CommandResponses::toResponse);
    }
}
