package com.example.coldchain.controller;

import com.example.coldchain.domain.Sensor;
import com.example.coldchain.service.SensorService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Sensor registry API. The shared key is write-only.
 */
@RestController
@RequestMapping("/api/sensors")
@RequiredArgsConstructor
public class SensorController {

    private final SensorService sensorService;

    public record SensorRequest(String name, String ipAddress, String sharedKey) {
    }

    @GetMapping
    public ResponseEntity<List<Sensor>> listSensors() {
        return ResponseEntity.ok(sensorService.list());
    }

    @GetMapping("/{name}")
    public ResponseEntity<Sensor> getSensor(@PathVariable String name) {
        return ResponseEntity.ok(sensorService.get(name));
    }

    /**
     * Register a sensor, or update it if the name is taken.
     */
    @PostMapping
    public ResponseEntity<Sensor> register(@RequestBody SensorRequest request) {
        return ResponseEntity.ok(sensorService.register(request.name(), request.ipAddress(), request.sharedKey()));
    }

    @PutMapping("/{name}")
    public ResponseEntity<Sensor> update(@PathVariable String name, @RequestBody SensorRequest request) {
        sensorService.get(name);
        return ResponseEntity.ok(sensorService.register(name, request.ipAddress(), request.sharedKey()));
    }
}
