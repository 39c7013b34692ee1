package com.example.coldchain.controller;

import com.example.coldchain.domain.Reading;
import com.example.coldchain.service.ReadingIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Sensor reading ingestion API.
 */
@RestController
@RequestMapping("/api/readings")
@RequiredArgsConstructor
public class ReadingController {

    private final ReadingIngestionService ingestionService;

    public record ReadingRequest(String sensor, Double temperature, Double humidity) {
    }

    @PostMapping
    public ResponseEntity<ReadingIngestionService.IngestionResult> ingest(@RequestBody ReadingRequest request) {
        return ResponseEntity.ok(ingestionService.ingest(request.sensor(), request.temperature(), request.humidity()));
    }

    @GetMapping("/{sensor}/latest")
    public ResponseEntity<Reading> latest(@PathVariable String sensor) {
        return ResponseEntity.ok(ingestionService.latest(sensor));
    }

    @GetMapping("/{sensor}")
    public ResponseEntity<List<Reading>> recent(@PathVariable String sensor) {
        return ResponseEntity.ok(ingestionService.recent(sensor));
    }
}
