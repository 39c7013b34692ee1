package com.example.coldchain.controller;

import com.example.coldchain.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private final MonitoringConfig monitoringConfig;

    @GetMapping("/monitoring-config")
    public ResponseEntity<MonitoringConfig> monitoringConfig() {
        return ResponseEntity.ok(monitoringConfig);
    }
}
