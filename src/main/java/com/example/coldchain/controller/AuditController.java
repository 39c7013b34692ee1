package com.example.coldchain.controller;

import com.example.coldchain.domain.AuditLog;
import com.example.coldchain.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the audit trail, per alert or ticket.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> search(
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) AuditLog.Action action,
            @RequestParam(required = false) String target,
            @RequestParam(defaultValue = "100") int limit) {
        if (actor == null && action == null && target == null) {
            return ResponseEntity.ok(auditService.getRecent(limit));
        }
        return ResponseEntity.ok(auditService.filter(actor, action, target));
    }

    @GetMapping("/alerts/{alertId}")
    public ResponseEntity<List<AuditLog>> alertTrail(@PathVariable Long alertId) {
        return ResponseEntity.ok(auditService.filter(null, null, AuditService.alertTarget(alertId)));
    }

    @GetMapping("/tickets/{ticketId}")
    public ResponseEntity<List<AuditLog>> ticketTrail(@PathVariable Long ticketId) {
        return ResponseEntity.ok(auditService.filter(null, null, AuditService.ticketTarget(ticketId)));
    }

    /**
     * {"alerts": {...}, "tickets": {...}, "rejected": n}
     */
    @GetMapping("/summary")
    public ResponseEntity<Map<String, Object>> summary() {
        return ResponseEntity.ok(auditService.summary());
    }
}
