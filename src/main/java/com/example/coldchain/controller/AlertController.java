package com.example.coldchain.controller;

import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.NotificationLog;
import com.example.coldchain.domain.Ticket;
import com.example.coldchain.service.AlertLifecycleService;
import com.example.coldchain.service.EscalationRunResult;
import com.example.coldchain.service.EscalationService;
import com.example.coldchain.service.TicketService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Alert REST API Controller.
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertLifecycleService lifecycleService;
    private final EscalationService escalationService;
    private final TicketService ticketService;

    public record AlertDetail(Alert alert, List<NotificationLog> notifications, Ticket ticket) {
    }

    /**
     * List alerts, newest first.
     */
    @GetMapping
    public ResponseEntity<List<Alert>> listAlerts(
            @RequestParam(required = false) Alert.AlertStatus status,
            @RequestParam(required = false) Alert.Severity severity,
            @RequestParam(required = false) Long sensorId) {
        return ResponseEntity.ok(lifecycleService.list(status, severity, sensorId));
    }

    /**
     * Alert with its notification history and ticket, if any.
     */
    @GetMapping("/{id}")
    public ResponseEntity<AlertDetail> getAlert(@PathVariable Long id) {
        Alert alert = lifecycleService.get(id);
        return ResponseEntity.ok(new AlertDetail(
                alert,
                lifecycleService.notificationHistory(id),
                ticketService.findByAlert(id).orElse(null)));
    }

    @PostMapping("/{id}/ack")
    public ResponseEntity<Alert> acknowledge(@PathVariable Long id,
                                             @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.ok(lifecycleService.acknowledge(id, RequestBodies.actor(body)));
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<Alert> resolve(@PathVariable Long id,
                                         @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.ok(lifecycleService.resolve(id, RequestBodies.actor(body)));
    }

    /**
     * Run the escalation driver now instead of waiting for the next tick.
     */
    @PostMapping("/process-due")
    public ResponseEntity<EscalationRunResult> processDue(
            @RequestParam(defaultValue = "200") int limit,
            @RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(escalationService.runOnce(limit, force));
    }
}
