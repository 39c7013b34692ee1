package com.example.coldchain.service;

import com.example.coldchain.domain.AuditLog;
import com.example.coldchain.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records operator and system actions (acknowledge, resolve, escalation,
 * ticket changes).
 *
 * <p>Callers only publish an {@link AuditEvent}. Completed actions are
 * written after their transaction commits, so a rolled-back step leaves no
 * trace; refused actions are written once the transaction ends either way.
 * Writes run on the audit pool and never hold an alert lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public void log(String actor, AuditLog.Action action, String target, Map<String, Object> details) {
        eventPublisher.publishEvent(new AuditEvent(actor, action, target, details, true, Instant.now(clock)));
    }

    public void logRejected(String actor, AuditLog.Action action, String target, Map<String, Object> details) {
        eventPublisher.publishEvent(new AuditEvent(actor, action, target, details, false, Instant.now(clock)));
    }

    @Async("auditExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCommitted(AuditEvent event) {
        if (event.success()) {
            write(event);
        }
    }

    @Async("auditExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMPLETION, fallbackExecution = true)
    public void onCompleted(AuditEvent event) {
        if (!event.success()) {
            write(event);
        }
    }

    void write(AuditEvent event) {
        try {
            String detailsJson = event.details() != null ? objectMapper.writeValueAsString(event.details()) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(event.actor())
                    .action(event.action())
                    .target(event.target())
                    .details(detailsJson)
                    .success(event.success())
                    .timestamp(event.timestamp())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} (success={})", event.actor(), event.action(), event.target(), event.success());
        } catch (Exception e) {
            log.error("Failed to write audit log for {} {}: {}", event.action(), event.target(), e.getMessage());
        }
    }

    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, Math.max(1, limit))).getContent();
    }

    public List<AuditLog> filter(String actor, AuditLog.Action action, String target) {
        return auditLogRepository.findFiltered(actor, action, target);
    }

    /**
     * Completed-action counts split into alert and ticket sections, plus the
     * number of refused actions. Every action appears, zero included.
     */
    public Map<String, Object> summary() {
        Map<AuditLog.Action, Long> counts = new EnumMap<>(AuditLog.Action.class);
        for (Object[] row : auditLogRepository.countSucceededGroupedByAction()) {
            counts.put((AuditLog.Action) row[0], (Long) row[1]);
        }

        Map<String, Long> alerts = new LinkedHashMap<>();
        Map<String, Long> tickets = new LinkedHashMap<>();
        for (AuditLog.Action action : AuditLog.Action.values()) {
            Map<String, Long> section = action.concernsTicket() ? tickets : alerts;
            section.put(action.name().toLowerCase(), counts.getOrDefault(action, 0L));
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("alerts", alerts);
        summary.put("tickets", tickets);
        summary.put("rejected", auditLogRepository.countBySuccessFalse());
        return summary;
    }

    public static String alertTarget(Long alertId) {
        return "alert:" + alertId;
    }

    public static String ticketTarget(Long ticketId) {
        return "ticket:" + ticketId;
    }
}
