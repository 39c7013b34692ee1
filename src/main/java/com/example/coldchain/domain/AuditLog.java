package com.example.coldchain.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Trail of operator and system actions on alerts and tickets. Notification
 * attempts themselves go to {@link NotificationLog}.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_actor", columnList = "actor"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_target", columnList = "target"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** "system", "scheduler" or the username behind an action. */
    @Column(nullable = false)
    private String actor;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Action action;

    /** e.g. "alert:12" or "ticket:4" */
    private String target;

    @Column(length = 4096)
    private String details;

    /** False for an action that was attempted and refused, e.g. acknowledging a resolved alert. */
    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    public enum Action {
        ALERT_CREATED, ESCALATION, ALERT_ACKNOWLEDGED, ALERT_RESOLVED,
        TICKET_CREATED, TICKET_ASSIGNED, TICKET_CLOSED;

        public boolean concernsTicket() {
            return name().startsWith("TICKET_");
        }
    }

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
