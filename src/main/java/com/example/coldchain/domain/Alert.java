package com.example.coldchain.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * An out-of-range condition on a sensor and its escalation state.
 * At most one OPEN alert exists per sensor; a newer out-of-range reading
 * refreshes the snapshot of the open one. Updates write only changed
 * columns, so a snapshot refresh and a state transition never overwrite
 * each other.
 */
@Entity
@DynamicUpdate
@Table(name = "alerts", indexes = {
        @Index(name = "idx_alert_status_next_retry", columnList = "status, next_retry_at"),
        @Index(name = "idx_alert_sensor_status", columnList = "sensor_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "sensor_id", nullable = false)
    private Sensor sensor;

    private Double temperature;

    private Double humidity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private AlertStatus status = AlertStatus.OPEN;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private Severity severity = Severity.LOW;

    /** 1 = operator, 2 = +manager, 3 = +admin. */
    @Column(nullable = false)
    @Builder.Default
    private int level = 1;

    @Column(name = "tries_without_response", nullable = false)
    @Builder.Default
    private int triesWithoutResponse = 0;

    /** Null or past means due; cleared on acknowledge/resolve. */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "last_notified_at")
    private Instant lastNotifiedAt;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum AlertStatus {
        OPEN, ACKNOWLEDGED, RESOLVED
    }

    public enum Severity {
        LOW, MEDIUM, HIGH
    }

    public boolean isOpen() {
        return status == AlertStatus.OPEN;
    }

    public boolean isDue(Instant now) {
        return isOpen() && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
        if (status == null) status = AlertStatus.OPEN;
    }
}
