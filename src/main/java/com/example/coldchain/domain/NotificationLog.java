package com.example.coldchain.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable record of one notification attempt, written whether or not the
 * send succeeded.
 */
@Entity
@Table(name = "alert_notification_logs", indexes = {
        @Index(name = "idx_notif_alert", columnList = "alert_id"),
        @Index(name = "idx_notif_sent_at", columnList = "sent_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "alert_id", nullable = false, updatable = false)
    private Long alertId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private Channel channel;

    /** Comma-joined addresses exactly as sent. */
    @Column(length = 2048, updatable = false)
    private String recipients;

    /** Attempt within the alert's level at the time of sending. */
    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Column(name = "level", nullable = false, updatable = false)
    private int level;

    @Column(name = "sent_at", nullable = false, updatable = false)
    private Instant sentAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private DeliveryStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 32, updatable = false)
    private NotificationFailure failureKind;

    @Column(length = 2048, updatable = false)
    private String error;

    public enum Channel {
        EMAIL, CALL
    }

    public enum DeliveryStatus {
        SENT, FAILED
    }
}
