package com.example.coldchain.service;

import com.example.coldchain.config.MonitoringConfig;
import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.AuditLog;
import com.example.coldchain.domain.NotificationLog;
import com.example.coldchain.domain.Reading;
import com.example.coldchain.domain.Sensor;
import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.exception.AlertLockedException;
import com.example.coldchain.exception.InvalidTransitionException;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.monitoring.ThresholdEvaluator;
import com.example.coldchain.notification.NotificationResult;
import com.example.coldchain.notification.NotificationService;
import com.example.coldchain.notification.RecipientResolver;
import com.example.coldchain.repository.AlertRepository;
import com.example.coldchain.repository.NotificationLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alert Lifecycle - the per-alert state machine.
 *
 * <pre>
 *   OPEN --acknowledge--> ACKNOWLEDGED --resolve--> RESOLVED
 *   OPEN --resolve--> RESOLVED
 * </pre>
 *
 * While OPEN, each due pass sends the level's email (and call, when voice is
 * enabled), records the attempt, and either schedules a retry, climbs one
 * level, or schedules the next repeat at the top level. Reaching the top level
 * opens a ticket. Every mutation happens under the alert's row lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertLifecycleService {

    private final AlertRepository alertRepository;
    private final NotificationLogRepository notificationLogRepository;
    private final ThresholdEvaluator thresholdEvaluator;
    private final RecipientResolver recipientResolver;
    private final NotificationService notificationService;
    private final TicketService ticketService;
    private final AuditService auditService;
    private final MonitoringConfig config;
    private final Clock clock;

    public enum ProcessOutcome {
        PROCESSED, NOT_OPEN, NOT_DUE
    }

    /**
     * Open an alert for an out-of-range reading, or refresh the snapshot of
     * the sensor's newest OPEN alert. In-range readings change nothing.
     * Callers serialize per sensor (see {@link ReadingIngestionService}); the
     * refresh itself is a guarded update under the alert's row lock.
     */
    @Transactional
    public Optional<Alert> createOrUpdate(Sensor sensor, Reading reading) {
        Double temperature = reading.getTemperature();
        if (!thresholdEvaluator.isOutOfRange(temperature)) {
            return Optional.empty();
        }

        Instant now = Instant.now(clock);
        Alert.Severity severity = thresholdEvaluator.computeSeverity(temperature);
        Optional<Long> openId = alertRepository
                .findIdsBySensorAndStatus(sensor.getId(), Alert.AlertStatus.OPEN, PageRequest.of(0, 1))
                .stream().findFirst();

        if (openId.isPresent()) {
            Long id = openId.get();
            int refreshed = alertRepository.refreshSnapshot(
                    id, Alert.AlertStatus.OPEN, temperature, reading.getHumidity(), severity, now);
            if (refreshed == 1) {
                log.debug("Alert {} refreshed from sensor {}: {} ({})", id, sensor.getName(), temperature, severity);
                return alertRepository.findById(id);
            }
            // acknowledged or resolved after the lookup
            log.debug("Alert {} left OPEN before refresh, opening a new one for sensor {}", id, sensor.getName());
        }

        Alert alert = Alert.builder()
                .sensor(sensor)
                .temperature(temperature)
                .humidity(reading.getHumidity())
                .status(Alert.AlertStatus.OPEN)
                .severity(severity)
                .level(1)
                .triesWithoutResponse(0)
                .nextRetryAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        alert = alertRepository.save(alert);

        log.warn("Alert {} opened for sensor {}: temperature={} severity={}",
                alert.getId(), sensor.getName(), temperature, severity);
        auditService.log("system", AuditLog.Action.ALERT_CREATED, AuditService.alertTarget(alert.getId()),
                Map.of("sensor", sensor.getName(), "severity", severity.name()));
        return Optional.of(alert);
    }

    /**
     * Lock the alert and run one escalation step if it is OPEN and due
     * ({@code force} ignores the schedule). The lock is held across the send,
     * so a concurrent run cannot notify the same alert twice.
     *
     * @throws AlertLockedException if the lock is not acquired in time
     * @throws NotFoundException if the alert no longer exists
     */
    @Transactional
    public ProcessOutcome processDue(Long alertId, boolean force) {
        Alert alert = lockAlert(alertId);
        return process(alert, Instant.now(clock), force);
    }

    ProcessOutcome process(Alert alert, Instant now, boolean force) {
        if (!alert.isOpen()) {
            log.debug("Alert {} is {}, nothing to do", alert.getId(), alert.getStatus());
            return ProcessOutcome.NOT_OPEN;
        }
        if (!force && !alert.isDue(now)) {
            log.debug("Alert {} not due until {}", alert.getId(), alert.getNextRetryAt());
            return ProcessOutcome.NOT_DUE;
        }

        int escalationCount = config.escalationCount();
        int level = alert.getLevel();
        int attempt = Math.min(alert.getTriesWithoutResponse() + 1, escalationCount);
        UserAccount.Role role = RecipientResolver.roleForLevel(level);
        List<UserAccount> recipients = recipientResolver.recipientsForLevel(level);

        NotificationResult email = notificationService.sendEmail(alert, role, attempt, recipients);
        recordAttempt(alert, NotificationLog.Channel.EMAIL, attempt, level, now, email);

        if (notificationService.isVoiceEnabled()) {
            NotificationResult call = notificationService.placeCall(alert, recipients);
            recordAttempt(alert, NotificationLog.Channel.CALL, attempt, level, now, call);
        }

        alert.setLastNotifiedAt(now);
        int tries = Math.min(alert.getTriesWithoutResponse() + 1, escalationCount);
        alert.setTriesWithoutResponse(tries);

        if (tries < escalationCount) {
            alert.setNextRetryAt(now.plus(config.retryDelay()));
        } else if (level < MonitoringConfig.MAX_LEVEL) {
            escalate(alert, level + 1, now);
        } else {
            alert.setNextRetryAt(now.plus(config.repeatDelayLevel3()));
            log.info("Alert {} still unanswered at level {}, repeating at {}",
                    alert.getId(), level, alert.getNextRetryAt());
        }

        alert.setUpdatedAt(now);
        alertRepository.save(alert);
        return ProcessOutcome.PROCESSED;
    }

    private void escalate(Alert alert, int newLevel, Instant now) {
        int from = alert.getLevel();
        alert.setLevel(newLevel);
        alert.setTriesWithoutResponse(0);
        alert.setNextRetryAt(now);

        log.warn("Escalating alert {} from level {} to level {} ({})",
                alert.getId(), from, newLevel, RecipientResolver.roleForLevel(newLevel));
        auditService.log("system", AuditLog.Action.ESCALATION, AuditService.alertTarget(alert.getId()),
                Map.of("from_level", from, "to_level", newLevel));

        if (newLevel == MonitoringConfig.MAX_LEVEL) {
            ticketService.ensureTicket(alert);
        }
    }

    private void recordAttempt(Alert alert, NotificationLog.Channel channel, int attempt, int level,
                               Instant now, NotificationResult result) {
        NotificationLog entry = NotificationLog.builder()
                .alertId(alert.getId())
                .channel(channel)
                .recipients(result.joinedAddresses())
                .attemptNumber(attempt)
                .level(level)
                .sentAt(now)
                .status(result.ok() ? NotificationLog.DeliveryStatus.SENT : NotificationLog.DeliveryStatus.FAILED)
                .failureKind(result.failure())
                .error(result.error())
                .build();
        notificationLogRepository.save(entry);
    }

    /**
     * OPEN -> ACKNOWLEDGED. Stops escalation; no further notifications.
     */
    @Transactional
    public Alert acknowledge(Long alertId, String actor) {
        Alert alert = lockAlert(alertId);
        if (alert.getStatus() != Alert.AlertStatus.OPEN) {
            auditService.logRejected(actor, AuditLog.Action.ALERT_ACKNOWLEDGED, AuditService.alertTarget(alertId),
                    Map.of("current_status", alert.getStatus().name()));
            throw new InvalidTransitionException("Only OPEN alerts can be acknowledged.", alert.getStatus().name());
        }

        Instant now = Instant.now(clock);
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedBy(actor);
        alert.setAcknowledgedAt(now);
        alert.setNextRetryAt(null);
        alert.setUpdatedAt(now);
        alert = alertRepository.save(alert);

        log.info("Alert {} acknowledged by {}", alertId, actor);
        auditService.log(actor, AuditLog.Action.ALERT_ACKNOWLEDGED, AuditService.alertTarget(alertId),
                Map.of("level", alert.getLevel()));
        return alert;
    }

    /**
     * OPEN or ACKNOWLEDGED -> RESOLVED. Terminal.
     */
    @Transactional
    public Alert resolve(Long alertId, String actor) {
        Alert alert = lockAlert(alertId);
        if (alert.getStatus() == Alert.AlertStatus.RESOLVED) {
            auditService.logRejected(actor, AuditLog.Action.ALERT_RESOLVED, AuditService.alertTarget(alertId),
                    Map.of("current_status", alert.getStatus().name()));
            throw new InvalidTransitionException("Alert already resolved.", alert.getStatus().name());
        }

        Instant now = Instant.now(clock);
        Alert.AlertStatus previous = alert.getStatus();
        alert.setStatus(Alert.AlertStatus.RESOLVED);
        alert.setResolvedBy(actor);
        alert.setResolvedAt(now);
        alert.setNextRetryAt(null);
        alert.setUpdatedAt(now);
        alert = alertRepository.save(alert);

        log.info("Alert {} resolved by {} (was {})", alertId, actor, previous);
        Map<String, Object> details = new HashMap<>();
        details.put("previous_status", previous.name());
        details.put("level", alert.getLevel());
        auditService.log(actor, AuditLog.Action.ALERT_RESOLVED, AuditService.alertTarget(alertId), details);
        return alert;
    }

    public Alert get(Long alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new NotFoundException("Alert", alertId));
    }

    public List<Alert> list(Alert.AlertStatus status, Alert.Severity severity, Long sensorId) {
        return alertRepository.findFiltered(status, severity, sensorId);
    }

    public List<NotificationLog> notificationHistory(Long alertId) {
        return notificationLogRepository.findByAlertIdOrderByIdAsc(alertId);
    }

    private Alert lockAlert(Long alertId) {
        try {
            return alertRepository.findByIdForUpdate(alertId)
                    .orElseThrow(() -> new NotFoundException("Alert", alertId));
        } catch (PessimisticLockingFailureException e) {
            throw new AlertLockedException(alertId, e);
        }
    }
}
