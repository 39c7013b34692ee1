package com.example.coldchain.service;

import com.example.coldchain.config.MonitoringConfig;
import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.AuditLog;
import com.example.coldchain.domain.NotificationFailure;
import com.example.coldchain.domain.NotificationLog;
import com.example.coldchain.domain.Reading;
import com.example.coldchain.domain.Sensor;
import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.domain.UserAccount.Role;
import com.example.coldchain.exception.AlertLockedException;
import com.example.coldchain.exception.InvalidTransitionException;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.monitoring.ThresholdEvaluator;
import com.example.coldchain.notification.NotificationResult;
import com.example.coldchain.notification.NotificationService;
import com.example.coldchain.notification.RecipientResolver;
import com.example.coldchain.repository.AlertRepository;
import com.example.coldchain.repository.NotificationLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertLifecycleServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private AlertRepository alertRepository;
    @Mock
    private NotificationLogRepository notificationLogRepository;
    @Mock
    private RecipientResolver recipientResolver;
    @Mock
    private NotificationService notificationService;
    @Mock
    private TicketService ticketService;
    @Mock
    private AuditService auditService;

    private final MonitoringConfig config = MonitoringConfig.defaults();
    private AlertLifecycleService service;
    private Sensor sensor;
    private List<NotificationLog> logs;

    private final UserAccount operator = UserAccount.builder().id(1L).username("op").role(Role.OPERATOR)
            .email("op@x.test").build();
    private final UserAccount manager = UserAccount.builder().id(2L).username("mgr").role(Role.MANAGER)
            .email("mgr@x.test").build();

    @BeforeEach
    void setUp() {
        service = new AlertLifecycleService(alertRepository, notificationLogRepository,
                new ThresholdEvaluator(config), recipientResolver, notificationService, ticketService,
                auditService, config, Clock.fixed(T0, ZoneOffset.UTC));
        sensor = Sensor.builder().id(5L).name("fridge-1").build();
        logs = new ArrayList<>();
        lenient().when(alertRepository.save(any(Alert.class))).thenAnswer(inv -> {
            Alert a = inv.getArgument(0);
            if (a.getId() == null) a.setId(100L);
            return a;
        });
        lenient().when(notificationLogRepository.save(any(NotificationLog.class))).thenAnswer(inv -> {
            logs.add(inv.getArgument(0));
            return inv.getArgument(0);
        });
    }

    private Alert openAlert() {
        return Alert.builder()
                .id(100L)
                .sensor(sensor)
                .temperature(10.0)
                .severity(Alert.Severity.MEDIUM)
                .level(1)
                .triesWithoutResponse(0)
                .nextRetryAt(T0)
                .createdAt(T0)
                .build();
    }

    private void emailsSucceed() {
        lenient().when(recipientResolver.recipientsForLevel(1)).thenReturn(List.of(operator));
        lenient().when(recipientResolver.recipientsForLevel(2)).thenReturn(List.of(operator, manager));
        lenient().when(recipientResolver.recipientsForLevel(3)).thenReturn(List.of(operator, manager));
        lenient().when(notificationService.sendEmail(any(), any(), anyInt(), anyList()))
                .thenAnswer(inv -> {
                    List<UserAccount> users = inv.getArgument(3);
                    return NotificationResult.sent(users.stream().map(UserAccount::getEmail).toList());
                });
    }

    private Reading reading(Double temperature) {
        return Reading.builder().sensor(sensor).temperature(temperature).humidity(45.0).build();
    }

    // --- create / update from readings ---

    @Test
    void inRangeReadingCreatesNothing() {
        assertTrue(service.createOrUpdate(sensor, reading(5.0)).isEmpty());
        verifyNoInteractions(alertRepository);
    }

    @Test
    void firstBreachOpensImmediatelyDueAlert() {
        when(alertRepository.findIdsBySensorAndStatus(eq(5L), eq(Alert.AlertStatus.OPEN), any()))
                .thenReturn(List.of());

        Alert alert = service.createOrUpdate(sensor, reading(13.5)).orElseThrow();

        assertEquals(Alert.AlertStatus.OPEN, alert.getStatus());
        assertEquals(1, alert.getLevel());
        assertEquals(0, alert.getTriesWithoutResponse());
        assertEquals(T0, alert.getNextRetryAt());
        assertEquals(Alert.Severity.HIGH, alert.getSeverity());
        assertTrue(alert.isDue(T0));
    }

    @Test
    void secondBreachRefreshesOpenAlertSnapshotOnly() {
        Alert refreshed = openAlert();
        refreshed.setTemperature(0.5);
        when(alertRepository.findIdsBySensorAndStatus(eq(5L), eq(Alert.AlertStatus.OPEN), any()))
                .thenReturn(List.of(100L));
        when(alertRepository.refreshSnapshot(100L, Alert.AlertStatus.OPEN, 0.5, 45.0, Alert.Severity.LOW, T0))
                .thenReturn(1);
        when(alertRepository.findById(100L)).thenReturn(Optional.of(refreshed));

        Alert alert = service.createOrUpdate(sensor, reading(0.5)).orElseThrow();

        assertSame(refreshed, alert);
        verify(alertRepository, never()).save(any(Alert.class));
        verify(auditService, never()).log(any(), eq(AuditLog.Action.ALERT_CREATED), any(), any());
    }

    @Test
    void breachAfterConcurrentAcknowledgeOpensNewAlert() {
        when(alertRepository.findIdsBySensorAndStatus(eq(5L), eq(Alert.AlertStatus.OPEN), any()))
                .thenReturn(List.of(100L));
        when(alertRepository.refreshSnapshot(eq(100L), eq(Alert.AlertStatus.OPEN), any(), any(), any(), any()))
                .thenReturn(0);
        doAnswer(inv -> {
            Alert a = inv.getArgument(0);
            a.setId(101L);
            return a;
        }).when(alertRepository).save(any(Alert.class));

        Alert alert = service.createOrUpdate(sensor, reading(12.0)).orElseThrow();

        assertEquals(101L, alert.getId());
        assertEquals(Alert.AlertStatus.OPEN, alert.getStatus());
        assertEquals(1, alert.getLevel());
        verify(alertRepository, never()).findById(100L);
        verify(auditService).log(eq("system"), eq(AuditLog.Action.ALERT_CREATED), eq("alert:101"), anyMap());
    }

    // --- escalation ---

    @Test
    void failedSendStillAdvancesSchedule() {
        Alert alert = openAlert();
        when(recipientResolver.recipientsForLevel(1)).thenReturn(List.of());
        when(notificationService.sendEmail(alert, Role.OPERATOR, 1, List.of()))
                .thenReturn(NotificationResult.failed(NotificationFailure.NO_RECIPIENTS,
                        "No email recipients for role OPERATOR.", List.of()));

        assertEquals(AlertLifecycleService.ProcessOutcome.PROCESSED, service.process(alert, T0, false));

        assertEquals(1, alert.getTriesWithoutResponse());
        assertEquals(1, alert.getLevel());
        assertEquals(T0.plus(Duration.ofMinutes(5)), alert.getNextRetryAt());
        assertEquals(T0, alert.getLastNotifiedAt());

        assertEquals(1, logs.size());
        NotificationLog entry = logs.get(0);
        assertEquals(NotificationLog.Channel.EMAIL, entry.getChannel());
        assertEquals(NotificationLog.DeliveryStatus.FAILED, entry.getStatus());
        assertEquals(NotificationFailure.NO_RECIPIENTS, entry.getFailureKind());
        assertEquals("No email recipients for role OPERATOR.", entry.getError());
        assertEquals(1, entry.getAttemptNumber());
        assertEquals("", entry.getRecipients());
    }

    @Test
    void threeAttemptsThenEscalateToLevelTwo() {
        emailsSucceed();
        Alert alert = openAlert();
        Instant now = T0;

        for (int i = 1; i <= 3; i++) {
            service.process(alert, now, false);
            if (i < 3) {
                assertEquals(i, alert.getTriesWithoutResponse());
                assertEquals(now.plus(Duration.ofMinutes(5)), alert.getNextRetryAt());
                now = alert.getNextRetryAt();
            }
        }

        assertEquals(2, alert.getLevel());
        assertEquals(0, alert.getTriesWithoutResponse());
        assertEquals(now, alert.getNextRetryAt());
        assertEquals(List.of(1, 2, 3), logs.stream().map(NotificationLog::getAttemptNumber).toList());
        verify(auditService).log(eq("system"), eq(AuditLog.Action.ESCALATION), eq("alert:100"), anyMap());
        verifyNoInteractions(ticketService);

        // immediately due again; now addressed to operator + manager
        service.process(alert, now, false);

        assertEquals(1, alert.getTriesWithoutResponse());
        NotificationLog last = logs.get(logs.size() - 1);
        assertEquals(2, last.getLevel());
        assertEquals(1, last.getAttemptNumber());
        assertEquals("op@x.test,mgr@x.test", last.getRecipients());
        verify(notificationService).sendEmail(alert, Role.MANAGER, 1, List.of(operator, manager));
    }

    @Test
    void reachingLevelThreeOpensTicketOnceThenRepeats() {
        emailsSucceed();
        Alert alert = openAlert();
        alert.setLevel(2);
        alert.setTriesWithoutResponse(2);

        service.process(alert, T0, false);

        assertEquals(3, alert.getLevel());
        assertEquals(0, alert.getTriesWithoutResponse());
        verify(ticketService, times(1)).ensureTicket(alert);

        Instant now = T0;
        for (int i = 0; i < 3; i++) {
            service.process(alert, now, false);
            now = alert.getNextRetryAt();
        }
        assertEquals(3, alert.getLevel());
        assertEquals(3, alert.getTriesWithoutResponse());
        assertEquals(T0.plus(Duration.ofMinutes(5 + 5 + 30)), now);

        // repeat mode: tries stay pinned, schedule advances by the repeat delay
        service.process(alert, now, false);
        assertEquals(3, alert.getLevel());
        assertEquals(3, alert.getTriesWithoutResponse());
        assertEquals(now.plus(Duration.ofMinutes(30)), alert.getNextRetryAt());
        assertEquals(3, logs.get(logs.size() - 1).getAttemptNumber());

        verify(ticketService, times(1)).ensureTicket(any());
    }

    @Test
    void notDueAlertIsLeftAlone() {
        Alert alert = openAlert();
        alert.setNextRetryAt(T0.plusSeconds(60));

        assertEquals(AlertLifecycleService.ProcessOutcome.NOT_DUE, service.process(alert, T0, false));
        assertTrue(logs.isEmpty());
        verifyNoInteractions(notificationService);
    }

    @Test
    void forceIgnoresSchedule() {
        emailsSucceed();
        Alert alert = openAlert();
        alert.setNextRetryAt(T0.plusSeconds(600));

        assertEquals(AlertLifecycleService.ProcessOutcome.PROCESSED, service.process(alert, T0, true));
        assertEquals(1, logs.size());
    }

    @Test
    void voiceEnabledAddsCallLogRow() {
        emailsSucceed();
        when(notificationService.isVoiceEnabled()).thenReturn(true);
        when(notificationService.placeCall(any(), anyList()))
                .thenReturn(NotificationResult.failed(NotificationFailure.NO_RECIPIENTS, "No phone recipients", List.of()));

        service.process(openAlert(), T0, false);

        assertEquals(List.of(NotificationLog.Channel.EMAIL, NotificationLog.Channel.CALL),
                logs.stream().map(NotificationLog::getChannel).toList());
        assertEquals(NotificationLog.DeliveryStatus.SENT, logs.get(0).getStatus());
        assertEquals(NotificationLog.DeliveryStatus.FAILED, logs.get(1).getStatus());
    }

    @Test
    void phoneOnlyOperatorIsCalledThoughEmailHasNoAddress() {
        UserAccount phoneOnly = UserAccount.builder().id(3L).username("night").role(Role.OPERATOR)
                .phone("+33600000003").build();
        when(recipientResolver.recipientsForLevel(1)).thenReturn(List.of(phoneOnly));
        when(notificationService.sendEmail(any(), eq(Role.OPERATOR), eq(1), eq(List.of(phoneOnly))))
                .thenReturn(NotificationResult.failed(NotificationFailure.NO_RECIPIENTS,
                        "No email recipients for role OPERATOR.", List.of()));
        when(notificationService.isVoiceEnabled()).thenReturn(true);
        when(notificationService.placeCall(any(), eq(List.of(phoneOnly))))
                .thenReturn(NotificationResult.sent(List.of("33600000003")));

        service.process(openAlert(), T0, false);

        assertEquals(NotificationLog.DeliveryStatus.FAILED, logs.get(0).getStatus());
        assertEquals(NotificationLog.Channel.CALL, logs.get(1).getChannel());
        assertEquals(NotificationLog.DeliveryStatus.SENT, logs.get(1).getStatus());
        assertEquals("33600000003", logs.get(1).getRecipients());
    }

    @Test
    void processDueLocksAndRechecks() {
        Alert alert = openAlert();
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);
        alert.setNextRetryAt(null);
        when(alertRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(alert));

        assertEquals(AlertLifecycleService.ProcessOutcome.NOT_OPEN, service.processDue(100L, true));
        verifyNoInteractions(notificationService);
        verify(alertRepository, never()).save(any());
    }

    @Test
    void lockTimeoutBecomesAlertLocked() {
        when(alertRepository.findByIdForUpdate(100L))
                .thenThrow(new PessimisticLockingFailureException("lock timeout"));

        AlertLockedException ex = assertThrows(AlertLockedException.class, () -> service.processDue(100L, false));
        assertEquals(100L, ex.getAlertId());
    }

    @Test
    void unknownAlertIsNotFound() {
        when(alertRepository.findByIdForUpdate(404L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.processDue(404L, false));
        assertThrows(NotFoundException.class, () -> service.acknowledge(404L, "op"));
    }

    // --- acknowledge / resolve ---

    @Test
    void acknowledgeStopsScheduling() {
        Alert alert = openAlert();
        when(alertRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(alert));

        service.acknowledge(100L, "op");

        assertEquals(Alert.AlertStatus.ACKNOWLEDGED, alert.getStatus());
        assertEquals("op", alert.getAcknowledgedBy());
        assertEquals(T0, alert.getAcknowledgedAt());
        assertNull(alert.getNextRetryAt());

        assertEquals(AlertLifecycleService.ProcessOutcome.NOT_OPEN, service.processDue(100L, false));
        assertEquals(AlertLifecycleService.ProcessOutcome.NOT_OPEN, service.processDue(100L, true));
        assertTrue(logs.isEmpty());
    }

    @Test
    void acknowledgeTwiceConflictsWithoutMutation() {
        Alert alert = openAlert();
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedBy("first");
        when(alertRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(alert));

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> service.acknowledge(100L, "second"));

        assertEquals("ACKNOWLEDGED", ex.getCurrentStatus());
        assertEquals("first", alert.getAcknowledgedBy());
        verify(alertRepository, never()).save(any());
        verify(auditService).logRejected(eq("second"), eq(AuditLog.Action.ALERT_ACKNOWLEDGED), eq("alert:100"),
                eq(Map.of("current_status", "ACKNOWLEDGED")));
        verify(auditService, never()).log(any(), any(), any(), any());
    }

    @Test
    void resolveFromAcknowledgedIsAllowed() {
        Alert alert = openAlert();
        alert.setStatus(Alert.AlertStatus.ACKNOWLEDGED);
        when(alertRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(alert));

        service.resolve(100L, "mgr");

        assertEquals(Alert.AlertStatus.RESOLVED, alert.getStatus());
        assertEquals("mgr", alert.getResolvedBy());
        assertNull(alert.getNextRetryAt());
    }

    @Test
    void resolveTwiceConflicts() {
        Alert alert = openAlert();
        alert.setStatus(Alert.AlertStatus.RESOLVED);
        when(alertRepository.findByIdForUpdate(100L)).thenReturn(Optional.of(alert));

        assertThrows(InvalidTransitionException.class, () -> service.resolve(100L, "mgr"));
        verify(alertRepository, never()).save(any());
        verify(auditService).logRejected(eq("mgr"), eq(AuditLog.Action.ALERT_RESOLVED), eq("alert:100"), anyMap());
    }

    @Test
    void triesNeverExceedEscalationCount() {
        emailsSucceed();
        Alert alert = openAlert();
        alert.setLevel(3);
        alert.setTriesWithoutResponse(3);

        ArgumentCaptor<Alert> saved = ArgumentCaptor.forClass(Alert.class);
        service.process(alert, T0, false);
        verify(alertRepository).save(saved.capture());

        assertEquals(3, saved.getValue().getTriesWithoutResponse());
        assertEquals(3, logs.get(0).getAttemptNumber());
    }
}
