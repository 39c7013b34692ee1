package com.example.coldchain.service;

import com.example.coldchain.config.ColdChainProperties;
import com.example.coldchain.domain.Alert;
import com.example.coldchain.exception.AlertLockedException;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.repository.AlertRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Escalation Driver - periodically selects due OPEN alerts and hands each to
 * {@link AlertLifecycleService#processDue} on the escalation pool.
 *
 * Selection is unlocked; every alert is re-checked under its own row lock, so
 * overlapping runs (scheduled tick plus a manual trigger) are safe.
 */
@Slf4j
@Service
public class EscalationService {

    private final AlertRepository alertRepository;
    private final AlertLifecycleService lifecycleService;
    private final ColdChainProperties properties;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public EscalationService(AlertRepository alertRepository,
                             AlertLifecycleService lifecycleService,
                             ColdChainProperties properties,
                             @Qualifier("escalationExecutor") Executor executor,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.alertRepository = alertRepository;
        this.lifecycleService = lifecycleService;
        this.properties = properties;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    private enum Outcome {
        PROCESSED, SKIPPED, ERROR, DEFERRED
    }

    @Scheduled(fixedDelayString = "${cold-chain.scheduler.interval-ms:60000}",
               initialDelayString = "${cold-chain.scheduler.interval-ms:60000}")
    public void scheduledRun() {
        if (!properties.getScheduler().isEnabled()) return;
        try {
            runOnce(properties.getScheduler().getBatchSize(), false);
        } catch (Exception e) {
            log.error("Escalation run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Ids of OPEN alerts to process, most overdue first (null schedule first,
     * then by next retry time, then by id). {@code force} ignores the schedule.
     */
    public List<Long> selectDueAlerts(int limit, boolean force) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<Alert> alerts = force
                ? alertRepository.findAllByStatusInDueOrder(Alert.AlertStatus.OPEN, page)
                : alertRepository.findDue(Alert.AlertStatus.OPEN, Instant.now(clock), page);
        return alerts.stream().map(Alert::getId).toList();
    }

    public EscalationRunResult runOnce(int limit, boolean force) {
        List<Long> ids = selectDueAlerts(limit, force);
        if (ids.isEmpty()) {
            log.debug("Escalation run: nothing due");
            return EscalationRunResult.empty();
        }

        Duration budget = Duration.ofSeconds(Math.max(1, properties.getScheduler().getRunBudgetSeconds()));
        long deadline = System.nanoTime() + budget.toNanos();

        List<CompletableFuture<Outcome>> futures = new ArrayList<>(ids.size());
        for (Long id : ids) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> processOne(id, force, deadline), executor));
            } catch (RejectedExecutionException e) {
                log.warn("Escalation pool rejected alert {}: {}", id, e.getMessage());
                futures.add(CompletableFuture.completedFuture(Outcome.DEFERRED));
            }
        }

        int processed = 0, skipped = 0, errors = 0, deferred = 0;
        for (CompletableFuture<Outcome> future : futures) {
            switch (future.join()) {
                case PROCESSED -> processed++;
                case SKIPPED -> skipped++;
                case ERROR -> errors++;
                case DEFERRED -> deferred++;
            }
        }

        meterRegistry.counter("coldchain.escalation.processed").increment(processed);
        meterRegistry.counter("coldchain.escalation.skipped").increment(skipped);
        meterRegistry.counter("coldchain.escalation.errors").increment(errors);
        meterRegistry.counter("coldchain.escalation.deferred").increment(deferred);

        EscalationRunResult result = new EscalationRunResult(ids.size(), processed, skipped, errors, deferred);
        if (deferred > 0) {
            log.warn("Escalation run exceeded its {}s budget; {} alert(s) deferred to the next run",
                    budget.toSeconds(), deferred);
        }
        log.info("Escalation run done: selected={} processed={} skipped={} errors={} deferred={}",
                result.selected(), processed, skipped, errors, deferred);
        return result;
    }

    private Outcome processOne(Long alertId, boolean force, long deadline) {
        if (System.nanoTime() > deadline) {
            return Outcome.DEFERRED;
        }
        try {
            AlertLifecycleService.ProcessOutcome outcome = lifecycleService.processDue(alertId, force);
            return outcome == AlertLifecycleService.ProcessOutcome.PROCESSED ? Outcome.PROCESSED : Outcome.SKIPPED;
        } catch (AlertLockedException e) {
            log.info("Alert {} is being processed elsewhere, skipping", alertId);
            return Outcome.SKIPPED;
        } catch (NotFoundException e) {
            log.info("Alert {} disappeared before processing, skipping", alertId);
            return Outcome.SKIPPED;
        } catch (Exception e) {
            log.error("Escalation failed for alert {}: {}", alertId, e.getMessage(), e);
            return Outcome.ERROR;
        }
    }
}
