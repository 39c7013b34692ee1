package com.example.coldchain.config;

import java.time.Duration;

/**
 * Immutable snapshot of the thresholds and escalation timings.
 * Counts and delays are floored to 1.
 */
public record MonitoringConfig(
        double tempMin,
        double tempMax,
        double mediumDelta,
        double highDelta,
        int escalationCount,
        int retryDelayMinutes,
        int repeatDelayMinutesLevel3) {

    public static final int MAX_LEVEL = 3;

    public MonitoringConfig {
        escalationCount = Math.max(1, escalationCount);
        retryDelayMinutes = Math.max(1, retryDelayMinutes);
        repeatDelayMinutesLevel3 = Math.max(1, repeatDelayMinutesLevel3);
    }

    public static MonitoringConfig defaults() {
        return new MonitoringConfig(2.0, 8.0, 2.0, 5.0, 3, 5, 30);
    }

    public static MonitoringConfig from(ColdChainProperties properties) {
        ColdChainProperties.ThresholdConfig t = properties.getThresholds();
        ColdChainProperties.EscalationConfig e = properties.getEscalation();
        return new MonitoringConfig(
                t.getTempMin(), t.getTempMax(), t.getMediumDelta(), t.getHighDelta(),
                e.getEscalationCount(), e.getRetryDelayMinutes(), e.getRepeatDelayMinutesLevel3());
    }

    public Duration retryDelay() {
        return Duration.ofMinutes(retryDelayMinutes);
    }

    public Duration repeatDelayLevel3() {
        return Duration.ofMinutes(repeatDelayMinutesLevel3);
    }
}
