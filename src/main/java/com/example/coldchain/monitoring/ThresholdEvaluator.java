package com.example.coldchain.monitoring;

import com.example.coldchain.config.MonitoringConfig;
import com.example.coldchain.domain.Alert;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Classifies temperatures against the configured acceptable range.
 * Stateless; all bounds come from the {@link MonitoringConfig} snapshot.
 */
@Component
@RequiredArgsConstructor
public class ThresholdEvaluator {

    private final MonitoringConfig config;

    /**
     * A missing temperature is never out of range.
     */
    public boolean isOutOfRange(Double temperature) {
        if (temperature == null) return false;
        return temperature < config.tempMin() || temperature > config.tempMax();
    }

    /**
     * Distance beyond the breached threshold; 0 while in range.
     */
    public double breachDelta(Double temperature) {
        if (temperature == null) return 0.0;
        if (temperature < config.tempMin()) return config.tempMin() - temperature;
        if (temperature > config.tempMax()) return temperature - config.tempMax();
        return 0.0;
    }

    public Alert.Severity computeSeverity(Double temperature) {
        if (temperature == null) return Alert.Severity.LOW;
        double delta = breachDelta(temperature);
        if (delta >= config.highDelta()) return Alert.Severity.HIGH;
        if (delta >= config.mediumDelta()) return Alert.Severity.MEDIUM;
        return Alert.Severity.LOW;
    }
}
