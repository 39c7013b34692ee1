package com.example.coldchain.exception;

/**
 * The per-alert row lock could not be acquired in time. The driver skips the
 * alert for the current run; it stays due and is picked up next cycle.
 */
public class AlertLockedException extends RuntimeException {

    private final Long alertId;

    public AlertLockedException(Long alertId, Throwable cause) {
        super("Alert " + alertId + " is locked by another transaction", cause);
        this.alertId = alertId;
    }

    public Long getAlertId() {
        return alertId;
    }
}
