package com.example.coldchain.exception;

/**
 * Raised when an action is not allowed from the entity's current status,
 * e.g. acknowledging an alert that is no longer OPEN. Nothing is mutated.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String currentStatus;

    public InvalidTransitionException(String message, String currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
