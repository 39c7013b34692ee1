package com.example.coldchain.domain;

/**
 * Why a notification attempt failed. None of these stop the escalation
 * schedule; they are kept apart so operators can tell a missing sender
 * identity from a provider outage.
 */
public enum NotificationFailure {
    NO_RECIPIENTS,
    TRANSPORT_FAILURE,
    CONFIGURATION_MISSING
}
