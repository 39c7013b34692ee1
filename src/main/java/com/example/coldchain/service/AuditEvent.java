package com.example.coldchain.service;

import com.example.coldchain.domain.AuditLog;

import java.time.Instant;
import java.util.Map;

/**
 * An action to be written to the audit trail once its transaction completes.
 */
public record AuditEvent(String actor, AuditLog.Action action, String target,
                         Map<String, Object> details, boolean success, Instant timestamp) {
}
