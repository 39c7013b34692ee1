package com.example.coldchain.service;

import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.AuditLog;
import com.example.coldchain.domain.Ticket;
import com.example.coldchain.exception.InvalidTransitionException;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.repository.TicketRepository;
import com.example.coldchain.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Work items opened for alerts that reach the top escalation level.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketService {

    static final String AUTO_DESCRIPTION = "Auto-created by monitoring escalation.";

    private final TicketRepository ticketRepository;
    private final UserAccountRepository userAccountRepository;
    private final AuditService auditService;
    private final Clock clock;

    /**
     * Returns the alert's ticket, creating it on first call. Calling it again
     * returns the same row unchanged.
     */
    @Transactional
    public Ticket ensureTicket(Alert alert) {
        Optional<Ticket> existing = ticketRepository.findByAlertId(alert.getId());
        if (existing.isPresent()) {
            log.debug("Ticket {} already exists for alert {}", existing.get().getId(), alert.getId());
            return existing.get();
        }

        String sensorName = alert.getSensor() != null ? alert.getSensor().getName() : "unknown";
        Ticket ticket = Ticket.builder()
                .alertId(alert.getId())
                .title(String.format("Auto ticket: %s (Alert #%d)", sensorName, alert.getId()))
                .description(AUTO_DESCRIPTION)
                .priority(alert.getSeverity() == Alert.Severity.HIGH ? Ticket.Priority.HIGH : Ticket.Priority.MEDIUM)
                .status(Ticket.TicketStatus.OPEN)
                .createdBy("system")
                .createdAt(Instant.now(clock))
                .build();
        ticket = ticketRepository.save(ticket);

        log.warn("Ticket {} opened for alert {} (sensor {}, priority {})",
                ticket.getId(), alert.getId(), sensorName, ticket.getPriority());
        auditService.log("system", AuditLog.Action.TICKET_CREATED, AuditService.ticketTarget(ticket.getId()),
                Map.of("alert_id", alert.getId(), "priority", ticket.getPriority().name()));
        return ticket;
    }

    public Optional<Ticket> findByAlert(Long alertId) {
        return ticketRepository.findByAlertId(alertId);
    }

    public Ticket get(Long ticketId) {
        return ticketRepository.findById(ticketId)
                .orElseThrow(() -> new NotFoundException("Ticket", ticketId));
    }

    public List<Ticket> list(Ticket.TicketStatus status, Ticket.Priority priority, Long alertId) {
        return ticketRepository.findFiltered(status, priority, alertId);
    }

    /**
     * Assign the ticket; an OPEN ticket moves to IN_PROGRESS.
     */
    @Transactional
    public Ticket assign(Long ticketId, Long userId) {
        Ticket ticket = get(ticketId);
        if (ticket.getStatus() == Ticket.TicketStatus.CLOSED) {
            auditService.logRejected("user", AuditLog.Action.TICKET_ASSIGNED, AuditService.ticketTarget(ticketId),
                    Map.of("user_id", userId));
            throw new InvalidTransitionException("Closed tickets cannot be assigned.", ticket.getStatus().name());
        }
        userAccountRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));

        ticket.setAssignedTo(userId);
        if (ticket.getStatus() == Ticket.TicketStatus.OPEN) {
            ticket.setStatus(Ticket.TicketStatus.IN_PROGRESS);
        }
        ticket = ticketRepository.save(ticket);

        log.info("Ticket {} assigned to user {}", ticketId, userId);
        auditService.log("user", AuditLog.Action.TICKET_ASSIGNED, AuditService.ticketTarget(ticketId),
                Map.of("user_id", userId));
        return ticket;
    }

    @Transactional
    public Ticket close(Long ticketId, String actor) {
        Ticket ticket = get(ticketId);
        if (ticket.getStatus() == Ticket.TicketStatus.CLOSED) {
            auditService.logRejected(actor, AuditLog.Action.TICKET_CLOSED, AuditService.ticketTarget(ticketId),
                    Map.of("current_status", ticket.getStatus().name()));
            throw new InvalidTransitionException("Ticket already closed.", ticket.getStatus().name());
        }

        ticket.setStatus(Ticket.TicketStatus.CLOSED);
        ticket.setClosedAt(Instant.now(clock));
        ticket = ticketRepository.save(ticket);

        log.info("Ticket {} closed by {}", ticketId, actor);
        auditService.log(actor, AuditLog.Action.TICKET_CLOSED, AuditService.ticketTarget(ticketId), null);
        return ticket;
    }
}
