package com.example.coldchain.controller;

import com.example.coldchain.domain.Ticket;
import com.example.coldchain.service.TicketService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Ticket REST API Controller.
 */
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;

    @GetMapping
    public ResponseEntity<List<Ticket>> listTickets(
            @RequestParam(required = false) Ticket.TicketStatus status,
            @RequestParam(required = false) Ticket.Priority priority,
            @RequestParam(required = false) Long alertId) {
        return ResponseEntity.ok(ticketService.list(status, priority, alertId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Ticket> getTicket(@PathVariable Long id) {
        return ResponseEntity.ok(ticketService.get(id));
    }

    /**
     * Assign to a user; body: {"userId": 7}.
     */
    @PostMapping("/{id}/assign")
    public ResponseEntity<Ticket> assign(@PathVariable Long id, @RequestBody Map<String, Object> body) {
        Object userId = body.get("userId");
        if (!(userId instanceof Number n)) {
            throw new IllegalArgumentException("userId is required");
        }
        return ResponseEntity.ok(ticketService.assign(id, n.longValue()));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<Ticket> close(@PathVariable Long id,
                                        @RequestBody(required = false) Map<String, Object> body) {
        return ResponseEntity.ok(ticketService.close(id, RequestBodies.actor(body)));
    }
}
