package com.example.coldchain.repository;

import com.example.coldchain.domain.Ticket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, Long> {

    Optional<Ticket> findByAlertId(Long alertId);

    long countByAlertId(Long alertId);

    @Query("SELECT t FROM Ticket t WHERE " +
           "(:status IS NULL OR t.status = :status) AND " +
           "(:priority IS NULL OR t.priority = :priority) AND " +
           "(:alertId IS NULL OR t.alertId = :alertId) " +
           "ORDER BY t.createdAt DESC, t.id DESC")
    List<Ticket> findFiltered(@Param("status") Ticket.TicketStatus status,
                              @Param("priority") Ticket.Priority priority,
                              @Param("alertId") Long alertId);
}
