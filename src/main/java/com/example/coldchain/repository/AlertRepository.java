package com.example.coldchain.repository;

import com.example.coldchain.domain.Alert;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long> {

    /**
     * Exclusive row lock held until the surrounding transaction ends.
     * Waits at most 3s, then fails with a pessimistic locking exception.
     * PostgreSQL ignores the hint; the postgres profile sets the same bound
     * as the session lock_timeout.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    @Query("SELECT a FROM Alert a WHERE a.id = :id")
    Optional<Alert> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT a.id FROM Alert a WHERE a.sensor.id = :sensorId AND a.status = :status " +
           "ORDER BY a.createdAt DESC, a.id DESC")
    List<Long> findIdsBySensorAndStatus(@Param("sensorId") Long sensorId,
                                        @Param("status") Alert.AlertStatus status,
                                        Pageable pageable);

    /**
     * Copies a new reading into the alert while it is still in {@code status}. Writes only the snapshot
     * columns and takes the row lock for the rest of the transaction, so it
     * waits behind an escalation step or an acknowledge and never rewrites
     * their status, level or schedule. Returns 0 once the alert left that status.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Alert a SET a.temperature = :temperature, a.humidity = :humidity, " +
           "a.severity = :severity, a.updatedAt = :now " +
           "WHERE a.id = :id AND a.status = :status")
    int refreshSnapshot(@Param("id") Long id,
                        @Param("status") Alert.AlertStatus status,
                        @Param("temperature") Double temperature,
                        @Param("humidity") Double humidity,
                        @Param("severity") Alert.Severity severity,
                        @Param("now") Instant now);

    long countBySensorIdAndStatus(Long sensorId, Alert.AlertStatus status);

    /** Due alerts, most overdue first (never-scheduled ones ahead of everything). */
    @Query("SELECT a FROM Alert a WHERE a.status = :status " +
           "AND (a.nextRetryAt IS NULL OR a.nextRetryAt <= :now) " +
           "ORDER BY CASE WHEN a.nextRetryAt IS NULL THEN 0 ELSE 1 END, a.nextRetryAt ASC, a.id ASC")
    List<Alert> findDue(@Param("status") Alert.AlertStatus status, @Param("now") Instant now, Pageable pageable);

    @Query("SELECT a FROM Alert a WHERE a.status = :status " +
           "ORDER BY CASE WHEN a.nextRetryAt IS NULL THEN 0 ELSE 1 END, a.nextRetryAt ASC, a.id ASC")
    List<Alert> findAllByStatusInDueOrder(@Param("status") Alert.AlertStatus status, Pageable pageable);

    @Query("SELECT a FROM Alert a WHERE " +
           "(:status IS NULL OR a.status = :status) AND " +
           "(:severity IS NULL OR a.severity = :severity) AND " +
           "(:sensorId IS NULL OR a.sensor.id = :sensorId) " +
           "ORDER BY a.createdAt DESC, a.id DESC")
    List<Alert> findFiltered(@Param("status") Alert.AlertStatus status,
                             @Param("severity") Alert.Severity severity,
                             @Param("sensorId") Long sensorId);
}
