package com.example.coldchain.repository;

import com.example.coldchain.domain.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByTargetOrderByTimestampDesc(String target);

    @Query("SELECT a FROM AuditLog a ORDER BY a.timestamp DESC")
    Page<AuditLog> findAllPaged(Pageable pageable);

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:actor IS NULL OR a.actor = :actor) AND " +
           "(:action IS NULL OR a.action = :action) AND " +
           "(:target IS NULL OR a.target = :target) " +
           "ORDER BY a.timestamp DESC")
    List<AuditLog> findFiltered(@Param("actor") String actor,
                               @Param("action") AuditLog.Action action,
                               @Param("target") String target);

    @Query("SELECT a.action, COUNT(a) FROM AuditLog a WHERE a.success = true GROUP BY a.action")
    List<Object[]> countSucceededGroupedByAction();

    long countBySuccessFalse();
}
