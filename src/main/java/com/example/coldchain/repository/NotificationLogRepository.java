package com.example.coldchain.repository;

import com.example.coldchain.domain.NotificationLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationLogRepository extends JpaRepository<NotificationLog, Long> {

    List<NotificationLog> findByAlertIdOrderByIdAsc(Long alertId);

    List<NotificationLog> findTop50ByAlertIdOrderBySentAtDescIdDesc(Long alertId);

    long countByAlertId(Long alertId);

    long countByAlertIdAndChannel(Long alertId, NotificationLog.Channel channel);
}
