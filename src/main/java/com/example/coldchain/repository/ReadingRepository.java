package com.example.coldchain.repository;

import com.example.coldchain.domain.Reading;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ReadingRepository extends JpaRepository<Reading, Long> {

    Optional<Reading> findTopBySensorNameOrderByCreatedAtDesc(String sensorName);

    List<Reading> findTop50BySensorIdOrderByCreatedAtDesc(Long sensorId);
}
