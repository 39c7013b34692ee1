package com.example.coldchain.service;

import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.Reading;
import com.example.coldchain.domain.Sensor;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.repository.ReadingRepository;
import com.example.coldchain.repository.SensorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Stores incoming sensor readings and feeds them to the alert lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingIngestionService {

    private final SensorRepository sensorRepository;
    private final SensorService sensorService;
    private final ReadingRepository readingRepository;
    private final AlertLifecycleService lifecycleService;
    private final Clock clock;

    public record IngestionResult(Reading reading, Alert alert) {
    }

    /**
     * Persist a reading (creating the sensor on first sight) and open or
     * refresh the sensor's alert when the temperature is out of range.
     * The sensor row is locked so concurrent readings cannot open two alerts.
     */
    @Transactional
    public IngestionResult ingest(String sensorName, Double temperature, Double humidity) {
        if (sensorName == null || sensorName.isBlank()) {
            throw new IllegalArgumentException("Sensor name is required");
        }
        String name = sensorName.trim();
        Sensor sensor = sensorService.findOrRegister(name);
        sensor = sensorRepository.findByIdForUpdate(sensor.getId())
                .orElseThrow(() -> new NotFoundException("Sensor", name));

        Reading reading = readingRepository.save(Reading.builder()
                .sensor(sensor)
                .temperature(temperature)
                .humidity(humidity)
                .createdAt(Instant.now(clock))
                .build());
        log.debug("Reading {} from {}: temperature={} humidity={}", reading.getId(), name, temperature, humidity);

        Alert alert = lifecycleService.createOrUpdate(sensor, reading).orElse(null);
        return new IngestionResult(reading, alert);
    }

    public Reading latest(String sensorName) {
        return readingRepository.findTopBySensorNameOrderByCreatedAtDesc(sensorName)
                .orElseThrow(() -> new NotFoundException("Reading for sensor", sensorName));
    }

    public List<Reading> recent(String sensorName) {
        Sensor sensor = sensorRepository.findByName(sensorName)
                .orElseThrow(() -> new NotFoundException("Sensor", sensorName));
        return readingRepository.findTop50BySensorIdOrderByCreatedAtDesc(sensor.getId());
    }
}
