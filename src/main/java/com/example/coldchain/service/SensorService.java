package com.example.coldchain.service;

import com.example.coldchain.domain.Sensor;
import com.example.coldchain.exception.NotFoundException;
import com.example.coldchain.repository.SensorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Sensor registry. Sensors are registered explicitly with their address and
 * shared key, or implicitly by name on their first reading.
 */
@Slf4j
@Service
public class SensorService {

    private static final int MAX_REGISTER_ATTEMPTS = 5;

    private final SensorRepository sensorRepository;
    private final TransactionTemplate insertTransaction;

    public SensorService(SensorRepository sensorRepository, PlatformTransactionManager transactionManager) {
        this.sensorRepository = sensorRepository;
        this.insertTransaction = new TransactionTemplate(transactionManager);
        this.insertTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public List<Sensor> list() {
        return sensorRepository.findAllByOrderByNameAsc();
    }

    public Sensor get(String name) {
        return sensorRepository.findByName(name)
                .orElseThrow(() -> new NotFoundException("Sensor", name));
    }

    /**
     * Returns the sensor with this name, inserting it if needed. The insert
     * commits on its own, so when a concurrent request inserts the same name
     * first, the caller's transaction stays usable and the next pass reads
     * the winning row.
     */
    public Sensor findOrRegister(String name) {
        DataAccessException conflict = null;
        for (int attempt = 0; attempt < MAX_REGISTER_ATTEMPTS; attempt++) {
            Optional<Sensor> existing = sensorRepository.findByName(name);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                return insert(name);
            } catch (DataAccessException e) {
                log.debug("Sensor '{}' insert lost to a concurrent registration: {}", name, e.getMessage());
                conflict = e;
            }
        }
        throw conflict;
    }

    /**
     * Register a sensor or update the address and shared key of an existing
     * one. A null field leaves the stored value unchanged.
     */
    @Transactional
    public Sensor register(String name, String ipAddress, String sharedKey) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sensor name is required");
        }
        Sensor sensor = findOrRegister(name.trim());
        sensor = sensorRepository.findByIdForUpdate(sensor.getId())
                .orElseThrow(() -> new NotFoundException("Sensor", name));
        if (ipAddress != null) {
            sensor.setIpAddress(ipAddress.isBlank() ? null : ipAddress.trim());
        }
        if (sharedKey != null) {
            sensor.setSharedKey(sharedKey.isBlank() ? null : sharedKey);
        }
        sensor = sensorRepository.save(sensor);
        log.info("Sensor '{}' registered (address={}, key set={})",
                sensor.getName(), sensor.getIpAddress(), sensor.getSharedKey() != null);
        return sensor;
    }

    private Sensor insert(String name) {
        Sensor sensor = insertTransaction.execute(status ->
                sensorRepository.saveAndFlush(Sensor.builder().name(name).build()));
        log.info("Registered new sensor '{}'", name);
        return sensor;
    }
}
