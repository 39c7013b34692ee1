package com.example.coldchain.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A temperature/humidity sensor. Registered through the sensor API or
 * created on its first ingested reading; address and shared key are the
 * mutable parts.
 */
@Entity
@Table(name = "sensors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Sensor {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @JsonIgnore
    @Column(name = "shared_key", length = 128)
    private String sharedKey;

    @JsonProperty("hasSharedKey")
    public boolean hasSharedKey() {
        return sharedKey != null && !sharedKey.isBlank();
    }
}
