package com.example.coldchain.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    /**
     * HTTP client used by the voice-call transport. Timeouts bound how long a
     * hung provider can hold an alert's row lock.
     */
    @Bean
    public OkHttpClient okHttpClient(ColdChainProperties properties) {
        int timeout = Math.max(1, properties.getNotifications().getVoice().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout, TimeUnit.SECONDS)
                .readTimeout(timeout, TimeUnit.SECONDS)
                .writeTimeout(timeout, TimeUnit.SECONDS)
                .callTimeout(timeout * 2L, TimeUnit.SECONDS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonitoringConfig monitoringConfig(ColdChainProperties properties) {
        MonitoringConfig config = MonitoringConfig.from(properties);
        log.info("Monitoring config: range=[{} .. {}] escalationCount={} retryDelay={}m repeatDelayL3={}m",
                config.tempMin(), config.tempMax(), config.escalationCount(),
                config.retryDelayMinutes(), config.repeatDelayMinutesLevel3());
        return config;
    }
}
