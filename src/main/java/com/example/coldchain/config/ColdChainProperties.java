package com.example.coldchain.config;

import com.example.coldchain.domain.UserAccount;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the cold-chain service.
 * Maps to the 'cold-chain' prefix in application.yml.
 * Threshold and escalation values are frozen into a {@link MonitoringConfig}
 * snapshot at startup; only that snapshot is handed to the lifecycle.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cold-chain")
public class ColdChainProperties {

    private ThresholdConfig thresholds = new ThresholdConfig();
    private EscalationConfig escalation = new EscalationConfig();
    private SchedulerConfig scheduler = new SchedulerConfig();
    private NotificationConfig notifications = new NotificationConfig();

    /** Users provisioned into the directory at startup. */
    private List<UserSeed> users = new ArrayList<>();

    @Data
    public static class ThresholdConfig {
        private double tempMin = 2.0;
        private double tempMax = 8.0;
        private double mediumDelta = 2.0;
        private double highDelta = 5.0;
    }

    @Data
    public static class EscalationConfig {
        private int escalationCount = 3;
        private int retryDelayMinutes = 5;
        private int repeatDelayMinutesLevel3 = 30;
    }

    @Data
    public static class SchedulerConfig {
        private boolean enabled = true;
        private long intervalMs = 60000;
        private int batchSize = 200;
        private int runBudgetSeconds = 50;
        private int workerThreads = 4;
    }

    @Data
    public static class NotificationConfig {
        private String publicBaseUrl = "http://127.0.0.1:8080";
        private EmailConfig email = new EmailConfig();
        private VoiceConfig voice = new VoiceConfig();

        @Data
        public static class EmailConfig {
            private String from = "";
        }

        @Data
        public static class VoiceConfig {
            private boolean enabled = false;
            private String apiUrl = "";
            private String apiKey = "";
            private String fromNumber = "";
            private int timeoutSeconds = 15;
        }
    }

    @Data
    public static class UserSeed {
        private String username;
        private String email;
        private String phone;
        private UserAccount.Role role = UserAccount.Role.OPERATOR;
    }
}
