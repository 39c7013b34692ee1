package com.example.coldchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cold-Chain Alert Escalation Service
 *
 * Watches temperature sensors of refrigerated storage and escalates
 * unacknowledged out-of-range conditions through notification tiers.
 *
 * Architecture:
 * - Threshold Evaluator → classifies readings and computes severity
 * - Alert Lifecycle → per-alert state machine (retry, escalate, repeat, ticket)
 * - Escalation Driver → periodic due-alert selection under per-alert row locks
 * - Notifier → email (and optional voice) delivery with audit rows per attempt
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class ColdChainApplication {

    public static void main(String[] args) {
        SpringApplication.run(ColdChainApplication.class, args);
    }
}
