package com.example.coldchain.notification;

import com.example.coldchain.config.ColdChainProperties;
import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.NotificationFailure;
import com.example.coldchain.domain.UserAccount;
import com.example.coldchain.domain.UserAccount.Role;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.TreeSet;

/**
 * Notifier - delivers an alert to a resolved set of users.
 *
 * Never throws on delivery problems: every failure comes back as a
 * {@link NotificationResult} so the caller can log the attempt and keep the
 * escalation schedule moving.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final ColdChainProperties properties;
    private final AlertMessageBuilder messageBuilder;
    private final MailTransport mailTransport;
    private final VoiceCallTransport voiceCallTransport;
    private final RecipientResolver recipientResolver;

    public boolean isVoiceEnabled() {
        return properties.getNotifications().getVoice().isEnabled();
    }

    /**
     * Send the role-specific alert email to the recipients that have an
     * email address.
     *
     * @param sequence attempt number within the current level
     */
    public NotificationResult sendEmail(Alert alert, Role role, int sequence, List<UserAccount> recipients) {
        List<String> emails = recipients == null ? List.of()
                : distinctSorted(recipients.stream().map(UserAccount::getEmail).toList());
        if (emails.isEmpty()) {
            log.warn("Alert {}: no email recipients for role {}", alert.getId(), role);
            return NotificationResult.failed(NotificationFailure.NO_RECIPIENTS,
                    "No email recipients for role " + role + ".", List.of());
        }

        String from = properties.getNotifications().getEmail().getFrom();
        if (from == null || from.isBlank()) {
            log.error("Alert {}: sender address (cold-chain.notifications.email.from) is not configured", alert.getId());
            return NotificationResult.failed(NotificationFailure.CONFIGURATION_MISSING,
                    "Sender address cold-chain.notifications.email.from is not configured", emails);
        }
        if (!mailTransport.isAvailable()) {
            log.error("Alert {}: no mail server configured (spring.mail.host)", alert.getId());
            return NotificationResult.failed(NotificationFailure.CONFIGURATION_MISSING,
                    "Mail server spring.mail.host is not configured", emails);
        }

        AlertMessageBuilder.AlertMessage message = messageBuilder.buildEmail(alert, role, sequence);
        try {
            mailTransport.send(from, emails, message.subject(), message.text(), message.html());
            log.info("Alert {} email #{} sent to {} ({} recipient(s))", alert.getId(), sequence, role, emails.size());
            return NotificationResult.sent(emails);
        } catch (Exception e) {
            log.warn("Alert {} email #{} to {} failed: {}", alert.getId(), sequence, role, e.getMessage());
            return NotificationResult.failed(NotificationFailure.TRANSPORT_FAILURE, describe(e), emails);
        }
    }

    /**
     * Place voice calls to the phone numbers of {@code recipients}.
     */
    public NotificationResult placeCall(Alert alert, List<UserAccount> recipients) {
        List<String> phones = recipientResolver.phoneNumbers(recipients != null ? recipients : List.of());
        if (phones.isEmpty()) {
            return NotificationResult.failed(NotificationFailure.NO_RECIPIENTS, "No phone recipients", List.of());
        }
        if (!voiceCallTransport.isConfigured()) {
            log.error("Alert {}: voice provider credentials are not configured", alert.getId());
            return NotificationResult.failed(NotificationFailure.CONFIGURATION_MISSING,
                    "Voice provider api-url/api-key/from-number not configured", phones);
        }

        try {
            voiceCallTransport.placeCall(messageBuilder.buildVoiceMessage(alert), phones);
            log.info("Alert {} voice call placed to {} number(s)", alert.getId(), phones.size());
            return NotificationResult.sent(phones);
        } catch (Exception e) {
            log.warn("Alert {} voice call failed: {}", alert.getId(), e.getMessage());
            return NotificationResult.failed(NotificationFailure.TRANSPORT_FAILURE, describe(e), phones);
        }
    }

    private static List<String> distinctSorted(List<String> values) {
        TreeSet<String> set = new TreeSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) set.add(v.trim());
        }
        return List.copyOf(set);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
