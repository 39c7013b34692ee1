package com.example.coldchain.notification;

import java.util.List;

/**
 * Outbound mail. Implementations throw on delivery problems; callers turn
 * those into failed attempts.
 */
public interface MailTransport {

    /** False when no mail server is configured. */
    boolean isAvailable();

    void send(String from, List<String> recipients, String subject, String textBody, String htmlBody);
}
