package com.example.coldchain.notification;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Sends multipart (plain text + HTML) mail through Spring's {@link JavaMailSender}.
 * The sender bean only exists when {@code spring.mail.host} is set.
 */
@Slf4j
@Component
public class SmtpMailTransport implements MailTransport {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;

    public SmtpMailTransport(ObjectProvider<JavaMailSender> mailSenderProvider) {
        this.mailSenderProvider = mailSenderProvider;
    }

    @Override
    public boolean isAvailable() {
        return mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public void send(String from, List<String> recipients, String subject, String textBody, String htmlBody) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw new MailPreparationException("No JavaMailSender configured (spring.mail.host)");
        }

        MimeMessage message = mailSender.createMimeMessage();
        try {
            boolean multipart = htmlBody != null && !htmlBody.isBlank();
            MimeMessageHelper helper = new MimeMessageHelper(message, multipart, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(recipients.toArray(String[]::new));
            helper.setSubject(subject);
            if (multipart) {
                helper.setText(textBody, htmlBody);
            } else {
                helper.setText(textBody);
            }
        } catch (MessagingException e) {
            throw new MailPreparationException("Failed to build alert email: " + e.getMessage(), e);
        }

        mailSender.send(message);
        log.debug("Mail '{}' handed to SMTP for {} recipient(s)", subject, recipients.size());
    }
}
