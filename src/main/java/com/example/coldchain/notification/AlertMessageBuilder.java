package com.example.coldchain.notification;

import com.example.coldchain.config.ColdChainProperties;
import com.example.coldchain.config.MonitoringConfig;
import com.example.coldchain.domain.Alert;
import com.example.coldchain.domain.UserAccount.Role;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Renders the email and voice texts for an alert notification.
 */
@Component
@RequiredArgsConstructor
public class AlertMessageBuilder {

    private static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final Map<Role, String> TITLES = Map.of(
            Role.OPERATOR, "Operator Action Required",
            Role.MANAGER, "Manager Escalation Notice",
            Role.ADMIN, "Admin Critical Escalation"
    );

    private static final Map<Role, String> INSTRUCTIONS = Map.of(
            Role.OPERATOR, "Check the sensor and fridge immediately. If you take ownership, acknowledge the alert.",
            Role.MANAGER, "Coordinate with the operator and decide next actions. Acknowledge if handled to stop escalation.",
            Role.ADMIN, "Critical escalation. Dispatch an intervention and track until resolution. Acknowledge immediately if assigned."
    );

    private final MonitoringConfig config;
    private final ColdChainProperties properties;

    public record AlertMessage(String subject, String text, String html) {}

    public record ActionLinks(String acknowledge, String resolve, String details) {}

    public ActionLinks actionLinks(Alert alert) {
        String base = properties.getNotifications().getPublicBaseUrl();
        if (base == null || base.isBlank()) base = "http://127.0.0.1:8080";
        base = base.replaceAll("/+$", "");
        return new ActionLinks(
                base + "/api/alerts/" + alert.getId() + "/ack",
                base + "/api/alerts/" + alert.getId() + "/resolve",
                base + "/dashboard/alerts/" + alert.getId());
    }

    public AlertMessage buildEmail(Alert alert, Role role, int sequence) {
        ActionLinks links = actionLinks(alert);
        String sensorName = sensorName(alert);
        String title = TITLES.getOrDefault(role, "Action Required");
        String instructions = INSTRUCTIONS.getOrDefault(role, "Please acknowledge in the web app to stop escalation.");
        String created = alert.getCreatedAt() != null ? TS_FMT.format(alert.getCreatedAt()) : "-";
        String thresholds = config.tempMin() + " .. " + config.tempMax();

        String subject = String.format("[%s] Cold Chain Alert #%d - %s - %s - Level %d",
                role, alert.getId(), sensorName, alert.getSeverity(), alert.getLevel());

        String text = title + "\n" +
                "----------------------------------------\n" +
                "Alert #" + alert.getId() + " | Sensor: " + sensorName + "\n" +
                "Severity: " + alert.getSeverity() + "\n" +
                "System Level: " + alert.getLevel() + "\n" +
                "Temperature: " + alert.getTemperature() + "\n" +
                "Humidity: " + alert.getHumidity() + "\n" +
                "Thresholds: " + thresholds + "\n" +
                "Status: " + alert.getStatus() + "\n" +
                "Created: " + created + "\n\n" +
                "Instructions: " + instructions + "\n\n" +
                "Acknowledge (ACK): " + links.acknowledge() + "\n" +
                "Resolve: " + links.resolve() + "\n" +
                "Details: " + links.details() + "\n\n" +
                "Email sequence: " + sequence + "\n";

        String html = """
                <!doctype html>
                <html>
                  <body style="margin:0;padding:24px;background:#f6f8fb;font-family:Arial,Helvetica,sans-serif;">
                    <div style="max-width:640px;margin:auto;background:#ffffff;border:1px solid #e7ecf3;border-radius:12px;">
                      <div style="padding:18px 22px;background:#0b1220;color:#ffffff;border-radius:12px 12px 0 0;">
                        <div style="font-size:14px;">%s</div>
                        <div style="font-size:20px;font-weight:700;margin-top:4px;">Cold Chain Alert #%d</div>
                        <div style="font-size:13px;margin-top:6px;">Sensor: <b>%s</b> | Severity: <b>%s</b> | Level: <b>%d</b></div>
                      </div>
                      <div style="padding:18px 22px;color:#1f2937;font-size:14px;">
                        <p><b>Instructions:</b> %s</p>
                        <p><b>Temperature:</b> %s &deg;C | <b>Humidity:</b> %s %%</p>
                        <p><b>Thresholds:</b> %s | <b>Status:</b> %s</p>
                        <p style="color:#64748b;font-size:12px;">Created: %s | Email sequence: %d</p>
                        <p>
                          <a href="%s" style="background:#16a34a;color:#ffffff;padding:12px 16px;border-radius:10px;text-decoration:none;font-weight:700;">Acknowledge (ACK)</a>
                          <a href="%s" style="background:#0ea5e9;color:#ffffff;padding:12px 16px;border-radius:10px;text-decoration:none;font-weight:700;">Resolve</a>
                          <a href="%s" style="background:#111827;color:#ffffff;padding:12px 16px;border-radius:10px;text-decoration:none;font-weight:700;">View details</a>
                        </p>
                      </div>
                      <div style="padding:14px 22px;background:#f8fafc;color:#64748b;font-size:12px;border-radius:0 0 12px 12px;">
                        This alert was generated automatically by the monitoring system.
                      </div>
                    </div>
                  </body>
                </html>
                """.formatted(
                esc(title), alert.getId(), esc(sensorName), alert.getSeverity(), alert.getLevel(),
                esc(instructions), alert.getTemperature(), alert.getHumidity(),
                esc(thresholds), alert.getStatus(), esc(created), sequence,
                links.acknowledge(), links.resolve(), links.details());

        return new AlertMessage(subject, text, html);
    }

    public String buildVoiceMessage(Alert alert) {
        return String.format("Alert level %d. Sensor %s. Temperature %s.",
                alert.getLevel(), sensorName(alert), alert.getTemperature());
    }

    private static String sensorName(Alert alert) {
        return alert.getSensor() != null ? alert.getSensor().getName() : "unknown";
    }

    private static String esc(String value) {
        return HtmlUtils.htmlEscape(value);
    }
}
