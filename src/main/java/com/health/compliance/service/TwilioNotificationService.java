package com.health.compliance.service;

import com.health.compliance.config.MetricsConfig;
import com.health.compliance.config.TwilioNotificationConfig;
import com.health.compliance.model.SecurityEvent;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Pages the security on-call list for high and critical alerts. Best effort: failures are
 * counted and logged, never rethrown.
 */
@Service
public class TwilioNotificationService {

    private static final Logger log = LoggerFactory.getLogger(TwilioNotificationService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioNotificationService(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification service initialized. Channel: {}, recipients: {}",
                    config.getChannel(), config.getRecipients().size());
        } else {
            log.info("Twilio notification service is DISABLED.");
        }
    }

    @Async
    @Observed(name = "notification.send", contextualName = "send-alert-notification")
    public void notifyAlert(SecurityEvent event) {
        if (!config.isEnabled()) {
            return;
        }
        if (config.getRecipients().isEmpty()) {
            log.warn("No notification recipients configured, alert {} not sent", event.getEventId());
            return;
        }

        String body = buildMessageBody(event);
        String from = resolveNumber(config.getFromNumber());
        for (String recipient : config.getRecipients()) {
            try {
                Message message = Message.creator(
                        new PhoneNumber(resolveNumber(recipient)),
                        new PhoneNumber(from),
                        body
                ).create();

                metricsConfig.recordNotification(config.getChannel(), "success");
                log.info("Alert notification sent for event={}, sid={}", event.getEventId(), message.getSid());
            } catch (Exception e) {
                metricsConfig.recordNotification(config.getChannel(), "error");
                log.error("Failed to send alert notification for event={} to {}: {}",
                        event.getEventId(), recipient, e.getMessage(), e);
            }
        }
    }

    String buildMessageBody(SecurityEvent event) {
        return String.format(
                "[SECURITY ALERT] %s - %s\n" +
                "%s\n" +
                "User: %s\n" +
                "IP: %s\n" +
                "Time: %s\n" +
                "Event ID: %s",
                event.getSeverity(),
                event.getEventType(),
                event.getDescription(),
                event.getActorUsername() != null ? event.getActorUsername() : "unknown",
                event.getIpAddress() != null ? event.getIpAddress() : "unknown",
                Instant.ofEpochMilli(event.getTimestamp()),
                event.getEventId()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
