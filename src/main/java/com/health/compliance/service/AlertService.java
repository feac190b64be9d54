package com.health.compliance.service;

import com.health.compliance.config.MetricsConfig;
import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.exception.SecurityEventNotFoundException;
import com.health.compliance.model.AlertRequest;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.SecurityEventRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Security event lifecycle: raise (open) and resolve (closed). High and critical alerts page the
 * on-call list; paging never affects the outcome of the raise.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final SecurityEventRepository securityEventRepository;
    private final TwilioNotificationService notificationService;
    private final MetricsConfig metricsConfig;

    public AlertService(SecurityEventRepository securityEventRepository,
                        TwilioNotificationService notificationService,
                        MetricsConfig metricsConfig) {
        this.securityEventRepository = securityEventRepository;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
    }

    public SecurityEvent raise(SecurityEventType type, String description, Severity severity,
                               String actorId, String actorUsername, String actorRole, String ipAddress,
                               String userAgent, Map<String, Object> context) {
        return raise(SecurityEvent.builder()
                .eventType(type)
                .description(description)
                .severity(severity != null ? severity : Severity.MEDIUM)
                .actorId(actorId)
                .actorUsername(actorUsername)
                .actorRole(actorRole)
                .ipAddress(ipAddress)
                .userAgent(userAgent)
                .context(context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>())
                .build());
    }

    /**
     * Raise from an API request.
     *
     * @throws IllegalArgumentException on a missing or unknown event type or severity
     */
    public SecurityEvent raise(AlertRequest request) {
        if (request.getEventType() == null || request.getEventType().isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (request.getDescription() == null || request.getDescription().isBlank()) {
            throw new IllegalArgumentException("description is required");
        }
        SecurityEventType type;
        try {
            type = SecurityEventType.valueOf(request.getEventType().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown eventType '" + request.getEventType() + "'");
        }
        Severity severity = request.getSeverity() != null && !request.getSeverity().isBlank()
                ? LogQuery.parseSeverity(request.getSeverity())
                : Severity.MEDIUM;

        return raise(type, request.getDescription(), severity, request.getActorId(), request.getActorUsername(),
                request.getActorRole(), request.getIpAddress(), request.getUserAgent(), request.getContext());
    }

    /**
     * Raise a heuristic's alert unless one with the same de-duplication key was raised at or
     * after {@code since}. The key is claimed before the alert is written; if the write fails the
     * claim is released and the failure propagates.
     */
    public Optional<SecurityEvent> raiseUnlessDuplicate(AlertCandidate candidate, long since) {
        String dedupKey = candidate.getDedupKey();
        if (dedupKey != null && !securityEventRepository.claimDedupKey(dedupKey, since)) {
            log.debug("Skipping duplicate alert {}", dedupKey);
            return Optional.empty();
        }
        SecurityEvent event = SecurityEvent.builder()
                .eventType(candidate.getEventType())
                .description(candidate.getDescription())
                .severity(candidate.getSeverity())
                .actorId(candidate.getActorId())
                .actorUsername(candidate.getActorUsername())
                .actorRole(candidate.getActorRole())
                .ipAddress(candidate.getIpAddress())
                .context(candidate.getContext() != null ? new LinkedHashMap<>(candidate.getContext()) : new LinkedHashMap<>())
                .dedupKey(dedupKey)
                .build();
        try {
            return Optional.of(raise(event));
        } catch (RuntimeException e) {
            if (dedupKey != null) {
                securityEventRepository.releaseDedupKey(dedupKey);
            }
            throw e;
        }
    }

    @Observed(name = "alerts.raise", contextualName = "raise-alert")
    public SecurityEvent raise(SecurityEvent event) {
        if (event.getEventType() == null) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (event.getSeverity() == null) {
            event.setSeverity(Severity.MEDIUM);
        }

        SecurityEvent saved = securityEventRepository.append(event);
        metricsConfig.recordAlertRaised(saved.getEventType().name(), saved.getSeverity().name());
        log.info("Security event raised: id={}, type={}, severity={}, actor={}",
                saved.getEventId(), saved.getEventType(), saved.getSeverity(), saved.getActorUsername());

        if (saved.getSeverity().isHighOrCritical()) {
            try {
                notificationService.notifyAlert(saved);
            } catch (Exception e) {
                log.error("Failed to dispatch notification for security event {}: {}",
                        saved.getEventId(), e.getMessage(), e);
            }
        }
        return saved;
    }

    /**
     * Resolve a security event. Resolving an already-resolved event keeps the original resolver
     * and time and only replaces the notes.
     *
     * @throws SecurityEventNotFoundException if no event has this id
     */
    @Observed(name = "alerts.resolve", contextualName = "resolve-alert")
    public SecurityEvent resolve(String eventId, String resolvedBy, String notes) {
        if (resolvedBy == null || resolvedBy.isBlank()) {
            throw new IllegalArgumentException("resolvedBy is required");
        }
        SecurityEvent resolved = securityEventRepository.resolve(eventId, resolvedBy, notes);
        if (resolved == null) {
            throw new SecurityEventNotFoundException(eventId);
        }
        metricsConfig.recordAlertResolved();
        log.info("Security event {} resolved by {}", eventId, resolved.getResolvedBy());
        return resolved;
    }

    public SecurityEvent getEvent(String eventId) {
        SecurityEvent event = securityEventRepository.findById(eventId);
        if (event == null) {
            throw new SecurityEventNotFoundException(eventId);
        }
        return event;
    }
}
