package com.health.compliance.capture;

import com.health.compliance.config.CaptureConfig;
import com.health.compliance.config.MetricsConfig;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.AccessType;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.ObservedOperation;
import com.health.compliance.model.ReasonStatus;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.service.AlertService;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns one observed platform operation into audit records.
 *
 * Every audited operation gets an activity event. Protected-data operations with a resolvable
 * patient also get an access event. A missing access reason or an auth failure raises a security
 * event right away. Nothing here ever throws back into the observed request.
 */
@Service
public class EventCaptureService {

    private static final Logger log = LoggerFactory.getLogger(EventCaptureService.class);

    private final PathClassifier classifier;
    private final RequestContextSanitizer sanitizer;
    private final ActivityEventRepository activityEventRepository;
    private final AccessEventRepository accessEventRepository;
    private final AlertService alertService;
    private final CaptureConfig captureConfig;
    private final MetricsConfig metricsConfig;

    public EventCaptureService(PathClassifier classifier,
                               RequestContextSanitizer sanitizer,
                               ActivityEventRepository activityEventRepository,
                               AccessEventRepository accessEventRepository,
                               AlertService alertService,
                               CaptureConfig captureConfig,
                               MetricsConfig metricsConfig) {
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.activityEventRepository = activityEventRepository;
        this.accessEventRepository = accessEventRepository;
        this.alertService = alertService;
        this.captureConfig = captureConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "capture.observe", contextualName = "observe-operation")
    public void observe(ObservedOperation op) {
        try {
            capture(op);
        } catch (Exception e) {
            metricsConfig.recordCaptureFailure();
            log.error("Audit capture failed for {} {}: {}",
                    op != null ? op.getMethod() : null, op != null ? op.getPath() : null, e.getMessage(), e);
        }
    }

    private void capture(ObservedOperation op) {
        String path = stripQuery(op.getPath());
        String method = op.getMethod() != null ? op.getMethod().toUpperCase() : "GET";

        // 1. Exclusions: preflight requests and excluded paths leave no trace
        if ("OPTIONS".equals(method) || classifier.isExcluded(path)) {
            return;
        }

        ResourceRef resource = classifier.parseResource(path);
        String clientIp = classifier.resolveClientIp(op.getHeaders(), op.getClientIp());
        ActivityEventType eventType = classifier.activityTypeOf(method, path);
        boolean authFailure = op.getStatusCode() == 401 || op.getStatusCode() == 403;

        // 2. Activity event
        Map<String, Object> context = buildContext(op, method, eventType);
        String attemptedUsername = attemptedUsername(op);
        if (eventType == ActivityEventType.LOGIN) {
            context.put("outcome", authFailure ? "failed" : "success");
            context.put("username", attemptedUsername);
        }
        ActivityEvent activity = ActivityEvent.builder()
                .actorId(op.getActorId())
                .actorUsername(op.getActorUsername())
                .actorRole(op.getActorRole())
                .eventType(eventType)
                .resourceType(resource.type())
                .resourceId(resource.id())
                .description(describe(method, path, eventType, authFailure, attemptedUsername))
                .ipAddress(clientIp)
                .userAgent(op.getUserAgent())
                .context(context)
                .build();
        runSafely("activity event", () -> {
            activityEventRepository.append(activity);
            metricsConfig.recordCaptured("activity");
        });

        // 3. Auth failures raise a security event right away
        if (authFailure && classifier.isAuthPath(path)) {
            runSafely("auth failure alert", () -> raiseAuthFailure(op, path, clientIp, attemptedUsername));
        }

        // 4. Protected health information access
        if (classifier.isProtected(path)) {
            runSafely("access event", () -> captureAccess(op, method, path, resource, clientIp));
        }
    }

    private void captureAccess(ObservedOperation op, String method, String path,
                               ResourceRef resource, String clientIp) {
        String subjectId = classifier.resolveSubject(path, op.getQueryParams(), op.getPayload());
        if (subjectId == null) {
            log.debug("No patient resolvable for {} {}, access event skipped", method, path);
            return;
        }

        String rawReason = classifier.resolveReason(op.getHeaders(), op.getQueryParams());
        ReasonStatus reasonStatus = ReasonStatus.classify(rawReason, captureConfig.getNoReasonSentinel());
        String reason = switch (reasonStatus) {
            case PROVIDED -> rawReason.trim();
            case EMPTY -> "";
            default -> captureConfig.getNoReasonSentinel();
        };
        AccessType accessType = classifier.accessTypeOf(method, path);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("method", method);
        context.put("path", path);
        context.put("statusCode", op.getStatusCode());
        context.put("reasonProvided", rawReason != null);

        AccessEvent access = accessEventRepository.append(AccessEvent.builder()
                .actorId(op.getActorId())
                .actorUsername(op.getActorUsername())
                .actorRole(op.getActorRole())
                .subjectId(subjectId)
                .accessType(accessType)
                .reason(reason)
                .reasonStatus(reasonStatus)
                .recordType(resource.type())
                .recordId(resource.id())
                .ipAddress(clientIp)
                .userAgent(op.getUserAgent())
                .context(context)
                .build());
        metricsConfig.recordCaptured("access");

        if (reasonStatus.isMissing()) {
            Map<String, Object> alertContext = new LinkedHashMap<>();
            alertContext.put("accessEventId", access.getEventId());
            alertContext.put("subjectId", subjectId);
            alertContext.put("accessType", accessType.name());
            alertContext.put("path", path);
            alertContext.put("reasonStatus", reasonStatus.name());

            alertService.raise(SecurityEventType.PERMISSION_VIOLATION,
                    String.format("PHI %s of patient %s without a stated access reason",
                            accessType.name().toLowerCase(), subjectId),
                    Severity.MEDIUM, op.getActorId(), op.getActorUsername(), op.getActorRole(), clientIp,
                    op.getUserAgent(), alertContext);
        }
    }

    private void raiseAuthFailure(ObservedOperation op, String path, String clientIp, String attemptedUsername) {
        SecurityEventType type;
        Severity severity;
        String description;
        if (classifier.isLoginPath(path)) {
            type = SecurityEventType.LOGIN_FAILED;
            severity = Severity.MEDIUM;
            description = "Failed login attempt for " + (attemptedUsername != null ? attemptedUsername : "unknown user");
        } else if (op.getStatusCode() == 403) {
            type = SecurityEventType.PERMISSION_VIOLATION;
            severity = Severity.MEDIUM;
            description = "Permission denied on " + path;
        } else {
            type = SecurityEventType.SUSPICIOUS_ACCESS;
            severity = Severity.LOW;
            description = "Unauthenticated request to " + path;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("path", path);
        context.put("statusCode", op.getStatusCode());
        if (attemptedUsername != null) {
            context.put("username", attemptedUsername);
        }

        String username = op.getActorUsername() != null ? op.getActorUsername() : attemptedUsername;
        alertService.raise(type, description, severity, op.getActorId(), username, op.getActorRole(), clientIp,
                op.getUserAgent(), context);
    }

    private Map<String, Object> buildContext(ObservedOperation op, String method, ActivityEventType eventType) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("statusCode", op.getStatusCode());
        context.put("method", method);
        if (op.getQueryParams() != null && !op.getQueryParams().isEmpty()) {
            context.put("queryParams", new LinkedHashMap<>(op.getQueryParams()));
        }
        context.put("headers", sanitizer.sanitizeHeaders(op.getHeaders()));
        boolean storesBody = eventType == ActivityEventType.CREATE || eventType == ActivityEventType.UPDATE;
        if (storesBody && op.getPayload() != null) {
            context.put("body", sanitizer.sanitizePayload(op.getPayload()));
        }
        return context;
    }

    private static String attemptedUsername(ObservedOperation op) {
        if (op.getPayload() != null) {
            Object username = op.getPayload().get("username");
            if (username == null) username = op.getPayload().get("email");
            if (username != null) return String.valueOf(username);
        }
        return op.getActorUsername();
    }

    private static String describe(String method, String path, ActivityEventType type,
                                   boolean authFailure, String username) {
        if (type == ActivityEventType.LOGIN) {
            String who = username != null ? username : "unknown user";
            return authFailure ? "Failed login for " + who : "Login by " + who;
        }
        if (type == ActivityEventType.LOGOUT) {
            return "Logout by " + (username != null ? username : "unknown user");
        }
        return method + " " + path;
    }

    private static String stripQuery(String path) {
        if (path == null) return "";
        int q = path.indexOf('?');
        return q >= 0 ? path.substring(0, q) : path;
    }

    private void runSafely(String step, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            metricsConfig.recordCaptureFailure();
            log.error("Audit capture step '{}' failed: {}", step, e.getMessage(), e);
        }
    }
}
