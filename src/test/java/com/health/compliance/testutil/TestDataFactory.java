package com.health.compliance.testutil;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    /** Wednesday 2024-03-13 12:00 UTC, inside business hours. */
    public static final long NOW = Instant.parse("2024-03-13T12:00:00Z").toEpochMilli();
    public static final long MINUTE = 60_000L;
    public static final long HOUR = 60 * MINUTE;
    public static final long DAY = 24 * HOUR;

    private TestDataFactory() {}

    public static DetectionSettings defaultSettings() {
        return new DetectionConfig().toSettings();
    }

    public static AccessEvent createAccessEvent(String eventId, String actorId, String role,
                                                String subjectId, long timestamp) {
        return AccessEvent.builder()
                .eventId(eventId)
                .actorId(actorId)
                .actorUsername("user-" + actorId)
                .actorRole(role)
                .subjectId(subjectId)
                .accessType(AccessType.VIEW)
                .reason("Treatment")
                .reasonStatus(ReasonStatus.PROVIDED)
                .recordType("patients")
                .recordId(subjectId)
                .ipAddress("10.0.0.12")
                .timestamp(timestamp)
                .build();
    }

    /**
     * {@code count} accesses by one actor, one minute apart ending at {@code lastTimestamp},
     * each to a different patient.
     */
    public static List<AccessEvent> createAccessBurst(String actorId, String role, int count, long lastTimestamp) {
        List<AccessEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(createAccessEvent(actorId + "-A" + i, actorId, role, "P-" + i,
                    lastTimestamp - (long) i * MINUTE));
        }
        return events;
    }

    public static ActivityEvent createFailedLogin(String username, String ip, long timestamp) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("statusCode", 401);
        context.put("outcome", "failed");
        context.put("username", username);
        return ActivityEvent.builder()
                .eventId("LOGIN-" + username + "-" + ip + "-" + timestamp)
                .eventType(ActivityEventType.LOGIN)
                .resourceType("auth")
                .description("Failed login for " + username)
                .ipAddress(ip)
                .timestamp(timestamp)
                .context(context)
                .build();
    }

    public static ActivityEvent createActivityEvent(String eventId, String actorId, ActivityEventType type,
                                                    long timestamp) {
        return ActivityEvent.builder()
                .eventId(eventId)
                .actorId(actorId)
                .actorUsername(actorId != null ? "user-" + actorId : null)
                .actorRole("provider")
                .eventType(type)
                .resourceType("patients")
                .resourceId("2001")
                .description(type + " /api/patients/2001")
                .ipAddress("10.0.0.12")
                .userAgent("JUnit")
                .timestamp(timestamp)
                .build();
    }

    public static SecurityEvent createSecurityEvent(String eventId, SecurityEventType type, Severity severity,
                                                    boolean resolved, long timestamp) {
        return SecurityEvent.builder()
                .eventId(eventId)
                .eventType(type)
                .severity(severity)
                .description("Test " + type)
                .actorId("U-1")
                .actorUsername("dr.smith")
                .actorRole("provider")
                .ipAddress("10.0.0.12")
                .timestamp(timestamp)
                .resolved(resolved)
                .resolvedBy(resolved ? "officer" : null)
                .resolvedAt(resolved ? timestamp + HOUR : 0)
                .build();
    }

    public static ComplianceReport createReport(String reportId, ReportType type, JobStatus status) {
        return ComplianceReport.builder()
                .reportId(reportId)
                .reportType(type)
                .reportDate(java.time.LocalDate.of(2024, 3, 13))
                .startDate(java.time.LocalDate.of(2024, 3, 1))
                .endDate(java.time.LocalDate.of(2024, 3, 12))
                .status(status)
                .format(type.getDefaultFormat())
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    public static DataExport createExport(String exportId, LogStream stream, JobStatus status) {
        return DataExport.builder()
                .exportId(exportId)
                .requestedBy("officer")
                .stream(stream)
                .status(status)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
