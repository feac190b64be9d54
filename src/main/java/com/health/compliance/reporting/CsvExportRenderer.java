package com.health.compliance.reporting;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.SecurityEvent;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders log-stream exports as comma-separated text: one header row, one row per record in the
 * order given.
 */
public class CsvExportRenderer {

    static final String ACTIVITY_HEADER =
            "ID,Timestamp,User,Event Type,Resource Type,Resource ID,Description,IP Address,User Agent";
    static final String ACCESS_HEADER =
            "ID,Timestamp,User,Patient,Access Type,Reason,Record Type,Record ID,IP Address";
    static final String SECURITY_HEADER =
            "ID,Timestamp,User,Event Type,Severity,Description,IP Address,Resolved,Resolved By,Resolved At";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;

    public CsvExportRenderer(ZoneId zone) {
        this.zone = zone;
    }

    public String renderActivity(List<ActivityEvent> events) {
        StringBuilder sb = new StringBuilder(ACTIVITY_HEADER).append('\n');
        for (ActivityEvent event : events) {
            row(sb,
                    event.getEventId(),
                    timestamp(event.getTimestamp()),
                    user(event.getActorUsername(), event.getActorId()),
                    event.getEventType() != null ? event.getEventType().name() : "",
                    event.getResourceType(),
                    event.getResourceId(),
                    event.getDescription(),
                    event.getIpAddress(),
                    event.getUserAgent());
        }
        return sb.toString();
    }

    public String renderAccess(List<AccessEvent> events) {
        StringBuilder sb = new StringBuilder(ACCESS_HEADER).append('\n');
        for (AccessEvent event : events) {
            row(sb,
                    event.getEventId(),
                    timestamp(event.getTimestamp()),
                    user(event.getActorUsername(), event.getActorId()),
                    event.getSubjectId(),
                    event.getAccessType() != null ? event.getAccessType().name() : "",
                    event.getReason(),
                    event.getRecordType(),
                    event.getRecordId(),
                    event.getIpAddress());
        }
        return sb.toString();
    }

    public String renderSecurity(List<SecurityEvent> events) {
        StringBuilder sb = new StringBuilder(SECURITY_HEADER).append('\n');
        for (SecurityEvent event : events) {
            row(sb,
                    event.getEventId(),
                    timestamp(event.getTimestamp()),
                    user(event.getActorUsername(), event.getActorId()),
                    event.getEventType() != null ? event.getEventType().name() : "",
                    event.getSeverity() != null ? event.getSeverity().name() : "",
                    event.getDescription(),
                    event.getIpAddress(),
                    event.isResolved() ? "Yes" : "No",
                    event.getResolvedBy(),
                    event.getResolvedAt() > 0 ? timestamp(event.getResolvedAt()) : "");
        }
        return sb.toString();
    }

    String timestamp(long epochMillis) {
        return TIMESTAMP.format(Instant.ofEpochMilli(epochMillis).atZone(zone));
    }

    private static String user(String username, String actorId) {
        if (username != null) return username;
        return actorId != null ? actorId : "Anonymous";
    }

    private static void row(StringBuilder sb, String... values) {
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(csv(values[i]));
        }
        sb.append('\n');
    }

    static String csv(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\r", " ").replace("\n", " ");
        if (sanitized.contains(",") || sanitized.contains("\"")) {
            return "\"" + sanitized.replace("\"", "\"\"") + "\"";
        }
        return sanitized;
    }
}
