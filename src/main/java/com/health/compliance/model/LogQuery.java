package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Filter over the log streams. Null fields match everything. The same predicate backs the
 * paged query endpoints and the exports, so both always see the same records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogQuery {

    public static final Set<String> FILTER_KEYS = Set.of(
            "actorId", "role", "kind", "startDate", "endDate", "search",
            "ipAddress", "subjectId", "severity", "resolved");

    private String actorId;
    private String role;
    private String kind;
    private Long from;                  // inclusive, epoch millis
    private Long to;                    // inclusive, epoch millis
    private String search;
    private String ipAddress;
    private String subjectId;
    private Severity severity;
    private Boolean resolved;

    public static LogQuery between(long from, long to) {
        return LogQuery.builder().from(from).to(to).build();
    }

    /**
     * Builds a query from string filters such as an export request carries.
     *
     * @throws IllegalArgumentException on unknown keys, bad dates or unknown severities
     */
    public static LogQuery fromFilters(Map<String, String> filters, ZoneId zone) {
        LogQueryBuilder builder = LogQuery.builder();
        if (filters == null) return builder.build();

        for (Map.Entry<String, String> entry : filters.entrySet()) {
            if (!FILTER_KEYS.contains(entry.getKey())) {
                throw new IllegalArgumentException("Unknown filter '" + entry.getKey()
                        + "'; supported filters are " + FILTER_KEYS);
            }
        }

        String startDate = filters.get("startDate");
        String endDate = filters.get("endDate");
        if (startDate != null && !startDate.isBlank()) {
            LocalDate start = DateRange.parseDate("startDate", startDate);
            builder.from(start.atStartOfDay(zone).toInstant().toEpochMilli());
        }
        if (endDate != null && !endDate.isBlank()) {
            LocalDate end = DateRange.parseDate("endDate", endDate);
            builder.to(end.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli() - 1);
        }

        String severity = filters.get("severity");
        if (severity != null && !severity.isBlank()) {
            builder.severity(parseSeverity(severity));
        }
        String resolved = filters.get("resolved");
        if (resolved != null && !resolved.isBlank()) {
            builder.resolved(Boolean.parseBoolean(resolved));
        }

        return builder
                .actorId(blankToNull(filters.get("actorId")))
                .role(blankToNull(filters.get("role")))
                .kind(blankToNull(filters.get("kind")))
                .search(blankToNull(filters.get("search")))
                .ipAddress(blankToNull(filters.get("ipAddress")))
                .subjectId(blankToNull(filters.get("subjectId")))
                .build();
    }

    public static Severity parseSeverity(String value) {
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid severity '" + value + "': expected one of LOW, MEDIUM, HIGH, CRITICAL");
        }
    }

    public boolean matches(ActivityEvent event) {
        return inRange(event.getTimestamp())
                && equalsOrUnset(actorId, event.getActorId())
                && equalsIgnoreCaseOrUnset(role, event.getActorRole())
                && equalsIgnoreCaseOrUnset(kind, event.getEventType() != null ? event.getEventType().name() : null)
                && equalsOrUnset(ipAddress, event.getIpAddress())
                && subjectId == null
                && containsSearch(event.getDescription(), event.getResourceType(),
                        event.getResourceId(), event.getActorUsername());
    }

    public boolean matches(AccessEvent event) {
        return inRange(event.getTimestamp())
                && equalsOrUnset(actorId, event.getActorId())
                && equalsIgnoreCaseOrUnset(role, event.getActorRole())
                && equalsIgnoreCaseOrUnset(kind, event.getAccessType() != null ? event.getAccessType().name() : null)
                && equalsOrUnset(ipAddress, event.getIpAddress())
                && equalsOrUnset(subjectId, event.getSubjectId())
                && containsSearch(event.getReason(), event.getRecordType(),
                        event.getRecordId(), event.getActorUsername());
    }

    public boolean matches(SecurityEvent event) {
        return inRange(event.getTimestamp())
                && equalsOrUnset(actorId, event.getActorId())
                && equalsIgnoreCaseOrUnset(role, event.getActorRole())
                && equalsIgnoreCaseOrUnset(kind, event.getEventType() != null ? event.getEventType().name() : null)
                && equalsOrUnset(ipAddress, event.getIpAddress())
                && (severity == null || severity == event.getSeverity())
                && (resolved == null || resolved == event.isResolved())
                && containsSearch(event.getDescription(), event.getActorUsername(), event.getIpAddress());
    }

    private boolean inRange(long timestamp) {
        if (from != null && timestamp < from) return false;
        return to == null || timestamp <= to;
    }

    private boolean containsSearch(String... fields) {
        if (search == null || search.isBlank()) return true;
        String needle = search.toLowerCase(Locale.ROOT);
        for (String field : fields) {
            if (field != null && field.toLowerCase(Locale.ROOT).contains(needle)) return true;
        }
        return false;
    }

    private static boolean equalsOrUnset(String expected, String actual) {
        return expected == null || expected.equals(actual);
    }

    private static boolean equalsIgnoreCaseOrUnset(String expected, String actual) {
        return expected == null || expected.equalsIgnoreCase(actual);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
