package com.health.compliance.reporting;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.AccessType;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Aggregations behind the compliance reports. Pure functions over already-loaded event lists;
 * loading and date windows are the caller's job.
 */
@Component
public class ReportAggregator {

    private static final long HOUR_MS = 3_600_000L;
    private static final long DAY_MS = 24 * HOUR_MS;

    public Map<String, Object> phiAccessSummary(List<AccessEvent> events, DateRange range) {
        long missingReason = events.stream().filter(AccessEvent::isMissingReason).count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("report_period", period(range));
        summary.put("total_accesses", events.size());
        summary.put("unique_subjects", distinct(events, AccessEvent::getSubjectId));
        summary.put("unique_actors", distinct(events, AccessEvent::getActorId));
        summary.put("access_by_type", countBy(events, e -> name(e.getAccessType())));
        summary.put("access_by_user_role", countBy(events, AccessEvent::getActorRole));
        summary.put("access_by_record_type", countBy(events, AccessEvent::getRecordType));
        summary.put("missing_reason", missingReason);
        summary.put("missing_reason_ratio", ratio(missingReason, events.size()));
        return summary;
    }

    public Map<String, Object> securityIncidentSummary(List<SecurityEvent> events, DateRange range) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("report_period", period(range));
        summary.put("total_incidents", events.size());
        summary.put("incidents_by_type", countBy(events, e -> name(e.getEventType())));
        summary.put("incidents_by_severity", countBy(events, e -> name(e.getSeverity())));
        summary.put("unresolved_incidents", events.stream().filter(e -> !e.isResolved()).count());
        summary.put("critical_unresolved", events.stream()
                .filter(e -> !e.isResolved() && e.getSeverity() == Severity.CRITICAL).count());
        summary.put("avg_resolution_time_hours", averageResolutionHours(events));
        return summary;
    }

    /**
     * Mean of (resolvedAt - timestamp) in hours over resolved events; 0 when none are resolved.
     */
    public static double averageResolutionHours(List<SecurityEvent> events) {
        return events.stream()
                .filter(e -> e.isResolved() && e.getResolvedAt() > 0)
                .mapToDouble(e -> (e.getResolvedAt() - e.getTimestamp()) / (double) HOUR_MS)
                .average()
                .orElse(0.0);
    }

    /**
     * Daily and weekly audit report: one section per stream.
     */
    public Map<String, Object> auditSummary(List<ActivityEvent> activity, List<AccessEvent> access,
                                            List<SecurityEvent> security, DateRange range) {
        long missingReason = access.stream().filter(AccessEvent::isMissingReason).count();

        Map<String, Object> activitySection = new LinkedHashMap<>();
        activitySection.put("total_events", activity.size());
        activitySection.put("unique_actors", distinct(activity, ActivityEvent::getActorId));
        activitySection.put("events_by_type", countBy(activity, e -> name(e.getEventType())));
        activitySection.put("events_by_resource_type", countBy(activity, ActivityEvent::getResourceType));

        Map<String, Object> accessSection = new LinkedHashMap<>();
        accessSection.put("total_accesses", access.size());
        accessSection.put("missing_reason", missingReason);
        accessSection.put("missing_reason_ratio", ratio(missingReason, access.size()));
        accessSection.put("access_by_user_role", countBy(access, AccessEvent::getActorRole));

        Map<String, Object> securitySection = new LinkedHashMap<>();
        securitySection.put("total_incidents", security.size());
        securitySection.put("high_severity", security.stream()
                .filter(e -> e.getSeverity() != null && e.getSeverity().isHighOrCritical()).count());
        securitySection.put("unresolved_incidents", security.stream().filter(e -> !e.isResolved()).count());
        securitySection.put("incidents_by_type", countBy(security, e -> name(e.getEventType())));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("report_period", period(range));
        summary.put("activity", activitySection);
        summary.put("phi_access", accessSection);
        summary.put("security", securitySection);
        return summary;
    }

    public Map<String, Object> userActivity(List<ActivityEvent> events, DateRange range) {
        Map<String, List<ActivityEvent>> byActor = new TreeMap<>();
        for (ActivityEvent event : events) {
            if (event.getActorId() == null) continue;
            byActor.computeIfAbsent(event.getActorId(), k -> new ArrayList<>()).add(event);
        }

        List<Map<String, Object>> users = new ArrayList<>();
        byActor.forEach((actorId, actorEvents) -> {
            Map<String, Object> user = new LinkedHashMap<>();
            user.put("actor_id", actorId);
            user.put("username", firstNonNull(actorEvents, ActivityEvent::getActorUsername));
            user.put("role", firstNonNull(actorEvents, ActivityEvent::getActorRole));
            user.put("total_events", actorEvents.size());
            user.put("events_by_type", countBy(actorEvents, e -> name(e.getEventType())));
            user.put("last_activity", actorEvents.stream().mapToLong(ActivityEvent::getTimestamp).max().orElse(0));
            users.add(user);
        });
        users.sort(Comparator.comparing((Map<String, Object> u) -> (Integer) u.get("total_events")).reversed());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("report_period", period(range));
        report.put("total_events", events.size());
        report.put("anonymous_events", events.stream().filter(e -> e.getActorId() == null).count());
        report.put("active_users", users.size());
        report.put("users", users);
        return report;
    }

    /**
     * Login and logout activity.
     */
    public Map<String, Object> systemAccess(List<ActivityEvent> events, DateRange range) {
        List<ActivityEvent> logins = events.stream().filter(e -> e.getEventType() == ActivityEventType.LOGIN).toList();
        List<ActivityEvent> failed = logins.stream().filter(ActivityEvent::isFailedLogin).toList();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("report_period", period(range));
        report.put("login_attempts", logins.size());
        report.put("successful_logins", logins.size() - failed.size());
        report.put("failed_logins", failed.size());
        report.put("logouts", events.stream().filter(e -> e.getEventType() == ActivityEventType.LOGOUT).count());
        report.put("unique_users", logins.stream()
                .filter(e -> !e.isFailedLogin())
                .map(ActivityEvent::getLoginUsername)
                .filter(Objects::nonNull)
                .distinct()
                .count());
        report.put("failed_logins_by_username", countBy(failed, ActivityEvent::getLoginUsername));
        report.put("failed_logins_by_ip", countBy(failed, ActivityEvent::getIpAddress));
        return report;
    }

    public Map<String, Object> subjectAccess(String subjectId, List<AccessEvent> events, DateRange range, ZoneId zone) {
        List<AccessEvent> subjectEvents = events.stream()
                .filter(e -> subjectId.equals(e.getSubjectId()))
                .toList();

        Map<String, Map<String, Object>> byUser = new TreeMap<>();
        for (AccessEvent event : subjectEvents) {
            String key = event.getActorId() != null ? event.getActorId() : "anonymous";
            Map<String, Object> entry = byUser.computeIfAbsent(key, k -> {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("actor_id", event.getActorId());
                m.put("username", event.getActorUsername());
                m.put("role", event.getActorRole());
                m.put("count", 0L);
                return m;
            });
            entry.put("count", (Long) entry.get("count") + 1);
        }

        Map<String, Long> trend = new TreeMap<>();
        for (AccessEvent event : subjectEvents) {
            String day = Instant.ofEpochMilli(event.getTimestamp()).atZone(zone).toLocalDate().toString();
            trend.merge(day, 1L, Long::sum);
        }
        List<Map<String, Object>> accessTrend = new ArrayList<>();
        trend.forEach((day, count) -> {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("date", day);
            point.put("count", count);
            accessTrend.add(point);
        });

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("subject_id", subjectId);
        report.put("report_period", period(range));
        report.put("total_accesses", subjectEvents.size());
        report.put("missing_reason", subjectEvents.stream().filter(AccessEvent::isMissingReason).count());
        report.put("access_by_type", countBy(subjectEvents, e -> name(e.getAccessType())));
        report.put("access_by_user", new ArrayList<>(byUser.values()));
        report.put("access_by_record_type", countBy(subjectEvents, AccessEvent::getRecordType));
        report.put("access_trend", accessTrend);
        return report;
    }

    /**
     * Minimum-necessary review: actors above twice the mean access count, providers touching
     * patients outside their caseload, and (actor, hour) buckets with many distinct patients.
     */
    public Map<String, Object> minimumNecessary(List<AccessEvent> events, DateRange range,
                                                Function<String, Set<String>> caseloadLookup,
                                                Set<String> providerRoles, int rapidSubjectThreshold,
                                                ZoneId zone) {
        Map<String, List<AccessEvent>> byActor = new TreeMap<>();
        for (AccessEvent event : events) {
            if (event.getActorId() == null) continue;
            byActor.computeIfAbsent(event.getActorId(), k -> new ArrayList<>()).add(event);
        }
        double average = byActor.isEmpty() ? 0.0
                : byActor.values().stream().mapToInt(List::size).sum() / (double) byActor.size();

        List<Map<String, Object>> highVolume = new ArrayList<>();
        List<Map<String, Object>> unusual = new ArrayList<>();
        List<Map<String, Object>> rapid = new ArrayList<>();

        for (Map.Entry<String, List<AccessEvent>> entry : byActor.entrySet()) {
            String actorId = entry.getKey();
            List<AccessEvent> actorEvents = entry.getValue();
            String username = firstNonNull(actorEvents, AccessEvent::getActorUsername);
            String role = firstNonNull(actorEvents, AccessEvent::getActorRole);

            int count = actorEvents.size();
            if (count > average * 2) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("actor_id", actorId);
                item.put("username", username);
                item.put("access_count", count);
                item.put("times_above_average", average > 0 ? count / average : 0.0);
                highVolume.add(item);
            }

            if (role != null && providerRoles.contains(role.toLowerCase())) {
                Set<String> caseload = caseloadLookup.apply(actorId);
                List<AccessEvent> outside = actorEvents.stream()
                        .filter(e -> e.getSubjectId() != null && !e.isSelfAccess() && !caseload.contains(e.getSubjectId()))
                        .toList();
                if (!outside.isEmpty()) {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("provider_id", actorId);
                    item.put("username", username);
                    item.put("unusual_access_count", outside.size());
                    item.put("unusual_patients_count", distinct(outside, AccessEvent::getSubjectId));
                    unusual.add(item);
                }
            }

            Map<ZonedDateTime, List<AccessEvent>> hours = new TreeMap<>();
            for (AccessEvent event : actorEvents) {
                ZonedDateTime hour = Instant.ofEpochMilli(event.getTimestamp()).atZone(zone).truncatedTo(ChronoUnit.HOURS);
                hours.computeIfAbsent(hour, k -> new ArrayList<>()).add(event);
            }
            hours.forEach((hour, hourEvents) -> {
                long patients = distinct(hourEvents, AccessEvent::getSubjectId);
                if (patients > rapidSubjectThreshold) {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("actor_id", actorId);
                    item.put("hour_start", hour.toOffsetDateTime().toString());
                    item.put("access_count", hourEvents.size());
                    item.put("unique_patients", patients);
                    rapid.add(item);
                }
            });
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("report_period", period(range));
        report.put("total_access_logs", events.size());
        report.put("average_access_per_user", average);
        report.put("high_volume_users", highVolume);
        report.put("unusual_access_patterns", unusual);
        report.put("rapid_access_patterns", rapid);
        return report;
    }

    public Map<String, Object> dataSharing(List<AccessEvent> access, DateRange range) {
        List<AccessEvent> shares = access.stream().filter(e -> e.getAccessType() == AccessType.SHARE).toList();
        List<AccessEvent> exports = access.stream().filter(e -> e.getAccessType() == AccessType.EXPORT).toList();
        List<AccessEvent> disclosures = access.stream()
                .filter(e -> e.getAccessType() != null && e.getAccessType().isDisclosure())
                .toList();

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("report_period", period(range));
        report.put("phi_sharing_events", shares.size());
        report.put("phi_export_events", exports.size());
        report.put("total_disclosures", disclosures.size());
        report.put("sharing_by_user", countBy(disclosures,
                e -> e.getActorUsername() != null ? e.getActorUsername() : e.getActorId()));
        report.put("sharing_by_role", countBy(disclosures, AccessEvent::getActorRole));
        report.put("sharing_by_record_type", countBy(disclosures, AccessEvent::getRecordType));
        return report;
    }

    /**
     * Dashboard bundle. Lists must cover at least the 60 days before {@code now}.
     */
    public Map<String, Object> dashboardMetrics(List<AccessEvent> access, List<SecurityEvent> security,
                                                List<ActivityEvent> activity, long now, ZoneId zone) {
        LocalDate today = Instant.ofEpochMilli(now).atZone(zone).toLocalDate();
        long todayStart = today.atStartOfDay(zone).toInstant().toEpochMilli();
        long yesterdayStart = today.minusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
        long last7 = now - 7 * DAY_MS;
        long last30 = now - 30 * DAY_MS;
        long prev30 = last30 - 30 * DAY_MS;

        long access30 = count(access, AccessEvent::getTimestamp, last30, now);
        long accessPrev30 = countBefore(access, AccessEvent::getTimestamp, prev30, last30);
        long accessNoReason = access.stream()
                .filter(e -> e.getTimestamp() >= last30 && e.getTimestamp() <= now && e.isMissingReason())
                .count();
        long accessToday = count(access, AccessEvent::getTimestamp, todayStart, now);
        long accessYesterday = countBefore(access, AccessEvent::getTimestamp, yesterdayStart, todayStart);

        Map<String, Object> phi = new LinkedHashMap<>();
        phi.put("today", accessToday);
        phi.put("yesterday", accessYesterday);
        phi.put("day_over_day_delta", delta(accessToday, accessYesterday));
        phi.put("last_7_days", count(access, AccessEvent::getTimestamp, last7, now));
        phi.put("last_30_days", access30);
        phi.put("previous_30_days", accessPrev30);
        phi.put("trend", access30 - accessPrev30);
        phi.put("period_over_period_delta", delta(access30, accessPrev30));
        phi.put("without_reason_count", accessNoReason);
        phi.put("without_reason_ratio", ratio(accessNoReason, access30));

        long security30 = count(security, SecurityEvent::getTimestamp, last30, now);
        long securityPrev30 = countBefore(security, SecurityEvent::getTimestamp, prev30, last30);

        Map<String, Object> sec = new LinkedHashMap<>();
        sec.put("incidents_7d", count(security, SecurityEvent::getTimestamp, last7, now));
        sec.put("incidents_30d", security30);
        sec.put("incidents_previous_30d", securityPrev30);
        sec.put("trend", security30 - securityPrev30);
        sec.put("period_over_period_delta", delta(security30, securityPrev30));
        sec.put("unresolved_critical", security.stream()
                .filter(e -> !e.isResolved() && e.getSeverity() == Severity.CRITICAL).count());
        sec.put("failed_logins_today", security.stream()
                .filter(e -> e.getEventType() == SecurityEventType.LOGIN_FAILED
                        && e.getTimestamp() >= todayStart && e.getTimestamp() <= now)
                .count());

        long activeToday = activeUsers(activity, todayStart, now + 1);
        long activeYesterday = activeUsers(activity, yesterdayStart, todayStart);

        Map<String, Object> users = new LinkedHashMap<>();
        users.put("active_users_today", activeToday);
        users.put("active_users_yesterday", activeYesterday);
        users.put("change", activeToday - activeYesterday);
        users.put("day_over_day_delta", delta(activeToday, activeYesterday));

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("generated_at", Instant.ofEpochMilli(now).toString());
        metrics.put("phi_access", phi);
        metrics.put("security", sec);
        metrics.put("user_activity", users);
        return metrics;
    }

    /**
     * Period-over-period change: (current - previous) / previous, or 0 when previous is 0.
     */
    public static double delta(long current, long previous) {
        if (previous == 0) return 0.0;
        return (current - previous) / (double) previous;
    }

    static Map<String, Object> period(DateRange range) {
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("start_date", range.start().toString());
        period.put("end_date", range.end().toString());
        return period;
    }

    private static double ratio(long part, long total) {
        return total == 0 ? 0.0 : part / (double) total;
    }

    private static <T> Map<String, Long> countBy(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.groupingBy(
                item -> Objects.requireNonNullElse(key.apply(item), "unknown"),
                TreeMap::new,
                Collectors.counting()));
    }

    private static <T> long distinct(List<T> items, Function<T, String> key) {
        return items.stream().map(key).filter(Objects::nonNull).collect(Collectors.toCollection(TreeSet::new)).size();
    }

    private static <T> String firstNonNull(List<T> items, Function<T, String> key) {
        return items.stream().map(key).filter(Objects::nonNull).findFirst().orElse(null);
    }

    private static <T> long count(List<T> items, java.util.function.ToLongFunction<T> ts, long from, long to) {
        return items.stream().filter(inRange(ts, from, to)).count();
    }

    private static <T> long countBefore(List<T> items, java.util.function.ToLongFunction<T> ts, long from, long toExclusive) {
        return items.stream().filter(i -> ts.applyAsLong(i) >= from && ts.applyAsLong(i) < toExclusive).count();
    }

    private static <T> Predicate<T> inRange(java.util.function.ToLongFunction<T> ts, long from, long to) {
        return i -> ts.applyAsLong(i) >= from && ts.applyAsLong(i) <= to;
    }

    private static long activeUsers(List<ActivityEvent> activity, long from, long toExclusive) {
        return activity.stream()
                .filter(e -> e.getActorId() != null && e.getTimestamp() >= from && e.getTimestamp() < toExclusive)
                .map(ActivityEvent::getActorId)
                .distinct()
                .count();
    }

    private static String name(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
