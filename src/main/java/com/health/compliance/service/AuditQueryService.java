package com.health.compliance.service;

import com.health.compliance.config.ReportingConfig;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.PagedResponse;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.repository.SecurityEventRepository;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only query surface over the three log streams. Filters arrive as the same string map an
 * export request carries, so a query and an export with equal filters select the same records.
 */
@Service
public class AuditQueryService {

    static final int MAX_PAGE_SIZE = 500;

    private final ActivityEventRepository activityEventRepository;
    private final AccessEventRepository accessEventRepository;
    private final SecurityEventRepository securityEventRepository;
    private final ReportingConfig reportingConfig;

    public AuditQueryService(ActivityEventRepository activityEventRepository,
                             AccessEventRepository accessEventRepository,
                             SecurityEventRepository securityEventRepository,
                             ReportingConfig reportingConfig) {
        this.activityEventRepository = activityEventRepository;
        this.accessEventRepository = accessEventRepository;
        this.securityEventRepository = securityEventRepository;
        this.reportingConfig = reportingConfig;
    }

    public PagedResponse<ActivityEvent> findActivity(Map<String, String> filters, int limit, String before) {
        return activityEventRepository.find(toQuery(filters), clamp(limit), before);
    }

    public PagedResponse<AccessEvent> findAccess(Map<String, String> filters, int limit, String before) {
        return accessEventRepository.find(toQuery(filters), clamp(limit), before);
    }

    public PagedResponse<SecurityEvent> findSecurity(Map<String, String> filters, int limit, String before) {
        return securityEventRepository.find(toQuery(filters), clamp(limit), before);
    }

    public ActivityEvent getActivity(String eventId) {
        return activityEventRepository.findById(eventId);
    }

    public AccessEvent getAccess(String eventId) {
        return accessEventRepository.findById(eventId);
    }

    public SecurityEvent getSecurity(String eventId) {
        return securityEventRepository.findById(eventId);
    }

    public Map<String, Object> activitySummary(int days) {
        DateRange range = lastDays(days);
        List<ActivityEvent> events = activityEventRepository.findAll(between(range));

        Map<String, Object> summary = header(range, events.size());
        summary.put("by_event_type", countBy(events, e -> e.getEventType() != null ? e.getEventType().name() : null));
        summary.put("by_resource_type", countBy(events, ActivityEvent::getResourceType));
        summary.put("by_actor", countBy(events, ActivityEvent::getActorId));
        summary.put("by_role", countBy(events, ActivityEvent::getActorRole));
        return summary;
    }

    public Map<String, Object> accessSummary(int days) {
        DateRange range = lastDays(days);
        List<AccessEvent> events = accessEventRepository.findAll(between(range));

        Map<String, Object> summary = header(range, events.size());
        summary.put("by_access_type", countBy(events, e -> e.getAccessType() != null ? e.getAccessType().name() : null));
        summary.put("by_record_type", countBy(events, AccessEvent::getRecordType));
        summary.put("by_actor", countBy(events, AccessEvent::getActorId));
        summary.put("by_role", countBy(events, AccessEvent::getActorRole));
        summary.put("missing_reason", events.stream().filter(AccessEvent::isMissingReason).count());
        summary.put("unique_subjects", events.stream().map(AccessEvent::getSubjectId)
                .filter(Objects::nonNull).distinct().count());
        return summary;
    }

    public Map<String, Object> securitySummary(int days) {
        DateRange range = lastDays(days);
        List<SecurityEvent> events = securityEventRepository.findAll(between(range));

        Map<String, Object> summary = header(range, events.size());
        summary.put("by_event_type", countBy(events, e -> e.getEventType() != null ? e.getEventType().name() : null));
        summary.put("by_severity", countBy(events, e -> e.getSeverity() != null ? e.getSeverity().name() : null));
        summary.put("unresolved", events.stream().filter(e -> !e.isResolved()).count());
        summary.put("critical_unresolved", events.stream()
                .filter(e -> !e.isResolved() && e.getSeverity() == Severity.CRITICAL).count());
        return summary;
    }

    private LogQuery toQuery(Map<String, String> filters) {
        return LogQuery.fromFilters(filters, zone());
    }

    private LogQuery between(DateRange range) {
        return LogQuery.between(range.startMillis(zone()), range.endMillis(zone()));
    }

    private DateRange lastDays(int days) {
        return DateRange.lastDays(LocalDate.now(zone()), days);
    }

    private ZoneId zone() {
        return ZoneId.of(reportingConfig.getZoneId());
    }

    private static Map<String, Object> header(DateRange range, int total) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("start_date", range.start().toString());
        summary.put("end_date", range.end().toString());
        summary.put("total", total);
        return summary;
    }

    private static <T> Map<String, Long> countBy(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.groupingBy(
                item -> Objects.requireNonNullElse(key.apply(item), "unknown"),
                TreeMap::new,
                Collectors.counting()));
    }

    private static int clamp(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        return Math.min(limit, MAX_PAGE_SIZE);
    }
}
