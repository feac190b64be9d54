package com.health.compliance.reporting;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.AccessType;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.ReasonStatus;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ReportAggregatorTest {

    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 13));

    private final ReportAggregator aggregator = new ReportAggregator();

    @Test
    void phiAccessSummary_countsMissingReasons() {
        AccessEvent withReason = createAccessEvent("A-1", "U-1", "provider", "P-1", NOW);
        AccessEvent absent = createAccessEvent("A-2", "U-2", "nurse", "P-2", NOW);
        absent.setReasonStatus(ReasonStatus.ABSENT);
        AccessEvent placeholder = createAccessEvent("A-3", "U-2", "nurse", "P-2", NOW);
        placeholder.setReasonStatus(ReasonStatus.PLACEHOLDER);
        AccessEvent withReason2 = createAccessEvent("A-4", "U-1", "provider", "P-3", NOW);

        Map<String, Object> summary = aggregator.phiAccessSummary(
                List.of(withReason, absent, placeholder, withReason2), RANGE);

        assertThat(summary.get("total_accesses")).isEqualTo(4);
        assertThat(summary.get("unique_subjects")).isEqualTo(3L);
        assertThat(summary.get("unique_actors")).isEqualTo(2L);
        assertThat(summary.get("missing_reason")).isEqualTo(2L);
        assertThat(summary.get("missing_reason_ratio")).isEqualTo(0.5);
        assertThat(summary.get("access_by_user_role")).isEqualTo(Map.of("provider", 2L, "nurse", 2L));
        assertThat(summary.get("report_period")).isEqualTo(Map.of("start_date", "2024-03-01", "end_date", "2024-03-13"));
    }

    @Test
    void securityIncidentSummary_averageResolutionOverResolvedOnly() {
        SecurityEvent fast = createSecurityEvent("S-1", SecurityEventType.LOGIN_FAILED, Severity.LOW, true, NOW - DAY);
        SecurityEvent slow = createSecurityEvent("S-2", SecurityEventType.LOGIN_FAILED, Severity.LOW, true, NOW - DAY);
        slow.setResolvedAt(slow.getTimestamp() + 3 * HOUR);
        SecurityEvent open = createSecurityEvent("S-3", SecurityEventType.UNUSUAL_ACTIVITY, Severity.CRITICAL, false, NOW);

        Map<String, Object> summary = aggregator.securityIncidentSummary(List.of(fast, slow, open), RANGE);

        assertThat((double) summary.get("avg_resolution_time_hours")).isCloseTo(2.0, within(1e-9));
        assertThat(summary.get("unresolved_incidents")).isEqualTo(1L);
        assertThat(summary.get("critical_unresolved")).isEqualTo(1L);
    }

    @Test
    void averageResolutionHours_noneResolved_isZero() {
        SecurityEvent open = createSecurityEvent("S-1", SecurityEventType.LOGIN_FAILED, Severity.LOW, false, NOW);

        assertThat(ReportAggregator.averageResolutionHours(List.of(open))).isZero();
        assertThat(ReportAggregator.averageResolutionHours(List.of())).isZero();
    }

    @Test
    void delta_previousZero_isZero() {
        assertThat(ReportAggregator.delta(10, 0)).isZero();
        assertThat(ReportAggregator.delta(15, 10)).isEqualTo(0.5);
        assertThat(ReportAggregator.delta(5, 10)).isEqualTo(-0.5);
    }

    @Test
    void minimumNecessary_flagsActorsAboveTwiceMean() {
        List<AccessEvent> events = new ArrayList<>();
        events.addAll(createAccessBurst("U-heavy", "provider", 30, NOW));
        events.addAll(createAccessBurst("U-a", "provider", 2, NOW - 2 * HOUR));
        events.addAll(createAccessBurst("U-b", "provider", 2, NOW - 3 * HOUR));
        events.addAll(createAccessBurst("U-c", "provider", 2, NOW - 4 * HOUR));

        Map<String, Object> report = aggregator.minimumNecessary(events, RANGE,
                actor -> Set.of("P-0", "P-1"), Set.of("provider"), 10, ZoneOffset.UTC);

        // mean = 36 / 4 = 9; only 30 exceeds 18
        assertThat(report.get("average_access_per_user")).isEqualTo(9.0);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> highVolume = (List<Map<String, Object>>) report.get("high_volume_users");
        assertThat(highVolume).hasSize(1);
        assertThat(highVolume.get(0)).containsEntry("actor_id", "U-heavy").containsEntry("access_count", 30);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> unusual = (List<Map<String, Object>>) report.get("unusual_access_patterns");
        assertThat(unusual).extracting(m -> m.get("provider_id")).containsExactly("U-heavy");
        assertThat(unusual.get(0)).containsEntry("unusual_access_count", 28);

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rapid = (List<Map<String, Object>>) report.get("rapid_access_patterns");
        assertThat(rapid).isNotEmpty();
        assertThat(rapid).allSatisfy(item -> assertThat(item.get("actor_id")).isEqualTo("U-heavy"));
    }

    @Test
    void minimumNecessary_nonProvidersNeverCheckedAgainstCaseload() {
        List<AccessEvent> events = createAccessBurst("U-nurse", "nurse", 3, NOW);

        Map<String, Object> report = aggregator.minimumNecessary(events, RANGE,
                actor -> { throw new AssertionError("caseload looked up for " + actor); },
                Set.of("provider"), 10, ZoneOffset.UTC);

        assertThat((List<?>) report.get("unusual_access_patterns")).isEmpty();
    }

    @Test
    void subjectAccess_groupsByUserAndDay() {
        AccessEvent first = createAccessEvent("A-1", "U-1", "provider", "P-7", NOW - DAY);
        AccessEvent second = createAccessEvent("A-2", "U-1", "provider", "P-7", NOW);
        AccessEvent other = createAccessEvent("A-3", "U-2", "nurse", "P-8", NOW);

        Map<String, Object> report = aggregator.subjectAccess("P-7", List.of(first, second, other), RANGE, ZoneOffset.UTC);

        assertThat(report.get("total_accesses")).isEqualTo(2);
        assertThat((List<?>) report.get("access_by_user")).hasSize(1);
        assertThat(report.get("access_trend")).isEqualTo(List.of(
                Map.of("date", "2024-03-12", "count", 1L),
                Map.of("date", "2024-03-13", "count", 1L)));
    }

    @Test
    void dataSharing_countsSharesAndExports() {
        AccessEvent share = createAccessEvent("A-1", "U-1", "provider", "P-1", NOW);
        share.setAccessType(AccessType.SHARE);
        AccessEvent export = createAccessEvent("A-2", "U-2", "admin", "P-2", NOW);
        export.setAccessType(AccessType.EXPORT);
        AccessEvent view = createAccessEvent("A-3", "U-1", "provider", "P-1", NOW);

        Map<String, Object> report = aggregator.dataSharing(List.of(share, export, view), RANGE);

        assertThat(report.get("phi_sharing_events")).isEqualTo(1);
        assertThat(report.get("phi_export_events")).isEqualTo(1);
        assertThat(report.get("total_disclosures")).isEqualTo(2);
    }

    @Test
    void systemAccess_splitsFailedLogins() {
        ActivityEvent ok = createActivityEvent("E-1", "U-1", ActivityEventType.LOGIN, NOW);
        ActivityEvent failed = createFailedLogin("mallory", "203.0.113.7", NOW);
        ActivityEvent logout = createActivityEvent("E-2", "U-1", ActivityEventType.LOGOUT, NOW);

        Map<String, Object> report = aggregator.systemAccess(List.of(ok, failed, logout), RANGE);

        assertThat(report.get("login_attempts")).isEqualTo(2);
        assertThat(report.get("failed_logins")).isEqualTo(1);
        assertThat(report.get("logouts")).isEqualTo(1L);
        assertThat(report.get("failed_logins_by_ip")).isEqualTo(Map.of("203.0.113.7", 1L));
    }

    @Test
    void dashboardMetrics_dayOverDayAndPeriodDeltas() {
        List<AccessEvent> access = new ArrayList<>();
        access.add(createAccessEvent("A-1", "U-1", "provider", "P-1", NOW - HOUR));
        access.add(createAccessEvent("A-2", "U-1", "provider", "P-1", NOW - 2 * HOUR));
        access.add(createAccessEvent("A-3", "U-1", "provider", "P-1", NOW - DAY));
        access.add(createAccessEvent("A-4", "U-1", "provider", "P-1", NOW - 40 * DAY));
        SecurityEvent critical = createSecurityEvent("S-1", SecurityEventType.UNUSUAL_ACTIVITY,
                Severity.CRITICAL, false, NOW - HOUR);

        Map<String, Object> metrics = aggregator.dashboardMetrics(access, List.of(critical),
                List.of(createActivityEvent("E-1", "U-1", ActivityEventType.READ, NOW - HOUR)), NOW, ZoneOffset.UTC);

        @SuppressWarnings("unchecked")
        Map<String, Object> phi = (Map<String, Object>) metrics.get("phi_access");
        assertThat(phi.get("today")).isEqualTo(2L);
        assertThat(phi.get("yesterday")).isEqualTo(1L);
        assertThat(phi.get("day_over_day_delta")).isEqualTo(1.0);
        assertThat(phi.get("last_30_days")).isEqualTo(3L);
        assertThat(phi.get("previous_30_days")).isEqualTo(1L);
        assertThat(phi.get("trend")).isEqualTo(2L);

        @SuppressWarnings("unchecked")
        Map<String, Object> security = (Map<String, Object>) metrics.get("security");
        assertThat(security.get("unresolved_critical")).isEqualTo(1L);
        assertThat(security.get("period_over_period_delta")).isEqualTo(0.0);

        @SuppressWarnings("unchecked")
        Map<String, Object> users = (Map<String, Object>) metrics.get("user_activity");
        assertThat(users.get("active_users_today")).isEqualTo(1L);
        assertThat(users.get("day_over_day_delta")).isEqualTo(0.0);
    }
}
