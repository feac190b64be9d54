package com.health.compliance.reporting;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.config.ReportingConfig;
import com.health.compliance.engine.CaseloadDirectory;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.repository.ComplianceReportRepository;
import com.health.compliance.repository.SecurityEventRepository;
import com.health.compliance.service.RiskScoringService;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads the log streams for a date range and builds report documents. Used both by the
 * asynchronous report jobs and by the on-demand report endpoints.
 */
@Service
public class ComplianceReportService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceReportService.class);

    private static final long DAY_MS = 86_400_000L;
    static final Set<String> CUSTOM_SECTIONS = Set.of(
            "phi_access", "security_incidents", "user_activity", "system_access", "data_sharing");
    static final String DEFAULT_CUSTOM_SECTIONS = "phi_access,security_incidents";

    private final ActivityEventRepository activityEventRepository;
    private final AccessEventRepository accessEventRepository;
    private final SecurityEventRepository securityEventRepository;
    private final ComplianceReportRepository complianceReportRepository;
    private final RiskScoringService riskScoringService;
    private final CaseloadDirectory caseloadDirectory;
    private final ReportAggregator aggregator;
    private final DetectionConfig detectionConfig;
    private final ReportingConfig reportingConfig;

    public ComplianceReportService(ActivityEventRepository activityEventRepository,
                                   AccessEventRepository accessEventRepository,
                                   SecurityEventRepository securityEventRepository,
                                   ComplianceReportRepository complianceReportRepository,
                                   RiskScoringService riskScoringService,
                                   CaseloadDirectory caseloadDirectory,
                                   ReportAggregator aggregator,
                                   DetectionConfig detectionConfig,
                                   ReportingConfig reportingConfig) {
        this.activityEventRepository = activityEventRepository;
        this.accessEventRepository = accessEventRepository;
        this.securityEventRepository = securityEventRepository;
        this.complianceReportRepository = complianceReportRepository;
        this.riskScoringService = riskScoringService;
        this.caseloadDirectory = caseloadDirectory;
        this.aggregator = aggregator;
        this.detectionConfig = detectionConfig;
        this.reportingConfig = reportingConfig;
    }

    public ZoneId zone() {
        return ZoneId.of(reportingConfig.getZoneId());
    }

    public LocalDate today() {
        return LocalDate.now(zone());
    }

    /**
     * Build the document for a scheduled report job.
     *
     * @throws IllegalArgumentException if the report's parameters are incomplete for its type
     */
    @Observed(name = "report.build", contextualName = "report-build")
    public Map<String, Object> buildDocument(ComplianceReport report, long now) {
        DateRange range = new DateRange(report.getStartDate(), report.getEndDate());
        Map<String, String> params = report.getParameters() != null ? report.getParameters() : Map.of();

        Map<String, Object> body = switch (report.getReportType()) {
            case DAILY_AUDIT, WEEKLY_AUDIT -> aggregator.auditSummary(
                    activity(range), access(range), security(range), range);
            case PHI_ACCESS -> aggregator.phiAccessSummary(access(range), range);
            case SECURITY_INCIDENTS -> aggregator.securityIncidentSummary(security(range), range);
            case USER_ACTIVITY -> aggregator.userActivity(activity(range), range);
            case SYSTEM_ACCESS -> aggregator.systemAccess(activity(range), range);
            case SUBJECT_ACCESS -> subjectAccess(requireParam(params, "subjectId"), range);
            case MINIMUM_NECESSARY -> minimumNecessary(range);
            case DATA_SHARING -> aggregator.dataSharing(access(range), range);
            case RISK_ASSESSMENT -> riskAssessment(now);
            case DASHBOARD_METRICS -> dashboardMetrics(now);
            case CUSTOM -> custom(params, range);
        };

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("report_id", report.getReportId());
        document.put("report_type", report.getReportType().name());
        document.put("generated_at", Instant.ofEpochMilli(now).toString());
        document.putAll(body);
        return document;
    }

    public Map<String, Object> subjectAccess(String subjectId, DateRange range) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId is required");
        }
        LogQuery query = LogQuery.builder()
                .subjectId(subjectId)
                .from(range.startMillis(zone()))
                .to(range.endMillis(zone()))
                .build();
        return aggregator.subjectAccess(subjectId, accessEventRepository.findAll(query), range, zone());
    }

    public Map<String, Object> minimumNecessary(DateRange range) {
        Set<String> providerRoles = detectionConfig.toSettings().getProviderRoles();
        return aggregator.minimumNecessary(access(range), range, caseloadDirectory::caseloadOf,
                providerRoles, reportingConfig.getRapidSubjectThreshold(), zone());
    }

    public Map<String, Object> dataSharing(DateRange range) {
        return aggregator.dataSharing(access(range), range);
    }

    public Map<String, Object> riskAssessment(long now) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("risk_assessment", riskScoringService.assess(now));
        return document;
    }

    public Map<String, Object> dashboardMetrics(long now) {
        LogQuery last60 = LogQuery.between(now - 60 * DAY_MS, now);
        return aggregator.dashboardMetrics(
                accessEventRepository.findAll(last60),
                securityEventRepository.findAll(last60),
                activityEventRepository.findAll(LogQuery.between(now - 2 * DAY_MS, now)),
                now, zone());
    }

    /**
     * Compliance dashboard: 30-day PHI and security summaries, open incident counts, audit volume
     * and the most recent reports.
     */
    public Map<String, Object> complianceDashboard(long now) {
        LocalDate today = Instant.ofEpochMilli(now).atZone(zone()).toLocalDate();
        DateRange last30 = DateRange.lastDays(today, 30);

        List<SecurityEvent> security = security(last30);
        List<SecurityEvent> unresolved = securityEventRepository.findAll(
                LogQuery.builder().resolved(false).build());

        Map<String, Object> auditVolume = new LinkedHashMap<>();
        auditVolume.put("last_30_days", activityEventRepository.findAll(LogQuery.between(now - 30 * DAY_MS, now)).size());
        auditVolume.put("last_90_days", activityEventRepository.findAll(LogQuery.between(now - 90 * DAY_MS, now)).size());

        List<Map<String, Object>> recentReports = new ArrayList<>();
        for (ComplianceReport report : complianceReportRepository.findRecent(reportingConfig.getRecentReportLimit())) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("report_id", report.getReportId());
            item.put("report_type", report.getReportType() != null ? report.getReportType().name() : null);
            item.put("report_date", report.getReportDate() != null ? report.getReportDate().toString() : null);
            item.put("status", report.getStatus().name());
            recentReports.add(item);
        }

        Map<String, Object> dashboard = new LinkedHashMap<>();
        dashboard.put("phi_access", aggregator.phiAccessSummary(access(last30), last30));
        dashboard.put("security_incidents", aggregator.securityIncidentSummary(security, last30));
        dashboard.put("unresolved_incidents", unresolved.size());
        dashboard.put("critical_unresolved", unresolved.stream()
                .filter(e -> e.getSeverity() == Severity.CRITICAL).count());
        dashboard.put("audit_events", auditVolume);
        dashboard.put("recent_reports", recentReports);
        return dashboard;
    }

    private Map<String, Object> custom(Map<String, String> params, DateRange range) {
        String requested = params.getOrDefault("sections", DEFAULT_CUSTOM_SECTIONS);
        List<String> sections = Arrays.stream(requested.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .toList();
        for (String section : sections) {
            if (!CUSTOM_SECTIONS.contains(section)) {
                throw new IllegalArgumentException("Unknown report section '" + section
                        + "'; supported sections are " + CUSTOM_SECTIONS);
            }
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("report_period", ReportAggregator.period(range));
        for (String section : sections) {
            Map<String, Object> content = switch (section) {
                case "phi_access" -> aggregator.phiAccessSummary(access(range), range);
                case "security_incidents" -> aggregator.securityIncidentSummary(security(range), range);
                case "user_activity" -> aggregator.userActivity(activity(range), range);
                case "system_access" -> aggregator.systemAccess(activity(range), range);
                default -> aggregator.dataSharing(access(range), range);
            };
            document.put(section, content);
        }
        log.debug("Built custom report with sections {}", sections);
        return document;
    }

    private List<ActivityEvent> activity(DateRange range) {
        return activityEventRepository.findAll(LogQuery.between(range.startMillis(zone()), range.endMillis(zone())));
    }

    private List<AccessEvent> access(DateRange range) {
        return accessEventRepository.findAll(LogQuery.between(range.startMillis(zone()), range.endMillis(zone())));
    }

    private List<SecurityEvent> security(DateRange range) {
        return securityEventRepository.findAll(LogQuery.between(range.startMillis(zone()), range.endMillis(zone())));
    }

    private static String requireParam(Map<String, String> params, String name) {
        String value = params.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Parameter '" + name + "' is required for this report type");
        }
        return value;
    }
}
