package com.health.compliance.reporting;

import com.health.compliance.exception.ReportNotFoundException;
import com.health.compliance.model.ArtifactFormat;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.ReportRequest;
import com.health.compliance.model.ReportType;
import com.health.compliance.repository.ComplianceReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Accepts report requests, de-duplicates them by content and hands new jobs to the runner.
 */
@Service
public class ReportSchedulingService {

    private static final Logger log = LoggerFactory.getLogger(ReportSchedulingService.class);

    private final ComplianceReportRepository reportRepository;
    private final ComplianceReportService reportService;
    private final ReportJobRunner jobRunner;

    public ReportSchedulingService(ComplianceReportRepository reportRepository,
                                   ComplianceReportService reportService,
                                   ReportJobRunner jobRunner) {
        this.reportRepository = reportRepository;
        this.reportService = reportService;
        this.jobRunner = jobRunner;
    }

    /**
     * @throws IllegalArgumentException on an unknown report type or format, or bad dates
     */
    public ComplianceReport schedule(ReportRequest request) {
        if (request.getReportType() == null || request.getReportType().isBlank()) {
            throw new IllegalArgumentException("reportType is required");
        }
        ReportType type = parseEnum(ReportType.class, "reportType", request.getReportType());
        ArtifactFormat format = request.getFormat() != null && !request.getFormat().isBlank()
                ? parseEnum(ArtifactFormat.class, "format", request.getFormat())
                : type.getDefaultFormat();
        DateRange range = DateRange.parse(request.getStartDate(), request.getEndDate(),
                reportService.today(), defaultDays(type));

        return schedule(type, range, format, request.getRequestedBy(), request.getParameters());
    }

    /**
     * Schedule a report. Re-submitting the same type, range, format and parameters returns the
     * existing job unless it failed.
     */
    public ComplianceReport schedule(ReportType type, DateRange range, ArtifactFormat format,
                                     String requestedBy, Map<String, String> parameters) {
        Map<String, String> params = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        String key = idempotencyKey(type, range, format, params);

        Optional<ComplianceReport> existing = reportRepository.findByIdempotencyKey(key).stream()
                .filter(r -> r.getStatus() != JobStatus.FAILED)
                .findFirst();
        if (existing.isPresent()) {
            log.info("Report request matches job {} ({}), not scheduling again",
                    existing.get().getReportId(), existing.get().getStatus());
            return existing.get();
        }

        long now = System.currentTimeMillis();
        ComplianceReport report = ComplianceReport.builder()
                .reportId(UUID.randomUUID().toString())
                .reportType(type)
                .reportDate(reportService.today())
                .startDate(range.start())
                .endDate(range.end())
                .requestedBy(requestedBy)
                .status(JobStatus.PENDING)
                .format(format)
                .parameters(params)
                .createdAt(now)
                .updatedAt(now)
                .idempotencyKey(key)
                .build();
        reportRepository.create(report);
        log.info("Scheduled {} report {} for {} to {}", type, report.getReportId(), range.start(), range.end());

        try {
            jobRunner.runReport(report.getReportId());
        } catch (RuntimeException e) {
            log.error("Could not enqueue report {}: {}", report.getReportId(), e.getMessage());
            reportRepository.transition(report.getReportId(), JobStatus.PENDING, JobStatus.FAILED, null,
                    "Could not enqueue: " + e.getMessage());
            report.setStatus(JobStatus.FAILED);
        }
        return report;
    }

    public ComplianceReport get(String reportId) {
        ComplianceReport report = reportRepository.findById(reportId);
        if (report == null) {
            throw new ReportNotFoundException(reportId);
        }
        return report;
    }

    public List<ComplianceReport> list(int limit) {
        return reportRepository.findRecent(limit);
    }

    static String idempotencyKey(ReportType type, DateRange range, ArtifactFormat format, Map<String, String> params) {
        StringBuilder sb = new StringBuilder()
                .append(type).append('|')
                .append(range.start()).append('|')
                .append(range.end()).append('|')
                .append(format);
        new TreeMap<>(params).forEach((k, v) -> sb.append('|').append(k).append('=').append(v));
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    static int defaultDays(ReportType type) {
        return switch (type) {
            case DAILY_AUDIT -> 1;
            case WEEKLY_AUDIT -> 7;
            default -> 30;
        };
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String parameter, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + parameter + " '" + value + "'");
        }
    }
}
