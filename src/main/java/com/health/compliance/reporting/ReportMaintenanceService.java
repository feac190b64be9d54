package com.health.compliance.reporting;

import com.health.compliance.config.MetricsConfig;
import com.health.compliance.config.ReportingConfig;
import com.health.compliance.model.ArtifactFormat;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.DataExport;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.ReportType;
import com.health.compliance.repository.ComplianceReportRepository;
import com.health.compliance.repository.DataExportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Background upkeep of the reporting pipeline: the weekly audit report, failing jobs stuck in
 * PROCESSING, flagging reports due for renewal, and picking up pending jobs after a restart.
 */
@Service
public class ReportMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(ReportMaintenanceService.class);

    private static final long MINUTE_MS = 60_000L;
    private static final long DAY_MS = 86_400_000L;

    private final ComplianceReportRepository reportRepository;
    private final DataExportRepository exportRepository;
    private final ReportSchedulingService schedulingService;
    private final ComplianceReportService reportService;
    private final ReportJobRunner jobRunner;
    private final ReportingConfig reportingConfig;
    private final MetricsConfig metricsConfig;

    public ReportMaintenanceService(ComplianceReportRepository reportRepository,
                                    DataExportRepository exportRepository,
                                    ReportSchedulingService schedulingService,
                                    ComplianceReportService reportService,
                                    ReportJobRunner jobRunner,
                                    ReportingConfig reportingConfig,
                                    MetricsConfig metricsConfig) {
        this.reportRepository = reportRepository;
        this.exportRepository = exportRepository;
        this.schedulingService = schedulingService;
        this.reportService = reportService;
        this.jobRunner = jobRunner;
        this.reportingConfig = reportingConfig;
        this.metricsConfig = metricsConfig;
    }

    @Scheduled(cron = "${audit.reporting.weekly-report.cron:0 0 6 * * MON}",
            zone = "${audit.reporting.zone-id:UTC}")
    public void generateWeeklyReport() {
        if (!reportingConfig.getWeeklyReport().isEnabled()) {
            return;
        }
        LocalDate yesterday = reportService.today().minusDays(1);
        DateRange range = DateRange.lastDays(yesterday, 7);
        try {
            ComplianceReport report = schedulingService.schedule(ReportType.WEEKLY_AUDIT, range,
                    ArtifactFormat.CSV, null, Map.of());
            log.info("Weekly audit report {} for {} to {}", report.getReportId(), range.start(), range.end());
        } catch (Exception e) {
            log.error("Weekly audit report scheduling failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRateString = "${audit.reporting.stale-sweep-interval-minutes:5}",
            initialDelayString = "${audit.reporting.stale-sweep-interval-minutes:5}",
            timeUnit = TimeUnit.MINUTES)
    public void sweepStaleJobs() {
        try {
            int failed = failStaleJobs(System.currentTimeMillis());
            metricsConfig.updateStaleJobCount(failed);
        } catch (Exception e) {
            log.error("Stale job sweep failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Fail every report and export that has sat in PROCESSING longer than the stale limit.
     *
     * @return number of jobs failed
     */
    public int failStaleJobs(long now) {
        long staleBefore = now - reportingConfig.getStaleAfterMinutes() * MINUTE_MS;
        String message = "Stale: no progress for " + reportingConfig.getStaleAfterMinutes() + " minutes";
        int failed = 0;

        for (ComplianceReport report : reportRepository.findByStatus(JobStatus.PROCESSING)) {
            if (report.getUpdatedAt() < staleBefore
                    && reportRepository.transition(report.getReportId(), JobStatus.PROCESSING, JobStatus.FAILED, null, message)) {
                log.warn("Report {} ({}) was stale in PROCESSING, marked FAILED", report.getReportId(), report.getReportType());
                metricsConfig.recordJobOutcome("report", "stale");
                failed++;
            }
        }
        for (DataExport export : exportRepository.findByStatus(JobStatus.PROCESSING)) {
            if (export.getUpdatedAt() < staleBefore
                    && exportRepository.transition(export.getExportId(), JobStatus.PROCESSING, JobStatus.FAILED, null, message)) {
                log.warn("Export {} ({}) was stale in PROCESSING, marked FAILED", export.getExportId(), export.getStream());
                metricsConfig.recordJobOutcome("export", "stale");
                failed++;
            }
        }
        return failed;
    }

    @Scheduled(cron = "${audit.reporting.expiry.cron:0 30 6 * * *}",
            zone = "${audit.reporting.zone-id:UTC}")
    public void checkExpiredReports() {
        if (!reportingConfig.getExpiry().isEnabled()) {
            return;
        }
        try {
            List<ComplianceReport> expired = findExpiredReports(System.currentTimeMillis());
            for (ComplianceReport report : expired) {
                log.warn("Compliance report {} ({}, {}) is older than {} days and due for renewal",
                        report.getReportId(), report.getReportType(), report.getReportDate(),
                        reportingConfig.getExpiry().getRenewalDays());
            }
            log.info("Report expiry check: {} report(s) due for renewal", expired.size());
        } catch (Exception e) {
            log.error("Report expiry check failed: {}", e.getMessage(), e);
        }
    }

    public List<ComplianceReport> findExpiredReports(long now) {
        return reportRepository.findCompletedBefore(now - reportingConfig.getExpiry().getRenewalDays() * DAY_MS);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeAfterRestart() {
        if (!reportingConfig.isResumePendingOnStartup()) {
            return;
        }
        try {
            int stale = failStaleJobs(System.currentTimeMillis());
            List<ComplianceReport> pendingReports = reportRepository.findByStatus(JobStatus.PENDING);
            List<DataExport> pendingExports = exportRepository.findByStatus(JobStatus.PENDING);
            pendingReports.forEach(r -> jobRunner.runReport(r.getReportId()));
            pendingExports.forEach(e -> jobRunner.runExport(e.getExportId()));
            log.info("Startup: resumed {} pending report(s) and {} pending export(s), failed {} stale job(s)",
                    pendingReports.size(), pendingExports.size(), stale);
        } catch (Exception e) {
            log.error("Resuming pending jobs failed: {}", e.getMessage(), e);
        }
    }
}
