package com.health.compliance.reporting;

import com.health.compliance.config.MetricsConfig;
import com.health.compliance.model.ArtifactFormat;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.DataExport;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.LogQuery;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.repository.ComplianceReportRepository;
import com.health.compliance.repository.DataExportRepository;
import com.health.compliance.repository.SecurityEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Executes report and export jobs off the request thread. Every job that this runner claims ends
 * in COMPLETED with an artifact or in FAILED with the error message.
 */
@Component
public class ReportJobRunner {

    private static final Logger log = LoggerFactory.getLogger(ReportJobRunner.class);

    private final ComplianceReportRepository reportRepository;
    private final DataExportRepository exportRepository;
    private final ActivityEventRepository activityEventRepository;
    private final AccessEventRepository accessEventRepository;
    private final SecurityEventRepository securityEventRepository;
    private final ComplianceReportService reportService;
    private final ArtifactStore artifactStore;
    private final MetricsConfig metricsConfig;
    private final ReportRenderer reportRenderer = new ReportRenderer();

    public ReportJobRunner(ComplianceReportRepository reportRepository,
                           DataExportRepository exportRepository,
                           ActivityEventRepository activityEventRepository,
                           AccessEventRepository accessEventRepository,
                           SecurityEventRepository securityEventRepository,
                           ComplianceReportService reportService,
                           ArtifactStore artifactStore,
                           MetricsConfig metricsConfig) {
        this.reportRepository = reportRepository;
        this.exportRepository = exportRepository;
        this.activityEventRepository = activityEventRepository;
        this.accessEventRepository = accessEventRepository;
        this.securityEventRepository = securityEventRepository;
        this.reportService = reportService;
        this.artifactStore = artifactStore;
        this.metricsConfig = metricsConfig;
    }

    @Async
    public void runReport(String reportId) {
        if (!reportRepository.transition(reportId, JobStatus.PENDING, JobStatus.PROCESSING, null, null)) {
            log.info("Report {} was not pending, another runner owns it", reportId);
            return;
        }

        try {
            ComplianceReport report = reportRepository.findById(reportId);
            if (report == null) {
                throw new IllegalStateException("Report " + reportId + " disappeared while processing");
            }
            ArtifactFormat format = report.getFormat() != null
                    ? report.getFormat() : report.getReportType().getDefaultFormat();

            long started = System.currentTimeMillis();
            String content = reportRenderer.render(reportService.buildDocument(report, started), format);
            String path = artifactStore.write("report_" + report.getReportType().name().toLowerCase(),
                    reportId, format, content);

            String notes = report.getReportType() + " report for " + report.getStartDate() + " to " + report.getEndDate();
            if (reportRepository.transition(reportId, JobStatus.PROCESSING, JobStatus.COMPLETED, path, notes)) {
                metricsConfig.recordJobOutcome("report", "completed");
                log.info("Report {} ({}) completed in {}ms: {}", reportId, report.getReportType(),
                        System.currentTimeMillis() - started, path);
            } else {
                log.warn("Report {} left PROCESSING before completion, artifact {} not attached", reportId, path);
            }
        } catch (Exception e) {
            log.error("Report {} failed: {}", reportId, e.getMessage(), e);
            failReport(reportId, describe(e));
        }
    }

    @Async
    public void runExport(String exportId) {
        if (!exportRepository.transition(exportId, JobStatus.PENDING, JobStatus.PROCESSING, null, null)) {
            log.info("Export {} was not pending, another runner owns it", exportId);
            return;
        }

        try {
            DataExport export = exportRepository.findById(exportId);
            if (export == null) {
                throw new IllegalStateException("Export " + exportId + " disappeared while processing");
            }
            CsvExportRenderer renderer = new CsvExportRenderer(reportService.zone());
            LogQuery query = LogQuery.fromFilters(export.getFilters(), reportService.zone());

            String content = switch (export.getStream()) {
                case ACTIVITY -> renderer.renderActivity(activityEventRepository.findAll(query));
                case ACCESS -> renderer.renderAccess(accessEventRepository.findAll(query));
                case SECURITY -> renderer.renderSecurity(securityEventRepository.findAll(query));
            };
            String path = artifactStore.write("export_" + export.getStream().name().toLowerCase(),
                    exportId, ArtifactFormat.CSV, content);

            if (exportRepository.transition(exportId, JobStatus.PROCESSING, JobStatus.COMPLETED, path, null)) {
                metricsConfig.recordJobOutcome("export", "completed");
                log.info("Export {} ({}) completed: {}", exportId, export.getStream(), path);
            } else {
                log.warn("Export {} left PROCESSING before completion, artifact {} not attached", exportId, path);
            }
        } catch (Exception e) {
            log.error("Export {} failed: {}", exportId, e.getMessage(), e);
            failExport(exportId, describe(e));
        }
    }

    void failReport(String reportId, String message) {
        try {
            if (reportRepository.transition(reportId, JobStatus.PROCESSING, JobStatus.FAILED, null, message)) {
                metricsConfig.recordJobOutcome("report", "failed");
            }
        } catch (RuntimeException e) {
            // Left in PROCESSING; the stale sweep fails it later.
            log.error("Could not mark report {} failed: {}", reportId, e.getMessage());
        }
    }

    void failExport(String exportId, String message) {
        try {
            if (exportRepository.transition(exportId, JobStatus.PROCESSING, JobStatus.FAILED, null, message)) {
                metricsConfig.recordJobOutcome("export", "failed");
            }
        } catch (RuntimeException e) {
            log.error("Could not mark export {} failed: {}", exportId, e.getMessage());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
