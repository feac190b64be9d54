package com.health.compliance.reporting;

import com.health.compliance.exception.ExportNotFoundException;
import com.health.compliance.model.DataExport;
import com.health.compliance.model.ExportRequest;
import com.health.compliance.model.JobStatus;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.LogStream;
import com.health.compliance.repository.DataExportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Service
public class DataExportService {

    private static final Logger log = LoggerFactory.getLogger(DataExportService.class);

    private final DataExportRepository exportRepository;
    private final ComplianceReportService reportService;
    private final ReportJobRunner jobRunner;

    public DataExportService(DataExportRepository exportRepository,
                             ComplianceReportService reportService,
                             ReportJobRunner jobRunner) {
        this.exportRepository = exportRepository;
        this.reportService = reportService;
        this.jobRunner = jobRunner;
    }

    /**
     * Create an export job for one log stream. Filters are validated here so a bad request never
     * becomes a job.
     *
     * @throws IllegalArgumentException on an unknown stream, unknown filter key or bad filter value
     */
    public DataExport requestExport(ExportRequest request) {
        if (request.getStream() == null || request.getStream().isBlank()) {
            throw new IllegalArgumentException("stream is required");
        }
        if (request.getRequestedBy() == null || request.getRequestedBy().isBlank()) {
            throw new IllegalArgumentException("requestedBy is required");
        }
        LogStream stream;
        try {
            stream = LogStream.valueOf(request.getStream().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid stream '" + request.getStream()
                    + "': expected one of ACTIVITY, ACCESS, SECURITY");
        }
        Map<String, String> filters = request.getFilters() != null
                ? new LinkedHashMap<>(request.getFilters()) : new LinkedHashMap<>();
        LogQuery.fromFilters(filters, reportService.zone());

        long now = System.currentTimeMillis();
        DataExport export = DataExport.builder()
                .exportId(UUID.randomUUID().toString())
                .requestedBy(request.getRequestedBy())
                .stream(stream)
                .status(JobStatus.PENDING)
                .filters(filters)
                .createdAt(now)
                .updatedAt(now)
                .build();
        exportRepository.create(export);
        log.info("Export {} of {} requested by {} with filters {}", export.getExportId(), stream,
                export.getRequestedBy(), filters);

        try {
            jobRunner.runExport(export.getExportId());
        } catch (RuntimeException e) {
            log.error("Could not enqueue export {}: {}", export.getExportId(), e.getMessage());
            exportRepository.transition(export.getExportId(), JobStatus.PENDING, JobStatus.FAILED, null,
                    "Could not enqueue: " + e.getMessage());
            export.setStatus(JobStatus.FAILED);
        }
        return export;
    }

    public DataExport get(String exportId) {
        DataExport export = exportRepository.findById(exportId);
        if (export == null) {
            throw new ExportNotFoundException(exportId);
        }
        return export;
    }

    public List<DataExport> list(String requestedBy, int limit) {
        return exportRepository.findByRequester(requestedBy, limit);
    }
}
