package com.health.compliance.controller;

import com.health.compliance.exception.ReportNotFoundException;
import com.health.compliance.model.ComplianceReport;
import com.health.compliance.model.DateRange;
import com.health.compliance.model.ReportRequest;
import com.health.compliance.reporting.ComplianceReportService;
import com.health.compliance.reporting.ReportSchedulingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Compliance Reports", description = "Asynchronous report jobs and on-demand compliance views")
public class ReportController {

    private static final int DEFAULT_RANGE_DAYS = 30;

    private final ReportSchedulingService schedulingService;
    private final ComplianceReportService reportService;

    public ReportController(ReportSchedulingService schedulingService,
                            ComplianceReportService reportService) {
        this.schedulingService = schedulingService;
        this.reportService = reportService;
    }

    @PostMapping
    @Operation(summary = "Schedule a report",
               description = "Returns the job immediately. Re-submitting an identical request returns the "
                       + "existing job unless it failed.")
    public ResponseEntity<?> schedule(@RequestBody ReportRequest request) {
        try {
            ComplianceReport report = schedulingService.schedule(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(report);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping
    @Operation(summary = "List recent report jobs")
    public ResponseEntity<List<ComplianceReport>> list(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(schedulingService.list(limit));
    }

    @GetMapping("/{reportId}")
    @Operation(summary = "Get a report job",
               description = "Status is always one of PENDING, PROCESSING, COMPLETED, FAILED. "
                       + "Completed jobs carry the artifact path.")
    public ResponseEntity<ComplianceReport> get(@PathVariable String reportId) {
        try {
            return ResponseEntity.ok(schedulingService.get(reportId));
        } catch (ReportNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Compliance dashboard",
               description = "30-day PHI access and security summaries, open incidents, audit volume and recent reports")
    public ResponseEntity<Map<String, Object>> dashboard() {
        return ResponseEntity.ok(reportService.complianceDashboard(System.currentTimeMillis()));
    }

    @GetMapping("/dashboard-metrics")
    @Operation(summary = "Dashboard metrics",
               description = "Today vs yesterday and last-30 vs previous-30-day comparisons with deltas")
    public ResponseEntity<Map<String, Object>> dashboardMetrics() {
        return ResponseEntity.ok(reportService.dashboardMetrics(System.currentTimeMillis()));
    }

    @GetMapping("/minimum-necessary")
    @Operation(summary = "Minimum-necessary review",
               description = "High-volume users, providers outside their caseload and rapid multi-patient access")
    public ResponseEntity<?> minimumNecessary(
            @Parameter(description = "YYYY-MM-DD") @RequestParam(required = false) String startDate,
            @Parameter(description = "YYYY-MM-DD") @RequestParam(required = false) String endDate) {
        try {
            return ResponseEntity.ok(reportService.minimumNecessary(range(startDate, endDate)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/data-sharing")
    @Operation(summary = "PHI sharing and export activity")
    public ResponseEntity<?> dataSharing(
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate) {
        try {
            return ResponseEntity.ok(reportService.dataSharing(range(startDate, endDate)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/subject-access/{subjectId}")
    @Operation(summary = "Who accessed a patient's records",
               description = "Access by type, by user and by record type, with a daily trend")
    public ResponseEntity<?> subjectAccess(
            @Parameter(description = "Patient id", example = "P-2001") @PathVariable String subjectId,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate) {
        try {
            return ResponseEntity.ok(reportService.subjectAccess(subjectId, range(startDate, endDate)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private DateRange range(String startDate, String endDate) {
        return DateRange.parse(startDate, endDate, reportService.today(), DEFAULT_RANGE_DAYS);
    }
}
