package com.health.compliance.controller;

import com.health.compliance.exception.ExportNotFoundException;
import com.health.compliance.model.DataExport;
import com.health.compliance.model.ExportRequest;
import com.health.compliance.reporting.DataExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/exports")
@Tag(name = "Exports", description = "CSV exports of the activity, PHI access and security logs")
public class ExportController {

    private final DataExportService exportService;

    public ExportController(DataExportService exportService) {
        this.exportService = exportService;
    }

    @PostMapping
    @Operation(summary = "Request a log export",
               description = "Filters use the same keys as the audit query endpoints: actorId, role, kind, "
                       + "startDate, endDate, search, ipAddress, subjectId, severity, resolved")
    public ResponseEntity<?> requestExport(@RequestBody ExportRequest request) {
        try {
            DataExport export = exportService.requestExport(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(export);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{exportId}")
    @Operation(summary = "Get an export job")
    public ResponseEntity<DataExport> get(@PathVariable String exportId) {
        try {
            return ResponseEntity.ok(exportService.get(exportId));
        } catch (ExportNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @GetMapping
    @Operation(summary = "List export jobs", description = "Newest first, optionally for one requester")
    public ResponseEntity<List<DataExport>> list(@RequestParam(required = false) String requestedBy,
                                                 @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(exportService.list(requestedBy, limit));
    }
}
