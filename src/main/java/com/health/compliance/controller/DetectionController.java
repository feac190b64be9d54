package com.health.compliance.controller;

import com.health.compliance.engine.DetectionEngine;
import com.health.compliance.model.DetectionRunReport;
import com.health.compliance.repository.CaseloadRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/detection")
@Tag(name = "Detection", description = "On-demand anomaly detection and caseload sync")
public class DetectionController {

    private final DetectionEngine detectionEngine;
    private final CaseloadRepository caseloadRepository;

    public DetectionController(DetectionEngine detectionEngine, CaseloadRepository caseloadRepository) {
        this.detectionEngine = detectionEngine;
        this.caseloadRepository = caseloadRepository;
    }

    @PostMapping("/run")
    @Operation(summary = "Run detection now",
               description = "Runs every enabled heuristic over the lookback window. "
                       + "A failing heuristic is reported without stopping the others.")
    public ResponseEntity<DetectionRunReport> run() {
        return ResponseEntity.ok(detectionEngine.run(System.currentTimeMillis()));
    }

    @PutMapping("/caseloads/{providerId}")
    @Operation(summary = "Replace a provider's caseload",
               description = "Patient ids the provider is clinically assigned to, used by the outside-caseload checks")
    public ResponseEntity<?> putCaseload(
            @Parameter(description = "Provider user id", example = "U-1001")
            @PathVariable String providerId,
            @RequestBody List<String> patientIds) {
        if (patientIds == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "patient id list is required"));
        }
        caseloadRepository.save(providerId, patientIds);
        Set<String> stored = caseloadRepository.caseloadOf(providerId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("providerId", providerId);
        response.put("patientCount", stored.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/caseloads/{providerId}")
    @Operation(summary = "Get a provider's caseload")
    public ResponseEntity<Set<String>> getCaseload(@PathVariable String providerId) {
        return ResponseEntity.ok(caseloadRepository.caseloadOf(providerId));
    }
}
