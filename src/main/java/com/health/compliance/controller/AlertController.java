package com.health.compliance.controller;

import com.health.compliance.exception.SecurityEventNotFoundException;
import com.health.compliance.model.AlertRequest;
import com.health.compliance.model.RiskAssessment;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.service.AlertService;
import com.health.compliance.service.RiskScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Security event lifecycle and organizational risk score")
public class AlertController {

    private final AlertService alertService;
    private final RiskScoringService riskScoringService;

    public AlertController(AlertService alertService, RiskScoringService riskScoringService) {
        this.alertService = alertService;
        this.riskScoringService = riskScoringService;
    }

    @PostMapping
    @Operation(summary = "Raise a security event",
               description = "HIGH and CRITICAL events notify the on-call recipients")
    public ResponseEntity<?> raise(@RequestBody AlertRequest request) {
        try {
            SecurityEvent event = alertService.raise(request);
            return ResponseEntity.status(HttpStatus.CREATED).body(event);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get a security event")
    public ResponseEntity<SecurityEvent> get(@PathVariable String eventId) {
        try {
            return ResponseEntity.ok(alertService.getEvent(eventId));
        } catch (SecurityEventNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/{eventId}/resolve")
    @Operation(summary = "Resolve a security event",
               description = "Body: {\"resolvedBy\": \"...\", \"notes\": \"...\"}. Resolving twice only replaces the notes.")
    public ResponseEntity<?> resolve(@PathVariable String eventId,
                                     @RequestBody Map<String, String> body) {
        try {
            SecurityEvent resolved = alertService.resolve(eventId, body.get("resolvedBy"), body.get("notes"));
            return ResponseEntity.ok(resolved);
        } catch (SecurityEventNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/risk-assessment")
    @Operation(summary = "Current security risk assessment",
               description = "Score 0-100 over the rolling window with its factors, breakdowns and weekly trend")
    public ResponseEntity<RiskAssessment> riskAssessment() {
        return ResponseEntity.ok(riskScoringService.assess(System.currentTimeMillis()));
    }
}
