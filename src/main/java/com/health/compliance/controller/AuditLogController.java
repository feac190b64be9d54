package com.health.compliance.controller;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.PagedResponse;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.service.AuditQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit Logs", description = "Read-only, paged queries over the activity, PHI access and security logs")
public class AuditLogController {

    private final AuditQueryService queryService;

    public AuditLogController(AuditQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/activity")
    @Operation(summary = "Query activity events",
               description = "Newest first. Pass nextCursor as 'before' to fetch the next page.")
    public ResponseEntity<?> queryActivity(
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String role,
            @Parameter(description = "Activity event type", example = "LOGIN")
            @RequestParam(required = false) String kind,
            @Parameter(description = "YYYY-MM-DD, inclusive") @RequestParam(required = false) String startDate,
            @Parameter(description = "YYYY-MM-DD, inclusive") @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String ipAddress,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "nextCursor of the previous page") @RequestParam(required = false) String before) {
        Map<String, String> filters = filters(actorId, role, kind, startDate, endDate, search, ipAddress);
        try {
            PagedResponse<ActivityEvent> page = queryService.findActivity(filters, limit, before);
            return ResponseEntity.ok(page);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/access")
    @Operation(summary = "Query PHI access events")
    public ResponseEntity<?> queryAccess(
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String role,
            @Parameter(description = "Access type", example = "VIEW")
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String ipAddress,
            @Parameter(description = "Patient id", example = "P-2001")
            @RequestParam(required = false) String subjectId,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "nextCursor of the previous page") @RequestParam(required = false) String before) {
        Map<String, String> filters = filters(actorId, role, kind, startDate, endDate, search, ipAddress);
        putIfPresent(filters, "subjectId", subjectId);
        try {
            PagedResponse<AccessEvent> page = queryService.findAccess(filters, limit, before);
            return ResponseEntity.ok(page);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/security")
    @Operation(summary = "Query security events")
    public ResponseEntity<?> querySecurity(
            @RequestParam(required = false) String actorId,
            @RequestParam(required = false) String role,
            @Parameter(description = "Security event type", example = "LOGIN_FAILED")
            @RequestParam(required = false) String kind,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String ipAddress,
            @Parameter(example = "HIGH") @RequestParam(required = false) String severity,
            @RequestParam(required = false) String resolved,
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "nextCursor of the previous page") @RequestParam(required = false) String before) {
        Map<String, String> filters = filters(actorId, role, kind, startDate, endDate, search, ipAddress);
        putIfPresent(filters, "severity", severity);
        putIfPresent(filters, "resolved", resolved);
        try {
            PagedResponse<SecurityEvent> page = queryService.findSecurity(filters, limit, before);
            return ResponseEntity.ok(page);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/activity/{eventId}")
    @Operation(summary = "Get an activity event")
    public ResponseEntity<ActivityEvent> getActivity(@PathVariable String eventId) {
        ActivityEvent event = queryService.getActivity(eventId);
        if (event == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(event);
    }

    @GetMapping("/access/{eventId}")
    @Operation(summary = "Get a PHI access event")
    public ResponseEntity<AccessEvent> getAccess(@PathVariable String eventId) {
        AccessEvent event = queryService.getAccess(eventId);
        if (event == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(event);
    }

    @GetMapping("/security/{eventId}")
    @Operation(summary = "Get a security event")
    public ResponseEntity<SecurityEvent> getSecurity(@PathVariable String eventId) {
        SecurityEvent event = queryService.getSecurity(eventId);
        if (event == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(event);
    }

    @GetMapping("/activity/summary")
    @Operation(summary = "Summarize activity events",
               description = "Counts by event type, resource type, actor and role over the last N days")
    public ResponseEntity<?> activitySummary(@RequestParam(defaultValue = "7") int days) {
        try {
            return ResponseEntity.ok(queryService.activitySummary(days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/access/summary")
    @Operation(summary = "Summarize PHI access events",
               description = "Counts by access type, record type, actor and role, plus accesses without a reason")
    public ResponseEntity<?> accessSummary(@RequestParam(defaultValue = "7") int days) {
        try {
            return ResponseEntity.ok(queryService.accessSummary(days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/security/summary")
    @Operation(summary = "Summarize security events",
               description = "Counts by type and severity, plus unresolved and critical unresolved counts")
    public ResponseEntity<?> securitySummary(@RequestParam(defaultValue = "7") int days) {
        try {
            return ResponseEntity.ok(queryService.securitySummary(days));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    private static Map<String, String> filters(String actorId, String role, String kind, String startDate,
                                               String endDate, String search, String ipAddress) {
        Map<String, String> filters = new LinkedHashMap<>();
        putIfPresent(filters, "actorId", actorId);
        putIfPresent(filters, "role", role);
        putIfPresent(filters, "kind", kind);
        putIfPresent(filters, "startDate", startDate);
        putIfPresent(filters, "endDate", endDate);
        putIfPresent(filters, "search", search);
        putIfPresent(filters, "ipAddress", ipAddress);
        return filters;
    }

    private static void putIfPresent(Map<String, String> filters, String key, String value) {
        if (value != null && !value.isBlank()) {
            filters.put(key, value);
        }
    }
}
