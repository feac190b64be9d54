package com.health.compliance.controller;

import com.health.compliance.capture.EventCaptureService;
import com.health.compliance.model.ObservedOperation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/capture")
@Tag(name = "Capture", description = "Inbound hook for operations observed on the host platform")
public class CaptureController {

    private final EventCaptureService captureService;

    public CaptureController(EventCaptureService captureService) {
        this.captureService = captureService;
    }

    @PostMapping("/observe")
    @Operation(summary = "Observe a platform operation",
               description = "Records activity, PHI access and security events for one operation. "
                       + "Always accepted; capture failures are logged and never returned to the caller.")
    public ResponseEntity<Void> observe(@RequestBody ObservedOperation operation) {
        captureService.observe(operation);
        return ResponseEntity.accepted().build();
    }
}
