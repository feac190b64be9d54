package com.health.compliance.service;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.engine.DetectionEngine;
import com.health.compliance.model.DetectionRunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Periodic detection run over the lookback window.
 */
@Service
public class DetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DetectionScheduler.class);

    private final DetectionEngine detectionEngine;
    private final DetectionConfig detectionConfig;

    public DetectionScheduler(DetectionEngine detectionEngine, DetectionConfig detectionConfig) {
        this.detectionEngine = detectionEngine;
        this.detectionConfig = detectionConfig;
    }

    @Scheduled(fixedRateString = "${audit.detection.run-interval-minutes:60}",
               initialDelayString = "${audit.detection.run-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES)
    public void runScheduledDetection() {
        if (!detectionConfig.isEnabled()) {
            return;
        }
        try {
            DetectionRunReport report = detectionEngine.run(System.currentTimeMillis());
            log.debug("Scheduled detection run raised {} alerts", report.getAlertsRaised());
        } catch (Exception e) {
            log.error("Scheduled detection run failed: {}", e.getMessage(), e);
        }
    }
}
