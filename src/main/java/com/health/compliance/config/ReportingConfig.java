package com.health.compliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit.reporting")
public class ReportingConfig {

    private String artifactDir = "compliance-artifacts";
    private String zoneId = "UTC";

    // Jobs left in PROCESSING longer than this are failed by the sweep.
    private int staleAfterMinutes = 30;
    private int staleSweepIntervalMinutes = 5;

    private boolean resumePendingOnStartup = true;

    private WeeklyReport weeklyReport = new WeeklyReport();
    private Expiry expiry = new Expiry();

    private int recentReportLimit = 10;

    // Artifact writes; read by ArtifactStore's @Retryable expressions.
    private int retryMaxAttempts = 3;
    private long retryDelayMs = 1000;

    // Minimum-necessary report: distinct patients per actor-hour above this is a rapid pattern.
    private int rapidSubjectThreshold = 10;

    @Data
    public static class WeeklyReport {
        private boolean enabled = true;
        private String cron = "0 0 6 * * MON";
    }

    @Data
    public static class Expiry {
        private boolean enabled = true;
        private int renewalDays = 365;
        private String cron = "0 30 6 * * *";
    }
}
