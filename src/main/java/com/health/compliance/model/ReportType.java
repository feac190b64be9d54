package com.health.compliance.model;

public enum ReportType {
    DAILY_AUDIT(ArtifactFormat.CSV),
    WEEKLY_AUDIT(ArtifactFormat.CSV),
    PHI_ACCESS(ArtifactFormat.JSON),
    SECURITY_INCIDENTS(ArtifactFormat.JSON),
    USER_ACTIVITY(ArtifactFormat.JSON),
    SYSTEM_ACCESS(ArtifactFormat.JSON),
    SUBJECT_ACCESS(ArtifactFormat.JSON),
    MINIMUM_NECESSARY(ArtifactFormat.JSON),
    DATA_SHARING(ArtifactFormat.JSON),
    RISK_ASSESSMENT(ArtifactFormat.JSON),
    DASHBOARD_METRICS(ArtifactFormat.JSON),
    CUSTOM(ArtifactFormat.JSON);

    private final ArtifactFormat defaultFormat;

    ReportType(ArtifactFormat defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    public ArtifactFormat getDefaultFormat() {
        return defaultFormat;
    }
}
