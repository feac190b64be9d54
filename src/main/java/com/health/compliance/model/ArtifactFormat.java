package com.health.compliance.model;

public enum ArtifactFormat {
    JSON("json"),
    CSV("csv");

    private final String extension;

    ArtifactFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
