package com.health.compliance.capture;

/**
 * Resource type and id parsed from a request path. Unrecognized paths give ("unknown", "").
 */
public record ResourceRef(String type, String id) {

    public static final ResourceRef UNKNOWN = new ResourceRef("unknown", "");
}
