package com.health.compliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit.capture")
public class CaptureConfig {

    // Only paths matching one of these are audited at all.
    private List<String> auditedPaths = new ArrayList<>(List.of("^/api/"));

    // Matched before anything else; a hit produces no records.
    private List<String> excludedPaths = new ArrayList<>(List.of(
            "^/admin/", "^/static/", "^/media/", "^/favicon\\.ico$", "^/robots\\.txt$",
            "^/actuator/", "^/health"));

    // Protected health information: these additionally produce an access event.
    private List<String> protectedPaths = new ArrayList<>(List.of(
            "^/api/healthcare/", "^/api/medication/", "^/api/telemedicine/", "^/api/patients/"));

    private List<String> authPaths = new ArrayList<>(List.of("^/api/auth/"));
    private List<String> loginPaths = new ArrayList<>(List.of("login"));
    private List<String> logoutPaths = new ArrayList<>(List.of("logout"));

    // Path segments after which the subject (patient) id is expected.
    private List<String> subjectPathMarkers = new ArrayList<>(List.of("patients", "patient", "subjects", "subject"));
    private List<String> subjectParamKeys = new ArrayList<>(List.of("patient_id", "patient", "subject_id"));

    private String reasonHeader = "X-Access-Reason";
    private String reasonParam = "access_reason";
    private String noReasonSentinel = "No reason provided";

    private List<String> excludedHeaders = new ArrayList<>(List.of("authorization", "cookie", "set-cookie"));
    private List<String> maskedFields = new ArrayList<>(List.of("password", "secret", "token", "ssn"));
    private String maskValue = "********";
}
