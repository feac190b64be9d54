package com.health.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Access to protected health information. Written once, never updated.")
public class AccessEvent {

    private String eventId;
    private String actorId;
    private String actorUsername;
    private String actorRole;

    @Schema(description = "Patient whose data was touched", example = "P-2001")
    private String subjectId;

    private AccessType accessType;

    @Schema(description = "Stated reason; the no-reason sentinel when none was given", example = "Treatment")
    private String reason;

    @Schema(description = "Whether the reason was absent, the placeholder text, or a real reason")
    private ReasonStatus reasonStatus;

    @Schema(example = "medication")
    private String recordType;

    private String recordId;
    private String ipAddress;
    private String userAgent;
    private long timestamp;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @JsonIgnore
    public boolean isMissingReason() {
        return reasonStatus == null || reasonStatus.isMissing();
    }

    @JsonIgnore
    public boolean isSelfAccess() {
        return actorId != null && actorId.equals(subjectId);
    }
}
