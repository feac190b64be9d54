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
@Schema(description = "General audit trail entry. Written once, never updated.")
public class ActivityEvent {

    @Schema(description = "Unique event identifier")
    private String eventId;

    @Schema(description = "Acting user id, null for anonymous operations", example = "U-1001")
    private String actorId;

    private String actorUsername;

    @Schema(example = "provider")
    private String actorRole;

    private ActivityEventType eventType;

    @Schema(example = "patients")
    private String resourceType;

    private String resourceId;
    private String description;
    private String ipAddress;
    private String userAgent;

    @Schema(description = "Write time in epoch milliseconds, assigned by the log store")
    private long timestamp;

    @Schema(description = "Status code, sanitized body, query parameters and selected headers")
    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    /**
     * A LOGIN event counts as failed when capture marked it so or when the response was 401/403.
     */
    @JsonIgnore
    public boolean isFailedLogin() {
        if (eventType != ActivityEventType.LOGIN || context == null) return false;
        if ("failed".equals(context.get("outcome"))) return true;
        Object status = context.get("statusCode");
        if (status instanceof Number) {
            int code = ((Number) status).intValue();
            return code == 401 || code == 403;
        }
        return false;
    }

    /**
     * Username attempted on a login; falls back to the authenticated username.
     */
    @JsonIgnore
    public String getLoginUsername() {
        if (context != null && context.get("username") != null) {
            return String.valueOf(context.get("username"));
        }
        return actorUsername;
    }
}
