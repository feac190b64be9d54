package com.health.compliance.model;

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
@Schema(description = "One operation observed on the host platform")
public class ObservedOperation {

    @Schema(description = "Authenticated user id, null when anonymous", example = "U-1001")
    private String actorId;

    @Schema(example = "dr.smith")
    private String actorUsername;

    @Schema(example = "provider")
    private String actorRole;

    @Schema(example = "GET")
    private String method;

    @Schema(example = "/api/patients/2001/records")
    private String path;

    @Schema(description = "Response status returned to the caller", example = "200")
    private int statusCode;

    @Builder.Default
    private Map<String, String> queryParams = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    @Schema(description = "Request body, if any")
    private Map<String, Object> payload;

    @Schema(example = "10.0.0.12")
    private String clientIp;

    private String userAgent;
}
