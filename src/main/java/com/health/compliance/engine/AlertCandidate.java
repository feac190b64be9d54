package com.health.compliance.engine;

import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A security event a heuristic wants raised.
 */
@Value
@Builder
public class AlertCandidate {
    HeuristicType heuristic;
    SecurityEventType eventType;
    Severity severity;
    String description;
    String actorId;
    String actorUsername;
    String actorRole;
    String ipAddress;
    Map<String, Object> context;
    String dedupKey;
}
