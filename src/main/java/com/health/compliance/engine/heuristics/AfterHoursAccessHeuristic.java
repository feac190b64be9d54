package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.DetectionHeuristic;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.engine.HeuristicType;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Flags access outside business hours or on weekend days.
 *
 * Self-access (actor is the patient) and exempt roles (admin, emergency_provider) are ignored.
 * Emits a LOW alert per flagged access and, per actor, a MEDIUM aggregate alert when the number
 * of flagged accesses is strictly above half the high-volume threshold. Either output can be
 * switched off.
 */
@Component
public class AfterHoursAccessHeuristic implements DetectionHeuristic {

    @Override
    public HeuristicType getType() {
        return HeuristicType.AFTER_HOURS_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        List<AccessEvent> flagged = window.getAccessEvents().stream()
                .filter(e -> !e.isSelfAccess())
                .filter(e -> !DetectionSettings.hasRole(settings.getAfterHoursExemptRoles(), e.getActorRole()))
                .filter(e -> settings.isAfterHours(e.getTimestamp()))
                .sorted(AccessGrouping.CHRONOLOGICAL)
                .toList();

        List<AlertCandidate> candidates = new ArrayList<>();
        if (settings.isAfterHoursPerAccessAlerts()) {
            for (AccessEvent event : flagged) {
                candidates.add(perAccess(event, settings));
            }
        }

        if (settings.isAfterHoursAggregateAlerts()) {
            double aggregateThreshold = settings.getHighVolumeThreshold() / 2.0;
            SortedMap<String, List<AccessEvent>> byActor = AccessGrouping.byActor(flagged);
            for (Map.Entry<String, List<AccessEvent>> entry : byActor.entrySet()) {
                int count = entry.getValue().size();
                if (count > aggregateThreshold) {
                    candidates.add(aggregate(entry.getKey(), entry.getValue(), aggregateThreshold, settings));
                }
            }
        }
        return candidates;
    }

    private AlertCandidate perAccess(AccessEvent event, DetectionSettings settings) {
        String username = event.getActorUsername() != null ? event.getActorUsername() : "anonymous";

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("heuristic", getType().name());
        context.put("accessEventId", event.getEventId());
        context.put("subjectId", event.getSubjectId());
        context.put("accessedAt", Instant.ofEpochMilli(event.getTimestamp()).atZone(settings.getZoneId()).toString());

        return AlertCandidate.builder()
                .heuristic(getType())
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.LOW)
                .description(String.format("After-hours PHI access by %s to patient %s",
                        username, event.getSubjectId()))
                .actorId(event.getActorId())
                .actorUsername(event.getActorUsername())
                .actorRole(event.getActorRole())
                .ipAddress(event.getIpAddress())
                .context(context)
                .dedupKey(getType().name() + ":access:" + event.getEventId())
                .build();
    }

    private AlertCandidate aggregate(String actorId, List<AccessEvent> events, double threshold,
                                     DetectionSettings settings) {
        String username = AccessGrouping.usernameOf(events, actorId);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("heuristic", getType().name());
        context.put("afterHoursCount", events.size());
        context.put("threshold", threshold);
        context.put("windowHours", settings.getLookbackHours());

        return AlertCandidate.builder()
                .heuristic(getType())
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.MEDIUM)
                .description(String.format("%s made %d after-hours PHI accesses in the last %d hours",
                        username, events.size(), settings.getLookbackHours()))
                .actorId(actorId)
                .actorUsername(username)
                .actorRole(AccessGrouping.roleOf(events))
                .context(context)
                .dedupKey(getType().name() + ":actor:" + actorId)
                .build();
    }
}
