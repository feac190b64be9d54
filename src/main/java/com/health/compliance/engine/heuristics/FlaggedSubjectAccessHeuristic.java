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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Any access to a watch-listed patient raises a HIGH alert, one per access, with no threshold.
 */
@Component
public class FlaggedSubjectAccessHeuristic implements DetectionHeuristic {

    @Override
    public HeuristicType getType() {
        return HeuristicType.FLAGGED_SUBJECT_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        if (settings.getWatchListedSubjects().isEmpty()) return List.of();

        return window.getAccessEvents().stream()
                .filter(e -> e.getSubjectId() != null && settings.getWatchListedSubjects().contains(e.getSubjectId()))
                .sorted(AccessGrouping.CHRONOLOGICAL)
                .map(this::toCandidate)
                .toList();
    }

    private AlertCandidate toCandidate(AccessEvent event) {
        String username = event.getActorUsername() != null ? event.getActorUsername() : "anonymous";

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("heuristic", getType().name());
        context.put("accessEventId", event.getEventId());
        context.put("subjectId", event.getSubjectId());
        context.put("accessType", event.getAccessType() != null ? event.getAccessType().name() : null);
        context.put("recordType", event.getRecordType());

        return AlertCandidate.builder()
                .heuristic(getType())
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.HIGH)
                .description(String.format("Access to watch-listed patient %s by %s",
                        event.getSubjectId(), username))
                .actorId(event.getActorId())
                .actorUsername(event.getActorUsername())
                .actorRole(event.getActorRole())
                .ipAddress(event.getIpAddress())
                .context(context)
                .dedupKey(getType().name() + ":" + event.getEventId())
                .build();
    }
}
