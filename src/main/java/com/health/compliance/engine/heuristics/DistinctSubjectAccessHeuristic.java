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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flags actors who touched more distinct patients than the high-volume threshold.
 */
@Component
public class DistinctSubjectAccessHeuristic implements DetectionHeuristic {

    @Override
    public HeuristicType getType() {
        return HeuristicType.DISTINCT_SUBJECT_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        List<AlertCandidate> candidates = new ArrayList<>();
        int threshold = settings.getHighVolumeThreshold();

        for (Map.Entry<String, List<AccessEvent>> entry : AccessGrouping.byActor(window.getAccessEvents()).entrySet()) {
            List<AccessEvent> events = entry.getValue();
            String role = AccessGrouping.roleOf(events);
            if (DetectionSettings.hasRole(settings.getDistinctSubjectExemptRoles(), role)) continue;

            long distinctSubjects = events.stream()
                    .map(AccessEvent::getSubjectId)
                    .filter(Objects::nonNull)
                    .distinct()
                    .count();
            if (distinctSubjects <= threshold) continue;

            String actorId = entry.getKey();
            String username = AccessGrouping.usernameOf(events, actorId);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("heuristic", getType().name());
            context.put("actorRole", role);
            context.put("distinctSubjects", distinctSubjects);
            context.put("threshold", threshold);
            context.put("windowHours", settings.getLookbackHours());

            candidates.add(AlertCandidate.builder()
                    .heuristic(getType())
                    .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                    .severity(Severity.MEDIUM)
                    .description(String.format(
                            "%s accessed %d different patients in the last %d hours (threshold=%d)",
                            username, distinctSubjects, settings.getLookbackHours(), threshold))
                    .actorId(actorId)
                    .actorUsername(username)
                    .actorRole(role)
                    .context(context)
                    .dedupKey(getType().name() + ":" + actorId)
                    .build());
        }
        return candidates;
    }
}
