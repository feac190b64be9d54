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

/**
 * Flags actors whose protected-data access count in the lookback window is strictly above the
 * high-volume threshold (default 20). Admin and compliance roles are exempt.
 */
@Component
public class HighVolumeAccessHeuristic implements DetectionHeuristic {

    @Override
    public HeuristicType getType() {
        return HeuristicType.HIGH_VOLUME_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        List<AlertCandidate> candidates = new ArrayList<>();
        int threshold = settings.getHighVolumeThreshold();

        for (Map.Entry<String, List<AccessEvent>> entry : AccessGrouping.byActor(window.getAccessEvents()).entrySet()) {
            List<AccessEvent> events = entry.getValue();
            String role = AccessGrouping.roleOf(events);
            if (DetectionSettings.hasRole(settings.getHighVolumeExemptRoles(), role)) continue;

            int count = events.size();
            if (count <= threshold) continue;

            String actorId = entry.getKey();
            String username = AccessGrouping.usernameOf(events, actorId);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("heuristic", getType().name());
            context.put("actorRole", role);
            context.put("accessCount", count);
            context.put("threshold", threshold);
            context.put("windowHours", settings.getLookbackHours());

            candidates.add(AlertCandidate.builder()
                    .heuristic(getType())
                    .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                    .severity(Severity.MEDIUM)
                    .description(String.format(
                            "High volume PHI access: %s accessed %d records in the last %d hours (threshold=%d)",
                            username, count, settings.getLookbackHours(), threshold))
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
