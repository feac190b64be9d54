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
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Buckets accesses by (actor, calendar hour) and flags any bucket strictly above
 * rapid-access multiplier x high-volume threshold (default 2 x 20). Bulk export suspicion.
 */
@Component
public class RapidAccessHeuristic implements DetectionHeuristic {

    @Override
    public HeuristicType getType() {
        return HeuristicType.RAPID_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        List<AlertCandidate> candidates = new ArrayList<>();
        int threshold = settings.getRapidAccessThreshold();

        for (Map.Entry<String, List<AccessEvent>> actorEntry : AccessGrouping.byActor(window.getAccessEvents()).entrySet()) {
            String actorId = actorEntry.getKey();
            SortedMap<ZonedDateTime, Integer> buckets = new TreeMap<>();
            for (AccessEvent event : actorEntry.getValue()) {
                ZonedDateTime hour = Instant.ofEpochMilli(event.getTimestamp())
                        .atZone(settings.getZoneId())
                        .truncatedTo(ChronoUnit.HOURS);
                buckets.merge(hour, 1, Integer::sum);
            }

            String username = AccessGrouping.usernameOf(actorEntry.getValue(), actorId);
            String role = AccessGrouping.roleOf(actorEntry.getValue());
            for (Map.Entry<ZonedDateTime, Integer> bucket : buckets.entrySet()) {
                int count = bucket.getValue();
                if (count <= threshold) continue;

                String hourLabel = bucket.getKey().toOffsetDateTime().toString();

                Map<String, Object> context = new LinkedHashMap<>();
                context.put("heuristic", getType().name());
                context.put("hourStart", hourLabel);
                context.put("accessCount", count);
                context.put("threshold", threshold);

                candidates.add(AlertCandidate.builder()
                        .heuristic(getType())
                        .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                        .severity(Severity.MEDIUM)
                        .description(String.format(
                                "Rapid PHI access: %s made %d accesses in the hour starting %s (threshold=%d)",
                                username, count, hourLabel, threshold))
                        .actorId(actorId)
                        .actorUsername(username)
                        .actorRole(role)
                        .context(context)
                        .dedupKey(getType().name() + ":" + actorId + ":" + hourLabel)
                        .build());
            }
        }
        return candidates;
    }
}
