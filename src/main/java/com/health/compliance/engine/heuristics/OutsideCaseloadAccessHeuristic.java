package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.CaseloadDirectory;
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
import java.util.Set;
import java.util.TreeSet;

/**
 * Flags providers who access patients outside their clinical caseload more than the configured
 * number of times (default 3) in the window. One alert per provider.
 *
 * A failing caseload lookup fails the whole heuristic; the engine isolates it from the others.
 */
@Component
public class OutsideCaseloadAccessHeuristic implements DetectionHeuristic {

    private final CaseloadDirectory caseloadDirectory;

    public OutsideCaseloadAccessHeuristic(CaseloadDirectory caseloadDirectory) {
        this.caseloadDirectory = caseloadDirectory;
    }

    @Override
    public HeuristicType getType() {
        return HeuristicType.OUTSIDE_CASELOAD_ACCESS;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        List<AlertCandidate> candidates = new ArrayList<>();
        int threshold = settings.getOutsideCaseloadThreshold();

        for (Map.Entry<String, List<AccessEvent>> entry : AccessGrouping.byActor(window.getAccessEvents()).entrySet()) {
            List<AccessEvent> events = entry.getValue();
            String role = AccessGrouping.roleOf(events);
            if (!DetectionSettings.hasRole(settings.getProviderRoles(), role)) continue;

            String providerId = entry.getKey();
            Set<String> caseload = caseloadDirectory.caseloadOf(providerId);

            int outsideCount = 0;
            Set<String> outsideSubjects = new TreeSet<>();
            for (AccessEvent event : events) {
                String subject = event.getSubjectId();
                if (subject == null || event.isSelfAccess() || caseload.contains(subject)) continue;
                outsideCount++;
                outsideSubjects.add(subject);
            }
            if (outsideCount <= threshold) continue;

            String username = AccessGrouping.usernameOf(events, providerId);

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("heuristic", getType().name());
            context.put("actorRole", role);
            context.put("outsideAccessCount", outsideCount);
            context.put("outsideSubjects", new ArrayList<>(outsideSubjects));
            context.put("caseloadSize", caseload.size());
            context.put("threshold", threshold);

            candidates.add(AlertCandidate.builder()
                    .heuristic(getType())
                    .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                    .severity(Severity.MEDIUM)
                    .description(String.format(
                            "%s accessed %d records of %d patients outside their caseload (threshold=%d)",
                            username, outsideCount, outsideSubjects.size(), threshold))
                    .actorId(providerId)
                    .actorUsername(username)
                    .actorRole(role)
                    .context(context)
                    .dedupKey(getType().name() + ":" + providerId)
                    .build());
        }
        return candidates;
    }
}
