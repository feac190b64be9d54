package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.DetectionHeuristic;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.engine.HeuristicType;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Counts failed logins per (username, IP) in the last failed-login window (default 15 min).
 * A group at or above the threshold (default 5) raises one HIGH brute-force alert.
 * This is the one heuristic that fires on count == threshold.
 */
@Component
public class BruteForceLoginHeuristic implements DetectionHeuristic {

    private static final String UNKNOWN = "unknown";

    @Override
    public HeuristicType getType() {
        return HeuristicType.BRUTE_FORCE_LOGIN;
    }

    @Override
    public List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings) {
        long since = window.getNow() - settings.getFailedLoginWindowMillis();
        int threshold = settings.getFailedLoginThreshold();

        SortedMap<String, SortedMap<String, Integer>> counts = new TreeMap<>();
        for (ActivityEvent event : window.getLoginEvents()) {
            if (!event.isFailedLogin()) continue;
            if (event.getTimestamp() < since || event.getTimestamp() > window.getNow()) continue;

            String username = event.getLoginUsername() != null ? event.getLoginUsername() : UNKNOWN;
            String ip = event.getIpAddress() != null ? event.getIpAddress() : UNKNOWN;
            counts.computeIfAbsent(username, k -> new TreeMap<>()).merge(ip, 1, Integer::sum);
        }

        List<AlertCandidate> candidates = new ArrayList<>();
        for (Map.Entry<String, SortedMap<String, Integer>> user : counts.entrySet()) {
            for (Map.Entry<String, Integer> byIp : user.getValue().entrySet()) {
                int count = byIp.getValue();
                if (count < threshold) continue;

                String username = user.getKey();
                String ip = byIp.getKey();

                Map<String, Object> context = new LinkedHashMap<>();
                context.put("heuristic", getType().name());
                context.put("username", username);
                context.put("failedAttempts", count);
                context.put("windowMinutes", settings.getFailedLoginWindowMinutes());
                context.put("threshold", threshold);

                candidates.add(AlertCandidate.builder()
                        .heuristic(getType())
                        .eventType(SecurityEventType.BRUTE_FORCE_ATTEMPT)
                        .severity(Severity.HIGH)
                        .description(String.format(
                                "Possible brute force attack: %d failed login attempts for user %s from IP %s in %d minutes",
                                count, username, ip, settings.getFailedLoginWindowMinutes()))
                        .actorUsername(username)
                        .ipAddress(UNKNOWN.equals(ip) ? null : ip)
                        .context(context)
                        .dedupKey(getType().name() + ":" + username + ":" + ip)
                        .build());
            }
        }
        return candidates;
    }

    /**
     * A burst only duplicates an alert raised within the same failed-login window.
     */
    @Override
    public long dedupSince(DetectionWindow window, DetectionSettings settings) {
        return window.getNow() - settings.getFailedLoginWindowMillis();
    }
}
