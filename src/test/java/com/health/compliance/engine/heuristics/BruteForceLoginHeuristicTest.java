package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class BruteForceLoginHeuristicTest {

    private final BruteForceLoginHeuristic heuristic = new BruteForceLoginHeuristic();
    private final DetectionSettings settings = defaultSettings();

    private DetectionWindow window(List<ActivityEvent> logins) {
        return DetectionWindow.builder()
                .now(NOW)
                .windowStart(NOW - settings.getLookbackMillis())
                .loginEvents(logins)
                .build();
    }

    @Test
    void evaluate_fiveFailuresSameUserAndIp_firesOnce() {
        List<ActivityEvent> logins = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            logins.add(createFailedLogin("alice", "203.0.113.7", NOW - i * MINUTE));
        }

        List<AlertCandidate> result = heuristic.evaluate(window(logins), settings);

        assertThat(result).hasSize(1);
        AlertCandidate alert = result.get(0);
        assertThat(alert.getEventType()).isEqualTo(SecurityEventType.BRUTE_FORCE_ATTEMPT);
        assertThat(alert.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(alert.getActorUsername()).isEqualTo("alice");
        assertThat(alert.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(alert.getDedupKey()).isEqualTo("BRUTE_FORCE_LOGIN:alice:203.0.113.7");
    }

    @Test
    void evaluate_fiveFailuresSpreadAcrossTwoIps_doesNotFire() {
        List<ActivityEvent> logins = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            logins.add(createFailedLogin("alice", "203.0.113.7", NOW - i * MINUTE));
        }
        for (int i = 0; i < 2; i++) {
            logins.add(createFailedLogin("alice", "198.51.100.4", NOW - i * MINUTE));
        }

        assertThat(heuristic.evaluate(window(logins), settings)).isEmpty();
    }

    @Test
    void evaluate_failuresOutsideWindow_ignored() {
        List<ActivityEvent> logins = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            logins.add(createFailedLogin("alice", "203.0.113.7", NOW - i * MINUTE));
        }
        logins.add(createFailedLogin("alice", "203.0.113.7", NOW - 20 * MINUTE));

        assertThat(heuristic.evaluate(window(logins), settings)).isEmpty();
    }

    @Test
    void evaluate_successfulLoginsNotCounted() {
        List<ActivityEvent> logins = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ActivityEvent ok = createActivityEvent("OK-" + i, "U-1", ActivityEventType.LOGIN, NOW - i * MINUTE);
            ok.getContext().put("statusCode", 200);
            ok.getContext().put("outcome", "success");
            logins.add(ok);
        }

        assertThat(heuristic.evaluate(window(logins), settings)).isEmpty();
    }
}
