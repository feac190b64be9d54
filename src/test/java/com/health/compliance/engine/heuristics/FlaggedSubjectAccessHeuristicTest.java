package com.health.compliance.engine.heuristics;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class FlaggedSubjectAccessHeuristicTest {

    private final FlaggedSubjectAccessHeuristic heuristic = new FlaggedSubjectAccessHeuristic();

    @Test
    void evaluate_watchListedSubject_raisesHighPerAccess() {
        DetectionConfig config = new DetectionConfig();
        config.setWatchListedSubjects(List.of("P-VIP"));
        DetectionSettings settings = config.toSettings();

        DetectionWindow window = DetectionWindow.builder()
                .now(NOW).windowStart(NOW - DAY)
                .accessEvent(createAccessEvent("A-1", "U-1", "provider", "P-VIP", NOW - 2 * MINUTE))
                .accessEvent(createAccessEvent("A-2", "U-2", "provider", "P-VIP", NOW - MINUTE))
                .accessEvent(createAccessEvent("A-3", "U-1", "provider", "P-1", NOW))
                .build();

        List<AlertCandidate> result = heuristic.evaluate(window, settings);

        assertThat(result).extracting(AlertCandidate::getActorId).containsExactly("U-1", "U-2");
        assertThat(result).allMatch(c -> c.getSeverity() == Severity.HIGH);
    }

    @Test
    void evaluate_emptyWatchList_raisesNothing() {
        DetectionWindow window = DetectionWindow.builder()
                .now(NOW).windowStart(NOW - DAY)
                .accessEvent(createAccessEvent("A-1", "U-1", "provider", "P-VIP", NOW))
                .build();

        assertThat(heuristic.evaluate(window, defaultSettings())).isEmpty();
    }
}
