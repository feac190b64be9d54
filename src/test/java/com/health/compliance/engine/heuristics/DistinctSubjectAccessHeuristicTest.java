package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.model.AccessEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class DistinctSubjectAccessHeuristicTest {

    private final DistinctSubjectAccessHeuristic heuristic = new DistinctSubjectAccessHeuristic();
    private final DetectionSettings settings = defaultSettings();

    private DetectionWindow window(List<AccessEvent> events) {
        return DetectionWindow.builder().now(NOW).windowStart(NOW - DAY).accessEvents(events).build();
    }

    @Test
    void evaluate_21DistinctPatients_fires() {
        assertThat(heuristic.evaluate(window(createAccessBurst("U-1", "nurse", 21, NOW)), settings))
                .singleElement()
                .satisfies(c -> assertThat(c.getContext()).containsEntry("distinctSubjects", 21L));
    }

    @Test
    void evaluate_manyAccessesToFewPatients_doesNotFire() {
        List<AccessEvent> events = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            events.add(createAccessEvent("A-" + i, "U-1", "nurse", "P-" + (i % 5), NOW - i * MINUTE));
        }

        assertThat(heuristic.evaluate(window(events), settings)).isEmpty();
    }
}
