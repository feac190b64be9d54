package com.health.compliance.engine.heuristics;

import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.CaseloadDirectory;
import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.DetectionWindow;
import com.health.compliance.model.AccessEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutsideCaseloadAccessHeuristicTest {

    @Mock
    private CaseloadDirectory caseloadDirectory;

    private final DetectionSettings settings = defaultSettings();

    private DetectionWindow window(List<AccessEvent> events) {
        return DetectionWindow.builder().now(NOW).windowStart(NOW - DAY).accessEvents(events).build();
    }

    private List<AccessEvent> accesses(String actorId, String role, String... subjects) {
        List<AccessEvent> events = new ArrayList<>();
        for (int i = 0; i < subjects.length; i++) {
            events.add(createAccessEvent(actorId + "-" + i, actorId, role, subjects[i], NOW - i * MINUTE));
        }
        return events;
    }

    @Test
    void evaluate_fourOutsideAccesses_fires() {
        when(caseloadDirectory.caseloadOf("U-1")).thenReturn(Set.of("P-1"));
        OutsideCaseloadAccessHeuristic heuristic = new OutsideCaseloadAccessHeuristic(caseloadDirectory);

        List<AlertCandidate> result = heuristic.evaluate(
                window(accesses("U-1", "doctor", "P-1", "P-2", "P-3", "P-4", "P-5")), settings);

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getContext()).containsEntry("outsideAccessCount", 4);
    }

    @Test
    void evaluate_threeOutsideAccesses_doesNotFire() {
        when(caseloadDirectory.caseloadOf("U-1")).thenReturn(Set.of("P-1"));
        OutsideCaseloadAccessHeuristic heuristic = new OutsideCaseloadAccessHeuristic(caseloadDirectory);

        assertThat(heuristic.evaluate(
                window(accesses("U-1", "doctor", "P-1", "P-2", "P-3", "P-4")), settings)).isEmpty();
    }

    @Test
    void evaluate_nonProviderRole_notLookedUp() {
        OutsideCaseloadAccessHeuristic heuristic = new OutsideCaseloadAccessHeuristic(caseloadDirectory);

        assertThat(heuristic.evaluate(
                window(accesses("U-1", "billing", "P-2", "P-3", "P-4", "P-5", "P-6")), settings)).isEmpty();
        verify(caseloadDirectory, never()).caseloadOf(anyString());
    }

    @Test
    void evaluate_lookupFailure_propagates() {
        when(caseloadDirectory.caseloadOf("U-1")).thenThrow(new IllegalStateException("Corrupt caseload"));
        OutsideCaseloadAccessHeuristic heuristic = new OutsideCaseloadAccessHeuristic(caseloadDirectory);

        assertThatThrownBy(() -> heuristic.evaluate(window(accesses("U-1", "nurse", "P-2")), settings))
                .isInstanceOf(IllegalStateException.class);
    }
}
