package com.health.compliance.engine;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of the log store read once per detection run and shared by every heuristic.
 * Heuristics must treat the lists as read-only.
 */
@Value
@Builder
public class DetectionWindow {

    long now;
    long windowStart;

    // Access events in [windowStart, now]
    @Singular
    List<AccessEvent> accessEvents;

    // LOGIN activity events in the failed-login window
    @Singular
    List<ActivityEvent> loginEvents;
}
