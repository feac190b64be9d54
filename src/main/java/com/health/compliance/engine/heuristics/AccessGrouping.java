package com.health.compliance.engine.heuristics;

import com.health.compliance.model.AccessEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Grouping helpers shared by the access heuristics. Keys are sorted so output order never
 * depends on the order events were loaded in.
 */
final class AccessGrouping {

    static final Comparator<AccessEvent> CHRONOLOGICAL = Comparator
            .comparingLong(AccessEvent::getTimestamp)
            .thenComparing(AccessEvent::getEventId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private AccessGrouping() {}

    /** Events grouped by actor id; anonymous accesses are left out. */
    static SortedMap<String, List<AccessEvent>> byActor(List<AccessEvent> events) {
        SortedMap<String, List<AccessEvent>> groups = new TreeMap<>();
        for (AccessEvent event : events) {
            if (event.getActorId() == null) continue;
            groups.computeIfAbsent(event.getActorId(), k -> new ArrayList<>()).add(event);
        }
        return groups;
    }

    static String roleOf(List<AccessEvent> events) {
        return events.stream()
                .map(AccessEvent::getActorRole)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    static String usernameOf(List<AccessEvent> events, String fallback) {
        return events.stream()
                .map(AccessEvent::getActorUsername)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(fallback);
    }
}
