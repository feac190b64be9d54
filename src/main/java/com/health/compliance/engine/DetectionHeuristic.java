package com.health.compliance.engine;

import java.util.List;

/**
 * Interface for all anomaly detection heuristics.
 * Each implementation handles one HeuristicType and must be a pure function of its inputs.
 */
public interface DetectionHeuristic {

    /**
     * The heuristic this implementation provides.
     */
    HeuristicType getType();

    /**
     * Evaluate the window and return the alerts to raise, in a deterministic order.
     *
     * @param window   events loaded for this run, with the run's fixed "now"
     * @param settings configuration snapshot for this run
     * @return zero or more alert candidates
     */
    List<AlertCandidate> evaluate(DetectionWindow window, DetectionSettings settings);

    /**
     * Earliest raise time that still counts as a duplicate of a candidate with the same
     * de-duplication key. Defaults to the start of the lookback window; heuristics that look at a
     * shorter window narrow it so a fresh burst after that window is alerted again.
     */
    default long dedupSince(DetectionWindow window, DetectionSettings settings) {
        return window.getWindowStart();
    }
}
