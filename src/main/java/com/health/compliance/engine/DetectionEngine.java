package com.health.compliance.engine;

import com.health.compliance.config.DetectionConfig;
import com.health.compliance.config.MetricsConfig;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.DetectionRunReport;
import com.health.compliance.model.HeuristicOutcome;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.service.AlertService;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every enabled heuristic over one snapshot of the log store.
 *
 * Heuristics are independent and read-only, so they evaluate in parallel. Their alerts are then
 * raised on the calling thread in heuristic order, which keeps a run's output deterministic.
 * A failing heuristic is reported in the run report and does not stop the others.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private final Map<HeuristicType, DetectionHeuristic> heuristics;
    private final AccessEventRepository accessEventRepository;
    private final ActivityEventRepository activityEventRepository;
    private final AlertService alertService;
    private final DetectionConfig detectionConfig;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final ExecutorService executor;

    public DetectionEngine(List<DetectionHeuristic> heuristicList,
                           AccessEventRepository accessEventRepository,
                           ActivityEventRepository activityEventRepository,
                           AlertService alertService,
                           DetectionConfig detectionConfig,
                           Tracer tracer,
                           MetricsConfig metricsConfig) {
        this.heuristics = new EnumMap<>(HeuristicType.class);
        this.accessEventRepository = accessEventRepository;
        this.activityEventRepository = activityEventRepository;
        this.alertService = alertService;
        this.detectionConfig = detectionConfig;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all heuristic implementations
        for (DetectionHeuristic heuristic : heuristicList) {
            heuristics.put(heuristic.getType(), heuristic);
            log.info("Registered detection heuristic: {} -> {}",
                    heuristic.getType(), heuristic.getClass().getSimpleName());
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, detectionConfig.getParallelism()), r -> {
            Thread t = new Thread(r, "detection-heuristic-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Run all enabled heuristics over the lookback window ending at {@code now}.
     */
    @Observed(name = "detection.run", contextualName = "detection-run")
    public DetectionRunReport run(long now) {
        long startedAt = System.currentTimeMillis();
        DetectionSettings settings = detectionConfig.toSettings();
        DetectionWindow window = loadWindow(now, settings);

        Map<HeuristicType, Future<List<AlertCandidate>>> pending = new EnumMap<>(HeuristicType.class);
        for (DetectionHeuristic heuristic : heuristics.values()) {
            if (settings.isEnabled(heuristic.getType())) {
                pending.put(heuristic.getType(), executor.submit(() -> evaluateTraced(heuristic, window, settings)));
            }
        }

        DetectionRunReport report = DetectionRunReport.builder()
                .windowStart(window.getWindowStart())
                .windowEnd(now)
                .startedAt(startedAt)
                .build();

        for (HeuristicType type : heuristics.keySet()) {
            Future<List<AlertCandidate>> future = pending.get(type);
            HeuristicOutcome outcome;
            if (future == null) {
                outcome = HeuristicOutcome.builder()
                        .heuristic(type.name())
                        .status(HeuristicOutcome.Status.DISABLED)
                        .build();
            } else {
                outcome = collect(type, future, heuristics.get(type).dedupSince(window, settings));
            }
            metricsConfig.recordHeuristicRun(type.name(), outcome.getStatus().name());
            report.getOutcomes().add(outcome);
        }

        report.setCompletedAt(System.currentTimeMillis());
        if (report.isPartialSuccess()) {
            log.warn("Detection run finished with failures: {} (alerts raised: {})",
                    report.getFailedHeuristics(), report.getAlertsRaised());
        } else {
            log.info("Detection run finished: {} access events, {} login events, {} alerts raised",
                    window.getAccessEvents().size(), window.getLoginEvents().size(), report.getAlertsRaised());
        }
        return report;
    }

    DetectionWindow loadWindow(long now, DetectionSettings settings) {
        long windowStart = now - settings.getLookbackMillis();
        List<AccessEvent> accessEvents = accessEventRepository.findAll(LogQuery.between(windowStart, now));

        long loginStart = now - settings.getFailedLoginWindowMillis();
        List<ActivityEvent> loginEvents = activityEventRepository.findAll(LogQuery.builder()
                .from(loginStart)
                .to(now)
                .kind(ActivityEventType.LOGIN.name())
                .build());

        return DetectionWindow.builder()
                .now(now)
                .windowStart(windowStart)
                .accessEvents(accessEvents)
                .loginEvents(loginEvents)
                .build();
    }

    private List<AlertCandidate> evaluateTraced(DetectionHeuristic heuristic, DetectionWindow window,
                                                DetectionSettings settings) {
        Span span = tracer.nextSpan()
                .name("detection.heuristic." + heuristic.getType())
                .tag("heuristic.type", heuristic.getType().name())
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<AlertCandidate> candidates = heuristic.evaluate(window, settings);
            span.tag("heuristic.candidates", String.valueOf(candidates.size()));
            return candidates;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private HeuristicOutcome collect(HeuristicType type, Future<List<AlertCandidate>> future, long dedupSince) {
        HeuristicOutcome outcome = HeuristicOutcome.builder()
                .heuristic(type.name())
                .status(HeuristicOutcome.Status.SUCCEEDED)
                .build();

        List<AlertCandidate> candidates;
        try {
            candidates = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Heuristic {} failed: {}", type, cause.getMessage(), cause);
            outcome.setStatus(HeuristicOutcome.Status.FAILED);
            outcome.setError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome.setStatus(HeuristicOutcome.Status.FAILED);
            outcome.setError("Interrupted while waiting for heuristic");
            return outcome;
        }

        outcome.setCandidates(candidates.size());
        for (AlertCandidate candidate : candidates) {
            try {
                Optional<SecurityEvent> raised = alertService.raiseUnlessDuplicate(candidate, dedupSince);
                if (raised.isPresent()) {
                    outcome.setAlertsRaised(outcome.getAlertsRaised() + 1);
                } else {
                    outcome.setDuplicatesSkipped(outcome.getDuplicatesSkipped() + 1);
                }
            } catch (Exception e) {
                log.error("Failed to raise {} alert {}: {}", type, candidate.getDedupKey(), e.getMessage(), e);
                outcome.setStatus(HeuristicOutcome.Status.FAILED);
                outcome.setError("Alert persistence failed: " + e.getMessage());
            }
        }
        return outcome;
    }
}
