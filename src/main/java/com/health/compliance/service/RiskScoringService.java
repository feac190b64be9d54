package com.health.compliance.service;

import com.health.compliance.config.RiskConfig;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.RiskAssessment;
import com.health.compliance.model.RiskFactors;
import com.health.compliance.model.RiskLevel;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.SecurityEventRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Organizational risk score over the rolling risk window.
 *
 * score = (30 if any unresolved critical)
 *       + min(5 x high-or-critical, 30)
 *       + min(2 x suspicious-access, 20)
 *       + min(3 x permission-violation, 15)
 *       + min(1 x repeat-login-failure groups, 5)
 *
 * Each factor is capped before summing.
 */
@Service
public class RiskScoringService {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringService.class);

    private static final long DAY_MS = 86_400_000L;

    private final SecurityEventRepository securityEventRepository;
    private final RiskConfig riskConfig;

    public RiskScoringService(SecurityEventRepository securityEventRepository, RiskConfig riskConfig) {
        this.securityEventRepository = securityEventRepository;
        this.riskConfig = riskConfig;
    }

    @Observed(name = "risk.assess", contextualName = "risk-assessment")
    public RiskAssessment assess(long now) {
        long trendStart = now - Math.max(riskConfig.getTrendWindowDays(), riskConfig.getWindowDays()) * DAY_MS;
        List<SecurityEvent> events = securityEventRepository.findAll(LogQuery.between(trendStart, now));
        return assess(events, now);
    }

    /**
     * Assessment from an already-loaded event list covering at least the trend window.
     */
    public RiskAssessment assess(List<SecurityEvent> events, long now) {
        long windowStart = now - riskConfig.getWindowDays() * DAY_MS;
        List<SecurityEvent> window = events.stream()
                .filter(e -> e.getTimestamp() >= windowStart && e.getTimestamp() <= now)
                .toList();

        RiskFactors factors = computeFactors(window);
        int score = score(factors);
        RiskLevel level = RiskLevel.fromScore(score);
        log.debug("Risk assessment: score={}, level={}, factors={}", score, level, factors);

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.name(), window.stream().filter(e -> e.getSeverity() == severity).count());
        }

        return RiskAssessment.builder()
                .score(score)
                .level(level)
                .levelLabel(level.getLabel())
                .factors(factors)
                .windowDays(riskConfig.getWindowDays())
                .totalEvents(window.size())
                .unresolvedEvents(window.stream().filter(e -> !e.isResolved()).count())
                .bySeverity(bySeverity)
                .byType(countByType(window))
                .weeklyTrend(weeklyTrend(events, now))
                .generatedAt(now)
                .build();
    }

    public RiskFactors computeFactors(List<SecurityEvent> events) {
        boolean unresolvedCritical = events.stream()
                .anyMatch(e -> e.getSeverity() == Severity.CRITICAL && !e.isResolved());
        long highOrCritical = events.stream()
                .filter(e -> e.getSeverity() != null && e.getSeverity().isHighOrCritical())
                .count();
        long suspicious = events.stream()
                .filter(e -> e.getEventType() == SecurityEventType.SUSPICIOUS_ACCESS)
                .count();
        long violations = events.stream()
                .filter(e -> e.getEventType() == SecurityEventType.PERMISSION_VIOLATION)
                .count();

        Map<String, Long> failuresPerUser = events.stream()
                .filter(e -> e.getEventType() == SecurityEventType.LOGIN_FAILED)
                .map(RiskScoringService::loginFailureKey)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        long repeatGroups = failuresPerUser.values().stream()
                .filter(count -> count > riskConfig.getRepeatLoginFailureMinimum())
                .count();

        return RiskFactors.builder()
                .unresolvedCritical(unresolvedCritical)
                .highOrCriticalCount(highOrCritical)
                .suspiciousAccessCount(suspicious)
                .permissionViolationCount(violations)
                .repeatLoginFailureGroups(repeatGroups)
                .build();
    }

    public static int score(RiskFactors factors) {
        long score = 0;
        if (factors.isUnresolvedCritical()) {
            score += 30;
        }
        score += Math.min(5 * factors.getHighOrCriticalCount(), 30);
        score += Math.min(2 * factors.getSuspiciousAccessCount(), 20);
        score += Math.min(3 * factors.getPermissionViolationCount(), 15);
        score += Math.min(factors.getRepeatLoginFailureGroups(), 5);
        return (int) score;
    }

    private static String loginFailureKey(SecurityEvent event) {
        if (event.getActorUsername() != null) return event.getActorUsername();
        Object username = event.getContext() != null ? event.getContext().get("username") : null;
        if (username != null) return String.valueOf(username);
        return event.getIpAddress();
    }

    private static Map<String, Long> countByType(List<SecurityEvent> events) {
        Map<SecurityEventType, Long> counts = new EnumMap<>(SecurityEventType.class);
        for (SecurityEvent event : events) {
            if (event.getEventType() != null) counts.merge(event.getEventType(), 1L, Long::sum);
        }
        Map<String, Long> result = new LinkedHashMap<>();
        counts.forEach((type, count) -> result.put(type.name(), count));
        return result;
    }

    private List<Map<String, Object>> weeklyTrend(List<SecurityEvent> events, long now) {
        int weeks = Math.max(1, riskConfig.getTrendWindowDays() / 7);
        TreeMap<Long, long[]> buckets = new TreeMap<>();
        for (int i = weeks - 1; i >= 0; i--) {
            buckets.put(now - (i + 1) * 7 * DAY_MS, new long[2]);
        }
        for (SecurityEvent event : events) {
            Map.Entry<Long, long[]> bucket = buckets.floorEntry(event.getTimestamp());
            if (bucket == null || event.getTimestamp() > now) continue;
            bucket.getValue()[0]++;
            if (event.getSeverity() != null && event.getSeverity().isHighOrCritical()) {
                bucket.getValue()[1]++;
            }
        }

        List<Map<String, Object>> trend = new ArrayList<>();
        for (Map.Entry<Long, long[]> bucket : buckets.entrySet()) {
            Map<String, Object> week = new LinkedHashMap<>();
            week.put("weekStart", Instant.ofEpochMilli(bucket.getKey()).atZone(ZoneOffset.UTC).toLocalDate().toString());
            week.put("total", bucket.getValue()[0]);
            week.put("highSeverity", bucket.getValue()[1]);
            trend.add(week);
        }
        return trend;
    }
}
