package com.health.compliance.engine;

import lombok.Builder;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable snapshot of the detection configuration for one run. Roles are lower-case.
 */
@Value
@Builder
public class DetectionSettings {

    ZoneId zoneId;
    int lookbackHours;

    int businessHoursStart;
    int businessHoursEnd;
    Set<DayOfWeek> weekendDays;

    int highVolumeThreshold;
    Set<String> highVolumeExemptRoles;
    Set<String> distinctSubjectExemptRoles;

    Set<String> afterHoursExemptRoles;
    boolean afterHoursPerAccessAlerts;
    boolean afterHoursAggregateAlerts;

    Set<String> providerRoles;
    int outsideCaseloadThreshold;

    int rapidAccessMultiplier;

    int failedLoginWindowMinutes;
    int failedLoginThreshold;

    Set<String> watchListedSubjects;

    Set<HeuristicType> disabledHeuristics;

    public boolean isEnabled(HeuristicType type) {
        return !disabledHeuristics.contains(type);
    }

    public int getRapidAccessThreshold() {
        return highVolumeThreshold * rapidAccessMultiplier;
    }

    public long getLookbackMillis() {
        return lookbackHours * 3_600_000L;
    }

    public long getFailedLoginWindowMillis() {
        return failedLoginWindowMinutes * 60_000L;
    }

    /**
     * True when the instant falls outside [start, end) local hours or on a weekend day.
     */
    public boolean isAfterHours(long epochMillis) {
        ZonedDateTime local = Instant.ofEpochMilli(epochMillis).atZone(zoneId);
        if (weekendDays.contains(local.getDayOfWeek())) return true;
        int hour = local.getHour();
        return hour < businessHoursStart || hour >= businessHoursEnd;
    }

    public static boolean hasRole(Set<String> roles, String role) {
        return role != null && roles.contains(role.trim().toLowerCase(Locale.ROOT));
    }
}
