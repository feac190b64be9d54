package com.health.compliance.config;

import com.health.compliance.engine.DetectionSettings;
import com.health.compliance.engine.HeuristicType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bound from {@code audit.detection.*}. Mutable only during binding; every detection run works
 * on the immutable snapshot returned by {@link #toSettings()}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "audit.detection")
public class DetectionConfig {

    private boolean enabled = true;
    private int runIntervalMinutes = 60;
    private int lookbackHours = 24;
    private String zoneId = "UTC";
    private int parallelism = 4;

    private List<HeuristicType> disabledHeuristics = new ArrayList<>();

    private BusinessHours businessHours = new BusinessHours();
    private HighVolume highVolume = new HighVolume();
    private AfterHours afterHours = new AfterHours();
    private OutsideCaseload outsideCaseload = new OutsideCaseload();
    private RapidAccess rapidAccess = new RapidAccess();
    private FailedLogin failedLogin = new FailedLogin();

    private List<String> watchListedSubjects = new ArrayList<>();

    @Data
    public static class BusinessHours {
        private int start = 8;
        private int end = 18;
        private List<DayOfWeek> weekendDays = new ArrayList<>(List.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));
    }

    @Data
    public static class HighVolume {
        private int threshold = 20;
        private List<String> exemptRoles = new ArrayList<>(List.of("admin", "compliance"));
        private List<String> distinctSubjectExemptRoles = new ArrayList<>(List.of("admin", "compliance"));
    }

    @Data
    public static class AfterHours {
        private List<String> exemptRoles = new ArrayList<>(List.of("admin", "emergency_provider"));
        private boolean perAccessAlerts = true;
        private boolean aggregateAlerts = true;
    }

    @Data
    public static class OutsideCaseload {
        private int threshold = 3;
        private List<String> providerRoles = new ArrayList<>(List.of("provider", "doctor", "nurse"));
    }

    @Data
    public static class RapidAccess {
        // Bucket threshold is multiplier x high-volume threshold.
        private int multiplier = 2;
    }

    @Data
    public static class FailedLogin {
        private int windowMinutes = 15;
        private int threshold = 5;
    }

    public DetectionSettings toSettings() {
        Set<HeuristicType> disabled = disabledHeuristics.isEmpty()
                ? EnumSet.noneOf(HeuristicType.class)
                : EnumSet.copyOf(disabledHeuristics);
        return DetectionSettings.builder()
                .zoneId(ZoneId.of(zoneId))
                .lookbackHours(lookbackHours)
                .businessHoursStart(businessHours.getStart())
                .businessHoursEnd(businessHours.getEnd())
                .weekendDays(Collections.unmodifiableSet(businessHours.getWeekendDays().isEmpty()
                        ? EnumSet.noneOf(DayOfWeek.class)
                        : EnumSet.copyOf(businessHours.getWeekendDays())))
                .highVolumeThreshold(highVolume.getThreshold())
                .highVolumeExemptRoles(normalize(highVolume.getExemptRoles()))
                .distinctSubjectExemptRoles(normalize(highVolume.getDistinctSubjectExemptRoles()))
                .afterHoursExemptRoles(normalize(afterHours.getExemptRoles()))
                .afterHoursPerAccessAlerts(afterHours.isPerAccessAlerts())
                .afterHoursAggregateAlerts(afterHours.isAggregateAlerts())
                .providerRoles(normalize(outsideCaseload.getProviderRoles()))
                .outsideCaseloadThreshold(outsideCaseload.getThreshold())
                .rapidAccessMultiplier(rapidAccess.getMultiplier())
                .failedLoginWindowMinutes(failedLogin.getWindowMinutes())
                .failedLoginThreshold(failedLogin.getThreshold())
                .watchListedSubjects(Set.copyOf(new HashSet<>(watchListedSubjects)))
                .disabledHeuristics(Collections.unmodifiableSet(disabled))
                .build();
    }

    private static Set<String> normalize(List<String> roles) {
        return roles.stream()
                .map(r -> r.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
