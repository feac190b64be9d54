package com.health.compliance.service;

import com.health.compliance.config.MetricsConfig;
import com.health.compliance.engine.AlertCandidate;
import com.health.compliance.engine.HeuristicType;
import com.health.compliance.exception.SecurityEventNotFoundException;
import com.health.compliance.model.AlertRequest;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.SecurityEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Optional;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertServiceTest {

    @Mock
    private SecurityEventRepository securityEventRepository;

    @Mock
    private TwilioNotificationService notificationService;

    private AlertService alertService;

    @BeforeEach
    void setUp() {
        alertService = new AlertService(securityEventRepository, notificationService,
                new MetricsConfig(new SimpleMeterRegistry()));
    }

    private void stubAppend() {
        when(securityEventRepository.append(any())).thenAnswer(inv -> {
            SecurityEvent event = inv.getArgument(0);
            event.setEventId("S-1");
            event.setTimestamp(NOW);
            return event;
        });
    }

    @Test
    void raise_highSeverity_notifies() {
        stubAppend();

        SecurityEvent event = alertService.raise(SecurityEventType.BRUTE_FORCE_ATTEMPT, "Brute force",
                Severity.HIGH, null, "alice", null, "203.0.113.7", null, Map.of("failedAttempts", 5));

        assertThat(event.getEventId()).isEqualTo("S-1");
        assertThat(event.isResolved()).isFalse();
        verify(notificationService).notifyAlert(event);
    }

    @Test
    void raise_mediumSeverity_doesNotNotify() {
        stubAppend();

        alertService.raise(SecurityEventType.PERMISSION_VIOLATION, "No reason", Severity.MEDIUM,
                "U-1", "dr.smith", "provider", null, null, null);

        verifyNoInteractions(notificationService);
    }

    @Test
    void raise_notificationFailure_alertStillPersisted() {
        stubAppend();
        doThrow(new RuntimeException("Twilio down")).when(notificationService).notifyAlert(any());

        SecurityEvent event = alertService.raise(SecurityEventType.UNUSUAL_ACTIVITY, "Critical",
                Severity.CRITICAL, "U-1", "dr.smith", "provider", null, null, null);

        assertThat(event.getEventId()).isEqualTo("S-1");
        verify(securityEventRepository).append(any());
    }

    @Test
    void raise_fromRequest_unknownTypeRejected() {
        AlertRequest request = AlertRequest.builder().eventType("NOPE").description("x").build();

        assertThatThrownBy(() -> alertService.raise(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE");
        verifyNoInteractions(securityEventRepository);
    }

    @Test
    void raise_fromRequest_defaultsToMediumSeverity() {
        stubAppend();
        AlertRequest request = AlertRequest.builder().eventType("suspicious_access").description("Odd access").build();

        SecurityEvent event = alertService.raise(request);

        assertThat(event.getEventType()).isEqualTo(SecurityEventType.SUSPICIOUS_ACCESS);
        assertThat(event.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void raiseUnlessDuplicate_existingKey_skipped() {
        AlertCandidate candidate = AlertCandidate.builder()
                .heuristic(HeuristicType.HIGH_VOLUME_ACCESS)
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.MEDIUM)
                .description("High volume")
                .dedupKey("HIGH_VOLUME_ACCESS:U-1")
                .build();
        when(securityEventRepository.claimDedupKey("HIGH_VOLUME_ACCESS:U-1", NOW - DAY)).thenReturn(false);

        Optional<SecurityEvent> result = alertService.raiseUnlessDuplicate(candidate, NOW - DAY);

        assertThat(result).isEmpty();
        verify(securityEventRepository, never()).append(any());
    }

    @Test
    void raiseUnlessDuplicate_claimGranted_raisesWithRole() {
        stubAppend();
        AlertCandidate candidate = AlertCandidate.builder()
                .heuristic(HeuristicType.HIGH_VOLUME_ACCESS)
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.MEDIUM)
                .description("High volume")
                .actorId("U-1")
                .actorRole("provider")
                .dedupKey("HIGH_VOLUME_ACCESS:U-1")
                .build();
        when(securityEventRepository.claimDedupKey("HIGH_VOLUME_ACCESS:U-1", NOW - DAY)).thenReturn(true);

        Optional<SecurityEvent> result = alertService.raiseUnlessDuplicate(candidate, NOW - DAY);

        assertThat(result).isPresent();
        assertThat(result.get().getActorRole()).isEqualTo("provider");
        assertThat(result.get().getDedupKey()).isEqualTo("HIGH_VOLUME_ACCESS:U-1");
        verify(securityEventRepository, never()).releaseDedupKey(any());
    }

    @Test
    void raiseUnlessDuplicate_writeFails_releasesClaim() {
        AlertCandidate candidate = AlertCandidate.builder()
                .heuristic(HeuristicType.RAPID_ACCESS)
                .eventType(SecurityEventType.UNUSUAL_ACTIVITY)
                .severity(Severity.MEDIUM)
                .description("Rapid access")
                .dedupKey("RAPID_ACCESS:U-1:2024-03-13T11:00Z")
                .build();
        when(securityEventRepository.claimDedupKey(candidate.getDedupKey(), NOW - DAY)).thenReturn(true);
        when(securityEventRepository.append(any())).thenThrow(new RuntimeException("store down"));

        assertThatThrownBy(() -> alertService.raiseUnlessDuplicate(candidate, NOW - DAY))
                .hasMessage("store down");
        verify(securityEventRepository).releaseDedupKey("RAPID_ACCESS:U-1:2024-03-13T11:00Z");
    }

    @Test
    void resolve_missingEvent_throwsNotFound() {
        when(securityEventRepository.resolve("MISSING", "officer", null)).thenReturn(null);

        assertThatThrownBy(() -> alertService.resolve("MISSING", "officer", null))
                .isInstanceOf(SecurityEventNotFoundException.class);
    }

    @Test
    void resolve_blankResolver_rejected() {
        assertThatThrownBy(() -> alertService.resolve("S-1", " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(securityEventRepository);
    }

    @Test
    void resolve_success_returnsResolvedEvent() {
        SecurityEvent resolved = createSecurityEvent("S-1", SecurityEventType.LOGIN_FAILED, Severity.MEDIUM, true, NOW);
        when(securityEventRepository.resolve("S-1", "officer", "Reviewed")).thenReturn(resolved);

        SecurityEvent result = alertService.resolve("S-1", "officer", "Reviewed");

        assertThat(result.isResolved()).isTrue();
        assertThat(result.getResolvedBy()).isEqualTo("officer");
    }
}
