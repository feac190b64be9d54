package com.health.compliance.service;

import com.health.compliance.config.ReportingConfig;
import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.LogQuery;
import com.health.compliance.model.PagedResponse;
import com.health.compliance.model.ReasonStatus;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.repository.AccessEventRepository;
import com.health.compliance.repository.ActivityEventRepository;
import com.health.compliance.repository.SecurityEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditQueryServiceTest {

    @Mock
    private ActivityEventRepository activityEventRepository;

    @Mock
    private AccessEventRepository accessEventRepository;

    @Mock
    private SecurityEventRepository securityEventRepository;

    private AuditQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new AuditQueryService(activityEventRepository, accessEventRepository,
                securityEventRepository, new ReportingConfig());
    }

    @Test
    void findAccess_filtersBecomeQueryAndLimitIsCapped() {
        when(accessEventRepository.find(any(LogQuery.class), eq(AuditQueryService.MAX_PAGE_SIZE), isNull()))
                .thenReturn(PagedResponse.empty());

        queryService.findAccess(Map.of("subjectId", "P-7", "kind", "VIEW"), 10_000, null);

        ArgumentCaptor<LogQuery> query = ArgumentCaptor.forClass(LogQuery.class);
        verify(accessEventRepository).find(query.capture(), eq(AuditQueryService.MAX_PAGE_SIZE), isNull());
        assertThat(query.getValue().getSubjectId()).isEqualTo("P-7");
        assertThat(query.getValue().getKind()).isEqualTo("VIEW");
    }

    @Test
    void findActivity_nonPositiveLimit_rejected() {
        assertThatThrownBy(() -> queryService.findActivity(Map.of(), 0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("limit");
        verifyNoInteractions(activityEventRepository);
    }

    @Test
    void findSecurity_unknownFilter_rejected() {
        assertThatThrownBy(() -> queryService.findSecurity(Map.of("patient", "P-1"), 50, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(securityEventRepository);
    }

    @Test
    void accessSummary_countsMissingReasonsAndSubjects() {
        AccessEvent ok = createAccessEvent("A-1", "U-1", "provider", "P-1", NOW);
        AccessEvent missing = createAccessEvent("A-2", "U-2", "nurse", "P-2", NOW);
        missing.setReasonStatus(ReasonStatus.PLACEHOLDER);
        when(accessEventRepository.findAll(any(LogQuery.class))).thenReturn(List.of(ok, missing));

        Map<String, Object> summary = queryService.accessSummary(7);

        assertThat(summary.get("total")).isEqualTo(2);
        assertThat(summary.get("missing_reason")).isEqualTo(1L);
        assertThat(summary.get("unique_subjects")).isEqualTo(2L);
        assertThat(summary.get("by_role")).isEqualTo(Map.of("provider", 1L, "nurse", 1L));
    }

    @Test
    void securitySummary_criticalUnresolved() {
        when(securityEventRepository.findAll(any(LogQuery.class))).thenReturn(List.of(
                createSecurityEvent("S-1", SecurityEventType.UNUSUAL_ACTIVITY, Severity.CRITICAL, false, NOW),
                createSecurityEvent("S-2", SecurityEventType.UNUSUAL_ACTIVITY, Severity.CRITICAL, true, NOW),
                createSecurityEvent("S-3", SecurityEventType.LOGIN_FAILED, Severity.LOW, false, NOW)));

        Map<String, Object> summary = queryService.securitySummary(30);

        assertThat(summary.get("unresolved")).isEqualTo(2L);
        assertThat(summary.get("critical_unresolved")).isEqualTo(1L);
        assertThat(summary.get("by_severity")).isEqualTo(Map.of("CRITICAL", 2L, "LOW", 1L));
    }

    @Test
    void summary_zeroDays_rejected() {
        assertThatThrownBy(() -> queryService.activitySummary(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
