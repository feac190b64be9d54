package com.health.compliance.controller;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.PagedResponse;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import com.health.compliance.service.AuditQueryService;
import com.health.compliance.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.health.compliance.testutil.TestDataFactory.NOW;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditLogController.class)
class AuditLogControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AuditQueryService queryService;

    @Test
    void queryAccess_filtersPassedThrough() throws Exception {
        AccessEvent event = TestDataFactory.createAccessEvent("A-1", "U-1", "provider", "P-7", NOW);
        when(queryService.findAccess(eq(Map.of("actorId", "U-1", "subjectId", "P-7")), eq(25), isNull()))
                .thenReturn(new PagedResponse<>(List.of(event), true, String.valueOf(NOW)));

        mockMvc.perform(get("/api/v1/audit/access?actorId=U-1&subjectId=P-7&limit=25"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].eventId").value("A-1"))
                .andExpect(jsonPath("$.data[0].subjectId").value("P-7"))
                .andExpect(jsonPath("$.hasMore").value(true))
                .andExpect(jsonPath("$.nextCursor").value(String.valueOf(NOW)));
    }

    @Test
    void queryActivity_defaultLimitAndCursor() throws Exception {
        when(queryService.findActivity(eq(Map.of()), eq(50), eq("1700000000000:E-9")))
                .thenReturn(new PagedResponse<>(List.of(
                        TestDataFactory.createActivityEvent("E-1", "U-1", ActivityEventType.READ, NOW)), false, null));

        mockMvc.perform(get("/api/v1/audit/activity?before=1700000000000:E-9"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].eventType").value("READ"))
                .andExpect(jsonPath("$.hasMore").value(false));
    }

    @Test
    void querySecurity_roleFilterPassedThrough() throws Exception {
        when(queryService.findSecurity(eq(Map.of("role", "provider", "severity", "HIGH")), eq(50), isNull()))
                .thenReturn(new PagedResponse<>(List.of(TestDataFactory.createSecurityEvent(
                        "S-1", SecurityEventType.UNUSUAL_ACTIVITY, Severity.HIGH, false, NOW)), false, null));

        mockMvc.perform(get("/api/v1/audit/security?role=provider&severity=HIGH"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].actorRole").value("provider"));
    }

    @Test
    void querySecurity_badSeverity_badRequest() throws Exception {
        when(queryService.findSecurity(anyMap(), anyInt(), any()))
                .thenThrow(new IllegalArgumentException("Invalid severity 'urgent'"));

        mockMvc.perform(get("/api/v1/audit/security?severity=urgent"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid severity 'urgent'"));
    }

    @Test
    void getSecurity_found() throws Exception {
        when(queryService.getSecurity("S-1")).thenReturn(TestDataFactory.createSecurityEvent(
                "S-1", SecurityEventType.LOGIN_FAILED, Severity.HIGH, false, NOW));

        mockMvc.perform(get("/api/v1/audit/security/S-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.severity").value("HIGH"))
                .andExpect(jsonPath("$.resolved").value(false));
    }

    @Test
    void getActivity_notFound() throws Exception {
        when(queryService.getActivity("MISSING")).thenReturn(null);

        mockMvc.perform(get("/api/v1/audit/activity/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void accessSummary_routesToSummaryNotEventLookup() throws Exception {
        when(queryService.accessSummary(14)).thenReturn(Map.of("total_accesses", 12, "missing_reason", 3));

        mockMvc.perform(get("/api/v1/audit/access/summary?days=14"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_accesses").value(12))
                .andExpect(jsonPath("$.missing_reason").value(3));
    }
}
