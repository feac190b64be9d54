package com.health.compliance.reporting;

import com.health.compliance.model.AccessEvent;
import com.health.compliance.model.ActivityEvent;
import com.health.compliance.model.ActivityEventType;
import com.health.compliance.model.SecurityEvent;
import com.health.compliance.model.SecurityEventType;
import com.health.compliance.model.Severity;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;

import static com.health.compliance.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class CsvExportRendererTest {

    private final CsvExportRenderer renderer = new CsvExportRenderer(ZoneOffset.UTC);

    @Test
    void renderActivity_headerAndRowsInGivenOrder() {
        ActivityEvent newer = createActivityEvent("E-2", "U-1", ActivityEventType.READ, NOW);
        ActivityEvent older = createActivityEvent("E-1", "U-1", ActivityEventType.CREATE, NOW - HOUR);

        String[] lines = renderer.renderActivity(List.of(newer, older)).split("\n");

        assertThat(lines[0]).isEqualTo(CsvExportRenderer.ACTIVITY_HEADER);
        assertThat(lines).hasSize(3);
        assertThat(lines[1]).startsWith("E-2,2024-03-13 12:00:00,user-U-1,READ,patients,2001,");
        assertThat(lines[2]).startsWith("E-1,2024-03-13 11:00:00,");
    }

    @Test
    void renderActivity_anonymousActor() {
        ActivityEvent anonymous = createActivityEvent("E-1", null, ActivityEventType.READ, NOW);

        String[] lines = renderer.renderActivity(List.of(anonymous)).split("\n");

        assertThat(lines[1]).contains(",Anonymous,");
    }

    @Test
    void renderAccess_escapesCommasAndQuotes() {
        AccessEvent event = createAccessEvent("A-1", "U-1", "provider", "P-1", NOW);
        event.setReason("Follow-up, \"urgent\"");

        String[] lines = renderer.renderAccess(List.of(event)).split("\n");

        assertThat(lines[0]).isEqualTo(CsvExportRenderer.ACCESS_HEADER);
        assertThat(lines[1]).contains(",\"Follow-up, \"\"urgent\"\"\",");
    }

    @Test
    void renderSecurity_resolvedColumns() {
        SecurityEvent resolved = createSecurityEvent("S-1", SecurityEventType.LOGIN_FAILED, Severity.HIGH, true, NOW);
        SecurityEvent open = createSecurityEvent("S-2", SecurityEventType.LOGIN_FAILED, Severity.LOW, false, NOW);

        String[] lines = renderer.renderSecurity(List.of(resolved, open)).split("\n");

        assertThat(lines[1]).endsWith(",Yes,officer,2024-03-13 13:00:00");
        assertThat(lines[2]).endsWith(",No,,");
    }

    @Test
    void csv_newlinesFlattened() {
        assertThat(CsvExportRenderer.csv("line1\nline2")).isEqualTo("line1 line2");
        assertThat(CsvExportRenderer.csv(null)).isEmpty();
    }
}
