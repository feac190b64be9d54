package com.health.compliance.contract;

import com.aerospike.client.AerospikeClient;
import com.health.compliance.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Guards the published OpenAPI document against accidental drift in paths and schemas that
 * compliance tooling depends on.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @MockBean
    private AerospikeClient aerospikeClient;

    @Autowired
    private TestRestTemplate restTemplate;

    private DocumentContext apiDocs() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void actuator_exposesOnlyConfiguredEndpoints() {
        ResponseEntity<String> response = restTemplate.getForEntity("/actuator", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);

        Map<String, Object> links = JsonPath.parse(response.getBody()).read("$._links");
        assertThat(links).containsKeys("health", "info", "metrics");
        assertThat(links).doesNotContainKey("prometheus");
    }

    @Test
    void openApiSpec_securityQueryAcceptsRoleAndCursor() {
        List<String> params = apiDocs().read("$.paths['/api/v1/audit/security'].get.parameters[*].name");

        assertThat(params).contains("role", "before");
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        Map<String, Object> paths = apiDocs().read("$.paths");

        // Capture
        assertThat(paths).containsKey("/api/v1/capture/observe");

        // Audit log queries
        assertThat(paths).containsKey("/api/v1/audit/activity");
        assertThat(paths).containsKey("/api/v1/audit/access");
        assertThat(paths).containsKey("/api/v1/audit/security");
        assertThat(paths).containsKey("/api/v1/audit/activity/{eventId}");
        assertThat(paths).containsKey("/api/v1/audit/access/{eventId}");
        assertThat(paths).containsKey("/api/v1/audit/security/{eventId}");
        assertThat(paths).containsKey("/api/v1/audit/activity/summary");
        assertThat(paths).containsKey("/api/v1/audit/access/summary");
        assertThat(paths).containsKey("/api/v1/audit/security/summary");

        // Alerts
        assertThat(paths).containsKey("/api/v1/alerts");
        assertThat(paths).containsKey("/api/v1/alerts/{eventId}");
        assertThat(paths).containsKey("/api/v1/alerts/{eventId}/resolve");
        assertThat(paths).containsKey("/api/v1/alerts/risk-assessment");

        // Detection
        assertThat(paths).containsKey("/api/v1/detection/run");
        assertThat(paths).containsKey("/api/v1/detection/caseloads/{providerId}");

        // Reports
        assertThat(paths).containsKey("/api/v1/reports");
        assertThat(paths).containsKey("/api/v1/reports/{reportId}");
        assertThat(paths).containsKey("/api/v1/reports/dashboard");
        assertThat(paths).containsKey("/api/v1/reports/dashboard-metrics");
        assertThat(paths).containsKey("/api/v1/reports/minimum-necessary");
        assertThat(paths).containsKey("/api/v1/reports/data-sharing");
        assertThat(paths).containsKey("/api/v1/reports/subject-access/{subjectId}");

        // Exports
        assertThat(paths).containsKey("/api/v1/exports");
        assertThat(paths).containsKey("/api/v1/exports/{exportId}");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        Map<String, Object> schemas = apiDocs().read("$.components.schemas");

        assertThat(schemas).containsKey("ObservedOperation");
        assertThat(schemas).containsKey("ActivityEvent");
        assertThat(schemas).containsKey("AccessEvent");
        assertThat(schemas).containsKey("SecurityEvent");
        assertThat(schemas).containsKey("RiskAssessment");
        assertThat(schemas).containsKey("ComplianceReport");
        assertThat(schemas).containsKey("DataExport");
    }

    @Test
    void openApiSpec_eventAndJobSchemas_haveRequiredFields() {
        DocumentContext json = apiDocs();

        Map<String, Object> accessProps = json.read("$.components.schemas.AccessEvent.properties");
        assertThat(accessProps).containsKey("eventId");
        assertThat(accessProps).containsKey("actorId");
        assertThat(accessProps).containsKey("subjectId");
        assertThat(accessProps).containsKey("accessType");
        assertThat(accessProps).containsKey("reason");
        assertThat(accessProps).containsKey("timestamp");

        Map<String, Object> securityProps = json.read("$.components.schemas.SecurityEvent.properties");
        assertThat(securityProps).containsKey("eventType");
        assertThat(securityProps).containsKey("severity");
        assertThat(securityProps).containsKey("resolved");
        assertThat(securityProps).containsKey("resolvedBy");

        Map<String, Object> reportProps = json.read("$.components.schemas.ComplianceReport.properties");
        assertThat(reportProps).containsKey("reportId");
        assertThat(reportProps).containsKey("reportType");
        assertThat(reportProps).containsKey("status");
        assertThat(reportProps).containsKey("artifactPath");
    }
}
