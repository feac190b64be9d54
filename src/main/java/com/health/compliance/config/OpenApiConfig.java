package com.health.compliance.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI complianceAuditOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Compliance Audit API")
                        .version("1.0.0")
                        .description(
                                "Audit capture, anomaly detection and compliance reporting for protected health data.\n\n" +
                                "**Capture:**\n" +
                                "1. The platform reports each operation via `POST /capture/observe`\n" +
                                "2. Every audited operation becomes an activity event\n" +
                                "3. Operations on protected paths with a resolvable patient also become an access event\n" +
                                "4. Missing access reasons and auth failures raise security events immediately\n\n" +
                                "**Detection heuristics** (run every hour over the last 24h):\n" +
                                "- `HIGH_VOLUME_ACCESS` - more accesses than the threshold by one actor\n" +
                                "- `DISTINCT_SUBJECT_ACCESS` - too many distinct patients touched by one actor\n" +
                                "- `AFTER_HOURS_ACCESS` - access outside business hours or on weekends\n" +
                                "- `OUTSIDE_CASELOAD_ACCESS` - providers touching patients outside their caseload\n" +
                                "- `RAPID_ACCESS` - bursts within one calendar hour\n" +
                                "- `BRUTE_FORCE_LOGIN` - repeated failed logins per username and IP\n" +
                                "- `FLAGGED_SUBJECT_ACCESS` - any access to a watch-listed patient\n\n" +
                                "**Reports** run asynchronously: `PENDING` -> `PROCESSING` -> `COMPLETED` | `FAILED`.")
                        .contact(new Contact().name("Compliance Engineering")));
    }
}
