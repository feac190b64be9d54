package com.health.compliance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit.risk")
public class RiskConfig {

    private int windowDays = 30;

    // A username with more than this many failed logins in the window counts as one repeat group.
    private int repeatLoginFailureMinimum = 3;

    private int trendWindowDays = 90;
}
