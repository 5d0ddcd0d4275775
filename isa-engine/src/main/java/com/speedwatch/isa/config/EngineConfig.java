package com.speedwatch.isa.config;

import com.speedwatch.isa.engine.ViolationCodeCatalog;
import com.speedwatch.isa.model.PolicyConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class EngineConfig {

    /**
     * The policy in force for this process. Loaded once; engine components receive it
     * as an argument on every call rather than reading configuration themselves.
     */
    @Bean
    public PolicyConfiguration policyConfiguration(IsaEngineProperties properties) {
        PolicyConfiguration policy = properties.getPolicy().toPolicyConfiguration();
        log.info("ISA policy: {} points / {} months (warning {}), {} tickets / {} months (warning {})",
                policy.getPointsThreshold(), policy.getDriverWindowMonths(), policy.getWarningBandPoints(),
                policy.getTicketThreshold(), policy.getVehicleWindowMonths(), policy.getWarningBandTickets());
        return policy;
    }

    @Bean
    public ViolationCodeCatalog violationCodeCatalog(IsaEngineProperties properties) {
        ViolationCodeCatalog catalog = properties.toCodeCatalog();
        log.info("Violation code catalog loaded with {} codes", catalog.size());
        return catalog;
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
