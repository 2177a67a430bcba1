package com.adautopilot.optimization.config;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.policy.PolicyEngine;
import com.adautopilot.common.prediction.PredictionEngine;
import com.adautopilot.common.roas.RoasCalculator;
import com.adautopilot.common.safety.SafetyEngine;
import com.adautopilot.optimization.service.ReallocationPlanner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AutopilotProperties.class)
public class OptimizationConfig {

    @Value("${services.ad-platform.base-url}")
    private String adPlatformUrl;

    @Value("${services.ledger.base-url}")
    private String ledgerUrl;

    @Bean
    public WebClient adPlatformClient(WebClient.Builder builder) {
        return builder.baseUrl(adPlatformUrl).build();
    }

    @Bean
    public WebClient ledgerClient(WebClient.Builder builder) {
        return builder.baseUrl(ledgerUrl).build();
    }

    @Bean
    public AutopilotSettings autopilotSettings(AutopilotProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoasCalculator roasCalculator(AutopilotSettings settings) {
        return new RoasCalculator(settings.roas());
    }

    @Bean
    public PredictionEngine predictionEngine(AutopilotSettings settings) {
        return new PredictionEngine(settings.roas());
    }

    @Bean
    public PolicyEngine policyEngine(AutopilotSettings settings, Clock clock) {
        return new PolicyEngine(settings.policy(), clock);
    }

    @Bean
    public SafetyEngine safetyEngine(AutopilotSettings settings, Clock clock) {
        return new SafetyEngine(settings.safety(), clock);
    }

    @Bean
    public ReallocationPlanner reallocationPlanner(AutopilotSettings settings) {
        return new ReallocationPlanner(settings.optimizer());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
