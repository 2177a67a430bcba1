package com.adautopilot.optimization.gateway;

import com.adautopilot.common.exception.ActionExecutionException;
import com.adautopilot.common.model.TargetLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the ad-platform gateway service.
 *
 * <p>Every request carries an {@code Idempotency-Key} header. Transport errors, non-2xx
 * responses and {@code success=false} bodies are all mapped to
 * {@link ActionExecutionException} so executors see a single failure type.
 */
@Component
public class WebClientAdPlatformGateway implements AdPlatformGateway {

    private static final Logger log = LoggerFactory.getLogger(WebClientAdPlatformGateway.class);

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final WebClient adPlatformClient;

    public WebClientAdPlatformGateway(@Qualifier("adPlatformClient") WebClient adPlatformClient) {
        this.adPlatformClient = adPlatformClient;
    }

    @Override
    public Mono<GatewayResponse> updateBudget(String idempotencyKey, TargetLevel level, String targetId,
                                              double dailyBudgetUsd) {
        return post(idempotencyKey, "/api/v1/{level}/{id}/budget", level, targetId,
            Map.of("dailyBudgetUsd", dailyBudgetUsd));
    }

    @Override
    public Mono<GatewayResponse> updateStatus(String idempotencyKey, TargetLevel level, String targetId,
                                              String status) {
        return post(idempotencyKey, "/api/v1/{level}/{id}/status", level, targetId,
            Map.of("status", status));
    }

    private Mono<GatewayResponse> post(String idempotencyKey, String uri, TargetLevel level, String targetId,
                                       Map<String, Object> body) {
        String levelPath = level.name().toLowerCase();
        return adPlatformClient.post()
            .uri(uri, levelPath, targetId)
            .header(IDEMPOTENCY_HEADER, idempotencyKey)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(GatewayResponse.class)
            .timeout(TIMEOUT)
            .switchIfEmpty(Mono.error(new ActionExecutionException(idempotencyKey, "Empty gateway response")))
            .flatMap(response -> response.success()
                ? Mono.just(response)
                : Mono.error(new ActionExecutionException(idempotencyKey,
                    "Gateway rejected change: " + response.message())))
            .doOnSuccess(r -> log.info("Gateway call applied. key={} level={} target={} requestId={}",
                idempotencyKey, level, targetId, r.requestId()))
            .onErrorMap(e -> !(e instanceof ActionExecutionException),
                e -> new ActionExecutionException(idempotencyKey, "Gateway call failed: " + e.getMessage(), e));
    }
}
