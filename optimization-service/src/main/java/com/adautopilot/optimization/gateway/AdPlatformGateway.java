package com.adautopilot.optimization.gateway;

import com.adautopilot.common.model.TargetLevel;
import reactor.core.publisher.Mono;

/**
 * Applies budget and status changes on the ad platform.
 *
 * <p>Calls are idempotent per {@code idempotencyKey}: retrying the same key must not
 * apply the change twice. Failures surface as {@code ActionExecutionException}.
 */
public interface AdPlatformGateway {

    Mono<GatewayResponse> updateBudget(String idempotencyKey, TargetLevel level, String targetId,
                                       double dailyBudgetUsd);

    Mono<GatewayResponse> updateStatus(String idempotencyKey, TargetLevel level, String targetId,
                                       String status);
}
