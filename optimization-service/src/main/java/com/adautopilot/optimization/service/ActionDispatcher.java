package com.adautopilot.optimization.service;

import com.adautopilot.common.exception.ActionExecutionException;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.adautopilot.optimization.gateway.AdPlatformGateway;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.repository.AdRepository;
import com.adautopilot.optimization.repository.CampaignRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies one action on the ad platform and mirrors the change locally.
 *
 * <p>Every gateway call carries the action id as idempotency key; reallocation
 * items use {@code actionId:adId}. Any error is returned as-is for the caller to
 * record as a failed execution.
 */
@Component
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private static final TypeReference<List<BudgetAllocation>> PLAN_TYPE = new TypeReference<>() {};

    private final AdPlatformGateway  gateway;
    private final AdRepository       adRepository;
    private final CampaignRepository campaignRepository;
    private final ObjectMapper       objectMapper;

    public ActionDispatcher(AdPlatformGateway gateway, AdRepository adRepository,
                            CampaignRepository campaignRepository, ObjectMapper objectMapper) {
        this.gateway            = gateway;
        this.adRepository       = adRepository;
        this.campaignRepository = campaignRepository;
        this.objectMapper       = objectMapper;
    }

    public Mono<ExecutionResult> dispatch(OptimizationAction action) {
        return switch (action.getActionType()) {
            case SCALE_UP, SCALE_DOWN -> applyBudget(action);
            case PAUSE                -> applyStatus(action, Campaign.STATUS_PAUSED);
            case RESUME               -> applyStatus(action, Campaign.STATUS_ACTIVE);
            case REALLOCATE           -> applyReallocation(action);
        };
    }

    /**
     * What {@link #dispatch} would send, without sending it.
     */
    public Map<String, Object> preview(OptimizationAction action) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("actionType", action.getActionType().wireName());
        details.put("targetLevel", action.getTargetLevel());
        details.put("targetId", action.getTargetId());
        switch (action.getActionType()) {
            case SCALE_UP, SCALE_DOWN -> {
                details.put("oldBudgetUsd", action.getOldBudgetUsd());
                details.put("newBudgetUsd", action.getNewBudgetUsd());
            }
            case PAUSE      -> details.put("newStatus", Campaign.STATUS_PAUSED);
            case RESUME     -> details.put("newStatus", Campaign.STATUS_ACTIVE);
            case REALLOCATE -> details.put("reallocationPlan", action.getReallocationPlan());
        }
        return details;
    }

    // ── executors ─────────────────────────────────────────────────────────────

    private Mono<ExecutionResult> applyBudget(OptimizationAction action) {
        Double budget = targetBudget(action);
        if (budget == null) {
            return Mono.error(new ActionExecutionException(action.getActionId(),
                "Action carries neither a new budget nor an old budget and percentage"));
        }
        double newBudget = budget;

        return gateway.updateBudget(action.getActionId(), action.getTargetLevel(), action.getTargetId(), newBudget)
            .flatMap(response -> mirrorBudget(action.getTargetLevel(), action.getTargetId(), newBudget)
                .thenReturn(response))
            .map(response -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("oldBudgetUsd", action.getOldBudgetUsd());
                details.put("newBudgetUsd", newBudget);
                details.put("requestId", response.requestId());
                log.info("Budget applied. actionId={} target={}:{} newBudgetUsd={}",
                         action.getActionId(), action.getTargetLevel(), action.getTargetId(), newBudget);
                return ExecutionResult.executed(action.getActionId(), details);
            });
    }

    private Mono<ExecutionResult> applyStatus(OptimizationAction action, String status) {
        return gateway.updateStatus(action.getActionId(), action.getTargetLevel(), action.getTargetId(), status)
            .flatMap(response -> mirrorStatus(action.getTargetLevel(), action.getTargetId(), status)
                .thenReturn(response))
            .map(response -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("newStatus", status);
                details.put("requestId", response.requestId());
                log.info("Status applied. actionId={} target={}:{} status={}",
                         action.getActionId(), action.getTargetLevel(), action.getTargetId(), status);
                return ExecutionResult.executed(action.getActionId(), details);
            });
    }

    private Mono<ExecutionResult> applyReallocation(OptimizationAction action) {
        return Mono.fromCallable(() -> readPlan(action))
            .flatMap(plan -> Flux.fromIterable(plan)
                .concatMap(item -> gateway
                    .updateBudget(action.getActionId() + ":" + item.adId(), TargetLevel.AD,
                                  item.adId(), item.newBudgetUsd())
                    .flatMap(r -> adRepository.updateDailyBudget(item.adId(), item.newBudgetUsd()))
                    .thenReturn(item))
                .collectList())
            .map(applied -> {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("allocations", applied);
                details.put("adsUpdated", applied.size());
                log.info("Reallocation applied. actionId={} campaignId={} adsUpdated={}",
                         action.getActionId(), action.getCampaignId(), applied.size());
                return ExecutionResult.executed(action.getActionId(), details);
            });
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private static Double targetBudget(OptimizationAction action) {
        if (action.getNewBudgetUsd() != null) {
            return action.getNewBudgetUsd();
        }
        if (action.getOldBudgetUsd() != null && action.getAmountPct() != null) {
            return Math.round(action.getOldBudgetUsd() * (1.0 + action.getAmountPct()) * 100.0) / 100.0;
        }
        return null;
    }

    private List<BudgetAllocation> readPlan(OptimizationAction action) {
        if (action.getReallocationPlan() == null || action.getReallocationPlan().isBlank()) {
            throw new ActionExecutionException(action.getActionId(), "Reallocation plan is missing");
        }
        try {
            return objectMapper.readValue(action.getReallocationPlan(), PLAN_TYPE);
        } catch (JsonProcessingException e) {
            throw new ActionExecutionException(action.getActionId(), "Reallocation plan is unreadable", e);
        }
    }

    private Mono<Integer> mirrorBudget(TargetLevel level, String targetId, double budget) {
        return switch (level) {
            case AD       -> adRepository.updateDailyBudget(targetId, budget);
            case CAMPAIGN -> campaignRepository.updateDailyBudget(targetId, budget);
            case AD_SET   -> Mono.just(0);
        };
    }

    private Mono<Integer> mirrorStatus(TargetLevel level, String targetId, String status) {
        return switch (level) {
            case AD       -> adRepository.updateStatus(targetId, status);
            case CAMPAIGN -> campaignRepository.updateStatus(targetId, status);
            case AD_SET   -> Mono.just(0);
        };
    }
}
