package com.adautopilot.optimization.service;

import com.adautopilot.common.exception.ActionExecutionException;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.adautopilot.optimization.gateway.AdPlatformGateway;
import com.adautopilot.optimization.gateway.GatewayResponse;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.repository.AdRepository;
import com.adautopilot.optimization.repository.CampaignRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ActionDispatcherTest {

    private AdPlatformGateway  gateway;
    private AdRepository       adRepository;
    private CampaignRepository campaignRepository;
    private ObjectMapper       objectMapper;
    private ActionDispatcher   dispatcher;

    @BeforeEach
    void setUp() {
        gateway            = mock(AdPlatformGateway.class);
        adRepository       = mock(AdRepository.class);
        campaignRepository = mock(CampaignRepository.class);
        objectMapper       = new ObjectMapper();
        dispatcher         = new ActionDispatcher(gateway, adRepository, campaignRepository, objectMapper);

        when(gateway.updateBudget(anyString(), any(), anyString(), anyDouble()))
            .thenReturn(Mono.just(new GatewayResponse(true, "req-1", "ok")));
        when(gateway.updateStatus(anyString(), any(), anyString(), anyString()))
            .thenReturn(Mono.just(new GatewayResponse(true, "req-2", "ok")));
        when(adRepository.updateDailyBudget(anyString(), anyDouble())).thenReturn(Mono.just(1));
        when(adRepository.updateStatus(anyString(), anyString())).thenReturn(Mono.just(1));
        when(campaignRepository.updateDailyBudget(anyString(), anyDouble())).thenReturn(Mono.just(1));
        when(campaignRepository.updateStatus(anyString(), anyString())).thenReturn(Mono.just(1));
    }

    private static OptimizationAction action(ActionType type, TargetLevel level, String targetId) {
        OptimizationAction action = new OptimizationAction();
        action.setActionId("act-1");
        action.setActionType(type);
        action.setTargetLevel(level);
        action.setTargetId(targetId);
        action.setCampaignId("camp-1");
        return action;
    }

    @Nested
    @DisplayName("budget changes")
    class Budget {

        @Test
        void sendsNewBudgetWithActionIdAsKeyAndMirrorsAd() {
            OptimizationAction action = action(ActionType.SCALE_UP, TargetLevel.AD, "a1");
            action.setOldBudgetUsd(100.0);
            action.setNewBudgetUsd(120.0);

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> {
                    assertTrue(result.succeeded());
                    assertEquals(120.0, result.details().get("newBudgetUsd"));
                    assertEquals("req-1", result.details().get("requestId"));
                })
                .verifyComplete();

            verify(gateway).updateBudget("act-1", TargetLevel.AD, "a1", 120.0);
            verify(adRepository).updateDailyBudget("a1", 120.0);
            verifyNoInteractions(campaignRepository);
        }

        @Test
        void derivesBudgetFromOldBudgetAndPercentage() {
            OptimizationAction action = action(ActionType.SCALE_DOWN, TargetLevel.CAMPAIGN, "camp-1");
            action.setOldBudgetUsd(250.0);
            action.setAmountPct(-0.2);

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> assertTrue(result.succeeded()))
                .verifyComplete();

            verify(gateway).updateBudget("act-1", TargetLevel.CAMPAIGN, "camp-1", 200.0);
            verify(campaignRepository).updateDailyBudget("camp-1", 200.0);
        }

        @Test
        void adSetChangeHasNoLocalMirror() {
            OptimizationAction action = action(ActionType.SCALE_UP, TargetLevel.AD_SET, "set-1");
            action.setNewBudgetUsd(80.0);

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> assertTrue(result.succeeded()))
                .verifyComplete();

            verify(adRepository, never()).updateDailyBudget(anyString(), anyDouble());
            verify(campaignRepository, never()).updateDailyBudget(anyString(), anyDouble());
        }

        @Test
        void missingBudgetFailsWithoutCallingGateway() {
            OptimizationAction action = action(ActionType.SCALE_UP, TargetLevel.AD, "a1");

            StepVerifier.create(dispatcher.dispatch(action))
                .expectError(ActionExecutionException.class)
                .verify();

            verifyNoInteractions(gateway);
        }

        @Test
        void gatewayErrorSkipsMirror() {
            when(gateway.updateBudget(anyString(), any(), anyString(), anyDouble()))
                .thenReturn(Mono.error(new ActionExecutionException("act-1", "platform rejected")));
            OptimizationAction action = action(ActionType.SCALE_UP, TargetLevel.AD, "a1");
            action.setNewBudgetUsd(120.0);

            StepVerifier.create(dispatcher.dispatch(action))
                .expectErrorMessage("[act-1] platform rejected")
                .verify();

            verify(adRepository, never()).updateDailyBudget(anyString(), anyDouble());
        }
    }

    @Nested
    @DisplayName("status changes")
    class Status {

        @Test
        void pauseSendsPausedAndMirrorsCampaign() {
            OptimizationAction action = action(ActionType.PAUSE, TargetLevel.CAMPAIGN, "camp-1");

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> assertEquals(Campaign.STATUS_PAUSED, result.details().get("newStatus")))
                .verifyComplete();

            verify(gateway).updateStatus("act-1", TargetLevel.CAMPAIGN, "camp-1", Campaign.STATUS_PAUSED);
            verify(campaignRepository).updateStatus("camp-1", Campaign.STATUS_PAUSED);
        }

        @Test
        void resumeSendsActiveForAd() {
            OptimizationAction action = action(ActionType.RESUME, TargetLevel.AD, "a1");

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> assertTrue(result.succeeded()))
                .verifyComplete();

            verify(gateway).updateStatus("act-1", TargetLevel.AD, "a1", Campaign.STATUS_ACTIVE);
            verify(adRepository).updateStatus("a1", Campaign.STATUS_ACTIVE);
        }
    }

    @Nested
    @DisplayName("reallocation")
    class Reallocation {

        @Test
        void appliesEachItemWithPerAdKey() throws Exception {
            OptimizationAction action = action(ActionType.REALLOCATE, TargetLevel.CAMPAIGN, "camp-1");
            action.setReallocationPlan(objectMapper.writeValueAsString(List.of(
                new BudgetAllocation("a1", 4.0, 0.9, 1.0, 100.0, 150.0),
                new BudgetAllocation("a2", 1.5, 0.9, 1.0, 100.0, 50.0))));

            StepVerifier.create(dispatcher.dispatch(action))
                .assertNext(result -> {
                    assertTrue(result.succeeded());
                    assertEquals(2, result.details().get("adsUpdated"));
                })
                .verifyComplete();

            verify(gateway).updateBudget("act-1:a1", TargetLevel.AD, "a1", 150.0);
            verify(gateway).updateBudget("act-1:a2", TargetLevel.AD, "a2", 50.0);
            verify(adRepository).updateDailyBudget("a1", 150.0);
            verify(adRepository).updateDailyBudget("a2", 50.0);
        }

        @Test
        void missingPlanFails() {
            OptimizationAction action = action(ActionType.REALLOCATE, TargetLevel.CAMPAIGN, "camp-1");

            StepVerifier.create(dispatcher.dispatch(action))
                .expectError(ActionExecutionException.class)
                .verify();

            verifyNoInteractions(gateway);
        }

        @Test
        void unreadablePlanFails() {
            OptimizationAction action = action(ActionType.REALLOCATE, TargetLevel.CAMPAIGN, "camp-1");
            action.setReallocationPlan("{not json");

            StepVerifier.create(dispatcher.dispatch(action))
                .expectErrorMessage("[act-1] Reallocation plan is unreadable")
                .verify();
        }
    }

    @Test
    void previewDescribesChangeWithoutCallingGateway() {
        OptimizationAction action = action(ActionType.SCALE_DOWN, TargetLevel.AD, "a1");
        action.setOldBudgetUsd(100.0);
        action.setNewBudgetUsd(80.0);

        Map<String, Object> details = dispatcher.preview(action);

        assertEquals("scale_down", details.get("actionType"));
        assertEquals(100.0, details.get("oldBudgetUsd"));
        assertEquals(80.0, details.get("newBudgetUsd"));
        verifyNoInteractions(gateway, adRepository, campaignRepository);
    }
}
