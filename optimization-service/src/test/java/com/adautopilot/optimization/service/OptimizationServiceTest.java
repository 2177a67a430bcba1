package com.adautopilot.optimization.service;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.exception.ActionExecutionException;
import com.adautopilot.common.exception.DuplicateActionException;
import com.adautopilot.common.exception.InvalidStateException;
import com.adautopilot.common.exception.NotFoundException;
import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.ActionStatus;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.adautopilot.optimization.InMemoryActionStore;
import com.adautopilot.optimization.ledger.EventLedger;
import com.adautopilot.optimization.ledger.LedgerEvent;
import com.adautopilot.optimization.model.Ad;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.repository.AdRepository;
import com.adautopilot.optimization.repository.CampaignRepository;
import com.adautopilot.optimization.repository.RoasMetricsRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.adautopilot.optimization.TestData.CLOCK;
import static com.adautopilot.optimization.TestData.NOW;
import static com.adautopilot.optimization.TestData.TODAY;
import static com.adautopilot.optimization.TestData.activeCampaign;
import static com.adautopilot.optimization.TestData.ad;
import static com.adautopilot.optimization.TestData.adMetrics;
import static com.adautopilot.optimization.TestData.campaign;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OptimizationServiceTest {

    private final AutopilotSettings settings = AutopilotSettings.defaults();
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private InMemoryActionStore   store;
    private CampaignRepository    campaignRepository;
    private AdRepository          adRepository;
    private RoasMetricsRepository metricsRepository;
    private ActionDispatcher      dispatcher;
    private EventLedger           ledger;
    private OptimizationService   service;

    @BeforeEach
    void setUp() {
        store              = new InMemoryActionStore();
        campaignRepository = mock(CampaignRepository.class);
        adRepository       = mock(AdRepository.class);
        metricsRepository  = mock(RoasMetricsRepository.class);
        dispatcher         = mock(ActionDispatcher.class);
        ledger             = mock(EventLedger.class);

        when(campaignRepository.findById(anyString())).thenReturn(Mono.empty());
        when(adRepository.findByCampaignId(anyString())).thenReturn(Flux.empty());
        when(metricsRepository.findAdMetricsForCampaign(anyString(), any())).thenReturn(Flux.empty());
        when(dispatcher.dispatch(any())).thenAnswer(inv -> {
            OptimizationAction action = inv.getArgument(0);
            return Mono.just(ExecutionResult.executed(action.getActionId(), Map.of("newBudgetUsd", 120.0)));
        });
        when(dispatcher.preview(any())).thenReturn(Map.of("actionType", "scale_up", "newBudgetUsd", 120.0));

        service = new OptimizationService(campaignRepository, adRepository, metricsRepository,
            store.repository(), new ReallocationPlanner(settings.optimizer()), dispatcher, ledger,
            objectMapper, settings, CLOCK);
    }

    private void givenCampaign(Campaign campaign, List<Ad> ads, List<RoasMetricsRecord> rowsNewestFirst) {
        String id = campaign.getCampaignId();
        when(campaignRepository.findById(id)).thenReturn(Mono.just(campaign));
        when(adRepository.findByCampaignId(id)).thenReturn(Flux.fromIterable(ads));
        when(metricsRepository.findAdMetricsForCampaign(eq(id), any()))
            .thenReturn(Flux.fromIterable(rowsNewestFirst));
    }

    private List<CandidateAction> evaluate(String campaignId) {
        return service.evaluateCampaign(campaignId, 7, settings.optimizer().minConfidence()).block();
    }

    private static CandidateAction scaleUp(String adId, double confidence) {
        return new CandidateAction(ActionType.SCALE_UP, TargetLevel.AD, adId, "camp-1", "set-1", adId,
            0.20, 20.0, 100.0, 120.0, "High ROAS", "ROAS 4.00 over 40 conversions",
            confidence, 4.0, 500.0, 5_000L, null);
    }

    private OptimizationAction enqueued(String adId) {
        return service.enqueueAction(scaleUp(adId, 0.9), "alice").block();
    }

    private List<String> ledgerEventTypes() {
        ArgumentCaptor<LedgerEvent> captor = ArgumentCaptor.forClass(LedgerEvent.class);
        verify(ledger, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues().stream().map(LedgerEvent::eventType).collect(Collectors.toList());
    }

    // ── evaluateCampaign ───────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluateCampaign()")
    class Evaluate {

        @Test
        @DisplayName("high ROAS ad → scale up capped at the daily change limit")
        void scaleUp() {
            givenCampaign(activeCampaign("camp-1", 72), List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));

            List<CandidateAction> candidates = evaluate("camp-1");

            assertEquals(1, candidates.size());
            CandidateAction c = candidates.get(0);
            assertEquals(ActionType.SCALE_UP, c.type());
            assertEquals(TargetLevel.AD, c.targetLevel());
            assertEquals("a1", c.targetId());
            assertEquals(0.20, c.amountPct(), 1e-9);
            assertEquals(100.0, c.oldBudgetUsd(), 1e-9);
            assertEquals(120.0, c.newBudgetUsd(), 1e-9);
            assertEquals(0.9, c.confidence(), 1e-9);
            assertEquals("High ROAS", c.reason());
        }

        @Test
        @DisplayName("low ROAS → scale down, ROAS under the pause line → pause, worst first")
        void scaleDownAndPause() {
            givenCampaign(activeCampaign("camp-1", 72),
                List.of(ad("a1", "camp-1", 100.0), ad("a2", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 1.2, 0.9),
                        adMetrics("camp-1", "a2", TODAY, 0.5, 0.9)));

            List<CandidateAction> candidates = evaluate("camp-1");

            assertEquals(2, candidates.size());
            assertEquals(ActionType.PAUSE, candidates.get(0).type());
            assertEquals("a2", candidates.get(0).targetId());
            assertEquals(-1.0, candidates.get(0).amountPct(), 1e-9);
            assertEquals(0.0, candidates.get(0).newBudgetUsd(), 1e-9);

            assertEquals(ActionType.SCALE_DOWN, candidates.get(1).type());
            assertEquals(-0.20, candidates.get(1).amountPct(), 1e-9);
            assertEquals(80.0, candidates.get(1).newBudgetUsd(), 1e-9);
        }

        @Test
        @DisplayName("only the newest row of each ad is used")
        void latestRowPerAd() {
            givenCampaign(activeCampaign("camp-1", 72), List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 1.2, 0.9),
                        adMetrics("camp-1", "a1", TODAY.minusDays(1), 6.0, 0.9)));

            List<CandidateAction> candidates = evaluate("camp-1");

            assertEquals(1, candidates.size());
            assertEquals(ActionType.SCALE_DOWN, candidates.get(0).type());
        }

        @Test
        @DisplayName("uneven ROAS across three ads → reallocation that does not grow the total")
        void reallocation() {
            givenCampaign(activeCampaign("camp-1", 72),
                List.of(ad("a1", "camp-1", 100.0), ad("a2", "camp-1", 100.0), ad("a3", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 4.0, 0.9),
                        adMetrics("camp-1", "a2", TODAY, 1.6, 0.9),
                        adMetrics("camp-1", "a3", TODAY, 1.8, 0.9)));

            List<CandidateAction> candidates = evaluate("camp-1");

            assertEquals(List.of(ActionType.SCALE_UP, ActionType.REALLOCATE),
                candidates.stream().map(CandidateAction::type).collect(Collectors.toList()));

            CandidateAction realloc = candidates.get(1);
            assertEquals(TargetLevel.CAMPAIGN, realloc.targetLevel());
            assertEquals("camp-1", realloc.targetId());
            assertEquals(settings.optimizer().reallocationConfidence(), realloc.confidence(), 1e-9);

            List<BudgetAllocation> plan = realloc.reallocationPlan();
            assertEquals(3, plan.size());
            assertEquals("a1", plan.get(0).adId());
            assertEquals(162.16, plan.get(0).newBudgetUsd(), 0.011);
            double total = plan.stream().mapToDouble(BudgetAllocation::newBudgetUsd).sum();
            assertTrue(total <= 300.0 + 1e-9, "plan total " + total);
        }

        @Test
        @DisplayName("campaign inside the optimizer embargo → no candidates")
        void embargo() {
            givenCampaign(activeCampaign("camp-1", 10), List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));

            assertTrue(evaluate("camp-1").isEmpty());
        }

        @Test
        @DisplayName("paused or unknown campaign → no candidates")
        void notActive() {
            givenCampaign(campaign("camp-1", Campaign.STATUS_PAUSED, NOW.minusDays(5)),
                List.of(ad("a1", "camp-1", 100.0)), List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));

            assertTrue(evaluate("camp-1").isEmpty());
            assertTrue(evaluate("missing").isEmpty());
        }

        @Test
        @DisplayName("confidence below the minimum → dropped")
        void lowConfidence() {
            givenCampaign(activeCampaign("camp-1", 72), List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.5)));

            assertTrue(evaluate("camp-1").isEmpty());
        }

        @Test
        @DisplayName("outlier rows never produce a scale up")
        void outlierExcluded() {
            RoasMetricsRecord row = adMetrics("camp-1", "a1", TODAY, 6.0, 0.9);
            row.setOutlier(true);
            givenCampaign(activeCampaign("camp-1", 72), List.of(ad("a1", "camp-1", 100.0)), List.of(row));

            assertTrue(evaluate("camp-1").isEmpty());
        }

        @Test
        @DisplayName("ad without a local record is skipped")
        void unknownAd() {
            givenCampaign(activeCampaign("camp-1", 72), List.of(),
                List.of(adMetrics("camp-1", "ghost", TODAY, 6.0, 0.9)));

            assertTrue(evaluate("camp-1").isEmpty());
        }

        @Test
        @DisplayName("target with an open action of the same type is cooling down")
        void coolingDown() {
            givenCampaign(activeCampaign("camp-1", 72), List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));

            CandidateAction first = evaluate("camp-1").get(0);
            service.enqueueAction(first, "alice").block();

            assertTrue(evaluate("camp-1").isEmpty());
        }
    }

    // ── queue ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cent rounding toward the old budget")
    class CentRounding {

        @Test
        @DisplayName("cap-sized changes on odd budgets never exceed the cap")
        void neverExceedsCap() {
            assertEquals(39.60, OptimizationService.centsTowardOld(33.00, 33.00 * 1.2), 1e-9);
            assertEquals(26.40, OptimizationService.centsTowardOld(33.00, 33.00 * 0.8), 1e-9);
            assertEquals(119.98, OptimizationService.centsTowardOld(99.99, 99.99 * 1.2), 1e-9);
            assertEquals(80.00, OptimizationService.centsTowardOld(99.99, 99.99 * 0.8), 1e-9);
        }

        @Test
        @DisplayName("a pause target stays at zero")
        void pauseIsZero() {
            assertEquals(0.0, OptimizationService.centsTowardOld(99.99, 0.0));
        }
    }

    @Nested
    @DisplayName("enqueueAction()")
    class Enqueue {

        @Test
        @DisplayName("persists SUGGESTED with an expiry and records the suggestion")
        void enqueue() {
            OptimizationAction action = enqueued("a1");

            assertNotNull(action.getActionId());
            assertEquals(ActionStatus.SUGGESTED, action.getStatus());
            assertEquals("alice", action.getCreatedBy());
            assertEquals(NOW, action.getCreatedAt());
            assertEquals(NOW.plusHours(settings.optimizer().actionExpiryHours()), action.getExpiresAt());
            assertSame(action, store.get(action.getActionId()));
            assertEquals(List.of("optimization_suggested"), ledgerEventTypes());
        }

        @Test
        @DisplayName("reallocation stores its plan and affected ads as JSON")
        void reallocationPlanStored() {
            List<BudgetAllocation> plan = List.of(
                new BudgetAllocation("a1", 4.0, 0.9, 3.6, 100, 150),
                new BudgetAllocation("a2", 1.0, 0.9, 0.45, 100, 50));
            CandidateAction candidate = new CandidateAction(ActionType.REALLOCATE, TargetLevel.CAMPAIGN,
                "camp-1", "camp-1", null, null, null, 50.0, null, null, "Uneven ROAS across ads", null,
                0.7, 4.0, 1_000.0, 10_000L, plan);

            OptimizationAction action = service.enqueueAction(candidate, "alice").block();

            assertTrue(action.getReallocationPlan().contains("\"adId\":\"a1\""));
            assertEquals("[\"a1\",\"a2\"]", action.getAffectedAdIds());
        }

        @Test
        @DisplayName("a second open action of the same type on the target is rejected")
        void sameTargetAndTypeTwice() {
            enqueued("a1");

            StepVerifier.create(service.enqueueAction(scaleUp("a1", 0.8), "bob"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(DuplicateActionException.class, e);
                    assertEquals("a1", ((DuplicateActionException) e).getTargetId());
                })
                .verify();

            assertEquals(1, store.all().size());
        }

        @Test
        @DisplayName("an open action older than the cooldown window still blocks")
        void oldOpenActionBlocks() {
            store.seed("old", ActionType.SCALE_UP, "a1", ActionStatus.PENDING, 0.9,
                NOW.minusHours(30), NOW.plusHours(18));

            StepVerifier.create(service.enqueueAction(scaleUp("a1", 0.9), "alice"))
                .expectError(DuplicateActionException.class)
                .verify();
        }

        @Test
        @DisplayName("a cancelled action or a different type does not block")
        void cancelledOrOtherTypeAllowed() {
            store.seed("gone", ActionType.SCALE_UP, "a1", ActionStatus.CANCELLED, 0.9,
                NOW.minusHours(1), NOW.plusHours(47));
            store.seed("down", ActionType.SCALE_DOWN, "a1", ActionStatus.SUGGESTED, 0.9,
                NOW.minusHours(1), NOW.plusHours(47));

            StepVerifier.create(service.enqueueAction(scaleUp("a1", 0.9), "alice"))
                .assertNext(a -> assertEquals(ActionStatus.SUGGESTED, a.getStatus()))
                .verifyComplete();
        }

        @Test
        @DisplayName("confidence outside [0, 1] is rejected")
        void badConfidence() {
            StepVerifier.create(service.enqueueAction(scaleUp("a1", 1.5), "alice"))
                .expectError(ValidationException.class)
                .verify();
            assertTrue(store.all().isEmpty());
        }

        @Test
        @DisplayName("reallocation without a plan is rejected")
        void reallocationWithoutPlan() {
            CandidateAction candidate = new CandidateAction(ActionType.REALLOCATE, TargetLevel.CAMPAIGN,
                "camp-1", "camp-1", null, null, null, null, null, null, "Uneven ROAS across ads", null,
                0.7, null, null, null, List.of());

            StepVerifier.create(service.enqueueAction(candidate, "alice"))
                .expectError(ValidationException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("approve and cancel")
    class ApproveCancel {

        @Test
        @DisplayName("approve moves SUGGESTED to PENDING once")
        void approveOnce() {
            String id = enqueued("a1").getActionId();

            StepVerifier.create(service.approveAction(id, "bob"))
                .assertNext(a -> {
                    assertEquals(ActionStatus.PENDING, a.getStatus());
                    assertEquals("bob", a.getApprovedBy());
                    assertEquals(NOW, a.getApprovedAt());
                })
                .verifyComplete();

            StepVerifier.create(service.approveAction(id, "bob"))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(InvalidStateException.class, e);
                    assertEquals(ActionStatus.PENDING, ((InvalidStateException) e).getCurrentStatus());
                })
                .verify();
        }

        @Test
        @DisplayName("unknown action → not found")
        void approveUnknown() {
            StepVerifier.create(service.approveAction("nope", "bob"))
                .expectError(NotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("cancel an open action, but not an executing one")
        void cancel() {
            String open = enqueued("a1").getActionId();
            StepVerifier.create(service.cancelAction(open, "carol"))
                .assertNext(a -> {
                    assertEquals(ActionStatus.CANCELLED, a.getStatus());
                    assertEquals("carol", a.getCancelledBy());
                })
                .verifyComplete();

            store.seed("run-1", ActionType.SCALE_UP, "a2", ActionStatus.EXECUTING, 0.9, NOW, NOW.plusHours(48));
            StepVerifier.create(service.cancelAction("run-1", "carol"))
                .expectErrorSatisfies(e -> assertEquals(ActionStatus.EXECUTING,
                    ((InvalidStateException) e).getCurrentStatus()))
                .verify();
        }
    }

    // ── execute ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("executeAction()")
    class Execute {

        @Test
        @DisplayName("success → EXECUTED with the executor result stored")
        void success() {
            String id = enqueued("a1").getActionId();

            StepVerifier.create(service.executeAction(id, "alice", false))
                .assertNext(r -> {
                    assertTrue(r.succeeded());
                    assertEquals(ExecutionResult.EXECUTED, r.status());
                })
                .verifyComplete();

            OptimizationAction stored = store.get(id);
            assertEquals(ActionStatus.EXECUTED, stored.getStatus());
            assertEquals("alice", stored.getExecutedBy());
            assertEquals(NOW, stored.getExecutedAt());
            assertTrue(stored.getExecutionResult().contains("newBudgetUsd"));
            assertTrue(ledgerEventTypes().contains("optimization_executed"));
        }

        @Test
        @DisplayName("an approved action can be executed")
        void fromPending() {
            String id = enqueued("a1").getActionId();
            service.approveAction(id, "bob").block();

            assertTrue(service.executeAction(id, "bob", false).block().succeeded());
            assertEquals(ActionStatus.EXECUTED, store.get(id).getStatus());
        }

        @Test
        @DisplayName("an operator-approved change above the daily cap executes as approved")
        void operatorApprovalIsFinal() {
            CandidateAction doubling = new CandidateAction(ActionType.SCALE_UP, TargetLevel.AD, "a1", "camp-1",
                "set-1", "a1", 1.0, 100.0, 100.0, 200.0, "manual", null, 0.4, 4.0, 500.0, 5_000L, null);
            String id = service.enqueueAction(doubling, "carol").block().getActionId();
            service.approveAction(id, "carol").block();

            assertTrue(service.executeAction(id, "carol", false).block().succeeded());
            assertEquals(ActionStatus.EXECUTED, store.get(id).getStatus());
            verify(dispatcher).dispatch(argThat(a -> a.getNewBudgetUsd() == 200.0));
        }

        @Test
        @DisplayName("executor error → failed result, action FAILED, no exception")
        void executorFailure() {
            String id = enqueued("a1").getActionId();
            when(dispatcher.dispatch(any())).thenReturn(
                Mono.error(new ActionExecutionException(id, "Gateway rejected change: budget locked")));

            StepVerifier.create(service.executeAction(id, "alice", false))
                .assertNext(r -> {
                    assertFalse(r.succeeded());
                    assertEquals(ExecutionResult.FAILED, r.status());
                    assertTrue(r.error().contains("budget locked"));
                })
                .verifyComplete();

            OptimizationAction stored = store.get(id);
            assertEquals(ActionStatus.FAILED, stored.getStatus());
            assertTrue(stored.getExecutionError().contains("budget locked"));
            assertTrue(ledgerEventTypes().contains("optimization_failed"));
        }

        @Test
        @DisplayName("dry run reports the change and leaves the action untouched")
        void dryRun() {
            String id = enqueued("a1").getActionId();

            StepVerifier.create(service.executeAction(id, "alice", true))
                .assertNext(r -> {
                    assertEquals(ExecutionResult.DRY_RUN, r.status());
                    assertEquals(120.0, r.details().get("newBudgetUsd"));
                })
                .verifyComplete();

            assertEquals(ActionStatus.SUGGESTED, store.get(id).getStatus());
            verify(dispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("terminal action → invalid state, dry run included")
        void terminal() {
            String id = enqueued("a1").getActionId();
            service.cancelAction(id, "carol").block();

            StepVerifier.create(service.executeAction(id, "alice", false))
                .expectErrorSatisfies(e -> assertEquals(ActionStatus.CANCELLED,
                    ((InvalidStateException) e).getCurrentStatus()))
                .verify();
            StepVerifier.create(service.executeAction(id, "alice", true))
                .expectError(InvalidStateException.class)
                .verify();
            verify(dispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("unknown action → not found")
        void unknown() {
            StepVerifier.create(service.executeAction("nope", "alice", false))
                .expectError(NotFoundException.class)
                .verify();
        }
    }

    // ── expiry and reads ───────────────────────────────────────────────────

    @Nested
    @DisplayName("expiry, listing and stats")
    class Reads {

        @BeforeEach
        void seed() {
            store.seed("s1", ActionType.SCALE_UP, "a1", ActionStatus.SUGGESTED, 0.9, NOW.minusHours(1), NOW.plusHours(47));
            store.seed("s2", ActionType.SCALE_DOWN, "a2", ActionStatus.SUGGESTED, 0.7, NOW.minusHours(2), NOW.plusHours(46));
            store.seed("p1", ActionType.SCALE_UP, "a3", ActionStatus.PENDING, 0.8, NOW.minusHours(3), NOW.minusHours(1));
            store.seed("stale", ActionType.SCALE_UP, "a4", ActionStatus.SUGGESTED, 0.95, NOW.minusDays(3), NOW.minusHours(1));
            OptimizationAction done = store.seed("e1", ActionType.PAUSE, "a5", ActionStatus.EXECUTED, 0.99,
                NOW.minusHours(5), NOW.plusHours(43));
            done.setExecutedAt(NOW.minusHours(1));
        }

        @Test
        @DisplayName("sweep cancels only SUGGESTED actions past their expiry")
        void expireStale() {
            StepVerifier.create(service.expireStaleSuggestions())
                .expectNext(1)
                .verifyComplete();

            assertEquals(ActionStatus.CANCELLED, store.get("stale").getStatus());
            assertEquals(OptimizationService.ACTOR_EXPIRY, store.get("stale").getCancelledBy());
            assertEquals(ActionStatus.PENDING, store.get("p1").getStatus());
            assertEquals(ActionStatus.SUGGESTED, store.get("s1").getStatus());
            assertEquals(List.of("optimization_expired"), ledgerEventTypes());
        }

        @Test
        @DisplayName("open queue is ordered by confidence and never lists stale suggestions")
        void listOpen() {
            List<String> ids = service.listQueue(QueueFilter.open())
                .map(OptimizationAction::getActionId).collectList().block();

            assertEquals(List.of("s1", "p1", "s2"), ids);
        }

        @Test
        @DisplayName("filters by status, type and limit")
        void listFiltered() {
            assertEquals(List.of("p1"), service.listQueue(new QueueFilter(null, null, ActionStatus.PENDING, null, 10))
                .map(OptimizationAction::getActionId).collectList().block());
            assertEquals(List.of("s2"), service.listQueue(new QueueFilter(null, null, null, ActionType.SCALE_DOWN, 10))
                .map(OptimizationAction::getActionId).collectList().block());
            assertEquals(2, service.listQueue(new QueueFilter("camp-1", null, null, null, 2))
                .count().block());
        }

        @Test
        @DisplayName("stats count by status and average open confidence")
        void stats() {
            StepVerifier.create(service.queueStats())
                .assertNext(s -> {
                    assertEquals(3, s.totalSuggested());
                    assertEquals(1, s.totalPending());
                    assertEquals(0, s.totalExecuting());
                    assertEquals(1, s.totalExecutedToday());
                    assertEquals(0, s.totalFailedToday());
                    assertEquals(0.8, s.avgConfidence(), 1e-9);
                })
                .verifyComplete();
        }
    }

    // ── manual run ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluateAndEnqueue()")
    class ManualRun {

        @Test
        @DisplayName("enqueues every candidate as SUGGESTED and executes nothing")
        void enqueuesOnly() {
            Campaign camp = activeCampaign("camp-1", 72);
            givenCampaign(camp, List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));
            when(campaignRepository.findByCampaignIds(any())).thenReturn(Flux.just(camp));

            StepVerifier.create(service.evaluateAndEnqueue(List.of("camp-1"), 7))
                .assertNext(r -> {
                    assertEquals(1, r.processedCampaigns());
                    assertEquals(1, r.actionsSuggested());
                })
                .verifyComplete();

            OptimizationAction stored = store.all().get(0);
            assertEquals(ActionStatus.SUGGESTED, stored.getStatus());
            assertEquals(OptimizationService.ACTOR_MANUAL, stored.getCreatedBy());
            verify(dispatcher, never()).dispatch(any());
        }

        @Test
        @DisplayName("a failing campaign counts as zero and the run continues")
        void failingCampaign() {
            Campaign good = activeCampaign("camp-1", 72);
            Campaign bad  = activeCampaign("camp-2", 72);
            givenCampaign(good, List.of(ad("a1", "camp-1", 100.0)),
                List.of(adMetrics("camp-1", "a1", TODAY, 6.0, 0.9)));
            when(campaignRepository.findById("camp-2")).thenReturn(Mono.error(new IllegalStateException("db down")));
            when(campaignRepository.findByCampaignIds(any())).thenReturn(Flux.just(bad, good));

            StepVerifier.create(service.evaluateAndEnqueue(List.of("camp-2", "camp-1"), 7))
                .assertNext(r -> {
                    assertEquals(2, r.processedCampaigns());
                    assertEquals(1, r.actionsSuggested());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no campaign ids → active campaigns")
        void defaultsToActive() {
            when(campaignRepository.findActive(anyInt())).thenReturn(Flux.empty());

            StepVerifier.create(service.evaluateAndEnqueue(List.of(), 0))
                .assertNext(r -> assertEquals(0, r.processedCampaigns()))
                .verifyComplete();
            verify(campaignRepository).findActive(50);
        }
    }
}
