package com.adautopilot.common.safety;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.model.GuardedOperation;
import com.adautopilot.common.model.GuardrailVerdict;
import com.adautopilot.common.policy.CreativeMetadata;
import com.adautopilot.common.policy.GuardrailContext;
import com.adautopilot.common.policy.ProposedChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SafetyEngineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    private final SafetyEngine engine = new SafetyEngine(AutopilotSettings.defaults().safety(), CLOCK);

    /** A context that passes every check. */
    private static GuardrailContext healthy() {
        return new GuardrailContext(false, 100, 3.0, 0.8, 500, 5_000,
            NOW.minusHours(72), "ad-1", 1_000, null, null);
    }

    private static GuardrailContext with(LocalDateTime createdAt, long impressions, double spend,
                                         double roas, double confidence, LocalDateTime lastAction,
                                         double spendToday) {
        return new GuardrailContext(false, 100, roas, confidence, spend, impressions,
            createdAt, "ad-1", spendToday, lastAction, null);
    }

    @Nested
    @DisplayName("individual checks")
    class Checks {

        @Test
        @DisplayName("negative ROAS is blocked regardless of confidence")
        void negativeRoas() {
            GuardrailVerdict verdict = engine.validateRoasConfidence(-0.1, 0.1);
            assertTrue(verdict.blocked());
            assertTrue(verdict.reason().startsWith("Negative ROAS"));
        }

        @Test
        @DisplayName("low ROAS with high confidence is dangerous")
        void dangerouslyLow() {
            assertTrue(engine.validateRoasConfidence(0.3, 0.85).reason().startsWith("Dangerously low ROAS"));
            assertTrue(engine.validateRoasConfidence(0.3, 0.5).allowed());
        }

        @Test
        @DisplayName("overspend: cap reached, or cap exceeded by the proposal")
        void overspend() {
            assertTrue(engine.preventOverspend(50_000, 10).reason().startsWith("Daily spend limit reached"));
            assertTrue(engine.preventOverspend(49_950, 100).reason().startsWith("Proposed budget"));
            assertTrue(engine.preventOverspend(1_000, 120).allowed());
        }

        @Test
        @DisplayName("embargo: 47h blocked, 49h passes")
        void embargo() {
            assertTrue(engine.enforceEmbargoPeriod(NOW.minusHours(47)).blocked());
            assertTrue(engine.enforceEmbargoPeriod(NOW.minusHours(49)).allowed());
        }

        @Test
        @DisplayName("minimum data: impressions checked before spend")
        void minimumData() {
            assertTrue(engine.checkMinimumData(999, 50).reason().startsWith("Insufficient impressions"));
            assertTrue(engine.checkMinimumData(1_000, 50).reason().startsWith("Insufficient spend"));
            assertTrue(engine.checkMinimumData(1_000, 100).allowed());
        }

        @Test
        @DisplayName("rate limit: none without a previous action, blocked inside 24h")
        void rateLimit() {
            assertTrue(engine.checkActionRateLimit("ad-1", null).allowed());
            assertTrue(engine.checkActionRateLimit("ad-1", NOW.minusHours(5)).blocked());
            assertTrue(engine.checkActionRateLimit("ad-1", NOW.minusHours(30)).allowed());
        }

        @Test
        @DisplayName("creatives need human approval")
        void creativeApproval() {
            assertEquals("Creative c-9 requires human approval",
                engine.blockUnapprovedCreatives(new CreativeMetadata("c-9", false)).reason());
            assertTrue(engine.blockUnapprovedCreatives(new CreativeMetadata("c-9", true)).allowed());
        }
    }

    @Nested
    @DisplayName("validateAction(): ordered chain")
    class Chain {

        @Test
        @DisplayName("chain order is fixed")
        void order() {
            List<String> names = engine.chain().stream().map(SafetyCheck::name).collect(Collectors.toList());
            assertEquals(List.of("embargo", "minimum-data", "roas-confidence", "rate-limit",
                                 "overspend", "creative-approval"), names);
        }

        @Test
        @DisplayName("healthy scale up passes")
        void healthyPasses() {
            assertTrue(engine.validateAction(GuardedOperation.SCALE_UP, ProposedChange.budget(120), healthy())
                .allowed());
        }

        @Test
        @DisplayName("embargo wins over every later failure")
        void embargoFirst() {
            GuardrailContext ctx = with(NOW.minusHours(2), 10, 1, -1.0, 0.1, NOW.minusHours(1), 60_000);
            assertTrue(engine.validateAction(GuardedOperation.SCALE_UP, ProposedChange.budget(120), ctx)
                .reason().startsWith("Entity in embargo"));
        }

        @Test
        @DisplayName("unknown creation time skips the embargo check")
        void nullCreatedAtSkipsEmbargo() {
            GuardrailContext ctx = with(null, 5_000, 500, 3.0, 0.8, null, 0);
            assertTrue(engine.validateAction(GuardedOperation.SCALE_UP, ProposedChange.budget(120), ctx)
                .allowed());
        }

        @Test
        @DisplayName("ROAS confidence applies to scale up only")
        void roasConfidenceScaleUpOnly() {
            GuardrailContext ctx = with(NOW.minusHours(72), 5_000, 500, -0.2, 0.1, null, 0);
            assertTrue(engine.validateAction(GuardedOperation.SCALE_UP, ProposedChange.budget(120), ctx).blocked());
            assertTrue(engine.validateAction(GuardedOperation.SCALE_DOWN, ProposedChange.budget(80), ctx).allowed());
        }

        @Test
        @DisplayName("overspend is not checked for scale down")
        void overspendScaleUpOnly() {
            GuardrailContext ctx = with(NOW.minusHours(72), 5_000, 500, 3.0, 0.8, null, 49_990);
            assertTrue(engine.validateAction(GuardedOperation.SCALE_UP, ProposedChange.budget(120), ctx).blocked());
            assertTrue(engine.validateAction(GuardedOperation.SCALE_DOWN, ProposedChange.budget(80), ctx).allowed());
        }

        @Test
        @DisplayName("creative approval runs for creative changes")
        void creativeChange() {
            assertTrue(engine.validateAction(GuardedOperation.CHANGE_CREATIVE,
                ProposedChange.creative(new CreativeMetadata("c-1", false)), healthy()).blocked());
        }
    }
}
