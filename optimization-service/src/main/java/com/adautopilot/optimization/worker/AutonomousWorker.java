package com.adautopilot.optimization.worker;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.config.AutopilotSettings.WorkerSettings;
import com.adautopilot.common.exception.DuplicateActionException;
import com.adautopilot.common.model.GuardedOperation;
import com.adautopilot.common.model.GuardrailVerdict;
import com.adautopilot.common.model.WorkerMode;
import com.adautopilot.common.policy.GuardrailContext;
import com.adautopilot.common.policy.PolicyEngine;
import com.adautopilot.common.policy.ProposedChange;
import com.adautopilot.common.safety.SafetyEngine;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.repository.CampaignRepository;
import com.adautopilot.optimization.repository.OptimizationActionRepository;
import com.adautopilot.optimization.repository.PerformanceInsightRepository;
import com.adautopilot.optimization.repository.RoasMetricsRepository;
import com.adautopilot.optimization.service.CandidateAction;
import com.adautopilot.optimization.service.OptimizationService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Background control loop: every {@code intervalSeconds} it evaluates eligible
 * campaigns, runs each candidate through policy then safety, and either queues it
 * for a human (SUGGEST) or executes it directly (AUTO, safe candidates only).
 *
 * <p>The loop is a recursive {@code Mono.delay} chain: each tick is a fresh
 * pipeline whose terminal subscriber schedules the next one. A failed tick is
 * logged and the next is scheduled after {@code errorBackoffSeconds}. Stopping
 * disposes only the pending delay, so a tick already in flight runs to the end.
 * Every start opens a new loop generation and a tick reschedules only while its
 * own generation is current, so a tick left over from before a stop never
 * forks a second loop.
 *
 * <p>Policy sees {@code isAutoMode = true} only for candidates the worker intends
 * to execute without a human, so the tighter auto cap applies to exactly those.
 */
@Component
public class AutonomousWorker {

    private static final Logger log = LoggerFactory.getLogger(AutonomousWorker.class);

    public static final String ACTOR = "autonomous_worker";

    private final OptimizationService          optimizationService;
    private final CampaignRepository           campaignRepository;
    private final RoasMetricsRepository        metricsRepository;
    private final OptimizationActionRepository actionRepository;
    private final PerformanceInsightRepository insightRepository;
    private final PolicyEngine                 policyEngine;
    private final SafetyEngine                 safetyEngine;
    private final AutopilotSettings            settings;
    private final Clock                        clock;

    private final AtomicReference<WorkerMode> mode     = new AtomicReference<>();
    private final AtomicBoolean               running  = new AtomicBoolean(false);
    private final AtomicLong                  loopGen  = new AtomicLong();
    private final AtomicReference<TickStats>  lastTick = new AtomicReference<>();
    private volatile Disposable               pendingDelay;

    public AutonomousWorker(OptimizationService optimizationService,
                            CampaignRepository campaignRepository,
                            RoasMetricsRepository metricsRepository,
                            OptimizationActionRepository actionRepository,
                            PerformanceInsightRepository insightRepository,
                            PolicyEngine policyEngine,
                            SafetyEngine safetyEngine,
                            AutopilotSettings settings,
                            Clock clock) {
        this.optimizationService = optimizationService;
        this.campaignRepository  = campaignRepository;
        this.metricsRepository   = metricsRepository;
        this.actionRepository    = actionRepository;
        this.insightRepository   = insightRepository;
        this.policyEngine        = policyEngine;
        this.safetyEngine        = safetyEngine;
        this.settings            = settings;
        this.clock               = clock;
        this.mode.set(settings.worker().mode());
    }

    // ── loop ──────────────────────────────────────────────────────────────────

    @PostConstruct
    public void startOnBoot() {
        if (!settings.worker().enabled()) {
            log.info("Autonomous worker disabled by configuration");
            return;
        }
        start();
    }

    /**
     * Starts the loop. The first tick runs immediately.
     *
     * @return false when the loop was already running
     */
    public boolean start() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        log.info("Autonomous worker started. mode={} intervalSeconds={} maxCampaignsPerTick={} maxActionsPerTick={}",
                 mode.get(), settings.worker().intervalSeconds(), settings.worker().maxCampaignsPerTick(),
                 settings.worker().maxActionsPerTick());
        scheduleNextTick(loopGen.incrementAndGet(), Duration.ZERO);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /**
     * Stops scheduling further ticks. A tick in flight is not interrupted.
     *
     * @return false when the loop was not running
     */
    public boolean stop() {
        if (!running.compareAndSet(true, false)) {
            return false;
        }
        Disposable delay = pendingDelay;
        if (delay != null) {
            delay.dispose();
        }
        log.info("Autonomous worker stopped");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private void scheduleNextTick(long gen, Duration delay) {
        pendingDelay = Mono.delay(delay).subscribe(ignored -> runScheduledTick(gen));
    }

    /**
     * Whether ticks of loop {@code gen} may still run and reschedule.
     */
    boolean ownsLoop(long gen) {
        return running.get() && loopGen.get() == gen;
    }

    long currentLoop() {
        return loopGen.get();
    }

    private void runScheduledTick(long gen) {
        if (!ownsLoop(gen)) {
            return;
        }
        tick().subscribe(
            stats -> {
                if (ownsLoop(gen)) {
                    scheduleNextTick(gen, Duration.ofSeconds(settings.worker().intervalSeconds()));
                } else {
                    log.debug("Tick from a stopped loop finished, not rescheduling. loop={}", gen);
                }
            },
            err -> {
                log.error("Worker tick failed, backing off. backoffSeconds={}",
                          settings.worker().errorBackoffSeconds(), err);
                if (ownsLoop(gen)) {
                    scheduleNextTick(gen, Duration.ofSeconds(settings.worker().errorBackoffSeconds()));
                }
            });
    }

    // ── mode ──────────────────────────────────────────────────────────────────

    public WorkerMode mode() {
        return mode.get();
    }

    /**
     * @return the previous mode
     */
    public WorkerMode setMode(WorkerMode newMode) {
        WorkerMode previous = mode.getAndSet(newMode);
        log.info("Worker mode changed. from={} to={}", previous, newMode);
        return previous;
    }

    public WorkerStatus status() {
        WorkerSettings w = settings.worker();
        return new WorkerStatus(w.enabled(), running.get(), mode.get(), w.intervalSeconds(),
            w.maxCampaignsPerTick(), w.maxActionsPerTick(), w.autoMinConfidence(), w.maxAutoChangePct(),
            lastTick.get());
    }

    // ── tick ──────────────────────────────────────────────────────────────────

    /**
     * One pass over the eligible campaigns. Also the body of a manual run-once.
     *
     * <p>A failing campaign is recorded in {@link TickStats#errors()} and the tick
     * moves on to the next campaign.
     */
    public Mono<TickStats> tick() {
        LocalDateTime started = now();
        AtomicInteger actionBudget = new AtomicInteger(settings.worker().maxActionsPerTick());
        WorkerMode tickMode = mode.get();

        return optimizationService.expireStaleSuggestions()
            .onErrorResume(e -> {
                log.warn("Stale suggestion sweep failed (non-critical)", e);
                return Mono.just(0);
            })
            .flatMap(expired -> eligibleCampaigns()
                .concatMap(campaign -> processCampaign(campaign, tickMode, actionBudget)
                    .onErrorResume(e -> {
                        log.error("Campaign processing failed. campaignId={}", campaign.getCampaignId(), e);
                        return Mono.just(TickStats.campaignError(campaign.getCampaignId(), e.getMessage()));
                    }))
                .reduce(TickStats.started(started, expired), TickStats::merge))
            .map(stats -> stats.completedAt(now()))
            .doOnNext(stats -> {
                lastTick.set(stats);
                log.info("Worker tick complete. mode={} campaigns={} generated={} policyBlocked={} safetyBlocked={} "
                         + "queued={} executed={} failed={} deferred={} expired={} errors={}",
                         tickMode, stats.campaignsEvaluated(), stats.actionsGenerated(),
                         stats.actionsPolicyBlocked(), stats.actionsSafetyBlocked(), stats.actionsQueued(),
                         stats.actionsExecuted(), stats.actionsFailed(), stats.actionsDeferred(),
                         stats.staleExpired(), stats.errors().size());
            });
    }

    /**
     * ACTIVE campaigns past the safety embargo, oldest first, at most
     * {@code maxCampaignsPerTick}.
     */
    private Flux<Campaign> eligibleCampaigns() {
        LocalDateTime cutoff = now().minusHours(settings.safety().minAgeHours());
        return campaignRepository.findEligible(cutoff, settings.worker().maxCampaignsPerTick())
            .filter(c -> Campaign.STATUS_ACTIVE.equals(c.getStatus()))
            .filter(c -> c.getCreatedAt() != null && !c.getCreatedAt().isAfter(cutoff));
    }

    private Mono<TickStats> processCampaign(Campaign campaign, WorkerMode tickMode, AtomicInteger actionBudget) {
        String campaignId = campaign.getCampaignId();
        LocalDate since = LocalDate.now(clock).minusDays(settings.optimizer().lookbackDays());

        return metricsRepository.findAdMetricsForCampaign(campaignId, since).collectList()
            .flatMap(rows -> {
                if (rows.isEmpty()) {
                    log.debug("Campaign has no metrics in window. campaignId={}", campaignId);
                    return Mono.just(TickStats.campaign(campaignId, 0));
                }
                return Mono.zip(
                        optimizationService.evaluateCampaign(campaignId, settings.optimizer().lookbackDays(),
                                                             settings.policy().hardStopConfidence()),
                        spendToday())
                    .flatMap(t -> {
                        List<CandidateAction> candidates = t.getT1();
                        CampaignSnapshot snapshot = CampaignSnapshot.of(campaign, rows, t.getT2());
                        return Flux.fromIterable(candidates)
                            .concatMap(candidate -> route(candidate, snapshot, tickMode, actionBudget))
                            .reduce(TickStats.campaign(campaignId, candidates.size()), TickStats::merge);
                    });
            });
    }

    private Mono<Double> spendToday() {
        return insightRepository.sumSpendSince(LocalDate.now(clock).atStartOfDay())
            .defaultIfEmpty(0.0);
    }

    // ── routing ───────────────────────────────────────────────────────────────

    private Mono<TickStats> route(CandidateAction candidate, CampaignSnapshot snapshot, WorkerMode tickMode,
                                  AtomicInteger actionBudget) {
        boolean autoCandidate = tickMode == WorkerMode.AUTO && isSafeForAuto(candidate);

        return lastExecutedAt(candidate).flatMap(lastAction -> {
            GuardrailContext context = snapshot.context(candidate, autoCandidate, lastAction.orElse(null));
            GuardedOperation operation = GuardedOperation.of(candidate.type());
            ProposedChange change = proposedChange(candidate);

            GuardrailVerdict policy = policyEngine.validateAction(operation, change, context);
            if (!policy.allowed()) {
                log.info("Action blocked by policy. targetId={} type={} reason={}",
                         candidate.targetId(), candidate.type().wireName(), policy.reason());
                return Mono.just(TickStats.policyBlocked());
            }
            GuardrailVerdict safety = safetyEngine.validateAction(operation, change, context);
            if (safety.blocked()) {
                log.info("Action blocked by safety. targetId={} type={} reason={}",
                         candidate.targetId(), candidate.type().wireName(), safety.reason());
                return Mono.just(TickStats.safetyBlocked());
            }
            if (actionBudget.getAndDecrement() <= 0) {
                log.debug("Per-tick action limit reached, deferring. targetId={} type={}",
                          candidate.targetId(), candidate.type().wireName());
                return Mono.just(TickStats.deferred());
            }
            return autoCandidate ? enqueueAndExecute(candidate) : enqueue(candidate);
        })
        .onErrorResume(DuplicateActionException.class, e -> {
            log.info("Candidate skipped, already enqueued. targetId={} type={}",
                     candidate.targetId(), candidate.type().wireName());
            return Mono.just(TickStats.empty());
        })
        .onErrorResume(e -> {
            log.error("Action routing failed. targetId={} type={}",
                      candidate.targetId(), candidate.type().wireName(), e);
            return Mono.just(TickStats.failed(candidate.targetId() + ": " + e.getMessage()));
        });
    }

    private Mono<TickStats> enqueue(CandidateAction candidate) {
        return optimizationService.enqueueAction(candidate, ACTOR)
            .map(action -> TickStats.queued());
    }

    private Mono<TickStats> enqueueAndExecute(CandidateAction candidate) {
        return optimizationService.enqueueAction(candidate, ACTOR)
            .flatMap(action -> optimizationService.executeAction(action.getActionId(), ACTOR, false))
            .map(result -> result.succeeded() ? TickStats.executed() : TickStats.failed(result.error()));
    }

    /**
     * Whether a candidate may run without a human in AUTO mode.
     */
    boolean isSafeForAuto(CandidateAction candidate) {
        WorkerSettings w = settings.worker();
        return switch (candidate.type()) {
            case PAUSE                -> true;
            case REALLOCATE           -> false;
            case RESUME               -> candidate.confidence() >= w.autoMinConfidence();
            case SCALE_UP, SCALE_DOWN -> candidate.confidence() >= w.autoMinConfidence()
                                         && candidate.absAmountPct() <= w.maxAutoChangePct();
        };
    }

    private static ProposedChange proposedChange(CandidateAction candidate) {
        return switch (candidate.type()) {
            case SCALE_UP, SCALE_DOWN -> candidate.newBudgetUsd() == null
                                             ? ProposedChange.none()
                                             : ProposedChange.budget(candidate.newBudgetUsd());
            case PAUSE                -> ProposedChange.budget(0.0);
            case RESUME               -> ProposedChange.none();
            case REALLOCATE           -> ProposedChange.reallocation(candidate.reallocationPlan());
        };
    }

    private Mono<Optional<LocalDateTime>> lastExecutedAt(CandidateAction candidate) {
        return actionRepository.findLastExecuted(candidate.targetId(), candidate.type().name())
            .map(OptimizationAction::getExecutedAt)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Campaign-wide aggregates from the ad-level metric rows in the lookback
     * window, shared by every candidate of the campaign.
     */
    private record CampaignSnapshot(LocalDateTime createdAt, double roas, double confidence, double spend,
                                    long impressions, double spendToday) {

        static CampaignSnapshot of(Campaign campaign, List<RoasMetricsRecord> rows, double spendToday) {
            double roas = rows.stream()
                .mapToDouble(r -> r.getActualRoas() == null ? 0.0 : r.getActualRoas()).average().orElse(0.0);
            double confidence = rows.stream()
                .mapToDouble(r -> r.getConfidenceScore() == null ? 0.0 : r.getConfidenceScore()).average().orElse(0.0);
            double spend = rows.stream()
                .mapToDouble(r -> r.getTotalCostUsd() == null ? 0.0 : r.getTotalCostUsd()).sum();
            long impressions = rows.stream()
                .mapToLong(r -> r.getImpressions() == null ? 0L : r.getImpressions()).sum();
            return new CampaignSnapshot(campaign.getCreatedAt(), roas, confidence, spend, impressions, spendToday);
        }

        GuardrailContext context(CandidateAction candidate, boolean autoMode, LocalDateTime lastAction) {
            double currentBudget = candidate.oldBudgetUsd() == null ? 0.0 : candidate.oldBudgetUsd();
            return new GuardrailContext(autoMode, currentBudget, roas, confidence, spend, impressions,
                createdAt, candidate.targetId(), spendToday, lastAction, null);
        }
    }
}
