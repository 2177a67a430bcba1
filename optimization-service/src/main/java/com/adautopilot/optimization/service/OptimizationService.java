package com.adautopilot.optimization.service;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.config.AutopilotSettings.OptimizerSettings;
import com.adautopilot.common.exception.DuplicateActionException;
import com.adautopilot.common.exception.InvalidStateException;
import com.adautopilot.common.exception.NotFoundException;
import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.ActionStatus;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.BudgetAllocation;
import com.adautopilot.common.model.TargetLevel;
import com.adautopilot.optimization.ledger.EventLedger;
import com.adautopilot.optimization.ledger.LedgerEvent;
import com.adautopilot.optimization.ledger.LedgerEventType;
import com.adautopilot.optimization.model.Ad;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.repository.AdRepository;
import com.adautopilot.optimization.repository.CampaignRepository;
import com.adautopilot.optimization.repository.OptimizationActionRepository;
import com.adautopilot.optimization.repository.RoasMetricsRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns campaign ROAS into queued actions and drives each action through its
 * lifecycle: SUGGESTED → PENDING → EXECUTING → EXECUTED | FAILED, or CANCELLED.
 *
 * <p>Every status change is a conditional UPDATE in the repository. When it
 * affects no row the action is re-read and the call fails with
 * {@link InvalidStateException} carrying the status that won, or
 * {@link NotFoundException} when the action does not exist. Two concurrent
 * executions of one action therefore run the executor at most once.
 *
 * <p>Each transition is recorded in the event ledger. Ledger failures never
 * affect the transition.
 */
@Service
public class OptimizationService {

    private static final Logger log = LoggerFactory.getLogger(OptimizationService.class);

    public static final String ACTOR_EXPIRY = "expiry_sweep";
    public static final String ACTOR_MANUAL = "manual_run";

    private static final int MANUAL_RUN_CAMPAIGN_LIMIT = 50;

    private final CampaignRepository           campaignRepository;
    private final AdRepository                 adRepository;
    private final RoasMetricsRepository        metricsRepository;
    private final OptimizationActionRepository actionRepository;
    private final ReallocationPlanner          reallocationPlanner;
    private final ActionDispatcher             dispatcher;
    private final EventLedger                  ledger;
    private final ObjectMapper                 objectMapper;
    private final AutopilotSettings            settings;
    private final Clock                        clock;

    public OptimizationService(CampaignRepository campaignRepository,
                               AdRepository adRepository,
                               RoasMetricsRepository metricsRepository,
                               OptimizationActionRepository actionRepository,
                               ReallocationPlanner reallocationPlanner,
                               ActionDispatcher dispatcher,
                               EventLedger ledger,
                               ObjectMapper objectMapper,
                               AutopilotSettings settings,
                               Clock clock) {
        this.campaignRepository  = campaignRepository;
        this.adRepository        = adRepository;
        this.metricsRepository   = metricsRepository;
        this.actionRepository    = actionRepository;
        this.reallocationPlanner = reallocationPlanner;
        this.dispatcher          = dispatcher;
        this.ledger              = ledger;
        this.objectMapper        = objectMapper;
        this.settings            = settings;
        this.clock               = clock;
    }

    // ── generation ────────────────────────────────────────────────────────────

    /**
     * Candidate actions for one campaign, without persisting anything.
     *
     * <p>Empty when the campaign is missing, not ACTIVE, younger than the
     * optimizer embargo, or has no ad-level metrics in the lookback window.
     * Targets still cooling down for the same action type are skipped.
     *
     * @param lookbackDays  metrics window; zero or negative uses the configured default
     * @param minConfidence candidates below this confidence are dropped
     */
    public Mono<List<CandidateAction>> evaluateCampaign(String campaignId, int lookbackDays, double minConfidence) {
        OptimizerSettings opt = settings.optimizer();
        int days = lookbackDays > 0 ? lookbackDays : opt.lookbackDays();
        LocalDate since = LocalDate.now(clock).minusDays(days);

        return campaignRepository.findById(campaignId)
            .filter(this::isOptimizable)
            .flatMap(campaign -> metricsRepository.findAdMetricsForCampaign(campaignId, since).collectList()
                .flatMap(rows -> rows.isEmpty()
                    ? Mono.just(List.<CandidateAction>of())
                    : adRepository.findByCampaignId(campaignId).collectMap(Ad::getAdId)
                        .flatMap(ads -> generate(campaign, rows, ads, minConfidence))))
            .defaultIfEmpty(List.of())
            .doOnNext(candidates -> log.info("Campaign evaluated. campaignId={} candidates={}",
                                             campaignId, candidates.size()));
    }

    private boolean isOptimizable(Campaign campaign) {
        if (!Campaign.STATUS_ACTIVE.equals(campaign.getStatus())) {
            log.debug("Campaign skipped, not active. campaignId={} status={}",
                      campaign.getCampaignId(), campaign.getStatus());
            return false;
        }
        LocalDateTime embargoEnds = campaign.getCreatedAt() == null
            ? null
            : campaign.getCreatedAt().plusHours(settings.optimizer().embargoHours());
        if (embargoEnds == null || embargoEnds.isAfter(now())) {
            log.debug("Campaign skipped, inside embargo. campaignId={} createdAt={}",
                      campaign.getCampaignId(), campaign.getCreatedAt());
            return false;
        }
        return true;
    }

    private Mono<List<CandidateAction>> generate(Campaign campaign, List<RoasMetricsRecord> rows,
                                                 Map<String, Ad> ads, double minConfidence) {
        OptimizerSettings opt = settings.optimizer();
        Map<String, RoasMetricsRecord> latest = RoasMetricsPlanning.latestPerAd(rows);

        List<CandidateAction> proposals = new ArrayList<>();

        latest.values().stream()
            .filter(r -> !r.isOutlierRow())
            .filter(r -> RoasMetricsPlanning.roas(r) >= opt.scaleUpMinRoas())
            .sorted(Comparator.comparingDouble(RoasMetricsPlanning::roas).reversed())
            .map(r -> budgetCandidate(ActionType.SCALE_UP, r, ads.get(r.getAdId())))
            .filter(Objects::nonNull)
            .forEach(proposals::add);

        latest.values().stream()
            .filter(r -> RoasMetricsPlanning.roas(r) <= opt.scaleDownMaxRoas())
            .sorted(Comparator.comparingDouble(RoasMetricsPlanning::roas))
            .map(r -> budgetCandidate(RoasMetricsPlanning.roas(r) < opt.pauseRoas()
                                          ? ActionType.PAUSE : ActionType.SCALE_DOWN,
                                      r, ads.get(r.getAdId())))
            .filter(Objects::nonNull)
            .forEach(proposals::add);

        if (reallocationPlanner.qualifies(latest.values())) {
            List<BudgetAllocation> plan = reallocationPlanner.plan(latest.values(), ads);
            if (!plan.isEmpty()) {
                proposals.add(reallocationCandidate(campaign, latest.values(), plan));
            }
        }

        return Flux.fromIterable(proposals)
            .filter(c -> passesGuardRails(c, minConfidence))
            .concatMap(c -> isCoolingDown(c).filter(cooling -> !cooling).map(ignored -> c))
            .take(opt.maxActionsPerCampaign())
            .collectList();
    }

    private CandidateAction budgetCandidate(ActionType type, RoasMetricsRecord row, Ad ad) {
        if (ad == null) {
            log.debug("Candidate skipped, ad not found. adId={}", row.getAdId());
            return null;
        }
        double roas       = RoasMetricsPlanning.roas(row);
        double pct        = changePct(type, roas);
        Double oldBudget  = ad.getDailyBudgetUsd();
        Double newBudget  = oldBudget == null ? null : centsTowardOld(oldBudget, oldBudget * (1.0 + pct));
        Double amountUsd  = oldBudget == null ? null : roundCents(newBudget - oldBudget);

        return new CandidateAction(type, TargetLevel.AD, ad.getAdId(), ad.getCampaignId(), ad.getAdsetId(),
            ad.getAdId(), pct, amountUsd, oldBudget, newBudget, reasonFor(type),
            String.format("ROAS %.2f over %d conversions", roas,
                          row.getTotalConversions() == null ? 0 : row.getTotalConversions()),
            RoasMetricsPlanning.confidence(row), roas, RoasMetricsPlanning.spend(row),
            RoasMetricsPlanning.impressions(row), null);
    }

    private double changePct(ActionType type, double roas) {
        OptimizerSettings opt = settings.optimizer();
        return switch (type) {
            case SCALE_UP   -> Math.min(scaleUpBand(roas), opt.maxDailyChangePct());
            case SCALE_DOWN -> -Math.min(opt.scaleDownPct(), opt.maxDailyChangePct());
            case PAUSE      -> -1.0;
            case RESUME, REALLOCATE -> 0.0;
        };
    }

    private static double scaleUpBand(double roas) {
        if (roas >= 5.0) return 1.00;
        if (roas >= 4.0) return 0.75;
        if (roas >= 3.5) return 0.50;
        if (roas >= 3.0) return 0.25;
        return 0.10;
    }

    private CandidateAction reallocationCandidate(Campaign campaign, Collection<RoasMetricsRecord> latest,
                                                  List<BudgetAllocation> plan) {
        double max = latest.stream().mapToDouble(RoasMetricsPlanning::roas).max().orElse(0.0);
        double min = latest.stream().mapToDouble(RoasMetricsPlanning::roas).min().orElse(0.0);
        double spend = latest.stream().mapToDouble(RoasMetricsPlanning::spend).sum();
        long impressions = latest.stream().mapToLong(RoasMetricsPlanning::impressions).sum();
        double moved = plan.stream().mapToDouble(a -> Math.abs(a.changeUsd())).sum() / 2.0;

        return new CandidateAction(ActionType.REALLOCATE, TargetLevel.CAMPAIGN, campaign.getCampaignId(),
            campaign.getCampaignId(), null, null, null, roundCents(moved), null, null,
            reasonFor(ActionType.REALLOCATE),
            String.format("ROAS spread %.2f to %.2f across %d ads", min, max, plan.size()),
            settings.optimizer().reallocationConfidence(), max, spend, impressions, plan);
    }

    private static String reasonFor(ActionType type) {
        return switch (type) {
            case SCALE_UP   -> "High ROAS";
            case SCALE_DOWN -> "Low ROAS";
            case PAUSE      -> "ROAS below pause threshold";
            case RESUME     -> "Resume requested";
            case REALLOCATE -> "Uneven ROAS across ads";
        };
    }

    private boolean passesGuardRails(CandidateAction candidate, double minConfidence) {
        if (candidate.confidence() < minConfidence) {
            return false;
        }
        return candidate.type() == ActionType.PAUSE
            || candidate.absAmountPct() <= settings.optimizer().maxDailyChangePct();
    }

    private Mono<Boolean> isCoolingDown(CandidateAction candidate) {
        LocalDateTime since = now().minusHours(settings.optimizer().cooldownHours());
        return actionRepository.countCoolingDown(candidate.targetId(), candidate.type().name(), since)
            .map(count -> count > 0)
            .doOnNext(cooling -> {
                if (cooling) {
                    log.debug("Candidate skipped, cooling down. targetId={} type={}",
                              candidate.targetId(), candidate.type().wireName());
                }
            });
    }

    // ── queue ─────────────────────────────────────────────────────────────────

    /**
     * Persists a candidate as SUGGESTED and records OPTIMIZATION_SUGGESTED.
     *
     * <p>Fails with {@link DuplicateActionException} while the target has an open
     * action of the same type, or one executed inside the cooldown window. The
     * partial unique index on open actions settles concurrent enqueues.
     */
    public Mono<OptimizationAction> enqueueAction(CandidateAction candidate, String createdBy) {
        return Mono.fromRunnable(() -> validate(candidate))
            .then(Mono.defer(() -> isCoolingDown(candidate)))
            .flatMap(cooling -> cooling
                ? Mono.<OptimizationAction>error(new DuplicateActionException(candidate.targetId(), candidate.type()))
                : actionRepository.save(newAction(candidate, createdBy)))
            .onErrorMap(DuplicateKeyException.class,
                        e -> new DuplicateActionException(candidate.targetId(), candidate.type()))
            .doOnNext(saved -> {
                log.info("Action enqueued. actionId={} type={} targetId={} confidence={} createdBy={}",
                         saved.getActionId(), saved.getActionType().wireName(), saved.getTargetId(),
                         saved.getConfidence(), createdBy);
                publish(LedgerEventType.OPTIMIZATION_SUGGESTED, saved, createdBy, details(
                    "amountPct", saved.getAmountPct(),
                    "newBudgetUsd", saved.getNewBudgetUsd(),
                    "confidence", saved.getConfidence(),
                    "reason", saved.getReason()));
            });
    }

    private OptimizationAction newAction(CandidateAction candidate, String createdBy) {
        LocalDateTime now = now();

        OptimizationAction action = new OptimizationAction();
        action.setActionId(UUID.randomUUID().toString());
        action.setActionType(candidate.type());
        action.setTargetLevel(candidate.targetLevel());
        action.setTargetId(candidate.targetId());
        action.setCampaignId(candidate.campaignId());
        action.setAdsetId(candidate.adsetId());
        action.setAdId(candidate.adId());
        action.setAmountPct(candidate.amountPct());
        action.setAmountUsd(candidate.amountUsd());
        action.setOldBudgetUsd(candidate.oldBudgetUsd());
        action.setNewBudgetUsd(candidate.newBudgetUsd());
        if (candidate.reallocationPlan() != null) {
            action.setReallocationPlan(toJson(candidate.reallocationPlan()));
            action.setAffectedAdIds(toJson(candidate.reallocationPlan().stream()
                .map(BudgetAllocation::adId).collect(Collectors.toList())));
        }
        action.setReason(candidate.reason());
        action.setReasonDetails(candidate.reasonDetails());
        action.setConfidence(candidate.confidence());
        action.setRoasValue(candidate.roasValue());
        action.setSpendUsd(candidate.spendUsd());
        action.setImpressions(candidate.impressions());
        action.setStatus(ActionStatus.SUGGESTED);
        action.setCreatedBy(createdBy);
        action.setCreatedAt(now);
        action.setUpdatedAt(now);
        action.setExpiresAt(now.plusHours(settings.optimizer().actionExpiryHours()));
        return action;
    }

    private static void validate(CandidateAction candidate) {
        if (candidate == null || candidate.type() == null) {
            throw new ValidationException("Action type is required");
        }
        if (candidate.targetLevel() == null) {
            throw new ValidationException("Target level is required");
        }
        if (candidate.targetId() == null || candidate.targetId().isBlank()) {
            throw new ValidationException("Target id is required");
        }
        if (candidate.confidence() < 0.0 || candidate.confidence() > 1.0) {
            throw new ValidationException("Confidence must be within [0, 1], got " + candidate.confidence());
        }
        if (candidate.type() == ActionType.REALLOCATE
                && (candidate.reallocationPlan() == null || candidate.reallocationPlan().isEmpty())) {
            throw new ValidationException("Reallocate action requires a reallocation plan");
        }
    }

    /**
     * SUGGESTED → PENDING.
     */
    public Mono<OptimizationAction> approveAction(String actionId, String approvedBy) {
        return requireTransition(actionRepository.markApproved(actionId, approvedBy, now()), actionId, "approve")
            .doOnNext(action -> {
                log.info("Action approved. actionId={} approvedBy={}", actionId, approvedBy);
                publish(LedgerEventType.OPTIMIZATION_APPROVED, action, approvedBy, Map.of());
            });
    }

    /**
     * SUGGESTED | PENDING → EXECUTING → EXECUTED | FAILED.
     *
     * <p>A dry run only reads the action and reports what would be sent. Its
     * status is left as it was and the gateway is not called.
     *
     * <p>Executor failures are returned as a {@code failed} result with the action
     * marked FAILED. Persistence errors propagate.
     *
     * <p>Policy and safety are not re-run here. They gate what the worker executes
     * on its own; an action a person approves or executes is taken as that
     * person's decision.
     */
    public Mono<ExecutionResult> executeAction(String actionId, String executedBy, boolean dryRun) {
        return loadAction(actionId).flatMap(action -> {
            if (!action.getStatus().isOpen()) {
                return Mono.error(new InvalidStateException(actionId, action.getStatus(), "execute"));
            }
            if (dryRun) {
                log.info("Dry run. actionId={} type={} targetId={}",
                         actionId, action.getActionType().wireName(), action.getTargetId());
                return Mono.just(ExecutionResult.dryRun(actionId, dispatcher.preview(action)));
            }
            return requireTransition(actionRepository.markExecuting(actionId, executedBy, now()), actionId, "execute")
                .flatMap(claimed -> runExecutor(claimed, executedBy));
        });
    }

    private Mono<ExecutionResult> runExecutor(OptimizationAction action, String executedBy) {
        String actionId = action.getActionId();
        return dispatcher.dispatch(action)
            .onErrorResume(e -> {
                log.warn("Executor failed. actionId={} type={} error={}",
                         actionId, action.getActionType().wireName(), e.getMessage());
                return Mono.just(ExecutionResult.failed(actionId, e.getMessage()));
            })
            .flatMap(result -> result.succeeded()
                ? requireTransition(actionRepository.markExecuted(actionId, toJson(result.details()), now()),
                                    actionId, "complete")
                    .doOnNext(done -> {
                        log.info("Action executed. actionId={} type={} targetId={} executedBy={}",
                                 actionId, done.getActionType().wireName(), done.getTargetId(), executedBy);
                        publish(LedgerEventType.OPTIMIZATION_EXECUTED, done, executedBy, result.details());
                    })
                    .thenReturn(result)
                : requireTransition(actionRepository.markFailed(actionId, result.error(), now()),
                                    actionId, "fail")
                    .doOnNext(failed -> {
                        log.error("Action failed. actionId={} type={} targetId={} error={}",
                                  actionId, failed.getActionType().wireName(), failed.getTargetId(),
                                  result.error());
                        publish(LedgerEventType.OPTIMIZATION_FAILED, failed, executedBy,
                                details("error", result.error()));
                    })
                    .thenReturn(result));
    }

    /**
     * SUGGESTED | PENDING → CANCELLED.
     */
    public Mono<OptimizationAction> cancelAction(String actionId, String cancelledBy) {
        return requireTransition(actionRepository.markCancelled(actionId, cancelledBy, now()), actionId, "cancel")
            .doOnNext(action -> {
                log.info("Action cancelled. actionId={} cancelledBy={}", actionId, cancelledBy);
                publish(LedgerEventType.OPTIMIZATION_CANCELLED, action, cancelledBy, Map.of());
            });
    }

    /**
     * Cancels every SUGGESTED action whose expiry has passed.
     *
     * @return number of actions expired by this call
     */
    public Mono<Integer> expireStaleSuggestions() {
        LocalDateTime now = now();
        return actionRepository.findStale(now)
            .concatMap(stale -> actionRepository.markExpired(stale.getActionId(), ACTOR_EXPIRY, now)
                .filter(rows -> rows > 0)
                .doOnNext(rows -> {
                    log.info("Stale suggestion expired. actionId={} expiresAt={}",
                             stale.getActionId(), stale.getExpiresAt());
                    publish(LedgerEventType.OPTIMIZATION_EXPIRED, stale, ACTOR_EXPIRY,
                            details("expiresAt", stale.getExpiresAt()));
                }))
            .count()
            .map(Long::intValue);
    }

    // ── reads ─────────────────────────────────────────────────────────────────

    public Mono<OptimizationAction> getAction(String actionId) {
        return loadAction(actionId);
    }

    /**
     * Open actions ordered by confidence, highest first. Stale suggestions are
     * never listed.
     */
    public Flux<OptimizationAction> listQueue(QueueFilter filter) {
        LocalDateTime now = now();
        Set<ActionStatus> statuses = filter.status() != null ? Set.of(filter.status()) : ActionStatus.OPEN;
        List<String> statusNames = statuses.stream().map(Enum::name).collect(Collectors.toList());

        return actionRepository.findByStatuses(statusNames)
            .filter(a -> filter.campaignId() == null || filter.campaignId().equals(a.getCampaignId()))
            .filter(a -> filter.targetId() == null || filter.targetId().equals(a.getTargetId()))
            .filter(a -> filter.type() == null || filter.type() == a.getActionType())
            .filter(a -> !a.isStale(now))
            .take(filter.limit());
    }

    public Mono<QueueStats> queueStats() {
        LocalDateTime startOfDay = LocalDate.now(clock).atStartOfDay();
        return Mono.zip(
                actionRepository.countByStatusName(ActionStatus.SUGGESTED.name()),
                actionRepository.countByStatusName(ActionStatus.PENDING.name()),
                actionRepository.countByStatusName(ActionStatus.EXECUTING.name()),
                actionRepository.countExecutedSince(startOfDay),
                actionRepository.countFailedSince(startOfDay),
                listQueue(QueueFilter.open()).map(a -> a.getConfidence() == null ? 0.0 : a.getConfidence())
                    .collectList()
                    .map(list -> list.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)))
            .map(t -> new QueueStats(t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5(), t.getT6()));
    }

    // ── manual run ────────────────────────────────────────────────────────────

    /**
     * Evaluates the given campaigns (or the active ones when none are given) and
     * enqueues every candidate as SUGGESTED. Nothing is executed. A campaign that
     * fails is logged and counted with zero actions.
     */
    public Mono<ManualRunResult> evaluateAndEnqueue(List<String> campaignIds, int lookbackDays) {
        Instant started = clock.instant();
        Flux<Campaign> campaigns = campaignIds == null || campaignIds.isEmpty()
            ? campaignRepository.findActive(MANUAL_RUN_CAMPAIGN_LIMIT)
            : campaignRepository.findByCampaignIds(campaignIds);

        return campaigns
            .concatMap(campaign -> evaluateCampaign(campaign.getCampaignId(), lookbackDays,
                                                    settings.optimizer().minConfidence())
                .flatMapMany(Flux::fromIterable)
                .concatMap(candidate -> enqueueAction(candidate, ACTOR_MANUAL)
                    .onErrorResume(DuplicateActionException.class, e -> {
                        log.info("Candidate skipped, already enqueued. targetId={} type={}",
                                 candidate.targetId(), candidate.type().wireName());
                        return Mono.empty();
                    }))
                .count()
                .onErrorResume(e -> {
                    log.error("Manual run failed for campaign. campaignId={}", campaign.getCampaignId(), e);
                    return Mono.just(0L);
                }))
            .collectList()
            .map(counts -> new ManualRunResult(
                counts.size(),
                counts.stream().mapToLong(Long::longValue).sum(),
                Duration.between(started, clock.instant()).toMillis() / 1000.0))
            .doOnNext(r -> log.info("Manual run complete. campaigns={} actionsSuggested={} seconds={}",
                                    r.processedCampaigns(), r.actionsSuggested(), r.executionTimeSeconds()));
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private Mono<OptimizationAction> loadAction(String actionId) {
        return actionRepository.findByActionId(actionId)
            .switchIfEmpty(Mono.error(new NotFoundException("OptimizationAction", actionId)));
    }

    /**
     * Re-reads the action after a conditional UPDATE. Zero affected rows means
     * another caller changed the status first.
     */
    private Mono<OptimizationAction> requireTransition(Mono<Integer> update, String actionId, String operation) {
        return update.flatMap(rows -> rows > 0
            ? loadAction(actionId)
            : loadAction(actionId).flatMap(current -> {
                log.warn("Transition rejected. actionId={} operation={} currentStatus={}",
                         actionId, operation, current.getStatus());
                return Mono.error(new InvalidStateException(actionId, current.getStatus(), operation));
            }));
    }

    private void publish(LedgerEventType type, OptimizationAction action, String actor, Map<String, Object> details) {
        ledger.publish(LedgerEvent.of(type, action.getActionId(), action.getActionType().wireName(),
                                      action.getTargetId(), actor, now(), details));
    }

    private static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + value.getClass().getSimpleName(), e);
        }
    }

    private static double roundCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Cent-rounds {@code target} toward {@code old}, so the rounded change is never
     * larger than the unrounded one. The epsilon absorbs float noise such as
     * 33.0 * 1.2 = 39.599999999999994.
     */
    static double centsTowardOld(double old, double target) {
        if (target <= 0.0) {
            return 0.0;
        }
        double cents = target * 100.0;
        return (target >= old ? Math.floor(cents + 1e-6) : Math.ceil(cents - 1e-6)) / 100.0;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
