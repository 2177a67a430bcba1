package com.adautopilot.optimization.controller;

import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.ActionStatus;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.ScopeRef;
import com.adautopilot.common.prediction.RoasPrediction;
import com.adautopilot.common.roas.RoasResult;
import com.adautopilot.optimization.dto.ApproveRequest;
import com.adautopilot.optimization.dto.EnqueueActionRequest;
import com.adautopilot.optimization.dto.ExecuteRequest;
import com.adautopilot.optimization.dto.ManualRunRequest;
import com.adautopilot.optimization.dto.RecordMetricsRequest;
import com.adautopilot.optimization.model.OptimizationAction;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.service.CandidateAction;
import com.adautopilot.optimization.service.ExecutionResult;
import com.adautopilot.optimization.service.ManualRunResult;
import com.adautopilot.optimization.service.OptimizationService;
import com.adautopilot.optimization.service.PredictionService;
import com.adautopilot.optimization.service.QueueFilter;
import com.adautopilot.optimization.service.QueueStats;
import com.adautopilot.optimization.service.RoasMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Operator-facing REST API for the action queue and ROAS reads.
 */
@RestController
@RequestMapping("/api/v1/optimization")
public class OptimizationController {

    private static final Logger log = LoggerFactory.getLogger(OptimizationController.class);

    private static final String DEFAULT_ACTOR = "api";

    private final OptimizationService optimizationService;
    private final RoasMetricsService  roasMetricsService;
    private final PredictionService   predictionService;

    public OptimizationController(OptimizationService optimizationService,
                                  RoasMetricsService roasMetricsService,
                                  PredictionService predictionService) {
        this.optimizationService = optimizationService;
        this.roasMetricsService  = roasMetricsService;
        this.predictionService   = predictionService;
    }

    // ── queue ─────────────────────────────────────────────────────────────────

    @GetMapping("/queue")
    public Flux<OptimizationAction> queue(@RequestParam(required = false) String campaignId,
                                          @RequestParam(required = false) String targetId,
                                          @RequestParam(required = false) String status,
                                          @RequestParam(required = false) String type,
                                          @RequestParam(defaultValue = "100") int limit) {
        log.info("Queue query. campaignId={} targetId={} status={} type={} limit={}",
                 campaignId, targetId, status, type, limit);
        return Mono.fromCallable(() -> new QueueFilter(campaignId, targetId, parseStatus(status),
                                                       type == null ? null : ActionType.fromWireName(type), limit))
            .flatMapMany(optimizationService::listQueue);
    }

    @GetMapping("/stats")
    public Mono<QueueStats> stats() {
        return optimizationService.queueStats();
    }

    @GetMapping("/actions/{actionId}")
    public Mono<OptimizationAction> action(@PathVariable String actionId) {
        return optimizationService.getAction(actionId);
    }

    @PostMapping("/actions")
    public Mono<ResponseEntity<OptimizationAction>> enqueue(@RequestBody EnqueueActionRequest request) {
        log.info("Manual enqueue requested. type={} targetId={}", request.type(), request.targetId());
        String createdBy = request.createdBy() == null ? DEFAULT_ACTOR : request.createdBy();
        return Mono.fromCallable(request::toCandidate)
            .flatMap(candidate -> optimizationService.enqueueAction(candidate, createdBy))
            .map(action -> ResponseEntity.status(HttpStatus.CREATED).body(action));
    }

    @PostMapping("/approve/{actionId}")
    public Mono<OptimizationAction> approve(@PathVariable String actionId,
                                            @RequestBody(required = false) ApproveRequest request) {
        String approvedBy = request == null || request.approvedBy() == null ? DEFAULT_ACTOR : request.approvedBy();
        log.info("Approve requested. actionId={} approvedBy={}", actionId, approvedBy);
        return optimizationService.approveAction(actionId, approvedBy);
    }

    @PostMapping("/execute/{actionId}")
    public Mono<ExecutionResult> execute(@PathVariable String actionId,
                                         @RequestBody(required = false) ExecuteRequest request) {
        String runBy  = request == null || request.runBy() == null ? DEFAULT_ACTOR : request.runBy();
        boolean dryRun = request != null && request.dryRun();
        log.info("Execute requested. actionId={} runBy={} dryRun={}", actionId, runBy, dryRun);
        return optimizationService.executeAction(actionId, runBy, dryRun);
    }

    @DeleteMapping("/cancel/{actionId}")
    public Mono<OptimizationAction> cancel(@PathVariable String actionId,
                                           @RequestParam(defaultValue = DEFAULT_ACTOR) String cancelledBy) {
        log.info("Cancel requested. actionId={} cancelledBy={}", actionId, cancelledBy);
        return optimizationService.cancelAction(actionId, cancelledBy);
    }

    // ── evaluation ────────────────────────────────────────────────────────────

    @GetMapping("/evaluate/{campaignId}")
    public Mono<List<CandidateAction>> evaluate(@PathVariable String campaignId,
                                                @RequestParam(defaultValue = "0") int lookbackDays,
                                                @RequestParam(defaultValue = "0.65") double minConfidence) {
        return optimizationService.evaluateCampaign(campaignId, lookbackDays, minConfidence);
    }

    @PostMapping("/run")
    public Mono<ManualRunResult> run(@RequestBody(required = false) ManualRunRequest request) {
        List<String> campaignIds = request == null ? List.of() : request.campaignIds();
        int lookbackDays = request == null ? 0 : request.lookbackDays();
        log.info("Manual run requested. campaignIds={} lookbackDays={}", campaignIds, lookbackDays);
        return optimizationService.evaluateAndEnqueue(campaignIds, lookbackDays);
    }

    // ── ROAS ──────────────────────────────────────────────────────────────────

    @GetMapping("/roas")
    public Mono<RoasResult> roas(@RequestParam(required = false) String campaignId,
                                 @RequestParam(required = false) String adsetId,
                                 @RequestParam(required = false) String adId,
                                 @RequestParam(required = false)
                                 @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
                                 @RequestParam(required = false)
                                 @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end,
                                 @RequestParam(required = false) String attributionModel) {
        return Mono.fromCallable(() -> ScopeRef.narrowest(campaignId, adsetId, adId))
            .flatMap(scope -> attributionModel == null
                ? roasMetricsService.calculateRoas(scope, start, end)
                : roasMetricsService.calculateAttributedRoas(scope, start, end, attributionModel));
    }

    @GetMapping("/predictions")
    public Mono<RoasPrediction> prediction(@RequestParam(required = false) String campaignId,
                                           @RequestParam(required = false) String adsetId,
                                           @RequestParam(required = false) String adId,
                                           @RequestParam(defaultValue = "0") int lookbackDays) {
        return Mono.fromCallable(() -> ScopeRef.narrowest(campaignId, adsetId, adId))
            .flatMap(scope -> predictionService.predictRoas(scope, lookbackDays));
    }

    @PostMapping("/roas/record")
    public Mono<RoasMetricsRecord> recordMetrics(@RequestBody RecordMetricsRequest request) {
        log.info("Metrics record requested. campaignId={} adsetId={} adId={} date={}",
                 request.campaignId(), request.adsetId(), request.adId(), request.date());
        return roasMetricsService.recordDailyMetrics(request.campaignId(), request.adsetId(),
                                                     request.adId(), request.date());
    }

    private static ActionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return ActionStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + status);
        }
    }
}
