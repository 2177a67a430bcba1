package com.adautopilot.optimization.service;

import com.adautopilot.common.attribution.AttributionEngine;
import com.adautopilot.common.attribution.AttributionModel;
import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.exception.ValidationException;
import com.adautopilot.common.model.ScopeRef;
import com.adautopilot.common.prediction.ConversionProbability;
import com.adautopilot.common.prediction.RoasPrediction;
import com.adautopilot.common.roas.PerformanceTier;
import com.adautopilot.common.roas.RoasCalculator;
import com.adautopilot.common.roas.RoasRecommendation;
import com.adautopilot.common.roas.RoasResult;
import com.adautopilot.optimization.model.ConversionOutcome;
import com.adautopilot.optimization.model.PerformanceInsight;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.repository.ConversionOutcomeRepository;
import com.adautopilot.optimization.repository.PerformanceInsightRepository;
import com.adautopilot.optimization.repository.RoasMetricsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Computes smoothed ROAS for a scope and persists one daily metrics row per
 * (scope, date).
 *
 * <p>Repository reads are reactive; the bootstrap itself is CPU-bound and runs on
 * {@link Schedulers#boundedElastic()}.
 */
@Service
public class RoasMetricsService {

    private static final Logger log = LoggerFactory.getLogger(RoasMetricsService.class);

    static final String CALCULATION_METHOD = "bayesian";

    private final PerformanceInsightRepository insightRepository;
    private final ConversionOutcomeRepository  outcomeRepository;
    private final RoasMetricsRepository        metricsRepository;
    private final RoasCalculator               calculator;
    private final PredictionService            predictionService;
    private final AutopilotSettings            settings;
    private final Clock                        clock;

    public RoasMetricsService(PerformanceInsightRepository insightRepository,
                              ConversionOutcomeRepository outcomeRepository,
                              RoasMetricsRepository metricsRepository,
                              RoasCalculator calculator,
                              PredictionService predictionService,
                              AutopilotSettings settings,
                              Clock clock) {
        this.insightRepository = insightRepository;
        this.outcomeRepository = outcomeRepository;
        this.metricsRepository = metricsRepository;
        this.calculator        = calculator;
        this.predictionService = predictionService;
        this.settings          = settings;
        this.clock             = clock;
    }

    /**
     * ROAS over {@code [start, end)}. A null {@code end} means now; a null
     * {@code start} means {@code end} minus the default window.
     */
    public Mono<RoasResult> calculateRoas(ScopeRef scope, LocalDateTime start, LocalDateTime end) {
        return calculate(scope, start, end, null);
    }

    /**
     * Same as {@link #calculateRoas} with conversion values weighted by the named
     * attribution model. An unknown model name leaves the values unweighted.
     */
    public Mono<RoasResult> calculateAttributedRoas(ScopeRef scope, LocalDateTime start, LocalDateTime end,
                                                    String attributionModel) {
        return calculate(scope, start, end, attributionModel);
    }

    /**
     * Computes and stores the metrics row for one scope and day. When the row
     * already exists it is returned unchanged and nothing is recomputed.
     */
    public Mono<RoasMetricsRecord> recordDailyMetrics(String campaignId, String adsetId, String adId,
                                                      LocalDate date) {
        return Mono.defer(() -> {
            if (campaignId == null || campaignId.isBlank()) {
                return Mono.error(new ValidationException("campaignId is required"));
            }
            ScopeRef scope = ScopeRef.narrowest(campaignId, adsetId, adId);
            LocalDate day = date != null ? date : LocalDate.now(clock);

            return findExisting(scope, day)
                .doOnNext(existing -> log.debug("ROAS metrics already recorded. scope={}:{} date={}",
                                                scope.level(), scope.id(), day))
                .switchIfEmpty(Mono.defer(() -> computeAndStore(scope, campaignId, adsetId, adId, day)));
        });
    }

    // ── calculation ───────────────────────────────────────────────────────────

    private Mono<RoasResult> calculate(ScopeRef scope, LocalDateTime start, LocalDateTime end, String model) {
        return Mono.defer(() -> {
            LocalDateTime windowEnd   = end != null ? end : LocalDateTime.now(clock);
            LocalDateTime windowStart = start != null
                ? start
                : windowEnd.minusDays(settings.roas().defaultWindowDays());
            if (windowEnd.isBefore(windowStart)) {
                return Mono.error(new ValidationException(
                    "Window end " + windowEnd + " is before start " + windowStart));
            }

            return Mono.zip(insights(scope, windowStart, windowEnd).collectList(),
                            outcomes(scope, windowStart, windowEnd).collectList())
                .flatMap(t -> Mono.fromCallable(() ->
                        compute(t.getT1(), t.getT2(), model, windowStart, windowEnd))
                    .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(r -> log.info("ROAS calculated. scope={}:{} actual={} smoothed={} conversions={} outlier={}",
                                        scope.level(), scope.id(), r.actualRoas(), r.smoothedRoas(),
                                        r.totalConversions(), r.isOutlier()));
        });
    }

    private RoasResult compute(List<PerformanceInsight> insights, List<ConversionOutcome> outcomes,
                               String model, LocalDateTime start, LocalDateTime end) {
        double spend       = insights.stream().map(PerformanceInsight::getSpendUsd)
                                     .filter(Objects::nonNull).mapToDouble(Double::doubleValue).sum();
        long clicks        = insights.stream().map(PerformanceInsight::getClicks)
                                     .filter(Objects::nonNull).mapToLong(Long::longValue).sum();
        long impressions   = insights.stream().map(PerformanceInsight::getImpressions)
                                     .filter(Objects::nonNull).mapToLong(Long::longValue).sum();

        List<Double> values;
        if (model == null) {
            values = outcomes.stream()
                .map(o -> o.getValueUsd() == null ? 0.0 : o.getValueUsd())
                .collect(Collectors.toList());
        } else {
            if (AttributionModel.fromName(model).isEmpty()) {
                log.warn("Unknown attribution model, outcomes left as stored. model={}", model);
            }
            values = AttributionEngine.apply(outcomes, model).stream()
                .map(RoasMetricsService::weightedValue)
                .collect(Collectors.toList());
        }
        return calculator.calculate(values, spend, clicks, impressions, start, end);
    }

    private static double weightedValue(ConversionOutcome outcome) {
        double value  = outcome.getValueUsd() == null ? 0.0 : outcome.getValueUsd();
        double weight = outcome.getAttributionWeight() == null ? 1.0 : outcome.getAttributionWeight();
        return value * weight;
    }

    // ── daily record ──────────────────────────────────────────────────────────

    private Mono<RoasMetricsRecord> computeAndStore(ScopeRef scope, String campaignId, String adsetId,
                                                    String adId, LocalDate day) {
        LocalDateTime start = day.atStartOfDay();
        LocalDateTime end   = day.plusDays(1).atStartOfDay();

        return Mono.zip(calculateRoas(scope, start, end),
                        predictionService.predictRoas(scope, settings.roas().predictionLookbackDays()))
            .flatMap(t -> {
                RoasMetricsRecord row = toRecord(t.getT1(), t.getT2(), campaignId, adsetId, adId, day);
                return metricsRepository.save(row);
            })
            .doOnNext(saved -> log.info("ROAS metrics recorded. scope={}:{} date={} tier={} recommendation={}",
                                        scope.level(), scope.id(), day,
                                        saved.getPerformanceTier(), saved.getRecommendation()))
            // a concurrent writer inserted the same (scope, date) first
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.info("ROAS metrics insert lost race, returning stored row. scope={}:{} date={}",
                         scope.level(), scope.id(), day);
                return findExisting(scope, day);
            });
    }

    private RoasMetricsRecord toRecord(RoasResult roas, RoasPrediction prediction, String campaignId,
                                       String adsetId, String adId, LocalDate day) {
        ConversionProbability probability =
            predictionService.conversionProbability(roas.clicks(), roas.totalConversions());
        PerformanceTier tier = PerformanceTier.classify(roas.actualRoas(), roas.conversionRate());
        RoasRecommendation recommendation =
            RoasRecommendation.from(tier, roas.smoothedRoas(), prediction.predictedRoas());

        RoasMetricsRecord row = new RoasMetricsRecord();
        row.setCampaignId(campaignId);
        row.setAdsetId(blankToNull(adsetId));
        row.setAdId(blankToNull(adId));
        row.setDate(day);
        row.setActualRoas(roas.actualRoas());
        row.setSmoothedRoas(roas.smoothedRoas());
        row.setPredictedRoas(prediction.predictedRoas());
        row.setPriorRoas(settings.roas().defaultPriorRoas());
        row.setConfidenceScore(prediction.confidence());
        row.setConfidenceIntervalLow(roas.confidenceIntervalLow());
        row.setConfidenceIntervalHigh(roas.confidenceIntervalHigh());
        row.setSampleSize(roas.sampleSize());
        row.setTotalRevenueUsd(roas.totalRevenueUsd());
        row.setTotalCostUsd(roas.totalCostUsd());
        row.setTotalConversions(roas.totalConversions());
        row.setImpressions(roas.impressions());
        row.setClicks(roas.clicks());
        row.setConversionRate(roas.conversionRate());
        row.setConversionProbability(probability.probability());
        row.setOutlier(roas.isOutlier());
        row.setOutlierReason(roas.outlierReason());
        row.setPerformanceTier(tier.name().toLowerCase());
        row.setRecommendation(recommendation.recommendation());
        row.setRecommendedBudgetChangePct(recommendation.budgetChangePct());
        row.setCalculationMethod(CALCULATION_METHOD);
        row.setCreatedAt(LocalDateTime.now(clock));
        return row;
    }

    // ── scope dispatch ────────────────────────────────────────────────────────

    private Mono<RoasMetricsRecord> findExisting(ScopeRef scope, LocalDate day) {
        return switch (scope.level()) {
            case AD       -> metricsRepository.findForAdOn(scope.id(), day);
            case AD_SET   -> metricsRepository.findForAdSetOn(scope.id(), day);
            case CAMPAIGN -> metricsRepository.findForCampaignOn(scope.id(), day);
        };
    }

    private Flux<PerformanceInsight> insights(ScopeRef scope, LocalDateTime start, LocalDateTime end) {
        return switch (scope.level()) {
            case AD       -> insightRepository.findForAd(scope.id(), start, end);
            case AD_SET   -> insightRepository.findForAdSet(scope.id(), start, end);
            case CAMPAIGN -> insightRepository.findForCampaign(scope.id(), start, end);
        };
    }

    private Flux<ConversionOutcome> outcomes(ScopeRef scope, LocalDateTime start, LocalDateTime end) {
        return switch (scope.level()) {
            case AD       -> outcomeRepository.findForAd(scope.id(), start, end);
            case AD_SET   -> outcomeRepository.findForAdSet(scope.id(), start, end);
            case CAMPAIGN -> outcomeRepository.findForCampaign(scope.id(), start, end);
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
