package com.adautopilot.optimization.service;

import com.adautopilot.common.config.AutopilotSettings;
import com.adautopilot.common.model.ScopeRef;
import com.adautopilot.common.prediction.ConversionProbability;
import com.adautopilot.common.prediction.ExpectedValue;
import com.adautopilot.common.prediction.PredictionEngine;
import com.adautopilot.common.prediction.RoasPrediction;
import com.adautopilot.optimization.model.RoasMetricsRecord;
import com.adautopilot.optimization.repository.RoasMetricsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Reactive front for {@link PredictionEngine}: loads daily ROAS history for a scope
 * and forecasts the next value.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    private final RoasMetricsRepository metricsRepository;
    private final PredictionEngine      predictionEngine;
    private final AutopilotSettings     settings;
    private final Clock                 clock;

    public PredictionService(RoasMetricsRepository metricsRepository, PredictionEngine predictionEngine,
                             AutopilotSettings settings, Clock clock) {
        this.metricsRepository = metricsRepository;
        this.predictionEngine  = predictionEngine;
        this.settings          = settings;
        this.clock             = clock;
    }

    /**
     * @param lookbackDays history window; zero or negative uses the configured default
     */
    public Mono<RoasPrediction> predictRoas(ScopeRef scope, int lookbackDays) {
        int days = lookbackDays > 0 ? lookbackDays : settings.roas().predictionLookbackDays();
        LocalDate since = LocalDate.now(clock).minusDays(days);

        return history(scope, since)
            .mapNotNull(RoasMetricsRecord::getActualRoas)
            .collectList()
            .map(predictionEngine::predict)
            .doOnNext(p -> log.debug("ROAS predicted. scope={}:{} predicted={} points={} trend={}",
                                     scope.level(), scope.id(), p.predictedRoas(),
                                     p.historicalPoints(), p.trend()));
    }

    public ConversionProbability conversionProbability(long clicks, long conversions) {
        return predictionEngine.conversionProbability(clicks, conversions);
    }

    public ExpectedValue expectedValue(double conversionProbability, double averageOrderValue, double costPerClick) {
        return predictionEngine.expectedValue(conversionProbability, averageOrderValue, costPerClick);
    }

    private Flux<RoasMetricsRecord> history(ScopeRef scope, LocalDate since) {
        return switch (scope.level()) {
            case AD       -> metricsRepository.findHistoryForAd(scope.id(), since);
            case AD_SET   -> metricsRepository.findHistoryForAdSet(scope.id(), since);
            case CAMPAIGN -> metricsRepository.findHistoryForCampaign(scope.id(), since);
        };
    }
}
