package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.PerformanceInsight;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Windows are half-open: {@code date_start >= :start AND date_start < :end}.
 */
@Repository
public interface PerformanceInsightRepository extends ReactiveCrudRepository<PerformanceInsight, Long> {

    @Query("""
        SELECT * FROM performance_insights
        WHERE ad_id = :adId AND date_start >= :start AND date_start < :end
        """)
    Flux<PerformanceInsight> findForAd(String adId, LocalDateTime start, LocalDateTime end);

    @Query("""
        SELECT * FROM performance_insights
        WHERE adset_id = :adsetId AND date_start >= :start AND date_start < :end
        """)
    Flux<PerformanceInsight> findForAdSet(String adsetId, LocalDateTime start, LocalDateTime end);

    @Query("""
        SELECT * FROM performance_insights
        WHERE campaign_id = :campaignId AND date_start >= :start AND date_start < :end
        """)
    Flux<PerformanceInsight> findForCampaign(String campaignId, LocalDateTime start, LocalDateTime end);

    /** Account-wide spend booked since {@code since}. */
    @Query("SELECT COALESCE(SUM(spend_usd), 0) FROM performance_insights WHERE date_start >= :since")
    Mono<Double> sumSpendSince(LocalDateTime since);
}
