package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.RoasMetricsRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface RoasMetricsRepository extends ReactiveCrudRepository<RoasMetricsRecord, Long> {

    // ── one row per (scope, date) ─────────────────────────────────────────────

    @Query("SELECT * FROM roas_metrics WHERE ad_id = :adId AND date = :date LIMIT 1")
    Mono<RoasMetricsRecord> findForAdOn(String adId, LocalDate date);

    @Query("SELECT * FROM roas_metrics WHERE adset_id = :adsetId AND ad_id IS NULL AND date = :date LIMIT 1")
    Mono<RoasMetricsRecord> findForAdSetOn(String adsetId, LocalDate date);

    @Query("""
        SELECT * FROM roas_metrics
        WHERE campaign_id = :campaignId AND adset_id IS NULL AND ad_id IS NULL AND date = :date
        LIMIT 1
        """)
    Mono<RoasMetricsRecord> findForCampaignOn(String campaignId, LocalDate date);

    // ── history, newest first (prediction) ───────────────────────────────────

    @Query("""
        SELECT * FROM roas_metrics
        WHERE ad_id = :adId AND date >= :since
        ORDER BY date DESC
        """)
    Flux<RoasMetricsRecord> findHistoryForAd(String adId, LocalDate since);

    @Query("""
        SELECT * FROM roas_metrics
        WHERE adset_id = :adsetId AND ad_id IS NULL AND date >= :since
        ORDER BY date DESC
        """)
    Flux<RoasMetricsRecord> findHistoryForAdSet(String adsetId, LocalDate since);

    @Query("""
        SELECT * FROM roas_metrics
        WHERE campaign_id = :campaignId AND adset_id IS NULL AND ad_id IS NULL AND date >= :since
        ORDER BY date DESC
        """)
    Flux<RoasMetricsRecord> findHistoryForCampaign(String campaignId, LocalDate since);

    /**
     * Ad-level rows of a campaign since {@code since}, newest first. Input to
     * action generation and to the worker's guardrail context.
     */
    @Query("""
        SELECT * FROM roas_metrics
        WHERE campaign_id = :campaignId AND ad_id IS NOT NULL AND date >= :since
        ORDER BY date DESC
        """)
    Flux<RoasMetricsRecord> findAdMetricsForCampaign(String campaignId, LocalDate since);
}
