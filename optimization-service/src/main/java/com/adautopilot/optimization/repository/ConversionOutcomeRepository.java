package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.ConversionOutcome;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface ConversionOutcomeRepository extends ReactiveCrudRepository<ConversionOutcome, Long> {

    @Query("""
        SELECT * FROM conversion_outcomes
        WHERE ad_id = :adId AND event_timestamp >= :start AND event_timestamp < :end
        ORDER BY event_timestamp ASC
        """)
    Flux<ConversionOutcome> findForAd(String adId, LocalDateTime start, LocalDateTime end);

    @Query("""
        SELECT * FROM conversion_outcomes
        WHERE adset_id = :adsetId AND event_timestamp >= :start AND event_timestamp < :end
        ORDER BY event_timestamp ASC
        """)
    Flux<ConversionOutcome> findForAdSet(String adsetId, LocalDateTime start, LocalDateTime end);

    @Query("""
        SELECT * FROM conversion_outcomes
        WHERE campaign_id = :campaignId AND event_timestamp >= :start AND event_timestamp < :end
        ORDER BY event_timestamp ASC
        """)
    Flux<ConversionOutcome> findForCampaign(String campaignId, LocalDateTime start, LocalDateTime end);
}
