package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.Campaign;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface CampaignRepository extends ReactiveCrudRepository<Campaign, String> {

    /**
     * Active campaigns created at or before {@code createdBefore}, oldest first.
     */
    @Query("""
        SELECT * FROM campaigns
        WHERE status = 'ACTIVE'
          AND created_at <= :createdBefore
        ORDER BY created_at ASC
        LIMIT :limit
        """)
    Flux<Campaign> findEligible(LocalDateTime createdBefore, int limit);

    @Query("""
        SELECT * FROM campaigns
        WHERE status = 'ACTIVE'
        ORDER BY created_at ASC
        LIMIT :limit
        """)
    Flux<Campaign> findActive(int limit);

    @Query("SELECT * FROM campaigns WHERE campaign_id IN (:campaignIds)")
    Flux<Campaign> findByCampaignIds(Collection<String> campaignIds);

    @Modifying
    @Query("UPDATE campaigns SET status = :status WHERE campaign_id = :campaignId")
    Mono<Integer> updateStatus(String campaignId, String status);

    @Modifying
    @Query("UPDATE campaigns SET daily_budget_usd = :budget WHERE campaign_id = :campaignId")
    Mono<Integer> updateDailyBudget(String campaignId, double budget);
}
