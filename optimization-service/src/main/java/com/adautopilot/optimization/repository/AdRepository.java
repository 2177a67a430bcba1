package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.Ad;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AdRepository extends ReactiveCrudRepository<Ad, String> {

    Flux<Ad> findByCampaignId(String campaignId);

    @Modifying
    @Query("UPDATE ads SET daily_budget_usd = :budget WHERE ad_id = :adId")
    Mono<Integer> updateDailyBudget(String adId, double budget);

    @Modifying
    @Query("UPDATE ads SET status = :status WHERE ad_id = :adId")
    Mono<Integer> updateStatus(String adId, String status);
}
