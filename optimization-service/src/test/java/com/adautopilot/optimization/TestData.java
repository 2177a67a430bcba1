package com.adautopilot.optimization;

import com.adautopilot.optimization.model.Ad;
import com.adautopilot.optimization.model.Campaign;
import com.adautopilot.optimization.model.RoasMetricsRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/** Entities used across the service and worker tests. */
public final class TestData {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);
    public static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    public static final LocalDate TODAY = LocalDate.now(CLOCK);

    private TestData() {}

    public static Campaign campaign(String campaignId, String status, LocalDateTime createdAt) {
        Campaign campaign = new Campaign();
        campaign.setCampaignId(campaignId);
        campaign.setName("Campaign " + campaignId);
        campaign.setStatus(status);
        campaign.setDailyBudgetUsd(1_000.0);
        campaign.setCreatedAt(createdAt);
        return campaign;
    }

    public static Campaign activeCampaign(String campaignId, int ageHours) {
        return campaign(campaignId, Campaign.STATUS_ACTIVE, NOW.minusHours(ageHours));
    }

    public static Ad ad(String adId, String campaignId, Double dailyBudgetUsd) {
        Ad ad = new Ad();
        ad.setAdId(adId);
        ad.setAdsetId("set-1");
        ad.setCampaignId(campaignId);
        ad.setStatus(Campaign.STATUS_ACTIVE);
        ad.setDailyBudgetUsd(dailyBudgetUsd);
        ad.setCreatedAt(NOW.minusDays(10));
        return ad;
    }

    /** Ad-level row with enough volume to pass the minimum-data checks. */
    public static RoasMetricsRecord adMetrics(String campaignId, String adId, LocalDate date,
                                              double roas, double confidence) {
        RoasMetricsRecord row = new RoasMetricsRecord();
        row.setCampaignId(campaignId);
        row.setAdsetId("set-1");
        row.setAdId(adId);
        row.setDate(date);
        row.setActualRoas(roas);
        row.setSmoothedRoas(roas);
        row.setConfidenceScore(confidence);
        row.setTotalCostUsd(500.0);
        row.setTotalRevenueUsd(500.0 * roas);
        row.setTotalConversions(40);
        row.setImpressions(5_000L);
        row.setClicks(400L);
        row.setOutlier(false);
        return row;
    }
}
