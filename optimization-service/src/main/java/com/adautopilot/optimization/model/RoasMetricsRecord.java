package com.adautopilot.optimization.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Daily ROAS snapshot for one scope. Inserted once per (scope, date) and never
 * updated afterwards.
 */
@Data
@NoArgsConstructor
@Table("roas_metrics")
public class RoasMetricsRecord {

    @Id
    private Long id;

    private String campaignId;

    private String adsetId;

    private String adId;

    private LocalDate date;

    // ── ROAS ──────────────────────────────────────────────────────────────────
    private Double actualRoas;

    private Double smoothedRoas;

    private Double predictedRoas;

    private Double priorRoas;

    private Double confidenceScore;

    private Double confidenceIntervalLow;

    private Double confidenceIntervalHigh;

    private Integer sampleSize;

    // ── volume ────────────────────────────────────────────────────────────────
    private Double totalRevenueUsd;

    private Double totalCostUsd;

    private Integer totalConversions;

    private Long impressions;

    private Long clicks;

    private Double conversionRate;

    private Double conversionProbability;

    // ── classification ────────────────────────────────────────────────────────
    @Column("is_outlier")
    private Boolean outlier;

    private String outlierReason;

    private String performanceTier;

    private String recommendation;

    private Double recommendedBudgetChangePct;

    private String calculationMethod;

    private LocalDateTime createdAt;

    public boolean isOutlierRow() {
        return Boolean.TRUE.equals(outlier);
    }
}
