package com.adautopilot.optimization.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Impressions, clicks and spend for one scope over {@code [dateStart, dateStop)}.
 * Written by the insights collector, read-only here.
 */
@Data
@NoArgsConstructor
@Table("performance_insights")
public class PerformanceInsight {

    @Id
    private Long id;

    private String campaignId;

    private String adsetId;

    private String adId;

    private LocalDateTime dateStart;

    private LocalDateTime dateStop;

    private Long impressions;

    private Long clicks;

    private Double spendUsd;
}
