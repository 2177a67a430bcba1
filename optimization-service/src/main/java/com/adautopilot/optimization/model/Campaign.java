package com.adautopilot.optimization.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Campaign as mirrored from the ad platform. Only status and budget are written
 * back, after an executor succeeded.
 */
@Data
@NoArgsConstructor
@Table("campaigns")
public class Campaign {

    public static final String STATUS_ACTIVE = "ACTIVE";
    public static final String STATUS_PAUSED = "PAUSED";

    @Id
    private String campaignId;

    private String name;

    private String status;

    private Double dailyBudgetUsd;

    private LocalDateTime createdAt;
}
