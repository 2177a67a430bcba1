package com.adautopilot.optimization.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("ads")
public class Ad {

    @Id
    private String adId;

    private String adsetId;

    private String campaignId;

    private String status;

    private Double dailyBudgetUsd;

    private LocalDateTime createdAt;
}
