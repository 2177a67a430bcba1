package com.adautopilot.optimization.model;

import com.adautopilot.common.attribution.AttributedConversion;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One pixel conversion. Attribution fields are rewritten in memory before
 * revenue is aggregated.
 */
@Data
@NoArgsConstructor
@Table("conversion_outcomes")
public class ConversionOutcome implements AttributedConversion {

    @Id
    private Long id;

    private String campaignId;

    private String adsetId;

    private String adId;

    private Double valueUsd;

    private String conversionType;

    private LocalDateTime eventTimestamp;

    private String sessionId;

    private Integer sessionDurationSeconds;

    private String attributionModel;

    private Double attributionWeight;
}
