package com.adautopilot.optimization.model;

import com.adautopilot.common.model.ActionStatus;
import com.adautopilot.common.model.ActionType;
import com.adautopilot.common.model.TargetLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One queued optimization action.
 *
 * <p>Inserted with {@code save()} once. Every later status change goes through a
 * conditional UPDATE in {@code OptimizationActionRepository}, never through
 * {@code save()}, so concurrent callers cannot overwrite each other's transition.
 */
@Data
@NoArgsConstructor
@Table("optimization_actions")
public class OptimizationAction {

    @Id
    private Long id;

    private String actionId;

    private ActionType actionType;

    private TargetLevel targetLevel;

    private String targetId;

    private String campaignId;

    private String adsetId;

    private String adId;

    // ── change ────────────────────────────────────────────────────────────────
    private Double amountPct;

    private Double amountUsd;

    private Double oldBudgetUsd;

    private Double newBudgetUsd;

    /** JSON list of {@code BudgetAllocation}, reallocate only. */
    private String reallocationPlan;

    /** JSON list of ad ids touched by a reallocation. */
    private String affectedAdIds;

    // ── evidence ──────────────────────────────────────────────────────────────
    private String reason;

    private String reasonDetails;

    private Double confidence;

    private Double roasValue;

    private Double spendUsd;

    private Long impressions;

    // ── lifecycle ─────────────────────────────────────────────────────────────
    private ActionStatus status;

    private String createdBy;

    private String approvedBy;

    private LocalDateTime approvedAt;

    private String executedBy;

    private LocalDateTime executedAt;

    /** JSON of the executor result. */
    private String executionResult;

    private String executionError;

    private String cancelledBy;

    private LocalDateTime cancelledAt;

    private LocalDateTime expiresAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /** A SUGGESTED action past its expiry. */
    public boolean isStale(LocalDateTime now) {
        return status == ActionStatus.SUGGESTED && expiresAt != null && expiresAt.isBefore(now);
    }
}
