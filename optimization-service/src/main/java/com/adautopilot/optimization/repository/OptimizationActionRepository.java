package com.adautopilot.optimization.repository;

import com.adautopilot.optimization.model.OptimizationAction;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Status transitions are single conditional UPDATEs. Each returns the affected row
 * count: 1 means this caller won the transition, 0 means the action was not in an
 * expected source status (or does not exist).
 */
@Repository
public interface OptimizationActionRepository extends ReactiveCrudRepository<OptimizationAction, Long> {

    Mono<OptimizationAction> findByActionId(String actionId);

    @Query("""
        SELECT * FROM optimization_actions
        WHERE status IN (:statuses)
        ORDER BY confidence DESC, created_at ASC
        """)
    Flux<OptimizationAction> findByStatuses(Collection<String> statuses);

    @Query("SELECT COUNT(*) FROM optimization_actions WHERE status = :status")
    Mono<Long> countByStatusName(String status);

    @Query("""
        SELECT COUNT(*) FROM optimization_actions
        WHERE status = 'EXECUTED' AND executed_at >= :since
        """)
    Mono<Long> countExecutedSince(LocalDateTime since);

    @Query("""
        SELECT COUNT(*) FROM optimization_actions
        WHERE status = 'FAILED' AND updated_at >= :since
        """)
    Mono<Long> countFailedSince(LocalDateTime since);

    /**
     * Same-type actions on the target that still block a new one: executed inside
     * the cooldown window, or not yet terminal at any age.
     */
    @Query("""
        SELECT COUNT(*) FROM optimization_actions
        WHERE target_id = :targetId
          AND action_type = :actionType
          AND ((status = 'EXECUTED' AND executed_at >= :since)
            OR status IN ('SUGGESTED', 'PENDING', 'EXECUTING'))
        """)
    Mono<Long> countCoolingDown(String targetId, String actionType, LocalDateTime since);

    @Query("""
        SELECT * FROM optimization_actions
        WHERE target_id = :targetId AND action_type = :actionType AND status = 'EXECUTED'
        ORDER BY executed_at DESC
        LIMIT 1
        """)
    Mono<OptimizationAction> findLastExecuted(String targetId, String actionType);

    @Query("""
        SELECT * FROM optimization_actions
        WHERE status = 'SUGGESTED' AND expires_at < :now
        """)
    Flux<OptimizationAction> findStale(LocalDateTime now);

    // ── compare-and-set transitions ──────────────────────────────────────────

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'PENDING', approved_by = :approvedBy, approved_at = :now, updated_at = :now
        WHERE action_id = :actionId AND status = 'SUGGESTED'
        """)
    Mono<Integer> markApproved(String actionId, String approvedBy, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'EXECUTING', executed_by = :executedBy, updated_at = :now
        WHERE action_id = :actionId AND status IN ('SUGGESTED', 'PENDING')
        """)
    Mono<Integer> markExecuting(String actionId, String executedBy, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'EXECUTED', executed_at = :now, execution_result = :result, updated_at = :now
        WHERE action_id = :actionId AND status = 'EXECUTING'
        """)
    Mono<Integer> markExecuted(String actionId, String result, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'FAILED', execution_error = :error, updated_at = :now
        WHERE action_id = :actionId AND status = 'EXECUTING'
        """)
    Mono<Integer> markFailed(String actionId, String error, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'CANCELLED', cancelled_by = :cancelledBy, cancelled_at = :now, updated_at = :now
        WHERE action_id = :actionId AND status IN ('SUGGESTED', 'PENDING')
        """)
    Mono<Integer> markCancelled(String actionId, String cancelledBy, LocalDateTime now);

    @Modifying
    @Query("""
        UPDATE optimization_actions
        SET status = 'CANCELLED', cancelled_by = :cancelledBy, cancelled_at = :now, updated_at = :now
        WHERE action_id = :actionId AND status = 'SUGGESTED' AND expires_at < :now
        """)
    Mono<Integer> markExpired(String actionId, String cancelledBy, LocalDateTime now);
}
