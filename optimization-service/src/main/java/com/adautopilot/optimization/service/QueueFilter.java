package com.adautopilot.optimization.service;

import com.adautopilot.common.model.ActionStatus;
import com.adautopilot.common.model.ActionType;

/**
 * Queue listing filter. Null fields do not filter; a null status means
 * SUGGESTED and PENDING.
 */
public record QueueFilter(String campaignId, String targetId, ActionStatus status, ActionType type, int limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT     = 1000;

    public QueueFilter {
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    }

    public static QueueFilter open() {
        return new QueueFilter(null, null, null, null, DEFAULT_LIMIT);
    }
}
