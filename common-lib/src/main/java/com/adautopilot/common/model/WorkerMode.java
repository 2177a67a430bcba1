package com.adautopilot.common.model;

/**
 * Operating mode of the autonomous worker.
 *
 * <ul>
 *   <li>{@link #SUGGEST}: every surviving action is queued for human approval</li>
 *   <li>{@link #AUTO}: actions that are safe for auto execution run immediately</li>
 * </ul>
 */
public enum WorkerMode {
    SUGGEST,
    AUTO
}
