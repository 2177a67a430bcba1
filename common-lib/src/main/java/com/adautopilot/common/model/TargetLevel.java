package com.adautopilot.common.model;

/**
 * Ad-hierarchy level an action or metric row applies to. Campaign 1→N AdSet 1→N Ad.
 */
public enum TargetLevel {
    AD,
    AD_SET,
    CAMPAIGN
}
