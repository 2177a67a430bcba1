package com.adautopilot.common.policy;

public record CreativeMetadata(String creativeId, boolean isHumanApproved) {}
