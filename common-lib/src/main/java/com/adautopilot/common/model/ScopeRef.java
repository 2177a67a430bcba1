package com.adautopilot.common.model;

import com.adautopilot.common.exception.ValidationException;

/**
 * One scope of the ad hierarchy (ad, ad set or campaign) identified by id.
 */
public record ScopeRef(TargetLevel level, String id) {

    public ScopeRef {
        if (level == null) {
            throw new ValidationException("Scope level is required");
        }
        if (id == null || id.isBlank()) {
            throw new ValidationException("Scope id is required for level " + level);
        }
    }

    public static ScopeRef campaign(String campaignId) {
        return new ScopeRef(TargetLevel.CAMPAIGN, campaignId);
    }

    public static ScopeRef adSet(String adSetId) {
        return new ScopeRef(TargetLevel.AD_SET, adSetId);
    }

    public static ScopeRef ad(String adId) {
        return new ScopeRef(TargetLevel.AD, adId);
    }

    /**
     * Resolves the narrowest scope among the given ids: ad wins over ad set, ad set
     * over campaign. Blank ids are ignored.
     *
     * @throws ValidationException when no id is given
     */
    public static ScopeRef narrowest(String campaignId, String adSetId, String adId) {
        if (hasText(adId))      return ad(adId);
        if (hasText(adSetId))   return adSet(adSetId);
        if (hasText(campaignId)) return campaign(campaignId);
        throw new ValidationException("One of campaignId, adSetId or adId is required");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
