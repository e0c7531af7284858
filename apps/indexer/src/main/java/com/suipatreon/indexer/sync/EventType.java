package com.suipatreon.indexer.sync;

/**
 * Move events the indexer tracks, with the module that emits them.
 */
public enum EventType {
    PROFILE_CREATED("profile", "ProfileCreated"),
    PROFILE_UPDATED("profile", "ProfileUpdated"),
    TIER_CREATED("subscription", "TierCreated"),
    TIER_PRICE_UPDATED("subscription", "TierPriceUpdated"),
    TIER_DEACTIVATED("subscription", "TierDeactivated"),
    SUBSCRIPTION_PURCHASED("subscription", "SubscriptionPurchased"),
    CONTENT_CREATED("content", "ContentCreated");

    private final String module;
    private final String eventName;

    EventType(String module, String eventName) {
        this.module = module;
        this.eventName = eventName;
    }

    public String getModule() {
        return module;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * {@code MoveEventType} filter value for a published package.
     */
    public String moveEventType(String packageId) {
        return packageId + "::" + module + "::" + eventName;
    }
}
