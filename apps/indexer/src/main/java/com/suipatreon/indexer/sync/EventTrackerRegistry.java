package com.suipatreon.indexer.sync;

import com.suipatreon.indexer.config.IndexerProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Static table of tracked events: what is polled and which handler receives it.
 */
@Component
public class EventTrackerRegistry {

    private final List<EventTracker> trackers;

    public EventTrackerRegistry(IndexerProperties properties,
                                ProfileSyncHandler profileHandler,
                                TierSyncHandler tierHandler,
                                SubscriptionSyncHandler subscriptionHandler,
                                ContentSyncHandler contentHandler) {
        String packageId = properties.getPackageId();
        List<EventTracker> list = new ArrayList<>();
        list.add(tracker(packageId, EventType.PROFILE_CREATED, profileHandler::handleProfileCreated));
        list.add(tracker(packageId, EventType.PROFILE_UPDATED, profileHandler::handleProfileUpdated));
        list.add(tracker(packageId, EventType.TIER_CREATED, tierHandler::handleTierCreated));
        list.add(tracker(packageId, EventType.TIER_PRICE_UPDATED, tierHandler::handleTierPriceUpdated));
        list.add(tracker(packageId, EventType.TIER_DEACTIVATED, tierHandler::handleTierDeactivated));
        list.add(tracker(packageId, EventType.SUBSCRIPTION_PURCHASED, subscriptionHandler::handleSubscriptionPurchased));
        list.add(tracker(packageId, EventType.CONTENT_CREATED, contentHandler::handleContentCreated));
        this.trackers = Collections.unmodifiableList(list);
    }

    public List<EventTracker> getTrackers() {
        return trackers;
    }

    public Optional<EventTracker> find(EventType type) {
        return trackers.stream().filter(t -> t.getType() == type).findFirst();
    }

    private static EventTracker tracker(String packageId, EventType type, EventHandler handler) {
        return new EventTracker(type, type.moveEventType(packageId), handler);
    }
}
