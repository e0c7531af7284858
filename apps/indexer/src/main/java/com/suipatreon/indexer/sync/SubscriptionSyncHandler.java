package com.suipatreon.indexer.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.Subscription;
import com.suipatreon.indexer.entity.Tier;
import com.suipatreon.indexer.repository.SubscriptionRepository;
import com.suipatreon.indexer.repository.TierRepository;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.util.CurrencyUnits;
import com.suipatreon.indexer.util.DependencyNotFoundException;
import com.suipatreon.indexer.util.EventFields;
import com.suipatreon.indexer.util.RetryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

/**
 * SubscriptionPurchased handler
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubscriptionSyncHandler {

    private final SubscriptionRepository subscriptionRepository;
    private final TierRepository tierRepository;
    private final IndexerProperties properties;

    public void handleSubscriptionPurchased(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        JsonNode json = event.getParsedJson();
        String subscriptionId = EventFields.requireText(json, "subscription_id");
        String subscriber = EventFields.requireText(json, "subscriber");
        String tierId = EventFields.requireText(json, "tier_id");
        BigInteger amount = json.hasNonNull("amount") ? EventFields.requireBigInteger(json, "amount") : BigInteger.ZERO;
        Instant expiresAt = EventFields.instant(json, "expires_at");
        if (expiresAt == null) {
            throw new IllegalArgumentException("Missing event field: expires_at");
        }
        Instant startsAt = purchaseTime(event, json);

        RetryUtils.executeWithRetry(() -> {
            Tier tier = tierRepository.findByTierId(tierId)
                    .orElseThrow(() -> new DependencyNotFoundException(
                            "Tier not found for tierId " + tierId + ", TierCreated may not be indexed yet"));

            Subscription subscription = subscriptionRepository.findBySubscriptionId(subscriptionId)
                    .orElseGet(() -> {
                        Subscription created = new Subscription();
                        created.setSubscriptionId(subscriptionId);
                        created.setStartsAt(Instant.now());
                        return created;
                    });
            if (startsAt != null) {
                subscription.setStartsAt(startsAt);
            }
            subscription.setSubscriber(subscriber);
            subscription.setTierId(tier.getId());
            subscription.setAmountPaid(amount);
            subscription.setExpiresAt(expiresAt);
            subscription.setIsActive(true);
            return subscriptionRepository.save(subscription);
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        log.info("[SubscriptionPurchased] {} subscribed to tier {} for {} until {}, tx {}",
                subscriber, tierId, CurrencyUnits.format(amount), expiresAt, txDigest);
    }

    private static Instant purchaseTime(SuiEvent event, JsonNode json) {
        Instant timestamp = EventFields.instant(json, "timestamp");
        if (timestamp != null) {
            return timestamp;
        }
        return event.getTimestampMs() != null ? Instant.ofEpochMilli(event.getTimestampMs()) : null;
    }
}
