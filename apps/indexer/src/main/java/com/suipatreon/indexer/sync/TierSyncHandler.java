package com.suipatreon.indexer.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.Creator;
import com.suipatreon.indexer.entity.Tier;
import com.suipatreon.indexer.repository.CreatorRepository;
import com.suipatreon.indexer.repository.TierRepository;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.util.CurrencyUnits;
import com.suipatreon.indexer.util.DependencyNotFoundException;
import com.suipatreon.indexer.util.EventFields;
import com.suipatreon.indexer.util.EventSequences;
import com.suipatreon.indexer.util.RetryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Subscription tier handlers
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TierSyncHandler {

    private final TierRepository tierRepository;
    private final CreatorRepository creatorRepository;
    private final IndexerProperties properties;

    public void handleTierCreated(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        JsonNode json = event.getParsedJson();
        String tierId = EventFields.requireText(json, "tier_id");
        String creatorAddress = EventFields.requireText(json, "creator");
        String name = EventFields.requireText(json, "name");
        String description = EventFields.text(json, "description");
        BigInteger price = EventFields.requireBigInteger(json, "price");

        Tier saved = RetryUtils.executeWithRetry(() -> {
            Creator creator = creatorRepository.findByAddress(creatorAddress)
                    .orElseThrow(() -> new DependencyNotFoundException(
                            "Creator not found for address " + creatorAddress + ", ProfileCreated may not be indexed yet"));

            Tier tier = tierRepository.findByTierId(tierId).orElse(null);
            if (tier == null) {
                tier = new Tier();
                tier.setTierId(tierId);
                tier.setPrice(price);
                tier.setIsActive(true);
            }
            // price and isActive of an existing row belong to the later update events
            tier.setCreatorId(creator.getId());
            tier.setName(name);
            tier.setDescription(description != null ? description : "");
            return tierRepository.save(tier);
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        log.info("[TierCreated] Indexed tier {} ({}) at {}, tx {}",
                name, tierId, CurrencyUnits.format(saved.getPrice()), txDigest);
    }

    public void handleTierPriceUpdated(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        JsonNode json = event.getParsedJson();
        String tierId = EventFields.requireText(json, "tier_id");
        BigInteger newPrice = EventFields.requireBigInteger(json, "new_price");

        boolean applied = RetryUtils.executeWithRetry(() -> {
            Tier tier = requireTier(tierId);
            if (EventSequences.isStale(eventSeq, tier.getPriceEventSeq())) {
                return false;
            }
            tier.setPrice(newPrice);
            if (eventSeq != null) {
                tier.setPriceEventSeq(eventSeq);
            }
            tierRepository.save(tier);
            return true;
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        if (!applied) {
            log.info("[TierPriceUpdated] Skipping seq {} for tier {}, a later price is already applied, tx {}",
                    eventSeq, tierId, txDigest);
            return;
        }
        log.info("[TierPriceUpdated] Tier {} now costs {}, tx {}", tierId, CurrencyUnits.format(newPrice), txDigest);
    }

    public void handleTierDeactivated(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        String tierId = EventFields.requireText(event.getParsedJson(), "tier_id");

        RetryUtils.executeWithRetry(() -> {
            Tier tier = requireTier(tierId);
            tier.setIsActive(false);
            return tierRepository.save(tier);
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        log.info("[TierDeactivated] Deactivated tier {}, tx {}", tierId, txDigest);
    }

    private Tier requireTier(String tierId) throws DependencyNotFoundException {
        return tierRepository.findByTierId(tierId)
                .orElseThrow(() -> new DependencyNotFoundException(
                        "Tier not found for tierId " + tierId + ", TierCreated may not be indexed yet"));
    }
}
