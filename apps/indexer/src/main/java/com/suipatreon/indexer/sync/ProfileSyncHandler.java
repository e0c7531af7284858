package com.suipatreon.indexer.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.Creator;
import com.suipatreon.indexer.repository.CreatorRepository;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.util.DependencyNotFoundException;
import com.suipatreon.indexer.util.EventFields;
import com.suipatreon.indexer.util.EventSequences;
import com.suipatreon.indexer.util.RetryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Creator profile handlers
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileSyncHandler {

    static final int MIN_TOPIC = 0;
    static final int MAX_TOPIC = 9;

    private final CreatorRepository creatorRepository;
    private final IndexerProperties properties;

    /**
     * ProfileCreated: upsert the creator keyed by wallet address
     */
    public void handleProfileCreated(SuiEvent event, String txDigest, BigInteger eventSeq) {
        JsonNode json = event.getParsedJson();
        String address = EventFields.requireText(json, "creator");
        String profileId = EventFields.requireText(json, "profile_id");
        String name = EventFields.requireText(json, "name");
        int topic = validTopic(json);

        Creator creator = creatorRepository.findByAddress(address).orElseGet(() -> {
            Creator created = new Creator();
            created.setAddress(address);
            return created;
        });
        creator.setProfileId(profileId);
        if (creator.getProfileEventSeq() != null) {
            // A ProfileUpdated already wrote the profile fields
            creatorRepository.save(creator);
            log.info("[ProfileCreated] Creator {} already updated at seq {}, keeping its profile, tx {}",
                    address, creator.getProfileEventSeq(), txDigest);
            return;
        }
        applyProfile(creator, json, name, topic);
        creatorRepository.save(creator);

        log.info("[ProfileCreated] Indexed creator {} ({}) with topic {}, tx {}", name, profileId, topic, txDigest);
    }

    /**
     * ProfileUpdated: the creator row may not exist yet when ProfileCreated is still in flight
     */
    public void handleProfileUpdated(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        JsonNode json = event.getParsedJson();
        String profileId = EventFields.requireText(json, "profile_id");
        String name = EventFields.requireText(json, "name");
        int topic = validTopic(json);

        boolean applied = RetryUtils.executeWithRetry(() -> {
            Creator creator = creatorRepository.findByProfileId(profileId)
                    .orElseThrow(() -> new DependencyNotFoundException(
                            "Creator not found for profileId " + profileId + ", ProfileCreated may not be indexed yet"));
            if (EventSequences.isStale(eventSeq, creator.getProfileEventSeq())) {
                return false;
            }
            applyProfile(creator, json, name, topic);
            if (eventSeq != null) {
                creator.setProfileEventSeq(eventSeq);
            }
            creatorRepository.save(creator);
            return true;
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        if (!applied) {
            log.info("[ProfileUpdated] Skipping seq {} for profile {}, a later update is already applied, tx {}",
                    eventSeq, profileId, txDigest);
            return;
        }
        log.info("[ProfileUpdated] Updated profile {} for {} with topic {}, tx {}", profileId, name, topic, txDigest);
    }

    private void applyProfile(Creator creator, JsonNode json, String name, int topic) {
        creator.setName(name);
        String bio = EventFields.text(json, "bio");
        creator.setBio(bio != null ? bio : "");
        creator.setAvatarUrl(EventFields.optionalText(json, "avatar_url"));
        creator.setBackgroundUrl(EventFields.optionalText(json, "background_url"));
        creator.setTopic(topic);
    }

    // Out-of-range topics fall back to 0
    static int validTopic(JsonNode json) {
        int topic = EventFields.intValue(json, "topic", MIN_TOPIC);
        return topic >= MIN_TOPIC && topic <= MAX_TOPIC ? topic : MIN_TOPIC;
    }
}
