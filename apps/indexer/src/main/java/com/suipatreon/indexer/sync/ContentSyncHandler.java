package com.suipatreon.indexer.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.suipatreon.indexer.config.IndexerProperties;
import com.suipatreon.indexer.entity.Content;
import com.suipatreon.indexer.entity.ContentTier;
import com.suipatreon.indexer.entity.Creator;
import com.suipatreon.indexer.entity.Tier;
import com.suipatreon.indexer.repository.ContentRepository;
import com.suipatreon.indexer.repository.ContentTierRepository;
import com.suipatreon.indexer.repository.CreatorRepository;
import com.suipatreon.indexer.repository.TierRepository;
import com.suipatreon.indexer.sui.SuiEvent;
import com.suipatreon.indexer.util.DependencyNotFoundException;
import com.suipatreon.indexer.util.EventFields;
import com.suipatreon.indexer.util.RetryUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ContentCreated handler
 * Content references its creator and every tier that unlocks it
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentSyncHandler {

    private final ContentRepository contentRepository;
    private final ContentTierRepository contentTierRepository;
    private final CreatorRepository creatorRepository;
    private final TierRepository tierRepository;
    private final IndexerProperties properties;

    public void handleContentCreated(SuiEvent event, String txDigest, BigInteger eventSeq) throws Exception {
        JsonNode json = event.getParsedJson();
        String contentId = EventFields.requireText(json, "content_id");
        String creatorAddress = EventFields.requireText(json, "creator");
        String title = EventFields.requireText(json, "title");
        String sealedPatchId = EventFields.requireText(json, "sealed_patch_id");
        List<String> tierIds = EventFields.textList(json, "tier_ids");
        boolean isPublic = EventFields.bool(json, "is_public", tierIds.isEmpty());
        Instant publishedAt = EventFields.instant(json, "created_at");

        Content saved = RetryUtils.executeWithRetry(() -> {
            Creator creator = creatorRepository.findByAddress(creatorAddress)
                    .orElseThrow(() -> new DependencyNotFoundException(
                            "Creator not found for address " + creatorAddress));
            List<Tier> tiers = resolveTiers(tierIds);

            Content content = contentRepository.findByContentId(contentId).orElseGet(() -> {
                Content created = new Content();
                created.setContentId(contentId);
                return created;
            });
            content.setCreatorId(creator.getId());
            content.setTitle(title);
            String description = EventFields.text(json, "description");
            content.setDescription(description != null ? description : "");
            String contentType = EventFields.optionalText(json, "content_type");
            content.setContentType(contentType != null ? contentType : "application/octet-stream");
            String previewPatchId = EventFields.optionalText(json, "preview_patch_id");
            content.setPreviewPatchId(previewPatchId != null ? previewPatchId : sealedPatchId);
            content.setSealedPatchId(sealedPatchId);
            content.setIsPublic(isPublic);
            content.setPublishedAt(publishedAt);
            Content stored = contentRepository.save(content);

            for (Tier tier : tiers) {
                if (contentTierRepository.findByContentIdAndTierId(stored.getId(), tier.getId()).isEmpty()) {
                    ContentTier link = new ContentTier();
                    link.setContentId(stored.getId());
                    link.setTierId(tier.getId());
                    contentTierRepository.save(link);
                }
            }
            return stored;
        }, RetryUtils::isDependencyNotFound, properties.getRetry().toRetryConfig());

        log.info("[ContentCreated] Indexed content {} ({}) with {} tier(s), public={}, tx {}",
                title, saved.getContentId(), tierIds.size(), isPublic, txDigest);
    }

    private List<Tier> resolveTiers(List<String> tierIds) throws DependencyNotFoundException {
        if (tierIds.isEmpty()) {
            return List.of();
        }
        List<Tier> tiers = tierRepository.findByTierIdIn(tierIds);
        Set<String> found = tiers.stream().map(Tier::getTierId).collect(Collectors.toSet());
        List<String> missing = tierIds.stream().filter(id -> !found.contains(id)).collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new DependencyNotFoundException("Missing tiers: " + String.join(", ", missing));
        }
        return tiers;
    }
}
