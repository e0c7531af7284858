package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.ContentTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentTierRepository extends JpaRepository<ContentTier, UUID> {

    Optional<ContentTier> findByContentIdAndTierId(UUID contentId, UUID tierId);

    List<ContentTier> findByContentId(UUID contentId);
}
