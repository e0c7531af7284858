package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.Tier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TierRepository extends JpaRepository<Tier, UUID> {

    Optional<Tier> findByTierId(String tierId);

    List<Tier> findByTierIdIn(List<String> tierIds);

    List<Tier> findByCreatorIdAndIsActiveTrue(UUID creatorId);
}
