package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.Creator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CreatorRepository extends JpaRepository<Creator, UUID> {

    Optional<Creator> findByAddress(String address);

    Optional<Creator> findByProfileId(String profileId);
}
