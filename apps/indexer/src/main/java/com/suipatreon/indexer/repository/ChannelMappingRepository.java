package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.ChannelMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ChannelMappingRepository extends JpaRepository<ChannelMapping, UUID> {

    Optional<ChannelMapping> findByUserAddressAndCreatorAddress(String userAddress, String creatorAddress);

    Optional<ChannelMapping> findByChannelId(String channelId);
}
