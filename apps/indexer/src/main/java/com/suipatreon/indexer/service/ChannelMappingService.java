package com.suipatreon.indexer.service;

import com.suipatreon.indexer.entity.ChannelMapping;
import com.suipatreon.indexer.repository.ChannelMappingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Messaging channel per (user, creator) pair. One channel per pair; a new channel id replaces the old one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelMappingService {

    private final ChannelMappingRepository channelMappingRepository;

    @Transactional
    public ChannelMapping upsert(String channelId, String userAddress, String creatorAddress) {
        ChannelMapping mapping = channelMappingRepository
                .findByUserAddressAndCreatorAddress(userAddress, creatorAddress)
                .orElseGet(() -> {
                    ChannelMapping created = new ChannelMapping();
                    created.setUserAddress(userAddress);
                    created.setCreatorAddress(creatorAddress);
                    return created;
                });
        mapping.setChannelId(channelId);
        ChannelMapping saved = channelMappingRepository.save(mapping);
        log.info("Channel {} mapped to user {} and creator {}", channelId, userAddress, creatorAddress);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<ChannelMapping> find(String userAddress, String creatorAddress) {
        return channelMappingRepository.findByUserAddressAndCreatorAddress(userAddress, creatorAddress);
    }
}
