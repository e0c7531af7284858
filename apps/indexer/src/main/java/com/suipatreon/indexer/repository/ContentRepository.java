package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.Content;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContentRepository extends JpaRepository<Content, UUID> {

    Optional<Content> findByContentId(String contentId);
}
