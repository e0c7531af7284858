package com.suipatreon.indexer.repository;

import com.suipatreon.indexer.entity.SyncError;
import com.suipatreon.indexer.sync.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

@Repository
public interface SyncErrorRepository extends JpaRepository<SyncError, Long> {

    Optional<SyncError> findByEventTypeAndTxDigestAndEventSeq(EventType eventType, String txDigest, BigInteger eventSeq);

    List<SyncError> findByResolvedFalseAndRetryCountLessThanOrderByIdAsc(int maxRetryCount);
}
