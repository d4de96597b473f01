package com.feerouter.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface FeeClaimRecordRepository extends MongoRepository<FeeClaimRecord, String> {

    List<FeeClaimRecord> findByVaultAndStatusOrderByClaimedAtAsc(String vault, FeeClaimRecord.Status status);

    List<FeeClaimRecord> findByVaultOrderByClaimedAtDesc(String vault, Pageable pageable);
}
