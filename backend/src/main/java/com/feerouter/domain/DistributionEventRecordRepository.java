package com.feerouter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DistributionEventRecordRepository extends MongoRepository<DistributionEventRecord, String> {

    List<DistributionEventRecord> findByVaultOrderByOccurredAtAsc(String vault);
}
