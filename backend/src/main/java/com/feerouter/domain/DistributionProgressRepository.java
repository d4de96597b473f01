package com.feerouter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface DistributionProgressRepository extends MongoRepository<DistributionProgress, String> {
}
