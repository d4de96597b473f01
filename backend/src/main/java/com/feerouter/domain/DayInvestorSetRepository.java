package com.feerouter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface DayInvestorSetRepository extends MongoRepository<DayInvestorSet, String> {
}
