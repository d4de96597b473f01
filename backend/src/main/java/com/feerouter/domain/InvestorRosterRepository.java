package com.feerouter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface InvestorRosterRepository extends MongoRepository<InvestorRoster, String> {
}
