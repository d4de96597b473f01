package com.feerouter.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface HonoraryPositionRepository extends MongoRepository<HonoraryPosition, String> {
}
