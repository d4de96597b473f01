package com.feerouter.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface PayoutTransferRepository extends MongoRepository<PayoutTransfer, String> {

    List<PayoutTransfer> findByVaultOrderByCreatedAtDesc(String vault, Pageable pageable);

    List<PayoutTransfer> findByVaultAndDayStartedTs(String vault, Instant dayStartedTs);
}
