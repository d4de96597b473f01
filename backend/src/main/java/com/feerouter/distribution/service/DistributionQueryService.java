package com.feerouter.distribution.service;

import com.feerouter.config.CaffeineConfig;
import com.feerouter.domain.DistributionEventRecord;
import com.feerouter.domain.DistributionEventRecordRepository;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.FeeClaimRecord;
import com.feerouter.domain.FeeClaimRecordRepository;
import com.feerouter.domain.HonoraryPosition;
import com.feerouter.domain.HonoraryPositionRepository;
import com.feerouter.domain.PayoutTransfer;
import com.feerouter.domain.PayoutTransferRepository;
import com.feerouter.domain.Policy;
import com.feerouter.domain.PolicyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side: policy (cached), position, progress, payout ledger, fee-claim ledger and audit log.
 */
@Service
@RequiredArgsConstructor
public class DistributionQueryService {

    public static final int DEFAULT_PAYOUT_LIMIT = 50;
    public static final int MAX_PAYOUT_LIMIT = 500;

    private final PolicyRepository policyRepository;
    private final HonoraryPositionRepository positionRepository;
    private final DistributionProgressRepository progressRepository;
    private final PayoutTransferRepository payoutTransferRepository;
    private final DistributionEventRecordRepository eventRecordRepository;
    private final FeeClaimRecordRepository claimRecordRepository;

    /** Policies are immutable, so a hit never goes stale; misses are not cached. */
    @Cacheable(value = CaffeineConfig.POLICY_CACHE, unless = "#result == null")
    public Optional<Policy> findPolicy(String vault) {
        return policyRepository.findById(vault);
    }

    public Optional<HonoraryPosition> findPosition(String vault) {
        return positionRepository.findById(vault);
    }

    public Optional<DistributionProgress> findProgress(String vault) {
        return progressRepository.findById(vault);
    }

    /** Most recent transfers first; {@code limit} is clamped to [1, MAX_PAYOUT_LIMIT]. */
    public List<PayoutTransfer> recentPayouts(String vault, Integer limit) {
        int size = limit == null ? DEFAULT_PAYOUT_LIMIT : Math.max(1, Math.min(limit, MAX_PAYOUT_LIMIT));
        return payoutTransferRepository.findByVaultOrderByCreatedAtDesc(vault, PageRequest.of(0, size));
    }

    /** Most recent claims first, including pending and quarantined ones; same limit rules as payouts. */
    public List<FeeClaimRecord> recentClaims(String vault, Integer limit) {
        int size = limit == null ? DEFAULT_PAYOUT_LIMIT : Math.max(1, Math.min(limit, MAX_PAYOUT_LIMIT));
        return claimRecordRepository.findByVaultOrderByClaimedAtDesc(vault, PageRequest.of(0, size));
    }

    public List<DistributionEventRecord> events(String vault) {
        return eventRecordRepository.findByVaultOrderByOccurredAtAsc(vault);
    }
}
