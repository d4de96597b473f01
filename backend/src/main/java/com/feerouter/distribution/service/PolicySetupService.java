package com.feerouter.distribution.service;

import com.feerouter.common.FeeMath;
import com.feerouter.distribution.engine.DayProgress;
import com.feerouter.distribution.event.PolicySetupEvent;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.DistributionProgressRepository;
import com.feerouter.domain.PaidBitmap;
import com.feerouter.domain.Policy;
import com.feerouter.domain.PolicyRepository;
import com.feerouter.error.ConfigurationException;
import com.feerouter.error.ErrorCodes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Creates a vault's policy and its initial progress in one transaction. Progress starts with the day complete and
 * {@code lastDistributionTs} one day in the past, so the first crank is eligible immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicySetupService {

    private final PolicyRepository policyRepository;
    private final DistributionProgressRepository progressRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    /**
     * @throws ConfigurationException INVALID_POLICY_PARAMETERS or POLICY_ALREADY_EXISTS; nothing is written
     */
    @Transactional
    public Policy setupPolicy(PolicyParams params) {
        validate(params);
        String vault = params.vault().trim();
        if (policyRepository.existsById(vault)) {
            throw new ConfigurationException(ErrorCodes.POLICY_ALREADY_EXISTS, "Policy already exists for vault " + vault);
        }

        Instant now = clock.instant();
        Policy policy = Policy.builder()
                .vault(vault)
                .creatorWallet(params.creatorWallet().trim())
                .investorFeeShareBps(params.investorFeeShareBps())
                .dailyCapLamports(params.dailyCapLamports())
                .minPayoutLamports(params.minPayoutLamports())
                .y0TotalAllocation(params.y0TotalAllocation())
                .totalInvestors(params.totalInvestors())
                .createdAt(now)
                .build();

        DistributionProgress progress = new DistributionProgress();
        progress.setVault(vault);
        ProgressMapper.apply(
                DayProgress.initial(policy.getTotalInvestors(), now.minusSeconds(FeeMath.SECONDS_PER_DAY)), progress);

        try {
            policyRepository.insert(policy);
            progressRepository.insert(progress);
        } catch (DuplicateKeyException e) {
            throw new ConfigurationException(ErrorCodes.POLICY_ALREADY_EXISTS, "Policy already exists for vault " + vault);
        }

        applicationEventPublisher.publishEvent(new PolicySetupEvent(this, vault, now, policy.getCreatorWallet(),
                policy.getInvestorFeeShareBps(), policy.getY0TotalAllocation(), policy.getTotalInvestors()));
        log.info("Policy set up for vault {}: shareBps={}, y0={}, investors={}, cap={}, minPayout={}",
                vault, policy.getInvestorFeeShareBps(), policy.getY0TotalAllocation(), policy.getTotalInvestors(),
                policy.getDailyCapLamports(), policy.getMinPayoutLamports());
        return policy;
    }

    private static void validate(PolicyParams p) {
        if (p.vault() == null || p.vault().isBlank()) {
            throw invalid("vault is required");
        }
        if (p.creatorWallet() == null || p.creatorWallet().isBlank()) {
            throw invalid("creatorWallet is required");
        }
        if (p.investorFeeShareBps() < 0 || p.investorFeeShareBps() > FeeMath.BPS_DENOMINATOR) {
            throw invalid("investorFeeShareBps must be in [0, " + FeeMath.BPS_DENOMINATOR + "], was "
                    + p.investorFeeShareBps());
        }
        if (p.y0TotalAllocation() <= 0) {
            throw invalid("y0TotalAllocation must be positive, was " + p.y0TotalAllocation());
        }
        if (p.totalInvestors() < 1 || p.totalInvestors() > PaidBitmap.MAX_CAPACITY) {
            throw invalid("totalInvestors must be in [1, " + PaidBitmap.MAX_CAPACITY + "], was " + p.totalInvestors());
        }
        if (p.minPayoutLamports() < 0) {
            throw invalid("minPayoutLamports must not be negative, was " + p.minPayoutLamports());
        }
        if (p.dailyCapLamports() != null && p.dailyCapLamports() < 0) {
            throw invalid("dailyCapLamports must not be negative, was " + p.dailyCapLamports());
        }
    }

    private static ConfigurationException invalid(String message) {
        return new ConfigurationException(ErrorCodes.INVALID_POLICY_PARAMETERS, message);
    }
}
