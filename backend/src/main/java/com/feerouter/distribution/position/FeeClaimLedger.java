package com.feerouter.distribution.position;

import com.feerouter.common.FeeMath;
import com.feerouter.domain.FeeClaimRecord;
import com.feerouter.domain.FeeClaimRecordRepository;
import com.feerouter.error.ConcurrentCrankException;
import com.feerouter.integration.FeeClaim;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Durable record of every amount drained from the honorary position. A claim is written in its own transaction, so
 * it survives the rollback of the page that made it; whichever day opens next takes all pending claims.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeClaimLedger {

    private final FeeClaimRecordRepository claimRecordRepository;
    private final Clock clock;

    /**
     * Records a claim that already happened. Claims carrying fees outside the designated asset are quarantined and
     * never folded into a day.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public FeeClaimRecord record(String vault, String positionHandle, FeeClaim claim) {
        FeeClaimRecord record = new FeeClaimRecord();
        record.setVault(vault);
        record.setPositionHandle(positionHandle);
        record.setDesignatedAmount(claim.designatedAmount());
        record.setOtherAmount(claim.otherAmount());
        record.setStatus(claim.otherAmount() != 0 ? FeeClaimRecord.Status.QUARANTINED : FeeClaimRecord.Status.PENDING);
        record.setClaimedAt(clock.instant());
        FeeClaimRecord saved = claimRecordRepository.insert(record);
        if (saved.getStatus() == FeeClaimRecord.Status.QUARANTINED) {
            log.error("Quarantined claim {} for vault {}: designated={}, other={}",
                    saved.getId(), vault, claim.designatedAmount(), claim.otherAmount());
        } else {
            log.debug("Recorded claim {} for vault {}: {}", saved.getId(), vault, claim.designatedAmount());
        }
        return saved;
    }

    public List<FeeClaimRecord> unreconciled(String vault) {
        return claimRecordRepository.findByVaultAndStatusOrderByClaimedAtAsc(vault, FeeClaimRecord.Status.PENDING);
    }

    /**
     * Marks pending claims as distributed in the day started at {@code dayStartedTs}. Runs inside the page
     * transaction, so a rolled-back page leaves them pending.
     *
     * @return total designated amount of the reconciled claims
     * @throws ConcurrentCrankException another page reconciled one of them first
     */
    public long reconcile(List<FeeClaimRecord> pending, Instant dayStartedTs) {
        if (pending.isEmpty()) {
            return 0L;
        }
        long total = FeeMath.sum(pending.stream().map(FeeClaimRecord::getDesignatedAmount).toList());
        for (FeeClaimRecord record : pending) {
            record.setStatus(FeeClaimRecord.Status.RECONCILED);
            record.setReconciledDayStartedTs(dayStartedTs);
        }
        try {
            claimRecordRepository.saveAll(pending);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrentCrankException("Pending fee claims were reconciled concurrently", e);
        }
        return total;
    }
}
