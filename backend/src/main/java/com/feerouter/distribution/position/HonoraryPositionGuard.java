package com.feerouter.distribution.position;

import com.feerouter.domain.CollectFeeMode;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.SafetyViolationException;
import com.feerouter.integration.FeeClaim;
import com.feerouter.integration.PoolState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Quote-only safety. A position may only be created in a pool that collects fees in a single asset, and that asset
 * must be the one the vault declared; every claim must carry nothing of the other asset.
 */
@Component
@Slf4j
public class HonoraryPositionGuard {

    /**
     * Validates the pool at position creation.
     *
     * @return the pool's fee asset (equal to {@code designatedAsset})
     * @throws SafetyViolationException INVALID_POOL_CONFIGURATION for a disabled pool or unknown fee mode;
     *                                  QUOTE_ONLY_VALIDATION_FAILED for two-sided fees or a mismatched asset pair
     */
    public String validatePool(PoolState pool, String designatedAsset, String otherAsset) {
        if (!pool.enabled()) {
            throw new SafetyViolationException(ErrorCodes.INVALID_POOL_CONFIGURATION,
                    "Pool " + pool.pool() + " is not enabled");
        }
        CollectFeeMode mode = pool.collectFeeMode();
        if (mode == null) {
            throw new SafetyViolationException(ErrorCodes.INVALID_POOL_CONFIGURATION,
                    "Pool " + pool.pool() + " reports an unknown fee collection mode");
        }
        if (mode == CollectFeeMode.BOTH_TOKENS) {
            throw new SafetyViolationException(ErrorCodes.QUOTE_ONLY_VALIDATION_FAILED,
                    "Pool " + pool.pool() + " collects fees in both tokens");
        }

        boolean samePair = (pool.tokenA().equals(designatedAsset) && pool.tokenB().equals(otherAsset))
                || (pool.tokenA().equals(otherAsset) && pool.tokenB().equals(designatedAsset));
        if (!samePair) {
            throw new SafetyViolationException(ErrorCodes.QUOTE_ONLY_VALIDATION_FAILED,
                    "Declared pair (" + designatedAsset + ", " + otherAsset + ") does not match pool "
                            + pool.pool() + " (" + pool.tokenA() + ", " + pool.tokenB() + ")");
        }
        String feeAsset = pool.tokenB();
        if (!feeAsset.equals(designatedAsset)) {
            throw new SafetyViolationException(ErrorCodes.QUOTE_ONLY_VALIDATION_FAILED,
                    "Pool " + pool.pool() + " collects fees in " + feeAsset + ", not " + designatedAsset);
        }
        return feeAsset;
    }

    /**
     * @throws SafetyViolationException BASE_FEES_DETECTED when the claim carries any amount of the other asset
     */
    public void checkClaim(String vault, FeeClaim claim) {
        if (claim.otherAmount() != 0) {
            log.error("Base fees detected for vault {}: other={}, designated={}",
                    vault, claim.otherAmount(), claim.designatedAmount());
            throw new SafetyViolationException(ErrorCodes.BASE_FEES_DETECTED,
                    "Claim for vault " + vault + " returned " + claim.otherAmount() + " of the non-designated asset");
        }
    }
}
