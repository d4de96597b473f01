package com.feerouter.integration;

import java.time.Instant;

/**
 * Read-only view of the external vesting system.
 */
public interface VestingOracle {

    /** Portion of the investor's allocation still locked at {@code at}. */
    long lockedAmount(String investorId, Instant at);
}
