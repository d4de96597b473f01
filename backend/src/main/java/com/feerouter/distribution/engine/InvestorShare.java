package com.feerouter.distribution.engine;

/**
 * One investor on a page, with the locked amount read from the vesting oracle at day start time.
 */
public record InvestorShare(int index, String investorId, String payoutAccount, long locked) {

    public InvestorShare {
        if (locked < 0) {
            throw new IllegalArgumentException("Locked amount must not be negative: " + investorId);
        }
    }
}
