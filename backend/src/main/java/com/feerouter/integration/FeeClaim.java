package com.feerouter.integration;

/**
 * Amounts drained by one claim, split by asset. A non-zero {@code otherAmount} means the position collected fees
 * outside its designated asset.
 */
public record FeeClaim(long designatedAmount, long otherAmount) {

    public FeeClaim {
        if (designatedAmount < 0 || otherAmount < 0) {
            throw new IllegalArgumentException("Claimed amounts must not be negative");
        }
    }
}
