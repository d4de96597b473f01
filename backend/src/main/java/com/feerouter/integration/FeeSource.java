package com.feerouter.integration;

/**
 * Claims fees accrued by a liquidity position. Each successful call drains what has accrued since the previous
 * call, so the distribution engine calls it at most once per day and never retries it.
 */
public interface FeeSource {

    /**
     * @param positionHandle  handle returned when the position was opened
     * @param designatedAsset asset the position is configured to collect; the other pool asset is reported as
     *                        {@link FeeClaim#otherAmount()}
     */
    FeeClaim claim(String positionHandle, String designatedAsset);
}
