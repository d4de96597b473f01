package com.feerouter.integration;

import com.feerouter.domain.CollectFeeMode;

/**
 * Pool configuration relevant to fee collection.
 *
 * @param collectFeeMode null when the AMM reported a mode this service does not know
 */
public record PoolState(String pool, String tokenA, String tokenB, CollectFeeMode collectFeeMode, boolean enabled) {
}
