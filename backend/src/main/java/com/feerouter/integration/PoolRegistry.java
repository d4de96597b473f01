package com.feerouter.integration;

/**
 * Pool metadata and position bootstrap on the AMM.
 */
public interface PoolRegistry {

    PoolState describePool(String pool);

    /** Opens a fee-only position in {@code pool} owned by {@code owner}; returns the position handle. */
    String openPosition(String pool, String owner);
}
