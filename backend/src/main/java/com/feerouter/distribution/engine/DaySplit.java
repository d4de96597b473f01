package com.feerouter.distribution.engine;

/**
 * Fee split fixed at the start of a day.
 */
public record DaySplit(long totalClaimed, long totalLocked, int eligibleBps, long investorPool) {
}
