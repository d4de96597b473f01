package com.feerouter.distribution.service;

/**
 * Input of policy setup.
 *
 * @param dailyCapLamports null for no daily cap
 */
public record PolicyParams(
        String vault,
        String creatorWallet,
        int investorFeeShareBps,
        Long dailyCapLamports,
        long minPayoutLamports,
        long y0TotalAllocation,
        int totalInvestors
) {
}
