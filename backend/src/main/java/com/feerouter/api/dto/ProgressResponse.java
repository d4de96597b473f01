package com.feerouter.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/vaults/{vault}/progress.
 *
 * @param nextDistributionAt earliest time a new day may start; null while a day is in progress
 * @param paidInCurrentDay   investors with their bit set in the current day
 */
public record ProgressResponse(
        String vault,
        int cursor,
        boolean dayCompleted,
        Instant lastDistributionTs,
        Instant currentDayStartedTs,
        Instant nextDistributionAt,
        int paidInCurrentDay,
        long currentDayTotalClaimed,
        long currentDayTotalLocked,
        int currentDayEligibleBps,
        long currentDayInvestorPool,
        long currentDayDistributed,
        long totalDistributions,
        long totalInvestorDistributed,
        long totalCreatorDistributed
) {
}
