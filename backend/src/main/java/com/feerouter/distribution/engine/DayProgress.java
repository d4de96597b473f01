package com.feerouter.distribution.engine;

import com.feerouter.domain.PaidBitmap;

import java.time.Instant;

/**
 * Immutable snapshot of a vault's distribution state, passed into and returned from {@link DistributionEngine}.
 * Persistence and mutual exclusion belong to the caller.
 *
 * @param lastDistributionTs    when the previous day closed; gates the next day start
 * @param currentDayStartedTs   when the current (or last) day's first page ran; null before the first day
 * @param cursor                next investor index to process; 0 when no day is in progress
 * @param paid                  investors paid in the current day
 * @param dayCompleted          true between days
 * @param totalClaimed          designated-asset fees claimed for the current day
 * @param totalLocked           locked amount across the whole investor set at day start
 * @param eligibleBps           investor share actually applied this day
 * @param investorPool          amount investors may receive this day, after the cap
 * @param distributed           paid to investors so far this day
 */
public record DayProgress(
        Instant lastDistributionTs,
        Instant currentDayStartedTs,
        int cursor,
        PaidBitmap paid,
        boolean dayCompleted,
        long totalClaimed,
        long totalLocked,
        int eligibleBps,
        long investorPool,
        long distributed,
        long totalDistributions,
        long totalInvestorDistributed,
        long totalCreatorDistributed
) {

    /** State right after policy setup: day complete, eligible as soon as {@code lastDistributionTs + 24h} passes. */
    public static DayProgress initial(int totalInvestors, Instant lastDistributionTs) {
        return new DayProgress(lastDistributionTs, null, 0, PaidBitmap.empty(totalInvestors), true,
                0L, 0L, 0, 0L, 0L, 0L, 0L, 0L);
    }

    DayProgress withPage(int nextCursor, PaidBitmap nextPaid, long nextDistributed) {
        return new DayProgress(lastDistributionTs, currentDayStartedTs, nextCursor, nextPaid, dayCompleted,
                totalClaimed, totalLocked, eligibleBps, investorPool, nextDistributed,
                totalDistributions, totalInvestorDistributed, totalCreatorDistributed);
    }
}
