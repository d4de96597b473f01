package com.feerouter.distribution.engine;

import com.feerouter.common.FeeMath;
import com.feerouter.domain.PaidBitmap;
import com.feerouter.domain.Policy;
import com.feerouter.error.ErrorCodes;
import com.feerouter.error.SequenceViolationException;
import com.feerouter.error.WindowViolationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure crank algorithm. Maps (policy, progress, claimed fees, locked amounts) to payouts and the next progress.
 * Performs no I/O; callers read external systems between {@link #admit} and {@link #startDay} and persist the
 * returned {@link DayProgress} atomically with the transfers of the {@link PageOutcome}.
 */
public class DistributionEngine {

    private final int maxPageSize;

    public DistributionEngine(int maxPageSize) {
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be >= 1");
        }
        this.maxPageSize = maxPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    /**
     * Admission: page size within bounds and {@code pageStart == cursor}. Rejects replays, overlaps and skips alike,
     * including an exact resubmission of the page that just committed.
     *
     * @throws SequenceViolationException INVALID_PAGINATION or INVALID_PAGINATION_SEQUENCE
     */
    public void admit(Policy policy, DayProgress progress, int pageStart, int pageSize) {
        if (pageSize < 1 || pageSize > maxPageSize) {
            throw new SequenceViolationException(ErrorCodes.INVALID_PAGINATION,
                    "pageSize must be in [1, " + maxPageSize + "], was " + pageSize);
        }
        if (pageStart < 0 || pageStart >= policy.getTotalInvestors()) {
            throw new SequenceViolationException(ErrorCodes.INVALID_PAGINATION_SEQUENCE,
                    "pageStart " + pageStart + " outside investor set of " + policy.getTotalInvestors()
                            + "; expected cursor " + progress.cursor());
        }
        if (pageStart != progress.cursor()) {
            throw new SequenceViolationException(ErrorCodes.INVALID_PAGINATION_SEQUENCE,
                    "pageStart " + pageStart + " does not match cursor " + progress.cursor());
        }
    }

    /** True when the admitted page opens a new day (claim, guard and split must run first). */
    public boolean opensDay(DayProgress progress) {
        return progress.cursor() == 0;
    }

    /**
     * 24-hour gate, evaluated only when a page opens a day.
     *
     * @throws WindowViolationException DISTRIBUTION_WINDOW_NOT_ELAPSED
     */
    public void checkWindow(DayProgress progress, Instant now) {
        Instant eligibleAt = progress.lastDistributionTs().plusSeconds(FeeMath.SECONDS_PER_DAY);
        if (now.isBefore(eligibleAt)) {
            throw new WindowViolationException(ErrorCodes.DISTRIBUTION_WINDOW_NOT_ELAPSED,
                    "Next distribution allowed at " + eligibleAt + ", now " + now);
        }
    }

    /**
     * eligibleBps = min(shareBps, floor(min(1, locked / Y0) * 10000)); pool = floor(claimed * eligibleBps / 10000),
     * then capped by the daily cap when set.
     */
    public DaySplit computeSplit(Policy policy, long claimed, long totalLocked) {
        if (claimed < 0 || totalLocked < 0) {
            throw new IllegalArgumentException("claimed and totalLocked must not be negative");
        }
        int eligibleBps = FeeMath.eligibleShareBps(totalLocked, policy.getY0TotalAllocation(),
                policy.getInvestorFeeShareBps());
        long pool = FeeMath.applyBps(claimed, eligibleBps);
        if (policy.hasDailyCap()) {
            pool = Math.min(pool, policy.getDailyCapLamports());
        }
        return new DaySplit(claimed, totalLocked, eligibleBps, pool);
    }

    /**
     * Opens a day: fixes the split, resets the day totals and clears the bitmap. Lifetime totals carry over.
     */
    public DayProgress startDay(Policy policy, DayProgress progress, DaySplit split, Instant now) {
        return new DayProgress(
                progress.lastDistributionTs(),
                now,
                0,
                progress.paid().cleared(),
                false,
                split.totalClaimed(),
                split.totalLocked(),
                split.eligibleBps(),
                split.investorPool(),
                0L,
                progress.totalDistributions(),
                progress.totalInvestorDistributed(),
                progress.totalCreatorDistributed());
    }

    /**
     * Pays one page of investors against the split fixed at day start, advances the cursor and, when the cursor
     * reaches the end of the investor set, closes the day with the creator remainder.
     *
     * @param page entries for indices {@code pageStart .. pageStart + n - 1} in order, where
     *             {@code n = min(pageSize, totalInvestors - pageStart)}
     * @throws SequenceViolationException INVESTOR_SET_MISMATCH when the page does not cover exactly that range
     */
    public PageOutcome applyPage(Policy policy, DayProgress progress, int pageStart, int pageSize,
                                 List<InvestorShare> page, Instant now) {
        if (progress.dayCompleted()) {
            throw new IllegalStateException("Day must be started before applying a page");
        }
        int expected = expectedPageLength(policy, pageStart, pageSize);
        if (page.size() != expected) {
            throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                    "Page at " + pageStart + " must carry " + expected + " investors, got " + page.size());
        }

        PaidBitmap paid = progress.paid();
        long distributed = progress.distributed();
        long pageDistributed = 0L;
        long pageDust = 0L;
        int alreadyPaid = 0;
        List<InvestorPayout> payouts = new ArrayList<>();

        for (int offset = 0; offset < page.size(); offset++) {
            InvestorShare share = page.get(offset);
            int index = pageStart + offset;
            if (share.index() != index) {
                throw new SequenceViolationException(ErrorCodes.INVESTOR_SET_MISMATCH,
                        "Expected investor index " + index + " at page offset " + offset + ", got " + share.index());
            }
            if (paid.isPaid(index)) {
                alreadyPaid++;
                continue;
            }
            long amount = FeeMath.proRata(progress.investorPool(), share.locked(), progress.totalLocked());
            if (amount < policy.getMinPayoutLamports()) {
                pageDust += amount;
                continue;
            }
            amount = Math.min(amount, headroom(policy, progress, distributed));
            if (amount <= 0) {
                continue;
            }
            payouts.add(new InvestorPayout(index, share.investorId(), share.payoutAccount(), amount));
            paid = paid.markPaid(index);
            distributed = Math.addExact(distributed, amount);
            pageDistributed = Math.addExact(pageDistributed, amount);
        }

        int nextCursor = pageStart + pageSize;
        if (nextCursor < policy.getTotalInvestors()) {
            DayProgress next = progress.withPage(nextCursor, paid, distributed);
            return new PageOutcome(next, List.copyOf(payouts), pageDistributed, pageDust, alreadyPaid, false, 0L);
        }

        long remainder = progress.totalClaimed() - distributed;
        DayProgress closed = new DayProgress(
                now,
                progress.currentDayStartedTs(),
                0,
                paid.cleared(),
                true,
                progress.totalClaimed(),
                progress.totalLocked(),
                progress.eligibleBps(),
                progress.investorPool(),
                distributed,
                progress.totalDistributions() + 1,
                Math.addExact(progress.totalInvestorDistributed(), distributed),
                Math.addExact(progress.totalCreatorDistributed(), remainder));
        return new PageOutcome(closed, List.copyOf(payouts), pageDistributed, pageDust, alreadyPaid, true, remainder);
    }

    /** Number of investors a page starting at {@code pageStart} must carry. */
    public int expectedPageLength(Policy policy, int pageStart, int pageSize) {
        return Math.max(0, Math.min(pageSize, policy.getTotalInvestors() - pageStart));
    }

    /** What may still be paid today: bounded by the day's pool and, independently, by the daily cap. */
    private static long headroom(Policy policy, DayProgress progress, long distributed) {
        long left = progress.investorPool() - distributed;
        if (policy.hasDailyCap()) {
            left = Math.min(left, policy.getDailyCapLamports() - distributed);
        }
        return Math.max(0L, left);
    }
}
