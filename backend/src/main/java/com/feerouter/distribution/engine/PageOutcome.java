package com.feerouter.distribution.engine;

import java.util.List;

/**
 * Result of one page transition.
 *
 * @param next             progress to persist
 * @param payouts          investor transfers to execute, in index order
 * @param pageDistributed  sum of {@code payouts}
 * @param pageDust         computed payouts left untransferred because they fell below the minimum
 * @param alreadyPaid      entries skipped because their bit was already set
 * @param dayClosed        true when this page finalized the day
 * @param creatorRemainder amount owed to the creator; non-zero only when {@code dayClosed}
 */
public record PageOutcome(
        DayProgress next,
        List<InvestorPayout> payouts,
        long pageDistributed,
        long pageDust,
        int alreadyPaid,
        boolean dayClosed,
        long creatorRemainder
) {
}
