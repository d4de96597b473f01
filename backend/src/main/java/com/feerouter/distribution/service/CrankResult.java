package com.feerouter.distribution.service;

/**
 * Outcome of one committed crank page.
 *
 * @param nextCursor     cursor after this page; 0 when the day closed
 * @param creatorPayout  remainder transferred to the creator; 0 unless {@code dayClosed}
 */
public record CrankResult(
        String vault,
        int pageStart,
        int pageSize,
        int nextCursor,
        boolean dayOpened,
        boolean dayClosed,
        int investorsPaid,
        long pageDistributed,
        long pageDust,
        int alreadyPaid,
        long creatorPayout
) {
}
