package com.feerouter.api.dto;

public record CrankResponse(
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
