package com.feerouter.api.dto;

import java.time.Instant;

public record PolicyResponse(
        String vault,
        String creatorWallet,
        int investorFeeShareBps,
        Long dailyCapLamports,
        long minPayoutLamports,
        long y0TotalAllocation,
        int totalInvestors,
        Instant createdAt
) {
}
