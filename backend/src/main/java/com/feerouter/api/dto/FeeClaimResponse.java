package com.feerouter.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/vaults/{vault}/claims.
 *
 * @param status                 PENDING, RECONCILED or QUARANTINED
 * @param reconciledDayStartedTs day the amount was distributed in; null unless reconciled
 */
public record FeeClaimResponse(
        String id,
        String status,
        long designatedAmount,
        long otherAmount,
        Instant claimedAt,
        Instant reconciledDayStartedTs
) {
}
