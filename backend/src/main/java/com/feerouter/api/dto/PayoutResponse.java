package com.feerouter.api.dto;

import java.time.Instant;

/**
 * @param investorIndex null for the creator transfer
 */
public record PayoutResponse(
        Instant dayStartedTs,
        String kind,
        Integer investorIndex,
        String recipient,
        long amount,
        Instant createdAt
) {
}
