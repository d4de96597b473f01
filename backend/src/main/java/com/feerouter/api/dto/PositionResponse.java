package com.feerouter.api.dto;

import java.time.Instant;

public record PositionResponse(
        String vault,
        String pool,
        String designatedAsset,
        String otherAsset,
        String positionHandle,
        long totalFeesClaimed,
        Instant createdAt
) {
}
