package com.feerouter.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/vaults/{vault}/policy. Range checks live in policy setup so that they surface as
 * INVALID_POLICY_PARAMETERS; here only presence is validated.
 *
 * @param dailyCapLamports omit for no cap
 */
public record SetupPolicyRequest(
        @NotBlank
        String creatorWallet,
        @NotNull
        Integer investorFeeShareBps,
        Long dailyCapLamports,
        @NotNull
        Long minPayoutLamports,
        @NotNull
        Long y0TotalAllocation,
        @NotNull
        Integer totalInvestors
) {
}
