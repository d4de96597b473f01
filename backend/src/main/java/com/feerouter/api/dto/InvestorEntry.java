package com.feerouter.api.dto;

import jakarta.validation.constraints.NotBlank;

public record InvestorEntry(
        @NotBlank
        String investorId,
        @NotBlank
        String payoutAccount
) {
}
