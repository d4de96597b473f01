package com.feerouter.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * POST /api/v1/vaults/{vault}/crank. The first page of a day carries the whole investor set; later pages carry
 * exactly their own slice. Omit {@code investors} to use the registered roster.
 */
public record CrankRequest(
        @NotNull
        Integer pageStart,
        @NotNull
        Integer pageSize,
        List<@Valid InvestorEntry> investors
) {
}
