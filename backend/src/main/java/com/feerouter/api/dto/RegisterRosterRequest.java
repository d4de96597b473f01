package com.feerouter.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * PUT /api/v1/vaults/{vault}/investors. List order is the investor index.
 */
public record RegisterRosterRequest(
        @NotEmpty
        List<@Valid InvestorEntry> investors
) {
}
