package com.feerouter.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/vaults/{vault}/position.
 *
 * @param designatedAsset the asset fees must be collected in (the pool's quote token)
 */
public record InitializePositionRequest(
        @NotBlank
        String pool,
        @NotBlank
        String designatedAsset,
        @NotBlank
        String otherAsset
) {
}
