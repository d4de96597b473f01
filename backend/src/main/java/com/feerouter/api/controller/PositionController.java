package com.feerouter.api.controller;

import com.feerouter.api.dto.InitializePositionRequest;
import com.feerouter.api.dto.PositionResponse;
import com.feerouter.distribution.position.PositionService;
import com.feerouter.distribution.service.DistributionQueryService;
import com.feerouter.domain.HonoraryPosition;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/vaults/{vault}/position")
@RequiredArgsConstructor
public class PositionController {

    private final PositionService positionService;
    private final DistributionQueryService queryService;

    @PostMapping
    public ResponseEntity<PositionResponse> initializePosition(@PathVariable String vault,
                                                               @Valid @RequestBody InitializePositionRequest request) {
        HonoraryPosition position = positionService.initializePosition(
                vault, request.pool().trim(), request.designatedAsset().trim(), request.otherAsset().trim());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(position));
    }

    @GetMapping
    public ResponseEntity<PositionResponse> getPosition(@PathVariable String vault) {
        return queryService.findPosition(vault)
                .map(p -> ResponseEntity.ok(toResponse(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    private static PositionResponse toResponse(HonoraryPosition p) {
        return new PositionResponse(p.getVault(), p.getPool(), p.getDesignatedAsset(), p.getOtherAsset(),
                p.getPositionHandle(), p.getTotalFeesClaimed(), p.getCreatedAt());
    }
}
