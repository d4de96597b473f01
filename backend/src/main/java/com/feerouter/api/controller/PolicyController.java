package com.feerouter.api.controller;

import com.feerouter.api.dto.PolicyResponse;
import com.feerouter.api.dto.SetupPolicyRequest;
import com.feerouter.distribution.service.DistributionQueryService;
import com.feerouter.distribution.service.PolicyParams;
import com.feerouter.distribution.service.PolicySetupService;
import com.feerouter.domain.Policy;
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

/**
 * POST /vaults/{vault}/policy (one-time setup), GET /vaults/{vault}/policy.
 */
@RestController
@RequestMapping("/api/v1/vaults/{vault}/policy")
@RequiredArgsConstructor
public class PolicyController {

    private final PolicySetupService policySetupService;
    private final DistributionQueryService queryService;

    @PostMapping
    public ResponseEntity<PolicyResponse> setupPolicy(@PathVariable String vault,
                                                      @Valid @RequestBody SetupPolicyRequest request) {
        Policy policy = policySetupService.setupPolicy(new PolicyParams(
                vault,
                request.creatorWallet(),
                request.investorFeeShareBps(),
                request.dailyCapLamports(),
                request.minPayoutLamports(),
                request.y0TotalAllocation(),
                request.totalInvestors()));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(policy));
    }

    @GetMapping
    public ResponseEntity<PolicyResponse> getPolicy(@PathVariable String vault) {
        return queryService.findPolicy(vault)
                .map(p -> ResponseEntity.ok(toResponse(p)))
                .orElse(ResponseEntity.notFound().build());
    }

    private static PolicyResponse toResponse(Policy p) {
        return new PolicyResponse(
                p.getVault(),
                p.getCreatorWallet(),
                p.getInvestorFeeShareBps(),
                p.getDailyCapLamports(),
                p.getMinPayoutLamports(),
                p.getY0TotalAllocation(),
                p.getTotalInvestors(),
                p.getCreatedAt());
    }
}
