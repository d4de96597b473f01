package com.feerouter.api.controller;

import com.feerouter.api.dto.DistributionEventResponse;
import com.feerouter.api.dto.FeeClaimResponse;
import com.feerouter.api.dto.PayoutResponse;
import com.feerouter.api.dto.ProgressResponse;
import com.feerouter.common.FeeMath;
import com.feerouter.distribution.service.DistributionQueryService;
import com.feerouter.domain.DistributionProgress;
import com.feerouter.domain.FeeClaimRecord;
import com.feerouter.domain.PaidBitmap;
import com.feerouter.domain.PayoutTransfer;
import com.feerouter.domain.Policy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views: GET /progress, GET /payouts, GET /claims, GET /events.
 */
@RestController
@RequestMapping("/api/v1/vaults/{vault}")
@RequiredArgsConstructor
public class DistributionStateController {

    private final DistributionQueryService queryService;

    @GetMapping("/progress")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String vault) {
        Optional<Policy> policy = queryService.findPolicy(vault);
        Optional<DistributionProgress> progress = queryService.findProgress(vault);
        if (policy.isEmpty() || progress.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toResponse(policy.get(), progress.get()));
    }

    @GetMapping("/payouts")
    public ResponseEntity<List<PayoutResponse>> getPayouts(@PathVariable String vault,
                                                           @RequestParam(required = false) Integer limit) {
        List<PayoutResponse> items = queryService.recentPayouts(vault, limit).stream()
                .map(DistributionStateController::toResponse)
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/claims")
    public ResponseEntity<List<FeeClaimResponse>> getClaims(@PathVariable String vault,
                                                            @RequestParam(required = false) Integer limit) {
        List<FeeClaimResponse> items = queryService.recentClaims(vault, limit).stream()
                .map(DistributionStateController::toResponse)
                .toList();
        return ResponseEntity.ok(items);
    }

    @GetMapping("/events")
    public ResponseEntity<List<DistributionEventResponse>> getEvents(@PathVariable String vault) {
        List<DistributionEventResponse> items = queryService.events(vault).stream()
                .map(e -> new DistributionEventResponse(e.getType(), e.getAttributes(), e.getOccurredAt()))
                .toList();
        return ResponseEntity.ok(items);
    }

    private static ProgressResponse toResponse(Policy policy, DistributionProgress p) {
        PaidBitmap paid = PaidBitmap.fromBytes(policy.getTotalInvestors(), p.getPaidBitmap());
        return new ProgressResponse(
                p.getVault(),
                p.getCursor(),
                p.isDayCompleted(),
                p.getLastDistributionTs(),
                p.getCurrentDayStartedTs(),
                p.isDayCompleted() && p.getLastDistributionTs() != null
                        ? p.getLastDistributionTs().plusSeconds(FeeMath.SECONDS_PER_DAY)
                        : null,
                paid.paidCount(),
                p.getCurrentDayTotalClaimed(),
                p.getCurrentDayTotalLocked(),
                p.getCurrentDayEligibleBps(),
                p.getCurrentDayInvestorPool(),
                p.getCurrentDayDistributed(),
                p.getTotalDistributions(),
                p.getTotalInvestorDistributed(),
                p.getTotalCreatorDistributed());
    }

    private static PayoutResponse toResponse(PayoutTransfer t) {
        return new PayoutResponse(
                t.getDayStartedTs(),
                t.getKind() != null ? t.getKind().name() : null,
                t.getKind() == PayoutTransfer.Kind.INVESTOR ? t.getInvestorIndex() : null,
                t.getRecipient(),
                t.getAmount(),
                t.getCreatedAt());
    }

    private static FeeClaimResponse toResponse(FeeClaimRecord c) {
        return new FeeClaimResponse(
                c.getId(),
                c.getStatus() != null ? c.getStatus().name() : null,
                c.getDesignatedAmount(),
                c.getOtherAmount(),
                c.getClaimedAt(),
                c.getReconciledDayStartedTs());
    }
}
