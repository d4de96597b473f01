package com.feerouter.api.controller;

import com.feerouter.api.dto.CrankRequest;
import com.feerouter.api.dto.CrankResponse;
import com.feerouter.distribution.service.CrankResult;
import com.feerouter.distribution.service.DistributionService;
import com.feerouter.distribution.service.InvestorRef;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /vaults/{vault}/crank: runs one distribution page. Open to any caller; ordering and idempotency are enforced
 * by the cursor and the paid bitmap, not by who calls.
 */
@RestController
@RequestMapping("/api/v1/vaults/{vault}/crank")
@RequiredArgsConstructor
public class CrankController {

    private final DistributionService distributionService;

    @PostMapping
    public ResponseEntity<CrankResponse> crank(@PathVariable String vault, @Valid @RequestBody CrankRequest request) {
        List<InvestorRef> investors = request.investors() == null ? null : request.investors().stream()
                .map(e -> new InvestorRef(e.investorId(), e.payoutAccount()))
                .toList();
        CrankResult r = distributionService.runPage(vault, request.pageStart(), request.pageSize(), investors);
        return ResponseEntity.ok(new CrankResponse(r.vault(), r.pageStart(), r.pageSize(), r.nextCursor(),
                r.dayOpened(), r.dayClosed(), r.investorsPaid(), r.pageDistributed(), r.pageDust(), r.alreadyPaid(),
                r.creatorPayout()));
    }
}
