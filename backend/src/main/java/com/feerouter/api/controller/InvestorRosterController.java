package com.feerouter.api.controller;

import com.feerouter.api.dto.RegisterRosterRequest;
import com.feerouter.api.dto.RosterResponse;
import com.feerouter.distribution.service.InvestorRef;
import com.feerouter.distribution.service.InvestorRosterService;
import com.feerouter.domain.InvestorRoster;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * PUT /vaults/{vault}/investors: replaces the investor roster between distribution days.
 */
@RestController
@RequestMapping("/api/v1/vaults/{vault}/investors")
@RequiredArgsConstructor
public class InvestorRosterController {

    private final InvestorRosterService rosterService;

    @PutMapping
    public ResponseEntity<RosterResponse> register(@PathVariable String vault,
                                                   @Valid @RequestBody RegisterRosterRequest request) {
        List<InvestorRef> refs = request.investors().stream()
                .map(e -> new InvestorRef(e.investorId(), e.payoutAccount()))
                .toList();
        InvestorRoster roster = rosterService.register(vault, refs);
        return ResponseEntity.ok(new RosterResponse(roster.getVault(), roster.getEntries().size(), roster.getUpdatedAt()));
    }
}
