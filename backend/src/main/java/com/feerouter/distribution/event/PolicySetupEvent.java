package com.feerouter.distribution.event;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;

@Getter
public class PolicySetupEvent extends DistributionEvent {

    private final String creatorWallet;
    private final int investorFeeShareBps;
    private final long y0TotalAllocation;
    private final int totalInvestors;

    public PolicySetupEvent(Object source, String vault, Instant occurredAt, String creatorWallet,
                            int investorFeeShareBps, long y0TotalAllocation, int totalInvestors) {
        super(source, vault, occurredAt);
        this.creatorWallet = creatorWallet;
        this.investorFeeShareBps = investorFeeShareBps;
        this.y0TotalAllocation = y0TotalAllocation;
        this.totalInvestors = totalInvestors;
    }

    @Override
    public String type() {
        return "POLICY_SETUP";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of(
                "creatorWallet", creatorWallet,
                "investorFeeShareBps", investorFeeShareBps,
                "y0TotalAllocation", y0TotalAllocation,
                "totalInvestors", totalInvestors);
    }
}
