package com.feerouter.distribution.event;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;

/**
 * A day opened: fees were claimed and the split fixed.
 */
@Getter
public class FeesClaimedEvent extends DistributionEvent {

    private final long amount;
    private final long totalLocked;
    private final int eligibleBps;
    private final long investorPool;

    public FeesClaimedEvent(Object source, String vault, Instant occurredAt, long amount, long totalLocked,
                            int eligibleBps, long investorPool) {
        super(source, vault, occurredAt);
        this.amount = amount;
        this.totalLocked = totalLocked;
        this.eligibleBps = eligibleBps;
        this.investorPool = investorPool;
    }

    @Override
    public String type() {
        return "FEES_CLAIMED";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("amount", amount, "totalLocked", totalLocked, "eligibleBps", eligibleBps,
                "investorPool", investorPool);
    }
}
