package com.feerouter.distribution.event;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;

@Getter
public class CreatorPayoutDayClosedEvent extends DistributionEvent {

    private final long creatorAmount;
    private final long investorsDistributed;
    private final long totalClaimed;

    public CreatorPayoutDayClosedEvent(Object source, String vault, Instant occurredAt, long creatorAmount,
                                       long investorsDistributed, long totalClaimed) {
        super(source, vault, occurredAt);
        this.creatorAmount = creatorAmount;
        this.investorsDistributed = investorsDistributed;
        this.totalClaimed = totalClaimed;
    }

    @Override
    public String type() {
        return "DAY_CLOSED";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("creatorAmount", creatorAmount, "investorsDistributed", investorsDistributed,
                "totalClaimed", totalClaimed);
    }
}
