package com.feerouter.distribution.event;

import lombok.Getter;

import java.time.Instant;
import java.util.Map;

@Getter
public class InvestorPayoutPageEvent extends DistributionEvent {

    private final int pageStart;
    private final int pageSize;
    private final int investorsPaid;
    private final long totalPaid;
    private final long dust;

    public InvestorPayoutPageEvent(Object source, String vault, Instant occurredAt, int pageStart, int pageSize,
                                   int investorsPaid, long totalPaid, long dust) {
        super(source, vault, occurredAt);
        this.pageStart = pageStart;
        this.pageSize = pageSize;
        this.investorsPaid = investorsPaid;
        this.totalPaid = totalPaid;
        this.dust = dust;
    }

    @Override
    public String type() {
        return "INVESTOR_PAYOUT_PAGE";
    }

    @Override
    public Map<String, Object> attributes() {
        return Map.of("pageStart", pageStart, "pageSize", pageSize, "investorsPaid", investorsPaid,
                "totalPaid", totalPaid, "dust", dust);
    }
}
