package com.feerouter.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Distribution policy for one vault. Written once by policy setup and never updated; keyed by vault id.
 */
@Document(collection = "policies")
@AllArgsConstructor
@Builder
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Policy {

    @Id
    @EqualsAndHashCode.Include
    private final String vault;
    /** Receives the non-investor remainder when a day closes. */
    private final String creatorWallet;
    /** Upper bound on the investors' share of claimed fees, in [0, 10000]. */
    private final int investorFeeShareBps;
    /** Ceiling on investor payouts per day; null = unbounded. */
    private final Long dailyCapLamports;
    /** Payouts below this are dust and stay with the creator. */
    private final long minPayoutLamports;
    /** Y0: original total allocation across all investors. */
    private final long y0TotalAllocation;
    private final int totalInvestors;
    private final Instant createdAt;

    public boolean hasDailyCap() {
        return dailyCapLamports != null;
    }
}
