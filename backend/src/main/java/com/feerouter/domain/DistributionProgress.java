package com.feerouter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-vault state of the current distribution day. Mutated by every committed crank page.
 * {@link #version} is the compare-and-swap guard: two pages racing on the same vault cannot both commit.
 */
@Document(collection = "distribution_progress")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DistributionProgress {

    @Id
    @EqualsAndHashCode.Include
    private String vault;
    @Version
    private Long version;

    /** Gate for the next day: a new day may start once now >= lastDistributionTs + 24h. */
    private Instant lastDistributionTs;
    private Instant currentDayStartedTs;
    /** Index of the next unprocessed investor; 0 when no day is in progress. */
    private int cursor;
    private byte[] paidBitmap;
    private boolean dayCompleted;

    private long currentDayTotalClaimed;
    private long currentDayTotalLocked;
    private int currentDayEligibleBps;
    private long currentDayInvestorPool;
    private long currentDayDistributed;

    private long totalDistributions;
    private long totalInvestorDistributed;
    private long totalCreatorDistributed;
}
