package com.feerouter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Fee-only liquidity position owned by the vault. Created once after the quote-only guard passes;
 * only {@link #totalFeesClaimed} changes afterwards.
 */
@Document(collection = "honorary_positions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class HonoraryPosition {

    @Id
    @EqualsAndHashCode.Include
    private String vault;
    private String pool;
    /** The only asset fees may be collected in. */
    private String designatedAsset;
    private String otherAsset;
    /** Opaque handle returned by the AMM when the position was opened. */
    private String positionHandle;
    private Instant createdAt;
    private long totalFeesClaimed;
}
