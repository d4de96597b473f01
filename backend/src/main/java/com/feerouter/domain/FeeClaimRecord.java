package com.feerouter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One fee claim against the honorary position, written as soon as the AMM has drained the fees and independently of
 * the page that asked for them. A PENDING claim is folded into the next day that opens; the page transaction that
 * folds it flips it to RECONCILED.
 */
@Document(collection = "fee_claims")
@CompoundIndex(name = "vault_status_claimed", def = "{'vault': 1, 'status': 1, 'claimedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class FeeClaimRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Version
    private Long version;
    private String vault;
    private String positionHandle;
    private long designatedAmount;
    /** Non-zero only for quarantined claims. */
    private long otherAmount;
    private Status status;
    private Instant claimedAt;
    /** Day the amount was distributed in; null until reconciled. */
    private Instant reconciledDayStartedTs;

    public enum Status {
        PENDING,
        RECONCILED,
        /** Carried fees outside the designated asset; held back from distribution. */
        QUARANTINED
    }
}
