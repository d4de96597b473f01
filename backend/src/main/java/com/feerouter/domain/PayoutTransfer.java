package com.feerouter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One transfer out of the vault treasury, written in the same transaction as the progress update that caused it.
 * The unique index on (vault, dayStartedTs, kind, investorIndex) backs the once-per-day payment guarantee in storage.
 */
@Document(collection = "payout_transfers")
@CompoundIndex(name = "vault_day_recipient", def = "{'vault': 1, 'dayStartedTs': 1, 'kind': 1, 'investorIndex': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PayoutTransfer {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String vault;
    /** Start of the distribution day this transfer belongs to. */
    private Instant dayStartedTs;
    private Kind kind;
    /** Investor index; -1 for the creator transfer. */
    private int investorIndex;
    private String recipient;
    private long amount;
    private Instant createdAt;

    public enum Kind {
        INVESTOR,
        CREATOR
    }
}
