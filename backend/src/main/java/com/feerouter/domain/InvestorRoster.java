package com.feerouter.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered investor set of a vault; list position is the investor index used by pagination and the paid bitmap.
 */
@Document(collection = "investor_rosters")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class InvestorRoster {

    @Id
    @EqualsAndHashCode.Include
    private String vault;
    private List<Entry> entries = new ArrayList<>();
    private Instant updatedAt;

    @NoArgsConstructor
    @AllArgsConstructor
    @Getter
    @Setter
    public static class Entry {
        /** Vesting stream id queried for the locked amount. */
        private String investorId;
        private String payoutAccount;
    }
}
