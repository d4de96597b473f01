package com.feerouter.domain;

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
 * Investor set frozen by the page that opened the current day. Later pages of that day must name exactly these
 * investors at exactly these indices.
 */
@Document(collection = "day_investor_sets")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DayInvestorSet {

    @Id
    @EqualsAndHashCode.Include
    private String vault;
    private Instant dayStartedTs;
    private List<InvestorRoster.Entry> entries = new ArrayList<>();
}
