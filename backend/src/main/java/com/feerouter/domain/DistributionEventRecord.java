package com.feerouter.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit trail of committed distribution events (setup, position, claim, page, day close).
 */
@Document(collection = "distribution_events")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class DistributionEventRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String vault;
    private String type;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private Instant occurredAt;
}
