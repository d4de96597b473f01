package com.feerouter.distribution.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Crank limits.
 */
@ConfigurationProperties(prefix = "feerouter.distribution")
@NoArgsConstructor
@Getter
@Setter
public class DistributionProperties {

    /** Largest page a single crank may carry. */
    private int maxPageSize = 50;
}
