package com.feerouter.distribution.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Scheduled crank keeper. Disabled by default; any caller may crank through the API instead.
 */
@ConfigurationProperties(prefix = "feerouter.keeper")
@NoArgsConstructor
@Getter
@Setter
public class KeeperProperties {

    private boolean enabled = false;

    /** How often (ms) the keeper sweeps all vaults with a registered roster. */
    private long intervalMs = 300_000;

    /** Investors per crank page; clamped to feerouter.distribution.max-page-size. */
    private int pageSize = 50;

    /** Backoff between a rejected page and the re-read of the cursor. */
    private long retryBaseDelayMs = 1_000;
    private double retryJitterFactor = 0.2;
    private int retryMaxAttempts = 3;
}
