package com.feerouter.integration.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gateway endpoints and client limits for the external AMM and vesting systems.
 */
@ConfigurationProperties(prefix = "feerouter.integration")
@NoArgsConstructor
@Getter
@Setter
public class IntegrationProperties {

    private Gateway amm = new Gateway();
    private Gateway vesting = new Gateway();

    /** Request timeout in ms for every gateway call. */
    private long timeoutMs = 10_000;

    /** Backoff for vesting reads; claims are never retried. */
    private long retryBaseDelayMs = 500;
    private double retryJitterFactor = 0.2;
    private int retryMaxAttempts = 4;

    /** Vesting reads per second; day start reads one per investor. */
    private int vestingMaxRequestsPerSecond = 50;
    private long vestingLimiterTimeoutMs = 5_000;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Gateway {
        private String url;
    }
}
