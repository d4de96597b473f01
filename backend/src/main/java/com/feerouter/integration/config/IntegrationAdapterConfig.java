package com.feerouter.integration.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.feerouter.common.RetryPolicy;
import com.feerouter.integration.FeeSource;
import com.feerouter.integration.PoolRegistry;
import com.feerouter.integration.VestingOracle;
import com.feerouter.integration.amm.AmmFeeSource;
import com.feerouter.integration.amm.AmmGatewayClient;
import com.feerouter.integration.amm.AmmPoolRegistry;
import com.feerouter.integration.rpc.JsonRpcClient;
import com.feerouter.integration.rpc.WebClientJsonRpcClient;
import com.feerouter.integration.vesting.VestingGatewayOracle;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires one concrete adapter per external system behind the capability interfaces the distribution code uses.
 */
@Configuration
@EnableConfigurationProperties(IntegrationProperties.class)
public class IntegrationAdapterConfig {

    @Bean
    @ConditionalOnMissingBean
    public JsonRpcClient jsonRpcClient(WebClient.Builder webClientBuilder, IntegrationProperties properties) {
        return new WebClientJsonRpcClient(webClientBuilder, Duration.ofMillis(properties.getTimeoutMs()));
    }

    @Bean
    public AmmGatewayClient ammGatewayClient(JsonRpcClient jsonRpcClient,
                                             IntegrationProperties properties,
                                             ObjectMapper objectMapper) {
        return new AmmGatewayClient(jsonRpcClient, properties.getAmm().getUrl(), objectMapper);
    }

    @Bean
    public FeeSource feeSource(AmmGatewayClient ammGatewayClient) {
        return new AmmFeeSource(ammGatewayClient);
    }

    @Bean
    public PoolRegistry poolRegistry(AmmGatewayClient ammGatewayClient) {
        return new AmmPoolRegistry(ammGatewayClient);
    }

    @Bean(name = "vestingRateLimiter")
    public RateLimiter vestingRateLimiter(IntegrationProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getVestingMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getVestingLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("vesting-gateway", config);
    }

    @Bean
    public VestingOracle vestingOracle(JsonRpcClient jsonRpcClient,
                                       IntegrationProperties properties,
                                       ObjectMapper objectMapper,
                                       RateLimiter vestingRateLimiter) {
        RetryPolicy retryPolicy = new RetryPolicy(
                properties.getRetryBaseDelayMs(),
                properties.getRetryJitterFactor(),
                properties.getRetryMaxAttempts());
        return new VestingGatewayOracle(jsonRpcClient, properties.getVesting().getUrl(), objectMapper,
                retryPolicy, vestingRateLimiter);
    }
}
