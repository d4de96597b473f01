package com.feerouter.integration.vesting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feerouter.common.RetryPolicy;
import com.feerouter.error.IntegrationException;
import com.feerouter.integration.VestingOracle;
import com.feerouter.integration.rpc.JsonRpcClient;
import com.feerouter.integration.rpc.JsonRpcResponses;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Vesting gateway adapter: {@code getLockedAmount(investorId, unixSeconds)}.
 * Reads are idempotent, so failures are retried with backoff; a rate limiter spreads the day-start burst
 * (one read per investor) over time.
 */
@Slf4j
public class VestingGatewayOracle implements VestingOracle {

    static final String GET_LOCKED_AMOUNT = "getLockedAmount";

    private final JsonRpcClient rpcClient;
    private final String endpointUrl;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;

    public VestingGatewayOracle(JsonRpcClient rpcClient,
                                String endpointUrl,
                                ObjectMapper objectMapper,
                                RetryPolicy retryPolicy,
                                RateLimiter rateLimiter) {
        this.rpcClient = rpcClient;
        this.endpointUrl = endpointUrl;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public long lockedAmount(String investorId, Instant at) {
        IntegrationException last = null;
        for (int attempt = 0; retryPolicy.hasAttemptsLeft(attempt); attempt++) {
            if (attempt > 0 && !retryPolicy.pause(attempt - 1)) {
                throw new IntegrationException("Interrupted while reading locked amount for " + investorId);
            }
            try {
                return RateLimiter.decorateSupplier(rateLimiter, () -> fetch(investorId, at)).get();
            } catch (IntegrationException e) {
                last = e;
                log.debug("Locked amount read for {} failed (attempt {}): {}", investorId, attempt + 1, e.getMessage());
            } catch (RequestNotPermitted e) {
                last = new IntegrationException("Vesting gateway rate limit exhausted", e);
            }
        }
        throw new IntegrationException("Locked amount read for " + investorId + " failed after "
                + retryPolicy.getMaxAttempts() + " attempts", last);
    }

    private long fetch(String investorId, Instant at) {
        String body = rpcClient.call(endpointUrl, GET_LOCKED_AMOUNT, List.of(investorId, at.getEpochSecond())).block();
        JsonNode result = JsonRpcResponses.result(objectMapper, GET_LOCKED_AMOUNT, body);
        return JsonRpcResponses.amount(result, "locked", GET_LOCKED_AMOUNT);
    }
}
