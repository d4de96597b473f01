package com.feerouter.integration.amm;

import com.fasterxml.jackson.databind.JsonNode;
import com.feerouter.domain.CollectFeeMode;
import com.feerouter.integration.PoolRegistry;
import com.feerouter.integration.PoolState;
import com.feerouter.integration.rpc.JsonRpcResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@code getPool} and {@code openPosition} on the AMM gateway. Pool status 0 means enabled.
 */
@RequiredArgsConstructor
@Slf4j
public class AmmPoolRegistry implements PoolRegistry {

    private final AmmGatewayClient client;

    @Override
    public PoolState describePool(String pool) {
        JsonNode result = client.invoke(AmmGatewayClient.GET_POOL, List.of(pool));
        int modeWire = result.path("collectFeeMode").asInt(-1);
        CollectFeeMode mode = CollectFeeMode.fromWire(modeWire);
        if (mode == null) {
            log.warn("Pool {} reported unknown collectFeeMode {}", pool, modeWire);
        }
        return new PoolState(
                pool,
                JsonRpcResponses.text(result, "tokenAMint", AmmGatewayClient.GET_POOL),
                JsonRpcResponses.text(result, "tokenBMint", AmmGatewayClient.GET_POOL),
                mode,
                result.path("poolStatus").asInt(-1) == 0);
    }

    @Override
    public String openPosition(String pool, String owner) {
        JsonNode result = client.invoke(AmmGatewayClient.OPEN_POSITION, List.of(pool, owner));
        return JsonRpcResponses.text(result, "position", AmmGatewayClient.OPEN_POSITION);
    }
}
