package com.feerouter.integration.amm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.feerouter.integration.rpc.JsonRpcClient;
import com.feerouter.integration.rpc.JsonRpcResponses;

/**
 * Single-endpoint JSON-RPC access to the AMM gateway. No retries here; callers decide.
 */
public class AmmGatewayClient {

    static final String GET_POOL = "getPool";
    static final String OPEN_POSITION = "openPosition";
    static final String CLAIM_POSITION_FEE = "claimPositionFee";

    private final JsonRpcClient rpcClient;
    private final String endpointUrl;
    private final ObjectMapper objectMapper;

    public AmmGatewayClient(JsonRpcClient rpcClient, String endpointUrl, ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.endpointUrl = endpointUrl;
        this.objectMapper = objectMapper;
    }

    JsonNode invoke(String method, Object params) {
        String body = rpcClient.call(endpointUrl, method, params).block();
        return JsonRpcResponses.result(objectMapper, method, body);
    }
}
