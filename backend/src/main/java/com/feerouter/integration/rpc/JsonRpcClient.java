package com.feerouter.integration.rpc;

import reactor.core.publisher.Mono;

/**
 * JSON-RPC 2.0 transport used by the AMM and vesting gateway adapters. Returns the raw response body.
 */
public interface JsonRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
