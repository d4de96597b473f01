package com.feerouter.integration.rpc;

import com.feerouter.error.IntegrationException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * JSON-RPC 2.0 over HTTP POST using WebClient.
 */
public class WebClientJsonRpcClient implements JsonRpcClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientJsonRpcClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : List.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class,
                        e -> new IntegrationException(method + " failed with HTTP " + e.getStatusCode().value(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new IntegrationException(method + " request failed: " + e.getMessage(), e));
    }
}
