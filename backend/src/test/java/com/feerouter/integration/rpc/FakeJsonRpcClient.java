package com.feerouter.integration.rpc;

import com.feerouter.error.IntegrationException;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory JSON-RPC transport: canned bodies per method, served in order (the last one repeats).
 * A {@code null} body simulates a transport failure.
 */
public class FakeJsonRpcClient implements JsonRpcClient {

    public record Call(String endpointUrl, String method, Object params) {
    }

    private final Map<String, Deque<String>> responses = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();

    public FakeJsonRpcClient respond(String method, String... bodies) {
        Deque<String> queue = responses.computeIfAbsent(method, m -> new ArrayDeque<>());
        for (String body : bodies) {
            queue.add(body == null ? "" : body);
        }
        return this;
    }

    @Override
    public synchronized Mono<String> call(String endpointUrl, String method, Object params) {
        calls.add(new Call(endpointUrl, method, params));
        Deque<String> queue = responses.get(method);
        if (queue == null || queue.isEmpty()) {
            return Mono.error(new IntegrationException("No canned response for " + method));
        }
        String body = queue.size() > 1 ? queue.poll() : queue.peek();
        if (body.isEmpty()) {
            return Mono.error(new IntegrationException(method + " request failed: connection refused"));
        }
        return Mono.just(body);
    }

    public List<Call> calls() {
        return calls;
    }

    public long callCount(String method) {
        return calls.stream().filter(c -> c.method().equals(method)).count();
    }
}
