package com.botical.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table from request type to handler. An unregistered type completes
 * exceptionally with {@link UnsupportedOperationException}.
 */
@Slf4j
public class RequestRouter {

    @FunctionalInterface
    public interface RequestHandler {
        CompletableFuture<Object> handle(JsonNode payload, ConnectionDescriptor connection);
    }

    private final Map<String, RequestHandler> handlers = new ConcurrentHashMap<>();

    public void register(String type, RequestHandler handler) {
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new IllegalStateException("Request type already registered: " + type);
        }
        log.debug("Registered request handler: {}", type);
    }

    public CompletableFuture<Object> dispatch(String type, JsonNode payload, ConnectionDescriptor connection) {
        RequestHandler handler = handlers.get(type);
        if (handler == null) {
            return CompletableFuture.failedFuture(
                    new UnsupportedOperationException("Unknown request type: " + type));
        }
        try {
            return handler.handle(payload, connection);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
