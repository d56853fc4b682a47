package com.botical.gateway.websocket;

import com.botical.gateway.auth.ConnectionAuthenticator;
import com.botical.gateway.runtime.GatewaySettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Registers the client WebSocket endpoint with a handshake interceptor that
 * captures the credential and tenant from the query string.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ObjectMapper objectMapper;
    private final RequestRouter requestRouter;
    private final ConnectionAuthenticator authenticator;
    private final ConnectionRegistry connectionRegistry;
    private final RoomIndex roomIndex;
    private final GatewaySettings settings;

    public WebSocketConfig(ObjectMapper objectMapper, RequestRouter requestRouter,
            ConnectionAuthenticator authenticator, ConnectionRegistry connectionRegistry,
            RoomIndex roomIndex, GatewaySettings settings) {
        this.objectMapper = objectMapper;
        this.requestRouter = requestRouter;
        this.authenticator = authenticator;
        this.connectionRegistry = connectionRegistry;
        this.roomIndex = roomIndex;
        this.settings = settings;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(gatewayWebSocketHandler(), settings.getPath())
                .addInterceptors(connectionInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public GatewayWebSocketHandler gatewayWebSocketHandler() {
        return new GatewayWebSocketHandler(objectMapper, requestRouter, authenticator,
                connectionRegistry, roomIndex, settings);
    }

    /**
     * Copies {@code token} and {@code projectId} query parameters and the
     * remote address into the session attributes. Always lets the handshake
     * through; the handler closes unauthenticated connections itself.
     */
    @Bean
    public HandshakeInterceptor connectionInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                var query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
                String token = decode(query.getFirst("token"));
                String projectId = decode(query.getFirst("projectId"));
                if (token != null) {
                    attributes.put(GatewayWebSocketHandler.ATTR_TOKEN, token);
                }
                if (projectId != null) {
                    attributes.put(GatewayWebSocketHandler.ATTR_PROJECT_ID, projectId);
                }
                if (request.getRemoteAddress() != null && request.getRemoteAddress().getAddress() != null) {
                    attributes.put(GatewayWebSocketHandler.ATTR_REMOTE_ADDR,
                            request.getRemoteAddress().getAddress().getHostAddress());
                }
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // no-op
            }
        };
    }

    private static String decode(String raw) {
        return raw != null ? UriUtils.decode(raw, StandardCharsets.UTF_8) : null;
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024);
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        container.setMaxSessionIdleTimeout(300_000L);
        return container;
    }
}
