package com.botical.gateway.websocket;

import com.botical.common.errors.BoticalException;
import com.botical.common.errors.ValidationException;
import com.botical.gateway.auth.ConnectionAuthenticator;
import com.botical.gateway.auth.ConnectionAuthenticator.AuthResult;
import com.botical.gateway.protocol.ProtocolTypes.ErrorCodes;
import com.botical.gateway.protocol.ProtocolTypes.ErrorShape;
import com.botical.gateway.protocol.ProtocolTypes.EventFrame;
import com.botical.gateway.protocol.ProtocolTypes.EventTypes;
import com.botical.gateway.protocol.ProtocolTypes.RequestFrame;
import com.botical.gateway.protocol.ProtocolTypes.ResponseFrame;
import com.botical.gateway.runtime.GatewaySettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Client WebSocket endpoint.
 *
 * <p>
 * Authentication happens on open from the handshake attributes; a rejected
 * connection is closed with a 4xxx code before it is registered. After that
 * every text frame is a request {@code {id, type, payload?}} answered with
 * exactly one response frame. Request errors are reported in the response and
 * never close the connection.
 */
@Slf4j
public class GatewayWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_TOKEN = "auth.token";
    static final String ATTR_PROJECT_ID = "connect.projectId";
    static final String ATTR_REMOTE_ADDR = "auth.remoteAddr";

    private static final String UNKNOWN_REQUEST_ID = "unknown";

    private final ObjectMapper objectMapper;
    private final RequestRouter router;
    private final ConnectionAuthenticator authenticator;
    private final ConnectionRegistry connections;
    private final RoomIndex roomIndex;
    private final GatewaySettings settings;

    public GatewayWebSocketHandler(ObjectMapper objectMapper, RequestRouter router,
            ConnectionAuthenticator authenticator, ConnectionRegistry connections,
            RoomIndex roomIndex, GatewaySettings settings) {
        this.objectMapper = objectMapper;
        this.router = router;
        this.authenticator = authenticator;
        this.connections = connections;
        this.roomIndex = roomIndex;
        this.settings = settings;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connId = session.getId();
        Map<String, Object> attrs = session.getAttributes();
        String remoteAddr = (String) attrs.get(ATTR_REMOTE_ADDR);

        WebSocketChannel channel = new WebSocketChannel(session,
                settings.getSendTimeLimitMs(), settings.getSendBufferLimit());
        AuthResult auth = authenticator.authenticate(
                (String) attrs.get(ATTR_TOKEN), (String) attrs.get(ATTR_PROJECT_ID));
        if (!auth.ok()) {
            log.warn("ws:unauthorized conn={} remote={} code={} reason={}",
                    connId, remoteAddr, auth.closeCode(), auth.reason());
            channel.close(auth.closeCode(), auth.reason());
            return;
        }

        connections.add(connId, new ConnectionDescriptor(connId, auth.userId(), auth.projectId(), channel));
        if (!GatewaySettings.GLOBAL_PROJECT.equals(auth.projectId())) {
            roomIndex.join(Rooms.project(auth.projectId()), connId);
        }

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("connectionId", connId);
        welcome.put("projectId", auth.projectId());
        welcome.put("userId", auth.userId());
        if (auth.singleUser()) {
            welcome.put("singleUserMode", true);
        }
        sendFrame(connId, EventFrame.of(EventTypes.CONNECTED, welcome));

        log.info("ws:in:open conn={} user={} project={} remote={}",
                connId, auth.userId(), auth.projectId(), remoteAddr);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String connId = session.getId();
        ConnectionDescriptor connection = connections.get(connId).orElse(null);
        if (connection == null) {
            return;
        }
        connections.touch(connId);

        RequestFrame request;
        try {
            request = objectMapper.readValue(message.getPayload(), RequestFrame.class);
        } catch (JsonProcessingException e) {
            log.warn("ws:parse-error conn={}: {}", connId, e.getOriginalMessage());
            sendFrame(connId, ResponseFrame.failure(extractId(message.getPayload()),
                    ValidationException.CODE, "Invalid request frame"));
            return;
        }
        if (request == null || !request.isValid()) {
            String id = request != null && request.getId() != null ? request.getId() : UNKNOWN_REQUEST_ID;
            sendFrame(connId, ResponseFrame.failure(id, ValidationException.CODE,
                    "Request requires id and type"));
            return;
        }

        String id = request.getId();
        String type = request.getType();
        log.debug("ws:in:req conn={} id={} type={}", connId, id, type);

        router.dispatch(type, request.getPayload(), connection)
                .thenAccept(result -> {
                    sendFrame(connId, ResponseFrame.success(id, result));
                    log.debug("ws:out:res conn={} id={} type={} ok=true", connId, id, type);
                })
                .exceptionally(ex -> {
                    sendFrame(connId, ResponseFrame.failure(id, toError(type, ex)));
                    return null;
                });
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connId = session.getId();
        connections.remove(connId);
        log.info("ws:close conn={} code={} reason={}", connId, status.getCode(), status.getReason());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("ws:error conn={}: {}", session.getId(), exception.getMessage());
    }

    // --- Helpers ---

    private ErrorShape toError(String type, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof BoticalException boticalError) {
            log.debug("request {} failed: {} {}", type, boticalError.getCode(), cause.getMessage());
            return new ErrorShape(boticalError.getCode(), cause.getMessage(), boticalError.getDetails());
        }
        if (cause instanceof UnsupportedOperationException) {
            log.debug("unknown request type: {}", type);
            return ErrorShape.of(ErrorCodes.UNKNOWN_REQUEST, cause.getMessage());
        }
        log.error("request {} failed: {}", type, cause.getMessage(), cause);
        String message = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
        return ErrorShape.of(ErrorCodes.INTERNAL_ERROR, message);
    }

    private String extractId(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node != null && node.hasNonNull("id")) {
                return node.get("id").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("no id in unparseable frame: {}", e.getOriginalMessage());
        }
        return UNKNOWN_REQUEST_ID;
    }

    private void sendFrame(String connId, Object frame) {
        try {
            connections.send(connId, objectMapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.error("ws:serialize-failed conn={}: {}", connId, e.getMessage(), e);
        }
    }
}
