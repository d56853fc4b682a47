package com.botical.gateway.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link ConnectionChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator}: concurrent
 * writers queue behind the one currently flushing instead of blocking, frames
 * leave in the order they were queued, and a client that stays over the time
 * or buffer limit is closed by the decorator.
 */
@Slf4j
public class WebSocketChannel implements ConnectionChannel {

    private final WebSocketSession session;

    public WebSocketChannel(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE);
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String textFrame) throws IOException {
        session.sendMessage(new TextMessage(textFrame));
    }

    @Override
    public void close(int code, String reason) {
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            log.debug("close failed conn={}: {}", session.getId(), e.getMessage());
        }
    }
}
