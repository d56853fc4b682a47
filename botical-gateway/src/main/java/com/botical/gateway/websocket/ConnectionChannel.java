package com.botical.gateway.websocket;

import java.io.IOException;

/**
 * Outbound side of one client transport.
 */
public interface ConnectionChannel {

    /** Live/closed state at call time. */
    boolean isOpen();

    void send(String textFrame) throws IOException;

    void close(int code, String reason);
}
