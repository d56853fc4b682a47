package com.botical.gateway.websocket;

/**
 * Which rooms an event kind is fanned out to.
 */
public enum EventRoute {

    /** {@code session:<sessionId>} when the event names a session, plus {@code project:<scope>}. */
    SESSION_AND_PROJECT,

    /** {@code project:<scope>} only. */
    PROJECT_ONLY
}
