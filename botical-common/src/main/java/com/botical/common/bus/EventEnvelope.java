package com.botical.common.bus;

/**
 * A published event plus delivery metadata.
 *
 * @param projectId tenant scope, {@code null} for global events
 */
public record EventEnvelope(
        String id,
        long timestamp,
        String projectId,
        BoticalEvent event) {

    public boolean isGlobal() {
        return projectId == null;
    }
}
