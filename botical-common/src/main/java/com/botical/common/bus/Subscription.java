package com.botical.common.bus;

/**
 * Handle returned by {@link EventBus#subscribe}. Unsubscribing twice is harmless.
 */
public interface Subscription {

    String id();

    String pattern();

    /** Tenant filter, or {@code null} when subscribed to every scope. */
    String projectId();

    void unsubscribe();
}
