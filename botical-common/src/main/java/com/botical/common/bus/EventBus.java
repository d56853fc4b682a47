package com.botical.common.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe for {@link BoticalEvent}s, keyed by project scope.
 *
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order, so
 * each subscriber sees the events of a single producer in the order they were
 * published. Nothing is retained after delivery. A subscriber that throws is
 * logged and skipped; the publisher never sees the failure.
 *
 * <p>
 * Instances are constructed explicitly and handed to the components that need
 * them; tests build a fresh bus per case.
 */
@Slf4j
public class EventBus {

    private final List<StoredSubscription> subscriptions = new CopyOnWriteArrayList<>();

    private final class StoredSubscription implements Subscription {
        private final String id;
        private final String pattern;
        private final String projectId;
        private final Consumer<EventEnvelope> handler;
        private final AtomicBoolean active = new AtomicBoolean(true);

        StoredSubscription(String pattern, String projectId, Consumer<EventEnvelope> handler) {
            this.id = newId("sub");
            this.pattern = pattern;
            this.projectId = projectId;
            this.handler = handler;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String pattern() {
            return pattern;
        }

        @Override
        public String projectId() {
            return projectId;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                subscriptions.remove(this);
            }
        }

        boolean accepts(EventEnvelope envelope) {
            if (!active.get()) {
                return false;
            }
            if (projectId != null && !projectId.equals(envelope.projectId())) {
                return false;
            }
            return EventPattern.matches(pattern, envelope.event().type());
        }
    }

    // ── Publish ─────────────────────────────────────────────────────────

    /**
     * Publish an event scoped to a project.
     */
    public EventEnvelope publish(String projectId, BoticalEvent event) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId required; use publishGlobal for unscoped events");
        }
        return dispatch(new EventEnvelope(newId("evt"), System.currentTimeMillis(), projectId, event));
    }

    /**
     * Publish an event that belongs to no project.
     */
    public EventEnvelope publishGlobal(BoticalEvent event) {
        return dispatch(new EventEnvelope(newId("evt"), System.currentTimeMillis(), null, event));
    }

    private EventEnvelope dispatch(EventEnvelope envelope) {
        if (envelope.event() == null) {
            throw new IllegalArgumentException("event required");
        }
        for (StoredSubscription sub : subscriptions) {
            if (!sub.accepts(envelope)) {
                continue;
            }
            try {
                sub.handler.accept(envelope);
            } catch (Exception e) {
                log.error("bus:handler-failed sub={} event={} project={}: {}",
                        sub.id, envelope.event().type(), envelope.projectId(), e.getMessage(), e);
            }
        }
        return envelope;
    }

    // ── Subscribe ───────────────────────────────────────────────────────

    /**
     * Subscribe to events of every scope whose type matches {@code pattern}.
     */
    public Subscription subscribe(String pattern, Consumer<EventEnvelope> handler) {
        return register(pattern, null, handler);
    }

    /**
     * Subscribe to events of a single project whose type matches {@code pattern}.
     */
    public Subscription subscribeProject(String projectId, String pattern, Consumer<EventEnvelope> handler) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId required");
        }
        return register(pattern, projectId, handler);
    }

    private Subscription register(String pattern, String projectId, Consumer<EventEnvelope> handler) {
        if (!EventPattern.isValid(pattern)) {
            throw new IllegalArgumentException("invalid event pattern: " + pattern);
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler required");
        }
        StoredSubscription sub = new StoredSubscription(pattern, projectId, handler);
        subscriptions.add(sub);
        log.debug("bus:subscribe sub={} pattern={} project={}", sub.id, pattern, projectId);
        return sub;
    }

    /**
     * Remove a subscription by id.
     */
    public boolean unsubscribe(String subscriptionId) {
        for (StoredSubscription sub : subscriptions) {
            if (sub.id.equals(subscriptionId)) {
                boolean wasActive = sub.active.get();
                sub.unsubscribe();
                return wasActive;
            }
        }
        return false;
    }

    /**
     * Remove every subscription scoped to a project.
     *
     * @return number removed
     */
    public int unsubscribeProject(String projectId) {
        int count = 0;
        for (StoredSubscription sub : subscriptions) {
            if (projectId != null && projectId.equals(sub.projectId) && sub.active.get()) {
                sub.unsubscribe();
                count++;
            }
        }
        return count;
    }

    public int getSubscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Drop every subscription. Used between tests and on shutdown.
     */
    public void clearAll() {
        for (StoredSubscription sub : subscriptions) {
            sub.active.set(false);
        }
        subscriptions.clear();
    }

    private static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
