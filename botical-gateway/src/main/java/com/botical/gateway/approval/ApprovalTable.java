package com.botical.gateway.approval;

import com.botical.common.errors.ConflictException;
import com.botical.common.errors.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Correlates pending human decisions with the tool calls waiting on them.
 *
 * <p>
 * Per call id: absent, then {@code PENDING} on {@link #register}, then exactly
 * one of approved, rejected, cancelled or expired, after which the entry is
 * gone. Whoever removes the entry from the map owns the release: the timer is
 * cancelled and the continuation invoked only after removal, so a resolve
 * racing an expiry releases the caller once.
 */
@Slf4j
public class ApprovalTable implements AutoCloseable {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    private static final class PendingEntry {
        final ApprovalRecord record;
        final ApprovalContinuation continuation;
        volatile ScheduledFuture<?> timer;

        PendingEntry(ApprovalRecord record, ApprovalContinuation continuation) {
            this.record = record;
            this.continuation = continuation;
        }
    }

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;
    private volatile boolean closed;

    public ApprovalTable(ScheduledExecutorService scheduler) {
        this(scheduler, DEFAULT_TIMEOUT);
    }

    public ApprovalTable(ScheduledExecutorService scheduler, Duration defaultTimeout) {
        this.scheduler = scheduler;
        this.defaultTimeout = defaultTimeout;
    }

    // ── Registration ────────────────────────────────────────────────────

    public ApprovalRecord register(String callId, String sessionId, ApprovalContinuation continuation) {
        return register(callId, sessionId, continuation, null);
    }

    /**
     * Create a pending entry and arm its timeout.
     *
     * @param timeout null for the table default
     * @throws ConflictException   if the call id already has a pending entry
     * @throws ValidationException for blank ids or a non-positive timeout
     */
    public ApprovalRecord register(String callId, String sessionId, ApprovalContinuation continuation,
            Duration timeout) {
        if (closed) {
            throw new IllegalStateException("approval table is closed");
        }
        if (callId == null || callId.isBlank()) {
            throw new ValidationException("callId required");
        }
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId required");
        }
        if (continuation == null) {
            throw new IllegalArgumentException("continuation required");
        }
        Duration effective = timeout != null ? timeout : defaultTimeout;
        if (effective.isNegative() || effective.isZero()) {
            throw new ValidationException("timeout must be positive");
        }

        long now = System.currentTimeMillis();
        long timeoutMs = effective.toMillis();
        ApprovalRecord record = new ApprovalRecord(callId, sessionId, ApprovalStatus.PENDING,
                now, now + timeoutMs, null, null);
        PendingEntry entry = new PendingEntry(record, continuation);
        if (pending.putIfAbsent(callId, entry) != null) {
            throw new ConflictException("Approval already pending for call " + callId);
        }

        entry.timer = scheduler.schedule(() -> expire(callId, entry), timeoutMs, TimeUnit.MILLISECONDS);
        if (pending.get(callId) != entry) {
            // released before the timer was armed
            entry.timer.cancel(false);
        }
        log.debug("approval:register call={} session={} timeoutMs={}", callId, sessionId, timeoutMs);
        return record;
    }

    /**
     * Register and hand back a future completed with the decision.
     */
    public CompletableFuture<ApprovalDecision> await(String callId, String sessionId, Duration timeout) {
        CompletableFuture<ApprovalDecision> future = new CompletableFuture<>();
        register(callId, sessionId, future::complete, timeout);
        return future;
    }

    // ── Resolution ──────────────────────────────────────────────────────

    /**
     * Release a pending call with the user's decision.
     *
     * @return the terminal record, or empty if nothing was pending for the call id
     */
    public Optional<ApprovalRecord> resolve(String callId, boolean approved, String reason) {
        if (callId == null) {
            return Optional.empty();
        }
        PendingEntry entry = pending.remove(callId);
        if (entry == null) {
            return Optional.empty();
        }
        ApprovalStatus status = approved ? ApprovalStatus.APPROVED : ApprovalStatus.REJECTED;
        return Optional.of(release(entry, status, reason));
    }

    public Optional<ApprovalRecord> reject(String callId, String reason) {
        return resolve(callId, false, reason);
    }

    /**
     * Release a pending call as cancelled (denied).
     */
    public boolean cancel(String callId) {
        if (callId == null) {
            return false;
        }
        PendingEntry entry = pending.remove(callId);
        if (entry == null) {
            return false;
        }
        release(entry, ApprovalStatus.CANCELLED, null);
        return true;
    }

    /**
     * Cancel every pending call of a session, e.g. when the session ends.
     *
     * @return number of calls released
     */
    public int cancelForSession(String sessionId) {
        int count = 0;
        for (Map.Entry<String, PendingEntry> e : pending.entrySet()) {
            PendingEntry entry = e.getValue();
            if (entry.record.sessionId().equals(sessionId) && pending.remove(e.getKey(), entry)) {
                release(entry, ApprovalStatus.CANCELLED, "session ended");
                count++;
            }
        }
        if (count > 0) {
            log.info("approval:cancel-session session={} released={}", sessionId, count);
        }
        return count;
    }

    private void expire(String callId, PendingEntry entry) {
        if (pending.remove(callId, entry)) {
            log.info("approval:expired call={} session={}", callId, entry.record.sessionId());
            release(entry, ApprovalStatus.EXPIRED, "approval timed out");
        }
    }

    private ApprovalRecord release(PendingEntry entry, ApprovalStatus status, String reason) {
        ScheduledFuture<?> timer = entry.timer;
        if (timer != null) {
            timer.cancel(false);
        }
        ApprovalRecord resolved = entry.record.withResolution(status, reason);
        ApprovalDecision decision = status == ApprovalStatus.APPROVED
                ? ApprovalDecision.approved(reason)
                : ApprovalDecision.denied(status, reason);
        try {
            entry.continuation.release(decision);
        } catch (Exception e) {
            log.error("approval:continuation-failed call={} status={}: {}",
                    resolved.callId(), status, e.getMessage(), e);
        }
        log.debug("approval:release call={} status={}", resolved.callId(), status);
        return resolved;
    }

    // ── Queries ─────────────────────────────────────────────────────────

    public Optional<ApprovalRecord> getPending(String callId) {
        PendingEntry entry = callId != null ? pending.get(callId) : null;
        return entry != null ? Optional.of(entry.record) : Optional.empty();
    }

    public List<ApprovalRecord> listPending(String sessionId) {
        List<ApprovalRecord> result = new ArrayList<>();
        for (PendingEntry entry : pending.values()) {
            if (entry.record.sessionId().equals(sessionId)) {
                result.add(entry.record);
            }
        }
        return result;
    }

    public boolean hasPending(String sessionId) {
        for (PendingEntry entry : pending.values()) {
            if (entry.record.sessionId().equals(sessionId)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return pending.size();
    }

    /**
     * Release every waiter as cancelled and refuse new registrations.
     */
    @Override
    public void close() {
        closed = true;
        int count = 0;
        for (Map.Entry<String, PendingEntry> e : pending.entrySet()) {
            if (pending.remove(e.getKey(), e.getValue())) {
                release(e.getValue(), ApprovalStatus.CANCELLED, "server shutting down");
                count++;
            }
        }
        if (count > 0) {
            log.info("approval:close released={}", count);
        }
    }
}
