package com.botical.gateway.approval;

import com.botical.common.errors.ConflictException;
import com.botical.common.errors.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalTableTest {

    private ScheduledExecutorService scheduler;
    private ApprovalTable table;
    private List<ApprovalDecision> released;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        table = new ApprovalTable(scheduler, Duration.ofMinutes(5));
        released = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Nested
    class Registration {

        @Test
        void register_createsPendingRecord() {
            ApprovalRecord record = table.register("call-1", "s1", released::add);

            assertEquals(ApprovalStatus.PENDING, record.status());
            assertEquals(record.createdAt() + Duration.ofMinutes(5).toMillis(), record.expiresAt());
            assertTrue(table.getPending("call-1").isPresent());
            assertTrue(table.hasPending("s1"));
            assertEquals(1, table.size());
        }

        @Test
        void register_twice_throwsConflict() {
            table.register("call-1", "s1", released::add);
            assertThrows(ConflictException.class, () -> table.register("call-1", "s1", released::add));
            assertEquals(1, table.size());
        }

        @Test
        void register_blankIds_throwValidation() {
            assertThrows(ValidationException.class, () -> table.register("", "s1", released::add));
            assertThrows(ValidationException.class, () -> table.register("call-1", " ", released::add));
        }

        @Test
        void register_afterClose_isRefused() {
            table.close();
            assertThrows(IllegalStateException.class, () -> table.register("call-1", "s1", released::add));
        }

        @Test
        void register_afterResolution_isAllowedAgain() {
            table.register("call-1", "s1", released::add);
            table.resolve("call-1", true, null);

            assertDoesNotThrow(() -> table.register("call-1", "s1", released::add));
        }
    }

    @Nested
    class Resolution {

        @Test
        void resolve_approve_releasesOnce() {
            table.register("call-1", "s1", released::add);

            Optional<ApprovalRecord> first = table.resolve("call-1", true, null);
            Optional<ApprovalRecord> second = table.resolve("call-1", true, null);

            assertTrue(first.isPresent());
            assertEquals(ApprovalStatus.APPROVED, first.get().status());
            assertNotNull(first.get().resolvedAt());
            assertTrue(second.isEmpty());
            assertEquals(1, released.size());
            assertTrue(released.get(0).approved());
            assertNull(released.get(0).reason());
            assertEquals(0, table.size());
        }

        @Test
        void reject_passesReason() {
            table.register("call-1", "s1", released::add);

            ApprovalRecord record = table.reject("call-1", "too risky").orElseThrow();

            assertEquals(ApprovalStatus.REJECTED, record.status());
            assertFalse(released.get(0).approved());
            assertEquals("too risky", released.get(0).reason());
        }

        @Test
        void resolve_unknown_returnsEmpty() {
            assertTrue(table.resolve("nope", true, null).isEmpty());
            assertTrue(released.isEmpty());
        }

        @Test
        void cancel_releasesAsDenied() {
            table.register("call-1", "s1", released::add);

            assertTrue(table.cancel("call-1"));
            assertFalse(table.cancel("call-1"));
            assertEquals(ApprovalStatus.CANCELLED, released.get(0).status());
            assertFalse(released.get(0).approved());
        }

        @Test
        void cancelForSession_onlyTouchesThatSession() {
            table.register("call-1", "s1", released::add);
            table.register("call-2", "s1", released::add);
            table.register("call-3", "s2", released::add);

            assertEquals(2, table.cancelForSession("s1"));

            assertFalse(table.hasPending("s1"));
            assertEquals(1, table.listPending("s2").size());
            assertEquals(2, released.size());
        }

        @Test
        void continuationFailure_stillRemovesEntry() {
            table.register("call-1", "s1", d -> {
                throw new IllegalStateException("tool runner gone");
            });

            assertTrue(table.resolve("call-1", true, null).isPresent());
            assertEquals(0, table.size());
        }

        @Test
        void close_deniesEveryWaiter() {
            table.register("call-1", "s1", released::add);
            table.register("call-2", "s2", released::add);

            table.close();

            assertEquals(0, table.size());
            assertEquals(2, released.size());
            assertTrue(released.stream().noneMatch(ApprovalDecision::approved));
        }
    }

    @Nested
    class Expiry {

        @Test
        void timeout_releasesAsExpired() throws Exception {
            CompletableFuture<ApprovalDecision> decision = table.await("call-1", "s1", Duration.ofMillis(10));

            ApprovalDecision result = decision.get(2, TimeUnit.SECONDS);

            assertEquals(ApprovalStatus.EXPIRED, result.status());
            assertFalse(result.approved());
            assertTrue(table.resolve("call-1", true, null).isEmpty());
        }

        @Test
        void resolveBeforeTimeout_timerDoesNothing() throws Exception {
            table.register("call-1", "s1", released::add, Duration.ofMillis(50));
            table.resolve("call-1", true, null);

            Thread.sleep(150);

            assertEquals(1, released.size());
            assertEquals(ApprovalStatus.APPROVED, released.get(0).status());
        }

        @Test
        void staleTimer_doesNotExpireReplacementEntry() throws Exception {
            table.register("call-1", "s1", released::add, Duration.ofMillis(50));
            table.resolve("call-1", false, "no");
            table.register("call-1", "s1", released::add, Duration.ofMinutes(1));

            Thread.sleep(150);

            assertTrue(table.getPending("call-1").isPresent());
            assertEquals(1, released.size());
        }

        @RepeatedTest(20)
        void resolveRacingExpiry_releasesExactlyOnce() throws Exception {
            CountDownLatch done = new CountDownLatch(1);
            table.register("call-1", "s1", d -> {
                released.add(d);
                done.countDown();
            }, Duration.ofMillis(1));

            table.resolve("call-1", true, null);

            assertTrue(done.await(2, TimeUnit.SECONDS));
            Thread.sleep(20);
            assertEquals(1, released.size());
        }

        @Test
        void nonPositiveTimeout_isRejected() {
            assertThrows(ValidationException.class,
                    () -> table.register("call-1", "s1", released::add, Duration.ZERO));
        }
    }
}
