package com.flagship.balance_ledger.guard;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the striped in-process account guard.
 */
class AccountLockGuardTest {

    @Test
    @DisplayName("Stripe index is stable and within bounds")
    void stripeIndexIsStableAndBounded() {
        AccountLockGuard guard = new AccountLockGuard(true, 16);

        for (long accountId = 1; accountId < 10_000; accountId++) {
            int index = guard.stripeIndex(accountId);
            assertTrue(index >= 0 && index < 16, "Index out of range for account " + accountId);
            assertEquals(index, guard.stripeIndex(accountId));
        }
        assertEquals(16, guard.stripeCount());
    }

    @Test
    @DisplayName("Non-positive stripe count is rejected")
    void rejectsInvalidStripeCount() {
        assertThrows(IllegalArgumentException.class, () -> new AccountLockGuard(true, 0));
    }

    @Test
    @DisplayName("Second holder of the same account blocks until the first releases")
    void sameAccountIsExclusive() throws Exception {
        AccountLockGuard guard = new AccountLockGuard(true, 64);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            GuardHandle first = guard.acquire(42L);
            Future<?> second = executor.submit(() -> {
                try (GuardHandle ignored = guard.acquire(42L)) {
                    // acquired
                }
            });

            assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS),
                    "Second acquire should block while the first handle is open");

            first.close();
            second.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Closing a handle twice releases only once")
    void closeIsIdempotent() throws Exception {
        AccountLockGuard guard = new AccountLockGuard(true, 8);

        GuardHandle handle = guard.acquireAll(List.of(1L, 2L));
        handle.close();
        handle.close();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> other = executor.submit(() -> {
                try (GuardHandle ignored = guard.acquireAll(List.of(2L, 1L))) {
                    // acquired
                }
            });
            other.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Disabled guard never blocks")
    void disabledGuardIsNoOp() throws Exception {
        AccountLockGuard guard = new AccountLockGuard(false, 8);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try (GuardHandle ignored = guard.acquire(7L)) {
            Future<?> other = executor.submit(() -> {
                try (GuardHandle inner = guard.acquire(7L)) {
                    // acquired
                }
            });
            other.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Opposite acquisition orders never deadlock")
    void oppositeOrdersDoNotDeadlock() throws Exception {
        AccountLockGuard guard = new AccountLockGuard(true, 256);
        int iterations = 2_000;
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<?> forward = executor.submit(() -> {
                startLatch.await();
                for (int i = 0; i < iterations; i++) {
                    try (GuardHandle ignored = guard.acquireAll(List.of(1001L, 2002L))) {
                        completed.incrementAndGet();
                    }
                }
                return null;
            });
            Future<?> backward = executor.submit(() -> {
                startLatch.await();
                for (int i = 0; i < iterations; i++) {
                    try (GuardHandle ignored = guard.acquireAll(List.of(2002L, 1001L))) {
                        completed.incrementAndGet();
                    }
                }
                return null;
            });

            startLatch.countDown();
            forward.get(30, TimeUnit.SECONDS);
            backward.get(30, TimeUnit.SECONDS);

            assertEquals(iterations * 2, completed.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
