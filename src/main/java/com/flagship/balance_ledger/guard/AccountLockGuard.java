package com.flagship.balance_ledger.guard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process serialization of balance mutations per account.
 *
 * Accounts hash onto a fixed array of lock stripes, so memory stays bounded no
 * matter how many accounts the process touches. Multi-account operations take
 * their stripes in ascending stripe index order, which gives every caller the
 * same total order and rules out deadlock between opposite transfers.
 *
 * This guard only reduces contention on the database row lock. It is not the
 * correctness authority: other processes never see it, the
 * {@code SELECT ... FOR UPDATE} in {@link com.flagship.balance_ledger.ledger.LedgerStore} does.
 */
@Component
@Slf4j
public class AccountLockGuard {

    private static final GuardHandle NO_OP = () -> { };

    private final boolean enabled;
    private final ReentrantLock[] stripes;

    public AccountLockGuard(@Value("${ledger.guard.enabled:true}") boolean enabled,
                            @Value("${ledger.guard.stripes:256}") int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("ledger.guard.stripes must be positive, got " + stripeCount);
        }
        this.enabled = enabled;
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
        log.info("Account lock guard initialised: enabled={}, stripes={}", enabled, stripeCount);
    }

    /**
     * Acquires the guard for a single account. Blocks until granted.
     */
    public GuardHandle acquire(long accountId) {
        return acquireAll(List.of(accountId));
    }

    /**
     * Acquires the guard for every given account in a fixed global order,
     * independent of the order of {@code accountIds}.
     */
    public GuardHandle acquireAll(Collection<Long> accountIds) {
        if (!enabled || accountIds.isEmpty()) {
            return NO_OP;
        }

        int[] indexes = accountIds.stream()
                .mapToInt(this::stripeIndex)
                .distinct()
                .sorted()
                .toArray();

        for (int i = 0; i < indexes.length; i++) {
            stripes[indexes[i]].lock();
        }
        return new StripeHandle(indexes);
    }

    public int stripeCount() {
        return stripes.length;
    }

    int stripeIndex(long accountId) {
        int h = Long.hashCode(accountId);
        h ^= (h >>> 16);
        return Math.floorMod(h, stripes.length);
    }

    private final class StripeHandle implements GuardHandle {

        private final int[] indexes;
        private boolean released;

        private StripeHandle(int[] indexes) {
            this.indexes = indexes;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            for (int i = indexes.length - 1; i >= 0; i--) {
                stripes[indexes[i]].unlock();
            }
        }

        @Override
        public String toString() {
            return "StripeHandle" + Arrays.toString(indexes);
        }
    }
}
