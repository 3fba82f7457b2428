package com.flagship.balance_ledger.guard;

/**
 * Scoped hold on one or more guard stripes. Closing the handle releases every
 * stripe it holds; closing it twice is a no-op.
 */
public interface GuardHandle extends AutoCloseable {

    @Override
    void close();
}
