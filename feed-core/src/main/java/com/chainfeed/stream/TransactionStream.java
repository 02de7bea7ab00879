package com.chainfeed.stream;

import com.chainfeed.domain.FeedTransaction;

import java.util.Optional;

/**
 * Sequential, newest-first cursor over one source's transactions.
 * Implementations own a single lookahead item between {@link #peek()} and {@link #next()}.
 * Not thread-safe; a merger calls one method at a time per stream.
 */
public interface TransactionStream {

    /**
     * Item the next call to {@link #next()} would return, without advancing.
     * Repeated calls return the same item until {@code next()} is called; empty once exhausted.
     */
    Optional<FeedTransaction> peek();

    /**
     * Advance past the current item and return it. A not-done step without a value is a transient empty
     * result, not exhaustion.
     */
    StreamStep next();
}
