package com.chainfeed.stream;

import com.chainfeed.domain.FeedTransaction;

import java.util.Optional;

/**
 * Result of {@link TransactionStream#next()}.
 */
public record StreamStep(boolean done, FeedTransaction transaction) {

    private static final StreamStep DONE = new StreamStep(true, null);
    private static final StreamStep EMPTY = new StreamStep(false, null);

    public static StreamStep of(FeedTransaction transaction) {
        return new StreamStep(false, transaction);
    }

    public static StreamStep finished() {
        return DONE;
    }

    /** Not done, but nothing produced this time. */
    public static StreamStep empty() {
        return EMPTY;
    }

    public Optional<FeedTransaction> value() {
        return done ? Optional.empty() : Optional.ofNullable(transaction);
    }
}
