package com.chainfeed.stream;

import com.chainfeed.domain.FeedTransaction;

import java.util.List;

/**
 * One page returned by a source. {@code nextCursor} is null on the last page.
 */
public record TransactionPage(List<FeedTransaction> items, String nextCursor) {

    public TransactionPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static TransactionPage last(List<FeedTransaction> items) {
        return new TransactionPage(items, null);
    }

    public boolean isLast() {
        return nextCursor == null;
    }
}
