package com.chainfeed.stream;

import com.chainfeed.domain.FeedTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Stream over an already materialised, newest-first list (e.g. a single-page source or a cached page).
 */
public class ListTransactionStream implements TransactionStream {

    private final List<FeedTransaction> transactions;
    private int position;

    public ListTransactionStream(List<? extends FeedTransaction> transactions) {
        if (transactions == null) {
            throw new IllegalArgumentException("transactions must not be null");
        }
        this.transactions = List.copyOf(transactions);
    }

    public static ListTransactionStream of(FeedTransaction... transactions) {
        return new ListTransactionStream(List.of(transactions));
    }

    @Override
    public Optional<FeedTransaction> peek() {
        return position < transactions.size() ? Optional.of(transactions.get(position)) : Optional.empty();
    }

    @Override
    public StreamStep next() {
        if (position >= transactions.size()) {
            return StreamStep.finished();
        }
        return StreamStep.of(transactions.get(position++));
    }

    public int remaining() {
        return transactions.size() - position;
    }
}
