package com.chainfeed.stream;

import com.chainfeed.common.RetryPolicy;
import com.chainfeed.domain.FeedTransaction;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Lookahead-buffered stream over a paginated source. Pages are fetched lazily: the first
 * {@link #peek()} loads page one, and the next page is requested only once the buffer is drained.
 * Empty intermediate pages are skipped.
 */
@Slf4j
public class PagedTransactionStream implements TransactionStream {

    /** Consecutive empty pages tolerated before the source is considered broken. */
    static final int MAX_CONSECUTIVE_EMPTY_PAGES = 10;

    private final String sourceName;
    private final TransactionPageFetcher fetcher;
    private final RetryPolicy retryPolicy;
    private final Deque<FeedTransaction> buffer = new ArrayDeque<>();

    private String nextCursor;
    private boolean started;
    private boolean exhausted;
    private int pagesFetched;

    public PagedTransactionStream(String sourceName, TransactionPageFetcher fetcher, RetryPolicy retryPolicy) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher must not be null");
        }
        this.sourceName = sourceName != null ? sourceName : "source";
        this.fetcher = fetcher;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public PagedTransactionStream(String sourceName, TransactionPageFetcher fetcher) {
        this(sourceName, fetcher, RetryPolicy.defaultPolicy());
    }

    @Override
    public Optional<FeedTransaction> peek() {
        fill();
        return Optional.ofNullable(buffer.peekFirst());
    }

    @Override
    public StreamStep next() {
        fill();
        FeedTransaction tx = buffer.pollFirst();
        return tx != null ? StreamStep.of(tx) : StreamStep.finished();
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    private void fill() {
        int emptyPages = 0;
        while (buffer.isEmpty() && !exhausted) {
            TransactionPage page = fetchWithRetry(started ? nextCursor : null);
            started = true;
            pagesFetched++;
            buffer.addAll(page.items());
            nextCursor = page.nextCursor();
            exhausted = page.isLast();
            if (exhausted) {
                log.debug("{} reached its last page after {} fetch(es)", sourceName, pagesFetched);
            }
            if (page.items().isEmpty() && !exhausted && ++emptyPages >= MAX_CONSECUTIVE_EMPTY_PAGES) {
                throw new TransactionFetchException(sourceName + " returned " + emptyPages
                        + " consecutive empty pages (cursor " + nextCursor + ")");
            }
        }
    }

    private TransactionPage fetchWithRetry(String cursor) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.debug("Retrying {} page fetch (cursor {}) in {} ms, attempt {}", sourceName, cursor, delay, attempt + 1);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransactionFetchException("Interrupted while retrying " + sourceName, e);
                }
            }
            try {
                TransactionPage page = fetcher.fetch(cursor);
                if (page == null) {
                    throw new TransactionFetchException(sourceName + " returned no page for cursor " + cursor);
                }
                return page;
            } catch (RuntimeException e) {
                lastException = e;
                log.warn("{} page fetch failed (cursor {}): {}", sourceName, cursor, e.getMessage());
            }
        }
        throw new TransactionFetchException(sourceName + " page fetch failed after "
                + retryPolicy.getMaxAttempts() + " attempts", lastException);
    }
}
