package com.chainfeed.stream;

/**
 * Per-source page client (explorer API, indexer, RPC). Pages come newest first.
 */
@FunctionalInterface
public interface TransactionPageFetcher {

    /**
     * Fetch the page at {@code cursor}; null requests the first page.
     *
     * @throws TransactionFetchException or any runtime exception when the source call fails
     */
    TransactionPage fetch(String cursor);
}
