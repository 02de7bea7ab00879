package com.chainfeed.merge;

/**
 * Failure kinds of a merge call. Stream exhaustion is not one of them.
 */
public enum MergeErrorCode {
    /** Merger built without streams, with a missing stream or with an invalid tuning value. */
    INVALID_CONFIGURATION,
    /** takeN limit outside 1..MAX_LIMIT or not a whole number. */
    INVALID_LIMIT,
    /** Starknet or Spark timestamp text that cannot be parsed. */
    MALFORMED_TIMESTAMP,
    /** Consecutive rounds produced nothing although some stream kept reporting an item. */
    MERGE_STALLED,
    /** A stream failed with a checked exception or the peek executor refused work. */
    STREAM_FAILURE
}
