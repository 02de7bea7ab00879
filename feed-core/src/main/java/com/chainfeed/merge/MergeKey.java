package com.chainfeed.merge;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Comparable position of a transaction in the merged feed: epoch seconds, or {@link #PENDING}
 * for items without any time information. PENDING sorts after every real timestamp, so in a
 * newest-first merge it surfaces ahead of confirmed history.
 */
@Getter
@EqualsAndHashCode
public final class MergeKey implements Comparable<MergeKey> {

    public static final MergeKey PENDING = new MergeKey(0L, true);

    private final long epochSeconds;
    private final boolean pending;

    private MergeKey(long epochSeconds, boolean pending) {
        this.epochSeconds = epochSeconds;
        this.pending = pending;
    }

    public static MergeKey ofEpochSeconds(long epochSeconds) {
        return new MergeKey(epochSeconds, false);
    }

    @Override
    public int compareTo(MergeKey other) {
        if (pending || other.pending) {
            return Boolean.compare(pending, other.pending);
        }
        return Long.compare(epochSeconds, other.epochSeconds);
    }

    @Override
    public String toString() {
        return pending ? "PENDING" : Long.toString(epochSeconds);
    }
}
