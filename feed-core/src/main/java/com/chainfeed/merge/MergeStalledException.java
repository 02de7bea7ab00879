package com.chainfeed.merge;

import lombok.Getter;

/**
 * Raised when a stream keeps winning a round but yields nothing from {@code next()}.
 */
@Getter
public class MergeStalledException extends StreamMergeException {

    private final int emptyRounds;
    /** Items merged before the stall; diagnostic only, the call returns nothing. */
    private final int collected;

    public MergeStalledException(int emptyRounds, int collected, int limit) {
        super(MergeErrorCode.MERGE_STALLED,
                "Possible infinite loop: " + emptyRounds + " consecutive rounds produced no transaction ("
                        + collected + " of " + limit + " collected)");
        this.emptyRounds = emptyRounds;
        this.collected = collected;
    }
}
