package com.chainfeed.merge;

import com.chainfeed.domain.SourceKind;
import lombok.Getter;

/**
 * Timestamp text of a feed item could not be read. Never defaulted: a guessed time would misorder the feed.
 */
@Getter
public class MalformedTimestampException extends StreamMergeException {

    private final SourceKind sourceKind;
    /** Offending value exactly as received; may be null when the field was absent. */
    private final String rawValue;

    public MalformedTimestampException(SourceKind sourceKind, String rawValue, Throwable cause) {
        super(MergeErrorCode.MALFORMED_TIMESTAMP,
                "Malformed " + sourceKind.wireName() + " timestamp: " + (rawValue == null ? "<absent>" : "'" + rawValue + "'"),
                cause);
        this.sourceKind = sourceKind;
        this.rawValue = rawValue;
    }
}
