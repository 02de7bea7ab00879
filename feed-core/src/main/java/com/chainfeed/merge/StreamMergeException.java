package com.chainfeed.merge;

import lombok.Getter;

/**
 * Fatal failure of a merge call. Callers get no partial result; the error code tells why.
 */
@Getter
public class StreamMergeException extends RuntimeException {

    private final MergeErrorCode errorCode;

    public StreamMergeException(MergeErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StreamMergeException(MergeErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
