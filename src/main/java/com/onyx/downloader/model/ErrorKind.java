package com.onyx.downloader.model;

/**
 * Closed set of failure categories a download can end with.
 * Retryable kinds are retried locally by the worker or the probe before they surface.
 */
public enum ErrorKind {
    NETWORK(true),
    UNREACHABLE(true),
    HTTP_CLIENT(false),
    HTTP_RATE_LIMIT_OR_SERVER(true),
    RANGE_UNSUPPORTED(false),
    SIZE_LIMIT_EXCEEDED(false),
    CHECKSUM_MISMATCH(false),
    DISK(false),
    RESUME_INCOMPATIBLE(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
