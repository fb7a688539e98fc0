package com.onyx.downloader.exception;

import com.onyx.downloader.model.ErrorKind;
import lombok.Getter;

@Getter
public class DownloadException extends Exception {

    public static final int NO_HTTP_STATUS = -1;

    private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;

    private final ErrorKind kind;
    private final int httpStatus;

    public DownloadException(ErrorKind kind, String message) {
        this(kind, message, NO_HTTP_STATUS, null);
    }

    public DownloadException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, NO_HTTP_STATUS, cause);
    }

    public DownloadException(ErrorKind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public static DownloadException cancelled(String message) {
        return new DownloadException(ErrorKind.CANCELLED, message);
    }

    public static DownloadException forStatus(int httpStatus, String url) {
        ErrorKind kind = httpStatus == 429 || httpStatus >= 500
                ? ErrorKind.HTTP_RATE_LIMIT_OR_SERVER
                : ErrorKind.HTTP_CLIENT;
        return new DownloadException(kind, "HTTP " + httpStatus + " for " + url, httpStatus, null);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public boolean isRangeNotSatisfiable() {
        return httpStatus == HTTP_RANGE_NOT_SATISFIABLE;
    }
}
