package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff: the base delay doubles per attempt up to the configured cap.
 */
@Component
@RequiredArgsConstructor
public class BackoffPolicy {

    private final DownloadProperties properties;

    public long waitTime(int attempt) {
        long base = properties.getBackoffBase().toMillis();
        long max = properties.getBackoffMax().toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = base << shift;
        return delay < 0 ? max : Math.min(delay, max);
    }

    /**
     * @return {@code false} if the wait was cut short by cancellation
     */
    public boolean waitForRetry(int attempt, CancellationToken token) throws InterruptedException {
        return token.sleep(waitTime(attempt));
    }
}
