package com.onyx.downloader.service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal. Cancelling a token cancels every child created from it;
 * cancelling a child leaves its parent untouched.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        children.forEach(CancellationToken::cancel);
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code millis} unless cancelled first.
     *
     * @return {@code true} if the full wait elapsed, {@code false} if the token was cancelled
     */
    public boolean sleep(long millis) throws InterruptedException {
        if (millis <= 0) {
            return !isCancelled();
        }
        return !cancelled.await(millis, TimeUnit.MILLISECONDS);
    }
}
