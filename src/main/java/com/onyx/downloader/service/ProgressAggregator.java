package com.onyx.downloader.service;

import com.onyx.downloader.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Progress of one task, owned by whoever runs it. Workers report bytes; subscribers receive
 * {@link ProgressEvent} snapshots at a fixed cadence and once more when the task stops.
 */
@Slf4j
public class ProgressAggregator {

    private final String taskId;
    private final String url;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong completedBytes = new AtomicLong();
    private final AtomicLong networkBytes = new AtomicLong();
    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicInteger peakActiveWorkers = new AtomicInteger();

    private volatile Long totalBytes;
    private ScheduledFuture<?> emitter;

    public ProgressAggregator(String taskId, String url) {
        this.taskId = taskId;
        this.url = url;
    }

    public void subscribe(ProgressListener listener) {
        listeners.add(listener);
    }

    /**
     * Starts a new transfer plan: {@code alreadyWritten} bytes are already on disk from an earlier run.
     */
    public void reset(Long totalBytes, long alreadyWritten) {
        this.totalBytes = totalBytes;
        completedBytes.set(alreadyWritten);
    }

    public void recordWritten(long bytes) {
        completedBytes.addAndGet(bytes);
        networkBytes.addAndGet(bytes);
    }

    /**
     * Bytes written earlier that a restarted stream is going to overwrite.
     */
    public void discardWritten(long bytes) {
        completedBytes.addAndGet(-bytes);
    }

    public void workerStarted() {
        int active = activeWorkers.incrementAndGet();
        peakActiveWorkers.accumulateAndGet(active, Math::max);
    }

    public void workerFinished() {
        activeWorkers.decrementAndGet();
    }

    public long getCompletedBytes() {
        return completedBytes.get();
    }

    public long getNetworkBytes() {
        return networkBytes.get();
    }

    public int getActiveWorkers() {
        return activeWorkers.get();
    }

    public int getPeakActiveWorkers() {
        return peakActiveWorkers.get();
    }

    public ProgressEvent snapshot() {
        return new ProgressEvent(taskId, url, completedBytes.get(), totalBytes, activeWorkers.get(), Instant.now());
    }

    public synchronized void start(ScheduledExecutorService scheduler, Duration interval) {
        if (emitter != null || listeners.isEmpty()) {
            return;
        }
        long period = Math.max(1L, interval.toMillis());
        emitter = scheduler.scheduleAtFixedRate(this::emit, period, period, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (emitter != null) {
            emitter.cancel(false);
            emitter = null;
        }
        emit();
    }

    void emit() {
        ProgressEvent event = snapshot();
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for task {}: {}", taskId, e.getMessage(), e);
            }
        }
    }
}
