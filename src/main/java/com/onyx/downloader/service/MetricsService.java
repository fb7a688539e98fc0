package com.onyx.downloader.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;

@Service
@Slf4j
public class MetricsService {

    private final Counter tasksSubmittedCounter;
    private final Counter tasksStartedCounter;
    private final Counter tasksCompletedCounter;
    private final Counter tasksFailedCounter;
    private final Counter chunkRetriesCounter;
    private final Counter bytesTransferredCounter;
    private final Timer downloadTimer;

    public MetricsService(MeterRegistry meterRegistry, @Qualifier("downloadExecutor") ThreadPoolExecutor downloadExecutor) {
        this.tasksSubmittedCounter = Counter.builder("download.tasks.submitted")
                .description("Download tasks submitted")
                .register(meterRegistry);

        this.tasksStartedCounter = Counter.builder("download.tasks.started")
                .description("Download tasks started")
                .register(meterRegistry);

        this.tasksCompletedCounter = Counter.builder("download.tasks.completed")
                .description("Download tasks finished successfully")
                .register(meterRegistry);

        this.tasksFailedCounter = Counter.builder("download.tasks.failed")
                .description("Download tasks that failed or were aborted")
                .register(meterRegistry);

        this.chunkRetriesCounter = Counter.builder("download.chunks.retried")
                .description("Chunk attempts retried after a transient failure")
                .register(meterRegistry);

        this.bytesTransferredCounter = Counter.builder("download.bytes.transferred")
                .description("Bytes received from the network")
                .baseUnit("bytes")
                .register(meterRegistry);

        this.downloadTimer = Timer.builder("download.duration")
                .description("Time spent per download task")
                .register(meterRegistry);

        meterRegistry.gauge("download.thread.pool.active",
                downloadExecutor,
                ThreadPoolExecutor::getActiveCount);

        meterRegistry.gauge("download.thread.pool.size",
                downloadExecutor,
                ThreadPoolExecutor::getPoolSize);

        meterRegistry.gauge("download.thread.pool.queue.size",
                downloadExecutor,
                executor -> executor.getQueue().size());

        log.info("Download metrics registered");
    }

    public void incrementTasksSubmitted() {
        tasksSubmittedCounter.increment();
    }

    public void incrementTasksStarted() {
        tasksStartedCounter.increment();
    }

    public void incrementTasksCompleted() {
        tasksCompletedCounter.increment();
    }

    public void incrementTasksFailed() {
        tasksFailedCounter.increment();
    }

    public void incrementChunkRetries() {
        chunkRetriesCounter.increment();
    }

    public void recordBytesTransferred(long bytes) {
        bytesTransferredCounter.increment(bytes);
    }

    public void recordDownloadTime(Duration duration) {
        downloadTimer.record(duration);
        log.debug("Recorded download time: {} ms", duration.toMillis());
    }

    public double getChunkRetriesCount() {
        return chunkRetriesCounter.count();
    }
}
