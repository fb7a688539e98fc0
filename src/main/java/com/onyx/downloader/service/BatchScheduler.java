package com.onyx.downloader.service;

import com.onyx.downloader.model.BatchJob;
import com.onyx.downloader.model.BatchResult;
import com.onyx.downloader.model.BatchStatus;
import com.onyx.downloader.model.DownloadTask;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the tasks of a batch under a global concurrency limit. Results keep submission order.
 * <p>
 * With {@code continueOnError} off, the first failed task cancels everything still running and
 * every task that has not started yet is recorded as aborted without touching the network.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchScheduler {

    private final DownloadService downloadService;
    private final MetricsService metricsService;

    @Qualifier("downloadExecutor")
    private final ThreadPoolExecutor downloadExecutor;

    public BatchResult run(BatchJob job) {
        return run(job, ProgressListener.NONE);
    }

    public BatchResult run(BatchJob job, ProgressListener listener) {
        int limit = Math.max(1, job.getConcurrencyLimit());
        ensureCapacity(limit);

        log.info("Starting batch: tasks={}, concurrency={}, continueOnError={}",
                job.getTasks().size(), limit, job.isContinueOnError());

        long startNanos = System.nanoTime();
        CancellationToken batchToken = CancellationToken.create();
        Semaphore slots = new Semaphore(limit);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<CompletableFuture<TaskResult>> futures = new ArrayList<>(job.getTasks().size());
        for (DownloadTask task : job.getTasks()) {
            if (!acquireSlot(slots, batchToken)) {
                futures.add(CompletableFuture.completedFuture(TaskResult.aborted(task, "Batch aborted before start")));
                continue;
            }

            metricsService.incrementTasksSubmitted();
            CancellationToken taskToken = batchToken.child();
            futures.add(CompletableFuture.supplyAsync(
                    () -> runTask(job, task, taskToken, batchToken, listener, slots, running, peak), downloadExecutor));
        }

        List<TaskResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();
        job.setResults(new ArrayList<>(results));

        int succeeded = count(results, TaskStatus.SUCCESS);
        int failed = count(results, TaskStatus.FAILED);
        int aborted = count(results, TaskStatus.ABORTED);
        BatchStatus status = !job.isContinueOnError() && batchToken.isCancelled()
                ? BatchStatus.ABORTED
                : BatchStatus.COMPLETED;

        BatchResult result = BatchResult.builder()
                .status(status)
                .results(results)
                .succeeded(succeeded)
                .failed(failed)
                .aborted(aborted)
                .duration(Duration.ofNanos(System.nanoTime() - startNanos))
                .peakConcurrency(peak.get())
                .build();

        log.info("Batch finished: status={}, succeeded={}, failed={}, aborted={}, peakConcurrency={}, duration={} ms",
                status, succeeded, failed, aborted, peak.get(), result.getDuration().toMillis());
        return result;
    }

    private TaskResult runTask(BatchJob job, DownloadTask task, CancellationToken taskToken,
                               CancellationToken batchToken, ProgressListener listener, Semaphore slots,
                               AtomicInteger running, AtomicInteger peak) {
        peak.accumulateAndGet(running.incrementAndGet(), Math::max);
        try {
            if (taskToken.isCancelled()) {
                return TaskResult.aborted(task, "Batch aborted before start");
            }

            TaskResult result = downloadService.download(task, taskToken, listener);
            if (result.getStatus() == TaskStatus.FAILED && !job.isContinueOnError() && !batchToken.isCancelled()) {
                log.warn("Task {} failed ({}), aborting the batch", task.getId(), result.getError());
                batchToken.cancel();
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected failure in batch task {}", task.getId(), e);
            if (!job.isContinueOnError()) {
                batchToken.cancel();
            }
            return TaskResult.aborted(task, e.getMessage());
        } finally {
            running.decrementAndGet();
            slots.release();
        }
    }

    private boolean acquireSlot(Semaphore slots, CancellationToken batchToken) {
        if (batchToken.isCancelled()) {
            return false;
        }
        try {
            slots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            batchToken.cancel();
            return false;
        }
        if (batchToken.isCancelled()) {
            slots.release();
            return false;
        }
        return true;
    }

    /**
     * Queued work only spills past the core threads once the queue is full, so the core size must
     * cover the batch limit for the limit to be reachable.
     */
    private synchronized void ensureCapacity(int limit) {
        int target = Math.min(limit, downloadExecutor.getMaximumPoolSize());
        if (downloadExecutor.getCorePoolSize() < target) {
            log.info("Raising download executor core size from {} to {}", downloadExecutor.getCorePoolSize(), target);
            downloadExecutor.setCorePoolSize(target);
        }
    }

    private static int count(List<TaskResult> results, TaskStatus status) {
        return (int) results.stream().filter(result -> result.getStatus() == status).count();
    }
}
