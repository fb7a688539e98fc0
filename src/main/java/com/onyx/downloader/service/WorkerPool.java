package com.onyx.downloader.service;

import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.Chunk;
import com.onyx.downloader.model.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the chunks of one task, at most {@code workerCount} at a time. The first chunk that fails for good
 * cancels its siblings; the pool waits for every worker to flush its progress before reporting.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkerPool {

    @Qualifier("chunkExecutor")
    private final ThreadPoolExecutor chunkExecutor;

    public void run(TransferContext context, List<Chunk> chunks, int workerCount)
            throws DownloadException, InterruptedException {
        CancellationToken poolToken = context.getToken().child();
        TransferContext workerContext = context.toBuilder().token(poolToken).build();
        Semaphore permits = new Semaphore(workerCount);
        AtomicReference<DownloadException> firstFailure = new AtomicReference<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        List<CompletableFuture<Chunk>> futures = chunks.stream()
                .filter(chunk -> !chunk.isComplete())
                .map(chunk -> CompletableFuture.supplyAsync(
                        () -> withMdc(mdc, () -> runChunk(workerContext, chunk, permits, firstFailure, poolToken)),
                        chunkExecutor))
                .toList();

        log.debug("Task {}: running {} of {} chunk(s) with {} worker(s)",
                context.getTaskId(), futures.size(), chunks.size(), workerCount);

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, throwable) -> null)
                .join();

        DownloadException failure = firstFailure.get();
        if (failure != null) {
            throw failure;
        }
        if (context.getToken().isCancelled()) {
            throw DownloadException.cancelled("Task " + context.getTaskId() + " cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Interrupted while waiting for chunk workers");
        }
    }

    private static <T> T withMdc(Map<String, String> mdc, Supplier<T> action) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        setMdc(mdc);
        try {
            return action.get();
        } finally {
            setMdc(previous);
        }
    }

    private static void setMdc(Map<String, String> context) {
        if (context == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(context);
        }
    }

    private Chunk runChunk(TransferContext context, Chunk chunk, Semaphore permits,
                           AtomicReference<DownloadException> firstFailure, CancellationToken poolToken) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(DownloadException.cancelled("Interrupted before chunk " + chunk.getId() + " started"));
        }

        context.getProgress().workerStarted();
        try {
            return new ChunkWorker(context, chunk).call();
        } catch (DownloadException e) {
            if (e.getKind() != ErrorKind.CANCELLED && firstFailure.compareAndSet(null, e)) {
                log.info("Task {}: chunk {} failed, cancelling remaining workers", context.getTaskId(), chunk.getId());
                poolToken.cancel();
            }
            throw new CompletionException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            poolToken.cancel();
            throw new CompletionException(DownloadException.cancelled("Interrupted during chunk " + chunk.getId()));
        } catch (RuntimeException e) {
            DownloadException failure = new DownloadException(ErrorKind.DISK,
                    "Unexpected failure in chunk " + chunk.getId() + ": " + e.getMessage(), e);
            if (firstFailure.compareAndSet(null, failure)) {
                poolToken.cancel();
            }
            throw new CompletionException(failure);
        } finally {
            context.getProgress().workerFinished();
            permits.release();
        }
    }
}
