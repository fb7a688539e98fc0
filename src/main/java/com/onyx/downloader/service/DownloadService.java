package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.ChecksumAlgorithm;
import com.onyx.downloader.model.Chunk;
import com.onyx.downloader.model.ChunkStatus;
import com.onyx.downloader.model.DownloadTask;
import com.onyx.downloader.model.ErrorKind;
import com.onyx.downloader.model.ExpectedChecksum;
import com.onyx.downloader.model.ProbeResult;
import com.onyx.downloader.model.ResumeRecord;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.model.TaskState;
import com.onyx.downloader.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one download task end to end: probe, name, plan or resume, transfer, verify. Every call
 * returns exactly one {@link TaskResult}; failures never escape as exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DownloadService {

    @Qualifier("downloadExecutor")
    private final ThreadPoolExecutor downloadExecutor;
    @Qualifier("chunkExecutor")
    private final ThreadPoolExecutor chunkExecutor;
    @Qualifier("progressScheduler")
    private final ScheduledExecutorService progressScheduler;

    private final RangeResolver rangeResolver;
    private final NameResolver nameResolver;
    private final ChunkPlanner chunkPlanner;
    private final ResumeStore resumeStore;
    private final WorkerPool workerPool;
    private final ChecksumVerifier checksumVerifier;
    private final HttpConnector connector;
    private final BackoffPolicy backoffPolicy;
    private final MetricsService metricsService;
    private final DownloadProperties properties;

    private final Map<String, CancellationToken> activeDownloads = new ConcurrentHashMap<>();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public CompletableFuture<TaskResult> submitDownloadTask(DownloadTask task, ProgressListener listener) {
        log.info("Submitting download task: id={}, url={}", task.getId(), task.getUrl());
        metricsService.incrementTasksSubmitted();

        CancellationToken token = CancellationToken.create();
        return CompletableFuture.supplyAsync(() -> download(task, token, listener), downloadExecutor);
    }

    public TaskResult download(DownloadTask task) {
        return download(task, CancellationToken.create(), ProgressListener.NONE);
    }

    public TaskResult download(DownloadTask task, CancellationToken token, ProgressListener listener) {
        if (task.getId() == null) {
            task.setId(UUID.randomUUID().toString());
        }

        MDC.put("taskId", task.getId());
        activeDownloads.put(task.getId(), token);

        ProgressAggregator progress = new ProgressAggregator(task.getId(), task.getUrl());
        progress.subscribe(listener);

        String threadName = Thread.currentThread().getName();
        log.info("Starting download: taskId={}, thread={}, url={}", task.getId(), threadName, task.getUrl());
        task.markAsStarted(threadName);
        metricsService.incrementTasksStarted();

        long startNanos = System.nanoTime();
        try {
            TaskResult result = execute(task, token, progress, startNanos);
            metricsService.recordBytesTransferred(progress.getNetworkBytes());
            metricsService.recordDownloadTime(result.getDuration());
            if (result.isSuccess()) {
                metricsService.incrementTasksCompleted();
            } else {
                metricsService.incrementTasksFailed();
            }
            return result;
        } finally {
            progress.stop();
            activeDownloads.remove(task.getId());
            MDC.remove("taskId");
        }
    }

    /**
     * Requests cooperative cancellation of a running task.
     *
     * @return {@code false} if no task with this id is running
     */
    public boolean cancel(String taskId) {
        CancellationToken token = activeDownloads.get(taskId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling download: taskId={}", taskId);
        token.cancel();
        return true;
    }

    private TaskResult execute(DownloadTask task, CancellationToken token, ProgressAggregator progress, long startNanos) {
        Transfer transfer = null;
        Path reservedPath = null;
        try {
            if (shuttingDown.get()) {
                throw DownloadException.cancelled("Download service is shutting down");
            }

            ProbeResult probe = rangeResolver.probe(task.getUrl(), task.getHeaders(), token);
            reservedPath = nameResolver.resolve(task, probe);
            task.setDestinationPath(reservedPath);
            checkSizeLimit(task, probe);
            createParentDirectories(task.getDestinationPath());

            transfer = transferWithFallbacks(task, probe, token, progress);

            Boolean verified = null;
            ExpectedChecksum expected = task.getExpectedChecksum();
            if (expected != null) {
                task.setState(TaskState.VERIFYING);
                verified = verify(task, transfer, expected);
                if (!verified) {
                    return checksumMismatch(task, transfer, progress, startNanos);
                }
            }

            if (transfer.resumeKey() != null) {
                resumeStore.delete(transfer.resumeKey());
            }
            task.markAsDone();

            TaskResult result = baseResult(task, progress, startNanos)
                    .status(TaskStatus.SUCCESS)
                    .fileSize(transfer.fileSize())
                    .checksumVerified(verified)
                    .resumed(transfer.resumed())
                    .build();
            log.info("Download completed: taskId={}, file={}, size={} bytes, transferred={} bytes, duration={} ms",
                    task.getId(), task.getDestinationPath(), transfer.fileSize(), result.getBytesTransferred(),
                    result.getDuration().toMillis());
            return result;

        } catch (DownloadException e) {
            task.markAsFailed();
            TaskStatus status = e.getKind() == ErrorKind.CANCELLED ? TaskStatus.ABORTED : TaskStatus.FAILED;
            if (status == TaskStatus.ABORTED) {
                log.warn("Download aborted: taskId={}, reason={}", task.getId(), e.getMessage());
            } else {
                log.error("Download failed: taskId={}, kind={}, error={}", task.getId(), e.getKind(), e.getMessage());
            }
            return baseResult(task, progress, startNanos)
                    .status(status)
                    .error(e.getKind())
                    .errorMessage(e.getMessage())
                    .resumed(transfer != null && transfer.resumed())
                    .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.markAsFailed();
            log.warn("Download interrupted: taskId={}", task.getId());
            return baseResult(task, progress, startNanos)
                    .status(TaskStatus.ABORTED)
                    .error(ErrorKind.CANCELLED)
                    .errorMessage("Interrupted")
                    .build();

        } catch (RuntimeException e) {
            task.markAsFailed();
            log.error("Unexpected error during download: taskId={}", task.getId(), e);
            return baseResult(task, progress, startNanos)
                    .status(TaskStatus.FAILED)
                    .error(ErrorKind.DISK)
                    .errorMessage(e.getMessage())
                    .build();
        } finally {
            if (reservedPath != null) {
                nameResolver.release(reservedPath);
            }
        }
    }

    private Transfer transferWithFallbacks(DownloadTask task, ProbeResult probe, CancellationToken token,
                                           ProgressAggregator progress) throws DownloadException, InterruptedException {
        ProbeResult current = probe;
        boolean singleStreamFallback = false;
        boolean reResolved = false;

        while (true) {
            try {
                return transfer(task, current, token, progress);
            } catch (DownloadException e) {
                if (e.getKind() == ErrorKind.RANGE_UNSUPPORTED && !singleStreamFallback) {
                    log.warn("Server ignored a range request for {}, restarting as a single stream", task.getUrl());
                    discardResumeRecord(task);
                    current = current.withoutRangeSupport();
                    singleStreamFallback = true;
                } else if (e.isRangeNotSatisfiable() && !reResolved) {
                    log.warn("Range not satisfiable for {}, resolving the resource size again", task.getUrl());
                    discardResumeRecord(task);
                    current = rangeResolver.probe(task.getUrl(), task.getHeaders(), token);
                    if (singleStreamFallback) {
                        current = current.withoutRangeSupport();
                    }
                    checkSizeLimit(task, current);
                    reResolved = true;
                } else {
                    throw e;
                }
            }
        }
    }

    private Transfer transfer(DownloadTask task, ProbeResult probe, CancellationToken token,
                              ProgressAggregator progress) throws DownloadException, InterruptedException {
        task.setState(TaskState.PLANNING);
        task.setExpectedSize(probe.getSize());
        task.setSupportsRange(probe.isSupportsRange());

        String url = task.getUrl();
        Path destination = task.getDestinationPath();
        Long size = probe.getSize();
        int requestedWorkers = Math.max(1, task.getWorkerCount());
        boolean multiPart = probe.isSupportsRange() && size != null && requestedWorkers > 1;

        List<Chunk> planned = multiPart ? chunkPlanner.plan(size, requestedWorkers) : chunkPlanner.singleStream(size);
        String resumeKey = size != null ? ResumeStore.recordKey(url, destination) : null;
        ChecksumAlgorithm algorithm = task.getExpectedChecksum() != null ? task.getExpectedChecksum().getAlgorithm() : null;

        List<Chunk> chunks = planned;
        boolean resumed = false;
        if (resumeKey != null) {
            Optional<ResumeRecord> existing = resumeStore.load(url, destination);
            if (existing.isPresent() && task.isResume()) {
                Optional<String> incompatibility = checkCompatibility(existing.get(), probe, requestedWorkers, planned, destination);
                if (incompatibility.isEmpty()) {
                    chunks = prepareResumedChunks(existing.get().getChunks());
                    resumed = true;
                    log.info("Resuming {}: {} of {} bytes already on disk", destination,
                            existing.get().totalBytesWritten(), size);
                } else {
                    log.warn("Resume record for {} not usable [{}]: {}, starting from scratch",
                            destination, ErrorKind.RESUME_INCOMPATIBLE, incompatibility.get());
                }
            } else if (existing.isPresent()) {
                log.info("Resume not requested, discarding existing record for {}", destination);
            }
            if (!resumed) {
                resumeStore.create(url, destination, size, algorithm, requestedWorkers, planned);
            }
        }

        log.info("Plan for {}: size={}, chunks={}, rangeRequests={}, resumed={}",
                destination, size, chunks.size(), probe.isSupportsRange(), resumed);

        try {
            return stream(task, probe, chunks, resumeKey, resumed, multiPart, token, progress);
        } catch (DownloadException e) {
            if (e.getKind() == ErrorKind.SIZE_LIMIT_EXCEEDED) {
                discardOutput(destination, resumeKey);
            }
            throw e;
        }
    }

    private Transfer stream(DownloadTask task, ProbeResult probe, List<Chunk> chunks, String resumeKey, boolean resumed,
                            boolean multiPart, CancellationToken token, ProgressAggregator progress)
            throws DownloadException, InterruptedException {
        Path destination = task.getDestinationPath();
        Long size = probe.getSize();
        long alreadyWritten = chunks.stream().mapToLong(Chunk::getBytesWritten).sum();

        ChecksumVerifier.StreamingDigest digest = null;
        if (task.getExpectedChecksum() != null && !multiPart) {
            digest = checksumVerifier.newStreamingDigest(task.getExpectedChecksum().getAlgorithm());
            if (alreadyWritten > 0) {
                digest.invalidate();
            }
        }

        try (RandomAccessFile file = openDestination(destination, resumed, multiPart ? size : 0L)) {
            TransferContext context = TransferContext.builder()
                    .taskId(task.getId())
                    .url(task.getUrl())
                    .headers(task.getHeaders())
                    .channel(file.getChannel())
                    .rangeRequests(probe.isSupportsRange())
                    .totalSize(size)
                    .maxSize(task.getMaxSize())
                    .resumeKey(resumeKey)
                    .digest(digest)
                    .progress(progress)
                    .token(token)
                    .connector(connector)
                    .backoffPolicy(backoffPolicy)
                    .resumeStore(resumeStore)
                    .metrics(metricsService)
                    .properties(properties)
                    .build();

            task.setState(TaskState.TRANSFERRING);
            progress.reset(size, alreadyWritten);
            progress.start(progressScheduler, properties.getProgressInterval());

            workerPool.run(context, chunks, chunks.size());

            long fileSize = size != null ? size : chunks.get(0).getBytesWritten();
            if (size == null) {
                file.getChannel().truncate(fileSize);
            }
            return new Transfer(resumeKey, digest, fileSize, resumed);
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.DISK, "Cannot use " + destination + ": " + e.getMessage(), e);
        }
    }

    private RandomAccessFile openDestination(Path destination, boolean resumed, long preallocate) throws IOException {
        RandomAccessFile file = new RandomAccessFile(destination.toFile(), "rw");
        try {
            if (!resumed) {
                file.setLength(0);
                file.setLength(preallocate);
            }
            return file;
        } catch (IOException e) {
            file.close();
            throw e;
        }
    }

    private Optional<String> checkCompatibility(ResumeRecord record, ProbeResult probe, int requestedWorkers,
                                                List<Chunk> planned, Path destination) {
        if (record.getExpectedSize() == null || !record.getExpectedSize().equals(probe.getSize())) {
            return Optional.of("size changed from " + record.getExpectedSize() + " to " + probe.getSize());
        }
        if (record.getWorkerCount() != requestedWorkers) {
            return Optional.of("worker count changed from " + record.getWorkerCount() + " to " + requestedWorkers);
        }
        if (!chunkPlanner.matches(record.getChunks(), planned)) {
            return Optional.of("chunk plan differs");
        }
        for (Chunk chunk : record.getChunks()) {
            if (chunk.getBytesWritten() < 0 || chunk.getBytesWritten() > chunk.length()) {
                return Optional.of("chunk " + chunk.getId() + " records an impossible offset");
            }
        }
        if (record.totalBytesWritten() > 0 && !probe.isSupportsRange()) {
            return Optional.of("server no longer supports range requests");
        }
        try {
            if (!Files.isRegularFile(destination) || Files.size(destination) < record.highestWrittenOffset()) {
                return Optional.of("destination file is missing or shorter than the recorded progress");
            }
        } catch (IOException e) {
            return Optional.of("destination file unreadable: " + e.getMessage());
        }
        return Optional.empty();
    }

    private List<Chunk> prepareResumedChunks(List<Chunk> persisted) {
        persisted.forEach(chunk -> {
            if (chunk.getStatus() != ChunkStatus.COMPLETE) {
                chunk.setStatus(ChunkStatus.PENDING);
            }
        });
        return persisted;
    }

    private boolean verify(DownloadTask task, Transfer transfer, ExpectedChecksum expected) throws DownloadException {
        ChecksumVerifier.StreamingDigest digest = transfer.digest();
        String actual = digest != null && digest.isValid() && digest.getPosition() == transfer.fileSize()
                ? digest.hex()
                : checksumVerifier.digestFile(task.getDestinationPath(), expected.getAlgorithm());

        boolean matches = expected.matches(actual);
        if (matches) {
            log.info("Checksum verified: taskId={}, {}={}", task.getId(), expected.getAlgorithm().getJcaName(), actual);
        } else {
            log.error("Checksum mismatch: taskId={}, expected={}, actual={}", task.getId(), expected.getHexDigest(), actual);
        }
        return matches;
    }

    private TaskResult checksumMismatch(DownloadTask task, Transfer transfer, ProgressAggregator progress, long startNanos) {
        if (transfer.resumeKey() != null) {
            resumeStore.delete(transfer.resumeKey());
        }

        if (task.isDeleteOnMismatch() || properties.isDeleteOnMismatch()) {
            try {
                Files.deleteIfExists(task.getDestinationPath());
                log.info("Deleted {} after checksum mismatch", task.getDestinationPath());
            } catch (IOException e) {
                log.warn("Cannot delete {} after checksum mismatch: {}", task.getDestinationPath(), e.getMessage());
            }
        }

        task.markAsFailed();
        return baseResult(task, progress, startNanos)
                .status(TaskStatus.FAILED)
                .fileSize(transfer.fileSize())
                .error(ErrorKind.CHECKSUM_MISMATCH)
                .errorMessage("Checksum mismatch for " + task.getDestinationPath())
                .checksumVerified(false)
                .resumed(transfer.resumed())
                .build();
    }

    private void checkSizeLimit(DownloadTask task, ProbeResult probe) throws DownloadException {
        if (task.getMaxSize() != null && probe.hasKnownSize() && probe.getSize() > task.getMaxSize()) {
            throw new DownloadException(ErrorKind.SIZE_LIMIT_EXCEEDED,
                    "Size " + probe.getSize() + " exceeds the limit of " + task.getMaxSize() + " bytes");
        }
    }

    private void createParentDirectories(Path destination) throws DownloadException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.info("Created download directory: {}", parent);
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.DISK, "Cannot create directory " + parent + ": " + e.getMessage(), e);
        }
    }

    private void discardResumeRecord(DownloadTask task) {
        resumeStore.delete(ResumeStore.recordKey(task.getUrl(), task.getDestinationPath()));
    }

    private void discardOutput(Path destination, String resumeKey) {
        if (resumeKey != null) {
            resumeStore.delete(resumeKey);
        }
        try {
            Files.deleteIfExists(destination);
        } catch (IOException e) {
            log.warn("Cannot delete partial output {}: {}", destination, e.getMessage());
        }
    }

    private TaskResult.TaskResultBuilder baseResult(DownloadTask task, ProgressAggregator progress, long startNanos) {
        return TaskResult.builder()
                .taskId(task.getId())
                .url(task.getUrl())
                .destinationPath(task.getDestinationPath())
                .bytesTransferred(progress.getNetworkBytes())
                .duration(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void shutdown() {
        log.info("Shutting down download service");

        shuttingDown.set(true);
        activeDownloads.values().forEach(CancellationToken::cancel);

        downloadExecutor.shutdown();
        chunkExecutor.shutdown();
        progressScheduler.shutdown();

        try {
            if (!downloadExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Forcing download threads to stop");
                downloadExecutor.shutdownNow();
            }

            if (!chunkExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Forcing chunk threads to stop");
                chunkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for download threads", e);
            downloadExecutor.shutdownNow();
            chunkExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Download service stopped");
    }

    private record Transfer(String resumeKey, ChecksumVerifier.StreamingDigest digest, long fileSize, boolean resumed) {
    }
}
