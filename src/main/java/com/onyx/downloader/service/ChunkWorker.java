package com.onyx.downloader.service;

import com.onyx.downloader.exception.DownloadException;
import com.onyx.downloader.model.Chunk;
import com.onyx.downloader.model.ChunkStatus;
import com.onyx.downloader.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streams one chunk into its offset of the destination file, retrying transient failures.
 * A retry or a resume asks only for {@code [start + bytesWritten, end)}.
 */
@Slf4j
class ChunkWorker {

    private static final int HTTP_PARTIAL_CONTENT = 206;
    private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;
    private static final Pattern CONTENT_RANGE =
            Pattern.compile("bytes\\s+(\\d+)-(\\d+)/(\\d+|\\*)", Pattern.CASE_INSENSITIVE);

    private final TransferContext context;
    private final Chunk chunk;

    private final long persistThresholdBytes;
    private final long persistIntervalNanos;
    private long bytesSinceLastPersist;
    private long lastPersistNanos = System.nanoTime();

    ChunkWorker(TransferContext context, Chunk chunk) {
        this.context = context;
        this.chunk = chunk;
        this.persistThresholdBytes = context.getProperties().getPersistThreshold().toBytes();
        this.persistIntervalNanos = context.getProperties().getPersistInterval().toNanos();
    }

    Chunk call() throws DownloadException, InterruptedException {
        int maxAttempts = context.getProperties().getMaxAttempts();

        for (int attempt = 1; ; attempt++) {
            if (context.getToken().isCancelled()) {
                throw stopCancelled();
            }

            chunk.setAttemptCount(chunk.getAttemptCount() + 1);
            try {
                transfer();
                chunk.setStatus(ChunkStatus.COMPLETE);
                persist();
                log.debug("Chunk {} of task {} complete: {} bytes", chunk.getId(), context.getTaskId(), chunk.getBytesWritten());
                return chunk;
            } catch (DownloadException e) {
                if (e.getKind() == ErrorKind.CANCELLED) {
                    throw stopCancelled();
                }
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    chunk.setStatus(ChunkStatus.FAILED);
                    persist();
                    log.warn("Chunk {} of task {} failed after {} attempt(s): {}",
                            chunk.getId(), context.getTaskId(), attempt, e.getMessage());
                    throw e;
                }

                chunk.setStatus(ChunkStatus.PENDING);
                persist();
                log.warn("Chunk {} of task {} failed on attempt {}/{} at offset {}: {}",
                        chunk.getId(), context.getTaskId(), attempt, maxAttempts, chunk.nextOffset(), e.getMessage());
                context.getMetrics().incrementChunkRetries();

                if (!context.getBackoffPolicy().waitForRetry(attempt, context.getToken())) {
                    throw stopCancelled();
                }
            }
        }
    }

    private void transfer() throws DownloadException {
        if (!chunk.isOpenEnded() && chunk.remaining() <= 0) {
            return;
        }
        if (chunk.getBytesWritten() > 0 && !context.isRangeRequests()) {
            restartFromBeginning();
        }

        long offset = chunk.nextOffset();
        boolean ranged = context.isRangeRequests() && (offset > 0 || !coversWholeResource());

        Map<String, String> headers = new LinkedHashMap<>(context.getHeaders());
        if (ranged) {
            headers.put("Range", "bytes=" + offset + "-" + (chunk.isOpenEnded() ? "" : chunk.getEndOffset() - 1));
        }

        chunk.setStatus(ChunkStatus.CONNECTING);
        HttpConnector connector = context.getConnector();
        HttpURLConnection connection = connector.open(context.getUrl(), "GET", headers);
        try {
            int status = connector.connect(connection);
            connector.ensureSuccess(status, context.getUrl());

            if (ranged && status != HTTP_PARTIAL_CONTENT) {
                throw new DownloadException(ErrorKind.RANGE_UNSUPPORTED,
                        "Server answered HTTP " + status + " to a ranged request for " + context.getUrl(), status, null);
            }
            if (ranged) {
                checkContentRange(connection.getHeaderField("Content-Range"), offset, status);
            } else {
                checkDeclaredLength(connection.getContentLengthLong());
            }

            chunk.setStatus(ChunkStatus.STREAMING);
            try (InputStream in = connection.getInputStream()) {
                stream(in, offset);
            } catch (IOException e) {
                throw new DownloadException(ErrorKind.NETWORK, "Stream error for " + context.getUrl() + ": " + e.getMessage(), e);
            }
        } finally {
            connection.disconnect();
        }
    }

    private void stream(InputStream in, long offset) throws DownloadException {
        byte[] buffer = new byte[(int) context.getProperties().getBufferSize().toBytes()];
        long position = offset;
        long limit = chunk.isOpenEnded() ? Long.MAX_VALUE : chunk.getEndOffset();
        Long maxSize = context.getMaxSize();

        while (position < limit) {
            if (context.getToken().isCancelled()) {
                throw DownloadException.cancelled("Chunk " + chunk.getId() + " cancelled at offset " + position);
            }

            int read;
            try {
                read = in.read(buffer, 0, (int) Math.min(buffer.length, limit - position));
            } catch (SocketTimeoutException e) {
                throw new DownloadException(ErrorKind.NETWORK, "Idle timeout at offset " + position, e);
            } catch (IOException e) {
                throw new DownloadException(ErrorKind.NETWORK, "Read failed at offset " + position + ": " + e.getMessage(), e);
            }
            if (read < 0) {
                break;
            }
            if (maxSize != null && position + read > maxSize) {
                throw new DownloadException(ErrorKind.SIZE_LIMIT_EXCEEDED,
                        "Stream exceeds the size limit of " + maxSize + " bytes");
            }

            write(buffer, read, position);
            if (context.getDigest() != null) {
                context.getDigest().update(position, buffer, read);
            }
            position += read;
            chunk.setBytesWritten(position - chunk.getStartOffset());
            context.getProgress().recordWritten(read);

            bytesSinceLastPersist += read;
            if (bytesSinceLastPersist >= persistThresholdBytes || System.nanoTime() - lastPersistNanos >= persistIntervalNanos) {
                persist();
            }
        }

        if (!chunk.isOpenEnded() && position < limit) {
            throw new DownloadException(ErrorKind.NETWORK,
                    "Connection closed at offset " + position + ", expected data up to " + limit);
        }
    }

    private void write(byte[] buffer, int length, long position) throws DownloadException {
        ByteBuffer source = ByteBuffer.wrap(buffer, 0, length);
        long target = position;
        try {
            while (source.hasRemaining()) {
                target += context.getChannel().write(source, target);
            }
        } catch (ClosedChannelException e) {
            throw DownloadException.cancelled("Destination closed while writing chunk " + chunk.getId());
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.DISK, "Write failed at offset " + position + ": " + e.getMessage(), e);
        }
    }

    /**
     * A partial response must start at the requested offset and describe the resource that was planned.
     * A different total means the resource changed, which is handled like a 416 and re-resolved.
     */
    private void checkContentRange(String contentRange, long offset, int status) throws DownloadException {
        Matcher matcher = contentRange != null ? CONTENT_RANGE.matcher(contentRange.trim()) : null;
        if (matcher == null || !matcher.matches()) {
            throw new DownloadException(ErrorKind.RANGE_UNSUPPORTED,
                    "Missing or malformed Content-Range '" + contentRange + "' for " + context.getUrl(), status, null);
        }

        long start = Long.parseLong(matcher.group(1));
        if (start != offset) {
            throw new DownloadException(ErrorKind.RANGE_UNSUPPORTED,
                    "Server sent bytes from " + start + " when " + offset + " was requested", status, null);
        }

        String total = matcher.group(3);
        Long expectedTotal = context.getTotalSize();
        if (expectedTotal != null && !total.equals("*") && Long.parseLong(total) != expectedTotal) {
            throw new DownloadException(ErrorKind.HTTP_CLIENT,
                    "Resource size changed from " + expectedTotal + " to " + total + " for " + context.getUrl(),
                    HTTP_RANGE_NOT_SATISFIABLE, null);
        }
    }

    private void checkDeclaredLength(long declaredLength) throws DownloadException {
        Long maxSize = context.getMaxSize();
        if (maxSize != null && declaredLength > maxSize) {
            throw new DownloadException(ErrorKind.SIZE_LIMIT_EXCEEDED,
                    "Declared length " + declaredLength + " exceeds the size limit of " + maxSize + " bytes");
        }
    }

    private void restartFromBeginning() throws DownloadException {
        log.info("Restarting chunk {} of task {} from offset {}: ranges unavailable",
                chunk.getId(), context.getTaskId(), chunk.getStartOffset());
        context.getProgress().discardWritten(chunk.getBytesWritten());
        chunk.setBytesWritten(0);
        if (context.getDigest() != null) {
            context.getDigest().reset();
        }
        try {
            context.getChannel().truncate(chunk.getStartOffset());
        } catch (IOException e) {
            throw new DownloadException(ErrorKind.DISK, "Cannot truncate destination: " + e.getMessage(), e);
        }
    }

    private boolean coversWholeResource() {
        if (chunk.getStartOffset() != 0) {
            return false;
        }
        return chunk.isOpenEnded() || (context.getTotalSize() != null && chunk.getEndOffset() == context.getTotalSize());
    }

    private DownloadException stopCancelled() {
        chunk.setStatus(ChunkStatus.PENDING);
        persist();
        return DownloadException.cancelled("Chunk " + chunk.getId() + " of task " + context.getTaskId() + " cancelled");
    }

    private void persist() {
        bytesSinceLastPersist = 0;
        lastPersistNanos = System.nanoTime();
        if (!context.isPersistent()) {
            return;
        }
        try {
            context.getResumeStore().updateProgress(context.getResumeKey(), chunk);
        } catch (DataAccessException e) {
            // A record that lags behind the file still only describes valid bytes.
            log.warn("Cannot persist progress of chunk {} of task {}: {}", chunk.getId(), context.getTaskId(), e.getMessage());
        }
    }
}
