package com.onyx.downloader.service;

import com.onyx.downloader.entity.ResumeChunkEntity;
import com.onyx.downloader.entity.ResumeRecordEntity;
import com.onyx.downloader.model.ChecksumAlgorithm;
import com.onyx.downloader.model.Chunk;
import com.onyx.downloader.model.ChunkStatus;
import com.onyx.downloader.model.ResumeRecord;
import com.onyx.downloader.repository.ResumeChunkRepository;
import com.onyx.downloader.repository.ResumeRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Durable chunk progress of unfinished downloads, keyed by {@code (url, destination)}.
 * <p>
 * All writes go through one lock. Progress updates are merged monotonically: {@code bytesWritten} and
 * {@code attemptCount} never decrease and a {@link ChunkStatus#COMPLETE} chunk stays complete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResumeStore {

    private final ResumeRecordRepository recordRepository;
    private final ResumeChunkRepository chunkRepository;

    private final ReentrantLock writeLock = new ReentrantLock();

    public static String recordKey(String url, Path destination) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String identity = url + "\n" + destination.toAbsolutePath().normalize();
            return HexFormat.of().formatHex(digest.digest(identity.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<ResumeRecord> load(String url, Path destination) {
        String key = recordKey(url, destination);
        return recordRepository.findById(key)
                .map(entity -> mapToDomain(entity, chunkRepository.findByRecordKeyOrderByChunkIndex(key)));
    }

    public boolean exists(String url, Path destination) {
        return recordRepository.existsById(recordKey(url, destination));
    }

    /**
     * Replaces any record for the same {@code (url, destination)} with a fresh plan.
     */
    @Transactional
    public ResumeRecord create(String url, Path destination, Long expectedSize,
                               ChecksumAlgorithm checksumAlgorithm, int workerCount, List<Chunk> chunks) {
        String key = recordKey(url, destination);
        writeLock.lock();
        try {
            chunkRepository.deleteByRecordKey(key);
            recordRepository.deleteById(key);
            recordRepository.flush();

            LocalDateTime now = LocalDateTime.now();
            ResumeRecordEntity entity = ResumeRecordEntity.builder()
                    .key(key)
                    .url(url)
                    .destinationPath(destination.toAbsolutePath().normalize().toString())
                    .expectedSize(expectedSize)
                    .checksumAlgorithm(checksumAlgorithm)
                    .workerCount(workerCount)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            recordRepository.save(entity);

            List<ResumeChunkEntity> chunkEntities = chunks.stream()
                    .map(chunk -> ResumeChunkEntity.builder()
                            .recordKey(key)
                            .chunkIndex(chunk.getId())
                            .startOffset(chunk.getStartOffset())
                            .endOffset(chunk.getEndOffset())
                            .bytesWritten(chunk.getBytesWritten())
                            .status(chunk.getStatus())
                            .attemptCount(chunk.getAttemptCount())
                            .updatedAt(now)
                            .build())
                    .collect(Collectors.toList());
            chunkRepository.saveAll(chunkEntities);

            log.debug("Created resume record: key={}, chunks={}, size={}", key, chunks.size(), expectedSize);
            return mapToDomain(entity, chunkEntities);
        } finally {
            writeLock.unlock();
        }
    }

    public void updateProgress(String key, Chunk chunk) {
        writeLock.lock();
        try {
            Optional<ResumeChunkEntity> found = chunkRepository.findByRecordKeyAndChunkIndex(key, chunk.getId());
            if (found.isEmpty()) {
                log.warn("Progress update for unknown chunk ignored: key={}, chunk={}", key, chunk.getId());
                return;
            }

            ResumeChunkEntity entity = found.get();
            entity.setBytesWritten(Math.max(entity.getBytesWritten(), chunk.getBytesWritten()));
            entity.setAttemptCount(Math.max(entity.getAttemptCount(), chunk.getAttemptCount()));
            if (entity.getStatus() != ChunkStatus.COMPLETE) {
                entity.setStatus(chunk.getStatus());
            }
            entity.setUpdatedAt(LocalDateTime.now());
            chunkRepository.save(entity);

            log.debug("Persisted chunk progress: key={}, chunk={}, bytesWritten={}, status={}",
                    key, chunk.getId(), entity.getBytesWritten(), entity.getStatus());
        } finally {
            writeLock.unlock();
        }
    }

    @Transactional
    public void delete(String key) {
        writeLock.lock();
        try {
            chunkRepository.deleteByRecordKey(key);
            if (recordRepository.existsById(key)) {
                recordRepository.deleteById(key);
                log.debug("Deleted resume record: key={}", key);
            }
        } finally {
            writeLock.unlock();
        }
    }

    private ResumeRecord mapToDomain(ResumeRecordEntity entity, List<ResumeChunkEntity> chunks) {
        return ResumeRecord.builder()
                .key(entity.getKey())
                .url(entity.getUrl())
                .destinationPath(entity.getDestinationPath())
                .expectedSize(entity.getExpectedSize())
                .checksumAlgorithm(entity.getChecksumAlgorithm())
                .workerCount(entity.getWorkerCount())
                .chunks(chunks.stream()
                        .map(chunk -> Chunk.builder()
                                .id(chunk.getChunkIndex())
                                .startOffset(chunk.getStartOffset())
                                .endOffset(chunk.getEndOffset())
                                .bytesWritten(chunk.getBytesWritten())
                                .status(chunk.getStatus())
                                .attemptCount(chunk.getAttemptCount())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
