package com.onyx.downloader.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of a task's persisted chunk progress.
 */
@Value
@Builder
public class ResumeRecord {
    String key;
    String url;
    String destinationPath;
    Long expectedSize;
    ChecksumAlgorithm checksumAlgorithm;
    int workerCount;
    List<Chunk> chunks;

    public long totalBytesWritten() {
        return chunks.stream().mapToLong(Chunk::getBytesWritten).sum();
    }

    public long highestWrittenOffset() {
        return chunks.stream()
                .filter(chunk -> chunk.getBytesWritten() > 0)
                .mapToLong(Chunk::nextOffset)
                .max()
                .orElse(0L);
    }
}
