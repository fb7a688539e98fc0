package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.model.Chunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a resource into contiguous, non-overlapping byte ranges. The same {@code (size, workerCount)}
 * always produces the same boundaries, which is what lets a persisted plan be checked on resume.
 */
@Component
@RequiredArgsConstructor
public class ChunkPlanner {

    private final DownloadProperties properties;

    public List<Chunk> plan(long size, int workerCount) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0: " + size);
        }

        int chunkCount = effectiveWorkerCount(size, workerCount);
        long chunkSize = size / chunkCount;

        List<Chunk> chunks = new ArrayList<>(chunkCount);
        for (int i = 0; i < chunkCount; i++) {
            long start = i * chunkSize;
            long end = (i == chunkCount - 1) ? size : start + chunkSize;
            chunks.add(Chunk.of(i, start, end));
        }
        return chunks;
    }

    /**
     * One chunk covering the whole resource, open-ended when the size is unknown.
     */
    public List<Chunk> singleStream(Long size) {
        List<Chunk> chunks = new ArrayList<>(1);
        chunks.add(Chunk.of(0, 0L, size != null ? size : Chunk.UNKNOWN_END));
        return chunks;
    }

    /**
     * Never splits below the minimum chunk size: per-connection overhead would dominate.
     */
    public int effectiveWorkerCount(long size, int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1: " + workerCount);
        }
        long minChunkSize = Math.max(1L, properties.getMinChunkSize().toBytes());
        if (size < workerCount * minChunkSize) {
            return (int) Math.max(1L, size / minChunkSize);
        }
        return workerCount;
    }

    public boolean matches(List<Chunk> persisted, List<Chunk> planned) {
        if (persisted.size() != planned.size()) {
            return false;
        }
        for (int i = 0; i < planned.size(); i++) {
            if (!persisted.get(i).hasSameBounds(planned.get(i))) {
                return false;
            }
        }
        return true;
    }
}
