package com.onyx.downloader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One contiguous byte range {@code [startOffset, endOffset)} of a task. An {@code endOffset} of
 * {@link #UNKNOWN_END} marks the open-ended chunk of a single stream whose size the server did not declare.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chunk {

    public static final long UNKNOWN_END = -1L;

    private int id;
    private long startOffset;
    private long endOffset;
    private volatile long bytesWritten;
    private volatile ChunkStatus status;
    private int attemptCount;

    public static Chunk of(int id, long startOffset, long endOffset) {
        return Chunk.builder()
                .id(id)
                .startOffset(startOffset)
                .endOffset(endOffset)
                .bytesWritten(0L)
                .status(ChunkStatus.PENDING)
                .attemptCount(0)
                .build();
    }

    public boolean isOpenEnded() {
        return endOffset == UNKNOWN_END;
    }

    public long length() {
        return isOpenEnded() ? UNKNOWN_END : endOffset - startOffset;
    }

    public long nextOffset() {
        return startOffset + bytesWritten;
    }

    public long remaining() {
        return isOpenEnded() ? UNKNOWN_END : endOffset - nextOffset();
    }

    public boolean isComplete() {
        return status == ChunkStatus.COMPLETE;
    }

    public boolean hasSameBounds(Chunk other) {
        return id == other.id && startOffset == other.startOffset && endOffset == other.endOffset;
    }
}
