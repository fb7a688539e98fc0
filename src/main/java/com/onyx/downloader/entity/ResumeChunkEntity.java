package com.onyx.downloader.entity;

import com.onyx.downloader.model.ChunkStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "resume_chunks", indexes = {
        @Index(name = "idx_chunk_record", columnList = "record_key"),
        @Index(name = "idx_chunk_record_index", columnList = "record_key, chunk_index", unique = true)
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeChunkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_key", nullable = false, length = 64)
    private String recordKey;

    @Column(name = "chunk_index", nullable = false)
    private Integer chunkIndex;

    @Column(name = "start_offset", nullable = false)
    private Long startOffset;

    @Column(name = "end_offset", nullable = false)
    private Long endOffset;

    @Column(name = "bytes_written", nullable = false)
    private Long bytesWritten;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChunkStatus status;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
