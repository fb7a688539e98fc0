package com.onyx.downloader.entity;

import com.onyx.downloader.model.ChecksumAlgorithm;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "resume_records")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResumeRecordEntity {

    @Id
    @Column(name = "record_key", length = 64, nullable = false)
    private String key;

    @Column(name = "url", nullable = false, length = 2000)
    private String url;

    @Column(name = "destination_path", nullable = false, length = 1000)
    private String destinationPath;

    @Column(name = "expected_size")
    private Long expectedSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "checksum_algorithm", length = 20)
    private ChecksumAlgorithm checksumAlgorithm;

    @Column(name = "worker_count", nullable = false)
    private Integer workerCount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
