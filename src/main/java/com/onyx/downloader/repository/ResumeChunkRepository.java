package com.onyx.downloader.repository;

import com.onyx.downloader.entity.ResumeChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ResumeChunkRepository extends JpaRepository<ResumeChunkEntity, Long> {
    List<ResumeChunkEntity> findByRecordKeyOrderByChunkIndex(String recordKey);
    Optional<ResumeChunkEntity> findByRecordKeyAndChunkIndex(String recordKey, Integer chunkIndex);
    void deleteByRecordKey(String recordKey);
}
