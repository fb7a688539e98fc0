package com.onyx.downloader.repository;

import com.onyx.downloader.entity.ResumeRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ResumeRecordRepository extends JpaRepository<ResumeRecordEntity, String> {
}
