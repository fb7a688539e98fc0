package com.onyx.downloader.config;

import com.onyx.downloader.service.DownloadService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class GracefulShutdownConfig {

    private final DownloadService downloadService;

    @PreDestroy
    public void onShutdown() {
        log.info("Starting graceful shutdown");

        try {
            downloadService.shutdown();
            log.info("Graceful shutdown finished");
        } catch (Exception e) {
            log.error("Graceful shutdown failed", e);
        }
    }
}
