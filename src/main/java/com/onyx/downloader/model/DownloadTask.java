package com.onyx.downloader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadTask {
    private String id;
    private String url;
    private Path destinationPath;
    private Path outputDirectory;
    private Long expectedSize;
    private boolean supportsRange;
    private ExpectedChecksum expectedChecksum;
    private int workerCount;
    private Long maxSize;
    @Builder.Default
    private boolean resume = true;
    private boolean overwrite;
    private boolean deleteOnMismatch;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    private TaskState state;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String threadName;

    public static DownloadTask create(String url, Path destinationPath, int workerCount) {
        return DownloadTask.builder()
                .id(UUID.randomUUID().toString())
                .url(url)
                .destinationPath(destinationPath)
                .workerCount(workerCount)
                .state(TaskState.PENDING)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public void markAsStarted(String threadName) {
        this.state = TaskState.PLANNING;
        this.startedAt = LocalDateTime.now();
        this.threadName = threadName;
    }

    public void markAsDone() {
        this.state = TaskState.DONE;
        this.completedAt = LocalDateTime.now();
    }

    public void markAsFailed() {
        this.state = TaskState.FAILED;
        this.completedAt = LocalDateTime.now();
    }
}
