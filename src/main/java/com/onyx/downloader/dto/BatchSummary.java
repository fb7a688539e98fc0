package com.onyx.downloader.dto;

import com.onyx.downloader.model.BatchResult;
import com.onyx.downloader.model.BatchStatus;
import com.onyx.downloader.model.TaskResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Batch outcome as printed by {@code download batch --format=json}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchSummary {
    private BatchStatus status;
    private int totalUrls;
    private int successful;
    private int failed;
    private int aborted;
    private long totalBytes;
    private double totalSeconds;
    private double averageBytesPerSecond;
    private int peakConcurrency;
    private List<TaskSummary> results;

    /**
     * Size, time and speed cover successful tasks only.
     */
    public static BatchSummary from(BatchResult batch) {
        List<TaskResult> successful = batch.getResults().stream().filter(TaskResult::isSuccess).toList();
        long totalBytes = successful.stream().mapToLong(TaskResult::getFileSize).sum();
        double totalSeconds = successful.stream().mapToLong(result -> result.getDuration().toMillis()).sum() / 1000.0;

        return BatchSummary.builder()
                .status(batch.getStatus())
                .totalUrls(batch.getResults().size())
                .successful(batch.getSucceeded())
                .failed(batch.getFailed())
                .aborted(batch.getAborted())
                .totalBytes(totalBytes)
                .totalSeconds(totalSeconds)
                .averageBytesPerSecond(totalSeconds > 0 ? totalBytes / totalSeconds : 0.0)
                .peakConcurrency(batch.getPeakConcurrency())
                .results(batch.getResults().stream().map(TaskSummary::from).toList())
                .build();
    }
}
