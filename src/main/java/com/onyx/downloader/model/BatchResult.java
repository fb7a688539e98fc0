package com.onyx.downloader.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class BatchResult {
    BatchStatus status;
    List<TaskResult> results;
    int succeeded;
    int failed;
    int aborted;
    Duration duration;
    int peakConcurrency;

    public boolean isAllSucceeded() {
        return succeeded == results.size();
    }
}
