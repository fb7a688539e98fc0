package com.onyx.downloader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchJob {
    @Builder.Default
    private List<DownloadTask> tasks = new ArrayList<>();
    private int concurrencyLimit;
    private boolean continueOnError;
    @Builder.Default
    private List<TaskResult> results = new ArrayList<>();
}
