package com.onyx.downloader.service;

import com.onyx.downloader.config.DownloadProperties;
import lombok.Builder;
import lombok.Value;

import java.nio.channels.FileChannel;
import java.util.Map;

/**
 * Everything the workers of one task share: the open destination channel, the resume record key,
 * the task's progress aggregator and cancellation token, and the collaborators they call.
 */
@Value
@Builder(toBuilder = true)
public class TransferContext {
    String taskId;
    String url;
    Map<String, String> headers;
    FileChannel channel;
    boolean rangeRequests;
    Long totalSize;
    Long maxSize;
    String resumeKey;
    ChecksumVerifier.StreamingDigest digest;
    ProgressAggregator progress;
    CancellationToken token;

    HttpConnector connector;
    BackoffPolicy backoffPolicy;
    ResumeStore resumeStore;
    MetricsService metrics;
    DownloadProperties properties;

    public boolean isPersistent() {
        return resumeKey != null;
    }
}
