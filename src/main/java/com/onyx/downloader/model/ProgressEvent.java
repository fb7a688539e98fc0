package com.onyx.downloader.model;

import lombok.Value;

import java.time.Instant;

@Value
public class ProgressEvent {
    String taskId;
    String url;
    long bytesTransferred;
    Long totalBytes;
    int activeWorkers;
    Instant timestamp;

    public double getPercentage() {
        return totalBytes != null && totalBytes > 0 ? (double) bytesTransferred / totalBytes * 100 : 0;
    }
}
