package com.onyx.downloader.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

@Value
@Builder
public class TaskResult {
    String taskId;
    String url;
    Path destinationPath;
    TaskStatus status;
    long bytesTransferred;
    long fileSize;
    Duration duration;
    ErrorKind error;
    String errorMessage;
    Boolean checksumVerified;
    boolean resumed;

    public boolean isSuccess() {
        return status == TaskStatus.SUCCESS;
    }

    public static TaskResult aborted(DownloadTask task, String reason) {
        return TaskResult.builder()
                .taskId(task.getId())
                .url(task.getUrl())
                .destinationPath(task.getDestinationPath())
                .status(TaskStatus.ABORTED)
                .duration(Duration.ZERO)
                .error(ErrorKind.CANCELLED)
                .errorMessage(reason)
                .build();
    }
}
