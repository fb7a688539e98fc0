package com.onyx.downloader.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.onyx.downloader.model.ErrorKind;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaskSummary {
    private String taskId;
    private String url;
    private String filename;
    private TaskStatus status;
    private Long fileSizeBytes;
    private long bytesTransferred;
    private double durationSeconds;
    private Double downloadSpeedMbps;
    private ErrorKind error;
    private String errorMessage;
    private Boolean checksumVerified;
    private boolean resumed;

    public static TaskSummary from(TaskResult result) {
        double seconds = result.getDuration() != null ? result.getDuration().toMillis() / 1000.0 : 0.0;
        boolean success = result.isSuccess();

        return TaskSummary.builder()
                .taskId(result.getTaskId())
                .url(result.getUrl())
                .filename(result.getDestinationPath() != null ? result.getDestinationPath().toString() : null)
                .status(result.getStatus())
                .fileSizeBytes(success ? result.getFileSize() : null)
                .bytesTransferred(result.getBytesTransferred())
                .durationSeconds(seconds)
                .downloadSpeedMbps(success && seconds > 0
                        ? result.getBytesTransferred() / seconds / (1024.0 * 1024.0)
                        : null)
                .error(result.getError())
                .errorMessage(result.getErrorMessage())
                .checksumVerified(result.getChecksumVerified())
                .resumed(result.isResumed())
                .build();
    }
}
