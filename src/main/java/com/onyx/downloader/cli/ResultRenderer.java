package com.onyx.downloader.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onyx.downloader.dto.BatchSummary;
import com.onyx.downloader.dto.TaskSummary;
import com.onyx.downloader.model.BatchResult;
import com.onyx.downloader.model.ProgressEvent;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.model.TaskStatus;
import com.onyx.downloader.service.ProgressListener;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Writes command output. Results go to {@code out}, progress and failures to {@code err}.
 */
public class ResultRenderer {

    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    public ResultRenderer(ObjectMapper objectMapper, PrintStream out, PrintStream err) {
        this.objectMapper = objectMapper;
        this.out = out;
        this.err = err;
    }

    public ProgressListener progressListener() {
        return this::renderProgress;
    }

    public void renderStart(String url, String detail) {
        out.println("Downloading: " + url + (detail != null ? " (" + detail + ")" : ""));
    }

    public void renderTask(TaskResult result) {
        if (result.isSuccess()) {
            out.println("Download completed: " + result.getDestinationPath() + " (" + ByteSizes.format(result.getFileSize())
                    + " in " + seconds(result) + "s" + (result.isResumed() ? ", resumed" : "") + ")");
            if (Boolean.TRUE.equals(result.getChecksumVerified())) {
                out.println("Checksum verification passed");
            }
            return;
        }

        if (Boolean.FALSE.equals(result.getChecksumVerified())) {
            err.println("Checksum verification failed: " + result.getDestinationPath());
        }
        err.println("Download " + result.getStatus().name().toLowerCase(Locale.ROOT) + ": " + result.getUrl()
                + " [" + result.getError() + "] " + result.getErrorMessage());
    }

    public void renderBatchTable(BatchResult batch) {
        BatchSummary summary = BatchSummary.from(batch);

        out.println();
        out.println("Download summary (" + summary.getStatus() + "):");
        out.println("   Successful: " + summary.getSuccessful());
        out.println("   Failed:     " + summary.getFailed());
        if (summary.getAborted() > 0) {
            out.println("   Aborted:    " + summary.getAborted());
        }

        if (summary.getSuccessful() > 0) {
            out.println("   Total size: " + ByteSizes.format(summary.getTotalBytes()));
            out.println(String.format(Locale.ROOT, "   Total time: %.1fs", summary.getTotalSeconds()));
            out.println("   Average speed: " + ByteSizes.format(summary.getAverageBytesPerSecond()) + "/s");
        }

        boolean headerPrinted = false;
        for (TaskSummary task : summary.getResults()) {
            if (task.getStatus() == TaskStatus.SUCCESS) {
                continue;
            }
            if (!headerPrinted) {
                out.println();
                out.println("Failed downloads:");
                headerPrinted = true;
            }
            out.println("   " + task.getUrl() + " - " + task.getStatus() + " " + task.getError() + ": " + task.getErrorMessage());
        }
    }

    public void renderBatchJson(BatchResult batch) {
        try {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(BatchSummary.from(batch)));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise batch summary", e);
        }
    }

    public void renderError(String message) {
        err.println("Error: " + message);
    }

    private void renderProgress(ProgressEvent event) {
        boolean known = event.getTotalBytes() != null;
        String total = known ? ByteSizes.format(event.getTotalBytes()) : "?";
        String percent = known ? String.format(Locale.ROOT, "%5.1f%%", event.getPercentage()) : "    ?";
        err.println(percent + "  " + ByteSizes.format(event.getBytesTransferred()) + " / " + total
                + "  workers=" + event.getActiveWorkers() + "  " + event.getUrl());
    }

    private static String seconds(TaskResult result) {
        return String.format(Locale.ROOT, "%.1f", result.getDuration().toMillis() / 1000.0);
    }
}
