package com.onyx.downloader.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.model.BatchJob;
import com.onyx.downloader.model.BatchResult;
import com.onyx.downloader.model.BatchStatus;
import com.onyx.downloader.model.ChecksumAlgorithm;
import com.onyx.downloader.model.DownloadTask;
import com.onyx.downloader.model.ErrorKind;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.model.TaskStatus;
import com.onyx.downloader.service.BatchScheduler;
import com.onyx.downloader.service.CancellationToken;
import com.onyx.downloader.service.DownloadService;
import com.onyx.downloader.service.ProgressListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadCommandRunnerTest {

    private static final String URL = "http://example.com/files/image.iso";
    private static final String SHA256 = "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

    @Mock
    private DownloadService downloadService;

    @Mock
    private BatchScheduler batchScheduler;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private DownloadProperties properties;
    private DownloadCommandRunner runner;

    @BeforeEach
    void setUp() {
        ResultRenderer renderer = new ResultRenderer(objectMapper,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        properties = new DownloadProperties();
        runner = new DownloadCommandRunner(downloadService, batchScheduler, properties, renderer);
    }

    @Test
    void doesNothingWithoutCommand() {
        runner.run(new DefaultApplicationArguments("--onyx.download.read-timeout=5s"));

        assertEquals(0, runner.getExitCode());
        verifyNoInteractions(downloadService, batchScheduler);
    }

    @Test
    void singleDownloadBuildsTaskFromOptions() {
        when(downloadService.download(any(DownloadTask.class), any(CancellationToken.class), any(ProgressListener.class)))
                .thenReturn(success(URL));
        Path output = tempDir.resolve("image.iso");

        runner.run(new DefaultApplicationArguments("download", "single", URL,
                "--output=" + output, "--workers=3", "--checksum=" + SHA256, "--max-size=1MB",
                "--header=X-Token: abc", "--resume", "--quiet"));

        ArgumentCaptor<DownloadTask> captor = ArgumentCaptor.forClass(DownloadTask.class);
        verify(downloadService).download(captor.capture(), any(CancellationToken.class), any(ProgressListener.class));
        DownloadTask task = captor.getValue();
        assertEquals(0, runner.getExitCode());
        assertEquals(output, task.getDestinationPath());
        assertEquals(3, task.getWorkerCount());
        assertEquals(1024L * 1024, task.getMaxSize());
        assertEquals(ChecksumAlgorithm.SHA256, task.getExpectedChecksum().getAlgorithm());
        assertEquals(Map.of("X-Token", "abc"), task.getHeaders());
        assertTrue(task.isResume());
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void outputWithoutExtensionIsADirectory() {
        when(downloadService.download(any(DownloadTask.class), any(CancellationToken.class), any(ProgressListener.class)))
                .thenReturn(success(URL));
        Path directory = tempDir.resolve("downloads");

        runner.run(new DefaultApplicationArguments("single", URL, "--output=" + directory));

        ArgumentCaptor<DownloadTask> captor = ArgumentCaptor.forClass(DownloadTask.class);
        verify(downloadService).download(captor.capture(), any(CancellationToken.class), any(ProgressListener.class));
        assertEquals(directory, captor.getValue().getOutputDirectory());
        assertNull(captor.getValue().getDestinationPath());
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Download completed"));
    }

    @Test
    void failedSingleDownloadExitsWithOne() {
        when(downloadService.download(any(DownloadTask.class), any(CancellationToken.class), any(ProgressListener.class)))
                .thenReturn(failure(URL, ErrorKind.HTTP_CLIENT));

        runner.run(new DefaultApplicationArguments("single", URL, "--quiet"));

        assertEquals(1, runner.getExitCode());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("HTTP_CLIENT"));
    }

    @Test
    void acceleratedUsesPartsAsWorkers() {
        when(downloadService.download(any(DownloadTask.class), any(CancellationToken.class), any(ProgressListener.class)))
                .thenReturn(success(URL));

        runner.run(new DefaultApplicationArguments("download", "accelerated", URL, "--parts=8"));

        ArgumentCaptor<DownloadTask> captor = ArgumentCaptor.forClass(DownloadTask.class);
        verify(downloadService).download(captor.capture(), any(CancellationToken.class), any(ProgressListener.class));
        assertEquals(8, captor.getValue().getWorkerCount());
    }

    @Test
    void batchReadsUrlFileAndPrintsJson() throws Exception {
        Path urls = Files.writeString(tempDir.resolve("urls.txt"),
                "# mirrors\n\nhttp://example.com/a.bin\n   \nhttp://example.com/b.bin\n");
        when(batchScheduler.run(any(BatchJob.class))).thenReturn(BatchResult.builder()
                .status(BatchStatus.COMPLETED)
                .results(List.of(success("http://example.com/a.bin"), failure("http://example.com/b.bin", ErrorKind.NETWORK)))
                .succeeded(1)
                .failed(1)
                .duration(Duration.ofSeconds(2))
                .peakConcurrency(2)
                .build());

        runner.run(new DefaultApplicationArguments("download", "batch", urls.toString(),
                "--workers=3", "--continue-on-error", "--format=json", "--output-dir=" + tempDir));

        ArgumentCaptor<BatchJob> captor = ArgumentCaptor.forClass(BatchJob.class);
        verify(batchScheduler).run(captor.capture());
        BatchJob job = captor.getValue();
        assertEquals(2, job.getTasks().size());
        assertEquals("http://example.com/b.bin", job.getTasks().get(1).getUrl());
        assertEquals(tempDir, job.getTasks().get(0).getOutputDirectory());
        assertEquals(3, job.getConcurrencyLimit());
        assertTrue(job.isContinueOnError());
        assertEquals(1, runner.getExitCode());

        JsonNode summary = objectMapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(2, summary.get("totalUrls").asInt());
        assertEquals(1, summary.get("successful").asInt());
        assertEquals("NETWORK", summary.get("results").get(1).get("error").asText());
    }

    @Test
    void batchTableListsFailures() throws Exception {
        Path urls = Files.writeString(tempDir.resolve("urls.txt"), "http://example.com/a.bin\n");
        when(batchScheduler.run(any(BatchJob.class))).thenReturn(BatchResult.builder()
                .status(BatchStatus.ABORTED)
                .results(List.of(failure("http://example.com/a.bin", ErrorKind.DISK)))
                .failed(1)
                .duration(Duration.ofSeconds(1))
                .build());

        runner.run(new DefaultApplicationArguments("batch", urls.toString()));

        String table = out.toString(StandardCharsets.UTF_8);
        assertTrue(table.contains("Failed downloads:"));
        assertTrue(table.contains("http://example.com/a.bin"));
        assertEquals(1, runner.getExitCode());
    }

    @Test
    void batchExitCodeIsCapped() throws Exception {
        Path urls = Files.writeString(tempDir.resolve("urls.txt"), "http://example.com/a.bin\n");
        when(batchScheduler.run(any(BatchJob.class))).thenReturn(BatchResult.builder()
                .status(BatchStatus.COMPLETED)
                .results(Collections.emptyList())
                .failed(200)
                .duration(Duration.ZERO)
                .build());

        runner.run(new DefaultApplicationArguments("batch", urls.toString(), "--format=json"));

        assertEquals(125, runner.getExitCode());
    }

    @Test
    void usageErrorsExitWithTwo() {
        runner.run(new DefaultApplicationArguments("download", "fetch", URL));
        assertEquals(2, runner.getExitCode());

        runner.run(new DefaultApplicationArguments("single", URL, "--checksum=nothex"));
        assertEquals(2, runner.getExitCode());

        runner.run(new DefaultApplicationArguments("single", URL, "--workers=0"));
        assertEquals(2, runner.getExitCode());

        runner.run(new DefaultApplicationArguments("batch", tempDir.resolve("absent.txt").toString()));
        assertEquals(2, runner.getExitCode());

        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
        verifyNoInteractions(downloadService, batchScheduler);
    }

    @Test
    void connectionOptionsOverrideSettings() {
        when(downloadService.download(any(DownloadTask.class), any(CancellationToken.class), any(ProgressListener.class)))
                .thenReturn(success(URL));

        runner.run(new DefaultApplicationArguments("single", URL, "--timeout=7", "--retries=0",
                "--user-agent=Mirror-Bot/2.0", "--quiet"));

        assertEquals(0, runner.getExitCode());
        assertEquals(Duration.ofSeconds(7), properties.getConnectTimeout());
        assertEquals(Duration.ofSeconds(7), properties.getReadTimeout());
        assertEquals(1, properties.getMaxAttempts());
        assertEquals(1, properties.getProbeAttempts());
        assertEquals("Mirror-Bot/2.0", properties.getUserAgent());
    }

    @Test
    void negativeRetriesAreAUsageError() {
        runner.run(new DefaultApplicationArguments("single", URL, "--retries=-1"));

        assertEquals(2, runner.getExitCode());
        verifyNoInteractions(downloadService);
    }

    @Test
    void parsesHeaders() {
        assertEquals(Map.of("Authorization", "Bearer x:y"), DownloadCommandRunner.parseHeaders(List.of("Authorization: Bearer x:y")));
    }

    private static TaskResult success(String url) {
        return TaskResult.builder()
                .taskId("t")
                .url(url)
                .destinationPath(Path.of("image.iso"))
                .status(TaskStatus.SUCCESS)
                .bytesTransferred(2048)
                .fileSize(2048)
                .duration(Duration.ofMillis(1500))
                .build();
    }

    private static TaskResult failure(String url, ErrorKind error) {
        return TaskResult.builder()
                .taskId("t")
                .url(url)
                .status(TaskStatus.FAILED)
                .duration(Duration.ofMillis(10))
                .error(error)
                .errorMessage("boom")
                .build();
    }
}
