package com.onyx.downloader.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.onyx.downloader.config.DownloadProperties;
import com.onyx.downloader.model.BatchJob;
import com.onyx.downloader.model.BatchResult;
import com.onyx.downloader.model.DownloadTask;
import com.onyx.downloader.model.ExpectedChecksum;
import com.onyx.downloader.model.TaskResult;
import com.onyx.downloader.service.BatchScheduler;
import com.onyx.downloader.service.CancellationToken;
import com.onyx.downloader.service.DownloadService;
import com.onyx.downloader.service.ProgressListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for {@code download single|batch|accelerated}. Options use the {@code --name=value} form.
 * Without a command the application starts and exits without doing anything.
 */
@Component
@Slf4j
public class DownloadCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int MAX_BATCH_EXIT = 125;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  download single <url> [--output=PATH] [--checksum=[ALG:]HEX] [--max-size=100MB] [--workers=N]",
            "                        [--resume] [--overwrite] [--delete-on-mismatch] [--header=\"K: V\"]... [--quiet]",
            "  download batch <urls-file> [--output-dir=DIR] [--workers=N] [--parts=N] [--resume]",
            "                        [--continue-on-error] [--format=table|json]",
            "  download accelerated <url> [--parts=N] [--output=PATH] [--resume]",
            "Every command also takes [--timeout=SECONDS] [--retries=N] [--user-agent=UA].");

    private final DownloadService downloadService;
    private final BatchScheduler batchScheduler;
    private final DownloadProperties properties;
    private final ResultRenderer renderer;

    private volatile int exitCode = EXIT_OK;

    @Autowired
    public DownloadCommandRunner(DownloadService downloadService, BatchScheduler batchScheduler,
                                 DownloadProperties properties, ObjectMapper objectMapper) {
        this(downloadService, batchScheduler, properties, new ResultRenderer(objectMapper, System.out, System.err));
    }

    DownloadCommandRunner(DownloadService downloadService, BatchScheduler batchScheduler,
                          DownloadProperties properties, ResultRenderer renderer) {
        this.downloadService = downloadService;
        this.batchScheduler = batchScheduler;
        this.properties = properties;
        this.renderer = renderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> command = new ArrayList<>(args.getNonOptionArgs());
        if (command.isEmpty()) {
            return;
        }
        if (command.get(0).equals("download")) {
            command.remove(0);
        }

        try {
            exitCode = execute(command, args);
        } catch (IllegalArgumentException e) {
            renderer.renderError(e.getMessage());
            renderer.renderError(USAGE);
            exitCode = EXIT_USAGE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int execute(List<String> command, ApplicationArguments args) {
        if (command.size() != 2) {
            throw new IllegalArgumentException("Expected a command and one argument, got " + command);
        }

        String argument = command.get(1);
        log.info("Running command: {} {}", command.get(0), argument);
        applyConnectionOptions(args);
        switch (command.get(0)) {
            case "single":
                return single(argument, args);
            case "batch":
                return batch(Path.of(argument), args);
            case "accelerated":
                return accelerated(argument, args);
            default:
                throw new IllegalArgumentException("Unknown command: " + command.get(0));
        }
    }

    private int single(String url, ApplicationArguments args) {
        DownloadTask task = DownloadTask.create(url, null, intOption(args, "workers", properties.getDefaultWorkerCount()));
        applyOutput(task, option(args, "output"));
        task.setResume(args.containsOption("resume"));
        task.setOverwrite(args.containsOption("overwrite"));
        task.setDeleteOnMismatch(args.containsOption("delete-on-mismatch"));
        task.setHeaders(parseHeaders(args.getOptionValues("header")));

        String checksum = option(args, "checksum");
        if (checksum != null) {
            task.setExpectedChecksum(ExpectedChecksum.parse(checksum));
        }
        String maxSize = option(args, "max-size");
        if (maxSize != null) {
            task.setMaxSize(ByteSizes.parse(maxSize));
        }

        boolean quiet = args.containsOption("quiet");
        if (!quiet) {
            renderer.renderStart(url, task.getMaxSize() != null ? "max size " + ByteSizes.format(task.getMaxSize()) : null);
        }
        return runSingle(task, quiet);
    }

    private int accelerated(String url, ApplicationArguments args) {
        int parts = intOption(args, "parts", 4);
        DownloadTask task = DownloadTask.create(url, null, parts);
        applyOutput(task, option(args, "output"));
        task.setResume(args.containsOption("resume"));

        renderer.renderStart(url, parts + " parts");
        return runSingle(task, false);
    }

    private int runSingle(DownloadTask task, boolean quiet) {
        ProgressListener listener = quiet ? ProgressListener.NONE : renderer.progressListener();
        TaskResult result = downloadService.download(task, CancellationToken.create(), listener);

        if (!quiet || !result.isSuccess()) {
            renderer.renderTask(result);
        }
        return result.isSuccess() ? EXIT_OK : EXIT_FAILED;
    }

    private int batch(Path urlsFile, ApplicationArguments args) {
        String format = option(args, "format") != null ? option(args, "format") : "table";
        if (!format.equals("table") && !format.equals("json")) {
            throw new IllegalArgumentException("Unknown format: " + format);
        }

        List<String> urls = readUrls(urlsFile);
        Path outputDirectory = option(args, "output-dir") != null
                ? Path.of(option(args, "output-dir"))
                : properties.getDownloadDirectory();
        int parts = intOption(args, "parts", 1);
        boolean resume = args.containsOption("resume");

        List<DownloadTask> tasks = new ArrayList<>(urls.size());
        for (String url : urls) {
            DownloadTask task = DownloadTask.create(url, null, parts);
            task.setOutputDirectory(outputDirectory);
            task.setResume(resume);
            tasks.add(task);
        }

        BatchJob job = BatchJob.builder()
                .tasks(tasks)
                .concurrencyLimit(intOption(args, "workers", 4))
                .continueOnError(args.containsOption("continue-on-error"))
                .build();

        if (format.equals("table")) {
            renderer.renderStart(urlsFile.toString(), urls.size() + " URLs");
        }
        BatchResult result = batchScheduler.run(job);

        if (format.equals("json")) {
            renderer.renderBatchJson(result);
        } else {
            renderer.renderBatchTable(result);
        }
        return Math.min(result.getFailed() + result.getAborted(), MAX_BATCH_EXIT);
    }

    /**
     * Short forms of the {@code onyx.download.*} connection settings. A retry count of {@code n}
     * allows {@code n + 1} attempts per chunk and per probe.
     */
    private void applyConnectionOptions(ApplicationArguments args) {
        String timeout = option(args, "timeout");
        if (timeout != null) {
            Duration duration = Duration.ofSeconds(intOption(args, "timeout", 1, 1));
            properties.setConnectTimeout(duration);
            properties.setReadTimeout(duration);
        }
        String retries = option(args, "retries");
        if (retries != null) {
            int attempts = intOption(args, "retries", 0, 0) + 1;
            properties.setMaxAttempts(attempts);
            properties.setProbeAttempts(attempts);
        }
        String userAgent = option(args, "user-agent");
        if (userAgent != null) {
            if (userAgent.isBlank()) {
                throw new IllegalArgumentException("--user-agent must not be empty");
            }
            properties.setUserAgent(userAgent.trim());
        }
    }

    /**
     * An existing directory, or a path without an extension that is not an existing file, is an output directory.
     */
    static void applyOutput(DownloadTask task, String output) {
        if (output == null) {
            return;
        }
        Path path = Path.of(output);
        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        boolean directory = Files.isDirectory(path) || (!Files.isRegularFile(path) && !fileName.contains("."));
        if (directory) {
            task.setOutputDirectory(path);
        } else {
            task.setDestinationPath(path);
        }
    }

    static List<String> readUrls(Path urlsFile) {
        if (!Files.isRegularFile(urlsFile)) {
            throw new IllegalArgumentException("URL file not found: " + urlsFile);
        }
        try {
            return Files.readAllLines(urlsFile).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read URL file " + urlsFile + ": " + e.getMessage(), e);
        }
    }

    static Map<String, String> parseHeaders(List<String> values) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (values == null) {
            return headers;
        }
        for (String value : values) {
            int colon = value.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Header must be in 'Key: Value' form: " + value);
            }
            headers.put(value.substring(0, colon).trim(), value.substring(colon + 1).trim());
        }
        return headers;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        return intOption(args, name, defaultValue, 1);
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue, int min) {
        String value = option(args, name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min) {
                throw new IllegalArgumentException("--" + name + " must be at least " + min);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " is not a number: " + value, e);
        }
    }
}
