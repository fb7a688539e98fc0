package com.onyx.downloader.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "onyx.download")
public class DownloadProperties {

    @NotNull
    private Path downloadDirectory = Path.of(".");

    @NotNull
    private Path stateDirectory = Path.of(System.getProperty("user.home"), ".onyx");

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * Idle read timeout; a chunk that stalls longer than this is retried.
     */
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);

    @NotBlank
    private String userAgent = "Onyx-Download/1.0";

    @NotNull
    private DataSize bufferSize = DataSize.ofKilobytes(64);

    /**
     * Smallest range worth a dedicated connection.
     */
    @NotNull
    private DataSize minChunkSize = DataSize.ofMegabytes(1);

    @Min(1)
    private int defaultWorkerCount = 4;

    @Min(1)
    private int maxAttempts = 5;

    @Min(1)
    private int probeAttempts = 3;

    @NotNull
    private Duration backoffBase = Duration.ofMillis(500);

    @NotNull
    private Duration backoffMax = Duration.ofSeconds(8);

    @NotNull
    private DataSize persistThreshold = DataSize.ofKilobytes(64);

    @NotNull
    private Duration persistInterval = Duration.ofSeconds(1);

    @NotNull
    private Duration progressInterval = Duration.ofMillis(500);

    private boolean deleteOnMismatch;
}
