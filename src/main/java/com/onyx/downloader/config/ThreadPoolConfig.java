package com.onyx.downloader.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@Slf4j
public class ThreadPoolConfig {

    @Value("${onyx.thread-pool.core-size:4}")
    private int corePoolSize;

    @Value("${onyx.thread-pool.max-size:32}")
    private int maxPoolSize;

    @Value("${onyx.thread-pool.queue-capacity:256}")
    private int queueCapacity;

    @Value("${onyx.thread-pool.keep-alive-seconds:60}")
    private int keepAliveSeconds;

    @Value("${onyx.thread-pool.chunk-max-size:64}")
    private int chunkMaxPoolSize;

    /**
     * Runs whole download tasks. Batch concurrency is bounded by the scheduler, not by this pool.
     */
    @Bean(name = "downloadExecutor", destroyMethod = "")
    public ThreadPoolExecutor downloadExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                corePoolSize,
                maxPoolSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                namedThreadFactory("download-thread-", false),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        executor.allowCoreThreadTimeOut(true);

        log.info("Created download executor: core={}, max={}, queue={}, keepAlive={}s",
                corePoolSize, maxPoolSize, queueCapacity, keepAliveSeconds);

        return executor;
    }

    /**
     * Runs chunk workers. Direct hand-off so that every submitted chunk gets its own connection thread.
     */
    @Bean(name = "chunkExecutor", destroyMethod = "")
    public ThreadPoolExecutor chunkExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                0,
                chunkMaxPoolSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                namedThreadFactory("chunk-thread-", true),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        log.info("Created chunk executor: max={}, keepAlive={}s", chunkMaxPoolSize, keepAliveSeconds);

        return executor;
    }

    @Bean(name = "progressScheduler", destroyMethod = "")
    public ScheduledExecutorService progressScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreadFactory("progress-", true));
    }

    private static ThreadFactory namedThreadFactory(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
