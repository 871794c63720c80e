package com.diskmap.treemap.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

/**
 * Scan limits and the threads scans run on.
 *
 * Values come from application.properties (app.scan.*).
 */
@Slf4j
@Configuration
public class DiskMapConfig {

    @Value("${app.scan.max-entries-per-directory:50}")
    private int maxEntriesPerDirectory;

    @Value("${app.scan.max-children:30}")
    private int maxChildren;

    @Value("${app.scan.directory-placeholder-bytes:1048576}")
    private long directoryPlaceholderBytes;

    @Value("${app.scan.max-depth:1}")
    private int maxDepth;

    @Value("${app.scan.include-hidden:false}")
    private boolean includeHidden;

    @Value("${app.scan.timeout-seconds:30}")
    private long timeoutSeconds;

    @Value("${app.scan.cancel-grace-seconds:5}")
    private long cancelGraceSeconds;

    @Bean
    public ScanSettings scanSettings() {
        ScanSettings settings = ScanSettings.builder()
                .maxEntriesPerDirectory(maxEntriesPerDirectory)
                .maxChildren(maxChildren)
                .directoryPlaceholderBytes(directoryPlaceholderBytes)
                .maxDepth(maxDepth)
                .includeHidden(includeHidden)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .cancelGrace(Duration.ofSeconds(cancelGraceSeconds))
                .build();
        log.info("Scan settings: {}", settings);
        return settings;
    }

    /**
     * Scans run here. One scan is active at a time; the extra threads cover
     * superseded scans that are still winding down.
     */
    @Bean
    public ThreadPoolTaskExecutor scanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("disk-scan-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler scanDeadlineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("scan-deadline-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
