package com.diskmap.treemap.service;

import com.diskmap.treemap.config.ScanSettings;
import com.diskmap.treemap.model.FileTypeCategory;
import com.diskmap.treemap.model.ScanResult;
import com.diskmap.treemap.model.ScanStatus;
import com.diskmap.treemap.model.TreemapNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScanGovernorTest {

    private DiskScanner scanner;
    private ThreadPoolTaskExecutor scanExecutor;
    private ThreadPoolTaskScheduler deadlineScheduler;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        scanner = mock(DiskScanner.class);
        scanExecutor = new ThreadPoolTaskExecutor();
        scanExecutor.setCorePoolSize(2);
        scanExecutor.setMaxPoolSize(8);
        scanExecutor.setQueueCapacity(0);
        scanExecutor.setThreadNamePrefix("test-scan-");
        scanExecutor.initialize();
        deadlineScheduler = new ThreadPoolTaskScheduler();
        deadlineScheduler.setThreadNamePrefix("test-deadline-");
        deadlineScheduler.initialize();
        callers = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        scanExecutor.shutdown();
        deadlineScheduler.shutdown();
        callers.shutdownNow();
    }

    private ScanGovernor governor(Duration timeout, Duration grace) {
        ScanSettings settings = ScanSettings.defaults().toBuilder()
                .timeout(timeout)
                .cancelGrace(grace)
                .build();
        return new ScanGovernor(scanner, settings, scanExecutor, deadlineScheduler);
    }

    private static TreemapNode partial(String path) {
        return TreemapNode.directory("partial", path, List.of(
                TreemapNode.leaf("kept.txt", path + "/kept.txt", 42, FileTypeCategory.DOCUMENTS, 1)), 0);
    }

    /** Blocks until the token is cancelled, then returns a partial tree. */
    private static TreemapNode waitForCancel(String path, CancellationToken token, CountDownLatch started)
            throws InterruptedException {
        started.countDown();
        while (!token.isCancelled()) {
            Thread.sleep(5);
        }
        return partial(path);
    }

    @Test
    void testCompletedScanReturnsScannerResult() {
        TreemapNode tree = partial("/data");
        when(scanner.scan(eq("/data"), any(CancellationToken.class))).thenReturn(tree);

        ScanResult result = governor(Duration.ofSeconds(10), Duration.ofSeconds(1)).scan("/data");

        assertEquals(ScanStatus.COMPLETE, result.getStatus());
        assertSame(tree, result.getRoot());
        assertTrue(result.getElapsedMs() >= 0);
    }

    @Test
    void testDeadlineCancelsAndReturnsPartialTree() {
        CountDownLatch started = new CountDownLatch(1);
        when(scanner.scan(eq("/slow"), any(CancellationToken.class)))
                .thenAnswer(invocation -> waitForCancel("/slow", invocation.getArgument(1), started));

        ScanResult result = governor(Duration.ofMillis(100), Duration.ofSeconds(5)).scan("/slow");

        assertEquals(ScanStatus.TIMED_OUT, result.getStatus());
        assertEquals(1, result.getRoot().getChildren().size(), "Partial tree should be kept");
        assertEquals(42L, result.getRoot().getSize());
    }

    @Test
    void testScanIgnoringDeadlineGivesEmptyRootAfterGrace() {
        when(scanner.scan(eq("/stuck/data"), any(CancellationToken.class))).thenAnswer(invocation -> {
            Thread.sleep(30_000);
            return partial("/stuck/data");
        });

        long start = System.currentTimeMillis();
        ScanResult result = governor(Duration.ofMillis(100), Duration.ofMillis(100)).scan("/stuck/data");
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(ScanStatus.TIMED_OUT, result.getStatus());
        assertEquals("data", result.getRoot().getName());
        assertTrue(result.getRoot().getChildren().isEmpty());
        assertTrue(elapsed < 10_000, "Governor should give up well before the scan ends, took " + elapsed);
    }

    @Test
    void testScannerFailureGivesErrorNodeWithFailedStatus() {
        when(scanner.scan(eq("/broken"), any(CancellationToken.class)))
                .thenThrow(new IllegalStateException("boom"));

        ScanResult result = governor(Duration.ofSeconds(10), Duration.ofSeconds(1)).scan("/broken");

        assertEquals(TreemapNode.ERROR_NAME, result.getRoot().getName());
        assertEquals(ScanStatus.FAILED, result.getStatus());
        assertTrue(result.getStatus().isPartial());
    }

    @Test
    void testNewScanSupersedesScanInFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(scanner.scan(eq("/first"), any(CancellationToken.class)))
                .thenAnswer(invocation -> waitForCancel("/first", invocation.getArgument(1), started));
        TreemapNode second = partial("/second");
        when(scanner.scan(eq("/second"), any(CancellationToken.class))).thenReturn(second);
        ScanGovernor governor = governor(Duration.ofSeconds(30), Duration.ofSeconds(5));

        CompletableFuture<ScanResult> first = CompletableFuture.supplyAsync(() -> governor.scan("/first"), callers);
        assertTrue(started.await(5, TimeUnit.SECONDS), "First scan should start");

        ScanResult secondResult = governor.scan("/second");
        ScanResult firstResult = first.get(5, TimeUnit.SECONDS);

        assertEquals(ScanStatus.COMPLETE, secondResult.getStatus());
        assertSame(second, secondResult.getRoot());
        assertEquals(ScanStatus.CANCELLED, firstResult.getStatus());
        assertFalse(governor.isScanning());
    }

    @Test
    void testCancelCurrentScan() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(scanner.scan(eq("/big"), any(CancellationToken.class)))
                .thenAnswer(invocation -> waitForCancel("/big", invocation.getArgument(1), started));
        ScanGovernor governor = governor(Duration.ofSeconds(30), Duration.ofSeconds(5));

        assertFalse(governor.cancelCurrentScan(), "Nothing to cancel yet");

        CompletableFuture<ScanResult> pending = CompletableFuture.supplyAsync(() -> governor.scan("/big"), callers);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertTrue(governor.isScanning());
        assertTrue(governor.cancelCurrentScan());

        ScanResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(ScanStatus.CANCELLED, result.getStatus());
        assertEquals(42L, result.getRoot().getSize());
    }

    @Test
    void testStatusAndCancelStayResponsiveWhileScanIsSuperseded() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        // Ignores its token; only the interrupt after the grace period stops it
        when(scanner.scan(eq("/stubborn"), any(CancellationToken.class))).thenAnswer(invocation -> {
            started.countDown();
            Thread.sleep(30_000);
            return partial("/stubborn");
        });
        when(scanner.scan(eq("/next"), any(CancellationToken.class))).thenReturn(partial("/next"));
        ScanGovernor governor = governor(Duration.ofSeconds(30), Duration.ofSeconds(3));

        CompletableFuture<ScanResult> stubborn = CompletableFuture.supplyAsync(() -> governor.scan("/stubborn"), callers);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<ScanResult> next = CompletableFuture.supplyAsync(() -> governor.scan("/next"), callers);
        Thread.sleep(200);

        long start = System.currentTimeMillis();
        boolean scanning = governor.isScanning();
        boolean cancelled = governor.cancelCurrentScan();
        long took = System.currentTimeMillis() - start;

        assertTrue(took < 1000, "Status and cancel should not wait for the superseded scan, took " + took + "ms");
        assertTrue(scanning, "The replacing scan counts as running");
        assertTrue(cancelled, "Cancel should reach the replacing scan");

        ScanResult nextResult = next.get(10, TimeUnit.SECONDS);
        ScanResult stubbornResult = stubborn.get(10, TimeUnit.SECONDS);
        assertEquals(ScanStatus.CANCELLED, nextResult.getStatus());
        assertTrue(nextResult.getRoot().getChildren().isEmpty(), "Cancelled before it started");
        assertEquals(ScanStatus.CANCELLED, stubbornResult.getStatus());
        verify(scanner, never()).scan(eq("/next"), any(CancellationToken.class));
        assertFalse(governor.isScanning());
    }

    @Test
    void testCancelAfterScanFinishedIsIgnored() {
        when(scanner.scan(eq("/done"), any(CancellationToken.class))).thenReturn(partial("/done"));
        ScanGovernor governor = governor(Duration.ofSeconds(10), Duration.ofSeconds(1));

        ScanResult result = governor.scan("/done");

        assertFalse(governor.cancelCurrentScan());
        assertEquals(ScanStatus.COMPLETE, result.getStatus());
    }
}
