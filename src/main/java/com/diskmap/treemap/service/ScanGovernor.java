package com.diskmap.treemap.service;

import com.diskmap.treemap.config.ScanSettings;
import com.diskmap.treemap.model.ScanResult;
import com.diskmap.treemap.model.ScanStatus;
import com.diskmap.treemap.model.TreemapNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs {@link DiskScanner} under a wall-clock deadline, one scan at a time.
 *
 * Deadline handling:
 * 1. A scheduled task cancels the scan's token when the deadline passes
 * 2. The scanner notices at its next checkpoint and returns what it has
 * 3. That partial tree comes back with status {@link ScanStatus#TIMED_OUT}
 * 4. If the scan is still running once the grace period after the deadline
 *    has also passed, it is interrupted and an empty root is returned
 *
 * Starting a scan while another is in flight cancels the older one and waits
 * for it to finish first; the older caller gets {@link ScanStatus#CANCELLED}.
 * The new scan is current from the moment it is requested, so a cancel sent
 * while the older one winds down stops the new one before it starts.
 */
@Slf4j
@Service
public class ScanGovernor {

    private final DiskScanner scanner;
    private final ScanSettings settings;
    private final AsyncTaskExecutor scanExecutor;
    private final TaskScheduler deadlineScheduler;

    /** Serializes scan starts. Never held while waiting on a scan result. */
    private final ReentrantLock startLock = new ReentrantLock();

    private final Object lock = new Object();

    // guarded by lock
    private InFlightScan current;

    public ScanGovernor(DiskScanner scanner,
                        ScanSettings settings,
                        @Qualifier("scanExecutor") AsyncTaskExecutor scanExecutor,
                        @Qualifier("scanDeadlineScheduler") TaskScheduler scanDeadlineScheduler) {
        this.scanner = scanner;
        this.settings = settings;
        this.scanExecutor = scanExecutor;
        this.deadlineScheduler = scanDeadlineScheduler;
    }

    /**
     * Scan a path, replacing any scan still in flight.
     * Never throws for filesystem problems; see {@link DiskScanner}.
     *
     * @param path - file or directory to scan
     * @return the tree together with how the scan ended
     */
    public ScanResult scan(String path) {
        long startTime = System.currentTimeMillis();
        InFlightScan scan = new InFlightScan(path, new CancellationToken());

        startLock.lock();
        try {
            InFlightScan previous;
            synchronized (lock) {
                previous = current;
                current = scan;
            }
            if (previous != null) {
                log.info("Cancelling in-flight scan of {} before scanning {}", previous.path, path);
                previous.token.cancel(CancellationToken.Reason.SUPERSEDED);
                awaitSuperseded(previous);
            }
            if (scan.token.isCancelled()) {
                log.info("Scan of {} cancelled before it started", path);
            } else {
                start(scan);
            }
        } catch (TaskRejectedException e) {
            log.error("Scan of {} could not be started", path, e);
            scan.failed = true;
        } finally {
            startLock.unlock();
        }

        TreemapNode root;
        try {
            root = scan.future != null ? awaitResult(scan) : notStarted(scan);
        } finally {
            if (scan.deadline != null) {
                scan.deadline.cancel(false);
            }
            synchronized (lock) {
                if (current == scan) {
                    current = null;
                }
            }
        }

        ScanStatus status = scan.failed ? ScanStatus.FAILED : statusOf(scan.token);
        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Scan of {} finished in {}ms with status {} ({} children)",
                path, elapsed, status, root.getChildren().size());

        return ScanResult.builder()
                .root(root)
                .status(status)
                .elapsedMs(elapsed)
                .build();
    }

    /**
     * Ask the scan in flight, if any, to stop at its next checkpoint.
     *
     * @return true if there was an unfinished scan and this call cancelled it
     */
    public boolean cancelCurrentScan() {
        synchronized (lock) {
            if (current == null || current.isDone()) {
                return false;
            }
            log.info("Cancel requested for scan of {}", current.path);
            return current.token.cancel(CancellationToken.Reason.REQUESTED);
        }
    }

    public boolean isScanning() {
        synchronized (lock) {
            return current != null && !current.isDone();
        }
    }

    private void start(InFlightScan scan) {
        CancellationToken token = scan.token;
        scan.future = scanExecutor.submit(() -> {
            TreemapNode root = scanner.scan(scan.path, token);
            token.finish();
            return root;
        });
        scan.deadline = deadlineScheduler.schedule(
                () -> onDeadline(scan.path, token),
                Instant.now().plus(settings.getTimeout()));
    }

    private void onDeadline(String path, CancellationToken token) {
        if (token.cancel(CancellationToken.Reason.TIMEOUT)) {
            log.warn("Scan of {} hit the {}s deadline, cancelling", path, settings.getTimeout().toSeconds());
        }
    }

    private TreemapNode awaitResult(InFlightScan scan) {
        long waitMillis = settings.getTimeout().toMillis() + settings.getCancelGrace().toMillis();
        try {
            return scan.future.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            scan.token.cancel(CancellationToken.Reason.TIMEOUT);
            if (!scan.future.cancel(true)) {
                // finished while we gave up on it
                return awaitResult(scan);
            }
            log.warn("Scan of {} did not stop within {}ms of its deadline, returning an empty result",
                    scan.path, settings.getCancelGrace().toMillis());
            return emptyRoot(scan.path);
        } catch (CancellationException e) {
            log.warn("Scan of {} was interrupted before it produced a result", scan.path);
            return emptyRoot(scan.path);
        } catch (ExecutionException e) {
            log.error("Scan of {} failed", scan.path, e.getCause());
            scan.failed = true;
            return TreemapNode.error(scan.path);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scan.token.cancel(CancellationToken.Reason.REQUESTED);
            scan.future.cancel(true);
            log.warn("Interrupted while waiting for scan of {}", scan.path);
            return emptyRoot(scan.path);
        }
    }

    private static TreemapNode notStarted(InFlightScan scan) {
        return scan.failed ? TreemapNode.error(scan.path) : emptyRoot(scan.path);
    }

    /**
     * Wait for a cancelled scan to wind down. Called with {@link #startLock}
     * held and {@link #lock} released.
     */
    private void awaitSuperseded(InFlightScan previous) {
        Future<TreemapNode> future = previous.future;
        if (future == null) {
            return;
        }
        try {
            future.get(settings.getCancelGrace().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Superseded scan of {} is still running, interrupting it", previous.path);
            future.cancel(true);
        } catch (CancellationException e) {
            log.debug("Superseded scan of {} was already interrupted", previous.path);
        } catch (ExecutionException e) {
            log.warn("Superseded scan of {} failed: {}", previous.path, e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        }
    }

    private static ScanStatus statusOf(CancellationToken token) {
        CancellationToken.Reason reason = token.getReason();
        if (reason == null) {
            return ScanStatus.COMPLETE;
        }
        return reason == CancellationToken.Reason.TIMEOUT ? ScanStatus.TIMED_OUT : ScanStatus.CANCELLED;
    }

    private static TreemapNode emptyRoot(String path) {
        String name = FilenameUtils.getName(FilenameUtils.normalizeNoEndSeparator(path));
        return TreemapNode.directory(name == null || name.isEmpty() ? path : name, path, List.of(), 0);
    }

    private static final class InFlightScan {
        final String path;
        final CancellationToken token;
        volatile Future<TreemapNode> future;
        volatile ScheduledFuture<?> deadline;
        volatile boolean failed;

        InFlightScan(String path, CancellationToken token) {
            this.path = path;
            this.token = token;
        }

        /** A scan that has not been submitted yet still counts as running. */
        boolean isDone() {
            Future<TreemapNode> f = future;
            return f != null && f.isDone();
        }
    }
}
