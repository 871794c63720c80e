package com.diskmap.treemap.service;

import com.diskmap.treemap.exception.NoScanAvailableException;
import com.diskmap.treemap.model.LayoutRequest;
import com.diskmap.treemap.model.NodeSummary;
import com.diskmap.treemap.model.ScanResult;
import com.diskmap.treemap.model.TreemapRect;
import com.diskmap.treemap.model.TreemapRequest;
import com.diskmap.treemap.model.TreemapResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Path in, rectangles out.
 *
 * Process Flow:
 * 1. Scan the requested path through {@link ScanGovernor}
 * 2. Remember the result so a canvas resize can reuse it
 * 3. Lay out the root's children with {@link SquarifiedLayoutEngine}
 *
 * The remembered result lives in memory only and is replaced by every scan.
 */
@Slf4j
@Service
public class TreemapService {

    private final ScanGovernor scanGovernor;
    private final SquarifiedLayoutEngine layoutEngine;
    private final double defaultWidth;
    private final double defaultHeight;

    private final AtomicReference<ScanResult> lastScan = new AtomicReference<>();

    public TreemapService(ScanGovernor scanGovernor,
                          SquarifiedLayoutEngine layoutEngine,
                          @Value("${app.treemap.default-width:800}") double defaultWidth,
                          @Value("${app.treemap.default-height:600}") double defaultHeight) {
        this.scanGovernor = scanGovernor;
        this.layoutEngine = layoutEngine;
        this.defaultWidth = defaultWidth;
        this.defaultHeight = defaultHeight;
    }

    /**
     * Scan a path and lay it out. Used on first display and on navigation.
     *
     * @param request - path plus optional canvas size
     * @return summary of the scanned root and its placed rectangles
     */
    public TreemapResponse buildTreemap(TreemapRequest request) {
        log.info("Building treemap for: {}", request.getPath());

        ScanResult scan = scanGovernor.scan(request.getPath());
        lastScan.set(scan);
        if (scan.getStatus().isPartial()) {
            log.warn("Scan of {} ended {}, showing a partial tree", request.getPath(), scan.getStatus());
        }

        double width = request.getWidth() != null ? request.getWidth() : defaultWidth;
        double height = request.getHeight() != null ? request.getHeight() : defaultHeight;
        return render(scan, width, height);
    }

    /**
     * Lay out the last scan again for a new canvas size.
     *
     * @throws NoScanAvailableException if nothing has been scanned yet
     */
    public TreemapResponse relayout(LayoutRequest request) {
        ScanResult scan = lastScan.get();
        if (scan == null) {
            throw new NoScanAvailableException();
        }
        log.debug("Re-laying out {} for {}x{}", scan.getRoot().getPath(), request.getWidth(), request.getHeight());
        return render(scan, request.getWidth(), request.getHeight());
    }

    public boolean cancelScan() {
        return scanGovernor.cancelCurrentScan();
    }

    public boolean isScanning() {
        return scanGovernor.isScanning();
    }

    public Optional<ScanResult> getLastScan() {
        return Optional.ofNullable(lastScan.get());
    }

    private TreemapResponse render(ScanResult scan, double width, double height) {
        long startTime = System.currentTimeMillis();
        List<TreemapRect> rects = layoutEngine.layout(scan.getRoot(), width, height);
        long layoutTime = System.currentTimeMillis() - startTime;

        log.info("Laid out {} rectangles for {} on {}x{} in {}ms",
                rects.size(), scan.getRoot().getPath(), width, height, layoutTime);

        return TreemapResponse.builder()
                .root(NodeSummary.of(scan.getRoot()))
                .status(scan.getStatus())
                .canvasWidth(width)
                .canvasHeight(height)
                .rects(rects)
                .scanTimeMs(scan.getElapsedMs())
                .layoutTimeMs(layoutTime)
                .build();
    }
}
