package com.diskmap.treemap.controller;

import com.diskmap.treemap.model.CategoryInfo;
import com.diskmap.treemap.model.FileTypeCategory;
import com.diskmap.treemap.model.LayoutRequest;
import com.diskmap.treemap.model.NodeSummary;
import com.diskmap.treemap.model.TreemapRequest;
import com.diskmap.treemap.model.TreemapResponse;
import com.diskmap.treemap.service.TreemapService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API Controller for the disk map.
 *
 * Endpoints:
 * - POST /api/treemap/scan - Scan a path and lay it out
 * - POST /api/treemap/layout - Lay out the last scan for a new canvas size
 * - POST /api/treemap/cancel - Cancel the scan in flight
 * - GET /api/treemap/status - Whether a scan is running, and the last result
 * - GET /api/treemap/categories - Category legend
 * - GET /api/health - Health check
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class TreemapController {

    private final TreemapService treemapService;

    public TreemapController(TreemapService treemapService) {
        this.treemapService = treemapService;
    }

    /**
     * Scan a path and lay it out.
     *
     * Example Request:
     * POST /api/treemap/scan
     * {
     *   "path": "/home/me/Downloads",
     *   "width": 1024,
     *   "height": 768
     * }
     *
     * @param request - path and optional canvas size
     * @return root summary, scan status and placed rectangles
     */
    @PostMapping("/treemap/scan")
    public ResponseEntity<TreemapResponse> scan(@Valid @RequestBody TreemapRequest request) {
        log.info("Received scan request for: {}", request.getPath());

        TreemapResponse response = treemapService.buildTreemap(request);

        log.info("Scan of {} returned {} rectangles ({})",
                request.getPath(), response.getRects().size(), response.getStatus());
        return ResponseEntity.ok(response);
    }

    /**
     * Canvas resize. Reuses the last scan; 409 if there is none yet.
     */
    @PostMapping("/treemap/layout")
    public ResponseEntity<TreemapResponse> layout(@Valid @RequestBody LayoutRequest request) {
        return ResponseEntity.ok(treemapService.relayout(request));
    }

    @PostMapping("/treemap/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = treemapService.cancelScan();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/treemap/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scanning", treemapService.isScanning());
        treemapService.getLastScan().ifPresent(scan -> {
            body.put("lastStatus", scan.getStatus());
            body.put("lastRoot", NodeSummary.of(scan.getRoot()));
            body.put("lastItemCount", scan.getItemCount());
            body.put("lastMaxDepth", scan.getMaxDepth());
            body.put("lastScanTimeMs", scan.getElapsedMs());
        });
        return ResponseEntity.ok(body);
    }

    @GetMapping("/treemap/categories")
    public ResponseEntity<List<CategoryInfo>> categories() {
        return ResponseEntity.ok(Arrays.stream(FileTypeCategory.values())
                .map(CategoryInfo::of)
                .toList());
    }

    /**
     * Health check endpoint.
     *
     * GET /api/health
     *
     * @return Simple status message
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Disk Map API is running");
    }
}
