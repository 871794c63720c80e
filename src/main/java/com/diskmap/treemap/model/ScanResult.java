package com.diskmap.treemap.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScanResult {

    TreemapNode root;

    ScanStatus status;

    long elapsedMs;

    public int getItemCount() {
        return root.getItemCount();
    }

    public int getMaxDepth() {
        return root.getMaxDepth();
    }
}
