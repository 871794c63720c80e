package com.diskmap.treemap.model;

import lombok.Builder;
import lombok.Value;

/**
 * Flat description of a scanned root, used for the header statistics of the
 * disk map (item count, depth, total size).
 */
@Value
@Builder
public class NodeSummary {

    String name;

    String path;

    long size;

    String formattedSize;

    FileTypeCategory category;

    int childCount;

    int itemCount;

    int maxDepth;

    public static NodeSummary of(TreemapNode node) {
        return NodeSummary.builder()
                .name(node.getName())
                .path(node.getPath())
                .size(node.getSize())
                .formattedSize(node.getFormattedSize())
                .category(node.getCategory())
                .childCount(node.getChildren().size())
                .itemCount(node.getItemCount())
                .maxDepth(node.getMaxDepth())
                .build();
    }
}
