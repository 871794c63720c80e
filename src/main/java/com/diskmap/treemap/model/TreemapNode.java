package com.diskmap.treemap.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.io.FileUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One filesystem entry of a scan result.
 *
 * Instances are immutable and only created through the static factories:
 * - {@link #leaf} - a file, sized by its byte count
 * - {@link #directory} - a scanned directory, sized by the sum of its children
 * - {@link #placeholderDirectory} - a directory that was not descended into
 * - {@link #error} - the safe default returned for an unusable path
 */
@Getter
@ToString(exclude = "children")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TreemapNode {

    public static final String ERROR_NAME = "Error";

    private final String name;

    private final String path;

    private final long size;

    private final FileTypeCategory category;

    private final List<TreemapNode> children;

    private final int depth;

    private final boolean directory;

    /** True when {@link #size} is an estimate rather than a measured value. */
    private final boolean approximate;

    public static TreemapNode leaf(String name, String path, long size, FileTypeCategory category, int depth) {
        return new TreemapNode(name, path, Math.max(0L, size), category, List.of(), depth, false, false);
    }

    /**
     * Build a directory node from already built children.
     *
     * Size is the sum of the children's sizes. Category is the one with the
     * greatest summed child size; on a tie the category met first in child
     * order wins, and no children means {@link FileTypeCategory#OTHER}.
     */
    public static TreemapNode directory(String name, String path, List<TreemapNode> children, int depth) {
        List<TreemapNode> copy = List.copyOf(children);
        long total = 0L;
        for (TreemapNode child : copy) {
            total += child.size;
        }
        return new TreemapNode(name, path, total, dominantCategory(copy), copy, depth, true, false);
    }

    public static TreemapNode placeholderDirectory(String name, String path, long estimatedSize, int depth) {
        return new TreemapNode(name, path, Math.max(0L, estimatedSize), FileTypeCategory.SYSTEM,
                List.of(), depth, true, true);
    }

    public static TreemapNode error(String path) {
        return new TreemapNode(ERROR_NAME, path, 0L, FileTypeCategory.OTHER, List.of(), 0, false, false);
    }

    static FileTypeCategory dominantCategory(List<TreemapNode> children) {
        Map<FileTypeCategory, Long> totals = new LinkedHashMap<>();
        for (TreemapNode child : children) {
            totals.merge(child.category, child.size, Long::sum);
        }

        FileTypeCategory best = FileTypeCategory.OTHER;
        long bestSize = Long.MIN_VALUE;
        for (Map.Entry<FileTypeCategory, Long> entry : totals.entrySet()) {
            if (entry.getValue() > bestSize) {
                best = entry.getKey();
                bestSize = entry.getValue();
            }
        }
        return best;
    }

    @JsonIgnore
    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Number of leaves in this subtree. A node without children counts as one.
     */
    @JsonIgnore
    public int getItemCount() {
        if (children.isEmpty()) {
            return 1;
        }
        int count = 0;
        for (TreemapNode child : children) {
            count += child.getItemCount();
        }
        return count;
    }

    /**
     * Height of this subtree: 0 for a node without children.
     */
    @JsonIgnore
    public int getMaxDepth() {
        int deepest = -1;
        for (TreemapNode child : children) {
            deepest = Math.max(deepest, child.getMaxDepth());
        }
        return deepest + 1;
    }

    public String getFormattedSize() {
        return FileUtils.byteCountToDisplaySize(size);
    }
}
