package com.diskmap.treemap.service;

import com.diskmap.treemap.model.TreemapNode;
import com.diskmap.treemap.model.TreemapRect;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Squarified treemap layout.
 *
 * Nodes are sorted largest first and packed into rows. A row keeps growing
 * while adding the next node does not make its worst aspect ratio worse, then
 * it is laid along the shorter side of the space still free and the free space
 * shrinks by the row's thickness. Every rectangle's area is
 * {@code size / totalSize * canvasArea} and together the rectangles tile the
 * target rectangle.
 *
 * Stateless and side-effect free: safe to call concurrently.
 */
@Service
public class SquarifiedLayoutEngine {

    private static final Comparator<TreemapNode> LARGEST_FIRST =
            Comparator.comparingLong(TreemapNode::getSize).reversed();

    /**
     * Lay out the children of {@code root} on a canvas anchored at (0, 0).
     * A root without children is returned as one rectangle covering the canvas.
     */
    public List<TreemapRect> layout(TreemapNode root, double width, double height) {
        if (root == null) {
            return List.of();
        }
        if (!root.hasChildren()) {
            return List.of(new TreemapRect(root, 0, 0, sanitize(width), sanitize(height)));
        }
        return layout(root.getChildren(), 0, 0, width, height);
    }

    /**
     * Lay out sibling nodes inside the given rectangle.
     *
     * Nodes with a size of zero or less take no space and are left out. If
     * nothing with a positive size remains the result is empty. A rectangle
     * with zero width or height yields zero-area rectangles.
     */
    public List<TreemapRect> layout(List<TreemapNode> nodes, double x, double y, double width, double height) {
        if (nodes == null || nodes.isEmpty()) {
            return List.of();
        }

        List<TreemapNode> sorted = nodes.stream()
                .filter(node -> node.getSize() > 0)
                .sorted(LARGEST_FIRST)
                .toList();

        long totalSize = 0L;
        for (TreemapNode node : sorted) {
            totalSize += node.getSize();
        }
        if (totalSize <= 0) {
            return List.of();
        }

        Bounds free = new Bounds(x, y, sanitize(width), sanitize(height));
        double canvasArea = free.width * free.height;

        double[] areas = new double[sorted.size()];
        for (int i = 0; i < areas.length; i++) {
            areas[i] = canvasArea * sorted.get(i).getSize() / totalSize;
        }

        List<TreemapRect> result = new ArrayList<>(sorted.size());
        long unplacedSize = totalSize;
        int start = 0;
        while (start < sorted.size()) {
            int end = rowEnd(areas, start, free.shortSide());
            long rowSize = 0L;
            for (int i = start; i < end; i++) {
                rowSize += sorted.get(i).getSize();
            }
            boolean lastRow = end == sorted.size();
            placeRow(sorted.subList(start, end), rowSize, unplacedSize, lastRow, free, result);
            unplacedSize -= rowSize;
            start = end;
        }
        return result;
    }

    /**
     * Worst aspect ratio among the items of a row laid along a side of the
     * given length: {@code max(side² · maxArea / rowArea², rowArea² / (side² · minArea))}.
     */
    static double worstRatio(double side, double rowArea, double minArea, double maxArea) {
        double sideSquared = side * side;
        double rowSquared = rowArea * rowArea;
        return Math.max(sideSquared * maxArea / rowSquared, rowSquared / (sideSquared * minArea));
    }

    /**
     * @return exclusive end index of the row starting at {@code start}; the row
     *         always holds at least one node
     */
    private int rowEnd(double[] areas, int start, double side) {
        if (side <= 0) {
            // No room to compare shapes in; everything left goes in one row.
            return areas.length;
        }

        double rowArea = areas[start];
        double min = areas[start];
        double max = areas[start];
        double worst = worstRatio(side, rowArea, min, max);

        int end = start + 1;
        while (end < areas.length) {
            double candidate = areas[end];
            double nextArea = rowArea + candidate;
            double nextMin = Math.min(min, candidate);
            double nextMax = Math.max(max, candidate);
            double nextWorst = worstRatio(side, nextArea, nextMin, nextMax);
            if (nextWorst > worst) {
                break;
            }
            rowArea = nextArea;
            min = nextMin;
            max = nextMax;
            worst = nextWorst;
            end++;
        }
        return end;
    }

    /**
     * Place one row and shrink {@code free} by the space it took. The last
     * item of a row, and the last row overall, take whatever is left so that
     * rounding never opens a gap.
     */
    private void placeRow(List<TreemapNode> row, long rowSize, long unplacedSize, boolean lastRow,
                          Bounds free, List<TreemapRect> out) {
        double fraction = lastRow ? 1.0 : (double) rowSize / unplacedSize;

        if (free.width > free.height) {
            // Column on the left, full height, items stacked top to bottom.
            double thickness = lastRow ? free.width : free.width * fraction;
            double offset = 0;
            for (int i = 0; i < row.size(); i++) {
                TreemapNode node = row.get(i);
                double length = i == row.size() - 1
                        ? free.height - offset
                        : free.height * node.getSize() / rowSize;
                out.add(new TreemapRect(node, free.x, free.y + offset, thickness, length));
                offset += length;
            }
            free.x += thickness;
            free.width = Math.max(0, free.width - thickness);
        } else {
            // Row along the top, full width, items left to right.
            double thickness = lastRow ? free.height : free.height * fraction;
            double offset = 0;
            for (int i = 0; i < row.size(); i++) {
                TreemapNode node = row.get(i);
                double length = i == row.size() - 1
                        ? free.width - offset
                        : free.width * node.getSize() / rowSize;
                out.add(new TreemapRect(node, free.x + offset, free.y, length, thickness));
                offset += length;
            }
            free.y += thickness;
            free.height = Math.max(0, free.height - thickness);
        }
    }

    private static double sanitize(double dimension) {
        if (!Double.isFinite(dimension) || dimension < 0) {
            return 0;
        }
        return dimension;
    }

    /** Free space while a layout pass runs; never shared. */
    private static final class Bounds {
        double x;
        double y;
        double width;
        double height;

        Bounds(double x, double y, double width, double height) {
            this.x = x;
            this.y = y;
            this.width = width;
            this.height = height;
        }

        double shortSide() {
            return Math.min(width, height);
        }
    }
}
