package com.diskmap.treemap.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Value;

/**
 * A node placed on the canvas by one layout pass.
 * Coordinates are canvas units with the origin at the top-left corner.
 */
@Value
public class TreemapRect {

    @JsonIgnoreProperties({"children"})
    TreemapNode node;

    double x;

    double y;

    double width;

    double height;

    public double getArea() {
        return width * height;
    }

    /**
     * Longer side divided by shorter side; 1.0 is a perfect square.
     * A degenerate rectangle reports positive infinity.
     */
    public double getAspectRatio() {
        double shorter = Math.min(width, height);
        if (shorter <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(width, height) / shorter;
    }

    /**
     * Hit test used for hover and click handling. The left and top edges are
     * inclusive, the right and bottom edges exclusive, so a point on a shared
     * edge belongs to exactly one rectangle.
     */
    public boolean contains(double px, double py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }
}
