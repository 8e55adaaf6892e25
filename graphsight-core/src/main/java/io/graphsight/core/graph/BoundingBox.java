package io.graphsight.core.graph;

import java.util.List;

/// Axis-aligned box on the oracle's normalized coordinate grid.
///
/// Coordinates follow the `[ymin, xmin, ymax, xmax]` convention on a 0-1000 scale
/// regardless of the source image's pixel dimensions.
///
/// @param ymin top edge, 0-1000
/// @param xmin left edge, 0-1000
/// @param ymax bottom edge, 0-1000
/// @param xmax right edge, 0-1000
public record BoundingBox(double ymin, double xmin, double ymax, double xmax) {

    /// Upper bound of the normalized grid.
    public static final double SCALE = 1000.0;

    public BoundingBox {
        if (ymax < ymin || xmax < xmin) {
            throw new IllegalArgumentException(
                    "Bounding box edges are inverted: ["
                            + ymin
                            + ", "
                            + xmin
                            + ", "
                            + ymax
                            + ", "
                            + xmax
                            + "]");
        }
    }

    /// Creates a box from the oracle's four-element list form.
    ///
    /// @param values `[ymin, xmin, ymax, xmax]`, not null
    /// @return the box, never null
    /// @throws IllegalArgumentException if the list does not hold exactly four non-null values
    public static BoundingBox of(List<? extends Number> values) {
        if (values == null || values.size() != 4 || values.contains(null)) {
            throw new IllegalArgumentException(
                    "Bounding box requires [ymin, xmin, ymax, xmax], got: " + values);
        }
        return new BoundingBox(
                values.get(0).doubleValue(),
                values.get(1).doubleValue(),
                values.get(2).doubleValue(),
                values.get(3).doubleValue());
    }

    public double centerY() {
        return (ymin + ymax) / 2.0;
    }

    public double centerX() {
        return (xmin + xmax) / 2.0;
    }

    /// Euclidean distance between the centroids of two boxes.
    ///
    /// @param other the box to compare with, not null
    /// @return distance in grid units
    public double centroidDistance(BoundingBox other) {
        double dy = centerY() - other.centerY();
        double dx = centerX() - other.centerX();
        return Math.sqrt(dy * dy + dx * dx);
    }

    /// Returns the box in the oracle's list form.
    public List<Double> toList() {
        return List.of(ymin, xmin, ymax, xmax);
    }
}
