package io.graphsight.core.identity;

import io.graphsight.core.graph.Fingerprint;
import java.util.Collections;

/// Hybrid fingerprint matcher: close bounding-box centroids, with grid cells as a fallback.
///
/// When both fingerprints carry a box, the centroid distance alone decides, against the
/// tolerance in 0-1000 grid units. Grid cells are advisory: the grid is not drawn on
/// the image, so the oracle's cell names are estimates and only decide a match (as
/// distance zero) when at least one side has no box.
///
/// @implNote Immutable and thread-safe.
public final class SpatialFingerprintMatcher implements FingerprintMatcher {

    /// Default centroid tolerance on the 0-1000 grid.
    public static final double DEFAULT_TOLERANCE = 60.0;

    private final double tolerance;

    public SpatialFingerprintMatcher() {
        this(DEFAULT_TOLERANCE);
    }

    /// @param tolerance maximum centroid distance still considered the same node, positive
    public SpatialFingerprintMatcher(double tolerance) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("tolerance must be positive, got " + tolerance);
        }
        this.tolerance = tolerance;
    }

    @Override
    public boolean matches(Fingerprint a, Fingerprint b) {
        return distance(a, b) < tolerance;
    }

    @Override
    public double distance(Fingerprint a, Fingerprint b) {
        if (a.hasBox() && b.hasBox()) {
            return a.box().centroidDistance(b.box());
        }
        if (gridOverlaps(a, b)) {
            return 0.0;
        }
        return Double.POSITIVE_INFINITY;
    }

    public double getTolerance() {
        return tolerance;
    }

    private static boolean gridOverlaps(Fingerprint a, Fingerprint b) {
        return !a.gridCells().isEmpty()
                && !b.gridCells().isEmpty()
                && !Collections.disjoint(a.gridCells(), b.gridCells());
    }
}
