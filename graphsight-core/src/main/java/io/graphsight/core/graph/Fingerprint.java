package io.graphsight.core.graph;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/// Spatial signature used to decide whether two mentions denote the same node.
///
/// A fingerprint carries whatever location evidence the oracle supplied: a bounding
/// box, a set of grid-cell references (for example `B3`), both, or neither. An empty
/// fingerprint never matches anything; identity then falls back to labels.
///
/// @param box normalized bounding box, may be null
/// @param gridCells grid-cell references, upper-cased, never null
/// @see io.graphsight.core.identity.FingerprintMatcher
public record Fingerprint(BoundingBox box, Set<String> gridCells) {

    private static final Fingerprint EMPTY = new Fingerprint(null, Set.of());

    public Fingerprint {
        gridCells = normalize(gridCells);
    }

    public static Fingerprint empty() {
        return EMPTY;
    }

    public static Fingerprint of(BoundingBox box) {
        return new Fingerprint(box, Set.of());
    }

    public static Fingerprint ofGrid(Set<String> cells) {
        return new Fingerprint(null, cells);
    }

    /// Returns `true` when the oracle gave no location evidence at all.
    public boolean isEmpty() {
        return box == null && gridCells.isEmpty();
    }

    public boolean hasBox() {
        return box != null;
    }

    private static Set<String> normalize(Set<String> cells) {
        if (cells == null || cells.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new TreeSet<>();
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                normalized.add(cell.trim().toUpperCase(Locale.ROOT));
            }
        }
        return Set.copyOf(normalized);
    }
}
