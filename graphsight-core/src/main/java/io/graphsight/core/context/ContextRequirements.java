package io.graphsight.core.context;

/// What a strategy wants to see of the history in each step request.
///
/// @param historyWindow number of most recent visits whose edges and reasoning are
///     included, at least 1
/// @param includeSpatialHints whether visited nodes carry their bounding boxes
/// @param includeReasoning whether recent reasoning traces are included
public record ContextRequirements(
        int historyWindow, boolean includeSpatialHints, boolean includeReasoning) {

    public static final int DEFAULT_HISTORY_WINDOW = 10;

    public ContextRequirements {
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be >= 1, got " + historyWindow);
        }
    }

    public static ContextRequirements defaults() {
        return new ContextRequirements(DEFAULT_HISTORY_WINDOW, false, true);
    }

    public ContextRequirements withHistoryWindow(int window) {
        return new ContextRequirements(window, includeSpatialHints, includeReasoning);
    }

    public ContextRequirements withSpatialHints(boolean include) {
        return new ContextRequirements(historyWindow, include, includeReasoning);
    }
}
