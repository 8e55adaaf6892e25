package io.graphsight.core.engine;

/// Observer for traversal events.
///
/// {@snippet :
/// TraversalObserver progress = event -> {
///     if (event instanceof TraversalEvent.FocusVisited visited) {
///         System.out.println("Examined " + visited.focus().label());
///     }
/// };
/// engine.addObserver(progress);
/// }
///
/// @implNote Implementations must be thread-safe when one engine serves concurrent
/// traversals. Observer failures are logged and never interrupt the traversal.
@FunctionalInterface
public interface TraversalObserver {

    /// @param event the event, never null
    void onEvent(TraversalEvent event);
}
