package io.graphsight.core.identity;

import io.graphsight.core.graph.Fingerprint;

/// Decides whether two spatial fingerprints denote the same node.
///
/// Implementations must be symmetric and must never match an empty fingerprint.
///
/// @see SpatialFingerprintMatcher for the default policy
public interface FingerprintMatcher {

    /// @param a first fingerprint, not null
    /// @param b second fingerprint, not null
    /// @return `true` when both describe the same node
    boolean matches(Fingerprint a, Fingerprint b);

    /// Ranks matches when several identities qualify. Lower is closer.
    ///
    /// @param a first fingerprint, not null
    /// @param b second fingerprint, not null
    /// @return non-negative distance, {@link Double#POSITIVE_INFINITY} when incomparable
    double distance(Fingerprint a, Fingerprint b);
}
