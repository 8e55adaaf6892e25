package io.graphsight.core.identity;

import io.graphsight.core.graph.Fingerprint;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeMention;
import io.graphsight.core.graph.NodeNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Maps oracle mentions to stable node identities for one traversal.
///
/// ### Resolution order
/// 1. A revisit reference naming a known identity reuses that identity.
/// 2. A non-empty fingerprint matching known identities (per {@link FingerprintMatcher})
///    reuses the nearest one, whatever its label.
/// 3. A non-empty fingerprint without a match reuses a same-label identity that has no
///    fingerprint yet, which adopts the new fingerprint.
/// 4. An empty fingerprint reuses the first identity with the same label.
/// 5. Otherwise a new identity is minted. Its ordinal is one more than the number of
///    identities already carrying the label, so a second "Error" becomes `Error_2`.
///
/// ### Contracts
/// - **Invariant**: no two identities hold fingerprints that match each other
/// - **Invariant**: identities are never removed; keys once returned stay valid
///
/// @implNote **Not thread-safe**. Owned by one traversal.
///
/// @see NodeNaming for display names
public class NodeIdentityResolver {

    private static final Logger logger = Logger.getLogger(NodeIdentityResolver.class.getName());

    private final FingerprintMatcher matcher;
    private final List<NodeIdentity> identities = new ArrayList<>();

    /// @param matcher fingerprint policy, not null
    public NodeIdentityResolver(FingerprintMatcher matcher) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    /// Resolves a mention to an identity, minting one if needed.
    ///
    /// @param mention the mention, not null
    /// @return the resolved identity, never null
    public NodeIdentity resolve(NodeMention mention) {
        Objects.requireNonNull(mention, "mention must not be null");

        if (mention.revisitOf() != null) {
            Optional<NodeIdentity> revisited = findByName(mention.revisitOf());
            if (revisited.isPresent()) {
                logger.fine("Mention '" + mention.label() + "' revisits " + revisited.get().key());
                return revisited.get();
            }
            logger.fine("Unknown revisit reference '" + mention.revisitOf() + "', resolving spatially");
        }

        Fingerprint fingerprint = mention.fingerprint();
        if (!fingerprint.isEmpty()) {
            Optional<NodeIdentity> nearest = nearestMatch(fingerprint);
            if (nearest.isPresent()) {
                return nearest.get();
            }
            Optional<NodeIdentity> unlocated = firstWithLabel(mention.label(), true);
            if (unlocated.isPresent()) {
                return adoptFingerprint(unlocated.get(), fingerprint);
            }
            return mint(mention.label(), fingerprint);
        }

        return firstWithLabel(mention.label(), false)
                .orElseGet(() -> mint(mention.label(), Fingerprint.empty()));
    }

    /// Finds an identity by its display name, suffixed name or bare label.
    ///
    /// @param name name as it appeared in a context payload or edge reference, not null
    /// @return the identity, or empty when no identity carries that name
    public Optional<NodeIdentity> findByName(String name) {
        Optional<NodeKey> key = naming().keyOf(name.trim());
        if (key.isPresent()) {
            return find(key.get());
        }
        return firstWithLabel(name.trim(), false);
    }

    public Optional<NodeIdentity> find(NodeKey key) {
        for (NodeIdentity identity : identities) {
            if (identity.key().equals(key)) {
                return Optional.of(identity);
            }
        }
        return Optional.empty();
    }

    /// Returns display names over every identity minted so far.
    public NodeNaming naming() {
        return NodeNaming.of(identities.stream().map(NodeIdentity::key).toList());
    }

    /// Returns all identities in mint order.
    public List<NodeIdentity> identities() {
        return Collections.unmodifiableList(identities);
    }

    public int size() {
        return identities.size();
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private Optional<NodeIdentity> nearestMatch(Fingerprint fingerprint) {
        NodeIdentity best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (NodeIdentity identity : identities) {
            if (matcher.matches(identity.fingerprint(), fingerprint)) {
                double distance = matcher.distance(identity.fingerprint(), fingerprint);
                if (best == null || distance < bestDistance) {
                    best = identity;
                    bestDistance = distance;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<NodeIdentity> firstWithLabel(String label, boolean unlocatedOnly) {
        for (NodeIdentity identity : identities) {
            if (identity.label().equals(label)
                    && (!unlocatedOnly || identity.fingerprint().isEmpty())) {
                return Optional.of(identity);
            }
        }
        return Optional.empty();
    }

    private NodeIdentity adoptFingerprint(NodeIdentity identity, Fingerprint fingerprint) {
        NodeIdentity located = new NodeIdentity(identity.key(), fingerprint);
        identities.set(identities.indexOf(identity), located);
        logger.fine("Identity " + identity.key() + " adopted a fingerprint");
        return located;
    }

    private NodeIdentity mint(String label, Fingerprint fingerprint) {
        int ordinal = 1;
        for (NodeIdentity identity : identities) {
            if (identity.label().equals(label)) {
                ordinal++;
            }
        }
        NodeIdentity minted = new NodeIdentity(new NodeKey(label, ordinal), fingerprint);
        identities.add(minted);
        logger.fine("Minted identity " + minted.key());
        return minted;
    }
}
