package io.graphsight.core.identity;

import static org.assertj.core.api.Assertions.assertThat;

import io.graphsight.core.graph.BoundingBox;
import io.graphsight.core.graph.Fingerprint;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeMention;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NodeIdentityResolverTest {

    private NodeIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new NodeIdentityResolver(new SpatialFingerprintMatcher());
    }

    private static NodeMention at(String label, double y, double x) {
        return NodeMention.of(label, new BoundingBox(y, x, y + 40, x + 100));
    }

    private static NodeMention revisit(String label, String knownName) {
        return new NodeMention(label, label, null, Fingerprint.empty(), knownName);
    }

    @Nested
    class Minting {

        @Test
        void shouldMintFirstOrdinalForNewLabel() {
            NodeIdentity identity = resolver.resolve(NodeMention.of("Validate"));

            assertThat(identity.key()).isEqualTo(new NodeKey("Validate", 1));
            assertThat(resolver.size()).isEqualTo(1);
        }

        @Test
        void shouldMintNextOrdinalForSameLabelElsewhere() {
            NodeIdentity first = resolver.resolve(at("Process", 100, 100));
            NodeIdentity second = resolver.resolve(at("Process", 100, 700));

            assertThat(first.key()).isEqualTo(new NodeKey("Process", 1));
            assertThat(second.key()).isEqualTo(new NodeKey("Process", 2));
        }

        @Test
        void shouldNameSharedLabelsWithSuffix() {
            resolver.resolve(at("Process", 100, 100));
            resolver.resolve(at("Process", 100, 700));
            resolver.resolve(at("End", 600, 400));

            assertThat(resolver.naming().nameOf(new NodeKey("Process", 2))).isEqualTo("Process_2");
            assertThat(resolver.naming().nameOf(new NodeKey("End", 1))).isEqualTo("End");
        }
    }

    @Nested
    class SpatialMatching {

        @Test
        void shouldReuseIdentityWithinTolerance() {
            NodeIdentity first = resolver.resolve(at("Process", 100, 100));
            NodeIdentity again = resolver.resolve(at("Process", 110, 120));

            assertThat(again.key()).isEqualTo(first.key());
            assertThat(resolver.size()).isEqualTo(1);
        }

        @Test
        void shouldMatchLocationEvenWhenLabelIsReadDifferently() {
            NodeIdentity first = resolver.resolve(at("Check input", 100, 100));
            NodeIdentity again = resolver.resolve(at("Check inputs", 100, 100));

            assertThat(again.key()).isEqualTo(first.key());
        }

        @Test
        void shouldPickNearestOfSeveralMatches() {
            NodeIdentity left = resolver.resolve(at("Left", 100, 100));
            NodeIdentity right = resolver.resolve(at("Right", 100, 180));

            NodeIdentity resolved = resolver.resolve(at("Right", 100, 170));

            assertThat(resolved.key()).isEqualTo(right.key());
            assertThat(resolved.key()).isNotEqualTo(left.key());
        }

        @Test
        void shouldMatchOverlappingGridCells() {
            NodeIdentity first =
                    resolver.resolve(
                            new NodeMention("a", "Store", null, Fingerprint.ofGrid(Set.of("C4", "C5")), null));
            NodeIdentity again =
                    resolver.resolve(
                            new NodeMention("b", "Store", null, Fingerprint.ofGrid(Set.of("c5")), null));

            assertThat(again.key()).isEqualTo(first.key());
        }

        @Test
        void shouldAdoptFingerprintForUnlocatedIdentity() {
            NodeIdentity unlocated = resolver.resolve(NodeMention.of("Review"));
            NodeIdentity located = resolver.resolve(at("Review", 300, 300));

            assertThat(located.key()).isEqualTo(unlocated.key());
            assertThat(located.fingerprint().hasBox()).isTrue();
            assertThat(resolver.find(unlocated.key()).orElseThrow().fingerprint().hasBox()).isTrue();
            assertThat(resolver.size()).isEqualTo(1);
        }
    }

    @Nested
    class LabelFallback {

        @Test
        void shouldReuseSameLabelWithoutFingerprint() {
            NodeIdentity first = resolver.resolve(at("Approve", 100, 100));
            NodeIdentity again = resolver.resolve(NodeMention.of("Approve"));

            assertThat(again.key()).isEqualTo(first.key());
        }
    }

    @Nested
    class Revisits {

        @Test
        void shouldResolveRevisitByDisplayName() {
            resolver.resolve(at("Process", 100, 100));
            NodeIdentity second = resolver.resolve(at("Process", 100, 700));

            NodeIdentity resolved = resolver.resolve(revisit("Process", "Process_2"));

            assertThat(resolved.key()).isEqualTo(second.key());
        }

        @Test
        void shouldResolveRevisitWhenSuffixedNameIsAlsoALabel() {
            NodeIdentity firstError = resolver.resolve(at("Error", 100, 100));
            resolver.resolve(at("Error", 100, 700));
            NodeIdentity literal = resolver.resolve(at("Error_1", 600, 400));

            assertThat(resolver.naming().nameOf(literal.key())).isEqualTo("Error_1_2");
            assertThat(resolver.resolve(revisit("Error", "Error_1")).key()).isEqualTo(firstError.key());
            assertThat(resolver.resolve(revisit("Error_1", "Error_1_2")).key()).isEqualTo(literal.key());
        }

        @Test
        void shouldIgnoreUnknownRevisitReference() {
            NodeIdentity resolved = resolver.resolve(revisit("Ship", "Nowhere"));

            assertThat(resolved.key()).isEqualTo(new NodeKey("Ship", 1));
        }

        @Test
        void shouldFindByBareLabel() {
            NodeIdentity identity = resolver.resolve(NodeMention.of("Pay"));

            assertThat(resolver.findByName("Pay")).contains(identity);
            assertThat(resolver.findByName("Pay_1")).contains(identity);
            assertThat(resolver.findByName("Refund")).isEmpty();
        }
    }
}
