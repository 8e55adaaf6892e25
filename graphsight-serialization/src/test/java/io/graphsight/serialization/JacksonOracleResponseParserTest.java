package io.graphsight.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphsight.core.detect.Classification;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.BoundingBox;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.EdgeMention;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeMention;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.StepInterpretation;
import io.graphsight.core.oracle.OracleMalformedResponseException;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JacksonOracleResponseParserTest {

    private final JacksonOracleResponseParser parser = new JacksonOracleResponseParser();

    @Nested
    class InitialFoci {

        @Test
        void shouldParseStartNodesWithLocation() throws Exception {
            String reply =
                    """
                    ```json
                    {"start_nodes": [
                      {"ref": "s", "label": "Start", "description": "top centre", "bbox": [40, 420, 90, 580]},
                      {"label": "Cron trigger", "grid": ["a1", "A2"]}
                    ]}
                    ```
                    """;

            List<Focus> foci = parser.parseInitialFoci(reply);

            assertThat(foci).hasSize(2);
            Focus start = foci.get(0);
            assertThat(start.ref()).isEqualTo("s");
            assertThat(start.label()).isEqualTo("Start");
            assertThat(start.description()).isEqualTo("top centre");
            assertThat(start.fingerprint().box()).isEqualTo(new BoundingBox(40, 420, 90, 580));
            Focus cron = foci.get(1);
            assertThat(cron.ref()).isEqualTo("Cron trigger");
            assertThat(cron.fingerprint().hasBox()).isFalse();
            assertThat(cron.fingerprint().gridCells()).containsExactlyInAnyOrder("A1", "A2");
        }

        @Test
        void shouldFindJsonInsideProse() throws Exception {
            String reply =
                    "Sure! The entry point is below.\n{\"start_nodes\": [{\"label\": \"Begin\"}]}\nHope this helps.";

            assertThat(parser.parseInitialFoci(reply)).extracting(Focus::label).containsExactly("Begin");
        }

        @Test
        void shouldDropFociWithoutLabel() throws Exception {
            String reply = "{\"start_nodes\": [{\"ref\": \"x\"}, {\"label\": \"  \"}, {\"label\": \"Go\"}]}";

            assertThat(parser.parseInitialFoci(reply)).extracting(Focus::label).containsExactly("Go");
        }

        @Test
        void shouldRejectReplyWithoutStartNodes() {
            assertThatThrownBy(() -> parser.parseInitialFoci("{\"nodes\": []}"))
                    .isInstanceOf(OracleMalformedResponseException.class)
                    .hasMessageContaining("start_nodes");
        }

        @Test
        void shouldRejectReplyWithoutJson() {
            assertThatThrownBy(() -> parser.parseInitialFoci("I cannot see a diagram in this image."))
                    .isInstanceOf(OracleMalformedResponseException.class)
                    .hasMessageContaining("No JSON object");
        }
    }

    @Nested
    class Steps {

        private final Focus focus = Focus.of("Check");

        @Test
        void shouldParseFullStepReply() throws Exception {
            String reply =
                    """
                    {
                      "reasoning": "A diamond with two exits",
                      "nodes": [
                        {"ref": "c", "label": "Check", "shape": "Decision", "bbox": [200, 400, 260, 600]},
                        {"ref": "p", "label": "Process", "shape": "rect", "revisit_of": "Process_1"}
                      ],
                      "edges": [
                        {"source": "c", "target": "p", "label": "yes"},
                        {"from": "c", "to": "End"}
                      ],
                      "next": [{"ref": "e", "label": "End", "description": "bottom"}],
                      "done": false,
                      "confidence": 0.8
                    }
                    """;

            StepInterpretation step = parser.parseStep(reply, focus);

            assertThat(step.focus()).isSameAs(focus);
            assertThat(step.source()).isNull();
            assertThat(step.reasoning()).isEqualTo("A diamond with two exits");
            assertThat(step.terminal()).isFalse();

            NodeMention check = step.nodes().get(0);
            assertThat(check.ref()).isEqualTo("c");
            assertThat(check.shape()).isEqualTo("decision");
            assertThat(check.fingerprint().box()).isEqualTo(new BoundingBox(200, 400, 260, 600));
            assertThat(step.nodes().get(1).revisitOf()).isEqualTo("Process_1");

            assertThat(step.edges())
                    .containsExactly(new EdgeMention("c", "p", "yes"), new EdgeMention("c", "End", ""));
            assertThat(step.nextFoci()).extracting(Focus::label).containsExactly("End");
        }

        @Test
        void shouldIgnoreBoundingBoxWithNullCoordinate() throws Exception {
            String reply =
                    """
                    {"nodes": [{"ref": "a", "label": "Approve", "bbox": [null, 10, 50, 90], "grid": ["c4"]}],
                     "next": [{"label": "Archive", "bbox": [100, null, 140, 300]}]}
                    """;

            StepInterpretation step = parser.parseStep(reply, focus);

            NodeMention approve = step.nodes().get(0);
            assertThat(approve.label()).isEqualTo("Approve");
            assertThat(approve.fingerprint().hasBox()).isFalse();
            assertThat(approve.fingerprint().gridCells()).containsExactly("C4");
            assertThat(step.nextFoci()).extracting(Focus::label).containsExactly("Archive");
            assertThat(step.nextFoci().get(0).fingerprint().isEmpty()).isTrue();
        }

        @Test
        void shouldTreatMissingCollectionsAsEmpty() throws Exception {
            StepInterpretation step = parser.parseStep("{\"done\": true}", focus);

            assertThat(step.isEmpty()).isTrue();
            assertThat(step.terminal()).isTrue();
            assertThat(step.reasoning()).isEmpty();
        }

        @Test
        void shouldDropUnusableElements() throws Exception {
            String reply =
                    """
                    {"nodes": [{"ref": "n"}, {"label": "Ok", "bbox": [300, 10, 100, 20]}],
                     "edges": [{"source": "Ok"}, {"source": "Ok", "target": ""}],
                     "next": [null]}
                    """;

            StepInterpretation step = parser.parseStep(reply, focus);

            assertThat(step.nodes()).extracting(NodeMention::label).containsExactly("Ok");
            assertThat(step.nodes().get(0).fingerprint().isEmpty()).isTrue();
            assertThat(step.edges()).isEmpty();
            assertThat(step.nextFoci()).isEmpty();
        }

        @Test
        void shouldRejectTruncatedJson() {
            assertThatThrownBy(() -> parser.parseStep("{\"nodes\": [{\"label\": \"A\"", focus))
                    .isInstanceOf(OracleMalformedResponseException.class);
        }

        @Test
        void shouldRejectWrongFieldTypes() {
            assertThatThrownBy(() -> parser.parseStep("{\"nodes\": {\"label\": 5}, \"edges\": 3}", focus))
                    .isInstanceOf(OracleMalformedResponseException.class)
                    .hasMessageContaining("step");
        }
    }

    @Nested
    class Audits {

        private final AuditSubject subject =
                new AuditSubject(Focus.of("Check"), "Check", List.of("Start"), List.of("Done", "Retry"));

        @Test
        void shouldReadConfirmedConnections() throws Exception {
            AuditVerdict verdict =
                    parser.parseAudit(
                            """
                            ```json
                            {"confirmed_incoming": ["Start"], "confirmed_outgoing": ["Done", " Done ", "Fail"],
                             "notes": "Retry belongs to the lane below"}
                            ```""",
                            subject);

            assertThat(verdict.confirmedIncoming()).containsExactly("Start");
            assertThat(verdict.confirmedOutgoing()).containsExactly("Done", "Fail");
            assertThat(verdict.notes()).isEqualTo("Retry belongs to the lane below");
        }

        @Test
        void shouldTreatNullDirectionAsUnchecked() throws Exception {
            AuditVerdict verdict =
                    parser.parseAudit("{\"confirmed_incoming\": null, \"confirmed_outgoing\": []}", subject);

            assertThat(verdict.checkedIncoming()).isFalse();
            assertThat(verdict.checkedOutgoing()).isTrue();
            assertThat(verdict.confirmedOutgoing()).isEmpty();
            assertThat(verdict.notes()).isEmpty();
        }

        @Test
        void shouldAcceptShortFieldNames() throws Exception {
            AuditVerdict verdict =
                    parser.parseAudit("{\"incoming\": [\"Start\"], \"outgoing\": [\"Done\"]}", subject);

            assertThat(verdict.confirmedIncoming()).containsExactly("Start");
            assertThat(verdict.confirmedOutgoing()).containsExactly("Done");
        }

        @Test
        void shouldRejectReplyThatIsNotJson() {
            assertThatThrownBy(() -> parser.parseAudit("All connections look right.", subject))
                    .isInstanceOf(OracleMalformedResponseException.class);
        }
    }

    @Nested
    class Classifications {

        @Test
        void shouldParseClassification() throws Exception {
            Classification classification =
                    parser.parseClassification(
                            "```json\n{\"diagram_type\": \"sequenceDiagram\", \"confidence\": 0.91, \"reasoning\": \"lifelines\"}\n```");

            assertThat(classification.type()).isEqualTo(DiagramType.SEQUENCE);
            assertThat(classification.confidence()).isEqualTo(0.91);
            assertThat(classification.reasoning()).isEqualTo("lifelines");
        }

        @Test
        void shouldMapUnrecognizedTypeToUnknown() throws Exception {
            Classification classification =
                    parser.parseClassification("{\"diagram_type\": \"gantt\", \"confidence\": 0.7}");

            assertThat(classification.type()).isEqualTo(DiagramType.UNKNOWN);
        }

        @Test
        void shouldDefaultMissingConfidenceToZero() throws Exception {
            assertThat(parser.parseClassification("{\"diagram_type\": \"state\"}").confidence())
                    .isZero();
        }

        @Test
        void shouldRejectMissingDiagramType() {
            assertThatThrownBy(() -> parser.parseClassification("{\"confidence\": 0.9}"))
                    .isInstanceOf(OracleMalformedResponseException.class)
                    .hasMessageContaining("diagram_type");
        }
    }
}
