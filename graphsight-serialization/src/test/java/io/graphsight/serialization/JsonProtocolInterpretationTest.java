package io.graphsight.serialization;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphsight.core.GraphSight;
import io.graphsight.core.GraphSightConfig;
import io.graphsight.core.GraphSightFactory;
import io.graphsight.core.InterpretationResult;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.RequestPurpose;
import io.graphsight.core.oracle.stub.StubVisionOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Runs the full interpretation pipeline against scripted JSON replies, exercising the
/// Jackson parser the way a real oracle would.
class JsonProtocolInterpretationTest {

    private static final DiagramImage IMAGE =
            new DiagramImage("approval.png", new byte[] {7, 7, 7}, "image/png", 800, 600);

    private StubVisionOracle oracle;
    private GraphSight graphSight;

    @BeforeEach
    void setUp() {
        oracle =
                new StubVisionOracle("gpt-4o")
                        .enqueue(
                                """
                                ```json
                                {"diagram_type": "flowchart", "confidence": 0.95, "reasoning": "boxes and arrows"}
                                ```
                                """)
                        .enqueue(
                                """
                                {"start_nodes": [{"ref": "s", "label": "Start", "bbox": [20, 400, 80, 600]}]}
                                """)
                        .enqueue(
                                """
                                Looking at the top of the diagram:
                                {"reasoning": "Start leads to a diamond",
                                 "nodes": [
                                   {"ref": "s", "label": "Start", "shape": "terminal", "bbox": [20, 400, 80, 600]},
                                   {"ref": "c", "label": "Check", "shape": "decision", "bbox": [300, 400, 380, 600]}],
                                 "edges": [{"source": "s", "target": "c", "label": ""}],
                                 "next": [{"ref": "c", "label": "Check", "bbox": [300, 400, 380, 600]}],
                                 "done": false}
                                """)
                        .enqueue(
                                """
                                {"reasoning": "The diamond has a yes branch",
                                 "nodes": [
                                   {"ref": "c", "label": "Check", "shape": "decision", "bbox": [300, 400, 380, 600]},
                                   {"ref": "e", "label": "End", "shape": "terminal", "bbox": [700, 400, 760, 600]}],
                                 "edges": [{"source": "c", "target": "e", "label": "yes"}],
                                 "next": [{"ref": "e", "label": "End", "bbox": [700, 400, 760, 600]}],
                                 "done": false}
                                """)
                        .enqueue(
                                """
                                {"reasoning": "Nothing leaves End",
                                 "nodes": [{"ref": "e", "label": "End", "shape": "terminal", "bbox": [700, 400, 760, 600]}],
                                 "edges": [], "next": [], "done": true}
                                """);

        graphSight =
                GraphSightFactory.builder()
                        .config(new GraphSightConfig())
                        .credential("TEST_API_KEY", "unused")
                        .oracle(oracle)
                        .responseParser(new JacksonOracleResponseParser())
                        .build();
    }

    @AfterEach
    void tearDown() {
        graphSight.close();
    }

    @Test
    void shouldInterpretDiagramFromJsonReplies() throws Exception {
        InterpretationResult result = graphSight.interpret(IMAGE, OutputFormat.MERMAID);

        assertThat(result.diagramType()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(result.graph().nodeNames()).containsExactly("Start", "Check", "End");
        assertThat(result.rawContent())
                .contains("Start([\"Start\"])")
                .contains("Check{\"Check\"}")
                .contains("Start --> Check")
                .contains("Check -->|yes| End");
        assertThat(result.content()).isEqualTo(result.rawContent().trim());
        assertThat(result.steps()).isEqualTo(3);
        assertThat(result.isComplete()).isTrue();
        assertThat(oracle.requests(RequestPurpose.STEP)).hasSize(3);
        assertThat(oracle.requests(RequestPurpose.REFINE)).hasSize(1);
    }

    @Test
    void shouldExportInterpretedResult() throws Exception {
        InterpretationResult result = graphSight.interpret(IMAGE, OutputFormat.MERMAID);

        JsonNode json = new ObjectMapper().readTree(ResultSerializer.toJson(result));

        assertThat(json.get("diagram_type").asText()).isEqualTo("flowchart");
        assertThat(json.get("is_partial").asBoolean()).isFalse();
        assertThat(json.get("call_count").asInt()).isEqualTo(result.callCount());
        assertThat(json.get("graph").get("edges")).hasSize(2);
    }

    @Test
    void shouldApplyAuditCorrectionsFromJsonReplies() throws Exception {
        oracle.enqueue("{\"confirmed_incoming\": [], \"confirmed_outgoing\": [\"Check\"]}")
                .enqueue(
                        """
                        {"confirmed_incoming": ["Start"], "confirmed_outgoing": ["End", "Retry"],
                         "notes": "a no branch loops back to Retry"}
                        """)
                .enqueue("{\"confirmed_incoming\": null, \"confirmed_outgoing\": null}");

        try (GraphSight audited =
                GraphSightFactory.builder()
                        .config(GraphSightConfig.builder().auditRounds(1).build())
                        .credential("TEST_API_KEY", "unused")
                        .oracle(oracle)
                        .responseParser(new JacksonOracleResponseParser())
                        .build()) {
            InterpretationResult result = audited.interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.graph().nodeNames()).containsExactly("Start", "Check", "End", "Retry");
            assertThat(result.rawContent())
                    .contains("Check -->|yes| End")
                    .contains("Check --> Retry");
            assertThat(result.isComplete()).isTrue();
            assertThat(oracle.requests(RequestPurpose.AUDIT)).hasSize(3);
            assertThat(oracle.requests(RequestPurpose.REFINE).get(0).instructions())
                    .contains("Audit 1 of Check: a no branch loops back to Retry Added: Check -> Retry.");
        }
    }

    @Test
    void shouldInterpretWhenReplyCarriesNullCoordinates() throws Exception {
        StubVisionOracle sloppyOracle =
                new StubVisionOracle("gpt-4o")
                        .enqueue("{\"diagram_type\": \"flowchart\", \"confidence\": 0.9}")
                        .enqueue("{\"start_nodes\": [{\"label\": \"Start\", \"bbox\": [20, null, 80, 600]}]}")
                        .enqueue(
                                """
                                {"nodes": [
                                   {"ref": "s", "label": "Start", "bbox": [null, null, null, null]},
                                   {"ref": "e", "label": "End", "bbox": [700, 400, 760, 600]}],
                                 "edges": [{"source": "s", "target": "e"}],
                                 "next": [], "done": true}
                                """);

        try (GraphSight sloppy =
                GraphSightFactory.builder()
                        .config(new GraphSightConfig())
                        .credential("TEST_API_KEY", "unused")
                        .oracle(sloppyOracle)
                        .responseParser(new JacksonOracleResponseParser())
                        .build()) {
            InterpretationResult result = sloppy.interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.graph().nodeNames()).containsExactly("Start", "End");
            assertThat(result.rawContent()).contains("Start --> End");
            assertThat(result.isComplete()).isTrue();
        }
    }
}
