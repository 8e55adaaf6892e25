package io.graphsight.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.graphsight.core.engine.CancellationToken;
import io.graphsight.core.engine.InterpretationException;
import io.graphsight.core.engine.TraversalPhase;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.graph.EdgeMention;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeMention;
import io.graphsight.core.graph.OutputFormat;
import io.graphsight.core.oracle.RequestPurpose;
import io.graphsight.core.oracle.stub.StubVisionOracle;
import io.graphsight.core.testing.ScriptedResponseParser;
import io.graphsight.core.validation.DiagramStructure;
import io.graphsight.core.validation.SyntaxValidationException;
import io.graphsight.core.validation.SyntaxValidator;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphSightTest {

    private static final DiagramImage IMAGE =
            new DiagramImage("order-flow.png", new byte[] {1, 2, 3}, "image/png", 0, 0);

    private StubVisionOracle oracle;
    private ScriptedResponseParser parser;
    private GraphSight graphSight;

    @BeforeEach
    void setUp() {
        oracle = new StubVisionOracle();
        parser =
                new ScriptedResponseParser()
                        .start(Focus.of("Order"))
                        .step(
                                "Order",
                                List.of(NodeMention.of("Order")),
                                List.of(EdgeMention.of("Order", "Ship")),
                                List.of(Focus.of("Ship")))
                        .step("Ship", List.of(NodeMention.of("Ship")), List.of(), List.of());
    }

    @AfterEach
    void tearDown() {
        if (graphSight != null) {
            graphSight.close();
        }
    }

    private GraphSight build(GraphSightConfig config, SyntaxValidator validator) {
        graphSight =
                GraphSightFactory.builder()
                        .config(config)
                        .credential("TEST_API_KEY", "unused")
                        .oracle(oracle)
                        .responseParser(parser)
                        .syntaxValidator(validator)
                        .build();
        return graphSight;
    }

    private GraphSight build() {
        return build(new GraphSightConfig(), null);
    }

    @Nested
    class Interpret {

        @Test
        void shouldClassifyTraverseAndRefine() throws Exception {
            InterpretationResult result = build().interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.diagramType()).isEqualTo(DiagramType.FLOWCHART);
            assertThat(result.graph().nodeNames()).containsExactly("Order", "Ship");
            assertThat(result.content()).startsWith("flowchart TD").contains("Order --> Ship");
            assertThat(result.isComplete()).isTrue();
            assertThat(result.degraded()).isFalse();
            assertThat(result.steps()).isEqualTo(2);
            assertThat(result.callCount()).isEqualTo(5);
            assertThat(result.modelName()).isEqualTo("stub");
            assertThat(oracle.requests(RequestPurpose.CLASSIFY)).hasSize(1);
        }

        @Test
        void shouldMeterEachRunSeparately() throws Exception {
            GraphSight facade = build();

            InterpretationResult first = facade.interpret(IMAGE, OutputFormat.MERMAID);
            InterpretationResult second = facade.interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(first.callCount()).isEqualTo(5);
            assertThat(second.callCount()).isEqualTo(5);
            assertThat(oracle.callCount()).isEqualTo(10);
        }

        @Test
        void shouldNarrateWhenRequested() throws Exception {
            InterpretationResult result = build().interpret(IMAGE, OutputFormat.NATURAL_LANGUAGE);

            assertThat(result.outputFormat()).isEqualTo(OutputFormat.NATURAL_LANGUAGE);
            assertThat(result.rawContent()).startsWith("The flowchart has 2 steps");
        }

        @Test
        void shouldNotContactOracleWhenAlreadyCancelled() {
            CancellationToken cancellation = CancellationToken.create();
            cancellation.cancel();

            assertThatThrownBy(() -> build().interpret(IMAGE, OutputFormat.MERMAID, cancellation))
                    .isInstanceOf(InterpretationException.class)
                    .hasMessageContaining("cancelled");
            assertThat(oracle.callCount()).isZero();
        }

        @Test
        void shouldRejectMissingImage() {
            assertThatThrownBy(() -> build().interpret((DiagramImage) null, OutputFormat.MERMAID))
                    .isInstanceOf(InterpretationException.class)
                    .hasMessage("No image supplied");
        }

        @Test
        void shouldReportUnreadableFile(@TempDir Path dir) {
            Path missing = dir.resolve("missing.png");

            assertThatThrownBy(() -> build().interpret(missing, OutputFormat.MERMAID))
                    .isInstanceOf(InterpretationException.class)
                    .hasMessageContaining("Cannot read image");
        }
    }

    @Nested
    class Detection {

        @Test
        void shouldFallBackWhenDetectionFails() throws Exception {
            parser.classifyAs(DiagramType.UNKNOWN, 1.0);

            InterpretationResult result = build().interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.diagramType()).isEqualTo(DiagramType.FLOWCHART);
            assertThat(result.graph().nodeNames()).containsExactly("Order", "Ship");
        }

        @Test
        void shouldSurfaceDetectionFailureWithoutFallback() {
            parser.classifyAs(DiagramType.STATE, 0.1);

            GraphSight facade = build(GraphSightConfig.builder().fallbackDiagramType(null).build(), null);

            assertThatThrownBy(() -> facade.interpret(IMAGE, OutputFormat.MERMAID))
                    .isInstanceOf(InterpretationException.class)
                    .hasMessageContaining("Cannot determine diagram type")
                    .hasMessageContaining("Low confidence");
        }

        @Test
        void shouldUseFallbackStrategyForUnsupportedType() throws Exception {
            parser.classifyAs(DiagramType.CLASS, 0.95);

            InterpretationResult result = build().interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.diagramType()).isEqualTo(DiagramType.FLOWCHART);
        }

        @Test
        void shouldRejectUnsupportedTypeWithoutFallback() {
            parser.classifyAs(DiagramType.ER, 0.95);

            GraphSight facade = build(GraphSightConfig.builder().fallbackDiagramType(null).build(), null);

            assertThatThrownBy(() -> facade.interpret(IMAGE, OutputFormat.MERMAID))
                    .isInstanceOf(InterpretationException.class)
                    .hasMessageContaining("No strategy for diagram type erDiagram");
        }

        @Test
        void shouldUseDetectedStrategy() throws Exception {
            parser.classifyAs(DiagramType.SEQUENCE, 0.9);

            InterpretationResult result = build().interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.diagramType()).isEqualTo(DiagramType.SEQUENCE);
            assertThat(result.content()).startsWith("sequenceDiagram");
        }
    }

    @Nested
    class Validation {

        private SyntaxValidator validator;

        @BeforeEach
        void setUp() {
            validator = mock(SyntaxValidator.class);
        }

        @Test
        void shouldAttachParsedStructure() throws Exception {
            DiagramStructure structure = new DiagramStructure("TD", List.of("Order", "Ship"), 1);
            when(validator.isAvailable()).thenReturn(true);
            when(validator.validate(anyString())).thenReturn(structure);

            InterpretationResult result =
                    build(new GraphSightConfig(), validator).interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.structure()).isEqualTo(structure);
            verify(validator).validate(result.content());
        }

        @Test
        void shouldKeepResultWhenValidationFails() throws Exception {
            when(validator.isAvailable()).thenReturn(true);
            when(validator.validate(anyString())).thenThrow(new SyntaxValidationException("Parse error on line 2"));

            InterpretationResult result =
                    build(new GraphSightConfig(), validator).interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.structure()).isNull();
            assertThat(result.content()).startsWith("flowchart TD");
        }

        @Test
        void shouldSkipUnavailableValidator() throws Exception {
            when(validator.isAvailable()).thenReturn(false);

            InterpretationResult result =
                    build(new GraphSightConfig(), validator).interpret(IMAGE, OutputFormat.MERMAID);

            assertThat(result.structure()).isNull();
            verify(validator, never()).validate(anyString());
        }

        @Test
        void shouldNotValidateNarrative() throws Exception {
            when(validator.isAvailable()).thenReturn(true);

            build(new GraphSightConfig(), validator).interpret(IMAGE, OutputFormat.NATURAL_LANGUAGE);

            verify(validator, never()).validate(anyString());
        }
    }

    @Nested
    class Batch {

        @Test
        void shouldInterpretImagesIndependently() {
            DiagramImage other = new DiagramImage("other.png", new byte[] {4, 5, 6}, "image/png", 0, 0);

            List<CompletableFuture<InterpretationResult>> futures =
                    build().interpretAll(List.of(IMAGE, other), OutputFormat.MERMAID);

            assertThat(futures).hasSize(2);
            assertThat(futures)
                    .allSatisfy(
                            future -> {
                                InterpretationResult result = future.join();
                                assertThat(result.phase()).isEqualTo(TraversalPhase.DONE);
                                assertThat(result.callCount()).isEqualTo(5);
                            });
        }

        @Test
        void shouldFailOnlyTheAffectedFuture() {
            List<CompletableFuture<InterpretationResult>> futures =
                    build().interpretAll(Arrays.asList(IMAGE, null), OutputFormat.MERMAID);

            assertThat(futures.get(0).join().graph().nodeNames()).containsExactly("Order", "Ship");
            assertThatThrownBy(() -> futures.get(1).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(InterpretationException.class);
        }
    }
}
