package io.graphsight.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphsight.core.validation.DiagramStructure;
import io.graphsight.core.validation.SyntaxValidationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class NodeMermaidSyntaxValidatorTest {

    private static final String MISSING_COMMAND = "graphsight-no-such-node-binary";

    @Nested
    class OutputParsing {

        private final NodeMermaidSyntaxValidator validator = new NodeMermaidSyntaxValidator();

        @Test
        void shouldMapBridgeOutputToStructure() throws Exception {
            String stdout =
                    """
                    {"direction":"LR","nodes":[{"id":"A","label":"Start","shape":"stadium"},\
                    {"id":"B","label":"Valid?","shape":"diamond"}],\
                    "edges":[{"source":"A","target":"B","label":""}]}
                    """;

            DiagramStructure structure = validator.parseOutput(stdout);

            assertThat(structure.direction()).isEqualTo("LR");
            assertThat(structure.nodeIds()).containsExactly("A", "B");
            assertThat(structure.nodeCount()).isEqualTo(2);
            assertThat(structure.edgeCount()).isEqualTo(1);
        }

        @Test
        void shouldAcceptMissingCollections() throws Exception {
            DiagramStructure structure = validator.parseOutput("{\"direction\": null}");

            assertThat(structure.direction()).isNull();
            assertThat(structure.nodeIds()).isEmpty();
            assertThat(structure.edgeCount()).isZero();
        }

        @Test
        void shouldRejectEmptyOutput() {
            assertThatThrownBy(() -> validator.parseOutput("  \n"))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("empty output");
        }

        @Test
        void shouldRejectNonJsonOutput() {
            assertThatThrownBy(() -> validator.parseOutput("Error: Cannot find module 'mermaid'"))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("Unreadable");
        }
    }

    @Nested
    class MissingRuntime {

        private final NodeMermaidSyntaxValidator validator =
                new NodeMermaidSyntaxValidator(MISSING_COMMAND, null, Duration.ofSeconds(5));

        @Test
        void shouldReportUnavailable() {
            assertThat(validator.isAvailable()).isFalse();
        }

        @Test
        void shouldFailValidationWhenCommandCannotStart() {
            assertThatThrownBy(() -> validator.validate("flowchart TD\n    A --> B"))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("Failed to run Mermaid parser");
        }

        @Test
        void shouldRejectBlankCodeBeforeStartingProcess() {
            assertThatThrownBy(() -> validator.validate("   "))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("empty");
        }
    }

    /// Runs shell scripts in place of Node.js to drive the process handling.
    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class ScriptedRuntime {

        @TempDir Path tempDir;

        private Path script(String name, String body) throws IOException {
            Path script = tempDir.resolve(name);
            Files.writeString(script, "#!/bin/sh\n" + body + "\n");
            assertThat(script.toFile().setExecutable(true)).isTrue();
            return script;
        }

        @Test
        void shouldKillParserThatOutlivesTimeout() throws Exception {
            Path hanging = script("hanging.sh", "exec sleep 10");
            NodeMermaidSyntaxValidator validator =
                    new NodeMermaidSyntaxValidator(hanging.toString(), null, Duration.ofSeconds(1));

            long started = System.nanoTime();
            assertThatThrownBy(() -> validator.validate("flowchart TD\n    A --> B"))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("timed out");

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }

        @Test
        void shouldReadStructureFromParserOutput() throws Exception {
            Path parser =
                    script(
                            "parser.sh",
                            "cat > /dev/null\n"
                                    + "echo '{\"direction\":\"TD\",\"nodes\":[{\"id\":\"A\"},{\"id\":\"B\"}],"
                                    + "\"edges\":[{\"source\":\"A\",\"target\":\"B\"}]}'");
            NodeMermaidSyntaxValidator validator =
                    new NodeMermaidSyntaxValidator(parser.toString(), null, Duration.ofSeconds(10));

            DiagramStructure structure = validator.validate("flowchart TD\n    A --> B");

            assertThat(structure.direction()).isEqualTo("TD");
            assertThat(structure.nodeIds()).containsExactly("A", "B");
            assertThat(structure.edgeCount()).isEqualTo(1);
        }

        @Test
        void shouldReportParserErrorOutput() throws Exception {
            Path failing = script("failing.sh", "cat > /dev/null\necho 'Parse error on line 2' >&2\nexit 1");
            NodeMermaidSyntaxValidator validator =
                    new NodeMermaidSyntaxValidator(failing.toString(), null, Duration.ofSeconds(10));

            assertThatThrownBy(() -> validator.validate("flowchart TD\n    A -->"))
                    .isInstanceOf(SyntaxValidationException.class)
                    .hasMessageContaining("Parse error on line 2");
        }
    }

    @Test
    void shouldBundleParserScript() {
        assertThat(NodeMermaidSyntaxValidator.class.getResource(NodeMermaidSyntaxValidator.SCRIPT_RESOURCE))
                .isNotNull();
    }
}
