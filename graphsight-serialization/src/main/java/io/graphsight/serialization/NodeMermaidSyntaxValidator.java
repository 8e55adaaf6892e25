package io.graphsight.serialization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.graphsight.core.util.ResponseText;
import io.graphsight.core.validation.DiagramStructure;
import io.graphsight.core.validation.SyntaxValidationException;
import io.graphsight.core.validation.SyntaxValidator;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// {@link SyntaxValidator} that runs the official Mermaid parser under Node.js.
///
/// The bundled `mermaid_parser.mjs` script is extracted to a temporary file on first
/// use and run as `node <script>` with the diagram code on stdin. The script prints
/// `{"direction", "nodes": [{"id", "label", "shape"}], "edges": [{"source", "target", "label"}]}`
/// which is mapped to a {@link DiagramStructure}.
///
/// ### Contracts
/// - **Precondition**: `node` is on the `PATH` (or the configured command is runnable)
///   and the `mermaid` and `jsdom` packages resolve from the working directory
/// - **Postcondition**: `validate` returns a structure or throws; it never returns null
///
/// @implNote Thread-safe. Each call starts its own process; script extraction is
/// synchronized.
public class NodeMermaidSyntaxValidator implements SyntaxValidator {

    private static final Logger logger =
            Logger.getLogger(NodeMermaidSyntaxValidator.class.getName());

    static final String SCRIPT_RESOURCE = "mermaid_parser.mjs";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String nodeCommand;
    private final Path workingDirectory;
    private final Duration timeout;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Path scriptPath;
    private Boolean available;

    /// Creates a validator running `node` in the current directory.
    public NodeMermaidSyntaxValidator() {
        this("node", null, DEFAULT_TIMEOUT);
    }

    /// Creates a validator with an explicit Node.js command.
    ///
    /// @param nodeCommand executable to run, not null
    /// @param workingDirectory directory holding `node_modules`, may be null for the current one
    /// @param timeout maximum time one parse may take, not null; on expiry the process
///     is killed and the parse fails
    public NodeMermaidSyntaxValidator(String nodeCommand, Path workingDirectory, Duration timeout) {
        this.nodeCommand = Objects.requireNonNull(nodeCommand, "nodeCommand must not be null");
        this.workingDirectory = workingDirectory;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// Returns `true` when `<node> --version` exits successfully. The answer is cached.
    @Override
    public synchronized boolean isAvailable() {
        if (available == null) {
            available = probe();
        }
        return available;
    }

    @Override
    public DiagramStructure validate(String code) throws SyntaxValidationException {
        Objects.requireNonNull(code, "code must not be null");
        if (code.isBlank()) {
            throw new SyntaxValidationException("Diagram code is empty");
        }

        Path script = extractScript();
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("graphsight-mermaid", ".out");
            stderrFile = Files.createTempFile("graphsight-mermaid", ".err");
            ProcessBuilder pb = new ProcessBuilder(List.of(nodeCommand, script.toString()));
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            Process process = pb.start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(code.getBytes(StandardCharsets.UTF_8));
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new SyntaxValidationException(
                        "Mermaid parser timed out after " + timeout.toMillis() + "ms");
            }

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
                logger.warning("Mermaid parser rejected diagram (exit " + exitCode + "): " + stderr);
                throw new SyntaxValidationException(
                        "Mermaid parser rejected diagram: "
                                + (stderr.isEmpty() ? "exit code " + exitCode : stderr));
            }
            return parseOutput(Files.readString(stdoutFile, StandardCharsets.UTF_8));

        } catch (IOException e) {
            throw new SyntaxValidationException("Failed to run Mermaid parser: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyntaxValidationException("Interrupted while waiting for Mermaid parser", e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /// Maps the script's JSON output to a structure.
    ///
    /// @param stdout script output, not null
    /// @return parsed structure, never null
    /// @throws SyntaxValidationException if the output is empty or not the expected JSON
    DiagramStructure parseOutput(String stdout) throws SyntaxValidationException {
        if (stdout.isBlank()) {
            throw new SyntaxValidationException("Mermaid parser returned empty output");
        }
        try {
            BridgeOutput output = objectMapper.readValue(stdout.trim(), BridgeOutput.class);
            List<String> ids = new ArrayList<>();
            if (output.nodes() != null) {
                for (BridgeNode node : output.nodes()) {
                    if (node != null && node.id() != null) {
                        ids.add(node.id());
                    }
                }
            }
            int edgeCount = output.edges() != null ? output.edges().size() : 0;
            return new DiagramStructure(output.direction(), ids, edgeCount);
        } catch (JsonProcessingException e) {
            throw new SyntaxValidationException(
                    "Unreadable Mermaid parser output: " + ResponseText.abbreviate(stdout, 120), e);
        }
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private boolean probe() {
        try {
            Process process =
                    new ProcessBuilder(List.of(nodeCommand, "--version"))
                            .redirectErrorStream(true)
                            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                            .start();
            boolean finished = process.waitFor(10, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            logger.info("Node.js not available (" + nodeCommand + "): " + e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private synchronized Path extractScript() throws SyntaxValidationException {
        if (scriptPath != null && Files.exists(scriptPath)) {
            return scriptPath;
        }
        try (InputStream in = NodeMermaidSyntaxValidator.class.getResourceAsStream(SCRIPT_RESOURCE)) {
            if (in == null) {
                throw new SyntaxValidationException("Bundled script not found: " + SCRIPT_RESOURCE);
            }
            Path target = Files.createTempFile("graphsight-mermaid-parser", ".mjs");
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            target.toFile().deleteOnExit();
            scriptPath = target;
            return target;
        } catch (IOException e) {
            throw new SyntaxValidationException("Failed to extract Mermaid parser script", e);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.fine("Could not delete " + file + ": " + e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BridgeOutput(
            @JsonProperty("direction") String direction,
            @JsonProperty("nodes") List<BridgeNode> nodes,
            @JsonProperty("edges") List<Object> edges) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BridgeNode(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("shape") String shape) {}
}
