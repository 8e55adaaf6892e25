package io.graphsight.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.graphsight.core.InterpretationResult;

/// Utility class for exporting interpretation results as JSON.
///
/// ### Usage
/// {@snippet :
/// InterpretationResult result = graphSight.interpret(image, OutputFormat.MERMAID);
/// String json = ResultSerializer.toJson(result);
/// }
///
/// The export is one-way: results are reports, not state to restore.
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see GraphSightJacksonModule for the registered type handlers
public final class ResultSerializer {

    private ResultSerializer() {}

    /// Serializes a result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(InterpretationResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for result export.
    ///
    /// Registers `GraphSightJacksonModule`, uses snake-case property names and indents
    /// the output.
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GraphSightJacksonModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
