package io.graphsight.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.graphsight.core.synthesis.RawGraph;
import java.io.IOException;
import java.io.Serial;

/// Serializes a merged `RawGraph` using display names as node ids.
///
/// Emitted JSON shape:
/// ```json
/// {"nodes": [{"id": "Process_1", "label": "Process", "shape": "rect"}],
///  "edges": [{"source": "Process_1", "target": "End", "label": ""}]}
/// ```
///
/// `shape` is written as `null` when no step reported one. Identity keys are not
/// exported; the display names are unique within one graph.
///
/// @implNote Package-private. Registered by {@link GraphSightJacksonModule}.
class RawGraphSerializer extends StdSerializer<RawGraph> {

    @Serial private static final long serialVersionUID = 4127305566981740212L;

    RawGraphSerializer() {
        super(RawGraph.class);
    }

    @Override
    public void serialize(RawGraph graph, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();

        gen.writeArrayFieldStart("nodes");
        for (RawGraph.GraphNode node : graph.nodes()) {
            gen.writeStartObject();
            gen.writeStringField("id", node.name());
            gen.writeStringField("label", node.label());
            gen.writeStringField("shape", node.shape());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("edges");
        for (RawGraph.GraphEdge edge : graph.edges()) {
            gen.writeStartObject();
            gen.writeStringField("source", edge.sourceName());
            gen.writeStringField("target", edge.targetName());
            gen.writeStringField("label", edge.label());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }
}
