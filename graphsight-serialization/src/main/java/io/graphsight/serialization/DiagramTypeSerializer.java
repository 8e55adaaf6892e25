package io.graphsight.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.graphsight.core.graph.DiagramType;
import java.io.IOException;
import java.io.Serial;

/// Writes a `DiagramType` as its wire name (`flowchart`, `sequenceDiagram`, ...), the same
/// keyword the oracle answers with during classification.
///
/// @implNote Package-private. Registered by {@link GraphSightJacksonModule}.
class DiagramTypeSerializer extends StdSerializer<DiagramType> {

    @Serial private static final long serialVersionUID = -2985316625470815093L;

    DiagramTypeSerializer() {
        super(DiagramType.class);
    }

    @Override
    public void serialize(DiagramType type, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(type.wireName());
    }
}
