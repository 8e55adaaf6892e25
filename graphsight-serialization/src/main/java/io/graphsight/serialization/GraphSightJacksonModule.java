package io.graphsight.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.graphsight.core.InterpretationResult;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.synthesis.RawGraph;
import io.graphsight.serialization.mixin.InterpretationResultMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all GraphSight export configuration in one place.
///
/// - `RawGraph`: {@link RawGraphSerializer}, display names as ids
/// - `DiagramType`: {@link DiagramTypeSerializer}, wire names
/// - `InterpretationResult`: {@link InterpretationResultMixin}, flag names and ordering
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see ResultSerializer for the convenience factory API
public class GraphSightJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3390457188140296527L;

    public GraphSightJacksonModule() {
        super("GraphSightJacksonModule");

        addSerializer(RawGraph.class, new RawGraphSerializer());
        addSerializer(DiagramType.class, new DiagramTypeSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(InterpretationResult.class, InterpretationResultMixin.class);
    }
}
