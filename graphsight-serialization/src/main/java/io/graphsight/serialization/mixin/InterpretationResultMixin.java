package io.graphsight.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.graphsight.core.validation.DiagramStructure;

/// Jackson mixin fixing the exported shape of `InterpretationResult`.
///
/// Renames the two flags to `is_partial` / `is_degraded`, drops the derived
/// `isComplete()` view and omits `structure` when the result was not validated.
/// Property names are otherwise produced by the mapper's snake-case strategy.
///
/// @see io.graphsight.serialization.GraphSightJacksonModule
@JsonPropertyOrder({
    "diagram_type",
    "output_format",
    "content",
    "raw_content",
    "is_partial",
    "is_degraded",
    "call_count",
    "approximate_cost",
    "usage",
    "model_name",
    "steps",
    "phase",
    "termination_reason",
    "graph",
    "structure"
})
public abstract class InterpretationResultMixin {

    @JsonProperty("is_partial")
    abstract boolean partial();

    @JsonProperty("is_degraded")
    abstract boolean degraded();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    abstract DiagramStructure structure();

    @JsonIgnore
    abstract boolean isComplete();
}
