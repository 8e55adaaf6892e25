package io.graphsight.core.detect;

import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.oracle.OracleGateway;

/// Classifies a diagram image into a diagram family.
///
/// The gateway is the one of the current run, so detection calls count toward the
/// run's call count and cost.
public interface DiagramTypeDetector {

    /// @param image the diagram, not null
    /// @param oracle gateway of the current run, not null
    /// @return the detected type, never {@link DiagramType#UNKNOWN}
    /// @throws DetectorFailure if the type cannot be determined
    DiagramType classify(DiagramImage image, OracleGateway oracle) throws DetectorFailure;
}
