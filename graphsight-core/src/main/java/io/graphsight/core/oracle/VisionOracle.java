package io.graphsight.core.oracle;

/// External visual-reasoning service queried by the traversal.
///
/// The oracle is treated as opaque and unreliable: it may time out, throttle, or reply
/// with text that does not follow the requested format. Implementations only transport
/// requests and report failures with the appropriate {@link OracleException} subtype;
/// retrying and re-prompting belong to {@link OracleGateway}.
///
/// ### Contracts
/// - **Precondition**: `request` is not null
/// - **Postcondition**: a returned response is never null
///
/// @implNote Implementations must be thread-safe. Independent traversals may share one
/// oracle instance.
///
/// @see io.graphsight.core.oracle.stub.StubVisionOracle for a scripted implementation
public interface VisionOracle {

    /// Sends one request to the oracle.
    ///
    /// @param request the question, not null
    /// @return the raw reply, never null
    /// @throws OracleTimeoutException if the call did not complete in time
    /// @throws OracleRateLimitException if the provider throttled the call
    /// @throws OracleException for any other transport or provider failure
    OracleResponse query(OracleRequest request) throws OracleException;

    /// Returns the model identifier used for logging and result metadata.
    String modelName();

    /// Estimates the USD cost of the given usage for this oracle's model.
    ///
    /// @param usage token counts, not null
    /// @return approximate cost in USD, zero when pricing is unknown
    default double estimateCost(TokenUsage usage) {
        return 0.0;
    }
}
