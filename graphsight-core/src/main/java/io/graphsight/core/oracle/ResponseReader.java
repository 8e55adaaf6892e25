package io.graphsight.core.oracle;

/// Turns a raw oracle reply into a typed value.
///
/// @param <T> the value type
@FunctionalInterface
public interface ResponseReader<T> {

    /// Reads the reply.
    ///
    /// @param response raw reply, not null
    /// @return the value, never null
    /// @throws OracleMalformedResponseException if the reply does not have the expected shape
    T read(OracleResponse response) throws OracleMalformedResponseException;
}
