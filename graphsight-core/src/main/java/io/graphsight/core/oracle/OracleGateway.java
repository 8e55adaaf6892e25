package io.graphsight.core.oracle;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Applies the failure policy of the oracle boundary and meters its use.
///
/// Every oracle call made during one traversal goes through one gateway, which:
/// - retries timeouts and rate limits with exponential backoff up to
///   {@link RetryPolicy#maxAttempts()}, then raises {@link OracleUnavailableException}
/// - answers a malformed reply with exactly one clarifying re-prompt; a second
///   malformed reply yields an empty result instead of an exception
/// - treats any other {@link OracleException} as fatal
/// - counts calls, tokens and approximate cost
///
/// ### Contracts
/// - **Postcondition**: {@link #callCount()} equals the number of completed
///   {@link VisionOracle#query} calls, including retried and re-prompted ones that
///   returned a reply
///
/// @implNote **Not thread-safe**. Create one gateway per traversal.
///
/// @see RetryPolicy
public class OracleGateway {

    private static final Logger logger = Logger.getLogger(OracleGateway.class.getName());

    private final VisionOracle oracle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private int callCount;
    private int failedAttempts;
    private TokenUsage usage = TokenUsage.zero();

    /// Creates a gateway over the given oracle.
    ///
    /// @param oracle the transport, not null
    /// @param retryPolicy backoff settings, not null
    public OracleGateway(VisionOracle oracle, RetryPolicy retryPolicy) {
        this(oracle, retryPolicy, duration -> Thread.sleep(duration.toMillis()));
    }

    OracleGateway(VisionOracle oracle, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.oracle = Objects.requireNonNull(oracle, "oracle must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Asks the oracle and reads its reply.
    ///
    /// @param request the question, not null
    /// @param reader converts the reply, not null
    /// @param <T> the value type
    /// @return the value, or empty when the reply stayed malformed after the re-prompt
    /// @throws OracleUnavailableException if retries were exhausted or the failure is not
    ///     retryable
    public <T> Optional<T> ask(OracleRequest request, ResponseReader<T> reader)
            throws OracleUnavailableException {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(reader, "reader must not be null");

        OracleResponse response = send(request);
        try {
            return Optional.of(reader.read(response));
        } catch (OracleMalformedResponseException first) {
            logger.warning(
                    "Malformed "
                            + request.purpose()
                            + " reply, re-prompting once: "
                            + first.getMessage());
            OracleResponse retried = send(request.withClarification(first.getMessage()));
            try {
                return Optional.of(reader.read(retried));
            } catch (OracleMalformedResponseException second) {
                logger.warning(
                        "Reply to "
                                + request.purpose()
                                + " still malformed after re-prompt, discarding: "
                                + second.getMessage());
                return Optional.empty();
            }
        }
    }

    /// Sends a request, retrying transient failures.
    ///
    /// @param request the question, not null
    /// @return the raw reply, never null
    /// @throws OracleUnavailableException if retries were exhausted or the failure is not
    ///     retryable
    public OracleResponse send(OracleRequest request) throws OracleUnavailableException {
        OracleException lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                backoff(attempt, lastFailure);
            }
            try {
                OracleResponse response = oracle.query(request);
                record(response);
                return response;
            } catch (OracleTimeoutException | OracleRateLimitException e) {
                failedAttempts++;
                lastFailure = e;
                logger.warning(
                        "Oracle "
                                + request.purpose()
                                + " attempt "
                                + attempt
                                + "/"
                                + retryPolicy.maxAttempts()
                                + " failed: "
                                + e.getMessage());
            } catch (OracleUnavailableException e) {
                failedAttempts++;
                throw e;
            } catch (OracleException e) {
                failedAttempts++;
                logger.severe("Oracle " + request.purpose() + " failed: " + e.getMessage());
                throw new OracleUnavailableException(
                        "Oracle call failed: " + e.getMessage(), attempt, e);
            }
        }
        logger.severe(
                "Oracle "
                        + request.purpose()
                        + " unavailable after "
                        + retryPolicy.maxAttempts()
                        + " attempts");
        throw new OracleUnavailableException(
                "Oracle unavailable after " + retryPolicy.maxAttempts() + " attempts",
                retryPolicy.maxAttempts(),
                lastFailure);
    }

    private void backoff(int attempt, OracleException lastFailure)
            throws OracleUnavailableException {
        Duration delay = retryPolicy.delayBefore(attempt);
        if (delay.isZero()) {
            return;
        }
        logger.fine("Backing off " + delay.toMillis() + "ms before attempt " + attempt);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException(
                    "Interrupted while waiting to retry", attempt - 1, lastFailure);
        }
    }

    private void record(OracleResponse response) {
        callCount++;
        usage = usage.plus(response.usage());
    }

    // ---------------------------------------------------------------------
    // Metering
    // ---------------------------------------------------------------------

    /// Returns the number of calls that returned a reply.
    public int callCount() {
        return callCount;
    }

    /// Returns the number of calls that failed, whether or not they were retried.
    public int failedAttempts() {
        return failedAttempts;
    }

    public TokenUsage usage() {
        return usage;
    }

    /// Returns the approximate USD cost of all replies so far.
    public double approximateCost() {
        return oracle.estimateCost(usage);
    }

    public String modelName() {
        return oracle.modelName();
    }

    /// Waits between retry attempts.
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
