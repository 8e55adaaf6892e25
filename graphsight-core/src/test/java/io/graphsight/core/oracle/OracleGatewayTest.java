package io.graphsight.core.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.graphsight.core.oracle.stub.StubVisionOracle;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OracleGatewayTest {

    private static final OracleRequest REQUEST =
            OracleRequest.textOnly(RequestPurpose.STEP, "system", "describe the node");

    private static final ResponseReader<String> STRICT =
            response -> {
                if (!response.content().startsWith("ok")) {
                    throw new OracleMalformedResponseException("expected ok, got " + response.content());
                }
                return response.content();
            };

    private StubVisionOracle oracle;
    private List<Duration> sleeps;
    private OracleGateway gateway;

    @BeforeEach
    void setUp() {
        oracle = new StubVisionOracle("test-model");
        sleeps = new ArrayList<>();
        gateway = new OracleGateway(oracle, RetryPolicy.defaults(), sleeps::add);
    }

    @Nested
    class Retries {

        @Test
        void shouldRetryTimeoutsWithBackoff() throws Exception {
            oracle.enqueueFailure(new OracleTimeoutException("slow"))
                    .enqueueFailure(new OracleRateLimitException("busy"))
                    .enqueue("ok");

            OracleResponse response = gateway.send(REQUEST);

            assertThat(response.content()).isEqualTo("ok");
            assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
            assertThat(gateway.callCount()).isEqualTo(1);
            assertThat(gateway.failedAttempts()).isEqualTo(2);
        }

        @Test
        void shouldGiveUpAfterMaxAttempts() {
            oracle.enqueueFailure(new OracleTimeoutException("slow"))
                    .enqueueFailure(new OracleTimeoutException("slow"))
                    .enqueueFailure(new OracleTimeoutException("slow"));

            assertThatThrownBy(() -> gateway.send(REQUEST))
                    .isInstanceOf(OracleUnavailableException.class)
                    .hasCauseInstanceOf(OracleTimeoutException.class)
                    .satisfies(e -> assertThat(((OracleUnavailableException) e).getAttempts()).isEqualTo(3));
            assertThat(oracle.callCount()).isEqualTo(3);
        }

        @Test
        void shouldNotRetryOtherFailures() {
            oracle.enqueueFailure(new OracleException("bad credentials"));

            assertThatThrownBy(() -> gateway.send(REQUEST))
                    .isInstanceOf(OracleUnavailableException.class)
                    .hasMessageContaining("bad credentials");
            assertThat(oracle.callCount()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Nested
    class Reprompting {

        @Test
        void shouldRepromptOnceWithClarification() throws Exception {
            oracle.enqueue("garbage").enqueue("ok then");

            Optional<String> value = gateway.ask(REQUEST, STRICT);

            assertThat(value).contains("ok then");
            assertThat(oracle.requests()).hasSize(2);
            assertThat(oracle.requests().get(1).instructions())
                    .startsWith("describe the node")
                    .contains("expected ok, got garbage");
        }

        @Test
        void shouldReturnEmptyAfterSecondMalformedReply() throws Exception {
            oracle.enqueue("garbage").enqueue("still garbage").enqueue("ok");

            Optional<String> value = gateway.ask(REQUEST, STRICT);

            assertThat(value).isEmpty();
            assertThat(oracle.callCount()).isEqualTo(2);
        }
    }

    @Nested
    class Metering {

        @Test
        void shouldAccumulateUsageAndCost() throws Exception {
            VisionOracle priced = mock(VisionOracle.class);
            when(priced.query(any()))
                    .thenReturn(new OracleResponse("ok", new TokenUsage(1000, 200), "priced"));
            when(priced.estimateCost(any()))
                    .thenAnswer(inv -> ((TokenUsage) inv.getArgument(0)).totalTokens() / 1_000_000.0);
            when(priced.modelName()).thenReturn("priced");
            OracleGateway metered = new OracleGateway(priced, RetryPolicy.immediate(1));

            metered.send(REQUEST);
            metered.send(REQUEST);

            assertThat(metered.callCount()).isEqualTo(2);
            assertThat(metered.usage()).isEqualTo(new TokenUsage(2000, 400));
            assertThat(metered.approximateCost()).isEqualTo(0.0024);
            assertThat(metered.modelName()).isEqualTo("priced");
            verify(priced, times(2)).query(REQUEST);
        }
    }
}
