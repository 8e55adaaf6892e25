package io.graphsight.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.DiagramType;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleTimeoutException;
import io.graphsight.core.oracle.RequestPurpose;
import io.graphsight.core.oracle.RetryPolicy;
import io.graphsight.core.oracle.stub.StubVisionOracle;
import io.graphsight.core.testing.ScriptedResponseParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OracleDiagramTypeDetectorTest {

    private static final DiagramImage IMAGE =
            new DiagramImage("diagram.png", new byte[] {7, 7, 7}, "image/png", 0, 0);

    private StubVisionOracle oracle;
    private OracleGateway gateway;
    private ScriptedResponseParser parser;

    @BeforeEach
    void setUp() {
        oracle = new StubVisionOracle();
        gateway = new OracleGateway(oracle, RetryPolicy.immediate(2));
        parser = new ScriptedResponseParser();
    }

    @Test
    void shouldReturnConfidentVerdict() throws Exception {
        parser.classifyAs(DiagramType.SEQUENCE, 0.9);

        DiagramType type = new OracleDiagramTypeDetector(parser, 0.5).classify(IMAGE, gateway);

        assertThat(type).isEqualTo(DiagramType.SEQUENCE);
        OracleRequest request = oracle.requests().get(0);
        assertThat(request.purpose()).isEqualTo(RequestPurpose.CLASSIFY);
        assertThat(request.image()).isEqualTo(IMAGE);
        assertThat(gateway.callCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectLowConfidence() {
        parser.classifyAs(DiagramType.STATE, 0.3);

        assertThatThrownBy(() -> new OracleDiagramTypeDetector(parser, 0.5).classify(IMAGE, gateway))
                .isInstanceOf(DetectorFailure.class)
                .hasMessageContaining("Low confidence");
    }

    @Test
    void shouldRejectUnknownType() {
        parser.classifyAs(DiagramType.UNKNOWN, 1.0);

        assertThatThrownBy(() -> new OracleDiagramTypeDetector(parser, 0.0).classify(IMAGE, gateway))
                .isInstanceOf(DetectorFailure.class)
                .hasMessageContaining("not recognized");
    }

    @Test
    void shouldFailOnMalformedReplies() {
        oracle.enqueue(ScriptedResponseParser.MALFORMED).enqueue(ScriptedResponseParser.MALFORMED);

        assertThatThrownBy(() -> new OracleDiagramTypeDetector(parser, 0.5).classify(IMAGE, gateway))
                .isInstanceOf(DetectorFailure.class)
                .hasMessageContaining("malformed");
    }

    @Test
    void shouldFailWhenOracleIsUnavailable() {
        oracle.enqueueFailure(new OracleTimeoutException("slow"))
                .enqueueFailure(new OracleTimeoutException("slow"));

        assertThatThrownBy(() -> new OracleDiagramTypeDetector(parser, 0.5).classify(IMAGE, gateway))
                .isInstanceOf(DetectorFailure.class)
                .hasMessageContaining("unavailable");
    }

    @Test
    void shouldRejectConfidenceThresholdOutsideRange() {
        assertThatThrownBy(() -> new OracleDiagramTypeDetector(parser, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
