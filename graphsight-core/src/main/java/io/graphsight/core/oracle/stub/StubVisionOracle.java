package io.graphsight.core.oracle.stub;

import io.graphsight.core.oracle.OracleException;
import io.graphsight.core.oracle.OracleRequest;
import io.graphsight.core.oracle.OracleResponse;
import io.graphsight.core.oracle.RequestPurpose;
import io.graphsight.core.oracle.TokenUsage;
import io.graphsight.core.oracle.VisionOracle;
import io.graphsight.core.util.ResponseText;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/// Scripted oracle that answers without calling an external service.
///
/// ### Reply Resolution Order
/// 1. The next scripted entry queued with {@link #enqueue(String)} or
///    {@link #enqueueFailure(OracleException)}
/// 2. The responder set with {@link #respondWith(Function)}
/// 3. A canned reply for the request's {@link RequestPurpose}: a flowchart
///    classification, a single `Start` focus, a terminal empty step, an audit that
///    checks nothing, and for refinement the first code fence of the instructions
///    echoed back
///
/// Every request is recorded and can be inspected with {@link #requests()}.
///
/// @implNote Thread-safe. All state is guarded by the instance monitor.
///
/// @see StubOracleProvider for enabling stub mode through the factory
public class StubVisionOracle implements VisionOracle {

    private static final Logger logger = Logger.getLogger(StubVisionOracle.class.getName());

    private static final long TOKENS_PER_CALL = 100;

    private final String modelName;
    private final Deque<Object> script = new ArrayDeque<>();
    private final List<OracleRequest> requests = new ArrayList<>();
    private Function<OracleRequest, String> responder;

    public StubVisionOracle() {
        this("stub");
    }

    public StubVisionOracle(String modelName) {
        this.modelName = modelName;
    }

    /// Queues a reply text.
    ///
    /// @param content reply content, not null
    /// @return this oracle for chaining, never null
    public synchronized StubVisionOracle enqueue(String content) {
        script.addLast(content);
        return this;
    }

    /// Queues a failure to be thrown by the next call.
    ///
    /// @param failure the exception to throw, not null
    /// @return this oracle for chaining, never null
    public synchronized StubVisionOracle enqueueFailure(OracleException failure) {
        script.addLast(failure);
        return this;
    }

    /// Sets the function answering requests once the script is exhausted.
    ///
    /// @param responder reply function, may be null to restore canned replies
    /// @return this oracle for chaining, never null
    public synchronized StubVisionOracle respondWith(Function<OracleRequest, String> responder) {
        this.responder = responder;
        return this;
    }

    @Override
    public synchronized OracleResponse query(OracleRequest request) throws OracleException {
        requests.add(request);
        logger.fine("[STUB] " + request.purpose() + " request #" + requests.size());

        Object next = script.pollFirst();
        if (next instanceof OracleException failure) {
            throw failure;
        }
        String content;
        if (next != null) {
            content = (String) next;
        } else if (responder != null) {
            content = responder.apply(request);
        } else {
            content = cannedReply(request);
        }
        return new OracleResponse(content, new TokenUsage(TOKENS_PER_CALL, TOKENS_PER_CALL), modelName);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    /// Returns a copy of all requests received so far.
    public synchronized List<OracleRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized int callCount() {
        return requests.size();
    }

    public synchronized List<OracleRequest> requests(RequestPurpose purpose) {
        return requests.stream().filter(r -> r.purpose() == purpose).toList();
    }

    private String cannedReply(OracleRequest request) {
        return switch (request.purpose()) {
            case CLASSIFY ->
                    "{\"diagram_type\": \"flowchart\", \"confidence\": 1.0, \"reasoning\": \"stub\"}";
            case INITIAL_FOCUS ->
                    "{\"start_nodes\": [{\"ref\": \"Start\", \"label\": \"Start\"}]}";
            case STEP ->
                    "{\"reasoning\": \"stub\", \"nodes\": [], \"edges\": [], \"next\": [], \"done\": true}";
            case AUDIT -> "{\"confirmed_incoming\": null, \"confirmed_outgoing\": null, \"notes\": \"stub\"}";
            case REFINE -> {
                String raw = ResponseText.firstFencedBlock(request.instructions());
                yield raw != null ? "```\n" + raw + "\n```" : "";
            }
        };
    }
}
