package io.graphsight.core.engine;

import io.graphsight.core.InterpretationResult;
import io.graphsight.core.context.ContextPayload;
import io.graphsight.core.context.HistoryContextBuilder;
import io.graphsight.core.engine.TraversalEvent.FocusSkipped;
import io.graphsight.core.engine.TraversalEvent.FocusVisited;
import io.graphsight.core.engine.TraversalEvent.NodeAudited;
import io.graphsight.core.engine.TraversalEvent.PhaseChanged;
import io.graphsight.core.engine.TraversalState.FrontierEntry;
import io.graphsight.core.graph.AuditSubject;
import io.graphsight.core.graph.DiagramImage;
import io.graphsight.core.graph.EdgeMention;
import io.graphsight.core.graph.Fingerprint;
import io.graphsight.core.graph.Focus;
import io.graphsight.core.graph.NodeIdentity;
import io.graphsight.core.graph.NodeKey;
import io.graphsight.core.graph.NodeMention;
import io.graphsight.core.history.AuditVerdict;
import io.graphsight.core.history.ExtractedFragment;
import io.graphsight.core.history.ExtractedFragment.FragmentEdge;
import io.graphsight.core.history.ExtractedFragment.FragmentNode;
import io.graphsight.core.history.HistoryEntry;
import io.graphsight.core.history.StepInterpretation;
import io.graphsight.core.identity.FingerprintMatcher;
import io.graphsight.core.identity.NodeIdentityResolver;
import io.graphsight.core.oracle.OracleGateway;
import io.graphsight.core.oracle.OracleUnavailableException;
import io.graphsight.core.strategy.Strategy;
import io.graphsight.core.synthesis.RawGraph;
import io.graphsight.core.synthesis.SynthesisOutcome;
import io.graphsight.core.synthesis.Synthesizer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Drives the incremental exploration of one diagram.
///
/// The engine owns the traversal: it seeds the frontier from the strategy's initial
/// foci, explores one focus per iteration through the oracle, resolves every mention to
/// a stable identity, records history, optionally audits the recorded connections, and
/// finally hands the fragments to the {@link Synthesizer}. Strategies contribute diagram
/// knowledge only. The {@link FrontierOrder} decides whether new candidates wait behind
/// pending foci or go ahead of them.
///
/// ### Iteration
/// 1. Stop if cancelled.
/// 2. Pop foci whose identity was visited since they were enqueued, recording a skip
///    marker for each, without calling the oracle.
/// 3. Stop if the budget is exhausted.
/// 4. Build the context payload from history and ask the oracle about the focus.
/// 5. Resolve node mentions, next foci and edge endpoints; the focus's own reference
///    always maps to the explored identity.
/// 6. Mark the identity visited, enqueue candidates that are not visited, record a skip
///    marker for those that are, append the visit to history.
///
/// ### Termination
/// The loop ends on an empty frontier, an exhausted budget, cancellation, or an
/// unavailable oracle. The iteration cap holds however many foci the oracle proposes.
///
/// ### Audit
/// When audit rounds are enabled and the frontier ran dry, every visited node is put
/// back to the oracle with its currently recorded neighbours:
/// - outgoing edges to nodes the oracle does not confirm are retracted
/// - confirmed neighbours without an edge get one; unknown names become new nodes
/// - confirmed incoming neighbours only ever add edges
///
/// Corrections are appended to history as {@link HistoryEntry.Audit} entries and never
/// change earlier entries. Later rounds re-audit only nodes whose edges no longer agree
/// with their last verdict, until nothing changes or the round cap is reached. Audits
/// are bounded by the cost and duration limits, not the iteration cap.
///
/// ### Failure handling
/// - Oracle unavailable before the first focus is known: {@link InterpretationException}
/// - Oracle unavailable later: phase `FAILED`, partial result from gathered fragments
/// - Malformed step reply (after one re-prompt): recorded as an empty visit
/// - Cancellation or cost exhaustion: refinement is skipped, raw content returned
///
/// @implNote Thread-safe. All per-run state lives in a {@link TraversalState} created by
/// {@link #run}, so one engine can serve concurrent traversals. Observers are held in a
/// copy-on-write list.
///
/// @see Strategy
/// @see TraversalBudget
public class GraphInterpreterEngine {

    private static final Logger logger = Logger.getLogger(GraphInterpreterEngine.class.getName());

    private final TraversalBudget budget;
    private final FingerprintMatcher matcher;
    private final HistoryContextBuilder contextBuilder;
    private final Synthesizer synthesizer;
    private final Clock clock;
    private final FrontierOrder frontierOrder;
    private final int auditRounds;
    private final List<TraversalObserver> observers = new CopyOnWriteArrayList<>();

    /// Creates an engine with the default context builder and synthesizer.
    ///
    /// @param budget traversal limits, not null
    /// @param matcher fingerprint policy for identity resolution, not null
    public GraphInterpreterEngine(TraversalBudget budget, FingerprintMatcher matcher) {
        this(budget, matcher, FrontierOrder.BREADTH_FIRST, 0);
    }

    /// Creates an engine with the default context builder and synthesizer.
    ///
    /// @param budget traversal limits, not null
    /// @param matcher fingerprint policy for identity resolution, not null
    /// @param frontierOrder where newly found candidates join the frontier, not null
    /// @param auditRounds maximum audit rounds after exploration, 0 to disable
    public GraphInterpreterEngine(
            TraversalBudget budget,
            FingerprintMatcher matcher,
            FrontierOrder frontierOrder,
            int auditRounds) {
        this(
                budget,
                matcher,
                new HistoryContextBuilder(),
                new Synthesizer(),
                Clock.systemUTC(),
                frontierOrder,
                auditRounds);
    }

    /// Creates an engine with explicit collaborators.
    ///
    /// @param budget traversal limits, not null
    /// @param matcher fingerprint policy for identity resolution, not null
    /// @param contextBuilder history-to-context function, not null
    /// @param synthesizer fragment merger, not null
    /// @param clock time source for the duration limit, not null
    public GraphInterpreterEngine(
            TraversalBudget budget,
            FingerprintMatcher matcher,
            HistoryContextBuilder contextBuilder,
            Synthesizer synthesizer,
            Clock clock) {
        this(budget, matcher, contextBuilder, synthesizer, clock, FrontierOrder.BREADTH_FIRST, 0);
    }

    /// Creates an engine with explicit collaborators and exploration policy.
    ///
    /// @param budget traversal limits, not null
    /// @param matcher fingerprint policy for identity resolution, not null
    /// @param contextBuilder history-to-context function, not null
    /// @param synthesizer fragment merger, not null
    /// @param clock time source for the duration limit, not null
    /// @param frontierOrder where newly found candidates join the frontier, not null
    /// @param auditRounds maximum audit rounds after exploration, 0 to disable
    /// @throws IllegalArgumentException if `auditRounds` is negative
    public GraphInterpreterEngine(
            TraversalBudget budget,
            FingerprintMatcher matcher,
            HistoryContextBuilder contextBuilder,
            Synthesizer synthesizer,
            Clock clock,
            FrontierOrder frontierOrder,
            int auditRounds) {
        if (auditRounds < 0) {
            throw new IllegalArgumentException("auditRounds must not be negative, got " + auditRounds);
        }
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.frontierOrder = Objects.requireNonNull(frontierOrder, "frontierOrder must not be null");
        this.auditRounds = auditRounds;
    }

    /// Registers an observer for traversal events.
    ///
    /// @param observer the observer, not null
    public void addObserver(TraversalObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer must not be null"));
    }

    public void removeObserver(TraversalObserver observer) {
        observers.remove(observer);
    }

    public TraversalBudget getBudget() {
        return budget;
    }

    public FrontierOrder getFrontierOrder() {
        return frontierOrder;
    }

    public int getAuditRounds() {
        return auditRounds;
    }

    /// Interprets a diagram.
    ///
    /// @param image the diagram, not null
    /// @param strategy diagram-family strategy, not null
    /// @param oracle gateway of this run, not null
    /// @param cancellation cancellation signal, not null
    /// @return the result, possibly partial, never null
    /// @throws InterpretationException if the oracle was unavailable before any focus
    ///     was found
    public InterpretationResult run(
            DiagramImage image,
            Strategy strategy,
            OracleGateway oracle,
            CancellationToken cancellation)
            throws InterpretationException {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(oracle, "oracle must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        TraversalState state =
                new TraversalState(new NodeIdentityResolver(matcher), clock.instant());
        enterPhase(state, TraversalPhase.INIT);
        logger.info(
                "Interpreting "
                        + image.name()
                        + " as "
                        + strategy.diagramType().wireName()
                        + " ("
                        + strategy.outputFormat()
                        + ")");

        if (!cancellation.isCancelled()) {
            seed(image, strategy, oracle, state);
        }

        enterPhase(state, TraversalPhase.EXPLORING);
        Stop stop = explore(image, strategy, oracle, cancellation, state);
        logger.info(
                "Exploration stopped after "
                        + state.iterations()
                        + " steps: "
                        + stop.reason()
                        + " ("
                        + state.frontier().size()
                        + " foci left)");

        if (stop.kind() == StopKind.EXHAUSTED
                && auditRounds > 0
                && state.history().visitCount() > 0) {
            enterPhase(state, TraversalPhase.AUDITING);
            stop = audit(image, strategy, oracle, cancellation, state);
            logger.info(
                    "Audit finished after "
                            + state.history().audits().size()
                            + " checks: "
                            + stop.reason());
        }

        enterPhase(state, TraversalPhase.DRAINING);
        boolean refine =
                stop.kind() == StopKind.EXHAUSTED
                        || (stop.kind() == StopKind.BUDGET
                                && !budget.isCostExhausted(oracle.approximateCost()));
        SynthesisOutcome outcome =
                refine
                        ? synthesizer.synthesize(state.history(), strategy, oracle)
                        : synthesizer.merge(state.history(), strategy);

        TraversalPhase terminal =
                stop.kind() == StopKind.ORACLE_FAILED ? TraversalPhase.FAILED : TraversalPhase.DONE;
        enterPhase(state, terminal);

        return new InterpretationResult(
                strategy.diagramType(),
                strategy.outputFormat(),
                outcome.content(),
                outcome.rawContent(),
                outcome.graph(),
                oracle.callCount(),
                oracle.usage(),
                oracle.approximateCost(),
                stop.kind() != StopKind.EXHAUSTED,
                outcome.degraded(),
                terminal,
                state.iterations(),
                oracle.modelName(),
                stop.reason(),
                null);
    }

    private void seed(DiagramImage image, Strategy strategy, OracleGateway oracle, TraversalState state)
            throws InterpretationException {
        List<Focus> initial;
        try {
            initial = strategy.findInitialFocus(image, oracle);
        } catch (OracleUnavailableException e) {
            enterPhase(state, TraversalPhase.FAILED);
            throw new InterpretationException(
                    "Oracle unavailable before the first focus was found", e);
        }
        if (initial.isEmpty()) {
            logger.warning("Oracle reported no initial focus for " + image.name());
        }
        List<FrontierEntry> accepted = new ArrayList<>();
        for (Focus focus : initial) {
            offer(state, accepted, new FrontierEntry(focus, state.resolver().resolve(focus.asMention())));
        }
        frontierOrder.enqueue(state.frontier(), accepted);
    }

    private Stop explore(
            DiagramImage image,
            Strategy strategy,
            OracleGateway oracle,
            CancellationToken cancellation,
            TraversalState state) {
        while (true) {
            if (cancellation.isCancelled()) {
                return new Stop(StopKind.CANCELLED, "cancelled");
            }
            drainVisited(state);
            if (state.frontier().isEmpty()) {
                return new Stop(StopKind.EXHAUSTED, "frontier exhausted");
            }
            try {
                budget.enforce(
                        state.iterations(),
                        oracle.approximateCost(),
                        Duration.between(state.startedAt(), clock.instant()));
            } catch (BudgetExceededException e) {
                logger.warning("Stopping exploration: " + e.getMessage());
                return new Stop(StopKind.BUDGET, e.getMessage());
            }

            FrontierEntry entry = state.frontier().peekFirst();
            ContextPayload context = contextBuilder.build(state.history(), strategy);
            Optional<StepInterpretation> reply;
            try {
                reply =
                        oracle.ask(
                                strategy.stepRequest(image, entry.focus(), context),
                                response -> strategy.interpretStep(response, entry.focus(), context));
            } catch (OracleUnavailableException e) {
                logger.severe(
                        "Oracle unavailable while exploring '"
                                + entry.focus().label()
                                + "': "
                                + e.getMessage());
                return new Stop(StopKind.ORACLE_FAILED, "oracle unavailable: " + e.getMessage());
            }
            if (cancellation.isCancelled()) {
                logger.info("Cancelled during a step, discarding reply for '" + entry.focus().label() + "'");
                return new Stop(StopKind.CANCELLED, "cancelled");
            }

            state.frontier().pollFirst();
            state.countIteration();
            if (reply.isEmpty()) {
                logger.warning("Unusable reply for '" + entry.focus().label() + "', recording empty step");
            }
            visit(state, entry, reply.orElseGet(() -> StepInterpretation.empty(entry.focus())));
        }
    }

    private void drainVisited(TraversalState state) {
        while (!state.frontier().isEmpty()
                && state.visited().contains(state.frontier().peekFirst().identity())) {
            FrontierEntry stale = state.frontier().pollFirst();
            recordSkip(state, stale.focus(), stale.identity().key());
        }
    }

    private void visit(TraversalState state, FrontierEntry entry, StepInterpretation interpretation) {
        NodeIdentityResolver resolver = state.resolver();
        NodeIdentity source = resolver.find(entry.identity().key()).orElse(entry.identity());
        StepInterpretation step = interpretation.withSource(source.key());

        Map<String, NodeIdentity> refs = new HashMap<>();
        refs.put(step.focus().ref(), source);
        Map<NodeKey, String> nodes = new LinkedHashMap<>();
        nodes.put(source.key(), null);

        for (NodeMention mention : step.nodes()) {
            NodeIdentity identity =
                    mention.ref().equals(step.focus().ref()) ? source : resolver.resolve(mention);
            refs.putIfAbsent(mention.ref(), identity);
            addNode(nodes, identity.key(), mention.shape());
        }

        List<FrontierEntry> candidates = new ArrayList<>();
        for (Focus next : step.nextFoci()) {
            NodeIdentity identity = refs.get(next.ref());
            if (identity == null) {
                identity = resolver.resolve(next.asMention());
                refs.put(next.ref(), identity);
            }
            candidates.add(new FrontierEntry(next, identity));
        }

        List<FragmentEdge> edges = new ArrayList<>();
        for (EdgeMention edge : step.edges()) {
            NodeIdentity from = lookup(resolver, refs, edge.sourceRef());
            NodeIdentity to = lookup(resolver, refs, edge.targetRef());
            addNode(nodes, from.key(), null);
            addNode(nodes, to.key(), null);
            edges.add(new FragmentEdge(from.key(), to.key(), edge.label()));
        }

        List<FragmentNode> fragmentNodes = new ArrayList<>();
        nodes.forEach((key, shape) -> fragmentNodes.add(new FragmentNode(key, shape)));
        ExtractedFragment fragment = new ExtractedFragment(state.iterations(), fragmentNodes, edges);

        state.visited().add(source);
        state.history(state.history().appendVisit(source, step, fragment));

        List<FrontierEntry> accepted = new ArrayList<>();
        for (FrontierEntry candidate : candidates) {
            offer(state, accepted, candidate);
        }
        frontierOrder.enqueue(state.frontier(), accepted);
        int enqueued = accepted.size();

        logger.fine(
                "Step "
                        + state.iterations()
                        + " examined "
                        + source.key()
                        + ": "
                        + fragmentNodes.size()
                        + " nodes, "
                        + edges.size()
                        + " edges, "
                        + enqueued
                        + " new foci");
        notifyObservers(FocusVisited.now(state.iterations(), step.focus(), source.key(), enqueued));
    }

    /// Accepts a candidate for the frontier unless its identity was already visited.
    private void offer(TraversalState state, List<FrontierEntry> accepted, FrontierEntry candidate) {
        if (state.visited().contains(candidate.identity())) {
            recordSkip(state, candidate.focus(), candidate.identity().key());
            return;
        }
        accepted.add(candidate);
    }

    private void recordSkip(TraversalState state, Focus focus, NodeKey key) {
        logger.fine("Skipping '" + focus.label() + "', already visited as " + key);
        state.history(state.history().appendSkip(focus, key));
        notifyObservers(FocusSkipped.now(focus, key));
    }

    private static NodeIdentity lookup(
            NodeIdentityResolver resolver, Map<String, NodeIdentity> refs, String ref) {
        NodeIdentity identity = refs.get(ref);
        if (identity == null) {
            identity =
                    resolver.findByName(ref).orElseGet(() -> resolver.resolve(NodeMention.of(ref)));
            refs.put(ref, identity);
        }
        return identity;
    }

    private static void addNode(Map<NodeKey, String> nodes, NodeKey key, String shape) {
        if (!nodes.containsKey(key) || (nodes.get(key) == null && shape != null)) {
            nodes.put(key, shape);
        }
    }

    // ---------------------------------------------------------------------
    // Audit
    // ---------------------------------------------------------------------

    private Stop audit(
            DiagramImage image,
            Strategy strategy,
            OracleGateway oracle,
            CancellationToken cancellation,
            TraversalState state) {
        Map<NodeKey, ConfirmedLinks> confirmed = new LinkedHashMap<>();
        List<NodeKey> due = new ArrayList<>();
        for (HistoryEntry.Visit visit : state.history().visits()) {
            if (!due.contains(visit.source().key())) {
                due.add(visit.source().key());
            }
        }

        for (int round = 1; round <= auditRounds && !due.isEmpty(); round++) {
            boolean changed = false;
            for (NodeKey key : due) {
                if (cancellation.isCancelled()) {
                    return new Stop(StopKind.CANCELLED, "cancelled during audit");
                }
                try {
                    budget.enforceSpend(
                            oracle.approximateCost(),
                            Duration.between(state.startedAt(), clock.instant()));
                } catch (BudgetExceededException e) {
                    logger.warning("Stopping audit: " + e.getMessage());
                    return new Stop(StopKind.BUDGET, e.getMessage());
                }

                RawGraph graph = RawGraph.merge(state.history().fragments());
                AuditSubject subject = subjectOf(graph, state, key);
                Optional<AuditVerdict> reply;
                try {
                    reply =
                            oracle.ask(
                                    strategy.auditRequest(image, subject),
                                    response -> strategy.interpretAudit(response, subject));
                } catch (OracleUnavailableException e) {
                    logger.severe(
                            "Oracle unavailable while auditing '" + subject.name() + "': " + e.getMessage());
                    return new Stop(StopKind.ORACLE_FAILED, "oracle unavailable: " + e.getMessage());
                }
                if (cancellation.isCancelled()) {
                    logger.info("Cancelled during an audit, discarding reply for '" + subject.name() + "'");
                    return new Stop(StopKind.CANCELLED, "cancelled during audit");
                }
                if (reply.isEmpty()) {
                    logger.warning("Unusable audit reply for '" + subject.name() + "', keeping its edges");
                }

                AuditVerdict verdict = reply.orElseGet(() -> AuditVerdict.undecided("unusable reply"));
                ConfirmedLinks links = confirm(graph, state.resolver(), verdict);
                ExtractedFragment correction = correct(graph, key, links, state.iterations());
                if (verdict.checkedIncoming() || verdict.checkedOutgoing()) {
                    confirmed.put(key, links);
                }
                state.history(
                        state.history().appendAudit(round, subject.focus(), key, verdict, correction));
                changed |= !correction.isEmpty();

                logger.fine(
                        "Audit round "
                                + round
                                + " checked "
                                + subject.name()
                                + ": "
                                + correction.edges().size()
                                + " added, "
                                + correction.retractedEdges().size()
                                + " retracted");
                notifyObservers(
                        NodeAudited.now(
                                round, key, correction.edges().size(), correction.retractedEdges().size()));
            }
            if (!changed) {
                return new Stop(StopKind.EXHAUSTED, "connections confirmed in audit round " + round);
            }
            due = disagreeing(RawGraph.merge(state.history().fragments()), confirmed);
        }
        return new Stop(
                StopKind.EXHAUSTED,
                due.isEmpty() ? "connections confirmed" : "audit round limit of " + auditRounds + " reached");
    }

    private static AuditSubject subjectOf(RawGraph graph, TraversalState state, NodeKey key) {
        NodeIdentity identity =
                state.resolver().find(key).orElseGet(() -> new NodeIdentity(key, Fingerprint.empty()));
        String description = "";
        for (HistoryEntry.Visit visit : state.history().visits()) {
            if (visit.source().key().equals(key)) {
                description = visit.focus().description();
                break;
            }
        }
        String name = graph.nameOf(key);
        List<String> incoming = new ArrayList<>();
        List<String> outgoing = new ArrayList<>();
        for (RawGraph.GraphEdge edge : graph.edges()) {
            if (edge.target().equals(key) && !incoming.contains(edge.sourceName())) {
                incoming.add(edge.sourceName());
            }
            if (edge.source().equals(key) && !outgoing.contains(edge.targetName())) {
                outgoing.add(edge.targetName());
            }
        }
        Focus focus = new Focus(name, key.label(), description, identity.fingerprint(), null);
        return new AuditSubject(focus, name, incoming, outgoing);
    }

    /// Resolves the confirmed names to node keys, minting nodes the graph lacks.
    private static ConfirmedLinks confirm(
            RawGraph graph, NodeIdentityResolver resolver, AuditVerdict verdict) {
        List<NodeKey> minted = new ArrayList<>();
        Set<NodeKey> incoming =
                verdict.checkedIncoming()
                        ? resolveNames(graph, resolver, verdict.confirmedIncoming(), minted)
                        : null;
        Set<NodeKey> outgoing =
                verdict.checkedOutgoing()
                        ? resolveNames(graph, resolver, verdict.confirmedOutgoing(), minted)
                        : null;
        return new ConfirmedLinks(incoming, outgoing, minted);
    }

    private static Set<NodeKey> resolveNames(
            RawGraph graph, NodeIdentityResolver resolver, List<String> names, List<NodeKey> minted) {
        Set<NodeKey> keys = new LinkedHashSet<>();
        for (String name : names) {
            Optional<RawGraph.GraphNode> node = graph.nodeNamed(name);
            if (node.isPresent()) {
                keys.add(node.get().key());
                continue;
            }
            Optional<NodeIdentity> known = resolver.findByName(name);
            if (known.isPresent()) {
                keys.add(known.get().key());
                continue;
            }
            NodeIdentity created = resolver.resolve(NodeMention.of(name));
            logger.fine("Audit found unexplored node '" + name + "', recorded as " + created.key());
            minted.add(created.key());
            keys.add(created.key());
        }
        return keys;
    }

    private static ExtractedFragment correct(
            RawGraph graph, NodeKey subject, ConfirmedLinks links, int step) {
        Set<FragmentEdge> added = new LinkedHashSet<>();
        List<FragmentEdge> retracted = new ArrayList<>();
        if (links.outgoing() != null) {
            for (RawGraph.GraphEdge edge : graph.edges()) {
                if (edge.source().equals(subject) && !links.outgoing().contains(edge.target())) {
                    retracted.add(new FragmentEdge(edge.source(), edge.target(), edge.label()));
                }
            }
            for (NodeKey target : links.outgoing()) {
                if (!hasEdge(graph, subject, target)) {
                    added.add(new FragmentEdge(subject, target, ""));
                }
            }
        }
        if (links.incoming() != null) {
            for (NodeKey source : links.incoming()) {
                if (!hasEdge(graph, source, subject)) {
                    added.add(new FragmentEdge(source, subject, ""));
                }
            }
        }
        List<FragmentNode> nodes = new ArrayList<>();
        links.minted().forEach(key -> nodes.add(new FragmentNode(key, null)));
        return new ExtractedFragment(step, nodes, List.copyOf(added), retracted);
    }

    /// Returns the audited nodes whose current edges contradict their last verdict.
    private static List<NodeKey> disagreeing(RawGraph graph, Map<NodeKey, ConfirmedLinks> confirmed) {
        List<NodeKey> due = new ArrayList<>();
        confirmed.forEach(
                (key, links) -> {
                    Set<NodeKey> outgoing = new LinkedHashSet<>();
                    Set<NodeKey> incoming = new LinkedHashSet<>();
                    for (RawGraph.GraphEdge edge : graph.edges()) {
                        if (edge.source().equals(key)) {
                            outgoing.add(edge.target());
                        }
                        if (edge.target().equals(key)) {
                            incoming.add(edge.source());
                        }
                    }
                    boolean outgoingDiffers = links.outgoing() != null && !outgoing.equals(links.outgoing());
                    boolean incomingMissing = links.incoming() != null && !incoming.containsAll(links.incoming());
                    if (outgoingDiffers || incomingMissing) {
                        due.add(key);
                    }
                });
        return due;
    }

    private static boolean hasEdge(RawGraph graph, NodeKey source, NodeKey target) {
        for (RawGraph.GraphEdge edge : graph.edges()) {
            if (edge.source().equals(source) && edge.target().equals(target)) {
                return true;
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private void enterPhase(TraversalState state, TraversalPhase phase) {
        state.phase(phase);
        notifyObservers(PhaseChanged.now(phase));
    }

    private void notifyObservers(TraversalEvent event) {
        for (TraversalObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                logger.warning("Traversal observer failed: " + e.getMessage());
            }
        }
    }

    private enum StopKind {
        EXHAUSTED,
        BUDGET,
        CANCELLED,
        ORACLE_FAILED
    }

    private record Stop(StopKind kind, String reason) {}

    /// Keys the oracle confirmed for one node; a null set means the direction was not checked.
    private record ConfirmedLinks(Set<NodeKey> incoming, Set<NodeKey> outgoing, List<NodeKey> minted) {}
}
