package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.graph.GraphAnalysis;
import com.pipeforge.compiler.graph.GraphAnalyzer;
import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.FlowKind;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineGraph;
import com.pipeforge.compiler.workflow.BranchHandle;
import com.pipeforge.compiler.workflow.BranchTarget;
import com.pipeforge.compiler.workflow.ChoiceRule;
import com.pipeforge.compiler.workflow.ChoiceState;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import com.pipeforge.compiler.workflow.FailState;
import com.pipeforge.compiler.workflow.MapState;
import com.pipeforge.compiler.workflow.ParallelState;
import com.pipeforge.compiler.workflow.PassState;
import com.pipeforge.compiler.workflow.RetryPolicy;
import com.pipeforge.compiler.workflow.SucceedState;
import com.pipeforge.compiler.workflow.TaskState;
import com.pipeforge.compiler.workflow.WaitState;
import com.pipeforge.compiler.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one node into its workflow state(s).
 *
 * Choice rules are emitted with {@link BranchHandle} targets; the
 * {@link GraphLinker} resolves them once the whole graph has been
 * synthesized. A Map node's processor chain is compiled by a recursive call
 * to {@link #synthesizeWorkflow} over the sub-graph formed by the chain.
 */
@Component
public class StateSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynthesizer.class);

    public static final String STATUS_VARIABLE   = "$.metadata.externalJobStatus";
    public static final String STATUS_COMPLETED  = "Completed";
    public static final String DEFAULT_ITEMS     = "$.payload.data";
    public static final String EXTERNAL_ITEMS    = "$.payload.externalTaskResults";
    public static final String NO_OP_STATE       = "PassState";
    public static final int    MAX_CONCURRENCY   = 40;
    public static final int    MAP_MAX_ATTEMPTS  = 5;
    public static final int    DEFAULT_WAIT_SECONDS = 1;

    private final GraphAnalyzer analyzer;
    private final GraphLinker   linker;

    public StateSynthesizer(GraphAnalyzer analyzer, GraphLinker linker) {
        this.analyzer = analyzer;
        this.linker   = linker;
    }

    // ------------------------------------------------------------------
    // Whole (sub-)graph
    // ------------------------------------------------------------------

    /**
     * Synthesizes and links every materialized node of {@code analysis}.
     *
     * Trigger nodes and members of any Map processor chain are not
     * materialized.
     */
    public CompiledWorkflow synthesizeWorkflow(GraphAnalysis analysis,
                                               Map<String, String> nodeToState,
                                               CompileContext ctx) {
        Set<String> chainMembers = new HashSet<>();
        for (Node node : analysis.nodes()) {
            if (node.isFlow(FlowKind.MAP)) {
                ctx.chainOf(node.id()).ifPresent(chainMembers::addAll);
            }
        }

        Map<String, NodeStates> synthesized = new LinkedHashMap<>();
        for (Node node : analysis.nodes()) {
            if (node.role() == NodeRole.TRIGGER) continue;
            if (chainMembers.contains(node.id())) {
                log.debug("Node '{}' belongs to a processor chain; not materialized here", node.id());
                continue;
            }
            synthesized.put(node.id(), synthesize(node, nodeToState.get(node.id()), ctx));
        }
        return linker.link(synthesized, analysis);
    }

    // ------------------------------------------------------------------
    // Single node
    // ------------------------------------------------------------------

    public NodeStates synthesize(Node node, String stateName, CompileContext ctx) {
        return switch (node.role()) {
            case COMPUTE, INTEGRATION -> task(node, stateName, ctx);
            case FLOW -> flow(node, stateName, ctx);
            case TRIGGER -> throw new IllegalArgumentException(
                    "Trigger node '" + node.id() + "' does not compile to a state");
        };
    }

    private NodeStates flow(Node node, String stateName, CompileContext ctx) {
        FlowKind kind = node.flowKind().orElseThrow(() ->
                new IllegalArgumentException("Node '" + node.id() + "' has no flow kind"));
        return switch (kind) {
            case WAIT     -> NodeStates.single(stateName, new WaitState(waitSeconds(node, ctx), null));
            case CHOICE   -> NodeStates.single(stateName, choice(node, ctx));
            case PARALLEL -> NodeStates.single(stateName, parallel(node, ctx));
            case MAP      -> map(node, stateName, ctx);
            case PASS     -> NodeStates.single(stateName, new PassState(passResult(node), null));
            case SUCCEED  -> NodeStates.single(stateName, new SucceedState());
            case FAIL     -> NodeStates.single(stateName, new FailState(
                    stringConfig(node, "error", "FlowFailure"),
                    stringConfig(node, "cause", "Flow step failed")));
        };
    }

    // ------------------------------------------------------------------
    // Task
    // ------------------------------------------------------------------

    private NodeStates task(Node node, String stateName, CompileContext ctx) {
        Optional<String> handle = ctx.handleOf(node.id());
        if (handle.isEmpty()) {
            ctx.warn(CompileWarning.Kind.MISSING_HANDLE, node.id(),
                    "No compute handle for '" + node.typeId() + "'; emitting a Pass state");
            Map<String, Object> result = Map.of("message", "No compute handle for " + node.typeId());
            return NodeStates.single(stateName, new PassState(result, null));
        }

        Map<String, Object> parameters = null;
        if (ctx.isFirstCompute(node.id())) {
            parameters = new LinkedHashMap<>();
            parameters.put("executionName.$", "$$.Execution.Name");
            parameters.put("stateMachineArn.$", "$$.StateMachine.Id");
            parameters.put("payload.$", "$");
            log.debug("State '{}' carries the execution context parameters", stateName);
        }
        List<RetryPolicy> retry = RetryPolicy.twoTier(
                ctx.settings().retryIntervalSeconds(), ctx.settings().retryAttempts());
        return NodeStates.single(stateName, new TaskState(handle.get(), parameters, retry, null));
    }

    // ------------------------------------------------------------------
    // Wait
    // ------------------------------------------------------------------

    private int waitSeconds(Node node, CompileContext ctx) {
        Object raw = node.parameters().get("Duration");
        if (raw == null) raw = node.config("duration");
        if (raw == null) return DEFAULT_WAIT_SECONDS;

        Optional<Double> value = asNumber(raw);
        if (value.isEmpty() || !Double.isFinite(value.get())) {
            ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                    "Wait duration '" + raw + "' is not a number; using " + DEFAULT_WAIT_SECONDS + "s");
            return DEFAULT_WAIT_SECONDS;
        }
        return (int) Math.max(0, Math.floor(value.get()));
    }

    // ------------------------------------------------------------------
    // Choice
    // ------------------------------------------------------------------

    private ChoiceState choice(Node node, CompileContext ctx) {
        BranchTarget onTrue = BranchTarget.pending(node.id(), BranchHandle.Branch.TRUE);
        List<ChoiceRule> rules = new ArrayList<>();

        Object configured = node.config("choices");
        if (configured instanceof List<?> list) {
            for (Object entry : list) {
                if (!(entry instanceof Map<?, ?> condition)) {
                    ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                            "Ignoring choice condition that is not an object: " + entry);
                    continue;
                }
                Object variable = condition.get("variable");
                if (!(variable instanceof String v) || v.isBlank()) {
                    ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                            "Choice condition has no variable; testing " + STATUS_VARIABLE);
                    variable = STATUS_VARIABLE;
                }
                Object value = condition.get("value");
                rules.add(ChoiceRule.stringEquals((String) variable,
                        value == null ? STATUS_COMPLETED : String.valueOf(value), onTrue));
            }
        }
        if (rules.isEmpty()) {
            rules.add(ChoiceRule.stringEquals(STATUS_VARIABLE, STATUS_COMPLETED, onTrue));
        }
        return new ChoiceState(rules, BranchTarget.pending(node.id(), BranchHandle.Branch.DEFAULT));
    }

    // ------------------------------------------------------------------
    // Parallel / Pass
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private ParallelState parallel(Node node, CompileContext ctx) {
        Object branches = node.config("branches");
        if (branches != null && !(branches instanceof List<?>)) {
            ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                    "Parallel branches must be a list; emitting none");
            branches = null;
        }
        return new ParallelState((List<Object>) branches, null);
    }

    private Object passResult(Node node) {
        Object result = node.config("result");
        if (result instanceof String s && s.isEmpty()) return null;
        if (result instanceof Map<?, ?> m && m.isEmpty()) return null;
        return result;
    }

    // ------------------------------------------------------------------
    // Map
    // ------------------------------------------------------------------

    private NodeStates map(Node node, String stateName, CompileContext ctx) {
        CompiledWorkflow iterator = iterator(node, ctx);
        Integer concurrency = concurrencyLimit(node, ctx);
        List<RetryPolicy> retry = RetryPolicy.twoTier(ctx.settings().retryIntervalSeconds(), MAP_MAX_ATTEMPTS);
        Map<String, Object> itemParameters = Map.of("item.$", "$$.Map.Item.Value");

        String itemsPath = stringConfig(node, "itemsPath", DEFAULT_ITEMS);
        MapState mapState = new MapState(itemsPath, iterator, concurrency, itemParameters, retry, null);

        if (!Boolean.TRUE.equals(node.config("supportExternalPayload"))) {
            return NodeStates.single(stateName, mapState);
        }

        // Dual source: dispatch on whether the payload carries the items inline.
        String inlineName   = stateName + "_Map";
        String standardName = stateName + "_StandardMap";
        ChoiceState dispatch = new ChoiceState(
                List.of(ChoiceRule.isPresent(DEFAULT_ITEMS, BranchTarget.state(inlineName))),
                BranchTarget.state(standardName));

        Map<String, WorkflowState> states = new LinkedHashMap<>();
        states.put(stateName, dispatch);
        states.put(inlineName, mapState.withItemsPath(DEFAULT_ITEMS));
        states.put(standardName, mapState.withItemsPath(stringConfig(node, "externalItemsPath", EXTERNAL_ITEMS)));
        log.debug("Map '{}' compiled with inline and external item sources", node.id());
        return new NodeStates(stateName, states, List.of(inlineName, standardName));
    }

    private Integer concurrencyLimit(Node node, CompileContext ctx) {
        Object raw = node.parameters().get("ConcurrencyLimit");
        if (raw == null) raw = node.config("concurrencyLimit");
        if (raw == null) return null;

        Optional<Double> value = asNumber(raw);
        if (value.isEmpty() || !Double.isFinite(value.get())) {
            ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                    "Concurrency limit '" + raw + "' is not a number; leaving concurrency unbounded");
            return null;
        }
        int limit = (int) Math.floor(value.get());
        if (limit <= 0) return null;
        if (limit > MAX_CONCURRENCY) {
            log.debug("Capping concurrency of map '{}' from {} to {}", node.id(), limit, MAX_CONCURRENCY);
            return MAX_CONCURRENCY;
        }
        return limit;
    }

    /**
     * Builds the iterator from the node's processor chain.
     *
     * The chain members form a linear sub-graph of Task states that is
     * analyzed, synthesized and linked like a pipeline of its own. A chain
     * that is empty, names an unknown node, contains anything but compute
     * nodes, or has a compute node without a handle degrades to a single
     * no-op Pass state.
     */
    private CompiledWorkflow iterator(Node mapNode, CompileContext ctx) {
        List<String> chain = ctx.chainOf(mapNode.id()).orElse(List.of());
        if (chain.isEmpty()) {
            log.debug("Map '{}' has no processor chain; using a no-op iterator", mapNode.id());
            return CompiledWorkflow.noOp(NO_OP_STATE);
        }

        List<Node> members = new ArrayList<>();
        for (String memberId : chain) {
            Node member = ctx.source().node(memberId);
            if (member == null || member.role() == NodeRole.TRIGGER) {
                ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, mapNode.id(),
                        "Processor chain member '" + memberId + "' cannot run inside a map");
                return degraded(mapNode);
            }
            if (!member.role().isInvocable()) {
                ctx.warn(CompileWarning.Kind.INVALID_PARAMETER, memberId,
                        "Processor chain member '" + memberId + "' is not a compute step");
                return degraded(mapNode);
            }
            if (ctx.handleOf(memberId).isEmpty()) {
                ctx.warn(CompileWarning.Kind.MISSING_HANDLE, memberId,
                        "No compute handle for processor '" + member.typeId() + "'");
                return degraded(mapNode);
            }
            members.add(member);
        }

        List<Edge> links = new ArrayList<>();
        Map<String, String> names = new LinkedHashMap<>();
        for (int i = 0; i < members.size(); i++) {
            names.put(members.get(i).id(), StateNames.forProcessor(i, members.get(i)));
            if (i > 0) {
                links.add(new Edge("chain-" + mapNode.id() + "-" + i, members.get(i - 1).id(), members.get(i).id()));
            }
        }

        PipelineGraph subGraph = new PipelineGraph(
                ctx.source().graph().name() + "/" + mapNode.id(), members, links, ctx.settings());
        GraphAnalysis subAnalysis = analyzer.analyze(subGraph);
        return synthesizeWorkflow(subAnalysis, names, ctx.forChain());
    }

    private CompiledWorkflow degraded(Node mapNode) {
        log.warn("Map '{}': processor chain unusable; using a no-op iterator", mapNode.id());
        return CompiledWorkflow.noOp(NO_OP_STATE);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String stringConfig(Node node, String key, String fallback) {
        Object value = node.config(key);
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }

    private static Optional<Double> asNumber(Object raw) {
        if (raw instanceof Number n) return Optional.of(n.doubleValue());
        if (raw instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
