package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.graph.GraphAnalysis;
import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.FlowKind;
import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.workflow.BranchHandle;
import com.pipeforge.compiler.workflow.BranchTarget;
import com.pipeforge.compiler.workflow.ChainingState;
import com.pipeforge.compiler.workflow.ChoiceRule;
import com.pipeforge.compiler.workflow.ChoiceState;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import com.pipeforge.compiler.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Wires synthesized states together along the graph's edges.
 *
 * <p>Linking happens in four passes:
 * <ol>
 *   <li>ordinary edges set "Next" on every exit state of their source;</li>
 *   <li>edges leaving a Choice node are sorted into its TRUE / DEFAULT / FAIL
 *       branches and every {@link BranchHandle} is replaced by a state name;</li>
 *   <li>the unique entry state becomes StartAt;</li>
 *   <li>the resulting transitions are checked for cycles.</li>
 * </ol>
 * Only edges whose two ends were both materialized take part.
 */
@Component
public class GraphLinker {

    private static final Logger log = LoggerFactory.getLogger(GraphLinker.class);

    public static final String STATUS_FAILED = "Failed";

    private static final Set<String> TRUE_HANDLES = Set.of(
            "completed", "condition_true", "condition_true_output", "true");
    private static final Set<String> DEFAULT_HANDLES = Set.of(
            "in progress", "condition_false", "condition_false_output", "false", "default");
    private static final String FAIL_HANDLE = "fail";

    public CompiledWorkflow link(Map<String, NodeStates> synthesized, GraphAnalysis analysis) {
        String scope = analysis.graph().name();
        if (synthesized.isEmpty()) {
            throw new PipelineConfigurationException(scope, "Pipeline has no executable steps");
        }

        Map<String, WorkflowState> states = new LinkedHashMap<>();
        synthesized.values().forEach(ns -> states.putAll(ns.states()));

        Map<String, List<Edge>> choiceEdges = new LinkedHashMap<>();

        for (Edge edge : analysis.edges()) {
            NodeStates source = synthesized.get(edge.source());
            NodeStates target = synthesized.get(edge.target());
            if (source == null || target == null) continue;

            if (source.primaryState().isTerminalKind()) {
                log.warn("Ignoring edge '{}': state '{}' is terminal", edge.id(), source.primary());
                continue;
            }
            if (edge.isProcessorEdge()) continue;

            if (analysis.node(edge.source()).isFlow(FlowKind.CHOICE)) {
                choiceEdges.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
                continue;
            }
            for (String exit : source.exits()) {
                chain(states, exit, target.primary(), edge);
            }
        }

        for (Map.Entry<String, NodeStates> entry : synthesized.entrySet()) {
            if (!analysis.node(entry.getKey()).isFlow(FlowKind.CHOICE)) continue;
            String stateName = entry.getValue().primary();
            List<Edge> edges = choiceEdges.getOrDefault(entry.getKey(), List.of());
            states.put(stateName, resolveChoice(entry.getKey(), (ChoiceState) states.get(stateName),
                    edges, synthesized));
        }

        String startAt = entryState(synthesized, analysis, scope);
        detectCycles(states);

        log.debug("Linked '{}': {} states, StartAt={}", scope, states.size(), startAt);
        return CompiledWorkflow.of(startAt, states);
    }

    // ------------------------------------------------------------------
    // Sequential links
    // ------------------------------------------------------------------

    private void chain(Map<String, WorkflowState> states, String exit, String next, Edge edge) {
        ChainingState state = (ChainingState) states.get(exit);
        if (state.next() != null && !state.next().equals(next)) {
            throw new PipelineConfigurationException(edge.source(),
                    "State '" + exit + "' already continues to '" + state.next()
                            + "'; edge '" + edge.id() + "' would add a second successor '" + next + "'");
        }
        states.put(exit, state.withNext(next));
    }

    // ------------------------------------------------------------------
    // Choice branches
    // ------------------------------------------------------------------

    private ChoiceState resolveChoice(String nodeId, ChoiceState choice, List<Edge> edges,
                                      Map<String, NodeStates> synthesized) {
        Map<BranchHandle.Branch, String> targets = new EnumMap<>(BranchHandle.Branch.class);
        List<Edge> unlabelled = new ArrayList<>();

        for (Edge edge : edges) {
            String target = synthesized.get(edge.target()).primary();
            BranchHandle.Branch branch = branchOf(edge);
            if (branch == null) {
                unlabelled.add(edge);
                continue;
            }
            String existing = targets.putIfAbsent(branch, target);
            if (existing != null && !existing.equals(target)) {
                throw new PipelineConfigurationException(edge.id(),
                        "Choice '" + nodeId + "' has two " + branch + " branches ('" + existing + "', '" + target + "')");
            }
        }

        boolean labelledBranch = targets.containsKey(BranchHandle.Branch.TRUE)
                || targets.containsKey(BranchHandle.Branch.DEFAULT);
        for (Edge edge : unlabelled) {
            String target = synthesized.get(edge.target()).primary();
            if (!targets.containsKey(BranchHandle.Branch.TRUE)) {
                targets.put(BranchHandle.Branch.TRUE, target);
            } else if (!targets.containsKey(BranchHandle.Branch.DEFAULT)) {
                targets.put(BranchHandle.Branch.DEFAULT, target);
            } else {
                throw new PipelineConfigurationException(edge.id(),
                        "Choice '" + nodeId + "' has more outgoing edges than branches");
            }
        }
        // A lone unlabelled edge serves both branches.
        if (unlabelled.size() == 1 && !labelledBranch) {
            targets.put(BranchHandle.Branch.DEFAULT, targets.get(BranchHandle.Branch.TRUE));
        }

        List<ChoiceRule> rules = new ArrayList<>();
        for (ChoiceRule rule : choice.choices()) {
            rules.add(rule.withNext(resolve(nodeId, rule.next(), targets)));
        }
        String onFail = targets.get(BranchHandle.Branch.FAIL);
        if (onFail != null) {
            addFailedRule(rules, onFail);
        }
        BranchTarget fallback = resolve(nodeId, choice.defaultTarget(), targets);
        return new ChoiceState(rules, fallback);
    }

    private static BranchHandle.Branch branchOf(Edge edge) {
        if (!edge.hasHandle()) return null;
        String handle = edge.sourceHandle().trim().toLowerCase(Locale.ROOT);
        if (TRUE_HANDLES.contains(handle))    return BranchHandle.Branch.TRUE;
        if (DEFAULT_HANDLES.contains(handle)) return BranchHandle.Branch.DEFAULT;
        if (FAIL_HANDLE.equals(handle))       return BranchHandle.Branch.FAIL;
        log.debug("Edge '{}' has unrecognised handle '{}'; treating it as unlabelled",
                edge.id(), edge.sourceHandle());
        return null;
    }

    private static BranchTarget resolve(String nodeId, BranchTarget target,
                                        Map<BranchHandle.Branch, String> targets) {
        if (!(target instanceof BranchTarget.Pending pending)) return target;
        String name = targets.get(pending.handle().branch());
        if (name == null) {
            throw new PipelineConfigurationException(nodeId,
                    "Choice has no outgoing edge for its " + pending.handle().branch() + " branch");
        }
        return BranchTarget.state(name);
    }

    private static void addFailedRule(List<ChoiceRule> rules, String onFail) {
        for (int i = 0; i < rules.size(); i++) {
            ChoiceRule rule = rules.get(i);
            if (StateSynthesizer.STATUS_VARIABLE.equals(rule.variable())
                    && rule.operator() == ChoiceRule.Operator.STRING_EQUALS
                    && STATUS_FAILED.equals(rule.operand())) {
                rules.set(i, rule.withNext(BranchTarget.state(onFail)));
                return;
            }
        }
        rules.add(ChoiceRule.stringEquals(StateSynthesizer.STATUS_VARIABLE, STATUS_FAILED,
                BranchTarget.state(onFail)));
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    // Only edges that were linked count; a trigger's edge does not.
    private String entryState(Map<String, NodeStates> synthesized, GraphAnalysis analysis, String scope) {
        List<String> entries = new ArrayList<>();
        for (String nodeId : synthesized.keySet()) {
            boolean hasIncoming = analysis.incoming(nodeId).stream()
                    .anyMatch(e -> isLinked(e, synthesized));
            if (!hasIncoming) entries.add(nodeId);
        }
        if (entries.isEmpty()) {
            throw new PipelineConfigurationException(scope,
                    "Pipeline has no entry step; every step has a predecessor");
        }
        if (entries.size() > 1) {
            throw new PipelineConfigurationException(entries.get(1),
                    "Pipeline has more than one entry step: " + entries);
        }
        return synthesized.get(entries.get(0)).primary();
    }

    private static boolean isLinked(Edge edge, Map<String, NodeStates> synthesized) {
        NodeStates source = synthesized.get(edge.source());
        return source != null && !source.primaryState().isTerminalKind() && !edge.isProcessorEdge();
    }

    // ------------------------------------------------------------------
    // Cycles
    // ------------------------------------------------------------------

    private void detectCycles(Map<String, WorkflowState> states) {
        Map<String, Integer> colour = new HashMap<>();
        for (String name : states.keySet()) {
            if (!colour.containsKey(name)) visit(name, states, colour);
        }
    }

    // 1 = on the current path, 2 = finished
    private void visit(String name, Map<String, WorkflowState> states, Map<String, Integer> colour) {
        colour.put(name, 1);
        for (String next : successors(states.get(name))) {
            if (!states.containsKey(next)) continue;
            Integer c = colour.get(next);
            if (c == null) {
                visit(next, states, colour);
            } else if (c == 1) {
                throw new PipelineConfigurationException(next,
                        "Pipeline contains a cycle through state '" + next + "'");
            }
        }
        colour.put(name, 2);
    }

    static List<String> successors(WorkflowState state) {
        List<String> out = new ArrayList<>();
        if (state instanceof ChainingState chaining && chaining.next() != null) {
            out.add(chaining.next());
        } else if (state instanceof ChoiceState choice) {
            for (BranchTarget target : choice.targets()) {
                if (target instanceof BranchTarget.State s) out.add(s.name());
            }
        }
        return out;
    }
}
