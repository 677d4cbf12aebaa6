package com.pipeforge.compiler.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CompiledWorkflow} as an Amazon States Language document.
 *
 * A chaining state without a successor is written with "End": true.
 * MaxConcurrency is written only when a cap is set.
 */
@Component
public class WorkflowDocumentWriter {

    private final ObjectMapper objectMapper;

    public WorkflowDocumentWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toJson(CompiledWorkflow workflow) {
        ObjectNode root = objectMapper.createObjectNode();
        if (workflow.comment() != null) {
            root.put("Comment", workflow.comment());
        }
        root.put("StartAt", workflow.startAt());
        ObjectNode states = root.putObject("States");
        for (Map.Entry<String, WorkflowState> entry : workflow.states().entrySet()) {
            states.set(entry.getKey(), state(entry.getKey(), entry.getValue()));
        }
        if (workflow.timeoutSeconds() != null) {
            root.put("TimeoutSeconds", workflow.timeoutSeconds());
        }
        return root;
    }

    public String toJsonString(CompiledWorkflow workflow) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(workflow));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize workflow: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // States
    // ------------------------------------------------------------------

    private ObjectNode state(String name, WorkflowState state) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("Type", state.type());

        if (state instanceof TaskState task) {
            node.put("Resource", task.resource());
            if (task.parameters() != null) {
                node.set("Parameters", objectMapper.valueToTree(task.parameters()));
            }
            node.set("Retry", retry(task.retry()));
        } else if (state instanceof PassState pass) {
            if (pass.result() != null) {
                node.set("Result", objectMapper.valueToTree(pass.result()));
            }
        } else if (state instanceof WaitState wait) {
            node.put("Seconds", wait.seconds());
        } else if (state instanceof ParallelState parallel) {
            node.set("Branches", objectMapper.valueToTree(parallel.branches()));
        } else if (state instanceof MapState map) {
            node.put("ItemsPath", map.itemsPath());
            node.set("Iterator", toJson(map.iterator()));
            node.putNull("ResultPath");
            node.set("Parameters", objectMapper.valueToTree(map.parameters()));
            node.set("Retry", retry(map.retry()));
            if (map.maxConcurrency() != null) {
                node.put("MaxConcurrency", map.maxConcurrency());
            }
        } else if (state instanceof ChoiceState choice) {
            ArrayNode rules = node.putArray("Choices");
            for (ChoiceRule rule : choice.choices()) {
                ObjectNode r = rules.addObject();
                r.put("Variable", rule.variable());
                r.set(rule.operator().field(), objectMapper.valueToTree(rule.operand()));
                r.put("Next", targetName(name, rule.next()));
            }
            node.put("Default", targetName(name, choice.defaultTarget()));
        } else if (state instanceof FailState fail) {
            node.put("Error", fail.error());
            node.put("Cause", fail.cause());
        }

        if (state instanceof ChainingState chaining) {
            if (chaining.isEnd()) {
                node.put("End", true);
            } else {
                node.put("Next", chaining.next());
            }
        }
        return node;
    }

    private ArrayNode retry(List<RetryPolicy> policies) {
        ArrayNode array = objectMapper.createArrayNode();
        for (RetryPolicy policy : policies) {
            ObjectNode p = array.addObject();
            ArrayNode errors = p.putArray("ErrorEquals");
            policy.errorEquals().forEach(errors::add);
            p.put("IntervalSeconds", policy.intervalSeconds());
            p.put("MaxAttempts", policy.maxAttempts());
            p.put("BackoffRate", policy.backoffRate());
        }
        return array;
    }

    private static String targetName(String stateName, BranchTarget target) {
        if (target instanceof BranchTarget.State resolved) {
            return resolved.name();
        }
        throw new IllegalStateException("Choice state '" + stateName + "' still has an unlinked branch " + target);
    }
}
