package com.pipeforge.compiler.trigger;

/**
 * An event-bus rule derived from one trigger node.
 */
public record TriggerRule(String nodeId, RuleKind ruleKind, String ruleName, EventPattern eventPattern) {
}
