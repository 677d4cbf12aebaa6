package com.pipeforge.compiler.trigger;

import java.util.Map;

/**
 * An authored event-pattern skeleton with ${Name} placeholders.
 */
public record PatternTemplate(RuleKind ruleKind, Map<String, Object> eventPattern) {
}
