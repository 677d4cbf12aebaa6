package com.pipeforge.compiler.api.dto;

import com.pipeforge.compiler.trigger.EventPattern;
import com.pipeforge.compiler.trigger.TriggerRule;

/**
 * One event rule in the compile response.
 */
public record TriggerView(
        String       nodeId,
        String       ruleKind,
        String       ruleName,
        EventPattern eventPattern) {

    public static TriggerView from(TriggerRule rule) {
        return new TriggerView(rule.nodeId(), rule.ruleKind().wireName(), rule.ruleName(), rule.eventPattern());
    }
}
