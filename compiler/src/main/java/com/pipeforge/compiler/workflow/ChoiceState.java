package com.pipeforge.compiler.workflow;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-branch conditional. Always has at least one rule and exactly one
 * default target.
 */
public record ChoiceState(List<ChoiceRule> choices, BranchTarget defaultTarget) implements WorkflowState {

    public ChoiceState {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalArgumentException("Choice state needs at least one rule");
        }
        if (defaultTarget == null) {
            throw new IllegalArgumentException("Choice state needs a default target");
        }
        choices = List.copyOf(choices);
    }

    @Override public String type() { return "Choice"; }

    /** Every target (rules first, then default) in declaration order. */
    public List<BranchTarget> targets() {
        List<BranchTarget> all = new ArrayList<>();
        choices.forEach(c -> all.add(c.next()));
        all.add(defaultTarget);
        return all;
    }
}
