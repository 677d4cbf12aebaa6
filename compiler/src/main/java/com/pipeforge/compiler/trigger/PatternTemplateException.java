package com.pipeforge.compiler.trigger;

/**
 * A pattern template whose structure cannot be applied. Caught by
 * {@link TriggerPatternCompiler}, which falls back to the built-in pattern.
 */
public class PatternTemplateException extends RuntimeException {

    private final RuleKind ruleKind;

    public PatternTemplateException(RuleKind ruleKind, String message) {
        super(message);
        this.ruleKind = ruleKind;
    }

    public RuleKind getRuleKind() { return ruleKind; }
}
