package com.pipeforge.compiler.trigger;

import java.util.Optional;

@FunctionalInterface
public interface PatternTemplateSource {

    Optional<PatternTemplate> templateFor(RuleKind kind);

    static PatternTemplateSource none() {
        return kind -> Optional.empty();
    }
}
