package com.pipeforge.compiler.service;

import com.pipeforge.compiler.compile.CompileWarning;
import com.pipeforge.compiler.trigger.TriggerRule;
import com.pipeforge.compiler.workflow.CompiledWorkflow;

import java.util.List;

/**
 * Everything produced by one pipeline compile.
 */
public record CompilationResult(
        CompiledWorkflow     workflow,
        List<TriggerRule>    triggers,
        List<CompileWarning> warnings) {

    public CompilationResult {
        triggers = List.copyOf(triggers);
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
