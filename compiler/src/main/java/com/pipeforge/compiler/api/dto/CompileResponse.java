package com.pipeforge.compiler.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeforge.compiler.compile.CompileWarning;
import com.pipeforge.compiler.service.CompilationResult;
import com.pipeforge.compiler.workflow.WorkflowDocumentWriter;

import java.util.List;

/**
 * Response body for POST /pipelines/compile.
 *
 * {@code definition} is the workflow document exactly as it would be
 * deployed.
 */
public record CompileResponse(
        JsonNode             definition,
        List<TriggerView>    triggers,
        List<CompileWarning> warnings) {

    public static CompileResponse from(CompilationResult result, WorkflowDocumentWriter writer) {
        return new CompileResponse(
                writer.toJson(result.workflow()),
                result.triggers().stream().map(TriggerView::from).toList(),
                result.warnings());
    }
}
