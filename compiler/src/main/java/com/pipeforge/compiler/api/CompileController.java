package com.pipeforge.compiler.api;

import com.pipeforge.compiler.api.dto.CompileRequest;
import com.pipeforge.compiler.api.dto.CompileResponse;
import com.pipeforge.compiler.compile.HandleResolver;
import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.service.CompilationResult;
import com.pipeforge.compiler.service.PipelineCompilerService;
import com.pipeforge.compiler.workflow.WorkflowDocumentWriter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for pipeline compilation.
 *
 * POST /pipelines/compile   compile a pipeline graph into a workflow
 *                            definition and its event rules
 */
@RestController
@RequestMapping("/pipelines")
public class CompileController {

    private final PipelineCompilerService compilerService;
    private final WorkflowDocumentWriter  documentWriter;

    public CompileController(PipelineCompilerService compilerService, WorkflowDocumentWriter documentWriter) {
        this.compilerService = compilerService;
        this.documentWriter  = documentWriter;
    }

    /**
     * Compile a pipeline.
     *
     * Example:
     *   curl -X POST http://localhost:8080/pipelines/compile \
     *     -H "Content-Type: application/json" \
     *     -d '{"pipeline":{"name":"thumbs","nodes":[...],"edges":[...]},"handles":{"n2":"arn:..."}}'
     *
     * Returns 400 naming the offending node, edge or state when the graph
     * cannot be compiled.
     */
    @PostMapping("/compile")
    public CompileResponse compile(@RequestBody CompileRequest req) {
        if (req.pipeline() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request has no pipeline");
        }
        try {
            CompilationResult result = compilerService.compile(req.pipeline(), HandleResolver.fromMap(req.handles()));
            return CompileResponse.from(result, documentWriter);
        } catch (PipelineConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
