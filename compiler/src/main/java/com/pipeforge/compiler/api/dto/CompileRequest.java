package com.pipeforge.compiler.api.dto;

import com.pipeforge.compiler.model.PipelineGraph;

import java.util.Map;

/**
 * Request body for POST /pipelines/compile.
 *
 * @param handles deployed compute handle per node id
 */
public record CompileRequest(
        PipelineGraph       pipeline,
        Map<String, String> handles) {
}
