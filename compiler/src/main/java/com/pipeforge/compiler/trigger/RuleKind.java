package com.pipeforge.compiler.trigger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The event-bus rule kinds a trigger node can subscribe to.
 */
public enum RuleKind {
    INGEST_COMPLETED("AssetCreated", true),
    VIDEO_INGESTED("AssetCreated", true),
    VIDEO_PROCESSING_COMPLETED("ProcessingCompleted", true),
    PIPELINE_EXECUTION_COMPLETED("Pipeline Execution Completed", true),
    WORKFLOW_COMPLETED("WorkflowCompleted", false);

    private static final List<String> ASSET_FORMAT_PATH =
            List.of("DigitalSourceAsset", "MainRepresentation", "Format");

    private final String  detailType;
    private final boolean assetEvent;

    RuleKind(String detailType, boolean assetEvent) {
        this.detailType = detailType;
        this.assetEvent = assetEvent;
    }

    public String detailType() { return detailType; }

    /** Name of the template file and the value authors write, e.g. "video_ingested". */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Where a "Format" filter lives, relative to "detail".
     */
    public List<String> formatPath() {
        if (this == PIPELINE_EXECUTION_COMPLETED) {
            return List.of("outputs", "input", "DigitalSourceAsset", "MainRepresentation", "Format");
        }
        return assetEvent ? ASSET_FORMAT_PATH : List.of("Format");
    }

    /** Accepts both '-' and '_' as separators, case-insensitively. */
    public static Optional<RuleKind> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String key = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (RuleKind kind : values()) {
            if (kind.name().equals(key)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
