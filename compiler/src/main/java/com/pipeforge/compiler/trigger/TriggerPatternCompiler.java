package com.pipeforge.compiler.trigger;

import com.pipeforge.compiler.compile.CompileWarning;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles trigger node parameters into event-bus matching patterns.
 *
 * <p>Two modes:
 * <ul>
 *   <li><b>Template mode</b>: an authored pattern skeleton has its
 *       {@code ${Name}} placeholders replaced by the node's parameters,
 *       split on commas and upper-cased.
 *       A placeholder with no value removes its field, and objects left empty
 *       are pruned.</li>
 *   <li><b>Built-in mode</b>: a base pattern per {@link RuleKind}, extended
 *       with the node's remaining parameters as detail filters.</li>
 * </ul>
 * A template that cannot be applied produces a TEMPLATE_PROCESSING warning
 * and the built-in pattern is used instead.
 */
@Component
public class TriggerPatternCompiler {

    private static final Logger log = LoggerFactory.getLogger(TriggerPatternCompiler.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");
    private static final int MAX_RULE_NAME = 64;

    private static final Set<String> NEVER_FOLDED = Set.of("pipeline_name", "method", "rule");
    private static final Set<String> ASSET_TYPE_FIELDS = Set.of(
            TriggerParameters.IMAGE_TYPE, TriggerParameters.VIDEO_TYPE, TriggerParameters.AUDIO_TYPE);
    private static final String PREFIX = "Prefix";

    // Marks a value whose field must be removed.
    private static final Object DROP = new Object();

    private final String defaultSource;
    private final String pipelineSource;

    public TriggerPatternCompiler(
            @Value("${compiler.events.default-source:custom.asset.processor}") String defaultSource,
            @Value("${compiler.events.pipeline-source:media.pipeline}") String pipelineSource) {
        this.defaultSource  = defaultSource;
        this.pipelineSource = pipelineSource;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    public EventPattern compile(RuleKind kind, PatternTemplate template, Map<String, Object> configuration) {
        return compile(kind, template, configuration, kind.wireName(), w -> { });
    }

    /**
     * @param template may be null, selecting built-in mode
     * @param warnings receives a TEMPLATE_PROCESSING warning when the
     *                 template is unusable
     */
    public EventPattern compile(RuleKind kind,
                                PatternTemplate template,
                                Map<String, Object> configuration,
                                String elementId,
                                Consumer<CompileWarning> warnings) {
        Map<String, Object> params = TriggerParameters.flatten(configuration);
        if (template != null) {
            try {
                return new EventPattern(fromTemplate(kind, template, params));
            } catch (PatternTemplateException e) {
                CompileWarning warning = new CompileWarning(CompileWarning.Kind.TEMPLATE_PROCESSING, elementId,
                        "Template for " + e.getRuleKind().wireName() + " not applied: " + e.getMessage());
                log.warn("{}", warning);
                warnings.accept(warning);
            }
        }
        return new EventPattern(builtIn(kind, params));
    }

    /**
     * Compiles one trigger node into a named rule.
     *
     * The rule kind comes from the node's "rule" setting, else its type id.
     * A node naming no known rule kind is skipped with a warning.
     */
    public Optional<TriggerRule> compileTrigger(Node node,
                                                String pipelineName,
                                                PatternTemplateSource templates,
                                                Consumer<CompileWarning> warnings) {
        if (node.role() != NodeRole.TRIGGER) {
            throw new IllegalArgumentException("Node '" + node.id() + "' is not a trigger");
        }
        Object configured = node.config("rule");
        String ruleName = configured instanceof String s && !s.isBlank() ? s : node.typeId();
        Optional<RuleKind> kind = RuleKind.fromName(ruleName);
        if (kind.isEmpty()) {
            CompileWarning warning = new CompileWarning(CompileWarning.Kind.INVALID_PARAMETER, node.id(),
                    "Unknown trigger rule '" + ruleName + "'; no event rule created");
            log.warn("{}", warning);
            warnings.accept(warning);
            return Optional.empty();
        }

        PatternTemplate template = templates.templateFor(kind.get()).orElse(null);
        EventPattern pattern = compile(kind.get(), template, node.configuration(), node.id(), warnings);
        TriggerRule rule = new TriggerRule(node.id(), kind.get(), ruleName(pipelineName, node.typeId()), pattern);
        log.debug("Trigger '{}' compiled to rule '{}'", node.id(), rule.ruleName());
        return Optional.of(rule);
    }

    static String ruleName(String pipelineName, String typeId) {
        String base = sanitizeRuleSegment(pipelineName) + "-rule-" + sanitizeRuleSegment(typeId);
        return base.length() <= MAX_RULE_NAME ? base : base.substring(0, MAX_RULE_NAME);
    }

    private static String sanitizeRuleSegment(String raw) {
        if (raw == null) return "";
        return raw.trim().replace(' ', '-').replaceAll("[^A-Za-z0-9._-]", "");
    }

    // ------------------------------------------------------------------
    // Template mode
    // ------------------------------------------------------------------

    private Map<String, Object> fromTemplate(RuleKind kind, PatternTemplate template, Map<String, Object> params) {
        Map<String, Object> skeleton = template.eventPattern();
        if (skeleton == null || skeleton.isEmpty()) {
            throw new PatternTemplateException(kind, "template pattern is empty");
        }
        if (kind == RuleKind.PIPELINE_EXECUTION_COMPLETED) {
            skeleton = flattenPipelineExecution(kind, skeleton, params);
        }

        Object substituted = substitute(skeleton, null, params);
        Map<String, Object> result = substituted instanceof Map<?, ?> map ? asStringMap(map) : new LinkedHashMap<>();
        if (kind != RuleKind.PIPELINE_EXECUTION_COMPLETED && !result.containsKey("source")) {
            result.put("source", List.of(defaultSource));
        }
        if (result.isEmpty()) {
            throw new PatternTemplateException(kind, "nothing left after substitution");
        }
        return result;
    }

    /**
     * Event-bus patterns cannot match inside arrays of objects, so the asset
     * described under detail.payload.assets is re-projected to
     * detail.outputs.input.DigitalSourceAsset.
     */
    private Map<String, Object> flattenPipelineExecution(RuleKind kind, Map<String, Object> skeleton,
                                                         Map<String, Object> params) {
        Object detail = skeleton.get("detail");
        if (detail != null && !(detail instanceof Map<?, ?>)) {
            throw new PatternTemplateException(kind, "'detail' must be an object");
        }

        Map<String, Object> flat = new LinkedHashMap<>();
        copyIfPresent(skeleton, flat, "source");
        copyIfPresent(skeleton, flat, "detail-type");

        Map<String, Object> flatDetail = new LinkedHashMap<>();
        if (detail instanceof Map<?, ?> d) {
            if (d.get("metadata") != null) flatDetail.put("metadata", d.get("metadata"));
            Map<?, ?> asset = firstAsset(kind, d);
            if (asset != null) {
                Map<String, Object> projected = projectAsset(asset, params);
                if (!projected.isEmpty()) {
                    flatDetail.put("outputs", Map.of("input", Map.of("DigitalSourceAsset", projected)));
                }
            }
        }
        if (!flatDetail.isEmpty()) flat.put("detail", flatDetail);
        return flat;
    }

    private static Map<?, ?> firstAsset(RuleKind kind, Map<?, ?> detail) {
        Object payload = detail.get("payload");
        if (payload == null) return null;
        if (!(payload instanceof Map<?, ?> p)) {
            throw new PatternTemplateException(kind, "'detail.payload' must be an object");
        }
        Object assets = p.get("assets");
        if (assets == null) return null;
        if (assets instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> m && m.get("DigitalSourceAsset") instanceof Map<?, ?> asset) {
                    return asset;
                }
            }
            return null;
        }
        if (assets instanceof Map<?, ?> m) {
            return m.get("DigitalSourceAsset") instanceof Map<?, ?> asset ? asset : null;
        }
        throw new PatternTemplateException(kind, "'detail.payload.assets' must be a list or an object");
    }

    private static Map<String, Object> projectAsset(Map<?, ?> asset, Map<String, Object> params) {
        Map<String, Object> projected = new LinkedHashMap<>();
        if (TriggerParameters.isPopulated(asset.get("Type"))) {
            projected.put("Type", asset.get("Type"));
        }
        // A format filter is projected only where the template asks for one.
        Object formats = null;
        if (asset.get("MainRepresentation") instanceof Map<?, ?> rep && rep.containsKey("Format")) {
            String formatValue = TriggerParameters.formatValue(params);
            formats = formatValue != null ? TriggerParameters.toList(formatValue, true) : rep.get("Format");
        }
        if (TriggerParameters.isPopulated(formats)) {
            projected.put("MainRepresentation", Map.of("Format", formats));
        }
        return projected;
    }

    /**
     * Replaces placeholders below {@code value}. Returns {@link #DROP} when the
     * value itself must be removed from its parent.
     */
    private Object substitute(Object value, String field, Map<String, Object> params) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                Object replaced = substitute(entry.getValue(), key, params);
                if (replaced == DROP) continue;
                if (replaced instanceof Map<?, ?> m && m.isEmpty()) continue;
                out.put(key, replaced);
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof String s && isWholePlaceholder(s)) {
                    Object resolved = resolvePlaceholder(s, field, params);
                    if (resolved != DROP) out.addAll((List<?>) resolved);
                    continue;
                }
                Object replaced = substitute(item, field, params);
                if (replaced == DROP) continue;
                if (replaced instanceof Map<?, ?> m && m.isEmpty()) continue;
                out.add(replaced);
            }
            return out.isEmpty() && !list.isEmpty() ? DROP : out;
        }
        if (value instanceof String s) {
            if (isWholePlaceholder(s)) return resolvePlaceholder(s, field, params);
            return substituteInline(s, params);
        }
        return value;
    }

    private static boolean isWholePlaceholder(String s) {
        return PLACEHOLDER.matcher(s.trim()).matches();
    }

    private Object resolvePlaceholder(String placeholder, String field, Map<String, Object> params) {
        Matcher m = PLACEHOLDER.matcher(placeholder.trim());
        if (!m.matches()) return placeholder;
        String name = m.group(1).trim();
        boolean formatTyped = TriggerParameters.isFormatField(name) || TriggerParameters.isFormatField(field);

        Object raw = params.get(name);
        if (!TriggerParameters.isPopulated(raw) && formatTyped) {
            raw = TriggerParameters.formatValue(params);
        }
        // Event values are matched upper-case.
        List<Object> values = TriggerParameters.toList(raw, true);
        if (values.isEmpty()) {
            log.debug("Placeholder ${{{}}} has no value; dropping field '{}'", name, field);
            return DROP;
        }
        return values;
    }

    private Object substituteInline(String s, Map<String, Object> params) {
        Matcher m = PLACEHOLDER.matcher(s);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            Object raw = params.get(m.group(1).trim());
            if (!TriggerParameters.isPopulated(raw)) return DROP;
            m.appendReplacement(out, Matcher.quoteReplacement(raw.toString().trim()));
        }
        m.appendTail(out);
        return out.toString();
    }

    // ------------------------------------------------------------------
    // Built-in mode
    // ------------------------------------------------------------------

    private Map<String, Object> builtIn(RuleKind kind, Map<String, Object> params) {
        Map<String, Object> pattern = new LinkedHashMap<>();
        Map<String, Object> detail = new LinkedHashMap<>();
        Set<String> consumed = new HashSet<>(NEVER_FOLDED);

        pattern.put("source", List.of(kind == RuleKind.PIPELINE_EXECUTION_COMPLETED ? pipelineSource : defaultSource));
        pattern.put("detail-type", List.of(kind.detailType()));

        switch (kind) {
            case INGEST_COMPLETED -> { }
            case VIDEO_INGESTED, VIDEO_PROCESSING_COMPLETED ->
                    putPath(detail, List.of("DigitalSourceAsset", "Type"), List.of("Video"));
            case PIPELINE_EXECUTION_COMPLETED -> pipelineExecution(params, detail, consumed);
            case WORKFLOW_COMPLETED -> {
                List<Object> pipelines = TriggerParameters.toList(params.get("pipeline_name"), false);
                if (!pipelines.isEmpty()) detail.put("pipeline_name", pipelines);
            }
        }

        fold(kind, params, consumed, detail);
        if (!detail.isEmpty()) pattern.put("detail", detail);
        return pattern;
    }

    private void pipelineExecution(Map<String, Object> params, Map<String, Object> detail, Set<String> consumed) {
        String assetType = "Video";
        Object formats = params.get(TriggerParameters.FORMAT);
        for (String field : List.of(TriggerParameters.IMAGE_TYPE, TriggerParameters.VIDEO_TYPE,
                TriggerParameters.AUDIO_TYPE)) {
            if (TriggerParameters.isPopulated(params.get(field))) {
                assetType = field.substring(0, field.indexOf(' '));
                formats = params.get(field);
                break;
            }
        }
        consumed.addAll(ASSET_TYPE_FIELDS);
        consumed.add(TriggerParameters.FORMAT);
        consumed.add(PREFIX);

        List<String> asset = List.of("outputs", "input", "DigitalSourceAsset");
        putPath(detail, append(asset, "Type"), List.of(assetType));
        List<Object> formatList = TriggerParameters.toList(formats, true);
        if (!formatList.isEmpty()) {
            putPath(detail, RuleKind.PIPELINE_EXECUTION_COMPLETED.formatPath(), formatList);
        }
        List<Object> prefix = TriggerParameters.toList(params.get(PREFIX), false);
        if (!prefix.isEmpty()) {
            putPath(detail, append(asset, "MainRepresentation", "StorageInfo", "PrimaryLocation", "ObjectKey", "Path"),
                    prefix);
        }
    }

    /**
     * Folds every parameter not used by the base pattern into "detail".
     * "Format" goes under the kind's format path.
     */
    private void fold(RuleKind kind, Map<String, Object> params, Set<String> consumed, Map<String, Object> detail) {
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            String key = entry.getKey();
            if (consumed.contains(key) || !TriggerParameters.isPopulated(entry.getValue())) continue;
            if (entry.getValue() instanceof Map<?, ?>) {
                log.debug("Skipping object-valued trigger parameter '{}'", key);
                continue;
            }
            List<Object> values = TriggerParameters.toList(entry.getValue(), TriggerParameters.isFormatField(key));
            if (values.isEmpty()) continue;
            if (TriggerParameters.FORMAT.equals(key)) {
                putPath(detail, kind.formatPath(), values);
            } else {
                detail.put(key, values);
            }
        }
    }

    // ------------------------------------------------------------------
    // Map helpers
    // ------------------------------------------------------------------

    @SuppressWarnings("unchecked")
    private static void putPath(Map<String, Object> root, List<String> path, Object value) {
        Map<String, Object> current = root;
        for (String key : path.subList(0, path.size() - 1)) {
            current = (Map<String, Object>) current.computeIfAbsent(key, k -> new LinkedHashMap<String, Object>());
        }
        current.put(path.get(path.size() - 1), value);
    }

    private static List<String> append(List<String> base, String... more) {
        List<String> path = new ArrayList<>(base);
        path.addAll(List.of(more));
        return path;
    }

    private static void copyIfPresent(Map<String, Object> from, Map<String, Object> to, String key) {
        if (from.get(key) != null) to.put(key, from.get(key));
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
