package com.pipeforge.compiler.trigger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pattern templates read from YAML files, one per rule kind, named
 * {@code <rule_kind>.yaml} under {@code compiler.templates.location}.
 *
 * <pre>
 * event_pattern:
 *   detail-type: [AssetCreated]
 *   detail:
 *     DigitalSourceAsset:
 *       MainRepresentation:
 *         Format: ["${Format}"]
 * </pre>
 *
 * All templates are read once at startup. A file that is missing is simply
 * absent; a file that cannot be parsed is logged and skipped.
 */
@Component
public class YamlPatternTemplateSource implements PatternTemplateSource {

    private static final Logger log = LoggerFactory.getLogger(YamlPatternTemplateSource.class);

    static final String PATTERN_KEY = "event_pattern";

    private final Map<RuleKind, PatternTemplate> templates = new EnumMap<>(RuleKind.class);

    public YamlPatternTemplateSource(
            ResourceLoader resourceLoader,
            @Value("${compiler.templates.location:classpath:pattern-templates/}") String location) {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        String base = location.endsWith("/") ? location : location + "/";
        for (RuleKind kind : RuleKind.values()) {
            Resource resource = resourceLoader.getResource(base + kind.wireName() + ".yaml");
            if (!resource.exists()) {
                log.debug("No pattern template for {} at {}", kind.wireName(), base);
                continue;
            }
            load(yamlMapper, kind, resource).ifPresent(t -> templates.put(kind, t));
        }
        log.info("Loaded {} event pattern template(s) from {}", templates.size(), base);
    }

    @Override
    public Optional<PatternTemplate> templateFor(RuleKind kind) {
        return Optional.ofNullable(templates.get(kind));
    }

    @SuppressWarnings("unchecked")
    private Optional<PatternTemplate> load(ObjectMapper yamlMapper, RuleKind kind, Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            Map<String, Object> document = yamlMapper.readValue(in, new TypeReference<Map<String, Object>>() {});
            Object pattern = document == null ? null : document.get(PATTERN_KEY);
            if (!(pattern instanceof Map<?, ?>)) {
                log.warn("Template {} has no '{}' object; ignoring it", resource.getDescription(), PATTERN_KEY);
                return Optional.empty();
            }
            return Optional.of(new PatternTemplate(kind, (Map<String, Object>) pattern));
        } catch (IOException e) {
            log.warn("Cannot read pattern template {}: {}", resource.getDescription(), e.getMessage());
            return Optional.empty();
        }
    }
}
