package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.GenerationOptions;
import com.argforge.domain.template.model.TemplateBankStatistics;
import com.argforge.domain.template.model.TemplateMetadata;
import com.argforge.domain.template.model.TemplateType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Registry of templates keyed by rule name and template type.
 *
 * <p>Templates are appended while the bank is set up and only read afterwards, so a
 * populated bank can be shared by concurrent generators. Randomness is supplied by
 * the caller; each worker should pass its own {@link Random}.</p>
 */
@Slf4j
public class TemplateBank {

    private final Map<String, Map<TemplateType, List<EnhancedTemplate>>> templates = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> variationMappings = new LinkedHashMap<>();

    public void addTemplate(String ruleName, TemplateType templateType, EnhancedTemplate template) {
        Objects.requireNonNull(ruleName, "ruleName");
        Objects.requireNonNull(templateType, "templateType");
        Objects.requireNonNull(template, "template");
        templates.computeIfAbsent(ruleName, k -> new EnumMap<>(TemplateType.class))
                .computeIfAbsent(templateType, k -> new ArrayList<>())
                .add(template);
    }

    public void addVariationMapping(String variationName, Map<String, Object> mapping) {
        variationMappings.put(variationName, Map.copyOf(mapping));
    }

    public Optional<Map<String, Object>> getVariationMapping(String variationName) {
        return Optional.ofNullable(variationMappings.get(variationName));
    }

    public List<EnhancedTemplate> getTemplates(String ruleName, TemplateType templateType) {
        Map<TemplateType, List<EnhancedTemplate>> byType = templates.get(ruleName);
        if (byType == null || !byType.containsKey(templateType)) {
            return List.of();
        }
        return Collections.unmodifiableList(byType.get(templateType));
    }

    public Set<String> ruleNames() {
        return Collections.unmodifiableSet(templates.keySet());
    }

    public Optional<EnhancedTemplate> getRandomTemplate(String ruleName, TemplateType templateType,
                                                        ComplexityLevel complexity) {
        return getRandomTemplate(ruleName, templateType, complexity, ThreadLocalRandom.current());
    }

    /**
     * Picks a template uniformly at random. When {@code complexity} is given, only
     * templates tagged with it are candidates; if none are, every template for the
     * rule and type is a candidate again.
     *
     * @return empty only when nothing is registered for the rule and type
     */
    public Optional<EnhancedTemplate> getRandomTemplate(String ruleName, TemplateType templateType,
                                                        ComplexityLevel complexity, Random random) {
        List<EnhancedTemplate> candidates = getTemplates(ruleName, templateType);

        if (complexity != null) {
            List<EnhancedTemplate> filtered = candidates.stream()
                    .filter(t -> t.getMetadata().complexity() == complexity)
                    .toList();
            if (!filtered.isEmpty()) {
                candidates = filtered;
            } else if (!candidates.isEmpty()) {
                log.debug("[TemplateBank] No {} template for {} ({}), using all {} candidates",
                        complexity, ruleName, templateType, candidates.size());
            }
        }

        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(random.nextInt(candidates.size())));
    }

    public String generateArgument(String ruleName, Map<String, ?> variables,
                                   TemplateType templateType, GenerationOptions options) {
        return generateArgument(ruleName, variables, templateType, options, ThreadLocalRandom.current());
    }

    /**
     * Renders a random matching template. Returns a diagnostic sentence instead of
     * throwing when nothing is registered, so batch generation keeps going.
     */
    public String generateArgument(String ruleName, Map<String, ?> variables,
                                   TemplateType templateType, GenerationOptions options, Random random) {
        GenerationOptions effective = options == null ? GenerationOptions.defaults() : options;
        Optional<EnhancedTemplate> template = getRandomTemplate(ruleName, templateType, effective.complexity(), random);

        if (template.isEmpty()) {
            log.warn("[TemplateBank] No template found for {} ({})", ruleName, templateType);
            return "No template found for " + ruleName + " (" + templateType.getKey() + ")";
        }

        return template.get().render(variables, effective.variationPreferences(), random);
    }

    /**
     * Builds a template from pattern text where {@code {{name}}} marks a named variation point.
     */
    public EnhancedTemplate createTemplateFromPattern(String pattern,
                                                      Map<String, List<String>> variationPoints,
                                                      TemplateMetadata metadata) {
        TemplateBuilder builder = new TemplateBuilder().addPattern(pattern, variationPoints);
        TemplateMetadata effective = metadata == null ? TemplateMetadata.defaults() : metadata;
        builder.complexity(effective.complexity()).domain(effective.domain());
        effective.tags().forEach(builder::tag);
        effective.extensions().forEach(builder::setMetadata);
        return builder.build();
    }

    public TemplateBankStatistics getStatistics() {
        int total = 0;
        Map<String, Map<String, Integer>> perRule = new LinkedHashMap<>();
        for (Map.Entry<String, Map<TemplateType, List<EnhancedTemplate>>> rule : templates.entrySet()) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (Map.Entry<TemplateType, List<EnhancedTemplate>> byType : rule.getValue().entrySet()) {
                counts.put(byType.getKey().getKey(), byType.getValue().size());
                total += byType.getValue().size();
            }
            perRule.put(rule.getKey(), Collections.unmodifiableMap(counts));
        }
        return new TemplateBankStatistics(templates.size(), total, Collections.unmodifiableMap(perRule));
    }
}
