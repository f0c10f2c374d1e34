package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.TemplateComponent;
import com.argforge.domain.template.model.TemplateComponent.ConditionalBlock;
import com.argforge.domain.template.model.TemplateComponent.RepeatedBlock;
import com.argforge.domain.template.model.TemplateComponent.StaticText;
import com.argforge.domain.template.model.TemplateComponent.VariableSlot;
import com.argforge.domain.template.model.TemplateComponent.VariationPoint;
import com.argforge.domain.template.model.TemplateMetadata;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fluent builder for templates with named variation points.
 *
 * <p>The component list is assembled directly, so each variation point keeps its
 * name and can later be forced through {@code variationPreferences}.</p>
 *
 * <p>The source text of a built template is for display only. Conditional and repeated
 * parts are shown as {@code <if key>..<else>..</if>} and {@code <each key>..</each>},
 * which the parser does not read back as blocks.</p>
 */
public class TemplateBuilder {

    private static final Pattern NAMED_POINT_PATTERN = Pattern.compile("\\{\\{([^{}]+)\\}\\}");

    private final List<TemplateComponent> components = new ArrayList<>();
    private final Set<String> pointNames = new HashSet<>();
    private final StringBuilder source = new StringBuilder();
    private TemplateMetadata metadata = TemplateMetadata.defaults();

    public TemplateBuilder addStatic(String text) {
        if (text != null && !text.isEmpty()) {
            components.add(new StaticText(text));
            source.append(text);
        }
        return this;
    }

    public TemplateBuilder addVariable(String name) {
        components.add(new VariableSlot(name));
        source.append('{').append(name).append('}');
        return this;
    }

    public TemplateBuilder addVariation(String pointName, List<String> choices) {
        Objects.requireNonNull(pointName, "pointName");
        if (choices == null || choices.isEmpty()) {
            throw new IllegalArgumentException("Variation point '" + pointName + "' requires at least one choice");
        }
        if (!pointNames.add(pointName)) {
            throw new IllegalArgumentException("Duplicate variation point name: " + pointName);
        }
        components.add(new VariationPoint(pointName, choices));
        source.append("[[").append(String.join("|", choices)).append("]]");
        return this;
    }

    public TemplateBuilder addConditional(String conditionKey, String truePart) {
        return addConditional(conditionKey, truePart, "");
    }

    public TemplateBuilder addConditional(String conditionKey, String truePart, String falsePart) {
        components.add(new ConditionalBlock(conditionKey, truePart, falsePart));
        source.append("<if ").append(conditionKey).append('>').append(truePart == null ? "" : truePart)
                .append("<else>").append(falsePart == null ? "" : falsePart).append("</if>");
        return this;
    }

    public TemplateBuilder addRepeated(String itemsKey, String separator, String itemTemplate) {
        components.add(new RepeatedBlock(itemsKey, separator, itemTemplate));
        source.append("<each ").append(itemsKey).append('>').append(itemTemplate).append("</each>");
        return this;
    }

    /**
     * Appends pattern text in which {@code {{name}}} marks a named variation point.
     * Markers without an entry in {@code points} are parsed as ordinary text.
     */
    public TemplateBuilder addPattern(String pattern, Map<String, List<String>> points) {
        if (pattern == null || pattern.isEmpty()) {
            return this;
        }
        TemplateParser parser = new TemplateParser();
        Map<String, List<String>> named = points == null ? Map.of() : points;
        Matcher matcher = NAMED_POINT_PATTERN.matcher(pattern);
        int lastEnd = 0;
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!named.containsKey(name)) {
                continue;
            }
            appendParsed(parser, pattern.substring(lastEnd, matcher.start()));
            addVariation(name, named.get(name));
            lastEnd = matcher.end();
        }
        appendParsed(parser, pattern.substring(lastEnd));
        return this;
    }

    private void appendParsed(TemplateParser parser, String text) {
        if (text.isEmpty()) {
            return;
        }
        components.addAll(parser.parse(text));
        source.append(text);
    }

    public TemplateBuilder setMetadata(String key, Object value) {
        metadata = metadata.with(key, value);
        return this;
    }

    public TemplateBuilder complexity(ComplexityLevel complexity) {
        return setMetadata(TemplateMetadata.COMPLEXITY_KEY, complexity);
    }

    public TemplateBuilder domain(String domain) {
        return setMetadata(TemplateMetadata.DOMAIN_KEY, domain);
    }

    public TemplateBuilder tag(String key, String value) {
        metadata = metadata.withTag(key, value);
        return this;
    }

    public EnhancedTemplate build() {
        return new EnhancedTemplate(source.toString(), components, metadata);
    }
}
