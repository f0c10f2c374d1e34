package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComponentKind;
import com.argforge.domain.template.model.TemplateComponent;
import com.argforge.domain.template.model.TemplateComponent.ConditionalBlock;
import com.argforge.domain.template.model.TemplateComponent.RepeatedBlock;
import com.argforge.domain.template.model.TemplateComponent.StaticText;
import com.argforge.domain.template.model.TemplateComponent.VariableSlot;
import com.argforge.domain.template.model.TemplateComponent.VariationPoint;
import com.argforge.domain.template.model.TemplateInfo;
import com.argforge.domain.template.model.TemplateMetadata;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Matcher;

/**
 * A parsed template together with its metadata.
 *
 * <p>Instances are immutable and can be shared between threads. Rendering never
 * throws on missing bindings: an unbound variable is emitted as its {@code {name}}
 * placeholder so incomplete contexts stay visible in the output.</p>
 */
public final class EnhancedTemplate {

    private static final TemplateParser PARSER = new TemplateParser();

    private final String sourceText;
    private final List<TemplateComponent> components;
    private final Set<String> requiredVariables;
    private final TemplateMetadata metadata;

    public EnhancedTemplate(String sourceText) {
        this(sourceText, TemplateMetadata.defaults());
    }

    public EnhancedTemplate(String sourceText, TemplateMetadata metadata) {
        this(sourceText, PARSER.parse(sourceText), metadata);
    }

    EnhancedTemplate(String sourceText, List<TemplateComponent> components, TemplateMetadata metadata) {
        this.sourceText = sourceText == null ? "" : sourceText;
        this.components = List.copyOf(components);
        this.metadata = metadata == null ? TemplateMetadata.defaults() : metadata;
        this.requiredVariables = Collections.unmodifiableSet(collectRequiredVariables(this.components));
    }

    /**
     * Text the template was parsed from, or the display form recorded by {@link TemplateBuilder}.
     */
    public String getSourceText() { return sourceText; }
    public List<TemplateComponent> getComponents() { return components; }
    public Set<String> getRequiredVariables() { return requiredVariables; }
    public TemplateMetadata getMetadata() { return metadata; }

    public String render(Map<String, ?> context) {
        return render(context, Map.of(), ThreadLocalRandom.current());
    }

    public String render(Map<String, ?> context, Map<String, String> variationPreferences) {
        return render(context, variationPreferences, ThreadLocalRandom.current());
    }

    /**
     * Renders the template.
     *
     * @param context              variable bindings; string or collection values
     * @param variationPreferences forced choices keyed by variation point name, also
     *                             visible to the template as bindings
     * @param random               source for unforced variation choices
     */
    public String render(Map<String, ?> context, Map<String, String> variationPreferences, Random random) {
        Objects.requireNonNull(random, "random");
        Map<String, Object> scope = new HashMap<>();
        if (context != null) {
            scope.putAll(context);
        }
        Map<String, String> preferences = variationPreferences == null ? Map.of() : variationPreferences;
        preferences.forEach((name, value) -> {
            if (value != null) {
                scope.put(name, value);
            }
        });

        StringBuilder out = new StringBuilder();
        for (TemplateComponent component : components) {
            out.append(renderComponent(component, scope, preferences, random));
        }
        return out.toString();
    }

    private static String renderComponent(TemplateComponent component,
                                          Map<String, Object> scope,
                                          Map<String, String> preferences,
                                          Random random) {
        return switch (component.kind()) {
            case STATIC -> ((StaticText) component).text();
            case VARIABLE -> renderVariable((VariableSlot) component, scope);
            case VARIATION -> renderVariation((VariationPoint) component, scope, preferences, random);
            case CONDITIONAL -> renderConditional((ConditionalBlock) component, scope);
            case REPEATED -> renderRepeated((RepeatedBlock) component, scope);
        };
    }

    private static String renderVariable(VariableSlot slot, Map<String, Object> scope) {
        if (scope.containsKey(slot.name())) {
            return String.valueOf(scope.get(slot.name()));
        }
        return "{" + slot.name() + "}";
    }

    private static String renderVariation(VariationPoint point,
                                          Map<String, Object> scope,
                                          Map<String, String> preferences,
                                          Random random) {
        String choice;
        String forced = point.isNamed() ? preferences.get(point.pointName()) : null;
        if (forced != null) {
            choice = forced;
        } else {
            List<String> choices = point.choices();
            choice = choices.get(random.nextInt(choices.size()));
        }
        return resolvePlaceholders(choice, scope);
    }

    private static String renderConditional(ConditionalBlock block, Map<String, Object> scope) {
        boolean condition = isTruthy(scope.get(block.conditionKey()));
        return resolvePlaceholders(condition ? block.trueTemplate() : block.falseTemplate(), scope);
    }

    private static String renderRepeated(RepeatedBlock block, Map<String, Object> scope) {
        if (!(scope.get(block.itemsKey()) instanceof Collection<?> items) || items.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(block.separator());
        for (Object item : items) {
            Map<String, Object> itemScope = new HashMap<>(scope);
            itemScope.put(RepeatedBlock.ITEM_BINDING, item);
            joiner.add(resolvePlaceholders(block.itemTemplate(), itemScope));
        }
        return joiner.toString();
    }

    /**
     * Substitutes bound {@code {name}} placeholders in a raw string, leaving unbound
     * ones as written. The string is not re-parsed for variation syntax.
     */
    static String resolvePlaceholders(String text, Map<String, ?> scope) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Matcher matcher = TemplateParser.VARIABLE_PATTERN.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = scope.containsKey(name) ? String.valueOf(scope.get(name)) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean bool) return bool;
        if (value instanceof CharSequence text) return text.length() > 0;
        if (value instanceof Collection<?> collection) return !collection.isEmpty();
        if (value instanceof Map<?, ?> map) return !map.isEmpty();
        if (value instanceof Number number) return number.doubleValue() != 0.0;
        return true;
    }

    private static Set<String> collectRequiredVariables(List<TemplateComponent> components) {
        Set<String> names = new LinkedHashSet<>();
        for (TemplateComponent component : components) {
            switch (component.kind()) {
                case STATIC -> { }
                case VARIABLE -> names.add(((VariableSlot) component).name());
                case VARIATION -> ((VariationPoint) component).choices()
                        .forEach(choice -> names.addAll(TemplateParser.variableNames(choice)));
                case CONDITIONAL -> {
                    ConditionalBlock block = (ConditionalBlock) component;
                    names.addAll(TemplateParser.variableNames(block.trueTemplate()));
                    names.addAll(TemplateParser.variableNames(block.falseTemplate()));
                }
                case REPEATED -> {
                    Set<String> itemNames = TemplateParser.variableNames(((RepeatedBlock) component).itemTemplate());
                    itemNames.remove(RepeatedBlock.ITEM_BINDING);
                    names.addAll(itemNames);
                }
            }
        }
        return names;
    }

    public boolean hasVariations() {
        return components.stream().anyMatch(c -> c.kind() == ComponentKind.VARIATION);
    }

    public TemplateInfo info() {
        return new TemplateInfo(sourceText, requiredVariables, components.size(), hasVariations(), metadata);
    }

    @Override
    public String toString() {
        return "EnhancedTemplate[" + sourceText + ", " + metadata.complexity() + "]";
    }
}
