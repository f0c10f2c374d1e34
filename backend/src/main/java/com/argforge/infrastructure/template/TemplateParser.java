package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.TemplateComponent;
import com.argforge.domain.template.model.TemplateComponent.StaticText;
import com.argforge.domain.template.model.TemplateComponent.VariableSlot;
import com.argforge.domain.template.model.TemplateComponent.VariationPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses template source text into components.
 *
 * <p>Grammar:</p>
 * <ul>
 *     <li>{@code {name}} - variable, name is any run of characters other than braces</li>
 *     <li>{@code [[a|b|c]]} - anonymous variation point, choices split on {@code |}</li>
 * </ul>
 *
 * There is no escape syntax. An unterminated {@code [[} or {@code {} does not match
 * either pattern and stays in the output as static text; parsing never fails.
 */
public final class TemplateParser {

    static final Pattern VARIATION_PATTERN = Pattern.compile("\\[\\[([^\\]]+)\\]\\]");
    static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([^{}]+)\\}");

    private static final String CHOICE_SEPARATOR = "\\|";

    public List<TemplateComponent> parse(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }

        List<TemplateComponent> components = new ArrayList<>();
        String remaining = source;

        while (!remaining.isEmpty()) {
            Matcher variation = VARIATION_PATTERN.matcher(remaining);
            Matcher variable = VARIABLE_PATTERN.matcher(remaining);
            int variationStart = variation.find() ? variation.start() : Integer.MAX_VALUE;
            int variableStart = variable.find() ? variable.start() : Integer.MAX_VALUE;

            if (variationStart < variableStart) {
                components.addAll(parseStaticText(remaining.substring(0, variationStart)));
                List<String> choices = Arrays.asList(variation.group(1).split(CHOICE_SEPARATOR, -1));
                components.add(VariationPoint.anonymous(choices));
                remaining = remaining.substring(variation.end());
            } else if (variableStart != Integer.MAX_VALUE) {
                if (variableStart > 0) {
                    components.add(new StaticText(remaining.substring(0, variableStart)));
                }
                components.add(new VariableSlot(variable.group(1)));
                remaining = remaining.substring(variable.end());
            } else {
                components.add(new StaticText(remaining));
                break;
            }
        }

        return components;
    }

    /**
     * Splits text that contains no variation syntax into static and variable parts.
     */
    List<TemplateComponent> parseStaticText(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<TemplateComponent> components = new ArrayList<>();
        Matcher matcher = VARIABLE_PATTERN.matcher(text);
        int lastEnd = 0;
        while (matcher.find()) {
            if (matcher.start() > lastEnd) {
                components.add(new StaticText(text.substring(lastEnd, matcher.start())));
            }
            components.add(new VariableSlot(matcher.group(1)));
            lastEnd = matcher.end();
        }
        if (lastEnd < text.length()) {
            components.add(new StaticText(text.substring(lastEnd)));
        }
        return components;
    }

    /**
     * Names of every {@code {name}} placeholder in the given text, in order of first appearance.
     */
    public static Set<String> variableNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return names;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }
}
