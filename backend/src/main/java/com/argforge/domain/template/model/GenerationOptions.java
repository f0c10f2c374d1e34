package com.argforge.domain.template.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Options recognised by the template bank when generating an argument.
 *
 * @param complexity           preferred template complexity, nullable
 * @param variationPreferences forced choices keyed by variation point name; entries
 *                             with a null value are dropped
 */
public record GenerationOptions(
        ComplexityLevel complexity,
        Map<String, String> variationPreferences
) {
    public GenerationOptions {
        Map<String, String> present = new LinkedHashMap<>();
        if (variationPreferences != null) {
            variationPreferences.forEach((name, value) -> {
                if (name != null && value != null) {
                    present.put(name, value);
                }
            });
        }
        variationPreferences = Collections.unmodifiableMap(present);
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, Map.of());
    }

    public static GenerationOptions withComplexity(ComplexityLevel complexity) {
        return new GenerationOptions(complexity, Map.of());
    }
}
