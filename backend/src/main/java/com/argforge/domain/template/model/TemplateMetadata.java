package com.argforge.domain.template.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed template metadata. Keys other than {@code complexity}, {@code domain} and
 * {@code tags} are kept in {@link #extensions()}.
 */
public record TemplateMetadata(
        ComplexityLevel complexity,
        String domain,
        Map<String, String> tags,
        Map<String, Object> extensions
) {
    public static final String COMPLEXITY_KEY = "complexity";
    public static final String DOMAIN_KEY = "domain";
    public static final String TAGS_KEY = "tags";
    public static final String DEFAULT_DOMAIN = "general";

    public TemplateMetadata {
        complexity = complexity == null ? ComplexityLevel.BASIC : complexity;
        domain = domain == null ? DEFAULT_DOMAIN : domain;
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    }

    public static TemplateMetadata defaults() {
        return new TemplateMetadata(null, null, null, null);
    }

    public static TemplateMetadata of(ComplexityLevel complexity) {
        return new TemplateMetadata(complexity, null, null, null);
    }

    public static TemplateMetadata of(ComplexityLevel complexity, String domain) {
        return new TemplateMetadata(complexity, domain, null, null);
    }

    /**
     * Returns a copy with one entry set, routing recognised keys to their typed field.
     */
    public TemplateMetadata with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        switch (key) {
            case COMPLEXITY_KEY:
                return new TemplateMetadata(ComplexityLevel.fromValue(value), domain, tags, extensions);
            case DOMAIN_KEY:
                return new TemplateMetadata(complexity, String.valueOf(value), tags, extensions);
            case TAGS_KEY:
                if (value instanceof Map<?, ?> map) {
                    Map<String, String> merged = new LinkedHashMap<>(tags);
                    map.forEach((k, v) -> merged.put(String.valueOf(k), String.valueOf(v)));
                    return new TemplateMetadata(complexity, domain, merged, extensions);
                }
                break;
            default:
                break;
        }
        if (value == null) {
            throw new IllegalArgumentException("Metadata value for '" + key + "' must not be null");
        }
        Map<String, Object> merged = new LinkedHashMap<>(extensions);
        merged.put(key, value);
        return new TemplateMetadata(complexity, domain, tags, merged);
    }

    public TemplateMetadata withTag(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(tags);
        merged.put(key, value);
        return new TemplateMetadata(complexity, domain, merged, extensions);
    }
}
