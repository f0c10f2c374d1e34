package com.argforge.domain.template.model;

import java.util.Set;

public record TemplateInfo(
        String sourceText,
        Set<String> requiredVariables,
        int componentCount,
        boolean hasVariations,
        TemplateMetadata metadata
) {}
