package com.argforge.domain.template.model;

import java.util.Map;

public record TemplateBankStatistics(
        int totalRules,
        int totalTemplates,
        Map<String, Map<String, Integer>> perRule
) {}
