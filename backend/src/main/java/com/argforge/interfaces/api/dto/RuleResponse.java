package com.argforge.interfaces.api.dto;

import com.argforge.domain.rule.model.LogicalRule;

public record RuleResponse(
        String name,
        String fallacy,
        String description,
        int sentencesNeeded,
        String structureType,
        boolean hasTemplates
) {
    public static RuleResponse from(LogicalRule rule, boolean hasTemplates) {
        return new RuleResponse(rule.validName(), rule.invalidName(), rule.description(),
                rule.sentencesNeeded(), rule.structureType(), hasTemplates);
    }
}
