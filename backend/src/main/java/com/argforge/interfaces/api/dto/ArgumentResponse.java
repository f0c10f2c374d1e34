package com.argforge.interfaces.api.dto;

import com.argforge.domain.argument.model.GeneratedArgument;

public record ArgumentResponse(
        String ruleName,
        String argumentName,
        String templateType,
        String text
) {
    public static ArgumentResponse from(GeneratedArgument argument) {
        return new ArgumentResponse(
                argument.getRuleName(),
                argument.getArgumentName(),
                argument.getTemplateType().getKey(),
                argument.getText());
    }
}
