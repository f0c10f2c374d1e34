package com.argforge.domain.argument.model;

import com.argforge.domain.template.model.TemplateType;
import lombok.Value;

/**
 * Immutable value object holding one rendered argument.
 */
@Value
public class GeneratedArgument {
    String ruleName;
    String argumentName;
    TemplateType templateType;
    String text;
}
