package com.argforge.interfaces.api.dto;

import com.argforge.domain.template.model.ComplexityLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record GenerateArgumentRequest(
        @NotBlank(message = "Rule name is required")
        String ruleName,

        @NotEmpty(message = "At least one sentence is required")
        @Size(max = 8, message = "At most 8 sentences are accepted")
        List<@NotBlank(message = "Sentences must not be blank") String> sentences,

        @Pattern(regexp = "(?i)valid|invalid", message = "Template type must be 'valid' or 'invalid'")
        String templateType,

        ComplexityLevel complexity,

        Map<String, String> variationPreferences,

        Long seed
) {}
