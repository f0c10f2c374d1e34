package com.argforge.infrastructure.language;

import com.argforge.domain.language.LanguagePatternProvider;
import com.argforge.domain.template.model.VariationKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * English phrase templates for negation, conjunction, disjunction and conditionals.
 */
public class EnglishPatternProvider implements LanguagePatternProvider {

    private final Map<VariationKind, Map<String, List<String>>> patterns = new EnumMap<>(VariationKind.class);

    public EnglishPatternProvider() {
        Map<String, List<String>> negation = new LinkedHashMap<>();
        negation.put("simple", List.of(
                "not {sentence}",
                "{sentence} is false",
                "{sentence} is not the case",
                "{sentence} doesn't hold"));
        negation.put("formal", List.of(
                "it is not the case that {sentence}",
                "it is false that {sentence}",
                "{sentence} is not true",
                "the negation of {sentence}"));
        negation.put("emphatic", List.of(
                "{sentence} is definitely false",
                "{sentence} is certainly not the case",
                "{sentence} is absolutely false"));
        patterns.put(VariationKind.NEGATION, Collections.unmodifiableMap(negation));

        Map<String, List<String>> conjunction = new LinkedHashMap<>();
        conjunction.put("simple", List.of(
                "{p} and {q}",
                "{p}, and {q}",
                "both {p} and {q}",
                "{p} as well as {q}"));
        conjunction.put("formal", List.of(
                "{p} and {q}",
                "{p} in conjunction with {q}",
                "both {p} and {q}",
                "{p} together with {q}"));
        patterns.put(VariationKind.CONJUNCTION, Collections.unmodifiableMap(conjunction));

        Map<String, List<String>> disjunction = new LinkedHashMap<>();
        disjunction.put("inclusive", List.of(
                "{p} or {q}",
                "either {p} or {q}"));
        disjunction.put("exclusive", List.of(
                "either {p} or {q} but not both",
                "exactly one of {p} or {q}",
                "{p} or {q}, but not both"));
        patterns.put(VariationKind.DISJUNCTION, Collections.unmodifiableMap(disjunction));

        Map<String, List<String>> conditional = new LinkedHashMap<>();
        conditional.put("standard", List.of(
                "if {antecedent}, then {consequent}",
                "if {antecedent} then {consequent}",
                "{consequent} if {antecedent}",
                "given {antecedent}, {consequent}"));
        conditional.put("formal", List.of(
                "given that {antecedent}, {consequent}",
                "provided that {antecedent}, {consequent}",
                "on the condition that {antecedent}, {consequent}"));
        conditional.put("causal", List.of(
                "{antecedent} implies {consequent}",
                "{antecedent} leads to {consequent}",
                "{antecedent} results in {consequent}"));
        patterns.put(VariationKind.CONDITIONAL, Collections.unmodifiableMap(conditional));
    }

    @Override
    public String languageCode() {
        return "en";
    }

    @Override
    public Map<String, List<String>> patternsFor(VariationKind kind) {
        return patterns.getOrDefault(kind, Map.of());
    }
}
