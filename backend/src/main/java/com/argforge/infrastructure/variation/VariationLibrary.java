package com.argforge.infrastructure.variation;

import com.argforge.domain.language.LanguagePatternProvider;
import com.argforge.domain.template.model.VariationKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reusable phrase lists keyed {@code <kind>_<style>}, e.g. {@code negation_formal}.
 *
 * <p>Doubles as a pattern provider: {@link #patternsFor(VariationKind)} groups the
 * entries whose key starts with the kind's name into style buckets.</p>
 */
public class VariationLibrary implements LanguagePatternProvider {

    private final Map<String, List<String>> variations = new LinkedHashMap<>();

    public VariationLibrary() {
        addVariation("negation_simple", List.of(
                "{sentence} is not the case",
                "{sentence} is false",
                "not {sentence}",
                "{sentence} doesn't hold"));
        addVariation("negation_formal", List.of(
                "it is false that {sentence}",
                "it is not the case that {sentence}",
                "{sentence} is not true",
                "the proposition that {sentence} is false"));
        addVariation("negation_emphatic", List.of(
                "{sentence} is definitely false",
                "{sentence} is certainly not the case",
                "{sentence} is absolutely false",
                "{sentence} is unquestionably false"));

        addVariation("conjunction_simple", List.of(
                "{p} and {q}",
                "{p}, and {q}",
                "both {p} and {q}",
                "{p} as well as {q}"));
        addVariation("conjunction_formal", List.of(
                "{p} in conjunction with {q}",
                "{p} combined with {q}",
                "{p} together with {q}",
                "the conjunction of {p} and {q}"));

        addVariation("disjunction_inclusive", List.of(
                "{p} or {q}",
                "{p}, or {q}",
                "either {p} or {q} or both",
                "{p} and/or {q}"));
        addVariation("disjunction_exclusive", List.of(
                "either {p} or {q} but not both",
                "exactly one of {p} or {q}",
                "{p} or {q}, but not both",
                "either {p} or {q} (exclusive)"));

        addVariation("conditional_standard", List.of(
                "if {antecedent}, then {consequent}",
                "if {antecedent} then {consequent}",
                "{consequent} if {antecedent}",
                "given {antecedent}, {consequent}"));
        addVariation("conditional_causal", List.of(
                "{antecedent} causes {consequent}",
                "{antecedent} leads to {consequent}",
                "{antecedent} results in {consequent}",
                "{antecedent} brings about {consequent}"));
        addVariation("conditional_necessity", List.of(
                "{consequent} is necessary for {antecedent}",
                "{antecedent} requires {consequent}",
                "without {consequent}, no {antecedent}",
                "{antecedent} only if {consequent}"));
        addVariation("conditional_sufficiency", List.of(
                "{antecedent} is sufficient for {consequent}",
                "{antecedent} guarantees {consequent}",
                "{antecedent} ensures {consequent}",
                "{antecedent} implies {consequent}"));
    }

    public List<String> getVariation(String name) {
        return variations.getOrDefault(name, List.of());
    }

    public void addVariation(String name, List<String> patterns) {
        variations.put(name, List.copyOf(patterns));
    }

    public Map<String, List<String>> getAllVariations() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variations));
    }

    public List<String> getVariationNames() {
        return new ArrayList<>(variations.keySet());
    }

    @Override
    public String languageCode() {
        return "en";
    }

    @Override
    public Map<String, List<String>> patternsFor(VariationKind kind) {
        String prefix = kind.getKey() + "_";
        Map<String, List<String>> buckets = new LinkedHashMap<>();
        variations.forEach((name, patterns) -> {
            if (name.startsWith(prefix)) {
                buckets.put(name.substring(prefix.length()), patterns);
            }
        });
        return Collections.unmodifiableMap(buckets);
    }
}
