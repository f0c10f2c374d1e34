package com.argforge.infrastructure.variation;

import com.argforge.domain.language.LanguagePatternProvider;
import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.VariationKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces negated, conjoined, disjoined and conditional phrasings of sentences
 * from a language's style buckets.
 *
 * <p>A generator is immutable and owns its {@link Random}; give each worker its own
 * instance. When a bucket is missing the generator falls back to a default style and
 * finally returns the input sentences unchanged.</p>
 */
@Slf4j
public class VariationGenerator {

    static final String EXCLUSIVE_STYLE = "exclusive";

    private static final List<String> NEGATION_DEFAULTS = List.of("simple");
    private static final List<String> CONJUNCTION_DEFAULTS = List.of("simple");
    private static final List<String> DISJUNCTION_DEFAULTS = List.of("inclusive", "simple");
    private static final List<String> CONDITIONAL_DEFAULTS = List.of("standard");

    private static final Pattern SLOT_PATTERN = Pattern.compile("\\{(\\w+)\\}");

    private final LanguagePatternProvider provider;
    private final VariationStyleSelector selector;
    private final Random random;
    private final ComplexityLevel complexity;

    public VariationGenerator(LanguagePatternProvider provider, Random random) {
        this(provider, new VariationStyleSelector(), random, ComplexityLevel.BASIC);
    }

    public VariationGenerator(LanguagePatternProvider provider,
                              VariationStyleSelector selector,
                              Random random,
                              ComplexityLevel complexity) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.random = Objects.requireNonNull(random, "random");
        this.complexity = complexity == null ? ComplexityLevel.BASIC : complexity;
    }

    public VariationGenerator withComplexity(ComplexityLevel level) {
        return new VariationGenerator(provider, selector, random, level);
    }

    public ComplexityLevel getComplexity() { return complexity; }

    public LanguagePatternProvider getProvider() { return provider; }

    public String generateNegation(String sentence) {
        return generateNegation(sentence, null);
    }

    public String generateNegation(String sentence, String style) {
        if (sentence == null) {
            return "";
        }
        Map<String, List<String>> bucket = provider.patternsFor(VariationKind.NEGATION);
        String pattern = pickPattern(VariationKind.NEGATION, bucket, new ArrayList<>(bucket.keySet()),
                style, NEGATION_DEFAULTS);
        if (pattern == null) {
            return sentence;
        }
        return fill(pattern, Map.of("sentence", sentence));
    }

    public String generateConjunction(List<String> sentences) {
        return generateConjunction(sentences, null);
    }

    public String generateConjunction(List<String> input, String style) {
        List<String> sentences = present(input);
        if (sentences.isEmpty()) {
            return "";
        }
        if (sentences.size() == 1) {
            return sentences.get(0);
        }
        Map<String, List<String>> bucket = provider.patternsFor(VariationKind.CONJUNCTION);
        String pattern = pickPattern(VariationKind.CONJUNCTION, bucket, new ArrayList<>(bucket.keySet()),
                style, CONJUNCTION_DEFAULTS);
        return combine(pattern, sentences, "and");
    }

    public String generateDisjunction(List<String> sentences) {
        return generateDisjunction(sentences, null, false);
    }

    /**
     * @param exclusive prefer the {@code exclusive} bucket; when false that bucket is
     *                  left out of random selection unless {@code style} names it
     */
    public String generateDisjunction(List<String> input, String style, boolean exclusive) {
        List<String> sentences = present(input);
        if (sentences.isEmpty()) {
            return "";
        }
        if (sentences.size() == 1) {
            return sentences.get(0);
        }
        Map<String, List<String>> bucket = provider.patternsFor(VariationKind.DISJUNCTION);
        String pattern;
        if (style != null && hasPatterns(bucket, style)) {
            pattern = pickFrom(bucket.get(style));
        } else if (exclusive && hasPatterns(bucket, EXCLUSIVE_STYLE)) {
            pattern = pickFrom(bucket.get(EXCLUSIVE_STYLE));
        } else {
            List<String> styles = bucket.keySet().stream()
                    .filter(s -> exclusive || !EXCLUSIVE_STYLE.equals(s))
                    .toList();
            pattern = pickPattern(VariationKind.DISJUNCTION, bucket, styles, style, DISJUNCTION_DEFAULTS);
        }
        return combine(pattern, sentences, "or");
    }

    public String generateConditional(String antecedent, String consequent) {
        return generateConditional(antecedent, consequent, null);
    }

    public String generateConditional(String antecedent, String consequent, String style) {
        if (antecedent == null || consequent == null) {
            return antecedent == null ? Objects.toString(consequent, "") : antecedent;
        }
        Map<String, List<String>> bucket = provider.patternsFor(VariationKind.CONDITIONAL);
        String pattern = pickPattern(VariationKind.CONDITIONAL, bucket, new ArrayList<>(bucket.keySet()),
                style, CONDITIONAL_DEFAULTS);
        if (pattern == null) {
            return antecedent + " " + consequent;
        }
        return fill(pattern, Map.of("antecedent", antecedent, "consequent", consequent));
    }

    private String pickPattern(VariationKind kind,
                               Map<String, List<String>> bucket,
                               List<String> styles,
                               String explicitStyle,
                               List<String> defaults) {
        String selected = selector.selectStyle(styles, complexity, explicitStyle, random);
        if (selected != null && hasPatterns(bucket, selected)) {
            return pickFrom(bucket.get(selected));
        }
        for (String fallback : defaults) {
            if (hasPatterns(bucket, fallback)) {
                log.warn("[VariationGenerator] {} style '{}' unavailable for {}, using '{}'",
                        kind, selected, provider.languageCode(), fallback);
                return pickFrom(bucket.get(fallback));
            }
        }
        log.warn("[VariationGenerator] No {} patterns for {}, returning input unchanged",
                kind, provider.languageCode());
        return null;
    }

    private String combine(String pattern, List<String> sentences, String connective) {
        if (pattern == null) {
            return String.join(" ", sentences);
        }
        if (sentences.size() == 2) {
            return fill(pattern, Map.of("p", sentences.get(0), "q", sentences.get(1)));
        }
        List<String> head = sentences.subList(0, sentences.size() - 1);
        String last = sentences.get(sentences.size() - 1);
        if (pattern.contains("{list}")) {
            String list = String.join(", ", head) + ", " + connective + " " + last;
            return fill(pattern, Map.of("list", list));
        }
        return String.join(", " + connective + " ", sentences);
    }

    private static List<String> present(List<String> sentences) {
        if (sentences == null) {
            return List.of();
        }
        return sentences.stream().filter(Objects::nonNull).toList();
    }

    private static boolean hasPatterns(Map<String, List<String>> bucket, String style) {
        List<String> patterns = bucket.get(style);
        return patterns != null && !patterns.isEmpty();
    }

    private String pickFrom(List<String> patterns) {
        return patterns.get(random.nextInt(patterns.size()));
    }

    /**
     * Single-pass substitution of {@code {slot}} markers; unknown slots are kept.
     */
    static String fill(String pattern, Map<String, String> values) {
        Matcher matcher = SLOT_PATTERN.matcher(pattern);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
