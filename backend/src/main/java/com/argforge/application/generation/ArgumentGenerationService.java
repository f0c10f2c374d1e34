package com.argforge.application.generation;

import com.argforge.application.generation.exception.InsufficientSentencesException;
import com.argforge.domain.argument.model.ArgumentPair;
import com.argforge.domain.argument.model.GeneratedArgument;
import com.argforge.domain.language.LanguagePatternProvider;
import com.argforge.domain.rule.model.LogicalRule;
import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.GenerationOptions;
import com.argforge.domain.template.model.TemplateType;
import com.argforge.infrastructure.rule.RuleRegistry;
import com.argforge.infrastructure.template.TemplateBank;
import com.argforge.infrastructure.variation.VariationGenerator;
import com.argforge.infrastructure.variation.VariationStyleSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Turns caller-supplied sentences into rendered arguments.
 *
 * <p>Every call builds its own {@link Random} (seeded when a seed is given), so the
 * shared template bank is only ever read.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArgumentGenerationService {

    private static final char FIRST_LETTER = 'p';

    private final TemplateBank templateBank;
    private final RuleRegistry ruleRegistry;
    private final LanguagePatternProvider patternProvider;
    private final VariationStyleSelector styleSelector;

    @Value("${generator.default-complexity:BASIC}")
    private ComplexityLevel defaultComplexity = ComplexityLevel.BASIC;

    @Value("${generator.max-sentences:4}")
    private int maxSentences = 4;

    public GeneratedArgument generate(String ruleName,
                                      List<String> sentences,
                                      TemplateType templateType,
                                      ComplexityLevel complexity,
                                      Map<String, String> variationPreferences,
                                      Long seed) {
        LogicalRule rule = requireSentences(ruleName, sentences);
        Random random = newRandom(seed);
        Map<String, Object> variables = prepareVariables(sentences, newGenerator(complexity, random));
        GenerationOptions options = new GenerationOptions(complexity, variationPreferences);

        return render(rule, variables, templateType, options, random);
    }

    /**
     * Renders the valid argument and its fallacy from the same bindings.
     */
    public ArgumentPair generatePair(String ruleName,
                                     List<String> sentences,
                                     ComplexityLevel complexity,
                                     Map<String, String> variationPreferences,
                                     Long seed) {
        LogicalRule rule = requireSentences(ruleName, sentences);
        Random random = newRandom(seed);
        Map<String, Object> variables = prepareVariables(sentences, newGenerator(complexity, random));
        GenerationOptions options = new GenerationOptions(complexity, variationPreferences);

        GeneratedArgument valid = render(rule, variables, TemplateType.VALID, options, random);
        GeneratedArgument invalid = render(rule, variables, TemplateType.INVALID, options, random);
        return new ArgumentPair(valid, invalid, List.copyOf(sentences));
    }

    /**
     * Builds the binding context for up to four sentences, lettered {@code p, q, r, s}.
     * Fewer sentences are cycled to fill all four letters.
     *
     * <p>Per letter {@code x}: {@code x}, {@code X}, {@code not_x}, {@code not_X},
     * {@code not_formal_x}, {@code not_emphatic_x}. Composite phrasings:
     * {@code if_p_q}, {@code if_q_r}, {@code if_p_r}, {@code p_or_q}, {@code p_and_q}.</p>
     */
    public Map<String, Object> prepareVariables(List<String> sentences, VariationGenerator generator) {
        if (sentences == null || sentences.isEmpty()) {
            throw new IllegalArgumentException("At least one sentence is required");
        }
        LanguagePatternProvider language = generator.getProvider();
        int letters = Math.max(1, maxSentences);

        List<String> pool = new ArrayList<>(letters);
        for (int i = 0; i < letters; i++) {
            pool.add(language.normalizeSentence(sentences.get(i % sentences.size())));
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        for (int i = 0; i < pool.size(); i++) {
            String letter = String.valueOf((char) (FIRST_LETTER + i));
            String upper = letter.toUpperCase();
            String sentence = pool.get(i);

            variables.put(letter, sentence);
            variables.put(upper, language.capitalizeSentence(sentence));

            String negation = generator.generateNegation(sentence, "simple");
            variables.put("not_" + letter, negation);
            variables.put("not_" + upper, language.capitalizeSentence(negation));
            variables.put("not_formal_" + letter, generator.generateNegation(sentence, "formal"));
            variables.put("not_emphatic_" + letter, generator.generateNegation(sentence, "emphatic"));
        }

        String p = pool.get(0);
        String q = pool.size() > 1 ? pool.get(1) : p;
        String r = pool.size() > 2 ? pool.get(2) : q;
        variables.put("if_p_q", generator.generateConditional(p, q));
        variables.put("if_q_r", generator.generateConditional(q, r));
        variables.put("if_p_r", generator.generateConditional(p, r));
        variables.put("p_or_q", generator.generateDisjunction(List.of(p, q)));
        variables.put("p_and_q", generator.generateConjunction(List.of(p, q)));

        log.debug("[ArgumentGenerationService] Prepared {} bindings from {} sentences",
                variables.size(), sentences.size());
        return variables;
    }

    private GeneratedArgument render(LogicalRule rule,
                                     Map<String, Object> variables,
                                     TemplateType templateType,
                                     GenerationOptions options,
                                     Random random) {
        String text = templateBank.generateArgument(rule.validName(), variables, templateType, options, random);
        String argumentName = templateType == TemplateType.VALID ? rule.validName() : rule.invalidName();
        log.info("[ArgumentGenerationService] Generated {} argument for {} ({})",
                templateType, rule.validName(), argumentName);
        return new GeneratedArgument(rule.validName(), argumentName, templateType, text);
    }

    private LogicalRule requireSentences(String ruleName, List<String> sentences) {
        LogicalRule rule = ruleRegistry.get(ruleName);
        int supplied = sentences == null ? 0 : sentences.size();
        if (supplied < rule.sentencesNeeded()) {
            throw new InsufficientSentencesException(ruleName, rule.sentencesNeeded(), supplied);
        }
        return rule;
    }

    private VariationGenerator newGenerator(ComplexityLevel complexity, Random random) {
        ComplexityLevel level = complexity != null ? complexity : defaultComplexity;
        return new VariationGenerator(patternProvider, styleSelector, random, level);
    }

    private static Random newRandom(Long seed) {
        return seed != null ? new Random(seed) : new Random();
    }
}
