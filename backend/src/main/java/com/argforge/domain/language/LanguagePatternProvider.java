package com.argforge.domain.language;

import com.argforge.domain.template.model.VariationKind;

import java.util.List;
import java.util.Map;

/**
 * Source of language-specific phrase templates, grouped into named style buckets.
 * Implementations own the data; callers must not mutate the returned maps.
 */
public interface LanguagePatternProvider {

    String languageCode();

    /**
     * Style buckets for one variation kind, in the provider's iteration order.
     *
     * @return style name → phrase templates; empty when the kind is unsupported
     */
    Map<String, List<String>> patternsFor(VariationKind kind);

    /**
     * Trims the sentence and drops trailing sentence punctuation.
     */
    default String normalizeSentence(String sentence) {
        if (sentence == null) {
            return "";
        }
        String result = sentence.strip();
        int end = result.length();
        while (end > 0 && ".!?".indexOf(result.charAt(end - 1)) >= 0) {
            end--;
        }
        return result.substring(0, end);
    }

    default String capitalizeSentence(String sentence) {
        if (sentence == null || sentence.isEmpty()) {
            return sentence;
        }
        return Character.toUpperCase(sentence.charAt(0)) + sentence.substring(1);
    }
}
