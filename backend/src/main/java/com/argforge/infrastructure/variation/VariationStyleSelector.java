package com.argforge.infrastructure.variation;

import com.argforge.domain.template.model.ComplexityLevel;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Chooses a style bucket for a phrase variation.
 *
 * <p>Policy, in order:</p>
 * <ol>
 *     <li>an explicit style that is available wins</li>
 *     <li>BASIC prefers {@code simple}, otherwise the first style</li>
 *     <li>EXPERT prefers {@code formal}, otherwise the last style</li>
 *     <li>anything else picks uniformly at random</li>
 * </ol>
 */
@Component
public class VariationStyleSelector {

    public static final String SIMPLE_STYLE = "simple";
    public static final String FORMAL_STYLE = "formal";

    /**
     * @return the selected style, or null when {@code availableStyles} is empty
     */
    public String selectStyle(List<String> availableStyles,
                              ComplexityLevel complexityLevel,
                              String explicitStyle,
                              Random random) {
        if (availableStyles == null || availableStyles.isEmpty()) {
            return null;
        }
        if (explicitStyle != null && availableStyles.contains(explicitStyle)) {
            return explicitStyle;
        }
        if (complexityLevel == ComplexityLevel.BASIC) {
            return availableStyles.contains(SIMPLE_STYLE) ? SIMPLE_STYLE : availableStyles.get(0);
        }
        if (complexityLevel == ComplexityLevel.EXPERT) {
            return availableStyles.contains(FORMAL_STYLE)
                    ? FORMAL_STYLE
                    : availableStyles.get(availableStyles.size() - 1);
        }
        return availableStyles.get(random.nextInt(availableStyles.size()));
    }
}
