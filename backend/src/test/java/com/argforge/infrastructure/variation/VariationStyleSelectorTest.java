package com.argforge.infrastructure.variation;

import com.argforge.domain.template.model.ComplexityLevel;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class VariationStyleSelectorTest {

    private final VariationStyleSelector selector = new VariationStyleSelector();
    private final Random random = new Random(42);

    @Test
    void basic_prefers_simple() {
        assertThat(selector.selectStyle(List.of("formal", "simple", "emphatic"), ComplexityLevel.BASIC, null, random))
                .isEqualTo("simple");
    }

    @Test
    void basic_without_simple_takes_first_style() {
        assertThat(selector.selectStyle(List.of("inclusive", "exclusive"), ComplexityLevel.BASIC, null, random))
                .isEqualTo("inclusive");
    }

    @Test
    void expert_prefers_formal() {
        assertThat(selector.selectStyle(List.of("simple", "formal", "emphatic"), ComplexityLevel.EXPERT, null, random))
                .isEqualTo("formal");
    }

    @Test
    void expert_without_formal_takes_last_style() {
        assertThat(selector.selectStyle(List.of("standard", "causal", "necessity"), ComplexityLevel.EXPERT, null, random))
                .isEqualTo("necessity");
    }

    @Test
    void explicit_style_wins_when_available() {
        assertThat(selector.selectStyle(List.of("simple", "formal"), ComplexityLevel.BASIC, "formal", random))
                .isEqualTo("formal");
    }

    @Test
    void unavailable_explicit_style_is_ignored() {
        assertThat(selector.selectStyle(List.of("simple", "formal"), ComplexityLevel.BASIC, "poetic", random))
                .isEqualTo("simple");
    }

    @Test
    void intermediate_levels_pick_among_all_styles() {
        List<String> styles = List.of("simple", "formal", "emphatic");
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            seen.add(selector.selectStyle(styles, ComplexityLevel.INTERMEDIATE, null, random));
            seen.add(selector.selectStyle(styles, ComplexityLevel.ADVANCED, null, random));
        }
        assertThat(seen).containsExactlyInAnyOrderElementsOf(styles);
    }

    @Test
    void no_styles_yields_null() {
        assertThat(selector.selectStyle(List.of(), ComplexityLevel.BASIC, "simple", random)).isNull();
    }
}
