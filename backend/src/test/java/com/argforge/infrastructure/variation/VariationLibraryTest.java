package com.argforge.infrastructure.variation;

import com.argforge.domain.template.model.VariationKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VariationLibraryTest {

    private final VariationLibrary library = new VariationLibrary();

    @Test
    void ships_the_standard_entries() {
        assertThat(library.getVariationNames()).containsExactly(
                "negation_simple", "negation_formal", "negation_emphatic",
                "conjunction_simple", "conjunction_formal",
                "disjunction_inclusive", "disjunction_exclusive",
                "conditional_standard", "conditional_causal", "conditional_necessity", "conditional_sufficiency");
    }

    @Test
    void unknown_entry_is_empty() {
        assertThat(library.getVariation("negation_poetic")).isEmpty();
    }

    @Test
    void added_entries_are_copied() {
        List<String> patterns = new ArrayList<>(List.of("{sentence}? hardly"));
        library.addVariation("negation_ironic", patterns);
        patterns.clear();

        assertThat(library.getVariation("negation_ironic")).containsExactly("{sentence}? hardly");
        assertThat(library.patternsFor(VariationKind.NEGATION)).containsKey("ironic");
    }

    @Test
    void patterns_are_grouped_by_kind_prefix() {
        Map<String, List<String>> conditional = library.patternsFor(VariationKind.CONDITIONAL);

        assertThat(conditional).containsOnlyKeys("standard", "causal", "necessity", "sufficiency");
        assertThat(conditional.get("sufficiency")).contains("{antecedent} guarantees {consequent}");
    }

    @Test
    void all_variations_view_is_read_only() {
        Map<String, List<String>> all = library.getAllVariations();

        assertThatThrownBy(() -> all.put("x", List.of())).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void drives_a_generator() {
        VariationGenerator generator = new VariationGenerator(library, new Random(4));

        assertThat(library.getVariation("negation_simple").stream().map(p -> p.replace("{sentence}", "it rains")))
                .contains(generator.generateNegation("it rains"));
    }
}
