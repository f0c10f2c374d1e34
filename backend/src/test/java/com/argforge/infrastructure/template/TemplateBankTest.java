package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.GenerationOptions;
import com.argforge.domain.template.model.TemplateBankStatistics;
import com.argforge.domain.template.model.TemplateMetadata;
import com.argforge.domain.template.model.TemplateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateBankTest {

    private static final String MODUS_PONENS = "Modus Ponens";

    private TemplateBank bank;
    private EnhancedTemplate basic;
    private EnhancedTemplate advanced;

    @BeforeEach
    void setUp() {
        bank = new TemplateBank();
        basic = new EnhancedTemplate("If {p}, then {q}. {P}. So, {q}.", TemplateMetadata.of(ComplexityLevel.BASIC));
        advanced = new EnhancedTemplate("Assume {if_p_q}. Since {p}, {q}.", TemplateMetadata.of(ComplexityLevel.ADVANCED));
        bank.addTemplate(MODUS_PONENS, TemplateType.VALID, basic);
        bank.addTemplate(MODUS_PONENS, TemplateType.VALID, advanced);
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        void templates_are_returned_in_insertion_order() {
            assertThat(bank.getTemplates(MODUS_PONENS, TemplateType.VALID)).containsExactly(basic, advanced);
        }

        @Test
        void absent_rule_or_type_yields_empty_list() {
            assertThat(bank.getTemplates("Modus Tollens", TemplateType.VALID)).isEmpty();
            assertThat(bank.getTemplates(MODUS_PONENS, TemplateType.INVALID)).isEmpty();
        }

        @Test
        void returned_list_is_read_only() {
            List<EnhancedTemplate> templates = bank.getTemplates(MODUS_PONENS, TemplateType.VALID);

            assertThatThrownBy(() -> templates.add(basic)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Random selection")
    class RandomSelection {

        @Test
        void complexity_filter_restricts_candidates() {
            for (long seed = 0; seed < 20; seed++) {
                Optional<EnhancedTemplate> picked = bank.getRandomTemplate(
                        MODUS_PONENS, TemplateType.VALID, ComplexityLevel.ADVANCED, new Random(seed));
                assertThat(picked).containsSame(advanced);
            }
        }

        @Test
        void unmatched_complexity_falls_back_to_all_candidates() {
            for (long seed = 0; seed < 20; seed++) {
                Optional<EnhancedTemplate> picked = bank.getRandomTemplate(
                        MODUS_PONENS, TemplateType.VALID, ComplexityLevel.EXPERT, new Random(seed));
                assertThat(picked).isPresent();
                assertThat(picked.get()).isIn(basic, advanced);
            }
        }

        @Test
        void no_templates_yields_empty() {
            assertThat(bank.getRandomTemplate("Modus Tollens", TemplateType.VALID, null, new Random(1))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Argument generation")
    class Generation {

        private final Map<String, Object> variables = Map.of(
                "p", "it rains", "P", "It rains", "q", "the ground is wet");

        @Test
        void renders_a_template_for_the_requested_complexity() {
            String text = bank.generateArgument(MODUS_PONENS, variables, TemplateType.VALID,
                    GenerationOptions.withComplexity(ComplexityLevel.BASIC), new Random(3));

            assertThat(text).isEqualTo("If it rains, then the ground is wet. It rains. So, the ground is wet.");
        }

        @Test
        void missing_template_returns_diagnostic_text() {
            String text = bank.generateArgument(MODUS_PONENS, variables, TemplateType.INVALID, null);

            assertThat(text).isEqualTo("No template found for Modus Ponens (invalid)");
        }

        @Test
        void variation_preferences_force_named_points() {
            bank.addTemplate("Modus Tollens", TemplateType.VALID, new TemplateBuilder()
                    .addVariation("conclusion", List.of("Therefore", "Thus", "Hence"))
                    .addStatic(", ")
                    .addVariable("q")
                    .build());

            for (long seed = 0; seed < 10; seed++) {
                String text = bank.generateArgument("Modus Tollens", variables, TemplateType.VALID,
                        new GenerationOptions(null, Map.of("conclusion", "Hence")), new Random(seed));
                assertThat(text).isEqualTo("Hence, the ground is wet");
            }
        }
    }

    @Test
    void pattern_templates_keep_variation_identity() {
        EnhancedTemplate template = bank.createTemplateFromPattern(
                "{{marker}}, {q}.",
                Map.of("marker", List.of("Therefore", "Thus")),
                new TemplateMetadata(ComplexityLevel.INTERMEDIATE, "everyday", Map.of("source", "pattern"), null));

        assertThat(template.render(Map.of("q", "we stay in"), Map.of("marker", "Thus")))
                .isEqualTo("Thus, we stay in.");
        assertThat(template.getMetadata().complexity()).isEqualTo(ComplexityLevel.INTERMEDIATE);
        assertThat(template.getMetadata().domain()).isEqualTo("everyday");
        assertThat(template.getMetadata().tags()).containsEntry("source", "pattern");
    }

    @Test
    void statistics_count_rules_and_types() {
        bank.addTemplate("Modus Tollens", TemplateType.INVALID, basic);

        TemplateBankStatistics statistics = bank.getStatistics();

        assertThat(statistics.totalRules()).isEqualTo(2);
        assertThat(statistics.totalTemplates()).isEqualTo(3);
        assertThat(statistics.perRule()).containsEntry(MODUS_PONENS, Map.of("valid", 2));
        assertThat(statistics.perRule()).containsEntry("Modus Tollens", Map.of("invalid", 1));
    }

    @Test
    void variation_mappings_are_stored_by_name() {
        Map<String, Object> markers = Map.of("formal", "It follows that");
        bank.addVariationMapping("conclusion_markers", markers);

        assertThat(bank.getVariationMapping("conclusion_markers")).contains(markers);
        assertThat(bank.getVariationMapping("missing")).isEmpty();
    }
}
