package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.TemplateComponent.ConditionalBlock;
import com.argforge.domain.template.model.TemplateComponent.RepeatedBlock;
import com.argforge.domain.template.model.TemplateComponent.StaticText;
import com.argforge.domain.template.model.TemplateInfo;
import com.argforge.domain.template.model.TemplateMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancedTemplateTest {

    private static final Map<String, Object> RAIN = Map.of(
            "p", "it rains",
            "q", "the ground is wet");

    @Nested
    @DisplayName("Required variables")
    class RequiredVariables {

        @Test
        void union_covers_every_variation_choice() {
            EnhancedTemplate template = new EnhancedTemplate("[[Suppose {p}|Assume {q}]].");

            assertThat(template.getRequiredVariables()).containsExactlyInAnyOrder("p", "q");
        }

        @Test
        void top_level_and_choice_variables_are_merged() {
            EnhancedTemplate template = new EnhancedTemplate("{P}. [[So|Thus]], {q}. [[{r}|{s}]]");

            assertThat(template.getRequiredVariables()).containsExactlyInAnyOrder("P", "q", "r", "s");
        }

        @Test
        void conditional_branches_and_item_templates_are_included_but_item_is_not() {
            EnhancedTemplate template = new EnhancedTemplate("", List.of(
                    new ConditionalBlock("formal", "{not_formal_p}", "{not_p}"),
                    new RepeatedBlock("premises", "; ", "{item} under {context}")),
                    TemplateMetadata.defaults());

            assertThat(template.getRequiredVariables())
                    .containsExactlyInAnyOrder("not_formal_p", "not_p", "context");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        void missing_binding_is_left_as_placeholder() {
            EnhancedTemplate template = new EnhancedTemplate("Hello {name}");

            assertThat(template.render(Map.of())).isEqualTo("Hello {name}");
        }

        @Test
        void missing_binding_inside_choice_is_left_as_placeholder() {
            EnhancedTemplate template = new EnhancedTemplate("[[{p} holds]]");

            assertThat(template.render(Map.of())).isEqualTo("{p} holds");
        }

        @RepeatedTest(20)
        void end_to_end_example_picks_exactly_one_connective() {
            EnhancedTemplate template = new EnhancedTemplate("If {p}, then [[therefore|thus]] {q}.");

            String rendered = template.render(RAIN);

            assertThat(rendered).startsWith("If it rains, then ");
            assertThat(rendered).endsWith(" the ground is wet.");
            assertThat(rendered).isIn(
                    "If it rains, then therefore the ground is wet.",
                    "If it rains, then thus the ground is wet.");
        }

        @Test
        void same_seed_gives_same_output() {
            EnhancedTemplate template = new EnhancedTemplate("[[A|B|C|D]][[E|F|G|H]][[I|J|K|L]]");

            String first = template.render(Map.of(), Map.of(), new Random(42));
            String second = template.render(Map.of(), Map.of(), new Random(42));

            assertThat(first).isEqualTo(second);
        }

        @Test
        void rendering_does_not_mutate_the_context() {
            Map<String, Object> context = new HashMap<>(RAIN);
            EnhancedTemplate template = new EnhancedTemplate("{p} {conclusion}");

            template.render(context, Map.of("conclusion", "Thus"), new Random(1));

            assertThat(context).isEqualTo(RAIN);
        }

        @Test
        void preferences_are_visible_as_bindings() {
            EnhancedTemplate template = new EnhancedTemplate("{marker}, {q}.");

            assertThat(template.render(RAIN, Map.of("marker", "Hence")))
                    .isEqualTo("Hence, the ground is wet.");
        }

        @Test
        void values_containing_dollar_signs_are_substituted_literally() {
            EnhancedTemplate template = new EnhancedTemplate("[[costs {price}]]");

            assertThat(template.render(Map.of("price", "$5"))).isEqualTo("costs $5");
        }
    }

    @Nested
    @DisplayName("Conditional and repeated blocks")
    class Blocks {

        private final EnhancedTemplate conditional = new EnhancedTemplate("", List.of(
                new StaticText("Premise: "),
                new ConditionalBlock("formal", "it is false that {p}", "not {p}")),
                TemplateMetadata.defaults());

        @Test
        void truthy_condition_selects_true_branch() {
            Map<String, Object> context = Map.of("p", "it rains", "formal", true);

            assertThat(conditional.render(context)).isEqualTo("Premise: it is false that it rains");
        }

        @Test
        void absent_or_falsy_condition_selects_false_branch() {
            assertThat(conditional.render(Map.of("p", "it rains"))).isEqualTo("Premise: not it rains");
            assertThat(conditional.render(Map.of("p", "it rains", "formal", ""))).isEqualTo("Premise: not it rains");
            assertThat(conditional.render(Map.of("p", "it rains", "formal", List.of())))
                    .isEqualTo("Premise: not it rains");
        }

        @Test
        void repeated_block_joins_items_with_separator() {
            EnhancedTemplate template = new EnhancedTemplate("", List.of(
                    new RepeatedBlock("premises", "; ", "{item} ({source})")),
                    TemplateMetadata.defaults());

            String rendered = template.render(Map.of("premises", List.of("a", "b"), "source", "given"));

            assertThat(rendered).isEqualTo("a (given); b (given)");
        }

        @Test
        void repeated_block_without_list_renders_empty() {
            EnhancedTemplate template = new EnhancedTemplate("", List.of(
                    new RepeatedBlock("premises", null, "{item}")),
                    TemplateMetadata.defaults());

            assertThat(template.render(Map.of())).isEmpty();
            assertThat(template.render(Map.of("premises", "not a list"))).isEmpty();
            assertThat(template.render(Map.of("premises", List.of()))).isEmpty();
        }
    }

    @Test
    void info_summarises_the_template() {
        EnhancedTemplate template = new EnhancedTemplate("If {p}, [[so|thus]] {q}.",
                TemplateMetadata.of(ComplexityLevel.ADVANCED));

        TemplateInfo info = template.info();

        assertThat(info.componentCount()).isEqualTo(7);
        assertThat(info.hasVariations()).isTrue();
        assertThat(info.requiredVariables()).containsExactlyInAnyOrder("p", "q");
        assertThat(info.metadata().complexity()).isEqualTo(ComplexityLevel.ADVANCED);
    }
}
