package com.argforge.domain.template.model;

import java.util.List;
import java.util.Objects;

/**
 * One piece of a parsed template.
 *
 * <p>The set of kinds is closed: {@link StaticText}, {@link VariableSlot},
 * {@link VariationPoint}, {@link ConditionalBlock} and {@link RepeatedBlock}.
 * Only the first three have source-text syntax; conditional and repeated blocks
 * are created through the template builder.</p>
 */
public sealed interface TemplateComponent {

    ComponentKind kind();

    record StaticText(String text) implements TemplateComponent {
        public StaticText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public ComponentKind kind() {
            return ComponentKind.STATIC;
        }
    }

    record VariableSlot(String name) implements TemplateComponent {
        public VariableSlot {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public ComponentKind kind() {
            return ComponentKind.VARIABLE;
        }
    }

    /**
     * Alternative phrasings. {@code pointName} is null for variations parsed from
     * {@code [[a|b]]} source text, so those cannot be forced by preference.
     */
    record VariationPoint(String pointName, List<String> choices) implements TemplateComponent {
        public VariationPoint {
            Objects.requireNonNull(choices, "choices");
            if (choices.isEmpty()) {
                throw new IllegalArgumentException("Variation point requires at least one choice");
            }
            choices = List.copyOf(choices);
        }

        public static VariationPoint anonymous(List<String> choices) {
            return new VariationPoint(null, choices);
        }

        public boolean isNamed() {
            return pointName != null;
        }

        @Override
        public ComponentKind kind() {
            return ComponentKind.VARIATION;
        }
    }

    record ConditionalBlock(String conditionKey, String trueTemplate, String falseTemplate)
            implements TemplateComponent {
        public ConditionalBlock {
            Objects.requireNonNull(conditionKey, "conditionKey");
            trueTemplate = trueTemplate == null ? "" : trueTemplate;
            falseTemplate = falseTemplate == null ? "" : falseTemplate;
        }

        @Override
        public ComponentKind kind() {
            return ComponentKind.CONDITIONAL;
        }
    }

    record RepeatedBlock(String itemsKey, String separator, String itemTemplate)
            implements TemplateComponent {
        public static final String ITEM_BINDING = "item";
        public static final String DEFAULT_SEPARATOR = ", ";

        public RepeatedBlock {
            Objects.requireNonNull(itemsKey, "itemsKey");
            Objects.requireNonNull(itemTemplate, "itemTemplate");
            separator = separator == null ? DEFAULT_SEPARATOR : separator;
        }

        @Override
        public ComponentKind kind() {
            return ComponentKind.REPEATED;
        }
    }
}
