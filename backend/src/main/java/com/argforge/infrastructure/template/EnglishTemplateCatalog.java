package com.argforge.infrastructure.template;

import com.argforge.domain.template.model.ComplexityLevel;
import com.argforge.domain.template.model.TemplateMetadata;
import com.argforge.domain.template.model.TemplateType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * English argument templates, registered under the valid rule name.
 *
 * <p>Bindings the templates expect (prepared by the argument generation service):</p>
 * <ul>
 *     <li>{@code p}, {@code q}, {@code r}, {@code s}: normalised sentences; upper-case letters are capitalised</li>
 *     <li>{@code not_p}, {@code not_P}, {@code not_formal_p}: negations, likewise for the other letters</li>
 *     <li>{@code if_p_q}, {@code if_q_r}, {@code if_p_r}: generated conditionals</li>
 *     <li>{@code p_or_q}, {@code p_and_q}: generated disjunction and conjunction</li>
 * </ul>
 */
@Slf4j
public class EnglishTemplateCatalog {

    private static final List<String> CONCLUSION_MARKERS = List.of("Therefore", "Thus", "Hence", "Consequently");
    private static final List<String> FORMAL_MARKERS = List.of("It follows that", "We may therefore conclude that",
            "Consequently, it must be that");

    public void registerInto(TemplateBank bank) {
        modusPonens(bank);
        modusTollens(bank);
        disjunctiveSyllogism(bank);
        hypotheticalSyllogism(bank);
        conjunctionIntroduction(bank);
        conjunctionElimination(bank);
        disjunctionIntroduction(bank);
        disjunctionElimination(bank);
        materialConditionalIntroduction(bank);
        constructiveDilemma(bank);
        destructiveDilemma(bank);
        log.info("[EnglishTemplateCatalog] Registered {} templates for {} rules",
                bank.getStatistics().totalTemplates(), bank.getStatistics().totalRules());
    }

    private void modusPonens(TemplateBank bank) {
        String rule = "Modus Ponens";
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("conditional", List.of("If {p}, then {q}", "{Q} if {p}", "Given {p}, {q}"))
                .addStatic(". ")
                .addVariable("P")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", ")
                .addVariable("q")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .build());
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "[[Suppose|Assume]] that {if_p_q}. It is [[observed|established]] that {p}. "
                        + "[[Therefore|Hence]], {q}.",
                TemplateMetadata.of(ComplexityLevel.ADVANCED)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addStatic("Granting the premise that ")
                .addVariable("if_p_q")
                .addStatic(", and noting that ")
                .addVariable("p")
                .addStatic(", ")
                .addVariation("conclusion", FORMAL_MARKERS)
                .addStatic(" ")
                .addVariable("q")
                .addStatic(".")
                .complexity(ComplexityLevel.EXPERT)
                .domain("academic")
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new TemplateBuilder()
                .addVariation("conditional", List.of("If {p}, then {q}", "{Q} if {p}", "Given {p}, {q}"))
                .addStatic(". ")
                .addVariable("Q")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", ")
                .addVariable("p")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .tag("fallacy", "Affirming the Consequent")
                .build());
        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "[[Suppose|Assume]] that {if_p_q}. It is [[observed|established]] that {q}. "
                        + "[[Therefore|Hence]], {p}.",
                TemplateMetadata.of(ComplexityLevel.ADVANCED).withTag("fallacy", "Affirming the Consequent")));
    }

    private void modusTollens(TemplateBank bank) {
        String rule = "Modus Tollens";
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addStatic("If ")
                .addVariable("p")
                .addStatic(", then ")
                .addVariable("q")
                .addStatic(". ")
                .addVariable("not_Q")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", ")
                .addVariable("not_p")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .build());
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "It holds that {if_p_q}. However, {not_formal_q}. [[It follows that|Hence]] {not_formal_p}.",
                TemplateMetadata.of(ComplexityLevel.EXPERT)));

        bank.addTemplate(rule, TemplateType.INVALID, new TemplateBuilder()
                .addStatic("If ")
                .addVariable("p")
                .addStatic(", then ")
                .addVariable("q")
                .addStatic(". ")
                .addVariable("not_P")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", ")
                .addVariable("not_q")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .tag("fallacy", "Denying the Antecedent")
                .build());
    }

    private void disjunctiveSyllogism(TemplateBank bank) {
        String rule = "Disjunctive Syllogism";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "Either {p} or {q}. {not_P}. [[Therefore|Thus|So]], {q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("premise", List.of("We know that {p_or_q}", "It is given that {p_or_q}"))
                .addStatic(". Since ")
                .addVariable("not_p")
                .addStatic(", ")
                .addVariation("conclusion", List.of("it must be that", "we conclude that"))
                .addStatic(" ")
                .addVariable("q")
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "Either {p} or {q}. {P}. [[Therefore|Thus|So]], {not_q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "Affirming a Disjunct")));
    }

    private void hypotheticalSyllogism(TemplateBank bank) {
        String rule = "Hypothetical Syllogism";
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addStatic("If ")
                .addVariable("p")
                .addStatic(", then ")
                .addVariable("q")
                .addStatic(". If ")
                .addVariable("q")
                .addStatic(", then ")
                .addVariable("r")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", if ")
                .addVariable("p")
                .addStatic(", then ")
                .addVariable("r")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .build());
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "[[Studies show|Evidence suggests]] that {if_p_q}. [[Moreover|Furthermore]], {if_q_r}. "
                        + "[[Therefore|Consequently]], {if_p_r}.",
                new TemplateMetadata(ComplexityLevel.ADVANCED, "scientific", null, null)));

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "{P}. [[Therefore|Thus|Hence]], {q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "Non Sequitur")));
    }

    private void conjunctionIntroduction(TemplateBank bank) {
        String rule = "Conjunction Introduction";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "{P}. {Q}. [[Therefore|Thus|Hence]], {p_and_q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "{P}. [[Therefore|Thus|Hence]], {p_and_q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "False Conjunction")));
    }

    private void conjunctionElimination(TemplateBank bank) {
        String rule = "Conjunction Elimination";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "{P} and {q}. Therefore, {p}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("conjunction", List.of("{P} and {q}", "Both {p} and {q} are true",
                        "We have {p} as well as {q}", "It's the case that {p} and {q}"))
                .addStatic(". ")
                .addVariation("conclusion", List.of("Therefore", "From this we can conclude",
                        "It follows that", "In particular"))
                .addStatic(", ")
                .addVariable("p")
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "{P}. {Q}. Therefore, {p} and {q} and {r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "Composition Fallacy")));
    }

    private void disjunctionIntroduction(TemplateBank bank) {
        String rule = "Disjunction Introduction";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "{P}. Therefore, either {p} or {q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("premise", List.of("{P}", "Given that {p}", "Since {p}", "We know that {p}"))
                .addStatic(". ")
                .addVariation("conclusion", List.of("Therefore", "It follows that",
                        "We can conclude that", "This means"))
                .addStatic(" ")
                .addVariation("disjunction", List.of("either {p} or {q}", "{p} or {q}",
                        "at least one of {p} or {q}", "{p} or possibly {q}"))
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new TemplateBuilder()
                .addVariable("P")
                .addStatic(". ")
                .addVariation("conclusion", CONCLUSION_MARKERS)
                .addStatic(", both ")
                .addVariable("p")
                .addStatic(" and ")
                .addVariable("q")
                .addStatic(".")
                .complexity(ComplexityLevel.BASIC)
                .tag("fallacy", "Invalid Conjunction Introduction")
                .build());
    }

    private void disjunctionElimination(TemplateBank bank) {
        String rule = "Disjunction Elimination";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "Either {p} or {q}. If {p}, then {r}. If {q}, then {r}. Therefore, {r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("disjunction", List.of("Either {p} or {q}", "We have either {p} or {q}",
                        "One of two things: {p} or {q}"))
                .addStatic(". ")
                .addVariation("conditional1", List.of("If {p}, then {r}", "{P} leads to {r}", "{P} implies {r}"))
                .addStatic(". ")
                .addVariation("conditional2", List.of("If {q}, then {r}", "{Q} leads to {r}", "{Q} implies {r}"))
                .addStatic(". ")
                .addVariation("conclusion", List.of("Either way", "In both cases", "Therefore"))
                .addStatic(", ")
                .addVariable("r")
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "Either {p} or {q}. If {p}, then {r}. [[Therefore|Thus|Hence]], {r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "Invalid Disjunction Elimination")));
    }

    private void materialConditionalIntroduction(TemplateBank bank) {
        String rule = "Material Conditional Introduction";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "Assuming {p}, we can derive that {q}. Therefore, if {p}, then {q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("assumption", List.of("Assuming {p}", "Suppose {p}", "If we assume {p}",
                        "Let's say {p}"))
                .addStatic(", ")
                .addVariation("derivation", List.of("we can derive that", "it follows that", "we get",
                        "we can show that"))
                .addStatic(" ")
                .addVariable("q")
                .addStatic(". ")
                .addVariation("conclusion", List.of("Therefore", "Hence", "This means", "We can conclude that"))
                .addStatic(", ")
                .addVariation("conditional", List.of("if {p}, then {q}", "{p} implies {q}", "{p} leads to {q}",
                        "given {p}, we have {q}"))
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "Assuming {p}, we can derive that {q}. Therefore, if {p}, then {q} and {r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)
                        .withTag("fallacy", "Invalid Material Conditional Introduction")));
    }

    private void constructiveDilemma(TemplateBank bank) {
        String rule = "Constructive Dilemma";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "If {p}, then {q}. If {r}, then {s}. Either {p} or {r}. Therefore, either {q} or {s}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("conditional1", List.of("If {p}, then {q}", "{P} implies {q}", "{P} leads to {q}"))
                .addStatic(". ")
                .addVariation("conditional2", List.of("If {r}, then {s}", "{R} implies {s}", "{R} leads to {s}"))
                .addStatic(". ")
                .addVariation("disjunction", List.of("Either {p} or {r}", "We have either {p} or {r}",
                        "One of {p} or {r} is true"))
                .addStatic(". ")
                .addVariation("conclusion", List.of("Therefore", "It follows that", "Consequently"))
                .addStatic(", ")
                .addVariation("result", List.of("either {q} or {s}", "one of {q} or {s}",
                        "at least one of {q} or {s}"))
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "Either {p} or {q}. Therefore, not both {p} and {q}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "False Dilemma")));
        bank.addTemplate(rule, TemplateType.INVALID, new TemplateBuilder()
                .addVariation("since", List.of("Since", "Given that", "Because"))
                .addStatic(" either ")
                .addVariable("p")
                .addStatic(" or ")
                .addVariable("q")
                .addStatic(", ")
                .addVariation("conclusion", List.of("we can conclude that", "it follows that", "we know that"))
                .addStatic(" ")
                .addVariable("p")
                .addStatic(" and ")
                .addVariable("q")
                .addStatic(" cannot both be true.")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .tag("fallacy", "False Dilemma")
                .build());
    }

    private void destructiveDilemma(TemplateBank bank) {
        String rule = "Destructive Dilemma";
        bank.addTemplate(rule, TemplateType.VALID, new EnhancedTemplate(
                "If {p}, then {q}. If {r}, then {s}. Either {not_q} or {not_s}. "
                        + "Therefore, either {not_p} or {not_r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC)));
        bank.addTemplate(rule, TemplateType.VALID, new TemplateBuilder()
                .addVariation("conditional1", List.of("If {p}, then {q}", "{P} implies {q}", "{Q} follows from {p}"))
                .addStatic(". ")
                .addVariation("conditional2", List.of("If {r}, then {s}", "{R} implies {s}", "{S} follows from {r}"))
                .addStatic(". ")
                .addVariation("disjunction", List.of("Either {not_q} or {not_s}",
                        "We have either {not_q} or {not_s}", "At least one of {not_q} or {not_s}"))
                .addStatic(". ")
                .addVariation("conclusion", List.of("Therefore", "It follows that", "By modus tollens on each case"))
                .addStatic(", ")
                .addVariation("result", List.of("either {not_p} or {not_r}", "one of {not_p} or {not_r}",
                        "at least one of {not_p} or {not_r}"))
                .addStatic(".")
                .complexity(ComplexityLevel.INTERMEDIATE)
                .build());

        bank.addTemplate(rule, TemplateType.INVALID, new EnhancedTemplate(
                "If {p}, then {q}. If {r}, then {s}. Either {not_q} or {not_s}. "
                        + "[[Therefore|Thus|Hence]], either {p} or {r}.",
                TemplateMetadata.of(ComplexityLevel.BASIC).withTag("fallacy", "Non Sequitur")));
    }
}
