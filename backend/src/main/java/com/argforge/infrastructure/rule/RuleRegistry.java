package com.argforge.infrastructure.rule;

import com.argforge.domain.rule.model.LogicalRule;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The inference rules the generator knows, each paired with its fallacy.
 */
@Component
public class RuleRegistry {

    public static final String DEFAULT_FALLACY = "Non Sequitur";

    private final Map<String, LogicalRule> rules = new LinkedHashMap<>();

    public RuleRegistry() {
        register(new LogicalRule("Modus Ponens", "Affirming the Consequent",
                "If P→Q, P ∴ Q vs If P→Q, Q ∴ P", 2, "conditional"));
        register(new LogicalRule("Modus Tollens", "Denying the Antecedent",
                "If P→Q, ¬Q ∴ ¬P vs If P→Q, ¬P ∴ ¬Q", 2, "conditional_negation"));
        register(new LogicalRule("Disjunctive Syllogism", "Affirming a Disjunct",
                "P∨Q, ¬P ∴ Q vs P∨Q, P ∴ ¬Q", 2, "disjunctive"));
        register(new LogicalRule("Conjunction Introduction", "False Conjunction",
                "P, Q ∴ P∧Q vs P ∴ P∧Q", 2, "conjunction"));
        register(new LogicalRule("Conjunction Elimination", "Composition Fallacy",
                "P∧Q ∴ P vs Group has P ∴ All have P", 2, "conjunction_elimination"));
        register(new LogicalRule("Disjunction Introduction", "Invalid Conjunction Introduction",
                "P ∴ P∨Q vs P ∴ P∧Q", 2, "disjunction_intro"));
        register(new LogicalRule("Disjunction Elimination", "Invalid Disjunction Elimination",
                "Complete vs Incomplete case analysis", 3, "disjunction_elimination"));
        register(new LogicalRule("Hypothetical Syllogism", DEFAULT_FALLACY,
                "P→Q, Q→R ∴ P→R vs P ∴ Q", 3, "hypothetical"));
        register(new LogicalRule("Material Conditional Introduction", "Invalid Material Conditional Introduction",
                "Valid conditional formation vs Adding unwarranted variables", 3, "material_conditional"));
        register(new LogicalRule("Constructive Dilemma", "False Dilemma",
                "Valid disjunction vs Limited options", 3, "constructive_dilemma"));
        register(new LogicalRule("Destructive Dilemma", DEFAULT_FALLACY,
                "Valid complex reasoning vs Invalid conclusion", 3, "destructive_dilemma"));
    }

    private void register(LogicalRule rule) {
        rules.put(rule.validName(), rule);
    }

    public Optional<LogicalRule> find(String ruleName) {
        return Optional.ofNullable(rules.get(ruleName));
    }

    public LogicalRule get(String ruleName) {
        return find(ruleName).orElseThrow(() -> new UnknownRuleException(ruleName));
    }

    public int requiredSentenceCount(String ruleName) {
        return get(ruleName).sentencesNeeded();
    }

    public String structureType(String ruleName) {
        return get(ruleName).structureType();
    }

    public String fallacyFor(String ruleName) {
        return find(ruleName).map(LogicalRule::invalidName).orElse(DEFAULT_FALLACY);
    }

    public Collection<LogicalRule> allRules() {
        return Collections.unmodifiableCollection(rules.values());
    }

    public List<String> ruleNames() {
        return List.copyOf(rules.keySet());
    }

    public List<LogicalRule> rulesBySentenceCount(int count) {
        return rules.values().stream()
                .filter(rule -> rule.sentencesNeeded() == count)
                .toList();
    }

    public List<Map.Entry<String, String>> rulePairs() {
        return rules.values().stream()
                .map(rule -> Map.entry(rule.validName(), rule.invalidName()))
                .toList();
    }
}
