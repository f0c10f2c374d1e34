package com.argforge.domain.rule.model;

/**
 * A valid inference rule paired with the fallacy that imitates it.
 *
 * @param validName       name of the valid rule, also the template bank key
 * @param invalidName     name of the matched fallacy
 * @param description     symbolic form of both arguments
 * @param sentencesNeeded number of distinct sentences the argument needs
 * @param structureType   logical structure family (conditional, disjunctive, ...)
 */
public record LogicalRule(
        String validName,
        String invalidName,
        String description,
        int sentencesNeeded,
        String structureType
) {}
