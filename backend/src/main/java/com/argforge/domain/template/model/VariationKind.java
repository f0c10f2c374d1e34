package com.argforge.domain.template.model;

public enum VariationKind {
    NEGATION("negation"),
    CONJUNCTION("conjunction"),
    DISJUNCTION("disjunction"),
    CONDITIONAL("conditional");

    private final String key;

    VariationKind(String key) {
        this.key = key;
    }

    public String getKey() { return key; }
}
