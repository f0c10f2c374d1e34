package com.argforge.domain.template.model;

/**
 * Ordered complexity tag used to bias template selection and phrase-style selection.
 */
public enum ComplexityLevel {
    BASIC(1),
    INTERMEDIATE(2),
    ADVANCED(3),
    EXPERT(4);

    private final int rank;

    ComplexityLevel(int rank) {
        this.rank = rank;
    }

    public static ComplexityLevel fromValue(Object value) {
        if (value instanceof ComplexityLevel level) {
            return level;
        }
        if (value instanceof Number number) {
            for (ComplexityLevel level : values()) {
                if (level.rank == number.intValue()) return level;
            }
        }
        if (value instanceof CharSequence text) {
            return valueOf(text.toString().trim().toUpperCase());
        }
        throw new IllegalArgumentException("Unknown complexity level: " + value);
    }
}
