package com.argforge.domain.template.model;

public enum ComponentKind {
    STATIC,
    VARIABLE,
    VARIATION,
    CONDITIONAL,
    REPEATED
}
