package com.argforge.domain.template.model;

public enum TemplateType {
    VALID("valid"),
    INVALID("invalid");

    private final String key;

    TemplateType(String key) {
        this.key = key;
    }

    public String getKey() { return key; }

    public static TemplateType fromKey(String key) {
        for (TemplateType type : values()) {
            if (type.key.equalsIgnoreCase(key)) return type;
        }
        throw new IllegalArgumentException("Unknown template type: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
