package com.argforge.infrastructure.rule;

public class UnknownRuleException extends RuntimeException {

    public UnknownRuleException(String ruleName) {
        super("Unknown inference rule: " + ruleName);
    }
}
