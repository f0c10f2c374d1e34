package com.argforge.application.generation.exception;

public class InsufficientSentencesException extends RuntimeException {

    public InsufficientSentencesException(String ruleName, int required, int supplied) {
        super(String.format("%s needs %d sentences but %d were supplied", ruleName, required, supplied));
    }
}
