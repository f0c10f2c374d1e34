package com.argforge.domain.argument.model;

import java.util.List;

/**
 * A valid argument and its matched fallacy rendered from the same sentences.
 */
public record ArgumentPair(
        GeneratedArgument valid,
        GeneratedArgument invalid,
        List<String> sentences
) {}
