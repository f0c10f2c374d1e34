package com.argforge.interfaces.api.dto;

import com.argforge.domain.argument.model.ArgumentPair;

import java.util.List;

public record ArgumentPairResponse(
        ArgumentResponse valid,
        ArgumentResponse invalid,
        List<String> sentences
) {
    public static ArgumentPairResponse from(ArgumentPair pair) {
        return new ArgumentPairResponse(
                ArgumentResponse.from(pair.valid()),
                ArgumentResponse.from(pair.invalid()),
                pair.sentences());
    }
}
