package com.calai.goals.algorithm;

import lombok.Getter;

@Getter
public class UnknownAlgorithmException extends RuntimeException {
    private final AlgorithmCategory category;
    private final String identifier;

    public UnknownAlgorithmException(AlgorithmCategory category, String identifier) {
        super("Unknown " + category.name() + " algorithm: " + identifier);
        this.category = category;
        this.identifier = identifier;
    }
}
