package com.example.starterkit.projectgen.exception;

import lombok.Getter;

import java.util.List;

/**
 * Two schema sources declare the same model or enum name
 */
@Getter
public class DuplicateModelException extends GenerationException {
    public static final String CODE = "DUPLICATE_MODEL";

    private final String modelName;
    private final String firstSource;
    private final String secondSource;

    public DuplicateModelException(String modelName, String firstSource, String secondSource) {
        super(CODE,
                "'" + modelName + "' is declared by both " + firstSource + " and " + secondSource,
                List.of(modelName, firstSource, secondSource));
        this.modelName = modelName;
        this.firstSource = firstSource;
        this.secondSource = secondSource;
    }
}
