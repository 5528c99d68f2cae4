package com.example.starterkit.projectgen.exception;

import lombok.Getter;

import java.util.List;

/**
 * Root of the generation error taxonomy. Carries a stable code for the REST
 * layer and job records, and the identifiers (slugs, model names, paths) that
 * caused the failure so catalog authors can fix them.
 */
@Getter
public class GenerationException extends RuntimeException {
    private final String code;
    private final String description;
    private final List<String> identifiers;

    public GenerationException(String code, String description, List<String> identifiers) {
        this(code, description, identifiers, null);
    }

    public GenerationException(String code, String description, List<String> identifiers, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
        this.identifiers = identifiers != null ? List.copyOf(identifiers) : List.of();
    }
}
