package com.example.starterkit.projectgen.exception;

import java.util.List;

/**
 * Raised only when strict cycle handling is enabled
 */
public class DependencyCycleException extends GenerationException {
    public static final String CODE = "DEPENDENCY_CYCLE";

    public DependencyCycleException(List<String> cycle) {
        super(CODE, "Circular feature dependency: " + String.join(" -> ", cycle), cycle);
    }
}
