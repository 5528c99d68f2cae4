package com.example.starterkit.projectgen.exception;

import java.util.Collection;
import java.util.List;

/**
 * A selected, template-provided or transitively required slug is not in the catalog
 */
public class UnknownFeatureException extends GenerationException {
    public static final String CODE = "UNKNOWN_FEATURE";

    public UnknownFeatureException(Collection<String> slugs) {
        super(CODE, "Unknown feature(s): " + String.join(", ", slugs), List.copyOf(slugs));
    }

    public List<String> getSlugs() {
        return getIdentifiers();
    }
}
