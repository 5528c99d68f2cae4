package com.example.starterkit.projectgen.exception;

import java.util.List;

/**
 * Catalog was readable but its content is invalid
 */
public class CatalogLoadingException extends GenerationException {
    public static final String CODE = "CATALOG_INVALID";

    public CatalogLoadingException(String description, List<String> identifiers) {
        super(CODE, description, identifiers);
    }
}
