package com.example.starterkit.projectgen.exception;

import java.util.List;

/**
 * Catalog lookup failed; safe to retry the whole batch
 */
public class CatalogUnavailableException extends GenerationException {
    public static final String CODE = "CATALOG_UNAVAILABLE";

    public CatalogUnavailableException(String location, Throwable cause) {
        super(CODE, "Feature catalog unavailable: " + location, List.of(location), cause);
    }
}
