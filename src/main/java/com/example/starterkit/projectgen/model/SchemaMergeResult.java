package com.example.starterkit.projectgen.model;

import lombok.Value;

import java.util.List;

/**
 * Merged schema text plus the model and enum names it declares, in output order
 */
@Value
public class SchemaMergeResult {
    String schema;
    List<String> models;
    List<String> enums;
}
