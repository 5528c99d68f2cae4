package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Owning module of a feature, used to group features in generated docs.
 */
@Value
@Builder
@Jacksonized
public class ModuleRef {
    String slug;
    String name;
    String category;
}
