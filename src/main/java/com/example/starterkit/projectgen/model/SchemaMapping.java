package com.example.starterkit.projectgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A named data-model fragment contributed by a feature. The source is either a
 * path to a schema file or the fragment text itself.
 */
@Value
@Builder
@Jacksonized
public class SchemaMapping {
    String model;
    String source;

    @JsonIgnore
    public boolean isInline() {
        return source != null && (source.indexOf('\n') >= 0 || source.indexOf('{') >= 0);
    }
}
