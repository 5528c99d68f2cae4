package com.example.starterkit.projectgen.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * A package declared with different version constraints. {@code selected} is
 * the constraint that ended up in the manifest, {@code alternatives} the ones
 * it replaced.
 */
@Value
public class VersionConflict {
    @JsonProperty("package")
    String packageName;
    String selected;
    List<String> alternatives;
}
