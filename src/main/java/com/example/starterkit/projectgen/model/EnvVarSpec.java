package com.example.starterkit.projectgen.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class EnvVarSpec {
    String key;
    String description;
    boolean required;

    @JsonProperty("default")
    String defaultValue;
}
