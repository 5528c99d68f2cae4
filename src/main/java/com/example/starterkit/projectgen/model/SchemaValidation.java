package com.example.starterkit.projectgen.model;

import lombok.Value;

import java.util.List;

@Value
public class SchemaValidation {
    boolean valid;
    List<String> missing;
}
