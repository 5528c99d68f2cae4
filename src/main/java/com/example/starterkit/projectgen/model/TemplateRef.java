package com.example.starterkit.projectgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRef {
    private String name;
    private String slug;

    @Builder.Default
    private List<String> includedFeatures = new ArrayList<>();
}
