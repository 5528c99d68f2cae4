package com.example.starterkit.projectgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for a dry-run feature resolution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {
    @Builder.Default
    private List<String> selectedFeatures = new ArrayList<>();

    private String tier;

    /**
     * Features contributed by the chosen template
     */
    @Builder.Default
    private List<String> templateFeatures = new ArrayList<>();
}
