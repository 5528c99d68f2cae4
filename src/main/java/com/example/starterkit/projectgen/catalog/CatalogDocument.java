package com.example.starterkit.projectgen.catalog;

import com.example.starterkit.projectgen.model.FeatureSpec;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of a catalog YAML file
 */
@Data
@NoArgsConstructor
public class CatalogDocument {
    private List<FeatureSpec> features = new ArrayList<>();
}
