package com.example.starterkit.projectgen.model;

import lombok.Value;

import java.util.List;

/**
 * Packages one feature adds to a manifest
 */
@Value
public class PackageContribution {
    String featureSlug;
    List<PackageSpec> packages;
}
