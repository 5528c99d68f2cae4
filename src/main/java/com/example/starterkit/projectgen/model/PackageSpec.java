package com.example.starterkit.projectgen.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An npm dependency declared by a feature.
 */
@Value
@Builder
@Jacksonized
public class PackageSpec {
    String name;

    /**
     * Semver range or exact version
     */
    String version;

    /**
     * Goes to devDependencies instead of dependencies
     */
    boolean dev;

    /**
     * Which generated manifest receives the package
     */
    @Builder.Default
    PackageTarget target = PackageTarget.ALL;

    public boolean appliesTo(PackageTarget manifest) {
        PackageTarget effective = target != null ? target : PackageTarget.ALL;
        return effective == PackageTarget.ALL || effective == manifest;
    }
}
