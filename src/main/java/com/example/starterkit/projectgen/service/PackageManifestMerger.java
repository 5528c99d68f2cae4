package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.model.FeatureSpec;
import com.example.starterkit.projectgen.model.PackageContribution;
import com.example.starterkit.projectgen.model.PackageMergeResult;
import com.example.starterkit.projectgen.model.PackageSpec;
import com.example.starterkit.projectgen.model.PackageTarget;
import com.example.starterkit.projectgen.model.VersionConflict;
import com.example.starterkit.projectgen.util.JsonFormatting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges a base package.json with the npm packages contributed by features.
 *
 * <p>When a package is declared more than once with different constraints the
 * later declaration wins, the same way a later feature's file replaces an
 * earlier one. Every such case is reported as a {@link VersionConflict}.
 */
@Slf4j
@Service
public class PackageManifestMerger {
    static final String DEPENDENCIES = "dependencies";
    static final String DEV_DEPENDENCIES = "devDependencies";
    static final String SCRIPTS = "scripts";

    /**
     * Lifecycle scripts every generated backend exposes
     */
    static final Map<String, String> DEFAULT_SCRIPTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("dev", "tsx watch src/index.ts");
        defaults.put("build", "tsc");
        defaults.put("start", "node dist/index.js");
        defaults.put("lint", "eslint src --ext .ts");
        defaults.put("db:migrate", "prisma migrate dev");
        defaults.put("db:push", "prisma db push");
        defaults.put("db:generate", "prisma generate");
        defaults.put("db:seed", "tsx prisma/seed.ts");
        DEFAULT_SCRIPTS = Collections.unmodifiableMap(defaults);
    }

    /**
     * Collect the packages each feature contributes to one manifest, in feature order
     */
    public List<PackageContribution> contributionsFor(List<FeatureSpec> features, PackageTarget manifest) {
        List<PackageContribution> contributions = new ArrayList<>();
        for (FeatureSpec feature : features) {
            if (feature.getNpmPackages() == null || feature.getNpmPackages().isEmpty()) {
                continue;
            }
            List<PackageSpec> packages = new ArrayList<>();
            for (PackageSpec spec : feature.getNpmPackages()) {
                if (spec.appliesTo(manifest)) {
                    packages.add(spec);
                }
            }
            if (!packages.isEmpty()) {
                contributions.add(new PackageContribution(feature.getSlug(), List.copyOf(packages)));
            }
        }
        return contributions;
    }

    /**
     * @param basePkg base manifest; not modified
     * @param fragments package contributions in resolution order
     * @param projectName written to the manifest's {@code name}; kept as is when null
     */
    public PackageMergeResult mergePackageJson(Map<String, Object> basePkg, List<PackageContribution> fragments,
                                               String projectName) {
        Map<String, String> dependencies = stringMap(basePkg.get(DEPENDENCIES));
        Map<String, String> devDependencies = stringMap(basePkg.get(DEV_DEPENDENCIES));

        // package -> constraints it replaced, in replacement order
        Map<String, Set<String>> replaced = new LinkedHashMap<>();
        List<String> added = new ArrayList<>();
        List<String> addedDev = new ArrayList<>();

        for (PackageContribution fragment : fragments) {
            for (PackageSpec spec : fragment.getPackages()) {
                if (spec.getName() == null || spec.getName().isBlank()) {
                    log.warn("Feature '{}' declares a package without a name", fragment.getFeatureSlug());
                    continue;
                }
                String name = spec.getName().trim();
                String version = spec.getVersion() == null ? "*" : spec.getVersion().trim();

                String previous;
                String previousDev = null;
                if (spec.isDev() && !dependencies.containsKey(name)) {
                    previous = devDependencies.put(name, version);
                    if (previous == null) {
                        addedDev.add(name);
                    }
                } else {
                    previous = dependencies.put(name, version);
                    // a runtime declaration moves the package out of devDependencies
                    previousDev = devDependencies.remove(name);
                    if (previousDev != null) {
                        if (addedDev.remove(name)) {
                            added.add(name);
                        }
                        log.debug("Feature '{}' moves {} from {} to {}", fragment.getFeatureSlug(), name,
                                DEV_DEPENDENCIES, DEPENDENCIES);
                    } else if (previous == null) {
                        added.add(name);
                    }
                }

                for (String replacedVersion : Arrays.asList(previous, previousDev)) {
                    if (replacedVersion != null && !replacedVersion.equals(version)) {
                        Set<String> alternatives = replaced.computeIfAbsent(name, key -> new LinkedHashSet<>());
                        alternatives.add(replacedVersion);
                        alternatives.remove(version);
                        log.debug("Feature '{}' sets {} to {} (was {})",
                                fragment.getFeatureSlug(), name, version, replacedVersion);
                    }
                }
            }
        }

        List<VersionConflict> conflicts = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : replaced.entrySet()) {
            if (entry.getValue().isEmpty()) {
                continue;
            }
            String selected = dependencies.containsKey(entry.getKey())
                    ? dependencies.get(entry.getKey())
                    : devDependencies.get(entry.getKey());
            conflicts.add(new VersionConflict(entry.getKey(), selected, List.copyOf(entry.getValue())));
        }
        if (!conflicts.isEmpty()) {
            log.warn("Resolved {} package version conflict(s): {}", conflicts.size(), conflicts);
        }

        Map<String, Object> manifest = new LinkedHashMap<>(basePkg);
        if (projectName != null) {
            manifest.put("name", projectName);
        }
        manifest.put(DEPENDENCIES, new TreeMap<>(dependencies));
        manifest.put(DEV_DEPENDENCIES, new TreeMap<>(devDependencies));

        return new PackageMergeResult(manifest, List.copyOf(conflicts), List.copyOf(added), List.copyOf(addedDev));
    }

    /**
     * Build the scripts block: base scripts are kept verbatim, missing
     * lifecycle defaults are filled in, then feature scripts claim any name
     * still free. The first feature to declare a name keeps it.
     *
     * @param features features in resolution order
     */
    public Map<String, String> generateScripts(Map<String, String> baseScripts, List<FeatureSpec> features) {
        Map<String, String> scripts = new TreeMap<>();
        if (baseScripts != null) {
            scripts.putAll(baseScripts);
        }
        DEFAULT_SCRIPTS.forEach(scripts::putIfAbsent);
        for (FeatureSpec feature : features) {
            if (feature.getScripts() == null) {
                continue;
            }
            feature.getScripts().forEach((name, command) -> {
                String existing = scripts.putIfAbsent(name, command);
                if (existing != null && !existing.equals(command)) {
                    log.debug("Script '{}' from feature '{}' ignored, name already taken", name, feature.getSlug());
                }
            });
        }
        return scripts;
    }

    public String stringifyPackageJson(Map<String, Object> manifest) {
        return JsonFormatting.toPrettyJson(manifest);
    }

    static Map<String, String> stringMap(Object value) {
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((key, v) -> result.put(String.valueOf(key), String.valueOf(v)));
        }
        return result;
    }
}
