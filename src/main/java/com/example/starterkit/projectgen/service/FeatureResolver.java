package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.aspect.LogExecutionTime;
import com.example.starterkit.projectgen.catalog.FeatureCatalog;
import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.CatalogUnavailableException;
import com.example.starterkit.projectgen.exception.DependencyCycleException;
import com.example.starterkit.projectgen.exception.UnknownFeatureException;
import com.example.starterkit.projectgen.model.FeatureSpec;
import com.example.starterkit.projectgen.model.ResolvedFeatureSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the transitive closure of a feature selection against the catalog.
 *
 * Notes:
 * - The walk is set based: a slug already in the working set is never queried
 *   again, so cyclic requires terminate. Cycles are detected afterwards and
 *   either reported or rejected depending on {@code projectgen.resolver.reject-cycles}.
 * - Catalog lookups are batched per round. A failed batch is retried as a
 *   whole and the working set is only extended once a batch has succeeded.
 * - Tier does not filter anything yet; it is carried through to the result
 *   for the document generators.
 */
@Slf4j
@Service
public class FeatureResolver {
    private final FeatureCatalog catalog;
    private final ProjectGenProperties properties;

    public FeatureResolver(FeatureCatalog catalog, ProjectGenProperties properties) {
        this.catalog = catalog;
        this.properties = properties;
    }

    /**
     * Resolve a selection and its template features into a closed feature set
     *
     * @param selectedSlugs features picked by the customer; these keep the front positions
     * @param tier pricing tier, passed through
     * @param templateBaseSlugs features included by the chosen template
     * @return resolved set whose members' requires are all members themselves
     * @throws UnknownFeatureException if any referenced slug is not in the catalog
     * @throws DependencyCycleException if cycles are present and strict mode is on
     */
    @LogExecutionTime("Feature resolution")
    public ResolvedFeatureSet resolve(Collection<String> selectedSlugs, String tier, Collection<String> templateBaseSlugs) {
        Set<String> seed = new LinkedHashSet<>();
        addSlugs(seed, selectedSlugs);
        addSlugs(seed, templateBaseSlugs);
        log.info("Resolving {} seed feature(s) for tier '{}': {}", seed.size(), tier, seed);

        Map<String, FeatureSpec> working = new LinkedHashMap<>();
        Set<String> pending = seed;
        int round = 0;
        while (!pending.isEmpty()) {
            round++;
            Map<String, FeatureSpec> batch = fetchBatch(pending, round);

            List<String> missing = pending.stream()
                    .filter(slug -> !batch.containsKey(slug))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                log.error("Catalog has no feature(s) {} (round {})", missing, round);
                throw new UnknownFeatureException(missing);
            }

            for (String slug : pending) {
                working.put(slug, batch.get(slug));
            }
            pending = missingRequires(working);
            if (!pending.isEmpty()) {
                log.debug("Round {} pulled in dependencies {}", round, pending);
            }
        }

        Map<String, List<String>> dependencyTree = buildDependencyTree(working);
        List<List<String>> cycles = findCycles(dependencyTree);
        if (!cycles.isEmpty()) {
            if (properties.getResolver().isRejectCycles()) {
                throw new DependencyCycleException(cycles.get(0));
            }
            for (List<String> cycle : cycles) {
                log.warn("Tolerating circular feature dependency: {}", String.join(" -> ", cycle));
            }
        }
        List<List<String>> conflicts = findConflicts(working);

        log.info("Resolved {} feature(s) in {} round(s): {}", working.size(), round, working.keySet());
        return ResolvedFeatureSet.builder()
                .tier(tier)
                .allFeatureSlugs(Collections.unmodifiableSet(new LinkedHashSet<>(working.keySet())))
                .features(List.copyOf(working.values()))
                .dependencyTree(Collections.unmodifiableMap(dependencyTree))
                .cycles(List.copyOf(cycles))
                .conflicts(List.copyOf(conflicts))
                .build();
    }

    private static void addSlugs(Set<String> target, Collection<String> slugs) {
        if (slugs == null) {
            return;
        }
        for (String slug : slugs) {
            if (slug != null && !slug.isBlank()) {
                target.add(slug.trim());
            }
        }
    }

    /**
     * Query one batch, retrying the whole batch on catalog failure.
     */
    private Map<String, FeatureSpec> fetchBatch(Set<String> slugs, int round) {
        int maxAttempts = Math.max(1, properties.getResolver().getMaxAttempts());
        Set<String> request = Collections.unmodifiableSet(new LinkedHashSet<>(slugs));
        for (int attempt = 1; ; attempt++) {
            try {
                Map<String, FeatureSpec> bySlug = new HashMap<>();
                for (FeatureSpec feature : catalog.findFeatures(request)) {
                    if (feature != null && request.contains(feature.getSlug())) {
                        bySlug.put(feature.getSlug(), feature);
                    }
                }
                return bySlug;
            } catch (CatalogUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.error("Catalog lookup failed after {} attempt(s) in round {}", attempt, round);
                    throw e;
                }
                log.warn("Catalog lookup failed (round {}, attempt {}/{}), retrying batch of {} slug(s)",
                        round, attempt, maxAttempts, request.size());
                pause(properties.getResolver().getRetryDelay(), e);
            }
        }
    }

    private static void pause(Duration delay, CatalogUnavailableException cause) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }

    private static Set<String> missingRequires(Map<String, FeatureSpec> working) {
        Set<String> missing = new LinkedHashSet<>();
        for (FeatureSpec feature : working.values()) {
            for (String required : feature.requiresOrEmpty()) {
                if (required != null && !required.isBlank() && !working.containsKey(required)) {
                    missing.add(required);
                }
            }
        }
        return missing;
    }

    private static Map<String, List<String>> buildDependencyTree(Map<String, FeatureSpec> working) {
        Map<String, List<String>> tree = new LinkedHashMap<>();
        for (Map.Entry<String, FeatureSpec> entry : working.entrySet()) {
            String slug = entry.getKey();
            // self-reference is a no-op
            List<String> direct = entry.getValue().requiresOrEmpty().stream()
                    .filter(required -> required != null && !required.isBlank() && !required.equals(slug))
                    .distinct()
                    .collect(Collectors.toUnmodifiableList());
            tree.put(slug, direct);
        }
        return tree;
    }

    /**
     * Depth-first search for back edges. Each cycle is reported once, as the
     * path from the first revisited slug back to itself.
     */
    static List<List<String>> findCycles(Map<String, List<String>> tree) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> done = new HashSet<>();
        List<String> stack = new ArrayList<>();
        Set<String> onStack = new HashSet<>();
        for (String slug : tree.keySet()) {
            if (!done.contains(slug)) {
                visit(slug, tree, done, stack, onStack, cycles);
            }
        }
        return cycles;
    }

    private static void visit(String slug, Map<String, List<String>> tree, Set<String> done,
                              List<String> stack, Set<String> onStack, List<List<String>> cycles) {
        stack.add(slug);
        onStack.add(slug);
        for (String next : tree.getOrDefault(slug, List.of())) {
            if (onStack.contains(next)) {
                List<String> cycle = new ArrayList<>(stack.subList(stack.indexOf(next), stack.size()));
                cycle.add(next);
                cycles.add(List.copyOf(cycle));
            } else if (!done.contains(next)) {
                visit(next, tree, done, stack, onStack, cycles);
            }
        }
        stack.remove(stack.size() - 1);
        onStack.remove(slug);
        done.add(slug);
    }

    private static List<List<String>> findConflicts(Map<String, FeatureSpec> working) {
        List<List<String>> conflicts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (FeatureSpec feature : working.values()) {
            for (String other : feature.conflictsOrEmpty()) {
                if (other == null || !working.containsKey(other) || other.equals(feature.getSlug())) {
                    continue;
                }
                String key = feature.getSlug().compareTo(other) < 0
                        ? feature.getSlug() + "|" + other
                        : other + "|" + feature.getSlug();
                if (seen.add(key)) {
                    log.warn("Resolved features '{}' and '{}' are declared as conflicting", feature.getSlug(), other);
                    conflicts.add(List.of(feature.getSlug(), other));
                }
            }
        }
        return conflicts;
    }
}
