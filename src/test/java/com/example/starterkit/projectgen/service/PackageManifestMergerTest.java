package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Package Manifest Merger Tests")
public class PackageManifestMergerTest {

    private final PackageManifestMerger merger = new PackageManifestMerger();

    private static Map<String, Object> base() {
        Map<String, Object> base = new LinkedHashMap<>();
        base.put("name", "core-backend");
        base.put("version", "1.0.0");
        base.put("dependencies", new LinkedHashMap<>(Map.of("express", "^4.18.0", "lodash", "^4.17.0")));
        base.put("devDependencies", new LinkedHashMap<>(Map.of("typescript", "^5.0.0")));
        return base;
    }

    private static PackageSpec pkg(String name, String version) {
        return PackageSpec.builder().name(name).version(version).build();
    }

    private static PackageSpec devPkg(String name, String version) {
        return PackageSpec.builder().name(name).version(version).dev(true).build();
    }

    private static PackageContribution contribution(String slug, PackageSpec... packages) {
        return new PackageContribution(slug, List.of(packages));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> section(PackageMergeResult result, String name) {
        return (Map<String, String>) result.getManifest().get(name);
    }

    @Test
    @DisplayName("Adds feature packages to the right section")
    public void testMergeAddsPackages() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("auth", pkg("jsonwebtoken", "^9.0.0")),
                contribution("testing", devPkg("jest", "^29.0.0"))), "starter-pro");

        assertEquals("^9.0.0", section(result, "dependencies").get("jsonwebtoken"));
        assertEquals("^29.0.0", section(result, "devDependencies").get("jest"));
        assertEquals(List.of("jsonwebtoken"), result.getAddedDependencies());
        assertEquals(List.of("jest"), result.getAddedDevDependencies());
        assertTrue(result.getVersionConflicts().isEmpty());
    }

    @Test
    @DisplayName("Renames the manifest and keeps other base fields in order")
    public void testNameAndFieldOrder() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(), "saas-starter-pro");

        assertEquals("saas-starter-pro", result.getManifest().get("name"));
        assertEquals("1.0.0", result.getManifest().get("version"));
        assertEquals(List.of("name", "version", "dependencies", "devDependencies"),
                new ArrayList<>(result.getManifest().keySet()));
    }

    @Test
    @DisplayName("Later declarations win and the conflict is reported")
    public void testLaterVersionWins() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("a", pkg("lodash", "^4.17.21")),
                contribution("b", pkg("stripe", "^13.0.0")),
                contribution("c", pkg("stripe", "^14.0.0"))), null);

        assertEquals("^4.17.21", section(result, "dependencies").get("lodash"));
        assertEquals("^14.0.0", section(result, "dependencies").get("stripe"));
        assertEquals(2, result.getVersionConflicts().size());

        VersionConflict lodash = result.getVersionConflicts().get(0);
        assertEquals("lodash", lodash.getPackageName());
        assertEquals("^4.17.21", lodash.getSelected());
        assertEquals(List.of("^4.17.0"), lodash.getAlternatives());

        VersionConflict stripe = result.getVersionConflicts().get(1);
        assertEquals("^14.0.0", stripe.getSelected());
        assertEquals(List.of("^13.0.0"), stripe.getAlternatives());
    }

    @Test
    @DisplayName("Identical versions are not a conflict")
    public void testSameVersionNoConflict() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("a", pkg("express", "^4.18.0"))), null);

        assertTrue(result.getVersionConflicts().isEmpty());
        assertTrue(result.getAddedDependencies().isEmpty());
    }

    @Test
    @DisplayName("A dev package already a runtime dependency stays a runtime dependency")
    public void testDevPackageAlreadyRuntime() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("a", devPkg("lodash", "^4.17.0"))), null);

        assertFalse(section(result, "devDependencies").containsKey("lodash"));
        assertEquals("^4.17.0", section(result, "dependencies").get("lodash"));
    }

    @Test
    @DisplayName("A later runtime declaration moves a dev package into dependencies")
    public void testRuntimeDeclarationOverridesDevPackage() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("testing", devPkg("zod", "^3.0.0")),
                contribution("validation", pkg("zod", "^3.1.0"))), null);

        assertEquals("^3.1.0", section(result, "dependencies").get("zod"));
        assertFalse(section(result, "devDependencies").containsKey("zod"));
        assertEquals(List.of("zod"), result.getAddedDependencies());
        assertTrue(result.getAddedDevDependencies().isEmpty());

        assertEquals(1, result.getVersionConflicts().size());
        VersionConflict zod = result.getVersionConflicts().get(0);
        assertEquals("zod", zod.getPackageName());
        assertEquals("^3.1.0", zod.getSelected());
        assertEquals(List.of("^3.0.0"), zod.getAlternatives());
    }

    @Test
    @DisplayName("A runtime feature package replaces a base devDependency of the same name")
    public void testRuntimePackageOverridesBaseDevDependency() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("testing", devPkg("zod", "^3.0.0")),
                contribution("compiler", pkg("zod", "^3.1.0"), pkg("typescript", "^5.4.0"))), null);

        Map<String, String> dependencies = section(result, "dependencies");
        Map<String, String> devDependencies = section(result, "devDependencies");
        assertEquals("^5.4.0", dependencies.get("typescript"));
        assertEquals("^3.1.0", dependencies.get("zod"));
        for (String name : dependencies.keySet()) {
            assertFalse(devDependencies.containsKey(name), name + " listed in both sections");
        }
        assertEquals(List.of("zod"), result.getAddedDependencies());

        assertEquals(2, result.getVersionConflicts().size());
        VersionConflict typescript = result.getVersionConflicts().get(1);
        assertEquals("typescript", typescript.getPackageName());
        assertEquals("^5.4.0", typescript.getSelected());
        assertEquals(List.of("^5.0.0"), typescript.getAlternatives());
    }

    @Test
    @DisplayName("Dependency sections are sorted by name")
    public void testSortedDependencies() {
        PackageMergeResult result = merger.mergePackageJson(base(), List.of(
                contribution("a", pkg("zod", "^3.22.0"), pkg("axios", "^1.6.0"))), null);

        assertEquals(List.of("axios", "express", "lodash", "zod"),
                new ArrayList<>(section(result, "dependencies").keySet()));
    }

    @Test
    @DisplayName("Does not modify the base manifest")
    public void testBaseUntouched() {
        Map<String, Object> base = base();
        merger.mergePackageJson(base, List.of(contribution("a", pkg("zod", "^3.22.0"))), "x");

        assertEquals("core-backend", base.get("name"));
        assertFalse(((Map<?, ?>) base.get("dependencies")).containsKey("zod"));
    }

    @Test
    @DisplayName("Contributions are split by target manifest")
    public void testContributionsByTarget() {
        FeatureSpec stripe = FeatureSpec.builder()
                .slug("payments.stripe")
                .npmPackages(List.of(
                        PackageSpec.builder().name("stripe").version("^14.0.0").target(PackageTarget.BACKEND).build(),
                        PackageSpec.builder().name("@stripe/stripe-js").version("^2.4.0").target(PackageTarget.WEB).build(),
                        pkg("zod", "^3.22.0")))
                .build();
        FeatureSpec none = FeatureSpec.builder().slug("docs").build();

        List<PackageContribution> backend = merger.contributionsFor(List.of(stripe, none), PackageTarget.BACKEND);
        List<PackageContribution> web = merger.contributionsFor(List.of(stripe, none), PackageTarget.WEB);

        assertEquals(1, backend.size());
        assertEquals(List.of("stripe", "zod"),
                backend.get(0).getPackages().stream().map(PackageSpec::getName).toList());
        assertEquals(List.of("@stripe/stripe-js", "zod"),
                web.get(0).getPackages().stream().map(PackageSpec::getName).toList());
    }

    @Test
    @DisplayName("Base scripts win, defaults fill gaps, first feature claims a free name")
    public void testGenerateScripts() {
        FeatureSpec email = FeatureSpec.builder().slug("comms.email")
                .scripts(Map.of("email:preview", "email dev", "build", "feature build")).build();
        FeatureSpec other = FeatureSpec.builder().slug("comms.other")
                .scripts(Map.of("email:preview", "other preview")).build();

        Map<String, String> scripts = merger.generateScripts(
                Map.of("dev", "nodemon src/index.ts", "test", "jest"), List.of(email, other));

        assertEquals("nodemon src/index.ts", scripts.get("dev"));
        assertEquals("jest", scripts.get("test"));
        assertEquals("tsc", scripts.get("build"));
        assertEquals("prisma migrate dev", scripts.get("db:migrate"));
        assertEquals("email dev", scripts.get("email:preview"));
        List<String> names = new ArrayList<>(scripts.keySet());
        List<String> sorted = new ArrayList<>(names);
        Collections.sort(sorted);
        assertEquals(sorted, names);
    }

    @Test
    @DisplayName("Stringified manifests use two-space indentation and a trailing newline")
    public void testStringify() {
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("name", "demo");
        manifest.put("private", true);
        manifest.put("dependencies", new TreeMap<>(Map.of("b", "^2.0.0", "a", "^1.0.0")));
        manifest.put("devDependencies", new TreeMap<>());
        manifest.put("files", List.of("dist"));

        String json = merger.stringifyPackageJson(manifest);

        assertEquals("{\n"
                + "  \"name\": \"demo\",\n"
                + "  \"private\": true,\n"
                + "  \"dependencies\": {\n"
                + "    \"a\": \"^1.0.0\",\n"
                + "    \"b\": \"^2.0.0\"\n"
                + "  },\n"
                + "  \"devDependencies\": {},\n"
                + "  \"files\": [\n"
                + "    \"dist\"\n"
                + "  ]\n"
                + "}\n", json);
    }
}
