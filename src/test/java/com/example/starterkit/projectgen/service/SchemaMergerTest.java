package com.example.starterkit.projectgen.service;

import com.example.starterkit.projectgen.config.ProjectGenProperties;
import com.example.starterkit.projectgen.exception.DuplicateModelException;
import com.example.starterkit.projectgen.exception.ProjectAssemblyException;
import com.example.starterkit.projectgen.model.SchemaMapping;
import com.example.starterkit.projectgen.model.SchemaMergeResult;
import com.example.starterkit.projectgen.model.SchemaValidation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Schema Merger Tests")
public class SchemaMergerTest {

    private static final String BASE = String.join("\n",
            "datasource db {",
            "  provider = \"postgresql\"",
            "  url      = env(\"DATABASE_URL\")",
            "}",
            "",
            "model User {",
            "  id String @id",
            "}",
            "");

    @TempDir
    Path root;

    private SchemaMerger merger;

    @BeforeEach
    public void setup() throws IOException {
        merger = new SchemaMerger(new SourcePathResolver(), new ProjectGenProperties());
        Path payments = root.resolve("modules/payments/backend/prisma/schema.prisma");
        Files.createDirectories(payments.getParent());
        Files.writeString(payments, "model Payment {\n  id String @id\n}\n\nenum PaymentStatus {\n  PAID\n}\n");
    }

    private static SchemaMapping mapping(String model, String source) {
        return SchemaMapping.builder().model(model).source(source).build();
    }

    @Test
    @DisplayName("Fragments are appended after the base in order")
    public void testMergeOrder() {
        Map<String, String> fragments = new LinkedHashMap<>();
        fragments.put("auth", "model Session {\n  id String @id\n}");
        fragments.put("billing", "model Invoice {\n  id String @id\n}");

        SchemaMergeResult result = merger.merge(BASE, fragments);

        String schema = result.getSchema();
        assertTrue(schema.startsWith("datasource db {"));
        assertTrue(schema.indexOf("model User") < schema.indexOf("model Session"));
        assertTrue(schema.indexOf("model Session") < schema.indexOf("model Invoice"));
        assertTrue(schema.endsWith("}\n"));
        assertEquals(List.of("User", "Session", "Invoice"), result.getModels());
    }

    @Test
    @DisplayName("A model declared twice aborts the merge")
    public void testDuplicateModel() {
        Map<String, String> fragments = new LinkedHashMap<>();
        fragments.put("modules/a/schema.prisma", "model Post {\n  id String @id\n}");
        fragments.put("modules/b/schema.prisma", "model Post {\n  id Int @id\n}");

        DuplicateModelException ex = assertThrows(DuplicateModelException.class,
                () -> merger.merge(BASE, fragments));

        assertEquals("Post", ex.getModelName());
        assertEquals("modules/a/schema.prisma", ex.getFirstSource());
        assertEquals("modules/b/schema.prisma", ex.getSecondSource());
    }

    @Test
    @DisplayName("A fragment redeclaring a base model aborts the merge")
    public void testDuplicateOfBaseModel() {
        DuplicateModelException ex = assertThrows(DuplicateModelException.class,
                () -> merger.merge(BASE, Map.of("user", "model User {\n  id Int @id\n}")));

        assertEquals(SchemaMerger.BASE_LABEL, ex.getFirstSource());
    }

    @Test
    @DisplayName("Enums share the model namespace")
    public void testEnumCollidesWithModel() {
        Map<String, String> fragments = new LinkedHashMap<>();
        fragments.put("a", "enum Status {\n  ON\n}");
        fragments.put("b", "model Status {\n  id String @id\n}");

        assertThrows(DuplicateModelException.class, () -> merger.merge(BASE, fragments));
    }

    @Test
    @DisplayName("Commented-out declarations are ignored")
    public void testCommentedDeclaration() {
        SchemaMergeResult result = merger.merge(BASE,
                Map.of("legacy", "// model User {\nmodel Archive {\n  id String @id\n}"));

        assertEquals(List.of("User", "Archive"), result.getModels());
    }

    @Test
    @DisplayName("Loads file sources and inline sources")
    public void testLoadsSources() {
        SchemaMergeResult result = merger.mergeSchemas(BASE, List.of(
                mapping("Payment", "modules/payments/backend/prisma/schema.prisma"),
                mapping("Role", "model Role {\n  id String @id\n}")), root, root.resolve("core"));

        assertEquals(List.of("User", "Payment", "Role"), result.getModels());
        assertEquals(List.of("PaymentStatus"), result.getEnums());
    }

    @Test
    @DisplayName("A file shared by several mappings is merged once")
    public void testSharedSourceMergedOnce() {
        SchemaMergeResult result = merger.mergeSchemas(BASE, List.of(
                mapping("Payment", "modules/payments/backend/prisma/schema.prisma"),
                mapping("PaymentStatus", "modules/payments/backend/prisma/schema.prisma")), root, root.resolve("core"));

        assertEquals(List.of("User", "Payment"), result.getModels());
        assertEquals(1, result.getSchema().split("model Payment \\{", -1).length - 1);
    }

    @Test
    @DisplayName("Spellings of the same source path are merged once")
    public void testEquivalentSourcePathsMergedOnce() {
        SchemaMergeResult result = merger.mergeSchemas(BASE, List.of(
                mapping("Payment", "./modules/payments/backend/prisma/schema.prisma"),
                mapping("PaymentStatus", "modules//payments/backend/prisma/schema.prisma")), root, root.resolve("core"));

        assertEquals(List.of("User", "Payment"), result.getModels());
        assertEquals(List.of("PaymentStatus"), result.getEnums());
    }

    @Test
    @DisplayName("File sources resolve against the configured project root")
    public void testMergeAgainstConfiguredRoot() {
        ProjectGenProperties properties = new ProjectGenProperties();
        properties.getPaths().setProjectRoot(root.toString());
        SchemaMerger configured = new SchemaMerger(new SourcePathResolver(), properties);

        SchemaMergeResult result = configured.mergeSchemas(BASE, List.of(
                mapping("Payment", "modules/payments/backend/prisma/schema.prisma")));

        assertEquals(List.of("User", "Payment"), result.getModels());
        assertTrue(result.getSchema().contains("// modules/payments/backend/prisma/schema.prisma\n"));
    }

    @Test
    @DisplayName("A missing schema file fails the merge")
    public void testMissingSchemaFile() {
        assertThrows(ProjectAssemblyException.class, () -> merger.mergeSchemas(BASE,
                List.of(mapping("Ghost", "modules/ghost/schema.prisma")), root, root.resolve("core")));
    }

    @Test
    @DisplayName("Completeness check reports missing models")
    public void testValidateCompleteness() {
        SchemaMergeResult result = merger.merge(BASE, Map.of("auth", "model Session {\n  id String @id\n}"));

        SchemaValidation ok = merger.validateSchemaCompleteness(result, List.of("User", "Session"));
        SchemaValidation missing = merger.validateSchemaCompleteness(result, List.of("User", "Invoice", "Invoice"));

        assertTrue(ok.isValid());
        assertFalse(missing.isValid());
        assertEquals(List.of("Invoice"), missing.getMissing());
    }
}
