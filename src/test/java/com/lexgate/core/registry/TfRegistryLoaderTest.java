package com.lexgate.core.registry;

import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.DecisionMode;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.PrecedenceTier;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.TfStatus;
import com.lexgate.core.model.Transform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.lexgate.support.TaskFunctions.broadCatchDocument;
import static com.lexgate.support.TaskFunctions.document;
import static org.junit.jupiter.api.Assertions.*;

class TfRegistryLoaderTest {

    @TempDir
    Path tempDir;

    private TfRegistryLoader loader;
    private TfSchema schema;
    private Path tfDir;

    @BeforeEach
    void setUp() throws IOException {
        loader = new TfRegistryLoader(new LexgateProperties());
        schema = TfSchema.fromClasspath(TfSchema.DEFAULT_RESOURCE);
        tfDir = Files.createDirectories(tempDir.resolve("policy/tf"));
    }

    private void write(String name, String content) throws IOException {
        Files.writeString(tfDir.resolve(name), content);
    }

    // ── Loading ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("valid documents")
    class Valid {

        @Test
        @DisplayName("maps every section of the document")
        void mapsDocument() throws IOException {
            write("BEX-001.yaml", broadCatchDocument());

            TfRegistry registry = loader.load(tfDir, schema);

            TaskFunction tf = registry.find("BEX-001").orElseThrow();
            assertEquals("BEX-001 rule", tf.name());
            assertEquals(TfStatus.ACTIVE, tf.status());
            assertEquals(PrecedenceTier.L1, tf.tier());
            assertEquals(0.9, tf.confidence());
            assertEquals(DetectorKind.BROAD_CATCH, tf.kind());
            assertEquals(DecisionMode.AUTO, tf.decisionRule().mode());
            assertTrue(tf.allows(Transform.NARROW_CATCH));
            assertTrue(tf.footprint().covers("src/main/java/App.java"));
            assertEquals("method body", tf.scope());
        }

        @Test
        @DisplayName("orders functions by id and separates stubs from active ones")
        void ordersAndFiltersActive() throws IOException {
            write("b.yaml", document("SIL-002", "active", "L1", "EMPTY_CATCH", "rethrow", "auto"));
            write("a.yml", broadCatchDocument());
            write("c.yaml", document("DUP-018", "stub", "L4", "LONG_METHOD", "", "ask"));
            write("notes.txt", "ignored");

            TfRegistry registry = loader.load(tfDir, schema);

            assertEquals(3, registry.all().size());
            assertEquals("BEX-001", registry.all().get(0).id());
            assertEquals(2, registry.active().size());
            assertTrue(registry.find("DUP-018").isPresent());
            assertTrue(registry.active().stream().noneMatch(tf -> tf.id().equals("DUP-018")));
        }

        @Test
        @DisplayName("resolves the TF directory against the tree root")
        void loadsFromRoot() throws IOException {
            write("BEX-001.yaml", broadCatchDocument());

            TfRegistry registry = loader.load(tempDir);

            assertEquals(1, registry.active().size());
        }

        @Test
        @DisplayName("an empty directory yields an empty registry")
        void emptyDirectory() {
            TfRegistry registry = loader.load(tfDir, schema);
            assertTrue(registry.all().isEmpty());
        }
    }

    // ── Violations ───────────────────────────────────────────────────

    @Nested
    @DisplayName("invalid documents")
    class Invalid {

        @Test
        @DisplayName("an active document missing a required field fails the build")
        void missingRequiredField() throws IOException {
            write("BEX-001.yaml", broadCatchDocument());
            write("SIL-002.yaml", document("SIL-002", "active", "L1", "EMPTY_CATCH", "rethrow", "auto")
                    .replace("name: SIL-002 rule\n", ""));

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertEquals(1, e.getViolations().size());
            SchemaViolation violation = e.getViolations().get(0);
            assertEquals("SIL-002", violation.tfId());
            assertEquals("name", violation.field());
        }

        @Test
        @DisplayName("reports the field path of a bad enum value")
        void badEnumValue() throws IOException {
            write("BEX-001.yaml", broadCatchDocument().replace("tier: L1", "tier: L9"));

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertTrue(e.getViolations().stream().anyMatch(v -> v.field().equals("tier")));
        }

        @Test
        @DisplayName("rejects an id that does not match the pattern")
        void badId() throws IOException {
            write("x.yaml", broadCatchDocument().replace("id: BEX-001", "id: bex1"));

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertEquals("id", e.getViolations().get(0).field());
        }

        @Test
        @DisplayName("an invalid stub is tolerated and kept as a violation")
        void invalidStubTolerated() throws IOException {
            write("BEX-001.yaml", broadCatchDocument());
            write("DUP-018.yaml", document("DUP-018", "stub", "L4", "LONG_METHOD", "", "ask")
                    .replace("confidence: 0.9", "confidence: 7"));

            TfRegistry registry = loader.load(tfDir, schema);

            assertEquals(1, registry.all().size());
            assertEquals(1, registry.violations().size());
            assertEquals("confidence", registry.violations().get(0).field());
        }

        @Test
        @DisplayName("a duplicate id is a violation")
        void duplicateId() throws IOException {
            write("a.yaml", broadCatchDocument());
            write("b.yaml", broadCatchDocument());

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertTrue(e.getViolations().get(0).reason().startsWith("duplicate id"));
        }

        @Test
        @DisplayName("unparseable YAML is a violation of the document")
        void unreadableYaml() throws IOException {
            write("BEX-001.yaml", broadCatchDocument());
            write("ERR-011.yaml", "id: [unclosed\n");

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertEquals("<document>", e.getViolations().get(0).field());
            assertEquals("ERR-011", e.getViolations().get(0).tfId());
        }

        @Test
        @DisplayName("a footprint glob that does not compile names the function and field")
        void invalidFootprintGlob() throws IOException {
            write("BEX-001.yaml", broadCatchDocument()
                    .replace("include: [\"**/*.java\"]", "include: [\"src/[x\"]\n  exclude: [\"**/gen/**\"]"));

            RegistryException e = assertThrows(RegistryException.class, () -> loader.load(tfDir, schema));

            assertEquals(1, e.getViolations().size());
            SchemaViolation violation = e.getViolations().get(0);
            assertEquals("BEX-001", violation.tfId());
            assertEquals("footprint.include", violation.field());
            assertTrue(violation.reason().startsWith("invalid glob 'src/[x'"));
        }

        @Test
        @DisplayName("a missing directory fails the build")
        void missingDirectory() {
            assertThrows(RegistryException.class, () -> loader.load(tempDir.resolve("nope"), schema));
        }
    }
}
