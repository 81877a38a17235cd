package com.lexgate.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.lexgate.support.TaskFunctions.broadCatchDocument;
import static org.junit.jupiter.api.Assertions.*;

class TfSchemaTest {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final TfSchema schema = TfSchema.fromClasspath(TfSchema.DEFAULT_RESOURCE);

    private List<SchemaViolation> validate(String yaml) throws IOException {
        JsonNode doc = YAML.readTree(yaml);
        return schema.validate(doc, "BEX-001", "BEX-001.yaml");
    }

    @Test
    void bundledDocumentValidates() throws IOException {
        assertTrue(validate(broadCatchDocument()).isEmpty());
    }

    @Test
    void unknownFieldsAreTolerated() throws IOException {
        assertTrue(validate(broadCatchDocument() + "owner: platform-team\n").isEmpty());
    }

    @Test
    void confidenceOutOfRange() throws IOException {
        var violations = validate(broadCatchDocument().replace("confidence: 0.9", "confidence: 1.5"));
        assertEquals(1, violations.size());
        assertEquals("confidence", violations.get(0).field());
    }

    @Test
    void unknownTransform() throws IOException {
        var violations = validate(broadCatchDocument().replace("[narrow-catch]", "[delete-everything]"));
        assertEquals("allowed_transforms", violations.get(0).field());
    }

    @Test
    void missingNestedRequiredField() throws IOException {
        var violations = validate(broadCatchDocument().replace("  mode: auto\n", ""));
        assertEquals(1, violations.size());
        assertEquals("decision_rule.mode", violations.get(0).field());
    }

    @Test
    void listOfNonStrings() throws IOException {
        var violations = validate(broadCatchDocument().replace("signals: [something suspicious]", "signals: [{a: 1}]"));
        assertEquals("detection.signals", violations.get(0).field());
    }

    @Test
    void nonMappingDocument() throws IOException {
        var violations = validate("- just\n- a list\n");
        assertEquals("<document>", violations.get(0).field());
    }

    @Test
    void schemaFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("schema.yaml");
        Files.writeString(file, """
                fields:
                  - path: id
                    type: string
                    required: true
                """);

        TfSchema custom = TfSchema.fromFile(file);

        assertEquals(1, custom.rules().size());
        assertTrue(custom.validate(YAML.readTree("id: X-001\n"), "X-001", "x").isEmpty());
    }

    @Test
    void schemaWithoutFieldsIsRejected(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("schema.yaml");
        Files.writeString(file, "version: 1\n");
        assertThrows(RegistryException.class, () -> TfSchema.fromFile(file));
    }

    @Test
    void missingSchemaIsRejected(@TempDir Path dir) {
        assertThrows(RegistryException.class, () -> TfSchema.fromFile(dir.resolve("missing.yaml")));
    }
}
