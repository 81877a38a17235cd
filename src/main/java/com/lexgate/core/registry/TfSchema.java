package com.lexgate.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field rules every TF document must satisfy, read from a YAML schema document.
 * <p>
 * Checks presence of required fields and the type of each present field. Fields the
 * schema does not mention are tolerated.
 */
public class TfSchema {

    public static final String DEFAULT_RESOURCE = "schema/tf-schema.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final List<FieldRule> rules;

    public TfSchema(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static TfSchema fromClasspath(String resource) {
        try (InputStream in = TfSchema.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegistryException("Schema document not found on classpath: " + resource);
            }
            return parse(YAML.readTree(in), resource);
        } catch (IOException e) {
            throw new RegistryException("Cannot read schema document " + resource, e);
        }
    }

    public static TfSchema fromFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new RegistryException("Schema document not found: " + file);
        }
        try {
            return parse(YAML.readTree(file.toFile()), file.toString());
        } catch (IOException e) {
            throw new RegistryException("Cannot read schema document " + file, e);
        }
    }

    static TfSchema parse(JsonNode root, String source) {
        JsonNode fields = root == null ? null : root.get("fields");
        if (fields == null || !fields.isArray() || fields.isEmpty()) {
            throw new RegistryException("Schema document " + source + " declares no fields");
        }
        var rules = new ArrayList<FieldRule>();
        for (JsonNode field : fields) {
            String path = field.path("path").asText("");
            if (path.isBlank()) {
                throw new RegistryException("Schema document " + source + " has a field without a path");
            }
            var values = new ArrayList<String>();
            field.path("values").forEach(v -> values.add(v.asText()));
            try {
                rules.add(new FieldRule(
                        path,
                        FieldType.fromString(field.path("type").asText("string")),
                        field.path("required").asBoolean(false),
                        values,
                        field.hasNonNull("pattern") ? field.get("pattern").asText() : null,
                        field.hasNonNull("min") ? field.get("min").asDouble() : null,
                        field.hasNonNull("max") ? field.get("max").asDouble() : null));
            } catch (IllegalArgumentException e) {
                throw new RegistryException("Schema document " + source + ", field " + path + ": " + e.getMessage(), e);
            }
        }
        return new TfSchema(rules);
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * Validates one TF document and returns every violation found; empty when valid.
     */
    public List<SchemaViolation> validate(JsonNode document, String tfId, String source) {
        var violations = new ArrayList<SchemaViolation>();
        if (document == null || !document.isObject()) {
            violations.add(new SchemaViolation(tfId, "<document>", "document is not a mapping", source));
            return violations;
        }
        for (FieldRule rule : rules) {
            String[] segments = rule.path().split("\\.");
            JsonNode parent = document;
            boolean parentPresent = true;
            for (int i = 0; i < segments.length - 1; i++) {
                parent = parent.get(segments[i]);
                if (parent == null || !parent.isObject()) {
                    parentPresent = false;
                    break;
                }
            }
            if (!parentPresent) {
                // reported by the rule for the parent itself
                continue;
            }
            JsonNode value = parent.get(segments[segments.length - 1]);
            if (value == null || value.isNull()) {
                if (rule.required()) {
                    violations.add(new SchemaViolation(tfId, rule.path(), "missing required field", source));
                }
                continue;
            }
            String problem = check(rule, value);
            if (problem != null) {
                violations.add(new SchemaViolation(tfId, rule.path(), problem, source));
            }
        }
        return violations;
    }

    private static String check(FieldRule rule, JsonNode value) {
        return switch (rule.type()) {
            case STRING -> {
                if (!value.isTextual()) yield "expected string";
                if (rule.required() && value.asText().isBlank()) yield "must not be blank";
                if (rule.pattern() != null && !Pattern.matches(rule.pattern(), value.asText())) {
                    yield "'" + value.asText() + "' does not match " + rule.pattern();
                }
                yield null;
            }
            case NUMBER -> {
                if (!value.isNumber()) yield "expected number";
                double d = value.asDouble();
                if (rule.min() != null && d < rule.min()) yield d + " is below minimum " + rule.min();
                if (rule.max() != null && d > rule.max()) yield d + " is above maximum " + rule.max();
                yield null;
            }
            case BOOLEAN -> value.isBoolean() ? null : "expected boolean";
            case OBJECT -> value.isObject() ? null : "expected mapping";
            case STRING_LIST -> {
                if (!value.isArray()) yield "expected list of strings";
                for (JsonNode item : value) {
                    if (!item.isTextual()) yield "expected list of strings, found " + item.getNodeType();
                }
                yield null;
            }
            case ENUM -> value.isTextual() && rule.values().contains(value.asText())
                    ? null
                    : "'" + value.asText() + "' is not one of " + rule.values();
            case ENUM_LIST -> {
                if (!value.isArray()) yield "expected list of " + rule.values();
                for (JsonNode item : value) {
                    if (!item.isTextual() || !rule.values().contains(item.asText())) {
                        yield "'" + item.asText() + "' is not one of " + rule.values();
                    }
                }
                yield null;
            }
        };
    }
}
