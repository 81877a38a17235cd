package com.lexgate.core.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.PathGlob;
import com.lexgate.core.model.TaskFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Builds a {@link TfRegistry} from the YAML documents in a directory.
 * <p>
 * Documents are read in file-name order and validated one by one. The build fails when an
 * active document (or one whose status cannot be read) is invalid, when every document is
 * invalid, or when the schema or directory is missing. Invalid stub and disabled documents
 * are logged and kept as violations on the registry.
 */
@Service
public class TfRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(TfRegistryLoader.class);

    private final LexgateProperties properties;
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final TfDocumentMapper documentMapper = new TfDocumentMapper(yaml);

    public TfRegistryLoader(LexgateProperties properties) {
        this.properties = properties;
    }

    /** Loads from {@code lexgate.tf-dir}, resolved against {@code root}. */
    public TfRegistry load(Path root) {
        return load(root.resolve(properties.getTfDir()), schema(root));
    }

    public TfRegistry load(Path tfDir, TfSchema schema) {
        if (!Files.isDirectory(tfDir)) {
            throw new RegistryException("TF directory not readable: " + tfDir);
        }

        List<Path> documents;
        try (Stream<Path> files = Files.list(tfDir)) {
            documents = files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RegistryException("TF directory not readable: " + tfDir, e);
        }

        var loaded = new ArrayList<TaskFunction>();
        var fatal = new ArrayList<SchemaViolation>();
        var tolerated = new ArrayList<SchemaViolation>();
        Map<String, String> firstSource = new HashMap<>();

        for (Path document : documents) {
            String source = document.toString();
            String stem = stem(document);

            JsonNode root;
            try {
                root = yaml.readTree(document.toFile());
            } catch (IOException e) {
                fatal.add(new SchemaViolation(stem, "<document>", "unreadable YAML: " + firstLine(e.getMessage()), source));
                continue;
            }

            String tfId = root != null && root.path("id").isTextual() ? root.path("id").asText() : stem;
            String status = root != null ? root.path("status").asText("") : "";
            boolean inactive = "stub".equals(status) || "disabled".equals(status);

            var violations = new ArrayList<>(schema.validate(root, tfId, source));
            if (violations.isEmpty()) {
                violations.addAll(globViolations(root, tfId, source));
            }
            if (violations.isEmpty() && firstSource.containsKey(tfId)) {
                violations.add(new SchemaViolation(tfId, "id", "duplicate id, first defined in " + firstSource.get(tfId), source));
            }
            if (violations.isEmpty()) {
                try {
                    loaded.add(documentMapper.toTaskFunction(root, source));
                    firstSource.put(tfId, source);
                    continue;
                } catch (IllegalArgumentException e) {
                    violations.add(new SchemaViolation(tfId, "<document>", e.getMessage(), source));
                }
            }

            if (inactive) {
                violations.forEach(v -> log.warn("Ignoring invalid {} TF: {}", status, v));
                tolerated.addAll(violations);
            } else {
                fatal.addAll(violations);
            }
        }

        if (!fatal.isEmpty() || (!documents.isEmpty() && loaded.isEmpty())) {
            var all = new ArrayList<SchemaViolation>(fatal);
            all.addAll(tolerated);
            throw new RegistryException(all);
        }
        if (documents.isEmpty()) {
            log.warn("No TF documents found in {}", tfDir);
        }

        var registry = new TfRegistry(loaded, tolerated);
        log.info("Loaded {} TF(s) from {} ({} active)", registry.all().size(), tfDir, registry.active().size());
        return registry;
    }

    private TfSchema schema(Path root) {
        String file = properties.getSchemaFile();
        if (file == null || file.isBlank()) {
            return TfSchema.fromClasspath(TfSchema.DEFAULT_RESOURCE);
        }
        return TfSchema.fromFile(root.resolve(file));
    }

    private static List<SchemaViolation> globViolations(JsonNode document, String tfId, String source) {
        var violations = new ArrayList<SchemaViolation>();
        for (String field : List.of("include", "exclude")) {
            for (JsonNode glob : document.path("footprint").path(field)) {
                PathGlob.problem(glob.asText()).ifPresent(problem -> violations.add(new SchemaViolation(
                        tfId, "footprint." + field, "invalid glob '" + glob.asText() + "': " + problem, source)));
            }
        }
        return violations;
    }

    private static String stem(Path document) {
        String name = document.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
