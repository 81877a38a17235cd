package com.lexgate.core.waiver;

import com.lexgate.core.LexgateException;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.Waiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Waiver documents kept in the tree under {@code lexgate.waivers.dir}, one Markdown file per
 * change context plus {@value #ANY_CONTEXT_FILE} for waivers granted to every context.
 * <p>
 * The ledger only ever appends. Expired waivers stay in their documents and are simply not
 * active.
 */
@Service
public class WaiverLedger {

    private static final Logger log = LoggerFactory.getLogger(WaiverLedger.class);

    static final String ANY_CONTEXT_FILE = "any-context.md";

    private final LexgateProperties properties;

    public WaiverLedger(LexgateProperties properties) {
        this.properties = properties;
    }

    public Path directory(Path root) {
        return root.resolve(properties.getWaivers().getDir());
    }

    public Path documentFor(Path root, String contextId) {
        return directory(root).resolve(ChangeContext.ANY.equals(contextId)
                ? ANY_CONTEXT_FILE
                : contextId.replaceAll("[^A-Za-z0-9._-]", "_") + ".md");
    }

    /**
     * Appends {@code waiver} to its context's document, creating the document if needed.
     */
    public void record(Path root, Waiver waiver) {
        Path document = documentFor(root, waiver.context());
        try {
            Files.createDirectories(document.getParent());
            String header = Files.exists(document) ? "" : "# Waivers for " + waiver.context() + "\n\n";
            Files.writeString(document, header + waiver.toLine() + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            log.info("Recorded waiver for {} in {}", waiver.tfId(), document);
        } catch (IOException e) {
            throw new LexgateException("Cannot record waiver in " + document + ": " + e.getMessage(), e);
        }
    }

    /**
     * All waivers declared for {@code contextId} or for any context, with parse warnings.
     */
    public WaiverDocument load(Path root, String contextId) {
        WaiverDocument document = read(documentFor(root, ChangeContext.ANY), ChangeContext.ANY);
        if (!ChangeContext.ANY.equals(contextId)) {
            document = document.plus(read(documentFor(root, contextId), contextId));
        }
        document.warnings().forEach(w -> log.warn("Waiver document: {}", w));
        return document;
    }

    public Set<Waiver> active(Path root, ChangeContext context, Instant now) {
        var active = new LinkedHashSet<Waiver>();
        for (Waiver waiver : load(root, context.id()).waivers()) {
            if (waiver.isActiveFor(context, now)) {
                active.add(waiver);
            }
        }
        return active;
    }

    private static WaiverDocument read(Path document, String contextId) {
        if (!Files.isRegularFile(document)) {
            return WaiverDocument.empty();
        }
        try {
            return WaiverDocumentParser.parse(contextId, Files.readString(document, StandardCharsets.UTF_8),
                    document.getFileName().toString());
        } catch (IOException e) {
            throw new LexgateException("Cannot read waiver document " + document + ": " + e.getMessage(), e);
        }
    }
}
