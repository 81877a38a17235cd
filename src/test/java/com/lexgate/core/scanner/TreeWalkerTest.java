package com.lexgate.core.scanner;

import com.lexgate.core.config.LexgateProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeWalkerTest {

    @TempDir
    Path tempDir;

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    @Test
    void listsSortedRelativePaths() throws IOException {
        touch("src/b/B.java");
        touch("src/a/A.java");
        touch("README.md");

        List<String> files = new TreeWalker(new LexgateProperties()).files(tempDir);

        assertEquals(List.of("README.md", "src/a/A.java", "src/b/B.java"), files);
    }

    @Test
    void skipsIgnoredDirectoriesAndMetadataFiles() throws IOException {
        touch("src/A.java");
        touch(".git/HEAD");
        touch("target/classes/A.class");
        touch("module/build/Gen.java");
        touch(".lexgate/waivers/PR-1.md");
        touch("src/.DS_Store");

        List<String> files = new TreeWalker(new LexgateProperties()).files(tempDir);

        assertEquals(List.of("src/A.java"), files);
    }

    @Test
    void ignoreListComesFromProperties() throws IOException {
        touch("src/A.java");
        touch("generated/G.java");
        var properties = new LexgateProperties();
        properties.getScan().setIgnoreDirs(List.of("generated"));

        assertEquals(List.of("src/A.java"), new TreeWalker(properties).files(tempDir));
    }
}
