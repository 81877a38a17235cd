package com.lexgate.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangeContextTest {

    @Test
    void fromListNormalisesPaths() {
        ChangeContext change = ChangeContext.fromList("PR-42", """
                # files touched by PR-42
                ./src/B.java

                src\\main\\A.java
                src/B.java
                """);

        assertEquals(List.of("src/B.java", "src/main/A.java"), List.copyOf(change.changedFiles()));
    }

    @Test
    void fromListAcceptsWindowsLineEndings() {
        ChangeContext change = ChangeContext.fromList("PR-1", "a.java\r\nb.java\r\n");

        assertEquals(2, change.changedFiles().size());
        assertTrue(change.changedFiles().contains("b.java"));
    }

    @Test
    void blankIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChangeContext.of(" ", List.of()));
    }

    @Test
    void changedFilesAreImmutable() {
        ChangeContext change = ChangeContext.of("PR-1", List.of("a.java"));
        assertThrows(UnsupportedOperationException.class, () -> change.changedFiles().add("b.java"));
    }
}
