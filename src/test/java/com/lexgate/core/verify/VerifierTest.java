package com.lexgate.core.verify;

import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.detect.StrategyRegistry;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.TreeScanner;
import com.lexgate.core.scanner.TreeWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.lexgate.support.TaskFunctions.broadCatch;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class VerifierTest {

    private static final String CLEAN = """
            class A {
                int f(String s) {
                    try {
                        return Integer.parseInt(s);
                    } catch (NumberFormatException e) {
                        return 0;
                    }
                }
            }
            """;

    private static final String STILL_BROAD = CLEAN.replace("NumberFormatException", "Exception");

    @TempDir
    Path tempDir;

    private CheckSuite checkSuite;
    private Verifier verifier;
    private final TfRegistry registry = TfRegistry.of(broadCatch());

    @BeforeEach
    void setUp() {
        var properties = new LexgateProperties();
        checkSuite = mock(CheckSuite.class);
        when(checkSuite.run(any(), any())).thenReturn(List.of(
                new CheckOutcome("compile", VerifyStatus.PASS, 0, "", 12)));
        verifier = new Verifier(checkSuite,
                new TreeScanner(new StrategyRegistry(), new TreeWalker(properties), properties), properties);
    }

    private void write(String relative, String content) throws IOException {
        Path path = tempDir.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    // ── Predicates ───────────────────────────────────────────────────

    @Nested
    @DisplayName("acceptance predicates")
    class Predicates {

        @Test
        @DisplayName("a clean patched file passes")
        void passes() throws IOException {
            write("src/A.java", CLEAN);

            VerifyReport report = verifier.verify(tempDir, registry, Map.of("BEX-001", List.of("src/A.java")), List.of());

            assertTrue(report.passed());
            assertEquals(VerifyStatus.PASS, report.verdicts().get(0).status());
            assertEquals("verification passed", report.summary());
        }

        @Test
        @DisplayName("a resolvable finding left behind fails the fixed point")
        void fixedPointFails() throws IOException {
            write("src/A.java", STILL_BROAD);

            VerifyReport report = verifier.verify(tempDir, registry, Map.of("BEX-001", List.of("src/A.java")), List.of());

            assertFalse(report.passed());
            TfVerdict verdict = report.verdicts().get(0);
            assertEquals(VerifyStatus.FAIL, verdict.status());
            assertEquals(List.of("src/A.java: 1 finding(s) remain after patching (fixed-point)"), verdict.failures());
            assertTrue(report.summary().startsWith("BEX-001: src/A.java"));
        }

        @Test
        @DisplayName("a file that no longer parses fails")
        void parseFailure() throws IOException {
            write("src/A.java", "class A {\n");

            VerifyReport report = verifier.verify(tempDir, registry, Map.of("BEX-001", List.of("src/A.java")), List.of());

            assertEquals(VerifyStatus.FAIL, report.verdicts().get(0).status());
            assertTrue(report.verdicts().get(0).failures().get(0).startsWith("src/A.java no longer parses"));
        }

        @Test
        @DisplayName("an unknown function is checked for parsing only")
        void unknownFunction() throws IOException {
            write("src/A.java", STILL_BROAD);

            VerifyReport report = verifier.verify(tempDir, registry, Map.of("ZZZ-999", List.of("src/A.java")), List.of());

            assertTrue(report.passed());
        }

        @Test
        @DisplayName("an active waiver downgrades a failure")
        void waived() throws IOException {
            write("src/A.java", STILL_BROAD);
            var waiver = new Waiver("BEX-001", "src/**", null, "legacy module", "PR-7");

            VerifyReport report = verifier.verify(tempDir, registry,
                    Map.of("BEX-001", List.of("src/A.java")), List.of(waiver));

            assertTrue(report.passed());
            assertEquals(VerifyStatus.WAIVED, report.verdicts().get(0).status());
            assertFalse(report.verdicts().get(0).failures().isEmpty());
        }

        @Test
        @DisplayName("a waiver for another function does not apply")
        void waiverForOtherFunction() throws IOException {
            write("src/A.java", STILL_BROAD);
            var waiver = new Waiver("SIL-002", "*", null, "", "*");

            VerifyReport report = verifier.verify(tempDir, registry,
                    Map.of("BEX-001", List.of("src/A.java")), List.of(waiver));

            assertFalse(report.passed());
        }
    }

    // ── Check suite ──────────────────────────────────────────────────

    @Nested
    @DisplayName("check suite")
    class Suite {

        @Test
        @DisplayName("a timeout is reported as TIMEOUT, not FAIL")
        void timeout() {
            when(checkSuite.run(any(), any())).thenReturn(List.of(
                    new CheckOutcome("compile", VerifyStatus.PASS, 0, "", 10),
                    new CheckOutcome("test", VerifyStatus.TIMEOUT, -1, "", 5000)));

            VerifyReport report = verifier.verify(tempDir, registry, Map.of(), List.of(), Duration.ofSeconds(5));

            assertEquals(VerifyStatus.TIMEOUT, report.suiteStatus());
            assertFalse(report.passed());
            assertEquals("check 'test' TIMEOUT", report.summary());
        }

        @Test
        @DisplayName("a failing check fails the report even without verdicts")
        void failingCheck() {
            when(checkSuite.run(any(), any())).thenReturn(List.of(
                    new CheckOutcome("compile", VerifyStatus.FAIL, 1, "error: ';' expected", 10)));

            VerifyReport report = verifier.verify(tempDir, registry, Map.of(), List.of());

            assertEquals(VerifyStatus.FAIL, report.suiteStatus());
            assertFalse(report.passed());
        }

        @Test
        void emptySuitePasses() {
            assertEquals(VerifyStatus.PASS, Verifier.suiteStatus(List.of()));
        }
    }
}
