package com.lexgate.core.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexgate.core.LexgateException;
import com.lexgate.core.apply.ApplyEngine;
import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.detect.StrategyRegistry;
import com.lexgate.core.model.ChangeContext;
import com.lexgate.core.model.DecisionMode;
import com.lexgate.core.model.DetectorKind;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.PrecedenceTier;
import com.lexgate.core.model.Span;
import com.lexgate.core.model.TaskFunction;
import com.lexgate.core.model.TaskPacket;
import com.lexgate.core.model.Transform;
import com.lexgate.core.model.Waiver;
import com.lexgate.core.propose.Proposal;
import com.lexgate.core.registry.TfRegistry;
import com.lexgate.core.scanner.TreeScanner;
import com.lexgate.core.scanner.TreeWalker;
import com.lexgate.core.verify.CheckSuite;
import com.lexgate.core.verify.Verifier;
import com.lexgate.core.waiver.WaiverLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.lexgate.support.TaskFunctions.tf;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentBridgeTest {

    private static final String FILE = "src/A.java";
    private static final String SOURCE = """
            class A {
                int f(String s) {
                    try {
                        return Integer.parseInt(s);
                    } catch (Exception e) {
                        return 0;
                    }
                }
            }
            """;
    private static final String NARROWING_DIFF = """
            --- a/src/A.java
            +++ b/src/A.java
            @@ -5 +5 @@
            -        } catch (Exception e) {
            +        } catch (NumberFormatException e) {
            """;
    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    @TempDir
    Path root;

    @TempDir
    Path diffDir;

    private AgentBridge bridge;
    private WaiverLedger ledger;
    private final TaskFunction tf = tf("X-001", PrecedenceTier.L1, DetectorKind.BROAD_CATCH, Map.of(),
            DecisionMode.AUTO, Transform.NARROW_CATCH);
    private final TfRegistry registry = TfRegistry.of(tf);
    private final ChangeContext change = ChangeContext.of("PR-42", List.of(FILE));

    @BeforeEach
    void setUp() throws IOException {
        var properties = new LexgateProperties();
        var walker = new TreeWalker(properties);
        var scanner = new TreeScanner(new StrategyRegistry(), walker, properties);
        CheckSuite checks = mock(CheckSuite.class);
        when(checks.run(any(), any())).thenReturn(List.of());
        ledger = new WaiverLedger(properties);
        bridge = new AgentBridge(properties, new ApplyEngine(properties),
                new Verifier(checks, scanner, properties), ledger, walker);

        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve(FILE), SOURCE);
    }

    private Proposal ambiguousProposal() {
        var finding = new Finding("X-001", PrecedenceTier.L1, FILE, new Span(5, 18, 5, 26), 0.9,
                "catch of broad type Exception", "A.f()", List.of("helper"), false);
        return Proposal.ambiguous(finding, "no call in the try block maps to a specific exception type");
    }

    private void diff(String name, String text) throws IOException {
        Files.writeString(diffDir.resolve(name), text);
    }

    // ── Emit ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("emit")
    class Emit {

        @Test
        @DisplayName("writes exactly one packet naming the function")
        void onePacket() throws IOException {
            List<TaskPacket> packets = bridge.emit(root, List.of(ambiguousProposal()), registry);

            assertEquals(1, packets.size());
            Path file = root.resolve(".lexgate/tasks/task_001_X-001.json");
            assertTrue(Files.exists(file));
            JsonNode json = new ObjectMapper().readTree(file.toFile());
            assertEquals("X-001", json.get("tf_id").asText());
            assertEquals(FILE, json.get("file").asText());
            assertEquals(5, json.get("line").asInt());
            assertEquals(5, json.get("span").get("start_line").asInt());
            assertEquals("narrow-catch", json.get("allowed_transforms").get(0).asText());
            assertEquals("Fix X-001", json.get("decision_rule").asText());
            assertEquals("helper", json.get("hints").get(0).asText());
            assertEquals("no call in the try block maps to a specific exception type", json.get("reason").asText());
        }

        @Test
        @DisplayName("the code frame holds two lines of context either side")
        void codeFrame() {
            TaskPacket packet = bridge.packets(root, List.of(ambiguousProposal()), registry).get(0);

            assertEquals(String.join("\n",
                    "   3 |         try {",
                    "   4 |             return Integer.parseInt(s);",
                    "   5 |         } catch (Exception e) {",
                    "   6 |             return 0;",
                    "   7 |         }"), packet.codeFrame());
        }

        @Test
        @DisplayName("previous packets are replaced, other files are left alone")
        void replacesOldPackets() throws IOException {
            Path dir = Files.createDirectories(root.resolve(".lexgate/tasks"));
            Files.writeString(dir.resolve("task_007_OLD-001.json"), "{}");
            Files.writeString(dir.resolve("README.md"), "reviewer notes");

            bridge.emit(root, List.of(), registry);

            assertFalse(Files.exists(dir.resolve("task_007_OLD-001.json")));
            assertTrue(Files.exists(dir.resolve("README.md")));
        }
    }

    // ── Reading diffs ────────────────────────────────────────────────

    @Nested
    @DisplayName("reading diffs")
    class Reading {

        @Test
        @DisplayName("attributes a diff to the function in its file name")
        void tfIdFromName() throws IOException {
            diff("X-001.diff", NARROWING_DIFF);
            diff("notes.txt", "not a diff");

            List<AgentDiff> diffs = bridge.readDiffs(diffDir);

            assertEquals(1, diffs.size());
            assertEquals("X-001", diffs.get(0).tfId());
            assertFalse(diffs.get(0).isMalformed());
        }

        @Test
        @DisplayName("a tf_id header overrides the file name")
        void tfIdFromHeader() {
            AgentDiff diff = AgentBridge.parseDiff("fix.patch", "X-001", "# tf_id: SIL-002\n" + NARROWING_DIFF);

            assertEquals("SIL-002", diff.tfId());
        }

        @Test
        void unattributedDiffIsMalformed() {
            assertTrue(AgentBridge.parseDiff("fix.patch", null, NARROWING_DIFF).isMalformed());
        }

        @Test
        void diffWithoutHunksIsMalformed() {
            assertEquals("no hunks", AgentBridge.parseDiff("X-001.diff", "X-001", "LGTM\n").error());
        }

        @Test
        void missingDirectory() {
            assertThrows(LexgateException.class, () -> bridge.readDiffs(diffDir.resolve("missing")));
        }
    }

    // ── Ingest ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("ingest")
    class Ingest {

        @Test
        @DisplayName("a diff that verifies is applied to the tree")
        void accepted() throws IOException {
            diff("X-001.diff", NARROWING_DIFF);

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            assertEquals(IngestOutcome.ACCEPTED, result.entries().get(0).outcome());
            assertEquals(1, result.accepted());
            assertEquals(List.of(FILE), result.applied().changedFiles());
            assertTrue(Files.readString(root.resolve(FILE)).contains("catch (NumberFormatException e)"));
        }

        @Test
        @DisplayName("a diff already in the tree is a no-op")
        void alreadyApplied() throws IOException {
            diff("X-001.diff", NARROWING_DIFF);
            bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);
            String once = Files.readString(root.resolve(FILE));

            IngestResult again = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            assertEquals(IngestOutcome.ALREADY_APPLIED, again.entries().get(0).outcome());
            assertEquals(once, Files.readString(root.resolve(FILE)));
        }

        @Test
        @DisplayName("a diff that fails verification is not applied and is waived")
        void waived() throws IOException {
            diff("X-001.diff", NARROWING_DIFF.replace("catch (NumberFormatException e) {", "catch (Exception e) {{{"));

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            IngestEntry entry = result.entries().get(0);
            assertEquals(IngestOutcome.WAIVED, entry.outcome());
            assertTrue(entry.detail().startsWith("X-001: "));
            assertEquals(SOURCE, Files.readString(root.resolve(FILE)));

            List<Waiver> waivers = ledger.load(root, "PR-42").waivers();
            assertEquals(1, waivers.size());
            assertEquals("X-001", waivers.get(0).tfId());
            assertEquals(FILE, waivers.get(0).scope());
            assertEquals(NOW.plus(Duration.ofDays(14)), waivers.get(0).expiry());
            assertTrue(waivers.get(0).rationale().startsWith("agent diff X-001.diff failed verification"));
        }

        @Test
        @DisplayName("a diff that does not fit the tree is rejected without a waiver")
        void rejectedConflict() throws IOException {
            diff("X-001.diff", NARROWING_DIFF.replace("-        } catch (Exception e) {", "-        } catch (Error e) {"));

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            assertEquals(IngestOutcome.REJECTED, result.entries().get(0).outcome());
            assertTrue(ledger.load(root, "PR-42").waivers().isEmpty());
            assertEquals(SOURCE, Files.readString(root.resolve(FILE)));
        }

        @Test
        @DisplayName("a diff climbing out of the tree is rejected and writes nothing")
        void rejectedParentPath() throws IOException {
            diff("escape.diff", """
                    # tf_id: X-001
                    --- /dev/null
                    +++ b/../Escaped-lexgate.java
                    @@ -0,0 +1 @@
                    +class Escaped {}
                    """);

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            IngestEntry entry = result.entries().get(0);
            assertEquals(IngestOutcome.REJECTED, entry.outcome());
            assertEquals("path escapes the tree: ../Escaped-lexgate.java", entry.detail());
            assertFalse(Files.exists(root.getParent().resolve("Escaped-lexgate.java")));
            assertTrue(ledger.load(root, "PR-42").waivers().isEmpty());
        }

        @Test
        @DisplayName("a diff naming an absolute path is rejected and writes nothing")
        void rejectedAbsolutePath() throws IOException {
            Path outside = diffDir.resolve("Absolute.java").toAbsolutePath();
            diff("X-001-absolute.diff", "--- /dev/null\n+++ " + outside + "\n@@ -0,0 +1 @@\n+class Absolute {}\n");

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            assertEquals(IngestOutcome.REJECTED, result.entries().get(0).outcome());
            assertTrue(result.entries().get(0).detail().startsWith("path escapes the tree: "));
            assertFalse(Files.exists(outside));
            assertEquals(SOURCE, Files.readString(root.resolve(FILE)));
        }

        @Test
        @DisplayName("a malformed diff is rejected and the batch continues")
        void malformedThenValid() throws IOException {
            diff("A-001-broken.diff", "--- a/src/A.java\n+++ b/src/A.java\n@@ nonsense @@\n");
            diff("X-001.diff", NARROWING_DIFF);

            IngestResult result = bridge.ingest(root, bridge.readDiffs(diffDir), registry, change, NOW);

            assertEquals(2, result.entries().size());
            assertEquals(IngestOutcome.REJECTED, result.entries().get(0).outcome());
            assertEquals(IngestOutcome.ACCEPTED, result.entries().get(1).outcome());
        }
    }
}
