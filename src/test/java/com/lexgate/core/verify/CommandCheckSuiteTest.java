package com.lexgate.core.verify;

import com.lexgate.core.config.LexgateProperties;
import com.lexgate.core.config.LexgateProperties.CheckCommand;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandCheckSuiteTest {

    @TempDir
    Path tempDir;

    private static CheckCommand sh(String name, String script) {
        return new CheckCommand(name, List.of("sh", "-c", script));
    }

    private static CommandCheckSuite suite(CheckCommand... commands) {
        var properties = new LexgateProperties();
        properties.getVerify().setCommands(List.of(commands));
        return new CommandCheckSuite(properties);
    }

    @Test
    void passingCommand() {
        List<CheckOutcome> outcomes = suite(sh("style", "echo ok")).run(tempDir, Duration.ofSeconds(10));

        assertEquals(1, outcomes.size());
        assertEquals(VerifyStatus.PASS, outcomes.get(0).status());
        assertEquals(0, outcomes.get(0).exitCode());
        assertEquals("ok\n", outcomes.get(0).output());
    }

    @Test
    void runsInsideTheTree() {
        CheckOutcome outcome = suite(sh("pwd", "test -f marker || touch marker; ls marker"))
                .run(tempDir, Duration.ofSeconds(10)).get(0);

        assertEquals(VerifyStatus.PASS, outcome.status());
        assertTrue(tempDir.resolve("marker").toFile().exists());
    }

    @Test
    void failingCommandStopsTheSuite() {
        List<CheckOutcome> outcomes = suite(
                sh("compile", "echo broken >&2; exit 3"),
                sh("test", "echo never"))
                .run(tempDir, Duration.ofSeconds(10));

        assertEquals(1, outcomes.size());
        assertEquals(VerifyStatus.FAIL, outcomes.get(0).status());
        assertEquals(3, outcomes.get(0).exitCode());
        assertTrue(outcomes.get(0).output().contains("broken"));
    }

    @Test
    void outputThatIsNotUtf8IsKept() {
        CheckOutcome outcome = suite(sh("compile", "printf '\\377\\376broken'; exit 1"))
                .run(tempDir, Duration.ofSeconds(10)).get(0);

        assertEquals(VerifyStatus.FAIL, outcome.status());
        assertTrue(outcome.output().endsWith("broken"));
        assertTrue(outcome.output().contains("\uFFFD"));
    }

    @Test
    void slowCommandTimesOut() {
        CheckOutcome outcome = suite(sh("test", "sleep 30")).run(tempDir, Duration.ofMillis(300)).get(0);

        assertEquals(VerifyStatus.TIMEOUT, outcome.status());
        assertEquals(-1, outcome.exitCode());
    }

    @Test
    void missingExecutableFails() {
        var command = new CheckCommand("ghost", List.of("lexgate-no-such-binary"));

        CheckOutcome outcome = suite(command).run(tempDir, Duration.ofSeconds(5)).get(0);

        assertEquals(VerifyStatus.FAIL, outcome.status());
        assertTrue(outcome.output().startsWith("cannot run"));
    }
}
