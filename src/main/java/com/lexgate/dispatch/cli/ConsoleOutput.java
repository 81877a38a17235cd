package com.lexgate.dispatch.cli;

import com.lexgate.core.apply.ApplyConflict;
import com.lexgate.core.model.Finding;
import com.lexgate.core.model.GateDecision;
import com.lexgate.core.verify.CheckOutcome;
import com.lexgate.core.verify.TfVerdict;
import com.lexgate.core.verify.VerifyReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Lexgate CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LEXGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LEXGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void finding(Finding f) {
        String tierColor = switch (f.tier()) {
            case L1 -> "fg(red)";
            case L2 -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + tierColor + " " + f.tier() + "|@ @|bold " + f.tfId() + "|@ "
                        + f.file() + ":" + f.span().startLine() + ":" + f.span().startColumn()
                        + " " + f.message() + (f.resolved() ? " @|fg(green) [fixable]|@" : "")));
    }

    public static void conflict(ApplyConflict conflict) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) [CONFLICT]|@ " + conflict.patch().tfId() + " " + conflict.patch().file()
                        + ": " + conflict.reason()));
    }

    public static void check(CheckOutcome outcome) {
        String status = switch (outcome.status()) {
            case PASS -> "@|fg(green) PASS|@";
            case TIMEOUT -> "@|fg(yellow) TIMEOUT|@";
            default -> "@|fg(red) " + outcome.status() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [CHECK]|@ " + status + " " + outcome.name()
                        + " (" + formatDuration(outcome.durationMs()) + ")"));
    }

    public static void verdict(TfVerdict verdict) {
        String status = switch (verdict.status()) {
            case PASS -> "@|fg(green) PASS|@";
            case WAIVED -> "@|fg(yellow) WAIVED|@";
            default -> "@|fg(red) " + verdict.status() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [TF]|@ " + status + " " + verdict.tfId()
                        + ", " + verdict.files().size() + " file" + (verdict.files().size() != 1 ? "s" : "")));
        for (String failure : verdict.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + failure));
        }
    }

    public static void verifyReport(VerifyReport report) {
        report.checks().forEach(ConsoleOutput::check);
        report.verdicts().forEach(ConsoleOutput::verdict);
        if (report.passed()) {
            success("Verification passed");
        } else {
            error("Verification failed: " + report.summary());
        }
    }

    public static void gate(GateDecision decision) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Gate|@ (tiers " + decision.gatingTiers() + ")"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Findings: " + decision.totalFindings() + " total, " + decision.gatedTier() + " gating, "
                        + decision.inFootprint() + " in " + decision.changedFiles() + " changed file"
                        + (decision.changedFiles() != 1 ? "s" : "")));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Waivers: " + decision.waivers() + " active, " + decision.suppressed() + " suppressed"));
        decision.remainingFindings().forEach(ConsoleOutput::finding);
        if (decision.passed()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green),bold [GATE PASS]|@ nothing left to resolve"));
        } else {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [GATE FAIL]|@ " + decision.remaining() + " unwaived finding"
                            + (decision.remaining() != 1 ? "s" : "")));
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
