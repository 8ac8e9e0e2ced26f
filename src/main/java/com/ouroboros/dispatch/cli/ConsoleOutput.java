package com.ouroboros.dispatch.cli;

import com.ouroboros.core.model.ImprovementResult;
import com.ouroboros.core.model.PublishOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Ouroboros CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OUROBOROS v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OUROBOROS]|@ " + message));
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

    public static void result(ImprovementResult result) {
        String stage = switch (result.stage()) {
            case DONE -> "@|fg(green),bold [DONE]|@";
            case REJECTED -> "@|fg(yellow) [REJECTED]|@";
            case ROLLED_BACK -> "@|fg(yellow),bold [ROLLED_BACK]|@";
            case ROLLBACK_FAILED -> "@|fg(red),bold [ROLLBACK_FAILED]|@";
            default -> "@|fg(red) [" + result.stage() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                stage + " " + result.opportunityId() + ": " + result.message()));
        if (result.snapshotId() != null) {
            System.out.println("  snapshot: " + result.snapshotId());
        }
        PublishOutcome publish = result.publish();
        if (publish != null && publish.commitId() != null) {
            System.out.println("  commit:   " + publish.commitId() + (publish.pushed() ? " (pushed)" : " (local)"));
        }
    }
}
