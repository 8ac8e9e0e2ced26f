package com.ouroboros.dispatch.cli;

import com.ouroboros.core.analysis.OpportunityAnalyzer;
import com.ouroboros.core.model.ImprovementOpportunity;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: ouroboros opportunities
 * <p>
 * Runs the analyzer over the recorded history and lists what it found, highest
 * priority first. Read-only.
 */
@Command(name = "opportunities", mixinStandardHelpOptions = true,
        description = "List current improvement opportunities")
@Component
public class OpportunitiesCommand implements Runnable {

    private final OpportunityAnalyzer analyzer;

    public OpportunitiesCommand(OpportunityAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<ImprovementOpportunity> opportunities = analyzer.analyze();
        if (opportunities.isEmpty()) {
            ConsoleOutput.info("No improvement opportunities found.");
            return;
        }

        ConsoleOutput.info("Opportunities (" + opportunities.size() + "):");
        System.out.println();
        System.out.printf("  %-20s %-18s %-4s %s%n", "ID", "TYPE", "PRI", "DESCRIPTION");
        System.out.println("  " + "-".repeat(76));
        for (ImprovementOpportunity o : opportunities) {
            System.out.printf("  %-20s %-18s %-4d %s%n", o.id(), o.type(), o.priority(), truncate(o.description(), 60));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
