package com.ouroboros.dispatch.cli;

import com.ouroboros.core.history.ActivityRecorder;
import com.ouroboros.core.model.ImprovementResult;
import com.ouroboros.core.model.TaskRecord;
import com.ouroboros.core.scheduler.ResultLog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: ouroboros history
 * <p>
 * Shows the newest improvement results from the result log, or with
 * {@code --tasks} the newest recorded agent tasks.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent improvement attempts")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    @Option(names = {"--tasks"}, description = "Show recorded agent tasks instead of improvement results")
    private boolean tasks;

    private final ResultLog resultLog;
    private final ActivityRecorder recorder;

    public HistoryCommand(ResultLog resultLog, ActivityRecorder recorder) {
        this.resultLog = resultLog;
        this.recorder = recorder;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (tasks) {
            printTasks();
        } else {
            printResults();
        }
    }

    private void printResults() {
        List<ImprovementResult> results = resultLog.recent(limit);
        if (results.isEmpty()) {
            ConsoleOutput.info("No improvement attempts recorded.");
            return;
        }
        ConsoleOutput.info("Improvement attempts (newest first, " + results.size() + "):");
        System.out.println();
        System.out.printf("  %-22s %-20s %-16s %s%n", "TIME", "OPPORTUNITY", "STAGE", "MESSAGE");
        System.out.println("  " + "-".repeat(76));
        for (ImprovementResult r : results) {
            System.out.printf("  %-22s %-20s %-16s %s%n", r.timestamp(), r.opportunityId(), r.stage(),
                    truncate(r.message(), 50));
        }
    }

    private void printTasks() {
        List<TaskRecord> history = recorder.history();
        if (history.isEmpty()) {
            ConsoleOutput.info("No tasks recorded.");
            return;
        }
        List<TaskRecord> display = history.subList(0, Math.min(limit, history.size()));
        ConsoleOutput.info("Tasks (" + display.size() + " of " + history.size() + "):");
        System.out.println();
        System.out.printf("  %-22s %-6s %-8s %s%n", "TIME", "OK", "MS", "REQUEST");
        System.out.println("  " + "-".repeat(76));
        for (TaskRecord t : display) {
            System.out.printf("  %-22s %-6s %-8d %s%n", t.timestamp(), t.success() ? "yes" : "no", t.durationMs(),
                    truncate(t.userRequest(), 40));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
