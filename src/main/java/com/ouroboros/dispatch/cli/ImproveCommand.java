package com.ouroboros.dispatch.cli;

import com.ouroboros.core.scheduler.ImprovementScheduler;
import com.ouroboros.core.scheduler.TriggerResponse;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: ouroboros improve [--focus &lt;text&gt;]
 * <p>
 * Manually triggers one improvement, bypassing the idle check but not the cooldown.
 */
@Command(name = "improve", mixinStandardHelpOptions = true,
        description = "Process the top improvement opportunity now")
@Component
public class ImproveCommand implements Runnable {

    @Option(names = {"--focus", "-f"},
            description = "Only consider opportunities whose type, id or description contains this text")
    private String focus;

    private final ImprovementScheduler scheduler;

    public ImproveCommand(ImprovementScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info(focus != null ? "Improving (focus: " + focus + ")..." : "Improving...");

        TriggerResponse response = scheduler.improveNow(focus);
        if (!response.accepted()) {
            ConsoleOutput.error(response.message());
            return;
        }
        if (response.result() == null) {
            ConsoleOutput.info(response.message());
            return;
        }
        ConsoleOutput.result(response.result());
    }
}
