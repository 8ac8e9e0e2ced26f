package com.ouroboros.dispatch.cli;

import com.ouroboros.core.scheduler.ImprovementScheduler;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.CountDownLatch;

/**
 * CLI command: ouroboros serve
 * <p>
 * Starts the background scheduler and blocks until the application context is
 * closed (Ctrl+C). Improvement cycles run whenever the host agent is idle.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the improvement scheduler until interrupted")
@Component
public class ServeCommand implements Runnable {

    private final ImprovementScheduler scheduler;
    private final CountDownLatch closed = new CountDownLatch(1);

    public ServeCommand(ImprovementScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        scheduler.start();
        ConsoleOutput.info("Scheduler running. Press Ctrl+C to stop.");
        try {
            closed.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler.stop();
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        closed.countDown();
    }
}
