package com.ouroboros.dispatch.cli;

import com.ouroboros.core.history.ActivityRecorder;
import com.ouroboros.core.model.Snapshot;
import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.core.scheduler.ImprovementScheduler;
import com.ouroboros.core.scheduler.SchedulerStatus;
import com.ouroboros.core.snapshot.SnapshotManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: ouroboros status
 * <p>
 * Shows scheduler state, history size, snapshot counts and recent improvement commits.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show pipeline status")
@Component
public class StatusCommand implements Runnable {

    private final ImprovementScheduler scheduler;
    private final ActivityRecorder recorder;
    private final SnapshotManager snapshots;
    private final GitPublisher publisher;

    public StatusCommand(ImprovementScheduler scheduler, ActivityRecorder recorder,
                         SnapshotManager snapshots, GitPublisher publisher) {
        this.scheduler = scheduler;
        this.recorder = recorder;
        this.snapshots = snapshots;
        this.publisher = publisher;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        SchedulerStatus status = scheduler.status();
        System.out.println("Scheduler:        " + (status.running() ? "running" : "stopped")
                + (status.cycleInProgress() ? " (cycle in progress)" : ""));
        System.out.println("Last attempt:     " + (status.lastAttempt() != null ? status.lastAttempt() : "never"));
        System.out.println("Cooldown:         " + (status.cooldownRemainingSeconds() > 0
                ? status.cooldownRemainingSeconds() + "s remaining" : "ready"));
        System.out.println("Recorded tasks:   " + recorder.size());

        List<Snapshot> all = snapshots.list();
        long active = all.stream().filter(s -> s.state() == Snapshot.State.ACTIVE).count();
        System.out.println("Snapshots:        " + all.size() + " (" + active + " active)");

        List<GitPublisher.CommitInfo> commits = publisher.recentImprovementCommits(5);
        if (!commits.isEmpty()) {
            System.out.println();
            System.out.println("Recent improvement commits:");
            for (GitPublisher.CommitInfo c : commits) {
                System.out.println("  " + c.revision() + " " + c.subject());
            }
        }
    }
}
