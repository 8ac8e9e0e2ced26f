package com.ouroboros.dispatch.cli;

import com.ouroboros.core.model.Snapshot;
import com.ouroboros.core.snapshot.SnapshotManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: ouroboros snapshots [--prune N]
 */
@Command(name = "snapshots", mixinStandardHelpOptions = true, description = "List or prune snapshots")
@Component
public class SnapshotsCommand implements Runnable {

    @Option(names = {"--prune"}, paramLabel = "KEEP",
            description = "Delete content of superseded snapshots beyond the newest KEEP")
    private Integer prune;

    private final SnapshotManager snapshots;

    public SnapshotsCommand(SnapshotManager snapshots) {
        this.snapshots = snapshots;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (prune != null) {
            int pruned = snapshots.prune(prune);
            ConsoleOutput.success("Pruned " + pruned + " snapshot(s)");
            return;
        }

        List<Snapshot> all = snapshots.list();
        if (all.isEmpty()) {
            ConsoleOutput.info("No snapshots.");
            return;
        }
        System.out.printf("  %-30s %-11s %-22s %-5s %s%n", "ID", "STATE", "CREATED", "FILES", "LABEL");
        System.out.println("  " + "-".repeat(86));
        for (Snapshot s : all) {
            System.out.printf("  %-30s %-11s %-22s %-5d %s%n", s.id(), s.state(), s.createdAt(),
                    s.entries().size(), s.label());
        }
    }
}
