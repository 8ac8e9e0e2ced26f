package com.ouroboros.dispatch.cli;

import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.core.snapshot.RollbackException;
import com.ouroboros.core.snapshot.SnapshotManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: ouroboros rollback (&lt;snapshot-id&gt; | --last-commit)
 * <p>
 * With a snapshot id, restores the project files captured by that snapshot without
 * touching version control. With {@code --last-commit}, reverts the newest
 * improvement commit through git instead.
 */
@Command(name = "rollback", mixinStandardHelpOptions = true,
        description = "Restore files from a snapshot, or revert the last improvement commit")
@Component
public class RollbackCommand implements Callable<Integer> {

    static class Target {
        @Parameters(index = "0", description = "Snapshot ID")
        String snapshotId;

        @Option(names = "--last-commit", description = "Revert the newest improvement commit with git")
        boolean lastCommit;
    }

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    private final SnapshotManager snapshots;
    private final GitPublisher publisher;

    public RollbackCommand(SnapshotManager snapshots, GitPublisher publisher) {
        this.snapshots = snapshots;
        this.publisher = publisher;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (target.lastCommit) {
            return revertLastCommit();
        }
        try {
            snapshots.rollbackTo(target.snapshotId);
            ConsoleOutput.success("Restored snapshot " + target.snapshotId);
            return 0;
        } catch (RollbackException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private int revertLastCommit() {
        GitPublisher.RevertResult result = publisher.revertLastImprovement();
        if (!result.ok()) {
            ConsoleOutput.error(result.message());
            return 1;
        }
        if (result.pushed()) {
            ConsoleOutput.success(result.message());
        } else {
            ConsoleOutput.warn(result.message());
        }
        return 0;
    }
}
