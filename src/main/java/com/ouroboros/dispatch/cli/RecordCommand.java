package com.ouroboros.dispatch.cli;

import com.ouroboros.core.history.ActivityRecorder;
import com.ouroboros.core.model.TaskRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * CLI command: ouroboros record --request "&lt;text&gt;" [--tools a,b] [--error "&lt;text&gt;"] [--duration-ms N]
 * <p>
 * Records one completed agent task. A task with {@code --error} is recorded as failed.
 */
@Command(name = "record", mixinStandardHelpOptions = true, description = "Record a completed agent task")
@Component
public class RecordCommand implements Runnable {

    @Option(names = {"--id"}, description = "Task id (default: random)")
    private String taskId;

    @Option(names = {"--request", "-r"}, required = true, description = "Original request text")
    private String request;

    @Option(names = {"--tools", "-t"}, split = ",", description = "Tools used, in order")
    private List<String> tools;

    @Option(names = {"--error", "-e"}, description = "Error message; marks the task as failed")
    private String error;

    @Option(names = {"--duration-ms", "-d"}, defaultValue = "0", description = "Duration in milliseconds")
    private long durationMs;

    private final ActivityRecorder recorder;
    private final Clock clock;

    public RecordCommand(ActivityRecorder recorder, Clock clock) {
        this.recorder = recorder;
        this.clock = clock;
    }

    @Override
    public void run() {
        String id = taskId != null ? taskId : UUID.randomUUID().toString();
        var record = new TaskRecord(id, request, tools, error == null, error, durationMs, clock.instant());
        recorder.record(record);
        ConsoleOutput.success("Recorded task " + id + (record.success() ? "" : " (failed)")
                + "; history holds " + recorder.size() + " task(s)");
    }
}
