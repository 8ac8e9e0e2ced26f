package com.ouroboros.core.scheduler;

import com.ouroboros.core.events.EventBus;
import com.ouroboros.core.events.ImprovementEvent;
import com.ouroboros.core.generation.ChangeGenerator;
import com.ouroboros.core.generation.ValidationReport;
import com.ouroboros.core.metrics.OuroborosMetrics;
import com.ouroboros.core.model.*;
import com.ouroboros.core.publish.GitPublisher;
import com.ouroboros.core.snapshot.RollbackException;
import com.ouroboros.core.snapshot.SnapshotManager;
import com.ouroboros.sandbox.IsolatedVerifier;
import com.ouroboros.testsupport.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives {@link ImprovementPipeline} against a real {@link SnapshotManager} on a temp
 * project tree, with generation, verification and publishing mocked.
 */
class ImprovementPipelineTest {

    @TempDir
    Path root;

    @TempDir
    Path stateDir;

    private static final String ORIGINAL = "class Fetch { int timeout = 5; }\n";
    private static final String CHANGED = "class Fetch { int timeout = 30; }\n";

    private ChangeGenerator generator;
    private SnapshotManager snapshots;
    private IsolatedVerifier verifier;
    private GitPublisher publisher;
    private ResultLog resultLog;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private ImprovementPipeline pipeline;
    private final List<ImprovementEvent> events = new ArrayList<>();

    private final ImprovementOpportunity opportunity = new ImprovementOpportunity(
            "fix-00c0ffee", OpportunityType.FIX_FAILURE, "Fix recurring failure: timeout", 8, Map.of(),
            java.time.Instant.parse("2026-01-01T00:00:00Z"));

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/Fetch.java"), ORIGINAL);

        clock = MutableClock.at("2026-01-01T00:00:00Z");
        generator = mock(ChangeGenerator.class);
        snapshots = spy(new SnapshotManager(root, stateDir.resolve("snapshots"), clock));
        verifier = mock(IsolatedVerifier.class);
        publisher = mock(GitPublisher.class);
        resultLog = new ResultLog(stateDir.resolve("improvements.jsonl"));
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        pipeline = new ImprovementPipeline(generator, snapshots, verifier, publisher, resultLog, eventBus,
                new OuroborosMetrics(registry), clock);

        when(generator.validate(any())).thenAnswer(inv -> new ValidationReport(true, List.of(), inv.getArgument(0)));
        when(publisher.commitAndPublish(anyString(), anyString(), anyString(), anyList()))
                .thenReturn(new PublishOutcome(true, "abc1234", true, "Pushed to origin/main", null,
                        PushFailure.NONE, List.of("src/Fetch.java"), clock.instant()));
    }

    private Improvement improvement(String script, CodeChange... changes) {
        return new Improvement(opportunity.id(), "Raise fetch timeout", "Longer timeout", List.of(changes), script);
    }

    private static CodeChange modify(String path, String content) {
        return new CodeChange(path, ChangeKind.MODIFY, null, content, "");
    }

    private static VerificationResult verification(boolean passed, int exitCode, boolean timedOut, String error) {
        return new VerificationResult(passed, "", error, exitCode, 10, timedOut, "docker", true);
    }

    private double resultCount(PipelineStage stage) {
        var counter = registry.find("ouroboros.improvements.total").tag("outcome", stage.name()).counter();
        return counter != null ? counter.count() : 0;
    }

    @Nested
    @DisplayName("happy path")
    class HappyPathTests {

        @Test
        @DisplayName("a verified improvement is applied, committed and published")
        void done() throws IOException {
            when(generator.generate(opportunity)).thenReturn(improvement("exit 0", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(eq("exit 0"), anyMap())).thenReturn(verification(true, 0, false, null));

            ImprovementResult result = pipeline.process(opportunity);

            assertTrue(result.success());
            assertEquals(PipelineStage.DONE, result.stage());
            assertEquals(1, result.changesApplied());
            assertTrue(result.pushed());
            assertEquals(CHANGED, Files.readString(root.resolve("src/Fetch.java")));
            assertEquals(Snapshot.State.SUPERSEDED, snapshots.find(result.snapshotId()).orElseThrow().state());
            verify(publisher).commitAndPublish("Raise fetch timeout", "Longer timeout", "fix-00c0ffee",
                    List.of("src/Fetch.java"));
        }

        @Test
        @DisplayName("verification receives the new content of affected files")
        void verificationGetsContent() {
            when(generator.generate(opportunity)).thenReturn(improvement("exit 0", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(anyString(), anyMap())).thenReturn(verification(true, 0, false, null));

            pipeline.process(opportunity);

            verify(verifier).run("exit 0", Map.of("src/Fetch.java", CHANGED));
        }

        @Test
        @DisplayName("no verification script skips the verifier")
        void noScript() {
            when(generator.generate(opportunity)).thenReturn(improvement(null, modify("src/Fetch.java", CHANGED)));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.DONE, result.stage());
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("a push failure after commit is still a success")
        void degradedPublish() {
            when(generator.generate(opportunity)).thenReturn(improvement(null, modify("src/Fetch.java", CHANGED)));
            when(publisher.commitAndPublish(anyString(), anyString(), anyString(), anyList()))
                    .thenReturn(new PublishOutcome(true, "abc1234", false, "Committed locally, push failed",
                            "Could not resolve host", PushFailure.UNREACHABLE, List.of(), clock.instant()));

            ImprovementResult result = pipeline.process(opportunity);

            assertTrue(result.success());
            assertFalse(result.pushed());
            assertTrue(result.message().contains("push failed: UNREACHABLE"));
        }

        @Test
        @DisplayName("a commit failure leaves the change applied with a failed publish outcome")
        void commitFailure() throws IOException {
            when(generator.generate(opportunity)).thenReturn(improvement(null, modify("src/Fetch.java", CHANGED)));
            when(publisher.commitAndPublish(anyString(), anyString(), anyString(), anyList()))
                    .thenReturn(PublishOutcome.failed("git commit failed: hook rejected", List.of(), clock.instant()));

            ImprovementResult result = pipeline.process(opportunity);

            assertTrue(result.success());
            assertFalse(result.publish().success());
            assertEquals(CHANGED, Files.readString(root.resolve("src/Fetch.java")));
        }

        @Test
        @DisplayName("emits stage changes in order and one result event")
        void events() {
            when(generator.generate(opportunity)).thenReturn(improvement(null, modify("src/Fetch.java", CHANGED)));

            pipeline.process(opportunity);

            List<Object> stages = events.stream()
                    .filter(e -> e.eventType().equals(ImprovementEvent.STAGE_CHANGED))
                    .map(e -> e.payload().get("stage"))
                    .toList();
            assertEquals(List.of("GENERATING", "VALIDATING", "SNAPSHOTTING", "APPLYING", "COMMITTING",
                    "PUBLISHING", "DONE"), stages);
            assertEquals(1, events.stream().filter(e -> e.eventType().equals(ImprovementEvent.IMPROVEMENT_RESULT)).count());
        }
    }

    @Nested
    @DisplayName("pre-snapshot failures")
    class RejectedTests {

        @Test
        @DisplayName("no generated improvement is rejected without touching files")
        void nothingGenerated() throws IOException {
            when(generator.generate(opportunity)).thenReturn(null);

            ImprovementResult result = pipeline.process(opportunity);

            assertFalse(result.success());
            assertEquals(PipelineStage.REJECTED, result.stage());
            assertNull(result.snapshotId());
            assertTrue(snapshots.list().isEmpty());
            assertEquals(ORIGINAL, Files.readString(root.resolve("src/Fetch.java")));
        }

        @Test
        @DisplayName("a failed validation is rejected with its errors")
        void validationFails() {
            Improvement candidate = improvement(null, modify(".git/config", "x"));
            when(generator.generate(opportunity)).thenReturn(candidate);
            when(generator.validate(candidate)).thenReturn(
                    new ValidationReport(false, List.of(".git/config: path is protected"), candidate));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.REJECTED, result.stage());
            assertTrue(result.message().contains("path is protected"));
            verify(snapshots, never()).createSnapshot(anyString(), anyList());
        }

        @Test
        @DisplayName("an exception before the snapshot fails cleanly")
        void exceptionBeforeSnapshot() {
            when(generator.generate(opportunity)).thenThrow(new IllegalStateException("boom"));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.FAILED, result.stage());
            assertTrue(result.message().contains("GENERATING"));
            verify(snapshots, never()).rollbackTo(anyString());
        }
    }

    @Nested
    @DisplayName("post-snapshot failures")
    class RollbackTests {

        @Test
        @DisplayName("a failed verification rolls back to the original content")
        void verificationFails() throws IOException {
            when(generator.generate(opportunity)).thenReturn(improvement("exit 1", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(anyString(), anyMap())).thenReturn(verification(false, 1, false, "assertion failed"));

            ImprovementResult result = pipeline.process(opportunity);

            assertFalse(result.success());
            assertEquals(PipelineStage.ROLLED_BACK, result.stage());
            assertEquals(0, result.changesApplied());
            assertTrue(result.message().contains("exit code 1: assertion failed"));
            assertEquals(ORIGINAL, Files.readString(root.resolve("src/Fetch.java")));
            verifyNoInteractions(publisher);
        }

        @Test
        @DisplayName("a verification timeout rolls back")
        void verificationTimesOut() throws IOException {
            when(generator.generate(opportunity)).thenReturn(improvement("sleep 99", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(anyString(), anyMap())).thenReturn(verification(false, -1, true, "timed out after 60s"));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.ROLLED_BACK, result.stage());
            assertTrue(result.message().contains("timed out after 60s"));
            assertEquals(ORIGINAL, Files.readString(root.resolve("src/Fetch.java")));
        }

        @Test
        @DisplayName("a partial apply is rolled back")
        void partialApply() throws IOException {
            Files.writeString(root.resolve("blocker"), "file");
            when(generator.generate(opportunity)).thenReturn(improvement(null,
                    modify("src/Fetch.java", CHANGED),
                    new CodeChange("blocker/child.txt", ChangeKind.CREATE, null, "x", "")));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.ROLLED_BACK, result.stage());
            assertEquals(ORIGINAL, Files.readString(root.resolve("src/Fetch.java")));
        }

        @Test
        @DisplayName("an unexpected exception after the snapshot triggers rollback")
        void unexpectedExceptionAfterSnapshot() throws IOException {
            when(generator.generate(opportunity)).thenReturn(improvement("exit 0", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(anyString(), anyMap())).thenThrow(new IllegalStateException("verifier crashed"));

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.ROLLED_BACK, result.stage());
            assertTrue(result.message().contains("verifier crashed"));
            assertEquals(ORIGINAL, Files.readString(root.resolve("src/Fetch.java")));
        }

        @Test
        @DisplayName("a failed rollback is escalated")
        void rollbackFails() {
            when(generator.generate(opportunity)).thenReturn(improvement("exit 1", modify("src/Fetch.java", CHANGED)));
            when(verifier.run(anyString(), anyMap())).thenReturn(verification(false, 1, false, null));
            doThrow(new RollbackException("snap", "disk full")).when(snapshots).rollbackTo(anyString());

            ImprovementResult result = pipeline.process(opportunity);

            assertEquals(PipelineStage.ROLLBACK_FAILED, result.stage());
            assertTrue(result.message().contains("ROLLBACK FAILED"));
            assertEquals(1.0, registry.find("ouroboros.escalations.total").tag("reason", "rollback_failed")
                    .counter().count());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(ImprovementEvent.ROLLBACK_FAILED)));
        }
    }

    @Test
    @DisplayName("every result is appended to the result log and counted")
    void resultsAreLogged() {
        when(generator.generate(opportunity)).thenReturn(null);

        pipeline.process(opportunity);
        pipeline.process(opportunity);

        assertEquals(2, resultLog.readAll().size());
        assertEquals(PipelineStage.REJECTED, resultLog.readAll().get(0).stage());
        assertEquals(2.0, resultCount(PipelineStage.REJECTED));
    }

    @Test
    @DisplayName("affectedContent skips deletions")
    void affectedContent() {
        var imp = improvement(null,
                modify("a.txt", "A"),
                new CodeChange("b.txt", ChangeKind.DELETE, "old", null, ""));
        assertEquals(Map.of("a.txt", "A"), ImprovementPipeline.affectedContent(imp));
    }
}
