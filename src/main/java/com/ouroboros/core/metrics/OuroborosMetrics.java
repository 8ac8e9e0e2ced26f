package com.ouroboros.core.metrics;

import com.ouroboros.core.model.PipelineStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the improvement pipeline.
 */
@Service
public class OuroborosMetrics {

    private final MeterRegistry registry;

    public OuroborosMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(PipelineStage stage, long ms) {
        Timer.builder("ouroboros.stage.duration")
                .tag("stage", stage.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCycleDuration(long ms) {
        Timer.builder("ouroboros.cycle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Counts a finished improvement attempt by its terminal stage.
     */
    public void recordResult(PipelineStage terminalStage) {
        Counter.builder("ouroboros.improvements.total")
                .tag("outcome", terminalStage.name())
                .register(registry)
                .increment();
    }

    public void recordRollback(boolean succeeded) {
        Counter.builder("ouroboros.rollbacks.total")
                .tag("result", succeeded ? "restored" : "failed")
                .register(registry)
                .increment();
    }

    public void recordVerification(String backend, boolean passed) {
        Counter.builder("ouroboros.verifications.total")
                .tag("backend", backend)
                .tag("passed", String.valueOf(passed))
                .register(registry)
                .increment();
    }

    public void recordPublish(boolean pushed) {
        Counter.builder("ouroboros.publishes.total")
                .tag("pushed", String.valueOf(pushed))
                .register(registry)
                .increment();
    }

    public void recordTriggerRejected(String reason) {
        Counter.builder("ouroboros.triggers.rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("ouroboros.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
