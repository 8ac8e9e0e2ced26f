package com.ouroboros.core.scheduler;

import com.ouroboros.core.analysis.OpportunityAnalyzer;
import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.events.EventBus;
import com.ouroboros.core.events.ImprovementEvent;
import com.ouroboros.core.logging.MdcContext;
import com.ouroboros.core.metrics.OuroborosMetrics;
import com.ouroboros.core.model.ImprovementOpportunity;
import com.ouroboros.core.model.ImprovementResult;
import com.ouroboros.core.snapshot.SnapshotManager;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole entry point into the improvement pipeline.
 *
 * <p>A single background thread ticks at a fixed interval; when the host agent has
 * been idle long enough and the cooldown has expired, one bounded cycle runs:
 * analyze, drop suppressed opportunities, process the top few sequentially, and
 * stop early if activity resumes. {@link #improveNow} is the manual trigger; it
 * skips the idleness check but shares the cooldown and the cycle lock.
 */
@Service
public class ImprovementScheduler {

    private static final Logger log = LoggerFactory.getLogger(ImprovementScheduler.class);

    private final OpportunityAnalyzer analyzer;
    private final ImprovementPipeline pipeline;
    private final AttemptTracker attemptTracker;
    private final SnapshotManager snapshots;
    private final EventBus eventBus;
    private final OuroborosMetrics metrics;
    private final OuroborosProperties.Scheduler settings;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile Instant lastActivity;
    private volatile Instant lastAttempt;
    private ScheduledExecutorService executor;

    public ImprovementScheduler(OpportunityAnalyzer analyzer, ImprovementPipeline pipeline,
                                AttemptTracker attemptTracker, SnapshotManager snapshots, ResultLog resultLog,
                                EventBus eventBus, OuroborosMetrics metrics, OuroborosProperties properties,
                                Clock clock) {
        this.analyzer = analyzer;
        this.pipeline = pipeline;
        this.attemptTracker = attemptTracker;
        this.snapshots = snapshots;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = properties.getScheduler();
        this.clock = clock;
        this.lastActivity = clock.instant();
        this.lastAttempt = resultLog.lastAttemptTime().orElse(null);
        if (lastAttempt != null) {
            log.info("Restored last improvement attempt time {}", lastAttempt);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (settings.isAutoStart()) {
            start();
        }
    }

    /**
     * Resets the idle timer. Called by the host whenever the user interacts.
     */
    public void recordActivity() {
        lastActivity = clock.instant();
    }

    public boolean isIdle() {
        return idleFor().compareTo(settings.getIdleThreshold()) >= 0;
    }

    public synchronized void start() {
        if (executor != null) {
            log.debug("Scheduler already running");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ouroboros-scheduler");
            t.setDaemon(true);
            return t;
        });
        long interval = settings.getTickInterval().toMillis();
        executor.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Improvement scheduler started (tick {}s, idle threshold {}s, cooldown {}s)",
                settings.getTickInterval().toSeconds(), settings.getIdleThreshold().toSeconds(),
                settings.getCooldown().toSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Improvement scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /**
     * One scheduler tick: runs a cycle when idle, out of cooldown and no cycle is in flight.
     * Never throws.
     */
    public void tick() {
        try {
            if (!isIdle()) {
                return;
            }
            if (!cooldownRemaining().isZero()) {
                log.debug("Idle but in cooldown ({}s left)", cooldownRemaining().toSeconds());
                return;
            }
            if (!cycleLock.tryLock()) {
                log.debug("Cycle already in progress; skipping tick");
                return;
            }
            try {
                runCycle();
            } finally {
                cycleLock.unlock();
            }
        } catch (RuntimeException e) {
            log.error("Improvement cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one bounded cycle. Callers must hold the cycle lock.
     *
     * @return results of the opportunities processed, in processing order
     */
    List<ImprovementResult> runCycle() {
        String cycleId = "cycle-" + UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setCycle(cycleId);
        long started = clock.millis();
        lastAttempt = clock.instant();
        var results = new ArrayList<ImprovementResult>();
        try {
            eventBus.publish(new ImprovementEvent(ImprovementEvent.CYCLE_STARTED, null,
                    Map.of("cycleId", cycleId), clock.instant()));
            List<ImprovementOpportunity> batch = analyzer.analyze().stream()
                    .filter(o -> !attemptTracker.isSuppressed(o.id()))
                    .limit(settings.getMaxImprovementsPerCycle())
                    .toList();
            log.info("Cycle {} starting with {} opportunity(ies)", cycleId, batch.size());

            for (ImprovementOpportunity opportunity : batch) {
                if (!isIdle()) {
                    log.info("Activity resumed; aborting remaining {} opportunity(ies) in cycle {}",
                            batch.size() - results.size(), cycleId);
                    break;
                }
                results.add(pipeline.process(opportunity));
            }

            try {
                snapshots.prune(settings.getSnapshotRetention());
            } catch (RuntimeException e) {
                log.warn("Snapshot pruning failed: {}", e.getMessage());
            }

            long succeeded = results.stream().filter(ImprovementResult::success).count();
            log.info("Cycle {} complete: {}/{} improvement(s) applied", cycleId, succeeded, results.size());
            var payload = new HashMap<String, Object>();
            payload.put("cycleId", cycleId);
            payload.put("processed", results.size());
            payload.put("succeeded", succeeded);
            eventBus.publish(new ImprovementEvent(ImprovementEvent.CYCLE_COMPLETED, null, payload, clock.instant()));
            return results;
        } finally {
            metrics.recordCycleDuration(clock.millis() - started);
            MdcContext.clear();
        }
    }

    /**
     * Manual trigger. Bypasses the idleness check but shares the cooldown; while a
     * cycle is in flight or the cooldown runs, the request is rejected with the time
     * left. When accepted, processes the single highest-ranked opportunity, optionally
     * restricted by {@code focus} (matched against type, id and description). A
     * failure while analyzing or processing is returned as a failed response and
     * still starts the cooldown.
     */
    public TriggerResponse improveNow(String focus) {
        if (!cycleLock.tryLock()) {
            metrics.recordTriggerRejected("busy");
            return TriggerResponse.rejected("An improvement cycle is already in progress",
                    ceilSeconds(cooldownRemaining()));
        }
        try {
            Duration remaining = cooldownRemaining();
            if (!remaining.isZero()) {
                metrics.recordTriggerRejected("cooldown");
                long seconds = ceilSeconds(remaining);
                log.info("Manual improvement rejected: cooldown active ({}s remaining)", seconds);
                return TriggerResponse.rejected("Cooldown active, retry in " + seconds + "s", seconds);
            }
            lastAttempt = clock.instant();
            MdcContext.setCycle("manual-" + UUID.randomUUID().toString().substring(0, 8));

            List<ImprovementOpportunity> candidates = analyzer.analyze().stream()
                    .filter(o -> matchesFocus(o, focus))
                    .toList();
            if (candidates.isEmpty()) {
                String message = focus == null || focus.isBlank()
                        ? "No improvement opportunities found"
                        : "No improvement opportunities match '" + focus + "'";
                log.info("Manual improvement: {}", message);
                return TriggerResponse.accepted(message, null);
            }
            ImprovementResult result = pipeline.process(candidates.get(0));
            return TriggerResponse.accepted(result.message(), result);
        } catch (RuntimeException e) {
            log.error("Manual improvement failed: {}", e.getMessage(), e);
            return TriggerResponse.failed("Improvement attempt failed: " + e.getMessage(),
                    ceilSeconds(cooldownRemaining()));
        } finally {
            MdcContext.clear();
            cycleLock.unlock();
        }
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(isRunning(), isIdle(), idleFor().toSeconds(), cycleLock.isLocked(),
                ceilSeconds(cooldownRemaining()), lastActivity, lastAttempt);
    }

    Duration cooldownRemaining() {
        Instant last = lastAttempt;
        if (last == null) return Duration.ZERO;
        Duration elapsed = Duration.between(last, clock.instant());
        Duration remaining = settings.getCooldown().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private Duration idleFor() {
        Duration idle = Duration.between(lastActivity, clock.instant());
        return idle.isNegative() ? Duration.ZERO : idle;
    }

    static boolean matchesFocus(ImprovementOpportunity opportunity, String focus) {
        if (focus == null || focus.isBlank()) return true;
        String needle = focus.trim().toLowerCase(Locale.ROOT);
        return opportunity.type().name().toLowerCase(Locale.ROOT).contains(needle.replace('-', '_'))
                || opportunity.id().toLowerCase(Locale.ROOT).contains(needle)
                || opportunity.description().toLowerCase(Locale.ROOT).contains(needle);
    }

    private static long ceilSeconds(Duration d) {
        long millis = d.toMillis();
        return (millis + 999) / 1000;
    }
}
