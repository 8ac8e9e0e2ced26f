package com.ouroboros.core.analysis;

import com.ouroboros.core.config.OuroborosProperties;
import com.ouroboros.core.history.ActivityRecorder;
import com.ouroboros.core.model.ImprovementOpportunity;
import com.ouroboros.core.model.OpportunityType;
import com.ouroboros.core.model.TaskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Mines the task history for improvement opportunities.
 *
 * <p>Four detectors run over a trailing window, in this order: recurring failures,
 * latency outliers, repeated tool sequences, and missing capabilities. The result is
 * sorted by priority (highest first); the sort is stable, so equal priorities keep
 * detection order. Analysis is read-only.
 */
@Service
public class OpportunityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(OpportunityAnalyzer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> MISSING_CAPABILITY_MARKERS = List.of("not found", "not supported");
    private static final int MAX_SAMPLES = 3;

    private final ActivityRecorder recorder;
    private final OuroborosProperties.Analysis settings;
    private final Clock clock;

    public OpportunityAnalyzer(ActivityRecorder recorder, OuroborosProperties properties, Clock clock) {
        this.recorder = recorder;
        this.settings = properties.getAnalysis();
        this.clock = clock;
    }

    /**
     * Analyzes the current history.
     *
     * @return opportunities ordered by priority, highest first
     */
    public List<ImprovementOpportunity> analyze() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.getWindow());
        List<TaskRecord> recent = recorder.history().stream()
                .filter(t -> t.timestamp() != null && t.timestamp().isAfter(cutoff))
                .toList();

        var found = new ArrayList<ImprovementOpportunity>();
        found.addAll(detectFailureClusters(recent, now));
        found.addAll(detectLatencyOutliers(recent, now));
        found.addAll(detectRepeatedPatterns(recent, now));
        found.addAll(detectMissingCapabilities(recent, now));

        found.sort(Comparator.comparingInt(ImprovementOpportunity::priority).reversed());
        log.info("Found {} improvement opportunities in {} recent task(s)", found.size(), recent.size());
        return List.copyOf(found);
    }

    List<ImprovementOpportunity> detectFailureClusters(List<TaskRecord> recent, Instant now) {
        var clusters = new LinkedHashMap<String, List<TaskRecord>>();
        for (TaskRecord task : recent) {
            if (task.success()) continue;
            clusters.computeIfAbsent(normalizeError(task.errorMessage()), k -> new ArrayList<>()).add(task);
        }

        var result = new ArrayList<ImprovementOpportunity>();
        clusters.forEach((key, tasks) -> {
            if (tasks.size() < settings.getMinFailureCluster()) return;
            String error = tasks.get(0).errorMessage() != null ? tasks.get(0).errorMessage() : "unknown";
            var context = new LinkedHashMap<String, Object>();
            context.put(ImprovementOpportunity.CTX_ERROR_MESSAGE, error);
            context.put(ImprovementOpportunity.CTX_OCCURRENCES, tasks.size());
            context.put(ImprovementOpportunity.CTX_SAMPLE_REQUESTS, sampleRequests(tasks));
            context.put(ImprovementOpportunity.CTX_TOOLS_INVOLVED, toolsInvolved(tasks));
            result.add(new ImprovementOpportunity(
                    idFor("fix", key),
                    OpportunityType.FIX_FAILURE,
                    "Fix recurring failure: " + truncate(error, 100),
                    Math.min(10, 5 + tasks.size()),
                    context,
                    now));
        });
        return result;
    }

    List<ImprovementOpportunity> detectLatencyOutliers(List<TaskRecord> recent, Instant now) {
        List<TaskRecord> successful = recent.stream().filter(TaskRecord::success).toList();
        if (successful.size() < settings.getLatencyMinSamples() || successful.isEmpty()) {
            return List.of();
        }
        double mean = successful.stream().mapToLong(TaskRecord::durationMs).average().orElse(0);
        double threshold = mean * settings.getSlowFactor();

        var byTool = new LinkedHashMap<String, List<Long>>();
        for (TaskRecord task : successful) {
            if (task.durationMs() <= threshold) continue;
            for (String tool : task.toolsUsed()) {
                byTool.computeIfAbsent(tool, k -> new ArrayList<>()).add(task.durationMs());
            }
        }

        var result = new ArrayList<ImprovementOpportunity>();
        byTool.forEach((tool, durations) -> {
            if (durations.size() < settings.getMinSlowOccurrences()) return;
            long avg = (long) durations.stream().mapToLong(Long::longValue).average().orElse(0);
            result.add(new ImprovementOpportunity(
                    idFor("optimize", tool),
                    OpportunityType.OPTIMIZE_SPEED,
                    "Optimize slow tool: " + tool,
                    6,
                    Map.of(ImprovementOpportunity.CTX_TOOL_NAME, tool,
                            ImprovementOpportunity.CTX_AVG_DURATION_MS, avg,
                            ImprovementOpportunity.CTX_OCCURRENCES, durations.size()),
                    now));
        });
        return result;
    }

    List<ImprovementOpportunity> detectRepeatedPatterns(List<TaskRecord> recent, Instant now) {
        var sequences = new LinkedHashMap<List<String>, Integer>();
        for (TaskRecord task : recent) {
            if (task.toolsUsed().size() < 2) continue;
            sequences.merge(task.toolsUsed(), 1, Integer::sum);
        }

        var result = new ArrayList<ImprovementOpportunity>();
        sequences.forEach((sequence, count) -> {
            if (count < settings.getMinPatternRepeats()) return;
            String label = String.join(" -> ", sequence.subList(0, Math.min(3, sequence.size())));
            result.add(new ImprovementOpportunity(
                    idFor("automate", String.join(",", sequence)),
                    OpportunityType.AUTOMATE_PATTERN,
                    "Create automation for common pattern: " + label,
                    5,
                    Map.of(ImprovementOpportunity.CTX_TOOL_SEQUENCE, sequence,
                            ImprovementOpportunity.CTX_OCCURRENCES, count),
                    now));
        });
        return result;
    }

    List<ImprovementOpportunity> detectMissingCapabilities(List<TaskRecord> recent, Instant now) {
        var byRequest = new LinkedHashMap<String, List<TaskRecord>>();
        for (TaskRecord task : recent) {
            if (task.success() || !indicatesMissingCapability(task.errorMessage())) continue;
            String key = truncate(task.userRequest().toLowerCase(Locale.ROOT), settings.getRequestKeyLength());
            byRequest.computeIfAbsent(key, k -> new ArrayList<>()).add(task);
        }

        var result = new ArrayList<ImprovementOpportunity>();
        byRequest.forEach((key, tasks) -> {
            if (tasks.size() < settings.getMinCapabilityRequests()) return;
            var context = new LinkedHashMap<String, Object>();
            context.put(ImprovementOpportunity.CTX_SAMPLE_REQUESTS, sampleRequests(tasks));
            context.put(ImprovementOpportunity.CTX_OCCURRENCES, tasks.size());
            context.put(ImprovementOpportunity.CTX_TOOLS_INVOLVED, toolsInvolved(tasks));
            result.add(new ImprovementOpportunity(
                    idFor("capability", key),
                    OpportunityType.NEW_CAPABILITY,
                    "Add new capability for: " + truncate(tasks.get(0).userRequest(), 50),
                    7,
                    context,
                    now));
        });
        return result;
    }

    static boolean indicatesMissingCapability(String errorMessage) {
        if (errorMessage == null) return false;
        String lower = errorMessage.toLowerCase(Locale.ROOT);
        return MISSING_CAPABILITY_MARKERS.stream().anyMatch(lower::contains);
    }

    static String normalizeError(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) return "unknown";
        return WHITESPACE.matcher(errorMessage.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /** Stable across runs: the same grouping key always yields the same id. */
    static String idFor(String prefix, String key) {
        return prefix + "-" + String.format("%08x", key.hashCode());
    }

    private static List<String> sampleRequests(List<TaskRecord> tasks) {
        return tasks.stream().limit(MAX_SAMPLES).map(TaskRecord::userRequest).toList();
    }

    private static List<String> toolsInvolved(List<TaskRecord> tasks) {
        var tools = new LinkedHashSet<String>();
        tasks.forEach(t -> tools.addAll(t.toolsUsed()));
        return List.copyOf(tools);
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
