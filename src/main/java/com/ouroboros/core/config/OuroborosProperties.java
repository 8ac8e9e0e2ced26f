package com.ouroboros.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline configuration bound from {@code ouroboros.*}.
 */
@Component
@ConfigurationProperties(prefix = "ouroboros")
public class OuroborosProperties {

    /** Directory holding task history, snapshots and the result log. */
    private String stateDir = System.getProperty("user.home") + "/.ouroboros";

    /** Root of the monitored source tree the pipeline may modify. */
    private String projectRoot = ".";

    private History history = new History();
    private Analysis analysis = new Analysis();
    private Generation generation = new Generation();
    private Publish publish = new Publish();
    private Scheduler scheduler = new Scheduler();

    public Path stateDirPath() { return Path.of(stateDir).toAbsolutePath().normalize(); }
    public Path projectRootPath() { return Path.of(projectRoot).toAbsolutePath().normalize(); }

    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public History getHistory() { return history; }
    public void setHistory(History history) { this.history = history; }
    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }
    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }
    public Publish getPublish() { return publish; }
    public void setPublish(Publish publish) { this.publish = publish; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class History {
        private int maxEntries = 1000;

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }

    public static class Analysis {
        private Duration window = Duration.ofDays(7);
        private int minFailureCluster = 2;
        private double slowFactor = 3.0;
        private int latencyMinSamples = 10;
        private int minSlowOccurrences = 2;
        private int minPatternRepeats = 3;
        private int minCapabilityRequests = 2;
        private int requestKeyLength = 50;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public int getMinFailureCluster() { return minFailureCluster; }
        public void setMinFailureCluster(int minFailureCluster) { this.minFailureCluster = minFailureCluster; }
        public double getSlowFactor() { return slowFactor; }
        public void setSlowFactor(double slowFactor) { this.slowFactor = slowFactor; }
        public int getLatencyMinSamples() { return latencyMinSamples; }
        public void setLatencyMinSamples(int latencyMinSamples) { this.latencyMinSamples = latencyMinSamples; }
        public int getMinSlowOccurrences() { return minSlowOccurrences; }
        public void setMinSlowOccurrences(int minSlowOccurrences) { this.minSlowOccurrences = minSlowOccurrences; }
        public int getMinPatternRepeats() { return minPatternRepeats; }
        public void setMinPatternRepeats(int minPatternRepeats) { this.minPatternRepeats = minPatternRepeats; }
        public int getMinCapabilityRequests() { return minCapabilityRequests; }
        public void setMinCapabilityRequests(int minCapabilityRequests) { this.minCapabilityRequests = minCapabilityRequests; }
        public int getRequestKeyLength() { return requestKeyLength; }
        public void setRequestKeyLength(int requestKeyLength) { this.requestKeyLength = requestKeyLength; }
    }

    public static class Generation {
        /** Files always included in the generation context, relative to the project root. */
        private List<String> anchorFiles = new ArrayList<>();
        /** Directories searched for sources matching an opportunity's tools. */
        private List<String> toolSourceRoots = new ArrayList<>(List.of("src/main/java"));
        /** Extra protected globs on top of {@code .git/**} and the state directory. */
        private List<String> protectedPaths = new ArrayList<>();
        private int maxTools = 3;
        private int excerptChars = 2000;
        private int contextChars = 12000;

        public List<String> getAnchorFiles() { return anchorFiles; }
        public void setAnchorFiles(List<String> anchorFiles) { this.anchorFiles = anchorFiles; }
        public List<String> getToolSourceRoots() { return toolSourceRoots; }
        public void setToolSourceRoots(List<String> toolSourceRoots) { this.toolSourceRoots = toolSourceRoots; }
        public List<String> getProtectedPaths() { return protectedPaths; }
        public void setProtectedPaths(List<String> protectedPaths) { this.protectedPaths = protectedPaths; }
        public int getMaxTools() { return maxTools; }
        public void setMaxTools(int maxTools) { this.maxTools = maxTools; }
        public int getExcerptChars() { return excerptChars; }
        public void setExcerptChars(int excerptChars) { this.excerptChars = excerptChars; }
        public int getContextChars() { return contextChars; }
        public void setContextChars(int contextChars) { this.contextChars = contextChars; }
    }

    public static class Publish {
        private boolean enabled = true;
        private String remote = "origin";
        /** Branch to push; empty means the current branch. */
        private String branch = "";
        private Duration gitTimeout = Duration.ofSeconds(60);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getRemote() { return remote; }
        public void setRemote(String remote) { this.remote = remote; }
        public String getBranch() { return branch; }
        public void setBranch(String branch) { this.branch = branch; }
        public Duration getGitTimeout() { return gitTimeout; }
        public void setGitTimeout(Duration gitTimeout) { this.gitTimeout = gitTimeout; }
    }

    public static class Scheduler {
        private boolean autoStart = false;
        private Duration idleThreshold = Duration.ofSeconds(300);
        private Duration tickInterval = Duration.ofSeconds(60);
        private Duration cooldown = Duration.ofMinutes(5);
        private int maxImprovementsPerCycle = 3;
        private int maxConsecutiveFailures = 3;
        private Duration suppressionWindow = Duration.ofHours(24);
        private int snapshotRetention = 20;

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
        public Duration getIdleThreshold() { return idleThreshold; }
        public void setIdleThreshold(Duration idleThreshold) { this.idleThreshold = idleThreshold; }
        public Duration getTickInterval() { return tickInterval; }
        public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
        public int getMaxImprovementsPerCycle() { return maxImprovementsPerCycle; }
        public void setMaxImprovementsPerCycle(int maxImprovementsPerCycle) { this.maxImprovementsPerCycle = maxImprovementsPerCycle; }
        public int getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
        public void setMaxConsecutiveFailures(int maxConsecutiveFailures) { this.maxConsecutiveFailures = maxConsecutiveFailures; }
        public Duration getSuppressionWindow() { return suppressionWindow; }
        public void setSuppressionWindow(Duration suppressionWindow) { this.suppressionWindow = suppressionWindow; }
        public int getSnapshotRetention() { return snapshotRetention; }
        public void setSnapshotRetention(int snapshotRetention) { this.snapshotRetention = snapshotRetention; }
    }
}
