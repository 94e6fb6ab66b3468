package com.conclave.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "conclave")
public class ConclaveProperties {

    private Execution execution = new Execution();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Workspace workspace = new Workspace();
    private Analysis analysis = new Analysis();
    private Checkpoint checkpoint = new Checkpoint();
    private Executor executor = new Executor();

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public CircuitBreaker getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreaker circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }
    public Checkpoint getCheckpoint() { return checkpoint; }
    public void setCheckpoint(Checkpoint checkpoint) { this.checkpoint = checkpoint; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public static class Execution {
        private int maxParallel = 4;
        private int taskTimeoutSeconds = 1800;
        private long pollIntervalMillis = 500;
        private int maxAttempts = 3;
        private long backoffBaseMillis = 2000;
        private long backoffMaxMillis = 60000;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
        public long getPollIntervalMillis() { return pollIntervalMillis; }
        public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBackoffBaseMillis() { return backoffBaseMillis; }
        public void setBackoffBaseMillis(long backoffBaseMillis) { this.backoffBaseMillis = backoffBaseMillis; }
        public long getBackoffMaxMillis() { return backoffMaxMillis; }
        public void setBackoffMaxMillis(long backoffMaxMillis) { this.backoffMaxMillis = backoffMaxMillis; }

        public Duration taskTimeout() { return Duration.ofSeconds(taskTimeoutSeconds); }
        public Duration pollInterval() { return Duration.ofMillis(pollIntervalMillis); }
    }

    public static class CircuitBreaker {
        private double failureRateThreshold = 0.5;
        private int windowSeconds = 300;
        private int minimumAttempts = 4;
        private int coolDownSeconds = 120;

        public double getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(double failureRateThreshold) { this.failureRateThreshold = failureRateThreshold; }
        public int getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(int windowSeconds) { this.windowSeconds = windowSeconds; }
        public int getMinimumAttempts() { return minimumAttempts; }
        public void setMinimumAttempts(int minimumAttempts) { this.minimumAttempts = minimumAttempts; }
        public int getCoolDownSeconds() { return coolDownSeconds; }
        public void setCoolDownSeconds(int coolDownSeconds) { this.coolDownSeconds = coolDownSeconds; }
    }

    public static class Workspace {
        private String repository = ".";
        private String root = ".worktrees";
        private String baseRef = "HEAD";
        private String branchPrefix = "conclave/";
        private boolean commitResults = true;

        public String getRepository() { return repository; }
        public void setRepository(String repository) { this.repository = repository; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getBaseRef() { return baseRef; }
        public void setBaseRef(String baseRef) { this.baseRef = baseRef; }
        public String getBranchPrefix() { return branchPrefix; }
        public void setBranchPrefix(String branchPrefix) { this.branchPrefix = branchPrefix; }
        public boolean isCommitResults() { return commitResults; }
        public void setCommitResults(boolean commitResults) { this.commitResults = commitResults; }
    }

    public static class Analysis {
        private double decompositionThreshold = 7.0;
        private int maxDecompositionDepth = 2;
        private int maxGroupSize = 0;
        private List<String> highRiskKeywords = new ArrayList<>(List.of(
                "migration", "refactor", "security", "schema", "concurrency",
                "database", "authentication", "breaking", "rewrite", "architecture"));

        public double getDecompositionThreshold() { return decompositionThreshold; }
        public void setDecompositionThreshold(double decompositionThreshold) { this.decompositionThreshold = decompositionThreshold; }
        public int getMaxDecompositionDepth() { return maxDecompositionDepth; }
        public void setMaxDecompositionDepth(int maxDecompositionDepth) { this.maxDecompositionDepth = maxDecompositionDepth; }
        public int getMaxGroupSize() { return maxGroupSize; }
        public void setMaxGroupSize(int maxGroupSize) { this.maxGroupSize = maxGroupSize; }
        public List<String> getHighRiskKeywords() { return highRiskKeywords; }
        public void setHighRiskKeywords(List<String> highRiskKeywords) { this.highRiskKeywords = highRiskKeywords; }
    }

    public static class Checkpoint {
        private String directory = ".conclave/runs";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Executor {
        private String strategy = "local";
        private List<String> command = new ArrayList<>(List.of("sh", "-c", "cat \"$CONCLAVE_TASK_FILE\""));
        private String image = "alpine:3.19";
        private int memoryLimitMb = 2048;
        private int cpuCount = 1;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuCount() { return cpuCount; }
        public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    }
}
