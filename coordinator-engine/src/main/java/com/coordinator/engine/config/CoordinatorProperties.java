package com.coordinator.engine.config;

import com.coordinator.core.model.TaskStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration, bound from the {@code coordinator.*} namespace.
 * Defaults here are the production defaults; application.yml only overrides.
 */
@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorProperties {

    private final Store store = new Store();
    private final Pipeline pipeline = new Pipeline();
    private final Liveness liveness = new Liveness();
    private final Notification notification = new Notification();
    private final Gate gate = new Gate();
    private final State state = new State();
    private final Ci ci = new Ci();
    private final Monitor monitor = new Monitor();

    public Store getStore() {
        return store;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public Liveness getLiveness() {
        return liveness;
    }

    public Notification getNotification() {
        return notification;
    }

    public Gate getGate() {
        return gate;
    }

    public State getState() {
        return state;
    }

    public Ci getCi() {
        return ci;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public static class Store {
        /** memory or jdbc */
        private String type = "memory";
        private String keyPrefix = "";
        private int retryMaxAttempts = 3;
        private Duration retryInitialBackoff = Duration.ofMillis(50);
        private Duration retryMaxBackoff = Duration.ofSeconds(2);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public int getRetryMaxAttempts() {
            return retryMaxAttempts;
        }

        public void setRetryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = retryMaxAttempts;
        }

        public Duration getRetryInitialBackoff() {
            return retryInitialBackoff;
        }

        public void setRetryInitialBackoff(Duration retryInitialBackoff) {
            this.retryInitialBackoff = retryInitialBackoff;
        }

        public Duration getRetryMaxBackoff() {
            return retryMaxBackoff;
        }

        public void setRetryMaxBackoff(Duration retryMaxBackoff) {
            this.retryMaxBackoff = retryMaxBackoff;
        }
    }

    public static class Pipeline {
        private int maxRetries = 3;
        private List<String> nonRetryableReasons = new ArrayList<>();
        private Duration claimTimeout = Duration.ofSeconds(30);
        private Duration stuckMaxAge = Duration.ofMinutes(30);
        private Duration recoveryInterval = Duration.ofMinutes(1);
        private Duration handoffGrace = Duration.ofMinutes(1);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public List<String> getNonRetryableReasons() {
            return nonRetryableReasons;
        }

        public void setNonRetryableReasons(List<String> nonRetryableReasons) {
            this.nonRetryableReasons = nonRetryableReasons;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }

        public Duration getStuckMaxAge() {
            return stuckMaxAge;
        }

        public void setStuckMaxAge(Duration stuckMaxAge) {
            this.stuckMaxAge = stuckMaxAge;
        }

        public Duration getRecoveryInterval() {
            return recoveryInterval;
        }

        public void setRecoveryInterval(Duration recoveryInterval) {
            this.recoveryInterval = recoveryInterval;
        }

        public Duration getHandoffGrace() {
            return handoffGrace;
        }

        public void setHandoffGrace(Duration handoffGrace) {
            this.handoffGrace = handoffGrace;
        }
    }

    public static class Liveness {
        private Duration activeThreshold = Duration.ofSeconds(60);
        private Duration idleThreshold = Duration.ofSeconds(300);
        private Duration pollInterval = Duration.ofSeconds(30);

        public Duration getActiveThreshold() {
            return activeThreshold;
        }

        public void setActiveThreshold(Duration activeThreshold) {
            this.activeThreshold = activeThreshold;
        }

        public Duration getIdleThreshold() {
            return idleThreshold;
        }

        public void setIdleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }
    }

    public static class Notification {
        private String pendingKey = "orchestrator:pending_notifications";
        private int dedupCapacity = 1000;
        private Duration keepAliveInterval = Duration.ofMinutes(10);
        private Duration pollInterval = Duration.ofSeconds(5);
        /** log or tmux */
        private String console = "log";
        private String tmuxTarget = "coordinator:0";

        public String getPendingKey() {
            return pendingKey;
        }

        public void setPendingKey(String pendingKey) {
            this.pendingKey = pendingKey;
        }

        public int getDedupCapacity() {
            return dedupCapacity;
        }

        public void setDedupCapacity(int dedupCapacity) {
            this.dedupCapacity = dedupCapacity;
        }

        public Duration getKeepAliveInterval() {
            return keepAliveInterval;
        }

        public void setKeepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public String getConsole() {
            return console;
        }

        public void setConsole(String console) {
            this.console = console;
        }

        public String getTmuxTarget() {
            return tmuxTarget;
        }

        public void setTmuxTarget(String tmuxTarget) {
            this.tmuxTarget = tmuxTarget;
        }
    }

    public static class Gate {
        private boolean failOpen = true;
        private String artifactPath = "prp_status.json";
        private String sentinel = "[prp-system]";
        private List<TaskStatus> activeStatuses = new ArrayList<>(List.of(TaskStatus.IN_PROGRESS));
        private String completionPattern = "(?i)\\b(complete[sd]?|done|finish(es|ed)?)\\b";

        public boolean isFailOpen() {
            return failOpen;
        }

        public void setFailOpen(boolean failOpen) {
            this.failOpen = failOpen;
        }

        public String getArtifactPath() {
            return artifactPath;
        }

        public void setArtifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
        }

        public String getSentinel() {
            return sentinel;
        }

        public void setSentinel(String sentinel) {
            this.sentinel = sentinel;
        }

        public List<TaskStatus> getActiveStatuses() {
            return activeStatuses;
        }

        public void setActiveStatuses(List<TaskStatus> activeStatuses) {
            this.activeStatuses = activeStatuses;
        }

        public String getCompletionPattern() {
            return completionPattern;
        }

        public void setCompletionPattern(String completionPattern) {
            this.completionPattern = completionPattern;
        }
    }

    public static class State {
        private TaskStatus completionSource = TaskStatus.IN_PROGRESS;

        public TaskStatus getCompletionSource() {
            return completionSource;
        }

        public void setCompletionSource(TaskStatus completionSource) {
            this.completionSource = completionSource;
        }
    }

    public static class Ci {
        private List<String> requiredChecks = new ArrayList<>();
        private String mainlineBranch = "main";
        private Duration freshness = Duration.ofHours(24);
        private String githubApiUrl = "https://api.github.com";
        private String githubRepository;
        private String githubToken;
        private Duration requestTimeout = Duration.ofSeconds(10);

        public List<String> getRequiredChecks() {
            return requiredChecks;
        }

        public void setRequiredChecks(List<String> requiredChecks) {
            this.requiredChecks = requiredChecks;
        }

        public String getMainlineBranch() {
            return mainlineBranch;
        }

        public void setMainlineBranch(String mainlineBranch) {
            this.mainlineBranch = mainlineBranch;
        }

        public Duration getFreshness() {
            return freshness;
        }

        public void setFreshness(Duration freshness) {
            this.freshness = freshness;
        }

        public String getGithubApiUrl() {
            return githubApiUrl;
        }

        public void setGithubApiUrl(String githubApiUrl) {
            this.githubApiUrl = githubApiUrl;
        }

        public String getGithubRepository() {
            return githubRepository;
        }

        public void setGithubRepository(String githubRepository) {
            this.githubRepository = githubRepository;
        }

        public String getGithubToken() {
            return githubToken;
        }

        public void setGithubToken(String githubToken) {
            this.githubToken = githubToken;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }

    public static class Monitor {
        private int scalingThreshold = 20;
        private Duration depthCheckInterval = Duration.ofMinutes(1);
        private Duration progressInterval = Duration.ofMinutes(30);

        public int getScalingThreshold() {
            return scalingThreshold;
        }

        public void setScalingThreshold(int scalingThreshold) {
            this.scalingThreshold = scalingThreshold;
        }

        public Duration getDepthCheckInterval() {
            return depthCheckInterval;
        }

        public void setDepthCheckInterval(Duration depthCheckInterval) {
            this.depthCheckInterval = depthCheckInterval;
        }

        public Duration getProgressInterval() {
            return progressInterval;
        }

        public void setProgressInterval(Duration progressInterval) {
            this.progressInterval = progressInterval;
        }
    }
}
