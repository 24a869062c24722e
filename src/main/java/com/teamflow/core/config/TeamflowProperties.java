package com.teamflow.core.config;

import com.teamflow.core.model.Priority;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * All tunables of the coordination core, bound from {@code teamflow.*}.
 * Every threshold the algorithms use lives here with its documented default.
 */
@Component
@ConfigurationProperties(prefix = "teamflow")
public class TeamflowProperties {

    private boolean enabled = false;
    private Scoring scoring = new Scoring();
    private Balancer balancer = new Balancer();
    private Coordinator coordinator = new Coordinator();
    private Review review = new Review();
    private Stall stall = new Stall();
    private Sync sync = new Sync();
    private Store store = new Store();
    private List<AgentDefinition> agents = new ArrayList<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Balancer getBalancer() { return balancer; }
    public void setBalancer(Balancer balancer) { this.balancer = balancer; }
    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Review getReview() { return review; }
    public void setReview(Review review) { this.review = review; }
    public Stall getStall() { return stall; }
    public void setStall(Stall stall) { this.stall = stall; }
    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public List<AgentDefinition> getAgents() { return agents; }
    public void setAgents(List<AgentDefinition> agents) { this.agents = agents; }

    /**
     * One worker agent registered at startup, e.g.
     * {@code teamflow.agents[0].id=alice}, {@code teamflow.agents[0].capabilities=lang:java,jwt}.
     */
    public static class AgentDefinition {
        private String id;
        private String type = "coder";
        private List<String> capabilities = new ArrayList<>();
        private Integer maxConcurrentTasks;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public Integer getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(Integer maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
    }

    public static class Scoring {
        private int capabilityWeight = 40;
        private int performanceWeight = 20;
        private int availabilityWeight = 20;
        private int specializationWeight = 10;
        private int experienceWeight = 10;
        private double minimumScore = 50;

        public int getCapabilityWeight() { return capabilityWeight; }
        public void setCapabilityWeight(int capabilityWeight) { this.capabilityWeight = capabilityWeight; }
        public int getPerformanceWeight() { return performanceWeight; }
        public void setPerformanceWeight(int performanceWeight) { this.performanceWeight = performanceWeight; }
        public int getAvailabilityWeight() { return availabilityWeight; }
        public void setAvailabilityWeight(int availabilityWeight) { this.availabilityWeight = availabilityWeight; }
        public int getSpecializationWeight() { return specializationWeight; }
        public void setSpecializationWeight(int specializationWeight) { this.specializationWeight = specializationWeight; }
        public int getExperienceWeight() { return experienceWeight; }
        public void setExperienceWeight(int experienceWeight) { this.experienceWeight = experienceWeight; }
        public double getMinimumScore() { return minimumScore; }
        public void setMinimumScore(double minimumScore) { this.minimumScore = minimumScore; }
    }

    public static class Balancer {
        private double maxWorkload = 0.9;
        private double underloadThreshold = 0.3;
        private double matchWeight = 0.7;
        private double fairnessWeight = 0.3;
        private int defaultMaxConcurrentTasks = 3;
        private long rebalanceIntervalMs = 300_000;

        public double getMaxWorkload() { return maxWorkload; }
        public void setMaxWorkload(double maxWorkload) { this.maxWorkload = maxWorkload; }
        public double getUnderloadThreshold() { return underloadThreshold; }
        public void setUnderloadThreshold(double underloadThreshold) { this.underloadThreshold = underloadThreshold; }
        public double getMatchWeight() { return matchWeight; }
        public void setMatchWeight(double matchWeight) { this.matchWeight = matchWeight; }
        public double getFairnessWeight() { return fairnessWeight; }
        public void setFairnessWeight(double fairnessWeight) { this.fairnessWeight = fairnessWeight; }
        public int getDefaultMaxConcurrentTasks() { return defaultMaxConcurrentTasks; }
        public void setDefaultMaxConcurrentTasks(int defaultMaxConcurrentTasks) { this.defaultMaxConcurrentTasks = defaultMaxConcurrentTasks; }
        public long getRebalanceIntervalMs() { return rebalanceIntervalMs; }
        public void setRebalanceIntervalMs(long rebalanceIntervalMs) { this.rebalanceIntervalMs = rebalanceIntervalMs; }
    }

    public static class Coordinator {
        private Duration lockTimeout = Duration.ofSeconds(10);
        private int maxClaimAttempts = 3;

        public Duration getLockTimeout() { return lockTimeout; }
        public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
        public int getMaxClaimAttempts() { return maxClaimAttempts; }
        public void setMaxClaimAttempts(int maxClaimAttempts) { this.maxClaimAttempts = maxClaimAttempts; }
    }

    public static class Review {
        private double approvalThreshold = 0.85;
        private double reviewerMinScore = 40;
        private double capabilityOverlap = 0.5;
        private double recentPairPenalty = 0.9;
        private Duration recentPairWindow = Duration.ofHours(24);
        private int maxAttempts = 2;
        private double leadWeight = 3.0;
        private double standardConsensus = 0.6;
        private double criticalConsensus = 0.66;

        public double getApprovalThreshold() { return approvalThreshold; }
        public void setApprovalThreshold(double approvalThreshold) { this.approvalThreshold = approvalThreshold; }
        public double getReviewerMinScore() { return reviewerMinScore; }
        public void setReviewerMinScore(double reviewerMinScore) { this.reviewerMinScore = reviewerMinScore; }
        public double getCapabilityOverlap() { return capabilityOverlap; }
        public void setCapabilityOverlap(double capabilityOverlap) { this.capabilityOverlap = capabilityOverlap; }
        public double getRecentPairPenalty() { return recentPairPenalty; }
        public void setRecentPairPenalty(double recentPairPenalty) { this.recentPairPenalty = recentPairPenalty; }
        public Duration getRecentPairWindow() { return recentPairWindow; }
        public void setRecentPairWindow(Duration recentPairWindow) { this.recentPairWindow = recentPairWindow; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public double getLeadWeight() { return leadWeight; }
        public void setLeadWeight(double leadWeight) { this.leadWeight = leadWeight; }
        public double getStandardConsensus() { return standardConsensus; }
        public void setStandardConsensus(double standardConsensus) { this.standardConsensus = standardConsensus; }
        public double getCriticalConsensus() { return criticalConsensus; }
        public void setCriticalConsensus(double criticalConsensus) { this.criticalConsensus = criticalConsensus; }
    }

    public static class Stall {
        private long intervalMs = 60_000;
        private Duration criticalThreshold = Duration.ofMinutes(15);
        private Duration highThreshold = Duration.ofMinutes(30);
        private Duration mediumThreshold = Duration.ofMinutes(60);
        private Duration lowThreshold = Duration.ofMinutes(120);
        private int errorWindow = 5;
        private double errorRatio = 0.6;
        private double resourceFloor = 0.3;

        public Duration thresholdFor(Priority priority) {
            return switch (priority) {
                case CRITICAL -> criticalThreshold;
                case HIGH -> highThreshold;
                case MEDIUM -> mediumThreshold;
                case LOW -> lowThreshold;
            };
        }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
        public Duration getCriticalThreshold() { return criticalThreshold; }
        public void setCriticalThreshold(Duration criticalThreshold) { this.criticalThreshold = criticalThreshold; }
        public Duration getHighThreshold() { return highThreshold; }
        public void setHighThreshold(Duration highThreshold) { this.highThreshold = highThreshold; }
        public Duration getMediumThreshold() { return mediumThreshold; }
        public void setMediumThreshold(Duration mediumThreshold) { this.mediumThreshold = mediumThreshold; }
        public Duration getLowThreshold() { return lowThreshold; }
        public void setLowThreshold(Duration lowThreshold) { this.lowThreshold = lowThreshold; }
        public int getErrorWindow() { return errorWindow; }
        public void setErrorWindow(int errorWindow) { this.errorWindow = errorWindow; }
        public double getErrorRatio() { return errorRatio; }
        public void setErrorRatio(double errorRatio) { this.errorRatio = errorRatio; }
        public double getResourceFloor() { return resourceFloor; }
        public void setResourceFloor(double resourceFloor) { this.resourceFloor = resourceFloor; }
    }

    public static class Sync {
        private String baseUrl = "https://api.github.com";
        private String owner = "";
        private String repo = "";
        private String token = "";
        private boolean pollEnabled = false;
        private long pollIntervalMs = 60_000;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration requestTimeout = Duration.ofSeconds(10);

        public boolean isConfigured() {
            return !owner.isBlank() && !repo.isBlank();
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }
        public String getRepo() { return repo; }
        public void setRepo(String repo) { this.repo = repo; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public boolean isPollEnabled() { return pollEnabled; }
        public void setPollEnabled(boolean pollEnabled) { this.pollEnabled = pollEnabled; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Store {
        private String type = "memory";
        private Duration defaultTtl;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public Duration getDefaultTtl() { return defaultTtl; }
        public void setDefaultTtl(Duration defaultTtl) { this.defaultTtl = defaultTtl; }
    }
}
