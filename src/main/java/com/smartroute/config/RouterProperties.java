package com.smartroute.config;

import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.PrivacyMode;
import com.smartroute.core.model.RoutingPreferences;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for SmartRoute. Prefix: {@code smartroute}.
 * Read once at startup; the router is built from immutable copies.
 */
@Component
@ConfigurationProperties(prefix = "smartroute")
public class RouterProperties {

    private Routing routing = new Routing();
    private Execution execution = new Execution();
    private Classifier classifier = new Classifier();
    private Pricing pricing = new Pricing();
    private Capability capability = new Capability();
    private Accounting accounting = new Accounting();
    private Backends backends = new Backends();

    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }

    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }

    public Pricing getPricing() { return pricing; }
    public void setPricing(Pricing pricing) { this.pricing = pricing; }

    public Capability getCapability() { return capability; }
    public void setCapability(Capability capability) { this.capability = capability; }

    public Accounting getAccounting() { return accounting; }
    public void setAccounting(Accounting accounting) { this.accounting = accounting; }

    public Backends getBackends() { return backends; }
    public void setBackends(Backends backends) { this.backends = backends; }

    /**
     * Default routing policy; individual requests may override each value.
     */
    public static class Routing {
        private PrivacyMode privacyMode = PrivacyMode.BALANCED;
        private double costPriority = 0.5;
        private double qualityThreshold = 0.6;
        private boolean anonymizationEnabled = true;
        private double maxCloudCostPerRequest = 1.0;

        public PrivacyMode getPrivacyMode() { return privacyMode; }
        public void setPrivacyMode(PrivacyMode privacyMode) { this.privacyMode = privacyMode; }

        public double getCostPriority() { return costPriority; }
        public void setCostPriority(double costPriority) { this.costPriority = costPriority; }

        public double getQualityThreshold() { return qualityThreshold; }
        public void setQualityThreshold(double qualityThreshold) { this.qualityThreshold = qualityThreshold; }

        public boolean isAnonymizationEnabled() { return anonymizationEnabled; }
        public void setAnonymizationEnabled(boolean anonymizationEnabled) { this.anonymizationEnabled = anonymizationEnabled; }

        public double getMaxCloudCostPerRequest() { return maxCloudCostPerRequest; }
        public void setMaxCloudCostPerRequest(double maxCloudCostPerRequest) { this.maxCloudCostPerRequest = maxCloudCostPerRequest; }

        public RoutingPreferences toPreferences() {
            return new RoutingPreferences(privacyMode, costPriority, qualityThreshold,
                    anonymizationEnabled, maxCloudCostPerRequest);
        }
    }

    public static class Execution {
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private Duration overallDeadline = Duration.ofSeconds(90);
        private int poolSize = 8;

        public Duration getAttemptTimeout() { return attemptTimeout; }
        public void setAttemptTimeout(Duration attemptTimeout) { this.attemptTimeout = attemptTimeout; }

        public Duration getOverallDeadline() { return overallDeadline; }
        public void setOverallDeadline(Duration overallDeadline) { this.overallDeadline = overallDeadline; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    }

    /**
     * Blend weights for the rule score and the heuristic score.
     */
    public static class Classifier {
        private double ruleWeight = 0.7;
        private double heuristicWeight = 0.3;

        public double getRuleWeight() { return ruleWeight; }
        public void setRuleWeight(double ruleWeight) { this.ruleWeight = ruleWeight; }

        public double getHeuristicWeight() { return heuristicWeight; }
        public void setHeuristicWeight(double heuristicWeight) { this.heuristicWeight = heuristicWeight; }
    }

    /**
     * Prices in USD. Token prices are per 1K tokens.
     */
    public static class Pricing {
        private double localElectricityPerHour = 0.12;
        private double localDepreciationPerHour = 0.05;
        private double localSecondsPerCall = 2.0;
        private double cloudInputPer1k = 0.03;
        private double cloudOutputPer1k = 0.06;
        private double anonymizationFee = 0.0001;
        private double hybridCloudShare = 0.3;
        private double outputMultiplier = 1.5;

        public double getLocalElectricityPerHour() { return localElectricityPerHour; }
        public void setLocalElectricityPerHour(double v) { this.localElectricityPerHour = v; }

        public double getLocalDepreciationPerHour() { return localDepreciationPerHour; }
        public void setLocalDepreciationPerHour(double v) { this.localDepreciationPerHour = v; }

        public double getLocalSecondsPerCall() { return localSecondsPerCall; }
        public void setLocalSecondsPerCall(double v) { this.localSecondsPerCall = v; }

        public double getCloudInputPer1k() { return cloudInputPer1k; }
        public void setCloudInputPer1k(double v) { this.cloudInputPer1k = v; }

        public double getCloudOutputPer1k() { return cloudOutputPer1k; }
        public void setCloudOutputPer1k(double v) { this.cloudOutputPer1k = v; }

        public double getAnonymizationFee() { return anonymizationFee; }
        public void setAnonymizationFee(double v) { this.anonymizationFee = v; }

        public double getHybridCloudShare() { return hybridCloudShare; }
        public void setHybridCloudShare(double v) { this.hybridCloudShare = v; }

        public double getOutputMultiplier() { return outputMultiplier; }
        public void setOutputMultiplier(double v) { this.outputMultiplier = v; }
    }

    /**
     * Extra or replacement capability table entries, keyed by task type.
     */
    public static class Capability {
        private Map<String, Task> tasks = new LinkedHashMap<>();

        public Map<String, Task> getTasks() { return tasks; }
        public void setTasks(Map<String, Task> tasks) { this.tasks = tasks; }

        public static class Task {
            private ComplexityClass complexity = ComplexityClass.MEDIUM;
            private double baseScore = 0.5;

            public ComplexityClass getComplexity() { return complexity; }
            public void setComplexity(ComplexityClass complexity) { this.complexity = complexity; }

            public double getBaseScore() { return baseScore; }
            public void setBaseScore(double baseScore) { this.baseScore = baseScore; }
        }
    }

    public static class Accounting {
        private Duration window = Duration.ofHours(24);
        private int maxWindowEntries = 10_000;
        private boolean logSink = true;

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }

        public int getMaxWindowEntries() { return maxWindowEntries; }
        public void setMaxWindowEntries(int maxWindowEntries) { this.maxWindowEntries = maxWindowEntries; }

        public boolean isLogSink() { return logSink; }
        public void setLogSink(boolean logSink) { this.logSink = logSink; }
    }

    /**
     * OpenAI-compatible chat endpoints. {@code local} serves the LOCAL venue;
     * {@code cloud} serves both CLOUD_DIRECT and CLOUD_ANONYMIZED. HYBRID is
     * assembled from the two when both are enabled.
     */
    public static class Backends {
        private Backend local = new Backend("http://localhost:11434", "not-needed", "qwen3:8b", 0.75);
        private Backend cloud = new Backend("https://api.openai.com", "", "gpt-4o", 0.9);
        private Hybrid hybrid = new Hybrid();

        public Backend getLocal() { return local; }
        public void setLocal(Backend local) { this.local = local; }

        public Backend getCloud() { return cloud; }
        public void setCloud(Backend cloud) { this.cloud = cloud; }

        public Hybrid getHybrid() { return hybrid; }
        public void setHybrid(Hybrid hybrid) { this.hybrid = hybrid; }
    }

    public static class Backend {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey;
        private String model;
        private double quality;

        public Backend() {}

        Backend(String baseUrl, String apiKey, String model, double quality) {
            this.baseUrl = baseUrl;
            this.apiKey = apiKey;
            this.model = model;
            this.quality = quality;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public double getQuality() { return quality; }
        public void setQuality(double quality) { this.quality = quality; }

        public boolean isUsable() {
            return enabled && baseUrl != null && !baseUrl.isBlank()
                    && apiKey != null && !apiKey.isBlank();
        }
    }

    public static class Hybrid {
        private boolean enabled = true;
        private double localShare = 0.7;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getLocalShare() { return localShare; }
        public void setLocalShare(double localShare) { this.localShare = localShare; }
    }
}
