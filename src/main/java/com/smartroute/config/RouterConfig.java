package com.smartroute.config;

import com.smartroute.core.accounting.AccountingMonitor;
import com.smartroute.core.accounting.AccountingSink;
import com.smartroute.core.accounting.LoggingAccountingSink;
import com.smartroute.core.anonymize.Anonymizer;
import com.smartroute.core.capability.CapabilityEstimator;
import com.smartroute.core.capability.CapabilityTable;
import com.smartroute.core.capability.ComplexityAnalyzer;
import com.smartroute.core.classifier.KeywordDensityScorer;
import com.smartroute.core.classifier.SensitivityClassifier;
import com.smartroute.core.cost.CostModel;
import com.smartroute.core.cost.PricingTable;
import com.smartroute.core.cost.VenuePricing;
import com.smartroute.core.engine.SmartRouter;
import com.smartroute.core.events.EventBus;
import com.smartroute.core.execution.BackendRegistry;
import com.smartroute.core.execution.ChatClientBackend;
import com.smartroute.core.execution.ExecutionBackend;
import com.smartroute.core.execution.HybridBackend;
import com.smartroute.core.execution.VenueExecutor;
import com.smartroute.core.metrics.RouterMetrics;
import com.smartroute.core.model.Venue;
import com.smartroute.core.policy.DecisionTable;
import com.smartroute.core.policy.PolicyDecisionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Builds the routing pipeline from {@link RouterProperties}. Every table is
 * constructed once here and is immutable afterwards.
 */
@Configuration
public class RouterConfig {

    private static final Logger log = LoggerFactory.getLogger(RouterConfig.class);

    @Bean
    public SensitivityClassifier sensitivityClassifier(RouterProperties properties) {
        var weights = properties.getClassifier();
        return new SensitivityClassifier(new KeywordDensityScorer(),
                weights.getRuleWeight(), weights.getHeuristicWeight());
    }

    @Bean
    public CapabilityEstimator capabilityEstimator(RouterProperties properties) {
        var extra = new LinkedHashMap<String, CapabilityTable.Entry>();
        properties.getCapability().getTasks().forEach((taskType, task) ->
                extra.put(taskType, new CapabilityTable.Entry(task.getComplexity(), task.getBaseScore())));
        CapabilityTable table = CapabilityTable.defaults().withEntries(extra);
        log.info("Capability table loaded with {} task types", table.size());
        return new CapabilityEstimator(table, new ComplexityAnalyzer());
    }

    @Bean
    public PricingTable pricingTable(RouterProperties properties) {
        var p = properties.getPricing();
        var prices = new EnumMap<Venue, VenuePricing>(Venue.class);
        prices.put(Venue.LOCAL, new VenuePricing(0, 0, PricingTable.localFixedCost(
                p.getLocalElectricityPerHour(), p.getLocalDepreciationPerHour(), p.getLocalSecondsPerCall())));
        prices.put(Venue.CLOUD_DIRECT, new VenuePricing(p.getCloudInputPer1k(), p.getCloudOutputPer1k(), 0));
        prices.put(Venue.CLOUD_ANONYMIZED,
                new VenuePricing(p.getCloudInputPer1k(), p.getCloudOutputPer1k(), p.getAnonymizationFee()));
        return new PricingTable(prices, p.getHybridCloudShare(), p.getOutputMultiplier());
    }

    @Bean
    public CostModel costModel(PricingTable pricingTable) {
        return new CostModel(pricingTable);
    }

    @Bean
    public PolicyDecisionMatrix policyDecisionMatrix() {
        return new PolicyDecisionMatrix(DecisionTable.defaults());
    }

    @Bean
    public Anonymizer anonymizer() {
        return new Anonymizer();
    }

    @Bean
    public BackendRegistry backendRegistry(RouterProperties properties) {
        var config = properties.getBackends();
        Duration timeout = properties.getExecution().getAttemptTimeout();
        var backends = new EnumMap<Venue, ExecutionBackend>(Venue.class);

        ExecutionBackend local = config.getLocal().isUsable() ? chatBackend("local", config.getLocal(), timeout) : null;
        ExecutionBackend cloud = config.getCloud().isUsable() ? chatBackend("cloud", config.getCloud(), timeout) : null;
        if (local != null) {
            backends.put(Venue.LOCAL, local);
        }
        if (cloud != null) {
            backends.put(Venue.CLOUD_DIRECT, cloud);
            backends.put(Venue.CLOUD_ANONYMIZED, cloud);
        }
        if (local != null && cloud != null && config.getHybrid().isEnabled()) {
            backends.put(Venue.HYBRID, new HybridBackend(local, cloud, config.getHybrid().getLocalShare()));
        }
        log.info("Execution backends registered for venues {}", backends.keySet());
        return new BackendRegistry(backends);
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("analysisPool")
    public ExecutorService analysisPool(RouterProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getExecution().getPoolSize()),
                new CustomizableThreadFactory("smartroute-analysis-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("requestPool")
    public ExecutorService requestPool() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("smartroute-exec-"));
    }

    @Bean
    public VenueExecutor venueExecutor(BackendRegistry backendRegistry, Anonymizer anonymizer,
                                       @Qualifier("requestPool") ExecutorService requestPool,
                                       RouterProperties properties) {
        var execution = properties.getExecution();
        return new VenueExecutor(backendRegistry, anonymizer, requestPool,
                execution.getAttemptTimeout(), execution.getOverallDeadline());
    }

    @Bean
    public AccountingMonitor accountingMonitor(RouterProperties properties) {
        var accounting = properties.getAccounting();
        var sinks = new ArrayList<AccountingSink>();
        if (accounting.isLogSink()) {
            sinks.add(new LoggingAccountingSink());
        }
        return new AccountingMonitor(Clock.systemUTC(), accounting.getWindow(),
                accounting.getMaxWindowEntries(), sinks);
    }

    @Bean
    public SmartRouter smartRouter(SensitivityClassifier classifier, CapabilityEstimator estimator,
                                   CostModel costModel, PolicyDecisionMatrix matrix, VenueExecutor executor,
                                   AccountingMonitor accounting, RouterProperties properties,
                                   @Qualifier("analysisPool") ExecutorService analysisPool,
                                   @Qualifier("requestPool") ExecutorService requestPool,
                                   @Autowired(required = false) RouterMetrics metrics,
                                   @Autowired(required = false) EventBus eventBus) {
        return new SmartRouter(classifier, estimator, costModel, matrix, executor, accounting,
                properties.getRouting().toPreferences(), analysisPool, requestPool, metrics, eventBus);
    }

    /**
     * HTTP request factory whose connect and read timeouts match the per-attempt
     * timeout, so a stalled backend releases its worker thread.
     */
    static ClientHttpRequestFactory requestFactory(Duration timeout) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    private static ExecutionBackend chatBackend(String name, RouterProperties.Backend backend, Duration timeout) {
        var api = OpenAiApi.builder()
                .baseUrl(backend.getBaseUrl())
                .apiKey(backend.getApiKey())
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory(timeout)))
                .build();
        var chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(backend.getModel()).build())
                .build();
        log.info("Chat backend '{}' -> {} ({}, timeout {}ms)", name, backend.getBaseUrl(), backend.getModel(),
                timeout.toMillis());
        return new ChatClientBackend(name, ChatClient.create(chatModel), backend.getQuality());
    }
}
