package com.reviewgate.api.config;

import com.reviewgate.core.model.AggregationMode;
import com.reviewgate.core.model.DecisionPolicy;
import com.reviewgate.core.model.PipelineDefaults;
import com.reviewgate.core.model.RetryPolicy;
import com.reviewgate.core.model.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration under the {@code reviewgate} prefix.
 */
@ConfigurationProperties(prefix = "reviewgate")
public class ReviewGateProperties {

    /** Identity written into run leases. Must differ between processes sharing a store. */
    private String ownerId = "reviewgate-local";

    private Duration leaseDuration = Duration.ofSeconds(30);

    /** Deadline of a run, counted from its creation. */
    private Duration runSla = Duration.ofHours(2);

    /** Threads executing runs. */
    private int runPoolSize = 8;

    /** Threads executing tasks of parallel stages. */
    private int dispatchPoolSize = 16;

    private final Store store = new Store();
    private final Reconciliation reconciliation = new Reconciliation();
    private final Policy policy = new Policy();
    private final Defaults defaults = new Defaults();
    private final Pipelines pipelines = new Pipelines();
    private final Endpoints agents = new Endpoints();
    private final Endpoints compensation = new Endpoints();

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public Duration getRunSla() {
        return runSla;
    }

    public void setRunSla(Duration runSla) {
        this.runSla = runSla;
    }

    public int getRunPoolSize() {
        return runPoolSize;
    }

    public void setRunPoolSize(int runPoolSize) {
        this.runPoolSize = runPoolSize;
    }

    public int getDispatchPoolSize() {
        return dispatchPoolSize;
    }

    public void setDispatchPoolSize(int dispatchPoolSize) {
        this.dispatchPoolSize = dispatchPoolSize;
    }

    public Store getStore() {
        return store;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public Policy getPolicy() {
        return policy;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public Pipelines getPipelines() {
        return pipelines;
    }

    public Endpoints getAgents() {
        return agents;
    }

    public Endpoints getCompensation() {
        return compensation;
    }

    // ========== Nested Sections ==========

    public enum StoreType {
        MEMORY,
        JDBC
    }

    public static class Store {

        private StoreType type = StoreType.MEMORY;
        private String url;
        private String username;
        private String password;
        private int maximumPoolSize = 10;

        /** Run db/schema.sql on startup. The script only creates missing objects. */
        private boolean initializeSchema = true;

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }
    }

    public static class Reconciliation {

        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(30);
        private Duration compensationGrace = Duration.ofMinutes(1);

        /** How long terminal runs are kept. Unset keeps them forever. */
        private Duration retention = Duration.ofDays(30);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getCompensationGrace() {
            return compensationGrace;
        }

        public void setCompensationGrace(Duration compensationGrace) {
            this.compensationGrace = compensationGrace;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    /**
     * Decision policy for pipelines that declare none.
     */
    public static class Policy {

        private Severity blockingSeverity = Severity.HIGH;
        private Map<Severity, Integer> maxCounts = new EnumMap<>(Severity.class);
        private Map<String, Boolean> taskBlockFlags = new LinkedHashMap<>();
        private Set<String> overrideLabels = new LinkedHashSet<>();
        private AggregationMode aggregationMode = AggregationMode.MAX;
        private Map<Severity, Integer> weights = new EnumMap<>(Severity.class);

        public DecisionPolicy toDecisionPolicy() {
            return new DecisionPolicy(blockingSeverity, maxCounts, taskBlockFlags, overrideLabels,
                aggregationMode, weights);
        }

        public Severity getBlockingSeverity() {
            return blockingSeverity;
        }

        public void setBlockingSeverity(Severity blockingSeverity) {
            this.blockingSeverity = blockingSeverity;
        }

        public Map<Severity, Integer> getMaxCounts() {
            return maxCounts;
        }

        public void setMaxCounts(Map<Severity, Integer> maxCounts) {
            this.maxCounts = maxCounts;
        }

        public Map<String, Boolean> getTaskBlockFlags() {
            return taskBlockFlags;
        }

        public void setTaskBlockFlags(Map<String, Boolean> taskBlockFlags) {
            this.taskBlockFlags = taskBlockFlags;
        }

        public Set<String> getOverrideLabels() {
            return overrideLabels;
        }

        public void setOverrideLabels(Set<String> overrideLabels) {
            this.overrideLabels = overrideLabels;
        }

        public AggregationMode getAggregationMode() {
            return aggregationMode;
        }

        public void setAggregationMode(AggregationMode aggregationMode) {
            this.aggregationMode = aggregationMode;
        }

        public Map<Severity, Integer> getWeights() {
            return weights;
        }

        public void setWeights(Map<Severity, Integer> weights) {
            this.weights = weights;
        }
    }

    /**
     * Pipeline defaults for definitions that leave a field unset.
     */
    public static class Defaults {

        private Duration taskTimeout = PipelineDefaults.DEFAULT_TASK_TIMEOUT;
        private int retries = 2;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private int parallelism = PipelineDefaults.DEFAULT_PARALLELISM;
        private boolean failFast = true;
        private Duration waitTimeout = PipelineDefaults.DEFAULT_WAIT_TIMEOUT;

        public PipelineDefaults toPipelineDefaults() {
            RetryPolicy retryPolicy = RetryPolicy.builder()
                .maxAttempts(retries + 1)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .build();
            return new PipelineDefaults(taskTimeout, retryPolicy, parallelism, failFast, waitTimeout);
        }

        public Duration getTaskTimeout() {
            return taskTimeout;
        }

        public void setTaskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public boolean isFailFast() {
            return failFast;
        }

        public void setFailFast(boolean failFast) {
            this.failFast = failFast;
        }

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }
    }

    public static class Pipelines {

        /** Resource patterns of pipeline definition documents loaded at startup. */
        private List<String> locations = new ArrayList<>(List.of("classpath:pipelines/*.json"));

        public List<String> getLocations() {
            return locations;
        }

        public void setLocations(List<String> locations) {
            this.locations = locations;
        }
    }

    /**
     * HTTP endpoints keyed by task reference (agents) or action type (compensation).
     */
    public static class Endpoints {

        private Map<String, URI> endpoints = new HashMap<>();
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public Map<String, URI> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(Map<String, URI> endpoints) {
            this.endpoints = endpoints;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
