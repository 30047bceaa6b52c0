package com.reviewgate.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewgate.core.compensation.CompensationGateway;
import com.reviewgate.core.invocation.TaskInvoker;
import com.reviewgate.core.model.PipelineDefinition;
import com.reviewgate.core.repository.PipelineDefinitionRepository;
import com.reviewgate.core.repository.RunStateRepository;
import com.reviewgate.engine.aggregation.ResultAggregator;
import com.reviewgate.engine.compensation.CompensationHandler;
import com.reviewgate.engine.condition.ConditionEvaluator;
import com.reviewgate.engine.condition.PredicateRegistry;
import com.reviewgate.engine.decision.DecisionEngine;
import com.reviewgate.engine.events.LoggingRunEventListener;
import com.reviewgate.engine.events.RunEventPublisher;
import com.reviewgate.engine.execution.BackoffSleeper;
import com.reviewgate.engine.execution.DefinitionValidator;
import com.reviewgate.engine.execution.EngineSettings;
import com.reviewgate.engine.execution.PipelineDefinitionLoader;
import com.reviewgate.engine.execution.PipelineExecutionEngine;
import com.reviewgate.engine.execution.TaskDispatcher;
import com.reviewgate.engine.execution.WavePlanner;
import com.reviewgate.engine.metrics.PipelineMetrics;
import com.reviewgate.engine.persistence.InMemoryPipelineDefinitionRepository;
import com.reviewgate.engine.persistence.InMemoryRunStateRepository;
import com.reviewgate.engine.persistence.jdbc.JdbcRunStateRepository;
import com.reviewgate.engine.service.PipelineRunCoordinator;
import com.reviewgate.engine.service.RunTrigger;
import com.reviewgate.engine.support.ObjectMappers;
import com.reviewgate.recovery.ReconciliationScanner;
import com.reviewgate.recovery.ReconciliationSettings;
import com.reviewgate.worker.HttpCompensationGateway;
import com.reviewgate.worker.HttpTaskInvoker;
import com.reviewgate.worker.LocalTaskInvoker;
import com.reviewgate.worker.LoggingCompensationGateway;
import com.reviewgate.worker.RoutingTaskInvoker;
import com.reviewgate.worker.TaskHandler;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the plain-Java engine, recovery and worker components into the application.
 */
@Configuration
@EnableConfigurationProperties(ReviewGateProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper reviewGateObjectMapper() {
        return ObjectMappers.standard();
    }

    // ========== Definitions ==========

    @Bean
    public PredicateRegistry predicateRegistry() {
        return PredicateRegistry.withDefaults();
    }

    @Bean
    public DefinitionValidator definitionValidator(PredicateRegistry predicates) {
        return new DefinitionValidator(predicates);
    }

    @Bean
    public PipelineDefinitionLoader pipelineDefinitionLoader(
            ObjectMapper objectMapper, DefinitionValidator validator, ReviewGateProperties properties) {
        return new PipelineDefinitionLoader(objectMapper, validator, properties.getDefaults().toPipelineDefaults());
    }

    /**
     * Registry filled from the configured resource patterns. An invalid document fails startup.
     */
    @Bean
    public PipelineDefinitionRepository pipelineDefinitionRepository(
            PipelineDefinitionLoader loader,
            ResourcePatternResolver resolver,
            ReviewGateProperties properties) throws IOException {
        InMemoryPipelineDefinitionRepository repository = new InMemoryPipelineDefinitionRepository();
        for (String location : properties.getPipelines().getLocations()) {
            for (Resource resource : resolver.getResources(location)) {
                try (InputStream in = resource.getInputStream()) {
                    PipelineDefinition definition = loader.load(in, resource.getDescription());
                    repository.save(definition);
                }
            }
        }
        log.info("Registered {} pipeline definition(s)", repository.findAll().size());
        return repository;
    }

    // ========== Run State Store ==========

    @Bean
    @ConditionalOnProperty(prefix = "reviewgate.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public RunStateRepository inMemoryRunStateRepository(Clock clock) {
        log.info("Using in-memory run state store; runs do not survive a restart");
        return new InMemoryRunStateRepository(clock);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "reviewgate.store", name = "type", havingValue = "jdbc")
    public HikariDataSource reviewGateDataSource(ReviewGateProperties properties) {
        ReviewGateProperties.Store store = properties.getStore();
        if (store.getUrl() == null || store.getUrl().isBlank()) {
            throw new IllegalStateException("reviewgate.store.url is required for the jdbc store");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(store.getUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setMaximumPoolSize(store.getMaximumPoolSize());
        config.setPoolName("reviewgate-store");
        return new HikariDataSource(config);
    }

    @Bean
    @ConditionalOnProperty(prefix = "reviewgate.store", name = "type", havingValue = "jdbc")
    public RunStateRepository jdbcRunStateRepository(
            HikariDataSource dataSource, ObjectMapper objectMapper, Clock clock, ReviewGateProperties properties) {
        if (properties.getStore().isInitializeSchema()) {
            new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        }
        log.info("Using JDBC run state store at {}", properties.getStore().getUrl());
        return new JdbcRunStateRepository(new JdbcTemplate(dataSource), objectMapper, clock);
    }

    // ========== Events ==========

    @Bean
    public RunEventPublisher runEventPublisher(PipelineMetrics metrics) {
        return new RunEventPublisher(List.of(new LoggingRunEventListener(), metrics));
    }

    // ========== Invocation ==========

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchPool(ReviewGateProperties properties) {
        return Executors.newFixedThreadPool(properties.getDispatchPoolSize(), namedThreads("reviewgate-dispatch-"));
    }

    /**
     * Agent calls run here, apart from the dispatch pool whose threads wait on them.
     * Unbounded: dispatch parallelism already caps it, and an abandoned call keeps
     * its thread until the agent returns.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService invocationPool() {
        return Executors.newCachedThreadPool(namedThreads("reviewgate-invoke-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService runPool(ReviewGateProperties properties) {
        return Executors.newFixedThreadPool(properties.getRunPoolSize(), namedThreads("reviewgate-run-"));
    }

    /**
     * In-process handlers are every {@link TaskHandler} bean, registered under its bean name.
     */
    @Bean
    public LocalTaskInvoker localTaskInvoker(ObjectMapper objectMapper, ListableBeanFactory beanFactory) {
        LocalTaskInvoker invoker = new LocalTaskInvoker(objectMapper);
        beanFactory.getBeansOfType(TaskHandler.class).forEach(invoker::register);
        return invoker;
    }

    @Bean
    public TaskInvoker taskInvoker(LocalTaskInvoker local, ObjectMapper objectMapper, ReviewGateProperties properties) {
        ReviewGateProperties.Endpoints agents = properties.getAgents();
        HttpClient client = HttpClient.newBuilder().connectTimeout(agents.getConnectTimeout()).build();
        HttpTaskInvoker remote = new HttpTaskInvoker(agents.getEndpoints(), client, objectMapper);
        log.info("Task invoker: {} local handler(s), {} agent endpoint(s)",
            local.taskRefs().size(), agents.getEndpoints().size());
        return new RoutingTaskInvoker(local, remote);
    }

    @Bean
    public CompensationGateway compensationGateway(ObjectMapper objectMapper, ReviewGateProperties properties) {
        ReviewGateProperties.Endpoints compensation = properties.getCompensation();
        if (compensation.getEndpoints().isEmpty()) {
            log.warn("No compensation endpoints configured; compensation actions are only logged");
            return new LoggingCompensationGateway();
        }
        HttpClient client = HttpClient.newBuilder().connectTimeout(compensation.getConnectTimeout()).build();
        return new HttpCompensationGateway(compensation.getEndpoints(), client, objectMapper,
            compensation.getRequestTimeout());
    }

    @Bean
    public TaskDispatcher taskDispatcher(
            TaskInvoker taskInvoker,
            @Qualifier("invocationPool") ExecutorService invocationPool,
            RunEventPublisher events,
            Clock clock) {
        return new TaskDispatcher(taskInvoker, invocationPool, BackoffSleeper.THREAD_SLEEP, events, clock);
    }

    // ========== Engine ==========

    @Bean
    public CompensationHandler compensationHandler(CompensationGateway gateway, RunStateRepository store,
                                                   RunEventPublisher events, Clock clock) {
        return new CompensationHandler(gateway, store, events, clock);
    }

    @Bean
    public PipelineExecutionEngine pipelineExecutionEngine(
            RunStateRepository store,
            PipelineDefinitionRepository definitions,
            PredicateRegistry predicates,
            TaskDispatcher dispatcher,
            @Qualifier("dispatchPool") ExecutorService dispatchPool,
            CompensationHandler compensationHandler,
            RunEventPublisher events,
            ReviewGateProperties properties,
            Clock clock) {
        EngineSettings settings = new EngineSettings(
            properties.getOwnerId(),
            properties.getLeaseDuration(),
            properties.getPolicy().toDecisionPolicy());
        return new PipelineExecutionEngine(
            store,
            definitions,
            new ConditionEvaluator(predicates),
            new WavePlanner(),
            dispatcher,
            dispatchPool,
            new ResultAggregator(),
            new DecisionEngine(),
            compensationHandler,
            events,
            settings,
            clock);
    }

    @Bean
    public RunTrigger runTrigger(
            PipelineDefinitionRepository definitions,
            RunStateRepository store,
            DefinitionValidator validator,
            PipelineExecutionEngine engine,
            @Qualifier("runPool") ExecutorService runPool,
            RunEventPublisher events,
            ReviewGateProperties properties,
            Clock clock) {
        return new PipelineRunCoordinator(definitions, store, validator, engine, runPool, events, clock,
            properties.getRunSla());
    }

    // ========== Reconciliation ==========

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "reviewgate.reconciliation", name = "enabled", havingValue = "true",
        matchIfMissing = true)
    public ReconciliationScanner reconciliationScanner(
            RunStateRepository store,
            PipelineDefinitionRepository definitions,
            PipelineExecutionEngine engine,
            CompensationHandler compensationHandler,
            RunEventPublisher events,
            @Qualifier("runPool") ExecutorService runPool,
            ReviewGateProperties properties,
            Clock clock) {
        ReviewGateProperties.Reconciliation reconciliation = properties.getReconciliation();
        ReconciliationSettings settings = new ReconciliationSettings(
            reconciliation.getInterval(),
            reconciliation.getCompensationGrace(),
            reconciliation.getRetention(),
            reconciliation.getBatchSize());
        return new ReconciliationScanner(store, definitions, engine, compensationHandler, events, runPool,
            settings, clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
