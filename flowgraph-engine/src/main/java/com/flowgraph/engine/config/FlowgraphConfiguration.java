package com.flowgraph.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowgraph.core.graph.DefinitionRule;
import com.flowgraph.core.graph.GraphValidator;
import com.flowgraph.core.guard.GuardRegistry;
import com.flowgraph.core.guard.TransitionGuard;
import com.flowgraph.core.repository.AuditLedger;
import com.flowgraph.core.repository.InstanceLockManager;
import com.flowgraph.core.repository.WorkflowDefinitionRepository;
import com.flowgraph.core.repository.WorkflowInstanceRepository;
import com.flowgraph.core.time.MonotonicClock;
import com.flowgraph.engine.coordinator.TransitionEngine;
import com.flowgraph.engine.definition.DefinitionRegistry;
import com.flowgraph.engine.health.FlowgraphHealthIndicator;
import com.flowgraph.engine.history.HistoryService;
import com.flowgraph.engine.metrics.WorkflowMetrics;
import com.flowgraph.engine.persistence.InMemoryAuditLedger;
import com.flowgraph.engine.persistence.InMemoryInstanceLockManager;
import com.flowgraph.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.flowgraph.engine.persistence.InMemoryWorkflowInstanceRepository;
import com.flowgraph.engine.persistence.jdbc.JdbcAuditLedger;
import com.flowgraph.engine.persistence.jdbc.JdbcInstanceLockManager;
import com.flowgraph.engine.persistence.jdbc.JdbcWorkflowDefinitionRepository;
import com.flowgraph.engine.persistence.jdbc.JdbcWorkflowInstanceRepository;
import com.flowgraph.engine.service.WorkflowService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.stream.Collectors;

/**
 * Wires the engine. Every bean backs off when the application defines its own.
 *
 * Transition guards and definition rules are collected from the context, so
 * adding a {@link TransitionGuard} or {@link DefinitionRule} bean is all it takes
 * to make it available to definitions. {@link WorkflowMetrics} is a MeterBinder,
 * so Spring Boot binds it to the application's registries.
 */
@AutoConfiguration(after = {JdbcTemplateAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(FlowgraphProperties.class)
public class FlowgraphConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FlowgraphConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public MonotonicClock flowgraphClock() {
        return new MonotonicClock();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }

    @Bean
    @ConditionalOnProperty(prefix = "flowgraph.metrics", name = "application-tag")
    public MeterRegistryCustomizer<MeterRegistry> flowgraphApplicationTag(FlowgraphProperties properties) {
        return registry -> registry.config()
            .commonTags("application", properties.getMetrics().getApplicationTag());
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardRegistry guardRegistry(ObjectProvider<TransitionGuard> guards) {
        return new GuardRegistry(guards.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public GraphValidator graphValidator(ObjectProvider<DefinitionRule> rules, FlowgraphProperties properties) {
        return new GraphValidator(rules.orderedStream().collect(Collectors.toList()),
            properties.getValidation().isReportAll());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefinitionRegistry definitionRegistry(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            GraphValidator graphValidator,
            GuardRegistry guardRegistry,
            WorkflowMetrics workflowMetrics) {
        return new DefinitionRegistry(definitionRepository, instanceRepository,
            graphValidator, guardRegistry, workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean(WorkflowService.class)
    public TransitionEngine transitionEngine(
            DefinitionRegistry definitionRegistry,
            WorkflowInstanceRepository instanceRepository,
            AuditLedger auditLedger,
            InstanceLockManager instanceLockManager,
            GuardRegistry guardRegistry,
            MonotonicClock flowgraphClock,
            WorkflowMetrics workflowMetrics) {
        return new TransitionEngine(definitionRegistry, instanceRepository, auditLedger,
            instanceLockManager, guardRegistry, flowgraphClock, workflowMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryService historyService(
            WorkflowInstanceRepository instanceRepository,
            AuditLedger auditLedger,
            DefinitionRegistry definitionRegistry,
            MonotonicClock flowgraphClock) {
        return new HistoryService(instanceRepository, auditLedger, definitionRegistry, flowgraphClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public FlowgraphHealthIndicator flowgraphHealthIndicator(
            WorkflowDefinitionRepository definitionRepository,
            WorkflowInstanceRepository instanceRepository,
            FlowgraphProperties properties) {
        return new FlowgraphHealthIndicator(definitionRepository, instanceRepository,
            properties.getPersistence().name().toLowerCase());
    }

    // ========== Persistence ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "flowgraph", name = "persistence", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistenceConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkflowDefinitionRepository workflowDefinitionRepository() {
            log.info("Using in-memory workflow store");
            return new InMemoryWorkflowDefinitionRepository();
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkflowInstanceRepository workflowInstanceRepository() {
            return new InMemoryWorkflowInstanceRepository();
        }

        @Bean
        @ConditionalOnMissingBean(AuditLedger.class)
        public InMemoryAuditLedger auditLedger() {
            return new InMemoryAuditLedger();
        }

        // Rolls back the in-memory ledger; a custom AuditLedger brings its own lock manager
        @Bean
        @ConditionalOnMissingBean
        public InstanceLockManager instanceLockManager(InMemoryAuditLedger auditLedger, FlowgraphProperties properties) {
            return new InMemoryInstanceLockManager(auditLedger, properties.getLockTimeout());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "flowgraph", name = "persistence", havingValue = "jdbc")
    static class JdbcPersistenceConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkflowDefinitionRepository workflowDefinitionRepository(
                JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            log.info("Using PostgreSQL workflow store");
            return new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkflowInstanceRepository workflowInstanceRepository(
                JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new JdbcWorkflowInstanceRepository(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public AuditLedger auditLedger(JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
            return new JdbcAuditLedger(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public InstanceLockManager instanceLockManager(
                JdbcTemplate jdbcTemplate,
                PlatformTransactionManager transactionManager,
                FlowgraphProperties properties) {
            return new JdbcInstanceLockManager(jdbcTemplate, new TransactionTemplate(transactionManager),
                properties.getLockTimeout());
        }
    }
}
