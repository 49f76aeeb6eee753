package com.automation.app.config;

import com.automation.app.action.LoggingActionExecutor;
import com.automation.app.metrics.SchedulerMetricsListener;
import com.automation.core.action.ActionExecutor;
import com.automation.core.repository.AssignmentRepository;
import com.automation.core.repository.DomainRecordRepository;
import com.automation.core.repository.HierarchyRepository;
import com.automation.core.repository.NotificationService;
import com.automation.core.repository.TriggerRepository;
import com.automation.engine.advance.AssignmentAdvancer;
import com.automation.engine.dispatch.AsyncEventDispatcher;
import com.automation.engine.metrics.AutomationMetrics;
import com.automation.engine.persistence.InMemoryDomainRecordRepository;
import com.automation.engine.persistence.jdbc.JdbcAssignmentRepository;
import com.automation.engine.persistence.jdbc.JdbcHierarchyRepository;
import com.automation.engine.persistence.jdbc.JdbcNotificationService;
import com.automation.engine.persistence.jdbc.JdbcTriggerRepository;
import com.automation.engine.progression.ProgressionStateMachine;
import com.automation.engine.service.ProgressionService;
import com.automation.engine.trigger.EventTriggerEngine;
import com.automation.engine.trigger.EventTriggerRegistry;
import com.automation.scheduler.TriggerScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

/**
 * Wires the automation core on top of PostgreSQL.
 * 
 * Hosts replace the default action executor and domain record lookup by
 * declaring their own ActionExecutor and DomainRecordRepository beans.
 */
@Configuration
@EnableConfigurationProperties(AutomationProperties.class)
public class AutomationConfiguration {

    @Bean
    public Clock automationClock() {
        return Clock.systemUTC();
    }

    // ========== Metrics ==========

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "workflow-automation");
    }

    @Bean
    public AutomationMetrics automationMetrics() {
        return new AutomationMetrics();
    }

    // ========== Persistence ==========

    @Bean
    public TriggerRepository triggerRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcTriggerRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public HierarchyRepository hierarchyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcHierarchyRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public AssignmentRepository assignmentRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcAssignmentRepository(jdbcTemplate);
    }

    @Bean
    public NotificationService notificationService(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcNotificationService(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainRecordRepository domainRecordRepository() {
        return new InMemoryDomainRecordRepository();
    }

    // ========== Engine ==========

    @Bean
    @ConditionalOnMissingBean
    public ActionExecutor actionExecutor() {
        return new LoggingActionExecutor();
    }

    @Bean
    public ProgressionService progressionService(
            HierarchyRepository hierarchyRepository,
            ActionExecutor actionExecutor,
            AutomationMetrics metrics,
            Clock clock) {
        return new ProgressionStateMachine(hierarchyRepository, actionExecutor, metrics, clock);
    }

    @Bean
    public AssignmentAdvancer assignmentAdvancer(
            AssignmentRepository assignmentRepository,
            HierarchyRepository hierarchyRepository,
            NotificationService notificationService,
            AutomationMetrics metrics) {
        return new AssignmentAdvancer(assignmentRepository, hierarchyRepository, notificationService, metrics);
    }

    @Bean
    public EventTriggerRegistry eventTriggerRegistry() {
        return new EventTriggerRegistry();
    }

    @Bean
    public EventTriggerEngine eventTriggerEngine(
            EventTriggerRegistry registry,
            ActionExecutor actionExecutor,
            DomainRecordRepository domainRecordRepository,
            AssignmentAdvancer assignmentAdvancer,
            ProgressionService progressionService,
            AutomationMetrics metrics,
            ObjectMapper objectMapper,
            Clock clock) {
        return new EventTriggerEngine(registry, actionExecutor, domainRecordRepository,
            assignmentAdvancer, progressionService, metrics, objectMapper, clock);
    }

    @Bean
    public AsyncEventDispatcher asyncEventDispatcher(AutomationProperties properties) {
        return new AsyncEventDispatcher(properties.getEvents().getAsyncThreads());
    }

    // ========== Scheduler ==========

    @Bean
    public TriggerScheduler triggerScheduler(
            TriggerRepository triggerRepository,
            ActionExecutor actionExecutor,
            Clock clock,
            AutomationProperties properties,
            AutomationMetrics metrics) {
        return new TriggerScheduler(triggerRepository, actionExecutor, clock,
            properties.getScheduler().toSettings(), new SchedulerMetricsListener(metrics));
    }
}
