package com.coordinator.api.config;

import com.coordinator.core.ci.CiCollaborator;
import com.coordinator.core.model.RetryPolicy;
import com.coordinator.core.model.Stage;
import com.coordinator.core.notification.NotificationCodec;
import com.coordinator.core.notification.NotificationPublisher;
import com.coordinator.core.repository.AgentRepository;
import com.coordinator.core.repository.TaskRecordRepository;
import com.coordinator.core.repository.TransitionLog;
import com.coordinator.core.store.CoordinationStore;
import com.coordinator.engine.agent.AgentRegistry;
import com.coordinator.engine.config.CoordinatorProperties;
import com.coordinator.engine.health.CoordinatorHealthIndicator;
import com.coordinator.engine.metrics.PipelineMetrics;
import com.coordinator.engine.notification.StoreNotificationPublisher;
import com.coordinator.engine.persistence.StoreAgentRepository;
import com.coordinator.engine.persistence.StoreTaskRecordRepository;
import com.coordinator.engine.persistence.StoreTransitionLog;
import com.coordinator.engine.pipeline.PipelineSettings;
import com.coordinator.engine.pipeline.QueuePipelineEngine;
import com.coordinator.engine.state.CompletionGate;
import com.coordinator.engine.state.CompletionSettings;
import com.coordinator.engine.state.StableIdService;
import com.coordinator.engine.state.TaskStateManager;
import com.coordinator.engine.store.CoordinatorObjectMapper;
import com.coordinator.engine.store.InMemoryCoordinationStore;
import com.coordinator.engine.store.JdbcCoordinationStore;
import com.coordinator.engine.store.PipelineKeys;
import com.coordinator.engine.store.RetryingCoordinationStore;
import com.coordinator.engine.store.StoreRetrier;
import com.coordinator.gate.CommitGate;
import com.coordinator.gate.GateSettings;
import com.coordinator.gate.TaskIdExtractor;
import com.coordinator.gate.ci.GitHubCiCollaborator;
import com.coordinator.notifier.LoggingOperatorConsole;
import com.coordinator.notifier.NotificationDeliveryService;
import com.coordinator.notifier.NotificationFormatter;
import com.coordinator.notifier.OperatorConsole;
import com.coordinator.notifier.TmuxOperatorConsole;
import com.coordinator.recovery.AgentLivenessMonitor;
import com.coordinator.recovery.ProgressReporter;
import com.coordinator.recovery.QueueDepthMonitor;
import com.coordinator.recovery.RecoveryEngine;
import com.coordinator.recovery.StuckTaskRecovery;
import com.coordinator.scheduler.ScheduledTicker;
import com.coordinator.scheduler.Ticker;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.HashSet;

/**
 * Wires the coordinator services from {@link CoordinatorProperties}.
 *
 * The engine, recovery, notifier and gate modules are plain classes; this is the only place
 * that knows how they fit together.
 */
@Configuration
public class CoordinatorConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "prp-coordinator");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return CoordinatorObjectMapper.create();
    }

    // ========== Store ==========

    @Bean
    public StoreRetrier storeRetrier(CoordinatorProperties properties) {
        CoordinatorProperties.Store store = properties.getStore();
        return new StoreRetrier(RetryPolicy.builder()
            .maxAttempts(store.getRetryMaxAttempts())
            .initialBackoff(store.getRetryInitialBackoff())
            .maxBackoff(store.getRetryMaxBackoff())
            .build());
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public CoordinationStore inMemoryCoordinationStore(StoreRetrier retrier, Clock clock) {
        return new RetryingCoordinationStore(new InMemoryCoordinationStore(clock), retrier);
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.store", name = "type", havingValue = "jdbc")
    public CoordinationStore jdbcCoordinationStore(
            StoreRetrier retrier, JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new RetryingCoordinationStore(new JdbcCoordinationStore(jdbcTemplate, transactionTemplate), retrier);
    }

    @Bean
    public PipelineKeys pipelineKeys(CoordinatorProperties properties) {
        return new PipelineKeys(properties.getStore().getKeyPrefix());
    }

    // ========== Engine ==========

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry registry) {
        return new PipelineMetrics(registry);
    }

    @Bean
    public StoreTaskRecordRepository taskRecordRepository(CoordinationStore store, PipelineKeys keys) {
        return new StoreTaskRecordRepository(store, keys);
    }

    @Bean
    public StoreAgentRepository agentRepository(CoordinationStore store, PipelineKeys keys) {
        return new StoreAgentRepository(store, keys);
    }

    @Bean
    public StoreTransitionLog transitionLog(CoordinationStore store, PipelineKeys keys, ObjectMapper objectMapper) {
        return new StoreTransitionLog(store, keys, objectMapper);
    }

    @Bean
    public NotificationCodec notificationCodec(ObjectMapper objectMapper) {
        return new NotificationCodec(objectMapper);
    }

    @Bean
    public StoreNotificationPublisher notificationPublisher(
            CoordinationStore store, PipelineKeys keys, NotificationCodec codec,
            CoordinatorProperties properties, Clock clock) {
        return new StoreNotificationPublisher(
            store, keys.notifications(properties.getNotification().getPendingKey()), codec, clock);
    }

    @Bean
    public QueuePipelineEngine pipelineEngine(
            CoordinationStore store,
            PipelineKeys keys,
            TaskRecordRepository taskRepository,
            TransitionLog transitionLog,
            NotificationPublisher publisher,
            PipelineMetrics metrics,
            CoordinatorProperties properties,
            ObjectMapper objectMapper,
            Clock clock) {
        CoordinatorProperties.Pipeline pipeline = properties.getPipeline();
        PipelineSettings settings = new PipelineSettings(
            pipeline.getMaxRetries(), new HashSet<>(pipeline.getNonRetryableReasons()));
        return new QueuePipelineEngine(
            store, keys, taskRepository, transitionLog, publisher, metrics, settings, objectMapper, clock);
    }

    @Bean
    public CiCollaborator ciCollaborator(CoordinatorProperties properties, ObjectMapper objectMapper) {
        CoordinatorProperties.Ci ci = properties.getCi();
        return new GitHubCiCollaborator(
            ci.getGithubApiUrl(), ci.getGithubRepository(), ci.getGithubToken(), ci.getRequestTimeout(), objectMapper);
    }

    @Bean
    public CompletionSettings completionSettings(CoordinatorProperties properties) {
        CoordinatorProperties.Ci ci = properties.getCi();
        return new CompletionSettings(
            properties.getState().getCompletionSource(),
            new HashSet<>(ci.getRequiredChecks()),
            ci.getMainlineBranch(),
            ci.getFreshness());
    }

    @Bean
    public TaskStateManager taskStateManager(
            TaskRecordRepository taskRepository,
            CoordinationStore store,
            PipelineKeys keys,
            CiCollaborator ciCollaborator,
            CompletionSettings completionSettings,
            NotificationPublisher publisher,
            ObjectMapper objectMapper,
            Clock clock) {
        return new TaskStateManager(
            taskRepository,
            new StableIdService(store, keys),
            new CompletionGate(ciCollaborator, completionSettings, clock),
            completionSettings,
            publisher,
            objectMapper,
            clock);
    }

    @Bean
    public AgentRegistry agentRegistry(AgentRepository agentRepository, Clock clock) {
        return new AgentRegistry(agentRepository, clock);
    }

    @Bean
    public CoordinatorHealthIndicator coordinatorHealthIndicator(CoordinationStore store, QueuePipelineEngine pipeline) {
        return new CoordinatorHealthIndicator(store, pipeline);
    }

    // ========== Gate ==========

    @Bean
    public CommitGate commitGate(
            TaskRecordRepository taskRepository,
            TaskStateManager tasks,
            CoordinatorProperties properties,
            PipelineMetrics metrics) {
        CoordinatorProperties.Gate gate = properties.getGate();
        GateSettings settings = GateSettings.of(
            gate.isFailOpen(), gate.getArtifactPath(), gate.getSentinel(),
            gate.getActiveStatuses(), gate.getCompletionPattern());
        return new CommitGate(taskRepository, tasks, new TaskIdExtractor(), settings, metrics);
    }

    // ========== Background loops ==========

    @Bean
    public Ticker ticker() {
        return new ScheduledTicker(2);
    }

    @Bean
    public AgentLivenessMonitor agentLivenessMonitor(
            AgentRepository agentRepository,
            CoordinationStore store,
            PipelineKeys keys,
            NotificationPublisher publisher,
            PipelineMetrics metrics,
            ObjectMapper objectMapper,
            CoordinatorProperties properties,
            Clock clock) {
        CoordinatorProperties.Liveness liveness = properties.getLiveness();
        return new AgentLivenessMonitor(agentRepository, store, keys, publisher, metrics, objectMapper,
            liveness.getActiveThreshold(), liveness.getIdleThreshold(), clock);
    }

    @Bean
    public RecoveryEngine recoveryEngine(
            Ticker ticker,
            QueuePipelineEngine pipeline,
            TaskRecordRepository taskRepository,
            AgentLivenessMonitor livenessMonitor,
            NotificationPublisher publisher,
            ObjectMapper objectMapper,
            CoordinatorProperties properties) {
        CoordinatorProperties.Pipeline pipelineProps = properties.getPipeline();
        CoordinatorProperties.Monitor monitor = properties.getMonitor();
        return new RecoveryEngine(
            ticker,
            new StuckTaskRecovery(pipeline, pipelineProps.getStuckMaxAge(), pipelineProps.getHandoffGrace()),
            livenessMonitor,
            new QueueDepthMonitor(pipeline, publisher, objectMapper, Stage.DEVELOPMENT, monitor.getScalingThreshold()),
            new ProgressReporter(pipeline, taskRepository, publisher, objectMapper),
            new RecoveryEngine.Schedule(
                pipelineProps.getRecoveryInterval(),
                properties.getLiveness().getPollInterval(),
                monitor.getDepthCheckInterval(),
                monitor.getProgressInterval()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.notification", name = "console", havingValue = "tmux")
    public OperatorConsole tmuxOperatorConsole(CoordinatorProperties properties) {
        return new TmuxOperatorConsole(properties.getNotification().getTmuxTarget());
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordinator.notification", name = "console", havingValue = "log", matchIfMissing = true)
    public OperatorConsole loggingOperatorConsole() {
        return new LoggingOperatorConsole();
    }

    @Bean
    public NotificationDeliveryService notificationDeliveryService(
            CoordinationStore store,
            PipelineKeys keys,
            NotificationCodec codec,
            OperatorConsole console,
            PipelineMetrics metrics,
            CoordinatorProperties properties,
            Clock clock) {
        CoordinatorProperties.Notification notification = properties.getNotification();
        return new NotificationDeliveryService(
            store,
            keys.notifications(notification.getPendingKey()),
            codec,
            new NotificationFormatter(),
            console,
            metrics,
            notification.getDedupCapacity(),
            clock);
    }
}
