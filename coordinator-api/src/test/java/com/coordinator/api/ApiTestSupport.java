package com.coordinator.api;

import com.coordinator.api.lifecycle.CoordinatorLifecycle;
import com.coordinator.api.rest.AgentController;
import com.coordinator.api.rest.ApiExceptionHandler;
import com.coordinator.api.rest.GateController;
import com.coordinator.api.rest.NotificationController;
import com.coordinator.api.rest.PipelineController;
import com.coordinator.api.rest.TaskController;
import com.coordinator.core.model.Stage;
import com.coordinator.engine.config.CoordinatorProperties;
import com.coordinator.engine.test.PipelineFixture;
import com.coordinator.gate.CommitGate;
import com.coordinator.gate.GateSettings;
import com.coordinator.gate.TaskIdExtractor;
import com.coordinator.notifier.LoggingOperatorConsole;
import com.coordinator.notifier.NotificationDeliveryService;
import com.coordinator.notifier.NotificationFormatter;
import com.coordinator.recovery.AgentLivenessMonitor;
import com.coordinator.recovery.ProgressReporter;
import com.coordinator.recovery.QueueDepthMonitor;
import com.coordinator.recovery.RecoveryEngine;
import com.coordinator.recovery.StuckTaskRecovery;
import com.coordinator.scheduler.ManualTicker;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;

/**
 * The REST layer over a {@link PipelineFixture}, without a Spring context.
 */
public class ApiTestSupport {

    public final PipelineFixture fx = new PipelineFixture();
    public final CoordinatorProperties properties = new CoordinatorProperties();
    public final ManualTicker ticker = new ManualTicker();
    public final AgentLivenessMonitor livenessMonitor;
    public final RecoveryEngine recoveryEngine;
    public final LoggingOperatorConsole console = new LoggingOperatorConsole();
    public final NotificationDeliveryService deliveryService;
    public final CoordinatorLifecycle lifecycle;
    public final MockMvc mvc;

    public ApiTestSupport() {
        properties.getPipeline().setClaimTimeout(Duration.ZERO);
        livenessMonitor = new AgentLivenessMonitor(fx.agentRepository, fx.store, fx.keys, fx.publisher,
            fx.metrics, fx.objectMapper, Duration.ofSeconds(60), Duration.ofSeconds(300), fx.time);
        recoveryEngine = new RecoveryEngine(
            ticker,
            new StuckTaskRecovery(fx.pipeline, properties.getPipeline().getStuckMaxAge(),
                properties.getPipeline().getHandoffGrace()),
            livenessMonitor,
            new QueueDepthMonitor(fx.pipeline, fx.publisher, fx.objectMapper, Stage.DEVELOPMENT, 20),
            new ProgressReporter(fx.pipeline, fx.taskRepository, fx.publisher, fx.objectMapper),
            RecoveryEngine.Schedule.defaults());
        deliveryService = new NotificationDeliveryService(fx.store, fx.keys.notifications(PipelineFixture.PENDING_KEY),
            fx.codec, new NotificationFormatter(), console, fx.metrics, 100, fx.time);
        lifecycle = new CoordinatorLifecycle(ticker, recoveryEngine, deliveryService, properties);

        CommitGate gate = new CommitGate(fx.taskRepository, fx.tasks, new TaskIdExtractor(),
            GateSettings.defaults(), fx.metrics);

        mvc = MockMvcBuilders.standaloneSetup(
                new PipelineController(fx.pipeline, lifecycle, properties),
                new TaskController(fx.tasks, fx.transitionLog),
                new AgentController(fx.agents, livenessMonitor),
                new GateController(gate),
                new NotificationController(fx.publisher, fx.objectMapper))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(fx.objectMapper))
            .build();
    }
}
