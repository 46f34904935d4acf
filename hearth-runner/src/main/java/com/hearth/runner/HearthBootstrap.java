package com.hearth.runner;

import com.hearth.actionparser.ActionParser;
import com.hearth.config.HearthConfig;
import com.hearth.executor.ActionExecutor;
import com.hearth.executor.ExecutionOptions;
import com.hearth.gateway.HomeAssistantServiceGateway;
import com.hearth.gateway.ServiceCallGateway;
import com.hearth.template.PlaceholderTemplateRenderer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the runner from {@link HearthConfig}: Home Assistant gateway, strict template renderer, parser and a
 * started {@link ActionExecutor}.
 */
public final class HearthBootstrap {

    private static final Logger log = LoggerFactory.getLogger(HearthBootstrap.class);

    private HearthBootstrap() {
    }

    /** Loads configuration from the environment and talks to the configured Home Assistant instance. */
    public static RunnerContext initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(HearthConfig.fromEnvironment());
    }

    public static RunnerContext initialize(HearthConfig config) {
        ServiceCallGateway gateway = new HomeAssistantServiceGateway(
                config.getHaUrl(), config.getHaToken(), config.getHaRequestTimeout());
        return initialize(config, gateway);
    }

    /** Same wiring with a caller-supplied gateway. */
    public static RunnerContext initialize(HearthConfig config, ServiceCallGateway gateway) {
        ExecutionOptions options = toExecutionOptions(config);
        ActionExecutor executor = ActionExecutor.builder()
                .gateway(gateway)
                .renderer(PlaceholderTemplateRenderer.strict())
                .options(options)
                .meterRegistry(new SimpleMeterRegistry())
                .build();
        executor.start();
        log.info("Bootstrap: executor ready | haUrl={} | options={}", config.getHaUrl(), options);
        return new RunnerContext(config, new ActionParser(), executor);
    }

    public static ExecutionOptions toExecutionOptions(HearthConfig config) {
        return ExecutionOptions.builder()
                .numWorkers(config.getNumWorkers())
                .maxRetries(config.getMaxRetries())
                .initialRetryDelay(config.getInitialRetryDelay())
                .maxRetryDelay(config.getMaxRetryDelay())
                .perActionTimeout(config.getPerActionTimeout())
                .runDeadline(config.getRunDeadline())
                .queueCapacity(config.getQueueCapacity())
                .maxRepeatIterations(config.getMaxRepeatIterations())
                .build();
    }
}
