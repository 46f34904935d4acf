package com.hearth.runner;

import com.hearth.actionparser.ActionParser;
import com.hearth.config.HearthConfig;
import com.hearth.executor.ActionExecutor;

/**
 * What {@link HearthBootstrap} builds: configuration, parser and a started executor. Closing it stops the executor.
 */
public final class RunnerContext implements AutoCloseable {

    private final HearthConfig config;
    private final ActionParser parser;
    private final ActionExecutor executor;

    RunnerContext(HearthConfig config, ActionParser parser, ActionExecutor executor) {
        this.config = config;
        this.parser = parser;
        this.executor = executor;
    }

    public HearthConfig getConfig() {
        return config;
    }

    public ActionParser getParser() {
        return parser;
    }

    public ActionExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
