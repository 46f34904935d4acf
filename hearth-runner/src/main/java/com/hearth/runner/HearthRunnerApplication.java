package com.hearth.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hearth.actionmodel.error.ActionParseException;
import com.hearth.actionmodel.error.InvalidActionException;
import com.hearth.actionmodel.error.RunDeadlineExceededException;
import com.hearth.actionmodel.node.ActionNode;
import com.hearth.actionmodel.result.ActionExecutionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Runs one automation file against Home Assistant and prints the execution summary as JSON on stdout.
 * <pre>
 * hearth-runner &lt;automation.yaml|json&gt; [context.json]
 * </pre>
 * Exit codes: 0 overall success, 1 at least one action failed or the run was cancelled, 2 usage or parse error.
 * Configuration comes from HEARTH_* environment variables.
 */
public final class HearthRunnerApplication {

    private static final Logger log = LoggerFactory.getLogger(HearthRunnerApplication.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: hearth-runner <automation.yaml|json> [context.json]";

    private HearthRunnerApplication() {
    }

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println(USAGE);
            System.exit(EXIT_USAGE);
        }
        RunnerContext ctx = HearthBootstrap.initialize();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down executor...");
            ctx.close();
        }, "hearth-shutdown"));
        int code = run(args, ctx, System.out);
        ctx.close();
        System.exit(code);
    }

    /** Runs the automation named by {@code args} on an already bootstrapped context and returns the exit code. */
    static int run(String[] args, RunnerContext ctx, PrintStream out) {
        if (args.length < 1 || args.length > 2) {
            log.error(USAGE);
            return EXIT_USAGE;
        }
        Path automationFile = Path.of(args[0]);
        List<ActionNode> nodes;
        Map<String, Object> context;
        try {
            nodes = ctx.getParser().parse(Files.readString(automationFile));
            context = args.length == 2 ? readContext(Path.of(args[1])) : Map.of();
        } catch (ActionParseException | InvalidActionException e) {
            log.error("Automation rejected | file={} | error={}", automationFile, e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            log.error("Cannot read input | file={} | error={}", args.length == 2 ? args[1] : args[0], e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Automation parsed | file={} | topLevelActions={} | contextKeys={}",
                automationFile, nodes.size(), context.keySet());

        ActionExecutionSummary summary;
        try {
            summary = ctx.getExecutor().execute(nodes, context);
        } catch (RunDeadlineExceededException e) {
            log.error("Run made no progress before its deadline | runId={} | deadline={}", e.getRunId(), e.getDeadline());
            return EXIT_FAILURE;
        }
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(summary.toExportMap()));
        } catch (JsonProcessingException e) {
            log.error("Cannot render summary | runId={} | error={}", summary.getRunId(), e.getMessage(), e);
            return EXIT_FAILURE;
        }
        return summary.isOverallSuccess() ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    private static Map<String, Object> readContext(Path file) throws IOException {
        Map<String, Object> context = MAPPER.readValue(file.toFile(), new TypeReference<Map<String, Object>>() { });
        return context != null ? context : Map.of();
    }
}
