package io.agentrelay.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.agentrelay.config.AgentRelayConfig;
import io.agentrelay.model.Message;
import io.agentrelay.model.Response;
import io.agentrelay.runtime.AgentRelayRuntime;
import io.agentrelay.runtime.InvalidTimeoutException;
import io.agentrelay.util.Jsons;
import io.agentrelay.workflow.WorkflowDefinition;
import io.agentrelay.workflow.WorkflowStep;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "agentrelay",
        mixinStandardHelpOptions = true,
        description = "AgentRelay in-process broker and workflow orchestrator",
        subcommands = {
                AgentRelayCommand.AgentsCommand.class,
                AgentRelayCommand.WorkflowsCommand.class,
                AgentRelayCommand.RunCommand.class,
                AgentRelayCommand.MetricsCommand.class
        }
)
public final class AgentRelayCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_TIMEOUT = 2;

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    @Option(names = {"--config"}, description = "JSON configuration file")
    String config;

    @Override
    public void run() {
        System.out.println("Use subcommands: agents | workflows | run | metrics");
    }

    AgentRelayRuntime runtime() {
        AgentRelayRuntime runtime = new AgentRelayRuntime(AgentRelayConfig.load(config));
        runtime.bindEchoAgentsToUnboundTargets();
        return runtime;
    }

    @Command(name = "agents", description = "List registered agent ids")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.agentRegistry().listAgentIds()));
            }
            return EXIT_OK;
        }
    }

    @Command(name = "workflows", description = "List workflow types and their steps")
    static final class WorkflowsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                List<Map<String, Object>> out = new ArrayList<>();
                for (WorkflowDefinition definition : runtime.workflowCatalog().list()) {
                    List<Map<String, Object>> steps = new ArrayList<>();
                    for (WorkflowStep step : definition.steps()) {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("name", step.name());
                        row.put("agent", step.agentId());
                        steps.add(row);
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("type", definition.type());
                    row.put("steps", steps);
                    out.add(row);
                }
                System.out.println(Jsons.toJson(out));
            }
            return EXIT_OK;
        }
    }

    @Command(name = "run", description = "Process one message and print the response")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Option(names = {"--type"}, required = true, description = "Message type, workflow type or agent id")
        String type;

        @Option(names = {"--data"}, defaultValue = "{}", description = "Message data as a JSON object")
        String data;

        @Option(names = {"--timeout"}, description = "Deadline in seconds; implies --async")
        Double timeoutSeconds;

        @Option(names = {"--async"}, defaultValue = "false", description = "Run with a deadline")
        boolean async;

        @Override
        public Integer call() {
            Map<String, Object> payload;
            try {
                payload = Jsons.mapper().readValue(data, DATA_TYPE);
            } catch (JsonProcessingException e) {
                System.err.println("ERROR --data must be a JSON object: " + e.getOriginalMessage());
                return EXIT_ERROR;
            }
            try (AgentRelayRuntime runtime = parent.runtime()) {
                runtime.start();
                Message message = Message.of(type, payload);
                Response response;
                if (async || timeoutSeconds != null) {
                    double timeout = timeoutSeconds == null ? runtime.config().defaultTimeoutSeconds() : timeoutSeconds;
                    response = runtime.processAsync(message, timeout);
                } else {
                    response = runtime.process(message);
                }
                System.out.println(Jsons.toJson(response));
                return exitCode(response);
            } catch (InvalidTimeoutException e) {
                System.err.println("ERROR " + e.getMessage());
                return EXIT_ERROR;
            }
        }
    }

    @Command(name = "metrics", description = "Print metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        AgentRelayCommand parent;

        @Override
        public Integer call() {
            try (AgentRelayRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
            }
            return EXIT_OK;
        }
    }

    static int exitCode(Response response) {
        return switch (response.status()) {
            case SUCCESS, PENDING -> EXIT_OK;
            case TIMEOUT -> EXIT_TIMEOUT;
            case ERROR -> EXIT_ERROR;
        };
    }
}
