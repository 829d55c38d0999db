package io.taskwire.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskwire.agent.AgentHost;
import io.taskwire.agent.AgentRegistry;
import io.taskwire.bridge.TaskHttpBridge;
import io.taskwire.config.TaskWireConfig;
import io.taskwire.correlation.TaskCorrelator;
import io.taskwire.model.TaskRequest;
import io.taskwire.model.TaskResponse;
import io.taskwire.model.TaskStatus;
import io.taskwire.observability.CounterRegistry;
import io.taskwire.transport.Transport;
import io.taskwire.transport.local.InProcessTransport;
import io.taskwire.transport.socket.UnixSocketClient;
import io.taskwire.transport.socket.UnixSocketServer;
import io.taskwire.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

@Command(
        name = "taskwire",
        mixinStandardHelpOptions = true,
        description = "TaskWire agent transport CLI",
        subcommands = {
                TaskWireCommand.ServeSocketCommand.class,
                TaskWireCommand.SendTaskCommand.class,
                TaskWireCommand.ServeBridgeCommand.class,
                TaskWireCommand.SettingsCommand.class
        }
)
public final class TaskWireCommand implements Runnable {
    @Option(names = {"--config"}, description = "JSON settings file; absent fields use defaults")
    String configFile;

    @Option(names = {"--socket"}, description = "Unix socket path (overrides the settings file)")
    String socketPath;

    @Override
    public void run() {
        System.out.println("Use subcommands: serve-socket | send-task | serve-bridge | settings");
    }

    TaskWireConfig config() {
        TaskWireConfig config = TaskWireConfig.load(configFile == null ? null : Path.of(configFile));
        return socketPath == null || socketPath.isBlank() ? config : config.withSocketPath(socketPath);
    }

    @Command(name = "serve-socket", description = "Serve the built-in agents on the Unix socket")
    static final class ServeSocketCommand implements Callable<Integer> {
        @ParentCommand
        TaskWireCommand parent;

        @Override
        public Integer call() throws Exception {
            TaskWireConfig config = parent.config();
            CounterRegistry counters = new CounterRegistry();
            UnixSocketServer server = new UnixSocketServer(config, counters);
            AgentHost host = new AgentHost(AgentRegistry.withBuiltins(), server);
            server.start();
            host.start();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                host.close();
                server.stop();
            }, "taskwire-shutdown"));
            System.out.println("Socket server listening on " + server.socketPath());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "send-task", description = "Send one task over the Unix socket and print the response")
    static final class SendTaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskWireCommand parent;

        @Option(names = {"--recipient"}, required = true, description = "Target agent id")
        String recipient;

        @Option(names = {"--task-type"}, defaultValue = "generic", description = "Task type")
        String taskType;

        @Option(names = {"--params"}, defaultValue = "{}", description = "Task parameters as JSON")
        String params;

        @Option(names = {"--priority"}, description = "Task priority (default 5)")
        Integer priority;

        @Option(names = {"--sender"}, description = "Sender id (default: random cli id)")
        String sender;

        @Option(names = {"--timeout-ms"}, description = "Task timeout (default from settings)")
        Long timeoutMs;

        @Override
        public Integer call() throws Exception {
            TaskWireConfig config = parent.config();
            JsonNode parameters = Jsons.mapper().readTree(params);
            String senderId = sender == null || sender.isBlank() ? "cli-" + UUID.randomUUID() : sender;
            long timeout = timeoutMs == null ? config.taskTimeoutMs() : timeoutMs;
            CounterRegistry counters = new CounterRegistry();
            try (UnixSocketClient client = new UnixSocketClient(config, senderId, counters);
                 TaskCorrelator correlator = new TaskCorrelator(client, config, counters)) {
                client.connect().get(config.handshakeTimeoutMs() * 2, TimeUnit.MILLISECONDS);
                TaskRequest request = new TaskRequest(UUID.randomUUID().toString(), taskType, parameters, Map.of(), priority);
                TaskResponse response;
                try {
                    response = correlator.sendTaskRequest(request, recipient, senderId, timeout).get();
                } catch (ExecutionException e) {
                    System.err.println("Task failed: " + e.getCause().getMessage());
                    return 2;
                }
                System.out.println(Jsons.toJson(response));
                return response.status() == TaskStatus.COMPLETED ? 0 : 1;
            }
        }
    }

    @Command(name = "serve-bridge", description = "Serve POST /api/tasks over HTTP")
    static final class ServeBridgeCommand implements Callable<Integer> {
        @ParentCommand
        TaskWireCommand parent;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--sender"}, defaultValue = "http-bridge", description = "Sender id used for task calls")
        String sender;

        @Option(names = {"--local"}, description = "Run the built-in agents in-process instead of dialing the socket")
        boolean local;

        @Override
        public Integer call() throws Exception {
            TaskWireConfig config = parent.config();
            CounterRegistry counters = new CounterRegistry();
            Transport transport;
            AgentHost host = null;
            if (local) {
                transport = new InProcessTransport(config, counters);
                host = new AgentHost(AgentRegistry.withBuiltins(), transport);
                host.start();
            } else {
                UnixSocketClient client = new UnixSocketClient(config, sender, counters);
                client.connect().get(config.handshakeTimeoutMs() * 2, TimeUnit.MILLISECONDS);
                transport = client;
            }
            TaskCorrelator correlator = new TaskCorrelator(transport, config, counters);
            TaskHttpBridge bridge = new TaskHttpBridge(correlator, sender, config.taskTimeoutMs(), counters);
            bridge.start(port);
            AgentHost hostRef = host;
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                bridge.close();
                correlator.close();
                if (hostRef != null) {
                    hostRef.close();
                }
                transport.close();
            }, "taskwire-shutdown"));
            System.out.println("Task bridge listening on http://127.0.0.1:" + bridge.port() + "/api/tasks");
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "settings", description = "Print effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TaskWireCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.config()));
            return 0;
        }
    }
}
