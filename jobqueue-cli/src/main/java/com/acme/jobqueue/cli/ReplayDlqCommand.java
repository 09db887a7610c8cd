package com.acme.jobqueue.cli;

import com.acme.jobqueue.cli.config.CliConfiguration;
import com.acme.jobqueue.config.QueueSettings;
import com.acme.jobqueue.core.Jsons;
import com.acme.jobqueue.core.QueueBackendException;
import com.acme.jobqueue.core.QueueConfigurationException;
import com.acme.jobqueue.dlq.DlqNames;
import com.acme.jobqueue.dlq.DlqReplayer;
import com.acme.jobqueue.dlq.ReplayResult;
import com.acme.jobqueue.queue.QueueHandleFactory;
import com.acme.jobqueue.redis.QueueBackends;
import com.acme.jobqueue.spi.QueueBackend;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(
        name = "dlq-replay",
        description = "Replays dead-lettered jobs back into their original queues",
        mixinStandardHelpOptions = true,
        version = "1.0.0"
)
public class ReplayDlqCommand implements Callable<Integer> {

    static final String EVENT_COMPLETE = "dlq.replay.complete";
    static final String EVENT_FAILED = "dlq.replay.failed";

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "QUEUE",
            description = "Queue base name; only <QUEUE>-dlq is scanned. "
                    + "Without it: stripe-events-dlq, usage-rollups-dlq, maintenance-jobs-dlq.")
    private String queue;

    private final Supplier<QueueSettings> settings;
    private final Function<QueueSettings, QueueBackend> backends;
    private final PrintStream out;
    private final PrintStream err;

    public ReplayDlqCommand() {
        this(() -> CliConfiguration.getInstance().getQueueSettings(), QueueBackends::create,
                System.out, System.err);
    }

    ReplayDlqCommand(Supplier<QueueSettings> settings,
                     Function<QueueSettings, QueueBackend> backends,
                     PrintStream out,
                     PrintStream err) {
        this.settings = settings;
        this.backends = backends;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new ReplayDlqCommand()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(ReplayDlqCommand command) {
        CommandLine cmd = new CommandLine(command);
        // anything not handled in call() still ends as a single failure record
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            command.printFailure(ex.getMessage() != null ? ex.getMessage() : ex.toString());
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() {
        List<String> dlqNames = DlqNames.resolve(queue);
        try {
            QueueSettings queueSettings = settings.get();
            try (QueueBackend backend = backends.apply(queueSettings)) {
                DlqReplayer replayer = new DlqReplayer(
                        new QueueHandleFactory(backend), queueSettings.getReplayBatchSize());
                ReplayResult result = replayer.replay(dlqNames);

                if (result instanceof ReplayResult.Failed failed) {
                    printFailure(failed.message());
                    return 1;
                }
                printComplete((ReplayResult.Completed) result);
                return 0;
            }
        } catch (QueueConfigurationException | QueueBackendException e) {
            printFailure(e.getMessage());
            return 1;
        }
    }

    private void printComplete(ReplayResult.Completed completed) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("event", EVENT_COMPLETE);
        record.put("replayed", completed.replayed());
        record.put("dlqNames", completed.dlqNames());
        out.println(Jsons.toJson(record));
        out.flush();
    }

    private void printFailure(String message) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("event", EVENT_FAILED);
        record.put("error", message);
        err.println(Jsons.toJson(record));
        err.flush();
    }
}
