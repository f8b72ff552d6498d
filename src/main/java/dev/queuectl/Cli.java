package dev.queuectl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.queuectl.Models.Job;
import dev.queuectl.Models.JobState;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "queuectl", mixinStandardHelpOptions = true, version = "queuectl 1.0.0",
    description = "Persistent priority job queue with retrying workers and a dead letter queue",
    subcommands = {
        Cli.Enqueue.class,
        Cli.ListCmd.class,
        Cli.Show.class,
        Cli.Status.class,
        Cli.Remove.class,
        Cli.ClearAll.class,
        Cli.DlqCmd.class,
        Cli.ConfigCmd.class,
        Cli.WorkerCmd.class
    })
public class Cli implements Runnable {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Option(names = "--db", paramLabel = "PATH", description = "SQLite database file (default: $QUEUECTL_DB or ~/.queuectl/data/queuectl.db)")
    String db;

    private JobStore store;

    public void run() { new CommandLine(this).usage(System.out); }

    public static void main(String[] args) { System.exit(commandLine(new Cli()).execute(args)); }

    static CommandLine commandLine(Cli cli) {
        return new CommandLine(cli).setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof QueueException || ex instanceof IllegalArgumentException) {
                cmd.getErr().println("Error: " + ex.getMessage());
                return 1;
            }
            throw ex;
        });
    }

    synchronized JobStore store() {
        if (store == null) store = new JobStore(Config.resolveDbPath(db));
        return store;
    }

    QueueManager manager() {
        JobStore s = store();
        return new QueueManager(s, new WorkerPool(WorkerPool.registryFor(s.dbPath()), new JvmProcessSupervisor(s.dbPath())));
    }

    abstract static class Sub implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        Cli root() {
            return (Cli) spec.root().userObject();
        }

        QueueManager manager() {
            return root().manager();
        }

        void out(String line) {
            spec.commandLine().getOut().println(line);
        }

        void printJson(Object value) {
            try {
                out(JSON.writerWithDefaultPrettyPrinter().writeValueAsString(value));
            } catch (Exception e) {
                throw new IllegalStateException("Cannot render output", e);
            }
        }
    }

    @Command(name = "enqueue", description = "Enqueue a new job, from options or a JSON payload")
    static class Enqueue extends Sub {
        @Parameters(index = "0", arity = "0..1", paramLabel = "JOB_JSON", description = "Job JSON e.g. {\"id\":\"job1\",\"command\":\"echo hi\",\"priority\":8}")
        String jobJson;
        @Option(names = "--id") String id;
        @Option(names = "--command") String command;
        @Option(names = "--max-retries") Integer maxRetries;
        @Option(names = "--timeout", description = "Execution timeout in seconds") Integer timeout;
        @Option(names = "--backoff-base") Integer backoffBase;
        @Option(names = "--priority", description = "Higher runs first") Integer priority;

        public Integer call() throws Exception {
            if (jobJson != null) {
                JsonNode n;
                try {
                    n = JSON.readTree(jobJson);
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage());
                }
                if (!n.isObject()) throw new IllegalArgumentException("Invalid JSON: expected an object");
                if (id == null && n.hasNonNull("id")) id = n.get("id").asText();
                if (command == null && n.hasNonNull("command")) command = n.get("command").asText();
                if (maxRetries == null && n.hasNonNull("max_retries")) maxRetries = n.get("max_retries").asInt();
                if (timeout == null && n.hasNonNull("timeout")) timeout = n.get("timeout").asInt();
                if (backoffBase == null && n.hasNonNull("backoff_base")) backoffBase = n.get("backoff_base").asInt();
                if (priority == null && n.hasNonNull("priority")) priority = n.get("priority").asInt();
            }
            if (id == null || command == null) throw new IllegalArgumentException("id and command required");
            QueueManager qm = manager();
            Job j = qm.newJob(id, command);
            if (maxRetries != null) j.max_retries = maxRetries;
            if (timeout != null) j.timeout = timeout;
            if (backoffBase != null) j.backoff_base = backoffBase;
            if (priority != null) j.priority = priority;
            qm.enqueue(j);
            out("Enqueued job " + j.id);
            return 0;
        }
    }

    @Command(name = "list", description = "List jobs")
    static class ListCmd extends Sub {
        @Option(names = "--state", description = "pending, processing, completed, failed or dead")
        String state;

        public Integer call() {
            printJson(manager().list(state == null ? null : JobState.of(state)));
            return 0;
        }
    }

    @Command(name = "show", description = "Show one job")
    static class Show extends Sub {
        @Parameters(index = "0") String jobId;

        public Integer call() {
            printJson(manager().show(jobId));
            return 0;
        }
    }

    @Command(name = "status", description = "Show job counts per state and active workers")
    static class Status extends Sub {
        public Integer call() {
            printJson(manager().status());
            return 0;
        }
    }

    @Command(name = "remove", description = "Delete one job")
    static class Remove extends Sub {
        @Parameters(index = "0") String jobId;

        public Integer call() {
            manager().remove(jobId);
            out("Removed job " + jobId);
            return 0;
        }
    }

    @Command(name = "clear-all", description = "Delete every job")
    static class ClearAll extends Sub {
        public Integer call() {
            out("Removed " + manager().clearAll() + " job(s)");
            return 0;
        }
    }

    @Command(name = "dlq", description = "Dead Letter Queue operations", subcommands = {DlqCmd.ListDlq.class, DlqCmd.Retry.class, DlqCmd.Clear.class})
    static class DlqCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "list", description = "List DLQ jobs")
        static class ListDlq extends Sub {
            public Integer call() {
                printJson(manager().dlqList());
                return 0;
            }
        }

        @Command(name = "retry", description = "Move a DLQ job back to pending")
        static class Retry extends Sub {
            @Parameters(index = "0") String jobId;

            public Integer call() {
                manager().dlqRetry(jobId);
                out("Retried DLQ job " + jobId);
                return 0;
            }
        }

        @Command(name = "clear", description = "Delete every DLQ job")
        static class Clear extends Sub {
            public Integer call() {
                out("Removed " + manager().dlqClear() + " DLQ job(s)");
                return 0;
            }
        }
    }

    @Command(name = "config", description = "Manage configuration", subcommands = {ConfigCmd.Get.class, ConfigCmd.Set.class})
    static class ConfigCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "get", description = "Show one key, or all of them")
        static class Get extends Sub {
            @Parameters(index = "0", arity = "0..1") String key;

            public Integer call() {
                Config config = manager().config();
                if (key == null) {
                    printJson(config.all());
                    return 0;
                }
                String value = config.get(key);
                if (value == null) throw new IllegalArgumentException("Unknown config key: " + key);
                printJson(Map.of(key, value));
                return 0;
            }
        }

        @Command(name = "set", description = "Set a config key")
        static class Set extends Sub {
            @Parameters(index = "0") String key;
            @Parameters(index = "1") String value;

            public Integer call() {
                Config config = manager().config();
                config.set(key, value);
                printJson(config.all());
                return 0;
            }
        }
    }

    @Command(name = "worker", description = "Manage workers", subcommands = {WorkerCmd.Start.class, WorkerCmd.Stop.class, WorkerCmd.ListWorkers.class, WorkerCmd.Run.class})
    static class WorkerCmd implements Runnable {
        public void run() { CommandLine.usage(this, System.out); }

        @Command(name = "start", description = "Start N background worker processes")
        static class Start extends Sub {
            @Option(names = "--count", defaultValue = "1")
            int count;

            public Integer call() {
                List<WorkerPool.WorkerEntry> started = manager().startWorkers(count);
                for (WorkerPool.WorkerEntry w : started) out("Started worker " + w.worker_id + " (pid " + w.pid + ")");
                out("Started " + started.size() + " worker(s)");
                return 0;
            }
        }

        @Command(name = "stop", description = "Stop workers; each finishes its current job first")
        static class Stop extends Sub {
            public Integer call() {
                int stopped = manager().stopWorkers();
                out(stopped == 0 ? "No workers to stop" : "Signalled " + stopped + " worker(s) to stop");
                return 0;
            }
        }

        @Command(name = "list", description = "List live workers")
        static class ListWorkers extends Sub {
            public Integer call() {
                printJson(manager().workers());
                return 0;
            }
        }

        @Command(name = "run", description = "Run a worker in the foreground (used by worker start)")
        static class Run extends Sub {
            @Option(names = "--id") String workerId;
            @Option(names = "--poll-interval-ms", defaultValue = "1000") long pollIntervalMs;

            public Integer call() {
                Path dbPath = root().store().dbPath();
                Worker worker = new Worker(workerId, root().store(), new ShellCommandExecutor(), Duration.ofMillis(pollIntervalMs));
                out("Worker " + worker.id() + " running against " + dbPath);
                worker.runUntilSignalled();
                return 0;
            }
        }
    }
}
