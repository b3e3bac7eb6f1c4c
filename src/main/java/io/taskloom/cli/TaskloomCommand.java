package io.taskloom.cli;

import io.taskloom.config.TaskloomConfig;
import io.taskloom.coordination.BatchOutcome;
import io.taskloom.coordination.MergeOutcome;
import io.taskloom.loop.WorkLoopController;
import io.taskloom.model.Task;
import io.taskloom.process.KillResult;
import io.taskloom.runtime.TaskloomRuntime;
import io.taskloom.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Command(
        name = "taskloom",
        mixinStandardHelpOptions = true,
        description = "Autonomous work-orchestration loop",
        subcommands = {
                TaskloomCommand.InitCommand.class,
                TaskloomCommand.StartCommand.class,
                TaskloomCommand.StopCommand.class,
                TaskloomCommand.StatusCommand.class,
                TaskloomCommand.DashboardCommand.class,
                TaskloomCommand.ValidateOwnershipCommand.class,
                TaskloomCommand.OwnershipCommand.class,
                TaskloomCommand.TasksCommand.class,
                TaskloomCommand.TaskCommand.class,
                TaskloomCommand.EnqueueCommand.class,
                TaskloomCommand.ProcessesCommand.class,
                TaskloomCommand.HungCommand.class,
                TaskloomCommand.KillCommand.class,
                TaskloomCommand.CleanupCommand.class,
                TaskloomCommand.PurgeCommand.class,
                TaskloomCommand.BatchCommand.class,
                TaskloomCommand.FlagsCommand.class,
                TaskloomCommand.UnflagCommand.class,
                TaskloomCommand.NotificationsCommand.class,
                TaskloomCommand.SchemaMigrationsCommand.class
        }
)
public final class TaskloomCommand implements Runnable {
    @Option(names = {"--root"}, description = "Controller data root directory", defaultValue = TaskloomConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | start | stop | status | dashboard | validate-ownership | ownership | tasks | task | enqueue | processes | hung | kill | cleanup | purge | batch | flags | unflag | notifications | schema-migrations");
    }

    TaskloomRuntime runtime() {
        TaskloomRuntime runtime = new TaskloomRuntime(TaskloomConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println("Initialized taskloom at: " + runtime.config().rootDir());
                return 0;
            }
        }
    }

    @Command(name = "start", description = "Run the work loop in the foreground until stopped")
    static final class StartCommand implements Callable<Integer> {
        private static final long STOP_POLL_MS = 250L;

        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--once"}, defaultValue = "false", description = "Run a single cycle and exit")
        boolean once;

        @Override
        public Integer call() throws Exception {
            try (TaskloomRuntime runtime = parent.runtime()) {
                if (runtime.controllerRunning()) {
                    System.out.println("{\"error\":\"controller already running\",\"pid\":" + runtime.controllerPid().getAsLong() + "}");
                    return 1;
                }
                WorkLoopController controller = runtime.newController();
                if (once) {
                    controller.recover();
                    System.out.println(Jsons.toJson(controller.runCycle().toView()));
                    return 0;
                }
                runtime.clearStopRequest();
                runtime.writeControllerPid(ProcessHandle.current().pid());
                CountDownLatch stopped = new CountDownLatch(1);
                Thread hook = new Thread(() -> {
                    controller.requestShutdown();
                    try {
                        stopped.await();
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                }, "taskloom-shutdown-hook");
                Runtime.getRuntime().addShutdownHook(hook);
                ScheduledExecutorService stopWatcher = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "taskloom-stop-watcher");
                    t.setDaemon(true);
                    return t;
                });
                stopWatcher.scheduleWithFixedDelay(() -> {
                    if (runtime.stopRequested()) {
                        controller.requestShutdown();
                    }
                }, STOP_POLL_MS, STOP_POLL_MS, TimeUnit.MILLISECONDS);
                try {
                    controller.run();
                } finally {
                    stopWatcher.shutdownNow();
                    runtime.clearControllerPid();
                    runtime.clearStopRequest();
                    stopped.countDown();
                    removeHook(hook);
                }
                return 0;
            }
        }

        /** False while the JVM is already shutting down and the hook is running. */
        private static boolean removeHook(Thread hook) {
            try {
                return Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                return false;
            }
        }
    }

    @Command(name = "stop", description = "Ask a running controller to stop; workers keep running")
    static final class StopCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                TaskloomRuntime.StopOutcome out = runtime.stopController();
                System.out.println(Jsons.toJson(out));
                return out.stopRequested() ? 0 : 1;
            }
        }
    }

    @Command(name = "status", description = "Show controller state and task counters")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                TaskloomRuntime.StatusOutcome out = runtime.status();
                System.out.println(Jsons.toJson(out));
                return out.dbOk() ? 0 : 1;
            }
        }
    }

    @Command(name = "dashboard", description = "Show queue depth, agent performance, live workers and recent notifications")
    static final class DashboardCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.dashboard()));
                return 0;
            }
        }
    }

    @Command(name = "validate-ownership", description = "Check the ownership table for overlapping prefixes")
    static final class ValidateOwnershipCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                TaskloomRuntime.OwnershipOutcome out = runtime.validateOwnership();
                System.out.println(Jsons.toJson(Map.of("valid", out.valid(), "violations", out.violations())));
                return out.valid() ? 0 : 2;
            }
        }
    }

    @Command(name = "ownership", description = "Print the ownership table")
    static final class OwnershipCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                for (String line : runtime.validateOwnership().rules()) {
                    System.out.println(line);
                }
                return 0;
            }
        }
    }

    @Command(name = "tasks", description = "List tasks, most recent first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--status"}, description = "Filter by status: queued|running|completed|failed")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.tasks(status, limit)));
                return 0;
            }
        }
    }

    @Command(name = "task", description = "Show one task by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                Optional<Task> task = runtime.task(taskId);
                if (task.isEmpty()) {
                    System.out.println("{\"error\":\"task not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(task.get()));
                return 0;
            }
        }
    }

    @Command(name = "enqueue", description = "Add a task to the queue without spawning a worker")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--kind"}, required = true, description = "create_spec|implement|refactoring_analysis|auto_planning|review")
        String kind;

        @Option(names = {"--priority"}, description = "1 is most urgent; defaults to the kind's priority")
        Integer priority;

        @Option(names = {"--payload"}, description = "Payload JSON object")
        String payload;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                String taskId = runtime.enqueue(kind, priority, payload);
                System.out.println(Jsons.toJson(Map.of("task_id", taskId)));
                return 0;
            }
        }
    }

    @Command(name = "processes", description = "List worker processes")
    static final class ProcessesCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--all"}, defaultValue = "false", description = "Include finished processes")
        boolean all;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.processes(all)));
                return 0;
            }
        }
    }

    @Command(name = "hung", description = "List running workers older than the timeout")
    static final class HungCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--timeout-minutes"}, description = "Defaults to the configured hung-process timeout")
        Long timeoutMinutes;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                Duration timeout = timeoutMinutes == null
                        ? Duration.ofMillis(runtime.settings().hungProcessTimeoutMs())
                        : Duration.ofMinutes(Math.max(0L, timeoutMinutes));
                System.out.println(Jsons.toJson(runtime.hung(timeout)));
                return 0;
            }
        }
    }

    @Command(name = "kill", description = "Terminate a worker and mark its task failed")
    static final class KillCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Parameters(index = "0", description = "Worker pid")
        long pid;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                KillResult out = runtime.kill(pid);
                System.out.println(Jsons.toJson(out));
                return out.killed() ? 0 : 1;
            }
        }
    }

    @Command(name = "cleanup", description = "Finalize an exited worker")
    static final class CleanupCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Parameters(index = "0", description = "Worker pid")
        long pid;

        @Option(names = {"--release-context"}, defaultValue = "false", description = "Also remove its isolated context")
        boolean releaseContext;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                boolean cleaned = runtime.cleanup(pid, releaseContext);
                System.out.println(Jsons.toJson(Map.of("pid", pid, "cleaned", cleaned)));
                return cleaned ? 0 : 1;
            }
        }
    }

    @Command(name = "purge", description = "Delete finished tasks older than the retention")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--retention-days"}, description = "Defaults to the configured queue retention")
        Integer retentionDays;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                int days = retentionDays == null ? runtime.settings().queueRetentionDays() : retentionDays;
                System.out.println(Jsons.toJson(runtime.purge(days)));
                return 0;
            }
        }
    }

    @Command(name = "batch", description = "Run implementation items now, in parallel when independent")
    static final class BatchCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Parameters(arity = "1..*", description = "Backlog item numbers")
        List<Integer> items;

        @Option(names = {"--max-parallel"}, description = "Defaults to the configured maximum")
        Integer maxParallel;

        @Option(names = {"--no-merge"}, defaultValue = "false", description = "Keep isolated contexts instead of merging")
        boolean noMerge;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                int parallel = maxParallel == null ? runtime.settings().maxParallel() : maxParallel;
                boolean autoMerge = !noMerge && runtime.settings().autoMerge();
                BatchOutcome out = runtime.runBatch(items, parallel, autoMerge);
                System.out.println(Jsons.toJson(out));
                return out.mergeResults().stream().anyMatch(MergeOutcome::flagged) ? 1 : 0;
            }
        }
    }

    @Command(name = "flags", description = "List items excluded from dispatch after a failed merge")
    static final class FlagsCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.flags()));
                return 0;
            }
        }
    }

    @Command(name = "unflag", description = "Clear the merge flag of an item")
    static final class UnflagCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Parameters(index = "0", description = "Backlog item number")
        int item;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                boolean cleared = runtime.unflag(item);
                System.out.println(Jsons.toJson(Map.of("item", item, "cleared", cleared)));
                return cleared ? 0 : 1;
            }
        }
    }

    @Command(name = "notifications", description = "Show recent notifications")
    static final class NotificationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.notifications(limit)));
                return 0;
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migration versions")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        TaskloomCommand parent;

        @Override
        public Integer call() {
            try (TaskloomRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations()));
                return 0;
            }
        }
    }
}
