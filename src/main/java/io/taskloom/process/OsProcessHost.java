package io.taskloom.process;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ProcessHost} backed by {@link ProcessBuilder} and {@link ProcessHandle}. Worker output
 * goes to one log file per launch under {@code logDir}.
 */
public final class OsProcessHost implements ProcessHost {
    static final long START_TIME_TOLERANCE_MS = 10_000L;

    private final Path logDir;
    private final AtomicLong launchCounter = new AtomicLong();

    public OsProcessHost(Path logDir) {
        this.logDir = logDir;
    }

    @Override
    public WorkerHandle launch(List<String> command, Path workDir, Map<String, String> environment) throws IOException {
        Files.createDirectories(logDir);
        Path logFile = logDir.resolve("worker-" + System.currentTimeMillis() + "-" + launchCounter.incrementAndGet() + ".log");
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().putAll(environment);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        Process process = pb.start();
        return new OsWorkerHandle(process.toHandle(), process);
    }

    @Override
    public Optional<WorkerHandle> lookup(long pid, long spawnedAtMs) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            return Optional.empty();
        }
        WorkerHandle worker = new OsWorkerHandle(handle.get(), null);
        Optional<Instant> start = worker.startedAt();
        if (start.isPresent() && Math.abs(start.get().toEpochMilli() - spawnedAtMs) > START_TIME_TOLERANCE_MS) {
            // pid was reused by an unrelated process
            return Optional.empty();
        }
        return Optional.of(worker);
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        return new File(windows ? "NUL" : "/dev/null");
    }

    private static final class OsWorkerHandle implements WorkerHandle {
        private final ProcessHandle handle;
        private final Process process;

        private OsWorkerHandle(ProcessHandle handle, Process process) {
            this.handle = handle;
            this.process = process;
        }

        @Override
        public long pid() {
            return handle.pid();
        }

        @Override
        public boolean isAlive() {
            return handle.isAlive();
        }

        @Override
        public void terminate() {
            handle.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            if (process != null) {
                return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            try {
                handle.onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException e) {
                return false;
            } catch (ExecutionException e) {
                return !handle.isAlive();
            }
        }

        @Override
        public OptionalInt exitCode() {
            if (process == null || process.isAlive()) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(process.exitValue());
        }

        @Override
        public Optional<Instant> startedAt() {
            return handle.info().startInstant();
        }
    }
}
