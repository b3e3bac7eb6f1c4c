package io.taskloom.process;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class FakeWorkerHandle implements WorkerHandle {
    public static final int TERMINATED_EXIT_CODE = 143;

    private final long pid;
    private final Instant startedAt;
    private final CountDownLatch exited = new CountDownLatch(1);
    private volatile Integer exitCode;
    private volatile boolean terminated;

    FakeWorkerHandle(long pid, Instant startedAt) {
        this.pid = pid;
        this.startedAt = startedAt;
    }

    public synchronized void exit(int code) {
        if (exitCode == null) {
            exitCode = code;
            exited.countDown();
        }
    }

    public boolean terminated() {
        return terminated;
    }

    @Override
    public long pid() {
        return pid;
    }

    @Override
    public boolean isAlive() {
        return exitCode == null;
    }

    @Override
    public void terminate() {
        terminated = true;
        exit(TERMINATED_EXIT_CODE);
    }

    @Override
    public boolean waitFor(Duration timeout) throws InterruptedException {
        return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public OptionalInt exitCode() {
        Integer code = exitCode;
        return code == null ? OptionalInt.empty() : OptionalInt.of(code);
    }

    @Override
    public Optional<Instant> startedAt() {
        return Optional.of(startedAt);
    }
}
