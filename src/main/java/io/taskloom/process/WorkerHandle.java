package io.taskloom.process;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A launched or re-attached worker process.
 */
public interface WorkerHandle {
    long pid();

    boolean isAlive();

    /** Forced termination. */
    void terminate();

    /**
     * @return true if the process exited within {@code timeout}
     */
    boolean waitFor(Duration timeout) throws InterruptedException;

    /**
     * Exit code of an exited process. Empty while running, and for handles re-attached after a
     * restart, where the code is not observable.
     */
    OptionalInt exitCode();

    Optional<Instant> startedAt();
}
