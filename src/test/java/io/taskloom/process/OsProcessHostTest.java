package io.taskloom.process;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

final class OsProcessHostTest {

    @Test
    void lookupRejectsPidWhoseStartTimeDoesNotMatch() {
        Optional<Instant> started = ProcessHandle.current().info().startInstant();
        Assumptions.assumeTrue(started.isPresent(), "process start time not observable on this platform");
        OsProcessHost host = new OsProcessHost(Path.of("unused-logs"));
        long self = ProcessHandle.current().pid();
        long startedMs = started.get().toEpochMilli();

        Optional<WorkerHandle> same = host.lookup(self, startedMs);
        Assertions.assertTrue(same.isPresent());
        Assertions.assertEquals(started, same.get().startedAt());

        long reusedMs = startedMs - OsProcessHost.START_TIME_TOLERANCE_MS - 60_000L;
        Assertions.assertTrue(host.lookup(self, reusedMs).isEmpty());
    }

    @Test
    void lookupOfDeadPidIsEmpty() {
        OsProcessHost host = new OsProcessHost(Path.of("unused-logs"));

        Assertions.assertTrue(host.lookup(999_999_999L, System.currentTimeMillis()).isEmpty());
    }
}
