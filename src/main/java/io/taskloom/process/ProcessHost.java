package io.taskloom.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operating-system process capability used by {@link ProcessSupervisor}.
 */
public interface ProcessHost {
    WorkerHandle launch(List<String> command, Path workDir, Map<String, String> environment) throws IOException;

    /**
     * Re-attaches to a live process recorded as spawned at {@code spawnedAtMs}. Empty when no
     * such process is alive or the pid now belongs to a different process.
     */
    Optional<WorkerHandle> lookup(long pid, long spawnedAtMs);
}
