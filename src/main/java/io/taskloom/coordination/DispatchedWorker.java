package io.taskloom.coordination;

import java.nio.file.Path;

/**
 * {@code context} is null for a worker running directly in the trunk.
 */
public record DispatchedWorker(int itemNumber, String taskId, long pid, Path context) {
}
