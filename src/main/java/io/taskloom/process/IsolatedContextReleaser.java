package io.taskloom.process;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Disposes of a worker's private working copy once the worker is finished with it.
 */
@FunctionalInterface
public interface IsolatedContextReleaser {
    IsolatedContextReleaser NONE = context -> {
    };

    void release(Path context) throws IOException;
}
