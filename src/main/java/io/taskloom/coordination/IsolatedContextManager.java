package io.taskloom.coordination;

import io.taskloom.process.IsolatedContextReleaser;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Private working copies for workers that run in parallel, and their reconciliation into the
 * trunk.
 */
public interface IsolatedContextManager extends IsolatedContextReleaser {
    Path acquire(int itemNumber) throws IOException;

    /**
     * Workspace-relative paths the context changed compared to the trunk.
     */
    List<String> changedPaths(Path context) throws IOException;

    MergeAttempt merge(Path context, int itemNumber) throws IOException;

    record MergeAttempt(boolean merged, String error) {
        public static MergeAttempt ok() {
            return new MergeAttempt(true, null);
        }

        public static MergeAttempt conflict(String error) {
            return new MergeAttempt(false, error);
        }
    }
}
