package io.taskloom.coordination;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Footprint oracle for a long-running controller: re-reads the footprint file whenever its
 * modification time or size changes.
 */
public final class ReloadingFootprintOracle implements DisjointnessOracle {
    private final Path file;
    private String loadedVersion;
    private DeclaredFootprintOracle current;

    public ReloadingFootprintOracle(Path file) {
        this.file = file;
    }

    @Override
    public boolean areIndependent(int itemA, int itemB) {
        return current().areIndependent(itemA, itemB);
    }

    synchronized DeclaredFootprintOracle current() {
        String version = version();
        if (current == null || !version.equals(loadedVersion)) {
            current = DeclaredFootprintOracle.load(file);
            loadedVersion = version;
        }
        return current;
    }

    private String version() {
        try {
            if (!Files.exists(file)) {
                return "missing";
            }
            return Files.getLastModifiedTime(file).toMillis() + ":" + Files.size(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat footprint file " + file, e);
        }
    }
}
