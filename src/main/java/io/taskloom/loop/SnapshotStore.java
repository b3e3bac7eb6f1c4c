package io.taskloom.loop;

import io.taskloom.config.ConfigurationException;
import io.taskloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Controller snapshot on disk. Saves go through a temp file and an atomic rename, so readers
 * only ever see a complete previous or a complete new snapshot.
 */
public final class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path file;

    public SnapshotStore(Path file) {
        this.file = file;
    }

    /**
     * @return empty when no snapshot exists or the file was unreadable and has been quarantined
     * @throws ConfigurationException when the snapshot was written by a newer schema
     */
    public Optional<ControllerSnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        ControllerSnapshot snapshot;
        try {
            snapshot = Jsons.mapper().readValue(file.toFile(), ControllerSnapshot.class);
        } catch (IOException e) {
            quarantine(e);
            return Optional.empty();
        }
        if (snapshot.schemaVersion() > ControllerSnapshot.CURRENT_SCHEMA_VERSION) {
            throw new ConfigurationException("Snapshot " + file + " has schema version " + snapshot.schemaVersion()
                    + ", this build reads up to " + ControllerSnapshot.CURRENT_SCHEMA_VERSION);
        }
        return Optional.of(snapshot);
    }

    public void save(ControllerSnapshot snapshot) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            try {
                Files.writeString(tmp, Jsons.toJson(snapshot), StandardCharsets.UTF_8);
                try {
                    Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to write snapshot " + file, e);
        }
    }

    public Path file() {
        return file;
    }

    private void quarantine(IOException cause) {
        Path target = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Snapshot {} is unreadable ({}); moved to {} and starting fresh", file, cause.getMessage(), target);
        } catch (IOException e) {
            throw new RuntimeException("Failed to quarantine unreadable snapshot " + file, e);
        }
    }
}
