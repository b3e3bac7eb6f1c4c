package io.taskloom.observability;

import io.taskloom.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of controller and supervisor decisions: spawns, kills, merges,
 * alerts and cycle failures.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final Clock clock;

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("task_id", event.taskId());
        row.put("details", event.details());
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    /**
     * Last {@code limit} rows, oldest first. Lines that are not valid JSON are skipped.
     */
    public synchronized List<Map<String, Object>> recent(int limit) {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        List<Map<String, Object>> out = new ArrayList<>();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        for (String line : lines.subList(from, lines.size())) {
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                out.add(Jsons.toMap(line));
            } catch (RuntimeException ignored) {
                // torn trailing line from a crashed writer
            }
        }
        return out;
    }

    public Path file() {
        return auditFile;
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String taskId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    String taskId, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, taskId, details == null ? Map.of() : details);
        }
    }
}
