package io.taskloom.backlog;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskloom.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Backlog kept in a JSON file, either a bare array of items or {@code {"items": [...]}}.
 * The version token is the file's modification time and size.
 */
public final class JsonBacklogSource implements BacklogSource {
    private final Path file;

    public JsonBacklogSource(Path file) {
        this.file = file;
    }

    @Override
    public List<BacklogItem> getAllItems() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            JsonNode root = Jsons.mapper().readTree(file.toFile());
            JsonNode array = root == null ? null : (root.isArray() ? root : root.get("items"));
            if (array == null || !array.isArray()) {
                throw new RuntimeException("Backlog file " + file + " holds neither an array nor an items array");
            }
            List<BacklogItem> items = new ArrayList<>();
            for (JsonNode node : array) {
                items.add(Jsons.mapper().treeToValue(node, BacklogItem.class));
            }
            items.sort(Comparator.comparingInt(BacklogItem::number));
            return items;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read backlog file " + file, e);
        }
    }

    @Override
    public String version() {
        try {
            if (!Files.exists(file)) {
                return "missing";
            }
            return Files.getLastModifiedTime(file).toMillis() + ":" + Files.size(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat backlog file " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
