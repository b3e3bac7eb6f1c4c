package io.taskloom.coordination;

import com.fasterxml.jackson.core.type.TypeReference;
import io.taskloom.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Oracle over per-item file footprints declared in a JSON file of the form
 * {@code {"12": ["src/a", "docs/b.md"]}}. Items without a declared footprint are never
 * considered independent.
 */
public final class DeclaredFootprintOracle implements DisjointnessOracle {
    private static final TypeReference<Map<String, List<String>>> FILE_TYPE = new TypeReference<>() {
    };

    private final Map<Integer, Set<Path>> footprints;

    public DeclaredFootprintOracle(Map<Integer, ? extends Iterable<String>> footprints) {
        Map<Integer, Set<Path>> normalized = new HashMap<>();
        footprints.forEach((item, paths) -> {
            Set<Path> set = new LinkedHashSet<>();
            for (String raw : paths) {
                if (raw != null && !raw.isBlank()) {
                    set.add(Path.of(raw.trim()).normalize());
                }
            }
            normalized.put(item, set);
        });
        this.footprints = normalized;
    }

    /**
     * A missing file means no footprints are known, so every pair is treated as dependent.
     */
    public static DeclaredFootprintOracle load(Path file) {
        if (file == null || !Files.exists(file)) {
            return new DeclaredFootprintOracle(Map.of());
        }
        try {
            Map<String, List<String>> raw = Jsons.mapper().readValue(file.toFile(), FILE_TYPE);
            Map<Integer, List<String>> parsed = new HashMap<>();
            for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
                parsed.put(Integer.parseInt(entry.getKey().trim()), entry.getValue() == null ? List.of() : entry.getValue());
            }
            return new DeclaredFootprintOracle(parsed);
        } catch (IOException | NumberFormatException e) {
            throw new RuntimeException("Failed to read footprint file " + file, e);
        }
    }

    @Override
    public boolean areIndependent(int itemA, int itemB) {
        Set<Path> a = footprints.get(itemA);
        Set<Path> b = footprints.get(itemB);
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return false;
        }
        for (Path left : a) {
            for (Path right : b) {
                if (left.startsWith(right) || right.startsWith(left)) {
                    return false;
                }
            }
        }
        return true;
    }

    public boolean knows(int item) {
        return footprints.containsKey(item);
    }
}
