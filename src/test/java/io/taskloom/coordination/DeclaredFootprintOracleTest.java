package io.taskloom.coordination;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.stream.Stream;

final class DeclaredFootprintOracleTest {

    @Test
    void loadsFootprintFileAndComparesByPathComponents() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-footprints-");
        try {
            Path file = root.resolve("footprints.json");
            Files.writeString(file, """
                    {
                      "10": ["src/app/Main.java", "docs/specs/10.md"],
                      "11": ["src/application"],
                      "12": ["src/app"],
                      "13": []
                    }
                    """, StandardCharsets.UTF_8);

            DeclaredFootprintOracle oracle = DeclaredFootprintOracle.load(file);

            Assertions.assertTrue(oracle.areIndependent(10, 11), "src/app and src/application do not overlap");
            Assertions.assertFalse(oracle.areIndependent(10, 12));
            Assertions.assertFalse(oracle.areIndependent(12, 10));
            Assertions.assertFalse(oracle.areIndependent(10, 13), "empty footprint is unknown");
            Assertions.assertFalse(oracle.areIndependent(10, 99));
            Assertions.assertTrue(oracle.knows(13));
            Assertions.assertFalse(oracle.knows(99));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileKnowsNothingAndMalformedFileFails() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-footprints-bad-");
        try {
            DeclaredFootprintOracle empty = DeclaredFootprintOracle.load(root.resolve("absent.json"));
            Assertions.assertFalse(empty.areIndependent(1, 2));

            Path bad = root.resolve("bad.json");
            Files.writeString(bad, "{\"one\": [\"src\"]}", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> DeclaredFootprintOracle.load(bad));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reloadingOracleSeesEditedFile() throws Exception {
        Path root = Files.createTempDirectory("taskloom-test-footprints-reload-");
        try {
            Path file = root.resolve("footprints.json");
            ReloadingFootprintOracle oracle = new ReloadingFootprintOracle(file);
            Assertions.assertFalse(oracle.areIndependent(1, 2));

            Files.writeString(file, "{\"1\": [\"src/a\"], \"2\": [\"src/b\"]}", StandardCharsets.UTF_8);
            Assertions.assertTrue(oracle.areIndependent(1, 2));

            Files.writeString(file, "{\"1\": [\"src\"], \"2\": [\"src/b\"]}", StandardCharsets.UTF_8);
            Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(5)));
            Assertions.assertFalse(oracle.areIndependent(1, 2));
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
