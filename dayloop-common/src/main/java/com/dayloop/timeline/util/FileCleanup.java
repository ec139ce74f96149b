package com.dayloop.timeline.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Best-effort file removal. Called only after the owning rows are gone, so a failure
 * here leaves an orphan file, never a dangling row.
 */
@Slf4j
public final class FileCleanup {

    private FileCleanup() {
    }

    public static int deleteQuietly(Collection<String> paths) {
        int deleted = 0;
        for (String p : paths) {
            if (p == null || p.isBlank()) {
                continue;
            }
            try {
                if (Files.deleteIfExists(Paths.get(p))) {
                    deleted++;
                }
            } catch (IOException | SecurityException e) {
                log.warn("Failed to delete {}: {}", p, e.getMessage());
            }
        }
        return deleted;
    }

    public static void deleteTree(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", dir, e.getMessage());
        }
    }
}
