package io.archive.vectors.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Files that make up one persisted index, paired by base name:
 * {@code <base>.index}, {@code <base>.db} and the {@code <base>.committed} resume log.
 */
public record IndexArtifacts(Path index, Path database, Path resumeLog) {

    private static final String INDEX_SUFFIX = ".index";

    /**
     * Derives the artifact set from the index path, or from a bare base path.
     */
    public static IndexArtifacts forBase(Path path) {
        String fileName = path.getFileName().toString();
        String base = fileName.endsWith(INDEX_SUFFIX)
            ? fileName.substring(0, fileName.length() - INDEX_SUFFIX.length())
            : fileName;
        return new IndexArtifacts(
            path.resolveSibling(base + INDEX_SUFFIX),
            path.resolveSibling(base + ".db"),
            path.resolveSibling(base + ".committed"));
    }

    public boolean indexExists() {
        return Files.isRegularFile(index);
    }

    public boolean databaseExists() {
        return Files.isRegularFile(database);
    }

    /**
     * Removes all artifacts, including SQLite journal side files.
     */
    public void deleteAll() throws IOException {
        Files.deleteIfExists(index);
        Files.deleteIfExists(database);
        Files.deleteIfExists(database.resolveSibling(database.getFileName() + "-wal"));
        Files.deleteIfExists(database.resolveSibling(database.getFileName() + "-shm"));
        Files.deleteIfExists(resumeLog);
    }
}
