package io.archive.vectors.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A vector array and its metadata file, paired by base name.
 *
 * @param name base name shared by both files, recorded as the source file of every row
 * @param vectorsPath the {@code .npy} array
 * @param metadataPath the {@code .csv} rows; the file may not exist
 */
public record SourceBatch(String name, Path vectorsPath, Path metadataPath) {

    public SourceBatch {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(vectorsPath, "vectorsPath cannot be null");
        Objects.requireNonNull(metadataPath, "metadataPath cannot be null");
    }

    public boolean hasMetadata() {
        return Files.isRegularFile(metadataPath);
    }
}
