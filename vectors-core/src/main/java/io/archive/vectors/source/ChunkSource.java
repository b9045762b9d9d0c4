package io.archive.vectors.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * On-disk chunk corpus: {@code <name>.npy} vector arrays in one directory and
 * {@code <name>.csv} metadata files in another, positionally aligned.
 */
public class ChunkSource {

    private static final Logger log = LoggerFactory.getLogger(ChunkSource.class);

    private static final String VECTORS_SUFFIX = ".npy";
    private static final String METADATA_SUFFIX = ".csv";

    private final Path embeddingsDir;
    private final Path chunksDir;
    private final ChunkCsvReader csvReader;

    public ChunkSource(Path embeddingsDir, Path chunksDir) {
        this.embeddingsDir = embeddingsDir;
        this.chunksDir = chunksDir;
        this.csvReader = new ChunkCsvReader();
    }

    /**
     * Lists every vector array in name order, each paired with the metadata path
     * it should have.
     */
    public List<SourceBatch> list() throws IOException {
        if (!Files.isDirectory(embeddingsDir)) {
            throw new IOException("Embeddings directory not found: " + embeddingsDir);
        }
        try (Stream<Path> files = Files.list(embeddingsDir)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(VECTORS_SUFFIX))
                .filter(Files::isRegularFile)
                .map(p -> p.getFileName().toString())
                .sorted()
                .map(f -> batch(f.substring(0, f.length() - VECTORS_SUFFIX.length())))
                .collect(Collectors.toList());
        }
    }

    /**
     * Lists metadata files in name order, whether or not they have vectors.
     */
    public List<Path> listMetadataFiles() throws IOException {
        if (!Files.isDirectory(chunksDir)) {
            throw new IOException("Chunks directory not found: " + chunksDir);
        }
        try (Stream<Path> files = Files.list(chunksDir)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(METADATA_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    public SourceBatch batch(String name) {
        return new SourceBatch(name,
            embeddingsDir.resolve(name + VECTORS_SUFFIX),
            chunksDir.resolve(name + METADATA_SUFFIX));
    }

    /**
     * Loads vectors and metadata rows of one batch.
     *
     * @param includeText whether row text is kept in memory
     * @throws BatchFormatException if the batch is empty or the counts differ
     */
    public LoadedBatch load(SourceBatch batch, boolean includeText) throws IOException {
        float[][] vectors = loadVectors(batch);
        List<ChunkRow> rows = csvReader.readRows(batch.metadataPath(), includeText);
        if (rows.isEmpty()) {
            throw new BatchFormatException(batch.name(), "metadata file has no rows");
        }
        return new LoadedBatch(batch, vectors, rows);
    }

    public float[][] loadVectors(SourceBatch batch) throws IOException {
        return NpyReader.read(batch.vectorsPath());
    }

    public List<ChunkRow> loadRows(SourceBatch batch, boolean includeText) throws IOException {
        return csvReader.readRows(batch.metadataPath(), includeText);
    }

    /**
     * Text of one chunk, or empty if the file or row is gone or unreadable.
     */
    public Optional<String> readText(String sourceName, int rowOffset) {
        Path csv = chunksDir.resolve(sourceName + METADATA_SUFFIX);
        if (!Files.isRegularFile(csv)) {
            log.warn("Chunk file not found for text lookup: {}", csv);
            return Optional.empty();
        }
        try {
            return csvReader.readText(csv, rowOffset);
        } catch (IOException | RuntimeException e) {
            log.warn("Text lookup failed for {} row {}: {}", sourceName, rowOffset, e.getMessage());
            return Optional.empty();
        }
    }

    public long countRows(Path csv) throws IOException {
        return csvReader.countRows(csv);
    }

    public Path getEmbeddingsDir() {
        return embeddingsDir;
    }

    public Path getChunksDir() {
        return chunksDir;
    }
}
