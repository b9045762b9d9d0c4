package io.archive.vectors.source;

import io.archive.vectors.ArchiveFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ChunkSourceTest {

    @TempDir
    Path tempDir;

    private Path embeddingsDir;
    private Path chunksDir;
    private ChunkSource source;
    private Random random;

    @BeforeEach
    void setUp() {
        embeddingsDir = tempDir.resolve("embeddings");
        chunksDir = tempDir.resolve("chunked");
        source = new ChunkSource(embeddingsDir, chunksDir);
        random = new Random(42);
    }

    @Test
    void testListsBatchesInNameOrder() throws IOException {
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, "b_1900", ArchiveFixtures.randomVectors(random, 2), "Herald", 0);
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, "a_1899", ArchiveFixtures.randomVectors(random, 2), "Herald", 0);
        Files.writeString(embeddingsDir.resolve("notes.txt"), "ignored");

        List<SourceBatch> batches = source.list();

        assertEquals(List.of("a_1899", "b_1900"), batches.stream().map(SourceBatch::name).collect(Collectors.toList()));
        assertTrue(batches.get(0).hasMetadata());
    }

    @Test
    void testMissingDirectoryIsAnError() {
        assertThrows(IOException.class, () -> source.list());
    }

    @Test
    void testBatchWithoutCsvHasNoMetadata() throws IOException {
        Files.createDirectories(embeddingsDir);
        NpyWriter.write(embeddingsDir.resolve("orphan.npy"), ArchiveFixtures.randomVectors(random, 1));

        assertFalse(source.list().get(0).hasMetadata());
    }

    @Test
    void testLoadPairsVectorsWithRows() throws IOException {
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, "batch", ArchiveFixtures.randomVectors(random, 4), "Herald", 5);

        LoadedBatch loaded = source.load(source.batch("batch"), true);

        assertEquals(4, loaded.size());
        assertEquals(ArchiveFixtures.DIMENSIONS, loaded.dimensions());
        assertEquals("batch-3", loaded.rows().get(3).articleId());
        assertEquals("Text of batch row 3, with a comma", loaded.rows().get(3).text());
    }

    @Test
    void testRowCountMismatchRejected() throws IOException {
        Files.createDirectories(embeddingsDir);
        NpyWriter.write(embeddingsDir.resolve("short.npy"), ArchiveFixtures.randomVectors(random, 3));
        ArchiveFixtures.writeCsv(chunksDir, "short", ArchiveFixtures.rows("short", 2, "Herald", 0));

        assertThrows(BatchFormatException.class, () -> source.load(source.batch("short"), false));
    }

    @Test
    void testEmptyCsvRejected() throws IOException {
        Files.createDirectories(embeddingsDir);
        NpyWriter.write(embeddingsDir.resolve("empty.npy"), ArchiveFixtures.randomVectors(random, 1));
        ArchiveFixtures.writeCsv(chunksDir, "empty", List.of());

        assertThrows(BatchFormatException.class, () -> source.load(source.batch("empty"), false));
    }

    @Test
    void testReadTextFromSourceFile() throws IOException {
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, "batch", ArchiveFixtures.randomVectors(random, 3), "Herald", 0);

        assertEquals("Text of batch row 1, with a comma", source.readText("batch", 1).orElseThrow());
        assertTrue(source.readText("batch", 10).isEmpty());
        assertTrue(source.readText("gone", 0).isEmpty());
    }
}
