package io.archive.vectors.build;

import io.archive.vectors.ArchiveFixtures;
import io.archive.vectors.IndexConsistencyException;
import io.archive.vectors.IndexMode;
import io.archive.vectors.Neighbor;
import io.archive.vectors.VectorIndex;
import io.archive.vectors.VectorMath;
import io.archive.vectors.source.NpyWriter;
import io.archive.vectors.store.ChunkRecord;
import io.archive.vectors.store.MetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IndexBuilder - checkpointed, resumable ingestion.
 */
class IndexBuilderTest {

    @TempDir
    Path tempDir;

    private Path embeddingsDir;
    private Path chunksDir;
    private IndexArtifacts artifacts;
    private Random random;

    @BeforeEach
    void setUp() {
        embeddingsDir = tempDir.resolve("embeddings");
        chunksDir = tempDir.resolve("chunked");
        artifacts = IndexArtifacts.forBase(tempDir.resolve("out/udn.index"));
        random = new Random(42);
    }

    // ==================== Fresh Build Tests ====================

    @Test
    void testExactBuildIsConsistent() throws IOException {
        writeBatches(3, 10);

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(IndexMode.EXACT, report.mode());
        assertEquals(3, report.processed());
        assertEquals(30, report.totalVectors());
        assertEquals(30, report.metadataRows());
        assertTrue(report.isConsistent());

        try (VectorIndex index = VectorIndex.load(artifacts.index());
             MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
            assertEquals(30, index.size());
            assertEquals(30, store.count());
            assertEquals(29, store.maxId());
        }
        assertEquals(Set.of("f00", "f01", "f02"), IngestionTracker.open(artifacts.resumeLog()).committed());
    }

    @Test
    void testIdsFollowFileAndRowOrder() throws IOException {
        float[][] second = writeBatches(2, 10).get(1);

        new IndexBuilder(config()).build();

        try (VectorIndex index = VectorIndex.load(artifacts.index());
             MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
            ChunkRecord record = store.find(13).orElseThrow();
            assertEquals("f01", record.sourceFile());
            assertEquals(3, record.rowOffset());
            assertEquals("f01-3", record.articleId());

            List<Neighbor> hits = index.search(VectorMath.normalizedCopy(second[3]), 1);
            assertEquals(13, hits.get(0).id());
            assertEquals(1.0f, hits.get(0).score(), 1e-5f);
        }
    }

    @Test
    void testCompressedModeAboveThreshold() throws IOException {
        writeBatches(3, 60);

        BuildReport report = new IndexBuilder(config().withExactThreshold(2)).build();

        assertEquals(IndexMode.COMPRESSED, report.mode());
        assertEquals(180, report.totalVectors());
        assertTrue(report.isConsistent());
        try (VectorIndex index = VectorIndex.load(artifacts.index())) {
            assertEquals(IndexMode.COMPRESSED, index.mode());
            assertTrue(index.isTrained());
        }
    }

    @Test
    void testGraphModeOverride() throws IOException {
        writeBatches(2, 15);

        BuildReport report = new IndexBuilder(config().withModeOverride(IndexMode.GRAPH)).build();

        assertEquals(IndexMode.GRAPH, report.mode());
        assertEquals(30, report.totalVectors());
    }

    @Test
    void testStoreTextKeepsChunkText() throws IOException {
        writeBatches(1, 3);

        new IndexBuilder(config().withStoreText(true)).build();

        try (MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
            assertTrue(store.storesInlineText());
            assertEquals("Text of f00 row 2, with a comma", store.find(2).orElseThrow().text());
        }
    }

    @Test
    void testEmptyCorpusWritesEmptyIndex() throws IOException {
        Files.createDirectories(embeddingsDir);

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(0, report.totalVectors());
        assertTrue(artifacts.indexExists());
        try (VectorIndex index = VectorIndex.load(artifacts.index())) {
            assertTrue(index.isEmpty());
        }
    }

    // ==================== Rejected Input Tests ====================

    @Test
    void testMissingCsvSkipped() throws IOException {
        writeBatches(2, 5);
        Files.createDirectories(embeddingsDir);
        NpyWriter.write(embeddingsDir.resolve("f09.npy"), ArchiveFixtures.randomVectors(random, 4));

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(1, report.skipped());
        assertEquals(10, report.totalVectors());
        assertTrue(report.isConsistent());
    }

    @Test
    void testRowMismatchErroredAndRetried() throws IOException {
        writeBatches(2, 5);
        NpyWriter.write(embeddingsDir.resolve("f05.npy"), ArchiveFixtures.randomVectors(random, 4));
        ArchiveFixtures.writeCsv(chunksDir, "f05", ArchiveFixtures.rows("f05", 3, "Herald", 5));

        BuildReport first = new IndexBuilder(config()).build();

        assertEquals(1, first.errored());
        assertEquals(10, first.totalVectors());
        assertFalse(IngestionTracker.open(artifacts.resumeLog()).isCommitted("f05"));

        ArchiveFixtures.writeCsv(chunksDir, "f05", ArchiveFixtures.rows("f05", 4, "Herald", 5));
        BuildReport second = new IndexBuilder(config()).build();

        assertEquals(1, second.processed());
        assertEquals(14, second.totalVectors());
        assertTrue(second.isConsistent());
    }

    @Test
    void testDimensionMismatchErrored() throws IOException {
        writeBatches(1, 5);
        NpyWriter.write(embeddingsDir.resolve("f07.npy"), new float[][]{{1f, 2f}, {3f, 4f}});
        ArchiveFixtures.writeCsv(chunksDir, "f07", ArchiveFixtures.rows("f07", 2, "Herald", 7));

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(1, report.errored());
        assertEquals(5, report.totalVectors());
    }

    // ==================== Resume Tests ====================

    @Test
    void testSecondRunIsIdempotent() throws IOException {
        writeBatches(3, 10);
        new IndexBuilder(config()).build();

        BuildReport again = new IndexBuilder(config()).build();

        assertEquals(0, again.processed());
        assertEquals(3, again.alreadyCommitted());
        assertEquals(0, again.vectorsAdded());
        assertEquals(30, again.totalVectors());
        assertEquals(30, again.metadataRows());
    }

    @Test
    void testResumeAppendsNewFiles() throws IOException {
        writeBatches(2, 10);
        new IndexBuilder(config()).build();
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, "f02", ArchiveFixtures.randomVectors(random, 6), "Tribune", 2);

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(1, report.processed());
        assertEquals(2, report.alreadyCommitted());
        assertEquals(26, report.totalVectors());
        try (MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
            assertEquals("f02", store.find(20).orElseThrow().sourceFile());
            assertEquals("f02", store.find(25).orElseThrow().sourceFile());
        }
    }

    @Test
    void testResumeKeepsExistingMode() throws IOException {
        writeBatches(2, 10);
        new IndexBuilder(config()).build();
        writeBatch("f02", 10);

        BuildReport report = new IndexBuilder(config().withExactThreshold(1)).build();

        assertEquals(IndexMode.EXACT, report.mode());
    }

    @Test
    void testLostResumeLogRebuiltFromStore() throws IOException {
        writeBatches(3, 10);
        new IndexBuilder(config()).build();
        Files.delete(artifacts.resumeLog());

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(0, report.processed());
        assertEquals(3, report.alreadyCommitted());
        assertEquals(30, report.totalVectors());
    }

    @Test
    void testRowsBeyondCheckpointTruncated() throws IOException {
        writeBatches(2, 10);
        new IndexBuilder(config()).build();

        // Simulate a crash after the store commit but before the index save
        try (MetadataStore store = MetadataStore.openForWriting(artifacts.database(), false)) {
            List<ChunkRecord> extra = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                extra.add(new ChunkRecord(20 + i, "x", "", "", "", "f02", i, null));
            }
            store.insertAll(extra);
            store.commit();
        }
        writeBatch("f02", 5);

        BuildReport report = new IndexBuilder(config()).build();

        assertEquals(1, report.processed());
        assertEquals(25, report.totalVectors());
        assertEquals(25, report.metadataRows());
        try (MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
            assertEquals("f02-0", store.find(20).orElseThrow().articleId());
        }
    }

    @Test
    void testStoreBehindIndexRefused() throws IOException {
        writeBatches(2, 10);
        new IndexBuilder(config()).build();
        try (MetadataStore store = MetadataStore.openForWriting(artifacts.database(), false)) {
            store.truncateFrom(15);
        }

        IndexConsistencyException e = assertThrows(IndexConsistencyException.class,
            () -> new IndexBuilder(config()).build());
        assertEquals(20, e.getIndexVectors());
        assertEquals(15, e.getStoreRows());
    }

    @Test
    void testReconcileDropsLogEntriesWithoutRows() throws IOException {
        IndexBuilder builder = new IndexBuilder(config());
        IngestionTracker tracker = IngestionTracker.open(artifacts.resumeLog());
        tracker.markCommitted(List.of("f00", "ghost"));

        VectorIndex index = VectorIndex.create(IndexMode.EXACT, ArchiveFixtures.config());
        index.add(ArchiveFixtures.unitVectors(random, 2));
        try (MetadataStore store = MetadataStore.openForWriting(artifacts.database(), false)) {
            store.insertAll(List.of(
                new ChunkRecord(0, "a", "", "", "", "f00", 0, null),
                new ChunkRecord(1, "b", "", "", "", "f01", 0, null)));
            store.commit();

            builder.reconcile(index, store, tracker);
        }

        assertEquals(Set.of("f00", "f01"), tracker.committed());
    }

    // ==================== Helper Methods ====================

    private BuildConfig config() {
        return BuildConfig.defaults(embeddingsDir, chunksDir, artifacts.index())
            .withIndexConfig(ArchiveFixtures.config())
            .withCheckpointIntervals(2, 2);
    }

    private List<float[][]> writeBatches(int files, int rowsPerFile) throws IOException {
        List<float[][]> written = new ArrayList<>();
        for (int f = 0; f < files; f++) {
            written.add(writeBatch(String.format("f%02d", f), rowsPerFile));
        }
        return written;
    }

    private float[][] writeBatch(String name, int rows) throws IOException {
        float[][] vectors = ArchiveFixtures.randomVectors(random, rows);
        ArchiveFixtures.writeBatch(embeddingsDir, chunksDir, name, vectors, "Herald", 0);
        return vectors;
    }
}
