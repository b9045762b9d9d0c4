package io.archive.vectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static io.archive.vectors.ArchiveFixtures.DIMENSIONS;
import static io.archive.vectors.ArchiveFixtures.MODEL_ID;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the three VectorIndex modes.
 */
class VectorIndexTest {

    @TempDir
    Path tempDir;

    private Random random;

    @BeforeEach
    void setUp() {
        random = new Random(42);
    }

    // ==================== Creation Tests ====================

    @Test
    void testCreateDispatchesOnMode() {
        assertInstanceOf(FlatVectorIndex.class, VectorIndex.create(IndexMode.EXACT, ArchiveFixtures.config()));
        assertInstanceOf(IvfPqVectorIndex.class, VectorIndex.create(IndexMode.COMPRESSED, ArchiveFixtures.config()));
        assertInstanceOf(HnswVectorIndex.class, VectorIndex.create(IndexMode.GRAPH, ArchiveFixtures.config()));
    }

    @Test
    void testEmptyIndexReturnsNoResults() {
        for (IndexMode mode : IndexMode.values()) {
            VectorIndex index = VectorIndex.create(mode, ArchiveFixtures.config());
            assertTrue(index.isEmpty());
            assertTrue(index.search(ArchiveFixtures.unitVectors(random, 1)[0], 5).isEmpty(), mode.name());
        }
    }

    // ==================== Id Assignment Tests ====================

    @Test
    void testIdsAreContiguousAcrossBatches() {
        for (IndexMode mode : IndexMode.values()) {
            VectorIndex index = trainedIndex(mode);
            assertEquals(0, index.add(ArchiveFixtures.unitVectors(random, 7)));
            assertEquals(7, index.add(ArchiveFixtures.unitVectors(random, 5)));
            assertEquals(12, index.size());
        }
    }

    @Test
    void testDimensionMismatchRejected() {
        FlatVectorIndex index = new FlatVectorIndex(ArchiveFixtures.config());
        assertThrows(IllegalArgumentException.class, () -> index.add(new float[][]{new float[DIMENSIONS + 1]}));
        assertEquals(0, index.size());
    }

    // ==================== Search Tests ====================

    @Test
    void testExactSelfSearchScoresOne() {
        FlatVectorIndex index = new FlatVectorIndex(ArchiveFixtures.config());
        float[][] vectors = ArchiveFixtures.unitVectors(random, 50);
        index.add(vectors);

        List<Neighbor> hits = index.search(vectors[17], 3);

        assertEquals(3, hits.size());
        assertEquals(17, hits.get(0).id());
        assertEquals(1.0f, hits.get(0).score(), 1e-5f);
        assertTrue(hits.get(0).score() >= hits.get(1).score());
        assertTrue(hits.get(1).score() >= hits.get(2).score());
    }

    @Test
    void testSearchReturnsAtMostSize() {
        FlatVectorIndex index = new FlatVectorIndex(ArchiveFixtures.config());
        index.add(ArchiveFixtures.unitVectors(random, 3));

        assertEquals(3, index.search(ArchiveFixtures.unitVectors(random, 1)[0], 10).size());
    }

    @Test
    void testCompressedFindsSelf() {
        IvfPqVectorIndex index = (IvfPqVectorIndex) trainedIndex(IndexMode.COMPRESSED);
        float[][] vectors = ArchiveFixtures.unitVectors(random, 100);
        index.add(vectors);
        index.setNprobe(index.getClusterCount());

        List<Neighbor> hits = index.search(vectors[73], 5);

        assertEquals(73, hits.get(0).id());
        assertTrue(hits.get(0).score() > 0.9f);
        assertEquals(ScoreKind.SIMILARITY, index.scoreKind());
    }

    @Test
    void testCompressedRequiresTraining() {
        IvfPqVectorIndex index = new IvfPqVectorIndex(ArchiveFixtures.config());
        assertFalse(index.isTrained());
        assertThrows(IllegalStateException.class, () -> index.add(ArchiveFixtures.unitVectors(random, 1)));
        assertThrows(TrainingException.class, () -> index.train(new float[0][]));
    }

    @Test
    void testClusterCountFollowsSampleSize() {
        IvfPqVectorIndex index = new IvfPqVectorIndex(ArchiveFixtures.config());
        index.train(ArchiveFixtures.unitVectors(random, 400));

        assertEquals(ArchiveFixtures.config().clustersFor(400), index.getClusterCount());
    }

    @Test
    void testGraphReportsDistance() {
        HnswVectorIndex index = new HnswVectorIndex(ArchiveFixtures.config());
        float[][] vectors = ArchiveFixtures.unitVectors(random, 100);
        index.add(vectors);

        List<Neighbor> hits = index.search(vectors[42], 3);

        assertEquals(ScoreKind.DISTANCE, index.scoreKind());
        assertEquals(42, hits.get(0).id());
        assertEquals(0.0f, hits.get(0).score(), 1e-5f);
    }

    // ==================== Persistence Tests ====================

    @Test
    void testSaveAndLoadEveryMode() throws IOException {
        for (IndexMode mode : IndexMode.values()) {
            VectorIndex index = trainedIndex(mode);
            float[][] vectors = ArchiveFixtures.unitVectors(random, 120);
            index.add(vectors);
            List<Neighbor> before = index.search(vectors[9], 4);

            Path file = tempDir.resolve(mode.name().toLowerCase() + ".index");
            index.save(file);
            VectorIndex loaded = VectorIndex.load(file);

            assertEquals(mode, loaded.mode());
            assertEquals(MODEL_ID, loaded.getModelId());
            assertEquals(DIMENSIONS, loaded.getDimensions());
            assertEquals(120, loaded.size());
            assertEquals(before.get(0).id(), loaded.search(vectors[9], 4).get(0).id());
            assertFalse(Files.exists(tempDir.resolve(file.getFileName() + ".tmp")));
        }
    }

    @Test
    void testLoadedIndexKeepsAssigningIds() throws IOException {
        VectorIndex index = trainedIndex(IndexMode.COMPRESSED);
        index.add(ArchiveFixtures.unitVectors(random, 10));
        Path file = tempDir.resolve("resume.index");
        index.save(file);

        VectorIndex loaded = VectorIndex.load(file);

        assertTrue(loaded.isTrained());
        assertEquals(10, loaded.add(ArchiveFixtures.unitVectors(random, 3)));
    }

    @Test
    void testLoadedGraphKeepsCapacity() throws IOException {
        VectorIndex index = new HnswVectorIndex(ArchiveFixtures.config());
        float[][] vectors = ArchiveFixtures.unitVectors(random, 5);
        index.add(vectors);
        Path file = tempDir.resolve("graph.index");
        index.save(file);

        VectorIndex loaded = VectorIndex.load(file);

        assertEquals(5, loaded.add(ArchiveFixtures.unitVectors(random, 20)));
        assertEquals(25, loaded.size());
        assertEquals(2, loaded.search(vectors[2], 1).get(0).id());
    }

    @Test
    void testLoadRejectsUnknownMagic() {
        byte[] bytes = "NOPE and then some".getBytes(StandardCharsets.US_ASCII);
        assertThrows(IOException.class, () -> VectorIndex.load(new ByteArrayInputStream(bytes)));
    }

    @Test
    void testLoadRejectsFutureVersion() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream dos = new DataOutputStream(bytes);
        dos.write(FlatVectorIndex.MAGIC);
        dos.writeShort(99);
        dos.flush();

        assertThrows(UnsupportedFormatException.class,
            () -> VectorIndex.load(new ByteArrayInputStream(bytes.toByteArray())));
    }

    // ==================== Helper Methods ====================

    private VectorIndex trainedIndex(IndexMode mode) {
        VectorIndex index = VectorIndex.create(mode, ArchiveFixtures.config());
        if (mode.requiresTraining()) {
            index.train(ArchiveFixtures.unitVectors(random, 400));
        }
        return index;
    }
}
