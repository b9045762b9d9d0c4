package io.archive.vectors.build;

import io.archive.vectors.IndexMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModeSelectorTest {

    @Test
    void testExactUpToThreshold() {
        ModeSelector selector = new ModeSelector(200, null);

        assertEquals(IndexMode.EXACT, selector.select(0));
        assertEquals(IndexMode.EXACT, selector.select(200));
        assertEquals(IndexMode.COMPRESSED, selector.select(201));
    }

    @Test
    void testOverrideWins() {
        assertEquals(IndexMode.GRAPH, new ModeSelector(200, IndexMode.GRAPH).select(5));
        assertEquals(IndexMode.EXACT, new ModeSelector(200, IndexMode.EXACT).select(5000));
    }

    @Test
    void testDefaultThreshold() {
        BuildConfig config = BuildConfig.defaults(Path.of("emb"), Path.of("chunks"), Path.of("udn.index"));

        assertEquals(IndexMode.EXACT, ModeSelector.from(config).select(200));
        assertEquals(IndexMode.COMPRESSED, ModeSelector.from(config).select(201));
    }

    @Test
    void testNegativeThresholdRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ModeSelector(-1, null));
    }
}
