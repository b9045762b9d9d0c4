package io.archive.vectors.build;

import io.archive.vectors.IndexMode;

/**
 * Picks the index mode from the corpus size: up to the threshold, exact search
 * over raw vectors; beyond it, the compressed clustered index.
 */
public final class ModeSelector {

    private final int exactThreshold;
    private final IndexMode override;

    public ModeSelector(int exactThreshold, IndexMode override) {
        if (exactThreshold < 0) {
            throw new IllegalArgumentException("exactThreshold must be >= 0");
        }
        this.exactThreshold = exactThreshold;
        this.override = override;
    }

    public static ModeSelector from(BuildConfig config) {
        return new ModeSelector(config.exactThreshold(), config.modeOverride());
    }

    public IndexMode select(int fileCount) {
        if (override != null) {
            return override;
        }
        return fileCount <= exactThreshold ? IndexMode.EXACT : IndexMode.COMPRESSED;
    }
}
