package io.archive.vectors.build;

import io.archive.vectors.IndexConfig;
import io.archive.vectors.IndexMode;

import java.nio.file.Path;

/**
 * Configuration for a full index build.
 */
public record BuildConfig(
    /** Directory of {@code .npy} vector arrays */
    Path embeddingsDir,

    /** Directory of {@code .csv} chunk metadata */
    Path chunksDir,

    /** Output index path; the database and resume log sit next to it */
    Path indexPath,

    /** Index parameters */
    IndexConfig indexConfig,

    /** Largest file count built as an exact index */
    int exactThreshold,

    /** Forced mode, or null to select by file count */
    IndexMode modeOverride,

    /** Files at the head of the corpus that training samples are drawn from */
    int trainingFiles,

    /** Maximum training sample size */
    int trainingBudget,

    /** Files between checkpoints in compressed and graph mode */
    int compressedCheckpointInterval,

    /** Files between checkpoints in exact mode */
    int exactCheckpointInterval,

    /** Whether chunk text is copied into the metadata store */
    boolean storeText,

    /** Seed for training subsampling */
    long seed
) {
    public static BuildConfig defaults(Path embeddingsDir, Path chunksDir, Path indexPath) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, IndexConfig.defaultConfig(),
            200, null, 30, 500_000, 50, 10, false, 42L);
    }

    public BuildConfig withIndexConfig(IndexConfig indexConfig) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressedCheckpointInterval, exactCheckpointInterval, storeText, seed);
    }

    public BuildConfig withExactThreshold(int exactThreshold) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressedCheckpointInterval, exactCheckpointInterval, storeText, seed);
    }

    public BuildConfig withModeOverride(IndexMode modeOverride) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressedCheckpointInterval, exactCheckpointInterval, storeText, seed);
    }

    public BuildConfig withTrainingBudget(int trainingBudget) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressedCheckpointInterval, exactCheckpointInterval, storeText, seed);
    }

    public BuildConfig withCheckpointIntervals(int compressed, int exact) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressed, exact, storeText, seed);
    }

    public BuildConfig withStoreText(boolean storeText) {
        return new BuildConfig(embeddingsDir, chunksDir, indexPath, indexConfig, exactThreshold, modeOverride,
            trainingFiles, trainingBudget, compressedCheckpointInterval, exactCheckpointInterval, storeText, seed);
    }

    public int checkpointInterval(IndexMode mode) {
        return Math.max(1, mode == IndexMode.EXACT ? exactCheckpointInterval : compressedCheckpointInterval);
    }

    public IndexArtifacts artifacts() {
        return IndexArtifacts.forBase(indexPath);
    }
}
