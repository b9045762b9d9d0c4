package io.archive.vectors.build;

import io.archive.vectors.IndexConfig;

import java.nio.file.Path;

/**
 * Configuration for a self-contained sample index with inline text.
 */
public record LiteConfig(
    Path embeddingsDir,
    Path chunksDir,

    /** Output index path, {@code lite.index} by default */
    Path indexPath,

    IndexConfig indexConfig,

    /** Documents to sample in total */
    int targetDocs,

    /** Evenly spaced source files to sample from */
    int sampleFiles,

    /** Inline text is cut to this many characters */
    int maxTextLength,

    long seed
) {
    public static LiteConfig defaults(Path embeddingsDir, Path chunksDir, Path outputDir) {
        return new LiteConfig(embeddingsDir, chunksDir, outputDir.resolve("lite.index"),
            IndexConfig.defaultConfig(), 25_000, 10, 1_000, 42L);
    }

    public LiteConfig withTargetDocs(int targetDocs) {
        return new LiteConfig(embeddingsDir, chunksDir, indexPath, indexConfig, targetDocs, sampleFiles, maxTextLength, seed);
    }

    public LiteConfig withSampleFiles(int sampleFiles) {
        return new LiteConfig(embeddingsDir, chunksDir, indexPath, indexConfig, targetDocs, sampleFiles, maxTextLength, seed);
    }

    public LiteConfig withIndexConfig(IndexConfig indexConfig) {
        return new LiteConfig(embeddingsDir, chunksDir, indexPath, indexConfig, targetDocs, sampleFiles, maxTextLength, seed);
    }

    public IndexArtifacts artifacts() {
        return IndexArtifacts.forBase(indexPath);
    }
}
