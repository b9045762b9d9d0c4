package io.archive.vectors.retrieval;

import java.time.Duration;

/**
 * Query-time settings.
 */
public record RetrievalConfig(
    /** Results returned when the request does not say */
    int defaultTopK,

    /** Upper bound on results per query */
    int maxTopK,

    /** Clusters probed by a compressed index */
    int nprobe,

    /** Bound on one query embedding call */
    Duration embedTimeout,

    /** Archive name used in answers */
    String archiveName,

    /** Prefix joined with an article id to link to the archive */
    String linkBaseUrl,

    /** Characters of text shown per source */
    int snippetLength
) {
    public static final String DEFAULT_ARCHIVE = "Utah Digital Newspapers";
    public static final String DEFAULT_LINK_BASE = "https://newspapers.lib.utah.edu/details?id=";

    public static RetrievalConfig defaults() {
        return new RetrievalConfig(5, 20, 32, Duration.ofSeconds(30), DEFAULT_ARCHIVE, DEFAULT_LINK_BASE, 300);
    }

    public RetrievalConfig withNprobe(int nprobe) {
        return new RetrievalConfig(defaultTopK, maxTopK, nprobe, embedTimeout, archiveName, linkBaseUrl, snippetLength);
    }

    public RetrievalConfig withEmbedTimeout(Duration embedTimeout) {
        return new RetrievalConfig(defaultTopK, maxTopK, nprobe, embedTimeout, archiveName, linkBaseUrl, snippetLength);
    }

    public RetrievalConfig withArchive(String archiveName, String linkBaseUrl) {
        return new RetrievalConfig(defaultTopK, maxTopK, nprobe, embedTimeout, archiveName, linkBaseUrl, snippetLength);
    }

    /**
     * Requested count limited to {@code [1, maxTopK]}; non-positive means the default.
     */
    public int effectiveTopK(int requested) {
        if (requested <= 0) {
            return defaultTopK;
        }
        return Math.min(requested, maxTopK);
    }
}
