package io.archive.vectors.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.archive.vectors.IndexMode;

/**
 * Snapshot of what the service is serving.
 */
public record ServiceStats(
    @JsonProperty("status") ServiceStatus status,
    @JsonProperty("total_documents") long totalDocuments,
    @JsonProperty("model") String model,
    @JsonProperty("mode") IndexMode mode,
    @JsonProperty("summarizer") String summarizer,
    @JsonProperty("summarizer_available") boolean summarizerAvailable
) {}
