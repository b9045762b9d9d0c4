package io.archive.vectors.service;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer and sources for one request. Never carries an exception; failures are a status.
 */
public record QueryResponse(
    @JsonProperty("status") ServiceStatus status,
    @JsonProperty("answer") String answer,
    @JsonProperty("sources") List<SourceView> sources,
    @JsonProperty("synthesized") boolean synthesized
) {
    public QueryResponse {
        sources = List.copyOf(sources);
    }

    static QueryResponse notInitialized(String reason) {
        return new QueryResponse(ServiceStatus.NOT_INITIALIZED,
            "The archive search is not initialized: " + reason, List.of(), false);
    }

    static QueryResponse unavailable(String reason) {
        return new QueryResponse(ServiceStatus.UNAVAILABLE,
            "The archive search is temporarily unavailable: " + reason, List.of(), false);
    }
}
