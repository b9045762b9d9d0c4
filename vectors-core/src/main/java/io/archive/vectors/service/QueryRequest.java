package io.archive.vectors.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A question for the archive.
 *
 * @param query free text
 * @param topK results wanted, 0 for the default
 * @param useSynthesizer whether a generative answer should replace the extractive one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(
    @JsonProperty("query") String query,
    @JsonProperty("top_k") int topK,
    @JsonProperty("use_synthesizer") boolean useSynthesizer
) {
    public static QueryRequest of(String query) {
        return new QueryRequest(query, 0, false);
    }

    public QueryRequest withTopK(int topK) {
        return new QueryRequest(query, topK, useSynthesizer);
    }

    public QueryRequest withSynthesizer(boolean useSynthesizer) {
        return new QueryRequest(query, topK, useSynthesizer);
    }
}
