package io.archive.vectors.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A passage as shown to the reader.
 */
public record SourceView(
    @JsonProperty("title") String title,
    @JsonProperty("snippet") String snippet,
    @JsonProperty("date") String date,
    @JsonProperty("paper") String paper,
    @JsonProperty("article_id") String articleId,
    @JsonProperty("link") String link,
    @JsonProperty("relevance") String relevance
) {}
