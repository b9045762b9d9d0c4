package io.archive.vectors.retrieval;

import java.util.Set;

/**
 * Display rules for passage fields.
 */
public final class SourceFormatter {

    public static final String UNTITLED = "Untitled Article";
    public static final String UNKNOWN_PAPER = "Unknown Paper";

    private static final Set<String> MISSING = Set.of("", "nan", "None");

    private final String linkBaseUrl;
    private final int snippetLength;

    public SourceFormatter(String linkBaseUrl, int snippetLength) {
        this.linkBaseUrl = linkBaseUrl;
        this.snippetLength = snippetLength;
    }

    public static SourceFormatter from(RetrievalConfig config) {
        return new SourceFormatter(config.linkBaseUrl(), config.snippetLength());
    }

    public String title(String title) {
        return isMissing(title) ? UNTITLED : title;
    }

    public String paper(String paper) {
        return isMissing(paper) ? UNKNOWN_PAPER : paper;
    }

    /**
     * ISO timestamps are cut to the date part.
     */
    public static String date(String date) {
        if (isMissing(date)) {
            return "";
        }
        int t = date.indexOf('T');
        return t >= 0 ? date.substring(0, t) : date;
    }

    public String snippet(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > snippetLength ? text.substring(0, snippetLength) + "..." : text;
    }

    public String link(String articleId) {
        return isMissing(articleId) ? "" : linkBaseUrl + articleId;
    }

    static boolean isMissing(String value) {
        return value == null || MISSING.contains(value.trim());
    }
}
