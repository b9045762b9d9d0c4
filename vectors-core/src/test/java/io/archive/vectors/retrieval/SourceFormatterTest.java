package io.archive.vectors.retrieval;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceFormatterTest {

    private final SourceFormatter formatter = SourceFormatter.from(RetrievalConfig.defaults());

    @Test
    void testTitleFallback() {
        assertEquals("Untitled Article", formatter.title(""));
        assertEquals("Untitled Article", formatter.title("nan"));
        assertEquals("Untitled Article", formatter.title("None"));
        assertEquals("Untitled Article", formatter.title(null));
        assertEquals("Local News", formatter.title("Local News"));
    }

    @Test
    void testPaperFallback() {
        assertEquals("Unknown Paper", formatter.paper(""));
        assertEquals("Vernal Express", formatter.paper("Vernal Express"));
    }

    @Test
    void testDateCutAtTime() {
        assertEquals("1911-06-30", SourceFormatter.date("1911-06-30T00:00:00"));
        assertEquals("1911-06-30", SourceFormatter.date("1911-06-30"));
        assertEquals("", SourceFormatter.date("nan"));
    }

    @Test
    void testSnippetTruncation() {
        String shortText = "a".repeat(300);
        String longText = "b".repeat(301);

        assertEquals(shortText, formatter.snippet(shortText));
        assertEquals("b".repeat(300) + "...", formatter.snippet(longText));
        assertEquals("", formatter.snippet(null));
    }

    @Test
    void testLink() {
        assertEquals("https://newspapers.lib.utah.edu/details?id=12345", formatter.link("12345"));
        assertEquals("", formatter.link(""));
    }
}
