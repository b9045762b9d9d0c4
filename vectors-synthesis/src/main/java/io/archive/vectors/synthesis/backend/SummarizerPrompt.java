package io.archive.vectors.synthesis.backend;

import io.archive.vectors.retrieval.Passage;
import io.archive.vectors.retrieval.SourceFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt text sent to every summarizer backend.
 */
public final class SummarizerPrompt {

    static final int MAX_SOURCES = 5;
    static final int MAX_EXCERPT = 500;

    public static final String SYSTEM = """
        You are a knowledgeable historical research assistant specializing in Utah history and the Utah Digital Newspapers archive.

        Your job:
        1. Read the user's question and the retrieved newspaper excerpts
        2. Synthesize a clear, informative answer based ONLY on what the sources say
        3. Note important details: dates, people, places, events
        4. Acknowledge that text may have OCR errors from scanning old newspapers
        5. If the sources don't clearly answer the question, say so honestly

        Rules:
        - Be concise (3-5 sentences max for the summary)
        - Only state facts found in the sources - do NOT make things up
        - Reference which source(s) support your points
        - If text is garbled from OCR, interpret what you can and note the limitation""";

    private SummarizerPrompt() {
    }

    /**
     * User message: the question followed by up to five numbered excerpts.
     */
    public static String user(String query, List<Passage> passages) {
        List<String> sources = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_SOURCES, passages.size()); i++) {
            Passage passage = passages.get(i);
            String title = passage.record().articleTitle();
            String date = SourceFormatter.date(passage.date());
            String text = passage.text();
            sources.add(String.format("Source %d: %s%nPaper: %s | Date: %s%nText: %s%n",
                i + 1,
                title.isBlank() ? "Untitled" : title,
                passage.paper().isBlank() ? "Unknown" : passage.paper(),
                date.isBlank() ? "Unknown date" : date,
                text.length() > MAX_EXCERPT ? text.substring(0, MAX_EXCERPT) : text));
        }

        return String.format("""
            User question: "%s"

            Here are the most relevant newspaper excerpts found in the archive:

            %s

            Based on these historical sources, provide a clear and informative answer to the user's question:""",
            query, String.join("\n---\n", sources));
    }
}
