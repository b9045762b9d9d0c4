package io.archive.vectors.synthesis.backend;

import io.archive.vectors.synthesis.AnswerSynthesizer;
import io.archive.vectors.synthesis.Summarizer;

import java.util.Optional;

/**
 * Resolves the configured backend once, at startup.
 */
public final class Summarizers {

    private Summarizers() {
    }

    public static Optional<Summarizer> create(SynthesisConfig config) {
        return switch (config.backend()) {
            case GROQ -> Optional.of(new GroqSummarizer(config));
            case OLLAMA -> Optional.of(new OllamaSummarizer(config));
            case NONE -> Optional.empty();
        };
    }

    /**
     * A synthesizer for the configured backend, probed for availability.
     */
    public static AnswerSynthesizer synthesizer(SynthesisConfig config) {
        return create(config)
            .map(summarizer -> new AnswerSynthesizer(summarizer, config.timeout()))
            .orElseGet(AnswerSynthesizer::disabled);
    }
}
