package io.archive.vectors.synthesis.backend;

/**
 * Generative backends for synthesized answers.
 */
public enum SummarizerBackend {
    /** Groq cloud API (OpenAI-compatible chat completions) */
    GROQ,

    /** Local Ollama server */
    OLLAMA,

    /** Extractive answers only */
    NONE
}
