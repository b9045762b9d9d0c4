package io.archive.vectors.synthesis.backend;

import java.time.Duration;

/**
 * Configuration for the answer summarizer.
 */
public record SynthesisConfig(
    SummarizerBackend backend,

    /** API key for the cloud backend; falls back to GROQ_API_KEY */
    String apiKey,

    /** Chat completions endpoint of the cloud backend */
    String groqUrl,

    String groqModel,

    /** Base URL of the local Ollama server */
    String ollamaUrl,

    String ollamaModel,

    /** Bound on one summarization call */
    Duration timeout,

    double temperature,

    int maxTokens
) {
    public static final String GROQ_URL = "https://api.groq.com/openai/v1/chat/completions";
    public static final String OLLAMA_URL = "http://localhost:11434";

    public static SynthesisConfig defaults() {
        return new SynthesisConfig(SummarizerBackend.GROQ, null, GROQ_URL, "llama-3.3-70b-versatile",
            OLLAMA_URL, "llama3.2", Duration.ofSeconds(60), 0.3, 600);
    }

    public static SynthesisConfig disabled() {
        return defaults().withBackend(SummarizerBackend.NONE);
    }

    public SynthesisConfig withBackend(SummarizerBackend backend) {
        return new SynthesisConfig(backend, apiKey, groqUrl, groqModel, ollamaUrl, ollamaModel, timeout, temperature, maxTokens);
    }

    public SynthesisConfig withApiKey(String apiKey) {
        return new SynthesisConfig(backend, apiKey, groqUrl, groqModel, ollamaUrl, ollamaModel, timeout, temperature, maxTokens);
    }

    public SynthesisConfig withGroq(String groqUrl, String groqModel) {
        return new SynthesisConfig(backend, apiKey, groqUrl, groqModel, ollamaUrl, ollamaModel, timeout, temperature, maxTokens);
    }

    public SynthesisConfig withOllama(String ollamaUrl, String ollamaModel) {
        return new SynthesisConfig(backend, apiKey, groqUrl, groqModel, ollamaUrl, ollamaModel, timeout, temperature, maxTokens);
    }

    public SynthesisConfig withTimeout(Duration timeout) {
        return new SynthesisConfig(backend, apiKey, groqUrl, groqModel, ollamaUrl, ollamaModel, timeout, temperature, maxTokens);
    }

    /**
     * Explicit key, else the GROQ_API_KEY environment variable, else null.
     */
    public String resolveApiKey() {
        String key = apiKey;
        if (key == null || key.isBlank()) {
            key = System.getenv("GROQ_API_KEY");
        }
        return key == null || key.isBlank() ? null : key;
    }
}
