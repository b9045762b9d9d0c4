package io.archive.vectors.synthesis.backend;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.archive.vectors.retrieval.Passage;
import io.archive.vectors.synthesis.Summarizer;
import io.archive.vectors.synthesis.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizer on Groq's OpenAI-compatible chat completions API.
 *
 * <p>API key can be provided via:
 * <ol>
 *   <li>SynthesisConfig.apiKey()</li>
 *   <li>Environment variable: GROQ_API_KEY</li>
 * </ol>
 * Without a key the backend reports itself unavailable.</p>
 *
 * @see <a href="https://console.groq.com/docs/api-reference">Groq API</a>
 */
public class GroqSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(GroqSummarizer.class);

    private final SynthesisConfig config;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GroqSummarizer(SynthesisConfig config) {
        this.config = config;
        this.apiKey = config.resolveApiKey();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "groq:" + config.groqModel();
    }

    @Override
    public boolean probeAvailability() {
        if (apiKey == null) {
            log.info("No Groq API key. Set GROQ_API_KEY environment variable or use --api-key option.");
            return false;
        }
        return true;
    }

    @Override
    public SynthesisResult summarize(String query, List<Passage> passages) {
        if (apiKey == null) {
            return SynthesisResult.failure("no API key");
        }
        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("model", config.groqModel());
            request.put("messages", List.of(
                Map.of("role", "system", "content", SummarizerPrompt.SYSTEM),
                Map.of("role", "user", "content", SummarizerPrompt.user(query, passages))));
            request.put("temperature", config.temperature());
            request.put("max_tokens", config.maxTokens());

            HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(config.groqUrl()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(config.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
                .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Groq API error: {} - {}", response.statusCode(), response.body());
                return SynthesisResult.failure("HTTP " + response.statusCode());
            }

            ChatResponse chat = objectMapper.readValue(response.body(), ChatResponse.class);
            if (chat.choices == null || chat.choices.isEmpty() || chat.choices.get(0).message == null) {
                return SynthesisResult.failure("response has no choices");
            }
            return SynthesisResult.success(chat.choices.get(0).message.content);

        } catch (IOException e) {
            log.warn("Failed to call Groq API: {}", e.getMessage());
            return SynthesisResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SynthesisResult.failure("interrupted");
        }
    }

    // ==================== Response DTOs ====================

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class ChatResponse {
        @JsonProperty("choices")
        public List<Choice> choices;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class Choice {
        @JsonProperty("message")
        public Message message;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class Message {
        @JsonProperty("content")
        public String content;
    }
}
