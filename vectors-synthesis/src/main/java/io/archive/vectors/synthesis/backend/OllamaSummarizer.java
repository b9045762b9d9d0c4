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
 * Summarizer on a local Ollama server ({@code /api/generate}, non-streaming).
 */
public class OllamaSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(OllamaSummarizer.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(3);

    private final SynthesisConfig config;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OllamaSummarizer(SynthesisConfig config) {
        this.config = config;
        this.baseUrl = config.ollamaUrl().endsWith("/")
            ? config.ollamaUrl().substring(0, config.ollamaUrl().length() - 1)
            : config.ollamaUrl();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(PROBE_TIMEOUT)
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "ollama:" + config.ollamaModel();
    }

    /**
     * The server is up if it lists its models.
     */
    @Override
    public boolean probeAvailability() {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/tags"))
            .timeout(PROBE_TIMEOUT)
            .GET()
            .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (IOException e) {
            log.info("Ollama not reachable at {}: {}", baseUrl, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public SynthesisResult summarize(String query, List<Passage> passages) {
        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("model", config.ollamaModel());
            request.put("system", SummarizerPrompt.SYSTEM);
            request.put("prompt", SummarizerPrompt.user(query, passages));
            request.put("stream", false);
            request.put("options", Map.of("temperature", config.temperature(), "num_predict", config.maxTokens()));

            HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .header("Content-Type", "application/json")
                .timeout(config.timeout())
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request)))
                .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("Ollama error: {} - {}", response.statusCode(), response.body());
                return SynthesisResult.failure("HTTP " + response.statusCode());
            }
            GenerateResponse generated = objectMapper.readValue(response.body(), GenerateResponse.class);
            return generated.response != null
                ? SynthesisResult.success(generated.response)
                : SynthesisResult.failure("empty response");

        } catch (IOException e) {
            log.warn("Failed to call Ollama: {}", e.getMessage());
            return SynthesisResult.failure(e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SynthesisResult.failure("interrupted");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class GenerateResponse {
        @JsonProperty("response")
        public String response;
    }
}
