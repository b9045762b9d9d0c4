package io.archive.vectors.synthesis.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.archive.vectors.synthesis.AnswerSynthesizer;
import io.archive.vectors.synthesis.SynthesisResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for the Groq and Ollama summarizers against a local HTTP server.
 */
class SummarizerBackendsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<JsonNode> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/openai/v1/chat/completions", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastRequest.set(mapper.readTree(exchange.getRequestBody()));
            respond(exchange, 200, """
                {"id": "x", "choices": [{"index": 0, "message": {"role": "assistant", "content": "The railroad came in 1869."}}]}
                """);
        });
        server.createContext("/api/tags", exchange -> respond(exchange, 200, "{\"models\": []}"));
        server.createContext("/api/generate", exchange -> {
            lastRequest.set(mapper.readTree(exchange.getRequestBody()));
            respond(exchange, 200, "{\"model\": \"llama3.2\", \"response\": \"Local answer.\", \"done\": true}");
        });
        server.createContext("/broken/v1/chat/completions", exchange -> respond(exchange, 503, "{}"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    // ==================== Groq Tests ====================

    @Test
    void testGroqSendsChatCompletion() {
        GroqSummarizer summarizer = new GroqSummarizer(SynthesisConfig.defaults()
            .withApiKey("test-key")
            .withGroq(baseUrl + "/openai/v1/chat/completions", "llama-test"));

        assertTrue(summarizer.probeAvailability());
        SynthesisResult result = summarizer.summarize("railroad", List.of(
            SummarizerPromptTest.passage(0, "Golden Spike", "1869-05-10", "Deseret News", "The last spike.")));

        assertEquals("The railroad came in 1869.", result.text().orElseThrow());
        assertEquals("Bearer test-key", lastAuthorization.get());
        JsonNode request = lastRequest.get();
        assertEquals("llama-test", request.get("model").asText());
        assertEquals("system", request.get("messages").get(0).get("role").asText());
        assertTrue(request.get("messages").get(1).get("content").asText().contains("Golden Spike"));
        assertEquals(600, request.get("max_tokens").asInt());
    }

    @Test
    void testGroqHttpErrorIsFailure() {
        GroqSummarizer summarizer = new GroqSummarizer(SynthesisConfig.defaults()
            .withApiKey("test-key")
            .withGroq(baseUrl + "/broken/v1/chat/completions", "llama-test"));

        SynthesisResult result = summarizer.summarize("q", List.of());

        assertFalse(result.isSuccess());
        assertEquals("HTTP 503", result.failureReason());
    }

    @Test
    void testGroqWithoutKeyUnavailable() {
        assumeTrue(System.getenv("GROQ_API_KEY") == null);
        GroqSummarizer summarizer = new GroqSummarizer(SynthesisConfig.defaults());

        assertFalse(summarizer.probeAvailability());
        assertFalse(summarizer.summarize("q", List.of()).isSuccess());
    }

    // ==================== Ollama Tests ====================

    @Test
    void testOllamaGenerate() {
        OllamaSummarizer summarizer = new OllamaSummarizer(SynthesisConfig.defaults()
            .withBackend(SummarizerBackend.OLLAMA)
            .withOllama(baseUrl + "/", "llama3.2"));

        assertTrue(summarizer.probeAvailability());
        SynthesisResult result = summarizer.summarize("q", List.of());

        assertEquals("Local answer.", result.text().orElseThrow());
        assertFalse(lastRequest.get().get("stream").asBoolean());
        assertEquals("llama3.2", lastRequest.get().get("model").asText());
    }

    @Test
    void testOllamaUnreachable() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        OllamaSummarizer summarizer = new OllamaSummarizer(SynthesisConfig.defaults()
            .withOllama("http://127.0.0.1:" + port, "llama3.2"));

        assertFalse(summarizer.probeAvailability());
    }

    // ==================== Wiring Tests ====================

    @Test
    void testFactoryFollowsBackend() {
        assertTrue(Summarizers.create(SynthesisConfig.disabled()).isEmpty());
        assertInstanceOf(GroqSummarizer.class, Summarizers.create(SynthesisConfig.defaults()).orElseThrow());
        assertInstanceOf(OllamaSummarizer.class,
            Summarizers.create(SynthesisConfig.defaults().withBackend(SummarizerBackend.OLLAMA)).orElseThrow());
    }

    @Test
    void testSynthesizerForReachableOllama() {
        try (AnswerSynthesizer synthesizer = Summarizers.synthesizer(SynthesisConfig.defaults()
                .withBackend(SummarizerBackend.OLLAMA)
                .withOllama(baseUrl, "llama3.2")
                .withTimeout(Duration.ofSeconds(5)))) {

            assertTrue(synthesizer.isAvailable());
            assertEquals("ollama:llama3.2", synthesizer.backendName());
        }
    }

    @Test
    void testApiKeyOptionWins() {
        assertEquals("explicit", SynthesisConfig.defaults().withApiKey("explicit").resolveApiKey());
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
