package io.archive.vectors.embeddings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Map;

/**
 * Downloads ONNX exports of sentence-embedding models from HuggingFace into a local cache.
 */
public class ModelDownloader {

    private static final Logger log = LoggerFactory.getLogger(ModelDownloader.class);

    private static final String HF_BASE_URL = "https://huggingface.co";

    private static final String MODEL_FILE = "model.onnx";
    private static final String TOKENIZER_FILE = "tokenizer.json";

    /**
     * Known model configurations.
     */
    private static final Map<String, ModelInfo> KNOWN_MODELS = Map.ofEntries(
        // The model the newspaper corpus was embedded with
        Map.entry("all-MiniLM-L6-v2", new ModelInfo("Xenova/all-MiniLM-L6-v2", "onnx/model.onnx", 384)),
        Map.entry("sentence-transformers/all-MiniLM-L6-v2",
            new ModelInfo("Xenova/all-MiniLM-L6-v2", "onnx/model.onnx", 384)),

        Map.entry("all-MiniLM-L12-v2", new ModelInfo("Xenova/all-MiniLM-L12-v2", "onnx/model.onnx", 384)),
        Map.entry("bge-small-en", new ModelInfo("Xenova/bge-small-en-v1.5", "onnx/model.onnx", 384)),
        Map.entry("bge-base-en", new ModelInfo("Xenova/bge-base-en-v1.5", "onnx/model.onnx", 768))
    );

    /** Default model */
    public static final String DEFAULT_MODEL = "all-MiniLM-L6-v2";

    private final HttpClient httpClient;
    private final Path cacheDir;

    public ModelDownloader(Path cacheDir) {
        this.cacheDir = cacheDir;
        this.httpClient = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .connectTimeout(Duration.ofSeconds(30))
            .build();
    }

    /**
     * Downloads a model if not already cached.
     *
     * @param modelId Model identifier (e.g., "all-MiniLM-L6-v2") or a HuggingFace repo id
     * @return Path to the model directory
     */
    public Path downloadModel(String modelId) throws IOException, InterruptedException {
        ModelInfo info = KNOWN_MODELS.getOrDefault(modelId, new ModelInfo(modelId, "onnx/model.onnx", 384));

        Path modelDir = modelDir(modelId);
        Path modelPath = modelDir.resolve(MODEL_FILE);
        Path tokenizerPath = modelDir.resolve(TOKENIZER_FILE);

        if (isCached(modelId)) {
            log.info("Model already cached: {}", modelDir);
            return modelDir;
        }

        Files.createDirectories(modelDir);

        if (!Files.exists(modelPath)) {
            String modelUrl = String.format("%s/%s/resolve/main/%s", HF_BASE_URL, info.repoId(), info.modelFile());
            log.info("Downloading model from: {}", modelUrl);
            downloadFile(modelUrl, modelPath);
        }

        if (!Files.exists(tokenizerPath)) {
            String tokenizerUrl = String.format("%s/%s/resolve/main/%s", HF_BASE_URL, info.repoId(), TOKENIZER_FILE);
            log.info("Downloading tokenizer from: {}", tokenizerUrl);
            downloadFile(tokenizerUrl, tokenizerPath);
        }

        log.info("Model downloaded to: {}", modelDir);
        return modelDir;
    }

    /**
     * Cache directory of a model, whether or not it has been downloaded.
     */
    public Path modelDir(String modelId) {
        return cacheDir.resolve(modelId.replace("/", "_").replace("\\", "_"));
    }

    public boolean isCached(String modelId) {
        Path modelDir = modelDir(modelId);
        return Files.exists(modelDir.resolve(MODEL_FILE)) && Files.exists(modelDir.resolve(TOKENIZER_FILE));
    }

    /**
     * Returns the dimensions for a known model, 384 otherwise.
     */
    public static int getDimensions(String modelId) {
        ModelInfo info = KNOWN_MODELS.get(modelId);
        return info != null ? info.dimensions() : 384;
    }

    private void downloadFile(String url, Path destination) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(Duration.ofMinutes(10))
            .GET()
            .build();

        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

        if (response.statusCode() != 200) {
            response.body().close();
            throw new IOException("Failed to download " + url + ": HTTP " + response.statusCode());
        }

        Path partial = destination.resolveSibling(destination.getFileName() + ".part");
        try (InputStream in = response.body()) {
            Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);

        log.info("Downloaded: {} ({} bytes)", destination.getFileName(), Files.size(destination));
    }

    private record ModelInfo(String repoId, String modelFile, int dimensions) {}
}
