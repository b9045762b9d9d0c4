package io.archive.vectors.embeddings;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import io.archive.vectors.VectorMath;
import io.archive.vectors.retrieval.EmbedderUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ONNX Runtime based sentence-embedding model with HuggingFace tokenization.
 *
 * <p>Runs a transformer exported to ONNX and mean-pools the token states over the
 * attention mask, matching sentence-transformers output for all-MiniLM-L6-v2.
 * If the model cannot be loaded the instance stays usable but every call throws
 * {@link EmbedderUnavailableException}.</p>
 */
public class OnnxEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(OnnxEmbeddingModel.class);

    private final String modelId;
    private final EmbeddingConfig config;
    private final int dimensions;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;
    private boolean initialized = false;
    private String failure = "not initialized";

    public OnnxEmbeddingModel(String modelId, EmbeddingConfig config) {
        this.modelId = modelId;
        this.config = config;
        this.dimensions = config.dimensions() > 0 ? config.dimensions() : ModelDownloader.getDimensions(modelId);

        try {
            initialize();
        } catch (OrtException | IOException e) {
            failure = e.getMessage();
            log.warn("Failed to initialize ONNX model {}: {}", modelId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = "interrupted during download";
        }
    }

    private void initialize() throws OrtException, IOException, InterruptedException {
        log.info("Initializing ONNX embedding model: {}", modelId);

        ModelDownloader downloader = new ModelDownloader(config.cacheDir());
        Path modelDir = downloader.isCached(modelId) ? downloader.modelDir(modelId) : downloader.downloadModel(modelId);

        Path modelPath = modelDir.resolve("model.onnx");
        Path tokenizerPath = modelDir.resolve("tokenizer.json");
        if (!Files.exists(modelPath) || !Files.exists(tokenizerPath)) {
            failure = "model files not found at " + modelDir;
            log.warn("Model files not found at: {}", modelDir);
            return;
        }

        this.env = OrtEnvironment.getEnvironment();
        log.info("Loading ONNX model from: {}", modelPath);
        this.session = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());

        log.info("Loading tokenizer from: {}", tokenizerPath);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        this.initialized = true;
        log.info("ONNX model initialized successfully. Dimensions: {}", dimensions);
    }

    @Override
    public float[] embed(String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        if (!initialized) {
            throw new EmbedderUnavailableException("Embedding model " + modelId + " is unavailable: " + failure);
        }
        if (texts.isEmpty()) {
            return List.of();
        }

        Encoding[] encodings = tokenizer.batchEncode(texts);
        int seqLength = 1;
        for (Encoding encoding : encodings) {
            seqLength = Math.max(seqLength, Math.min(encoding.getIds().length, config.maxSequenceLength()));
        }

        long[][] inputIds = new long[encodings.length][];
        long[][] attentionMask = new long[encodings.length][];
        for (int i = 0; i < encodings.length; i++) {
            inputIds[i] = padOrTruncate(encodings[i].getIds(), seqLength);
            attentionMask[i] = padOrTruncate(encodings[i].getAttentionMask(), seqLength);
        }

        Map<String, OnnxTensor> inputs = new HashMap<>();
        try {
            inputs.put("input_ids", OnnxTensor.createTensor(env, inputIds));
            inputs.put("attention_mask", OnnxTensor.createTensor(env, attentionMask));
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", OnnxTensor.createTensor(env, new long[encodings.length][seqLength]));
            }

            try (OrtSession.Result result = session.run(inputs)) {
                Object output = result.get(0).getValue();
                List<float[]> embeddings = new ArrayList<>(encodings.length);
                for (int i = 0; i < encodings.length; i++) {
                    float[] embedding;
                    if (output instanceof float[][][] tokenStates) {
                        embedding = meanPooling(tokenStates[i], attentionMask[i]);
                    } else if (output instanceof float[][] pooled) {
                        embedding = pooled[i];
                    } else {
                        throw new EmbedderUnavailableException("Unexpected ONNX output type: " + output.getClass());
                    }
                    embeddings.add(config.normalizeOutput() ? VectorMath.normalize(embedding) : embedding);
                }
                return embeddings;
            }
        } catch (OrtException e) {
            log.error("ONNX inference failed: {}", e.getMessage());
            throw new EmbedderUnavailableException("ONNX inference failed: " + e.getMessage(), e);
        } finally {
            inputs.values().forEach(OnnxTensor::close);
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public int getDimensions() {
        return dimensions;
    }

    @Override
    public void close() {
        try {
            if (session != null) {
                session.close();
            }
            if (tokenizer != null) {
                tokenizer.close();
            }
        } catch (OrtException e) {
            log.warn("Error closing ONNX resources", e);
        }
    }

    /**
     * Mean pooling over token embeddings, weighted by attention mask.
     */
    private static float[] meanPooling(float[][] tokenEmbeddings, long[] attentionMask) {
        int hiddenSize = tokenEmbeddings[0].length;
        float[] pooled = new float[hiddenSize];
        float maskSum = 0;

        for (int i = 0; i < tokenEmbeddings.length; i++) {
            if (attentionMask[i] == 1) {
                maskSum++;
                for (int j = 0; j < hiddenSize; j++) {
                    pooled[j] += tokenEmbeddings[i][j];
                }
            }
        }

        if (maskSum > 0) {
            for (int j = 0; j < hiddenSize; j++) {
                pooled[j] /= maskSum;
            }
        }
        return pooled;
    }

    private static long[] padOrTruncate(long[] array, int targetLength) {
        if (array.length == targetLength) {
            return array;
        }
        long[] result = new long[targetLength];
        System.arraycopy(array, 0, result, 0, Math.min(array.length, targetLength));
        return result;
    }
}
