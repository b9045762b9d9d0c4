package io.archive.vectors.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.archive.vectors.IncompatibleModelException;
import io.archive.vectors.IndexConfig;
import io.archive.vectors.IndexMode;
import io.archive.vectors.IndexStats;
import io.archive.vectors.VectorIndex;
import io.archive.vectors.build.BuildConfig;
import io.archive.vectors.build.BuildReport;
import io.archive.vectors.build.IndexArtifacts;
import io.archive.vectors.build.IndexBuilder;
import io.archive.vectors.build.IngestionTracker;
import io.archive.vectors.build.LiteConfig;
import io.archive.vectors.build.LiteIndexBuilder;
import io.archive.vectors.embeddings.ChunkEmbedder;
import io.archive.vectors.embeddings.EmbeddingConfig;
import io.archive.vectors.embeddings.EmbeddingModel;
import io.archive.vectors.embeddings.ModelDownloader;
import io.archive.vectors.retrieval.RetrievalConfig;
import io.archive.vectors.service.QueryRequest;
import io.archive.vectors.service.QueryResponse;
import io.archive.vectors.service.RetrievalService;
import io.archive.vectors.service.ServiceStatus;
import io.archive.vectors.service.SourceView;
import io.archive.vectors.source.ArticleChunker;
import io.archive.vectors.source.ChunkSource;
import io.archive.vectors.store.MetadataStore;
import io.archive.vectors.synthesis.AnswerSynthesizer;
import io.archive.vectors.synthesis.backend.SummarizerBackend;
import io.archive.vectors.synthesis.backend.Summarizers;
import io.archive.vectors.synthesis.backend.SynthesisConfig;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for Archive Vectors.
 */
@Command(
    name = "vectors",
    mixinStandardHelpOptions = true,
    version = "archive-vectors 1.0.0",
    description = "Build and query vector indexes over newspaper archive chunks",
    subcommands = {
        VectorsCli.ChunkCommand.class,
        VectorsCli.EmbedCommand.class,
        VectorsCli.BuildCommand.class,
        VectorsCli.BuildLiteCommand.class,
        VectorsCli.QueryCommand.class,
        VectorsCli.StatsCommand.class,
        VectorsCli.CheckCommand.class,
        VectorsCli.DownloadCommand.class
    }
)
public class VectorsCli implements Callable<Integer> {

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new VectorsCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Split an article export into chunk CSV files.
     */
    @Command(
        name = "chunk",
        mixinStandardHelpOptions = true,
        description = "Split an article export into overlapping text chunks"
    )
    static class ChunkCommand implements Callable<Integer> {

        @Option(names = {"-i", "--input"}, description = "Article export CSV (id, article_title_t, date_tdt, paper_t, ocr_t)",
            required = true)
        private Path input;

        @Option(names = {"-o", "--output-dir"}, description = "Directory for chunk CSV files", required = true)
        private Path outputDir;

        @Option(names = {"--chunk-size"}, description = "Characters per chunk", defaultValue = "500")
        private int chunkSize;

        @Option(names = {"--overlap"}, description = "Characters shared by consecutive chunks", defaultValue = "50")
        private int overlap;

        @Option(names = {"--rows-per-file"}, description = "Chunks per output file", defaultValue = "100000")
        private int rowsPerFile;

        @Override
        public Integer call() throws Exception {
            System.out.println("Chunking: " + input);
            ArticleChunker.Summary summary = new ArticleChunker(chunkSize, overlap, rowsPerFile).chunk(input, outputDir);
            System.out.printf("%,d articles, %,d chunks in %d files (%,d articles without text)%n",
                summary.articles(), summary.chunks(), summary.files().size(), summary.articlesSkipped());
            return 0;
        }
    }

    /**
     * Embed chunk CSV files into .npy arrays.
     */
    @Command(
        name = "embed",
        mixinStandardHelpOptions = true,
        description = "Embed chunk CSV files that have no vector array yet"
    )
    static class EmbedCommand implements Callable<Integer> {

        @Option(names = {"-c", "--chunks-dir"}, description = "Directory of chunk CSV files", required = true)
        private Path chunksDir;

        @Option(names = {"-e", "--embeddings-dir"}, description = "Directory for .npy arrays", required = true)
        private Path embeddingsDir;

        @Option(names = {"-m", "--model"}, description = "Embedding model", defaultValue = ModelDownloader.DEFAULT_MODEL)
        private String model;

        @Option(names = {"-p", "--provider"}, description = "Embedding provider: onnx, simple", defaultValue = "onnx")
        private String provider;

        @Option(names = {"--batch-size"}, description = "Texts per inference call", defaultValue = "32")
        private int batchSize;

        @Override
        public Integer call() throws Exception {
            System.out.println("Embedding chunks from: " + chunksDir);
            System.out.println("Using model: " + model);

            try (EmbeddingModel embeddingModel = EmbeddingModel.load(model, createConfig(provider))) {
                ChunkEmbedder.Summary summary = new ChunkEmbedder(
                    embeddingModel, new ChunkSource(embeddingsDir, chunksDir), batchSize).embedAll();
                System.out.printf("Embedded %d files (%,d chunks), %d already present, %d failed%n",
                    summary.filesEmbedded(), summary.chunks(), summary.filesSkipped(), summary.filesFailed());
                return summary.filesFailed() == 0 ? 0 : 1;
            }
        }
    }

    /**
     * Build or resume the full index.
     */
    @Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Build (or resume building) the vector index and metadata store"
    )
    static class BuildCommand implements Callable<Integer> {

        @Option(names = {"-e", "--embeddings-dir"}, description = "Directory of .npy arrays", required = true)
        private Path embeddingsDir;

        @Option(names = {"-c", "--chunks-dir"}, description = "Directory of chunk CSV files", required = true)
        private Path chunksDir;

        @Option(names = {"-o", "--output"}, description = "Index file; .db and .committed files go next to it",
            defaultValue = "data/udn.index")
        private Path outputPath;

        @Option(names = {"-m", "--model"}, description = "Embedding model the arrays were built with",
            defaultValue = ModelDownloader.DEFAULT_MODEL)
        private String model;

        @Option(names = {"--mode"}, description = "Force index mode: ${COMPLETION-CANDIDATES}")
        private IndexMode mode;

        @Option(names = {"--exact-threshold"}, description = "Largest file count built as an exact index",
            defaultValue = "200")
        private int exactThreshold;

        @Option(names = {"--training-budget"}, description = "Maximum training sample size", defaultValue = "500000")
        private int trainingBudget;

        @Option(names = {"--store-text"}, description = "Copy chunk text into the metadata store")
        private boolean storeText;

        @Override
        public Integer call() throws Exception {
            BuildConfig config = BuildConfig.defaults(embeddingsDir, chunksDir, outputPath)
                .withIndexConfig(IndexConfig.forModel(model, ModelDownloader.getDimensions(model)))
                .withExactThreshold(exactThreshold)
                .withModeOverride(mode)
                .withTrainingBudget(trainingBudget)
                .withStoreText(storeText);

            BuildReport report = new IndexBuilder(config).build();
            printReport(report, config.artifacts());
            return report.isConsistent() ? 0 : 1;
        }
    }

    /**
     * Build a small self-contained index.
     */
    @Command(
        name = "build-lite",
        mixinStandardHelpOptions = true,
        description = "Build a small self-contained index with text stored inline"
    )
    static class BuildLiteCommand implements Callable<Integer> {

        @Option(names = {"-e", "--embeddings-dir"}, description = "Directory of .npy arrays", required = true)
        private Path embeddingsDir;

        @Option(names = {"-c", "--chunks-dir"}, description = "Directory of chunk CSV files", required = true)
        private Path chunksDir;

        @Option(names = {"-o", "--output-dir"}, description = "Output directory", defaultValue = "data")
        private Path outputDir;

        @Option(names = {"-m", "--model"}, description = "Embedding model the arrays were built with",
            defaultValue = ModelDownloader.DEFAULT_MODEL)
        private String model;

        @Option(names = {"--docs"}, description = "Documents to sample", defaultValue = "25000")
        private int docs;

        @Option(names = {"--files"}, description = "Files to sample from", defaultValue = "10")
        private int files;

        @Override
        public Integer call() throws Exception {
            LiteConfig config = LiteConfig.defaults(embeddingsDir, chunksDir, outputDir)
                .withIndexConfig(IndexConfig.forModel(model, ModelDownloader.getDimensions(model)))
                .withTargetDocs(docs)
                .withSampleFiles(files);

            System.out.printf("Target: %,d docs from %d files%n", docs, files);
            BuildReport report = new LiteIndexBuilder(config).build();
            printReport(report, config.artifacts());
            return 0;
        }
    }

    /**
     * Ask a question.
     */
    @Command(
        name = "query",
        mixinStandardHelpOptions = true,
        description = "Search the archive"
    )
    static class QueryCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to vector index file")
        private Path indexPath;

        @Parameters(index = "1", description = "Search query")
        private String query;

        @Option(names = {"-n", "--top"}, description = "Number of results (max 20)", defaultValue = "5")
        private int topK;

        @Option(names = {"-c", "--chunks-dir"}, description = "Chunk CSV directory for text lookup")
        private Path chunksDir;

        @Option(names = {"-m", "--model"}, description = "Embedding model", defaultValue = ModelDownloader.DEFAULT_MODEL)
        private String model;

        @Option(names = {"-p", "--provider"}, description = "Embedding provider: onnx, simple", defaultValue = "onnx")
        private String provider;

        @Option(names = {"-s", "--summarizer"}, description = "Answer summarizer: ${COMPLETION-CANDIDATES}",
            defaultValue = "NONE")
        private SummarizerBackend summarizer;

        @Option(names = {"--api-key"}, description = "API key for the cloud summarizer (or set GROQ_API_KEY env var)")
        private String apiKey;

        @Option(names = {"--ollama-url"}, description = "Ollama server URL", defaultValue = SynthesisConfig.OLLAMA_URL)
        private String ollamaUrl;

        @Option(names = {"--nprobe"}, description = "Clusters probed by a compressed index", defaultValue = "32")
        private int nprobe;

        @Option(names = {"--json"}, description = "Print the response as JSON")
        private boolean json;

        @Override
        public Integer call() throws Exception {
            SynthesisConfig synthesisConfig = SynthesisConfig.defaults()
                .withBackend(summarizer)
                .withApiKey(apiKey)
                .withOllama(ollamaUrl, SynthesisConfig.defaults().ollamaModel());
            RetrievalConfig retrievalConfig = RetrievalConfig.defaults().withNprobe(nprobe);
            ChunkSource chunkSource = chunksDir != null ? new ChunkSource(chunksDir, chunksDir) : null;

            AnswerSynthesizer synthesizer = summarizer == SummarizerBackend.NONE
                ? AnswerSynthesizer.disabled()
                : Summarizers.synthesizer(synthesisConfig);

            try (EmbeddingModel embeddingModel = EmbeddingModel.load(model, createConfig(provider));
                 RetrievalService service = RetrievalService.open(IndexArtifacts.forBase(indexPath), chunkSource,
                     embeddingModel, synthesizer, retrievalConfig)) {

                if (service.isReady()) {
                    service.requireModel(embeddingModel.getModelId());
                }
                QueryResponse response = service.ask(new QueryRequest(query, topK, summarizer != SummarizerBackend.NONE));

                if (json) {
                    System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(response));
                } else {
                    printResponse(response);
                }
                return response.status() == ServiceStatus.OK ? 0 : 1;
            } catch (IncompatibleModelException e) {
                System.err.println(e.getMessage());
                return 1;
            }
        }

        private void printResponse(QueryResponse response) {
            System.out.println();
            System.out.println(response.answer());
            if (response.sources().isEmpty()) {
                return;
            }
            System.out.println();
            System.out.println("Sources:");
            System.out.println("=".repeat(60));

            int rank = 1;
            for (SourceView source : response.sources()) {
                System.out.println();
                System.out.printf("  %d. %s (%s, %s) - %s%n",
                    rank++, source.title(), source.paper(), source.date(), source.relevance());
                if (!source.link().isEmpty()) {
                    System.out.println("     " + source.link());
                }
                if (!source.snippet().isEmpty()) {
                    System.out.println("     " + source.snippet().replace('\n', ' '));
                }
            }
        }
    }

    /**
     * Show index statistics.
     */
    @Command(
        name = "stats",
        mixinStandardHelpOptions = true,
        description = "Display index statistics"
    )
    static class StatsCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to vector index file")
        private Path indexPath;

        @Override
        public Integer call() throws Exception {
            IndexArtifacts artifacts = IndexArtifacts.forBase(indexPath);
            IndexStats stats;
            try (VectorIndex index = VectorIndex.load(artifacts.index())) {
                stats = index.getStats();
            }

            System.out.println();
            System.out.println("Vector Index Statistics");
            System.out.println("=".repeat(40));
            System.out.println("Mode: " + stats.mode());
            System.out.println("Model: " + stats.modelId());
            System.out.println("Dimensions: " + stats.dimensions());
            System.out.printf("Total vectors: %,d%n", stats.totalVectors());
            System.out.println("Trained: " + stats.trained());
            if (stats.clusters() > 0) {
                System.out.println("Clusters: " + stats.clusters());
            }
            System.out.printf("Index size: %.1f MB%n", stats.sizeBytes() / (1024.0 * 1024.0));

            if (artifacts.databaseExists()) {
                try (MetadataStore store = MetadataStore.openReadOnly(artifacts.database())) {
                    System.out.printf("Metadata rows: %,d%n", store.count());
                    System.out.println("Inline text: " + store.storesInlineText());
                }
            } else {
                System.out.println("Metadata store: missing (" + artifacts.database() + ")");
            }
            System.out.println("Committed files: " + IngestionTracker.open(artifacts.resumeLog()).committedCount());
            return 0;
        }
    }

    /**
     * Count rows in chunk files.
     */
    @Command(
        name = "check",
        mixinStandardHelpOptions = true,
        description = "Count rows per chunk CSV file"
    )
    static class CheckCommand implements Callable<Integer> {

        @Option(names = {"-c", "--chunks-dir"}, description = "Directory of chunk CSV files", required = true)
        private Path chunksDir;

        @Option(names = {"-v", "--verbose"}, description = "Print every file")
        private boolean verbose;

        @Override
        public Integer call() throws Exception {
            ChunkSource source = new ChunkSource(chunksDir, chunksDir);
            List<Path> files = source.listMetadataFiles();

            long total = 0;
            int unreadable = 0;
            for (Path file : files) {
                try {
                    long rows = source.countRows(file);
                    total += rows;
                    if (verbose) {
                        System.out.printf("%s: %,d rows%n", file.getFileName(), rows);
                    }
                } catch (IOException | RuntimeException e) {
                    unreadable++;
                    System.err.println("Unreadable: " + file.getFileName() + " (" + e.getMessage() + ")");
                }
            }

            System.out.printf("%d files, %,d chunks, %d unreadable%n", files.size(), total, unreadable);
            return unreadable == 0 ? 0 : 1;
        }
    }

    /**
     * Download an embedding model.
     */
    @Command(
        name = "download",
        mixinStandardHelpOptions = true,
        description = "Download an embedding model from HuggingFace"
    )
    static class DownloadCommand implements Callable<Integer> {

        @Option(names = {"-m", "--model"}, description = "Model to download", defaultValue = ModelDownloader.DEFAULT_MODEL)
        private String model;

        @Option(names = {"-d", "--dir"}, description = "Cache directory")
        private Path cacheDir;

        @Override
        public Integer call() throws Exception {
            Path targetDir = cacheDir != null ? cacheDir : EmbeddingConfig.DEFAULT_CACHE_DIR;

            System.out.println("Downloading model: " + model);
            System.out.println("Cache directory: " + targetDir);
            System.out.println();

            ModelDownloader downloader = new ModelDownloader(targetDir);
            if (downloader.isCached(model)) {
                System.out.println("Model already cached!");
                return 0;
            }

            try {
                Path modelDir = downloader.downloadModel(model);
                System.out.println();
                System.out.println("Model downloaded successfully to: " + modelDir);
                return 0;
            } catch (IOException e) {
                System.err.println("Failed to download model: " + e.getMessage());
                return 1;
            }
        }
    }

    private static void printReport(BuildReport report, IndexArtifacts artifacts) {
        System.out.println();
        System.out.println("Build complete");
        System.out.println("=".repeat(40));
        System.out.println("Mode: " + report.mode());
        System.out.printf("Files: %d (%d processed, %d already committed, %d skipped, %d errored)%n",
            report.totalFiles(), report.processed(), report.alreadyCommitted(), report.skipped(), report.errored());
        System.out.printf("Vectors: %,d added, %,d total%n", report.vectorsAdded(), report.totalVectors());
        System.out.printf("Metadata rows: %,d%n", report.metadataRows());
        System.out.printf("Elapsed: %.1f min%n", report.elapsed().toMillis() / 60_000.0);
        System.out.println("Index: " + artifacts.index());
        System.out.println("Database: " + artifacts.database());
    }

    /**
     * Create embedding config for the specified provider.
     */
    static EmbeddingConfig createConfig(String provider) {
        return switch (provider.toLowerCase()) {
            case "onnx", "local" -> EmbeddingConfig.defaults();
            case "simple", "hash" -> EmbeddingConfig.simple();
            default -> throw new IllegalArgumentException("Unknown provider: " + provider + ". Use: onnx, simple");
        };
    }
}
