package io.archive.vectors.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Splits an article export into the chunk CSV files the rest of the pipeline reads.
 *
 * <p>The export is streamed row by row. Each article's OCR text is cut into
 * fixed-size character windows that overlap by a configurable amount, and the
 * chunks are written to {@code udn_chunks_part<N>.csv} files. A file is closed
 * once it holds at least {@code rowsPerFile} rows; an article's chunks are never
 * split across two files.</p>
 */
public class ArticleChunker {

    private static final Logger log = LoggerFactory.getLogger(ArticleChunker.class);

    // Export columns
    public static final String EXPORT_ID = "id";
    public static final String EXPORT_TITLE = "article_title_t";
    public static final String EXPORT_DATE = "date_tdt";
    public static final String EXPORT_PAPER = "paper_t";
    public static final String EXPORT_TEXT = "ocr_t";

    public static final String FILE_PREFIX = "udn_chunks_part";

    public static final int DEFAULT_CHUNK_SIZE = 500;
    public static final int DEFAULT_OVERLAP = 50;
    public static final int DEFAULT_ROWS_PER_FILE = 100_000;

    private static final CsvSchema CHUNK_SCHEMA = CsvSchema.builder()
        .addColumn(ChunkCsvReader.ID)
        .addColumn(ChunkCsvReader.ARTICLE_TITLE)
        .addColumn(ChunkCsvReader.DATE)
        .addColumn(ChunkCsvReader.PAPER)
        .addColumn(ChunkCsvReader.CHUNK_INDEX)
        .addColumn(ChunkCsvReader.CHUNK_TEXT)
        .build()
        .withHeader();

    private final int chunkSize;
    private final int overlap;
    private final int rowsPerFile;
    private final ObjectReader exportReader;
    private final ObjectWriter chunkWriter;

    public ArticleChunker(int chunkSize, int overlap, int rowsPerFile) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be >= 1");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("overlap must be in [0, chunkSize)");
        }
        if (rowsPerFile < 1) {
            throw new IllegalArgumentException("rowsPerFile must be >= 1");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.rowsPerFile = rowsPerFile;

        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.exportReader = mapper.readerFor(Map.class).with(CsvSchema.emptySchema().withHeader());
        this.chunkWriter = mapper.writer(CHUNK_SCHEMA);
    }

    public static ArticleChunker withDefaults() {
        return new ArticleChunker(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP, DEFAULT_ROWS_PER_FILE);
    }

    /**
     * Outcome of one chunking run.
     */
    public record Summary(int articles, int articlesSkipped, long chunks, List<Path> files) {
        public Summary {
            files = List.copyOf(files);
        }
    }

    /**
     * Cuts text into windows of {@code chunkSize} characters, each starting
     * {@code chunkSize - overlap} after the previous one. The last window ends at
     * the end of the text. Blank text and the literal {@code nan} give no chunks.
     */
    public List<String> split(String text) {
        if (isMissing(text)) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        int step = chunkSize - overlap;
        for (int start = 0; start < text.length(); start += step) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(text.substring(start, end));
            if (end == text.length()) {
                break;
            }
        }
        return chunks;
    }

    /**
     * Chunks every article of {@code exportCsv} into {@code outputDir}.
     */
    public Summary chunk(Path exportCsv, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);

        List<Path> files = new ArrayList<>();
        int articles = 0;
        int skipped = 0;
        long chunks = 0;

        SequenceWriter out = null;
        long rowsInFile = 0;
        try (MappingIterator<Map<String, String>> it = exportReader.readValues(exportCsv.toFile())) {
            while (it.hasNextValue()) {
                Map<String, String> article = it.nextValue();
                List<String> pieces = split(article.get(EXPORT_TEXT));
                if (pieces.isEmpty()) {
                    skipped++;
                    continue;
                }
                articles++;

                if (out == null) {
                    Path file = outputDir.resolve(FILE_PREFIX + files.size() + ".csv");
                    files.add(file);
                    out = chunkWriter.writeValues(file.toFile());
                    rowsInFile = 0;
                }
                for (int i = 0; i < pieces.size(); i++) {
                    out.write(Arrays.asList(
                        value(article, EXPORT_ID),
                        value(article, EXPORT_TITLE),
                        value(article, EXPORT_DATE),
                        value(article, EXPORT_PAPER),
                        i,
                        pieces.get(i)));
                }
                rowsInFile += pieces.size();
                chunks += pieces.size();

                if (rowsInFile >= rowsPerFile) {
                    out.close();
                    out = null;
                    log.info("Wrote {} chunks to {}", rowsInFile, files.get(files.size() - 1).getFileName());
                }
            }
        } finally {
            if (out != null) {
                out.close();
                log.info("Wrote {} chunks to {}", rowsInFile, files.get(files.size() - 1).getFileName());
            }
        }

        log.info("Chunked {} articles into {} chunks across {} files ({} articles without text)",
            articles, chunks, files.size(), skipped);
        return new Summary(articles, skipped, chunks, files);
    }

    private static boolean isMissing(String text) {
        return text == null || text.isBlank() || text.equalsIgnoreCase("nan");
    }

    private static String value(Map<String, String> article, String column) {
        String value = article.get(column);
        return value != null ? value : "";
    }
}
