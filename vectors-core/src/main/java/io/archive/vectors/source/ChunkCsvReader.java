package io.archive.vectors.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads chunk metadata CSV files with a header row
 * ({@code id, article_title, date, paper, chunk_index, chunk_text}).
 *
 * <p>Rows are addressed by their zero-based position after the header, which
 * is the row offset recorded in the metadata store.</p>
 */
public class ChunkCsvReader {

    public static final String ID = "id";
    public static final String ARTICLE_TITLE = "article_title";
    public static final String DATE = "date";
    public static final String PAPER = "paper";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String CHUNK_TEXT = "chunk_text";

    private final ObjectReader reader;

    public ChunkCsvReader() {
        CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.reader = mapper.readerFor(Map.class).with(CsvSchema.emptySchema().withHeader());
    }

    /**
     * Reads every row.
     *
     * @param includeText false to drop chunk text, as the builder does for external-text stores
     */
    public List<ChunkRow> readRows(Path csv, boolean includeText) throws IOException {
        List<ChunkRow> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = reader.readValues(csv.toFile())) {
            while (it.hasNextValue()) {
                rows.add(toRow(it.nextValue(), includeText));
            }
        }
        return rows;
    }

    /**
     * Streams to one row and returns its text, without materializing the file.
     */
    public Optional<String> readText(Path csv, int rowOffset) throws IOException {
        if (rowOffset < 0) {
            return Optional.empty();
        }
        try (MappingIterator<Map<String, String>> it = reader.readValues(csv.toFile())) {
            int row = 0;
            while (it.hasNextValue()) {
                Map<String, String> values = it.nextValue();
                if (row++ == rowOffset) {
                    return Optional.ofNullable(values.get(CHUNK_TEXT));
                }
            }
        }
        return Optional.empty();
    }

    public long countRows(Path csv) throws IOException {
        long count = 0;
        try (MappingIterator<Map<String, String>> it = reader.readValues(csv.toFile())) {
            while (it.hasNextValue()) {
                it.nextValue();
                count++;
            }
        }
        return count;
    }

    private static ChunkRow toRow(Map<String, String> values, boolean includeText) {
        return new ChunkRow(
            values.get(ID),
            values.get(ARTICLE_TITLE),
            values.get(DATE),
            values.get(PAPER),
            parseIndex(values.get(CHUNK_INDEX)),
            includeText ? values.get(CHUNK_TEXT) : null
        );
    }

    private static int parseIndex(String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
