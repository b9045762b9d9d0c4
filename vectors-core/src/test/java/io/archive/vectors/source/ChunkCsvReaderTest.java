package io.archive.vectors.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChunkCsvReaderTest {

    @TempDir
    Path tempDir;

    private ChunkCsvReader reader;
    private Path csv;

    @BeforeEach
    void setUp() throws IOException {
        reader = new ChunkCsvReader();
        csv = tempDir.resolve("chunks.csv");
        Files.writeString(csv, """
            id,article_title,date,paper,chunk_index,chunk_text,extra
            a1,Mining News,1899-04-02T00:00:00,Salt Lake Herald,0,"Ore shipments, silver and lead",x
            a1,Mining News,1899-04-02T00:00:00,Salt Lake Herald,1.0,"Second ""quoted"" part",x

            a2,,,,,Short note,x
            """);
    }

    @Test
    void testReadsRowsWithText() throws IOException {
        List<ChunkRow> rows = reader.readRows(csv, true);

        assertEquals(3, rows.size());
        assertEquals("a1", rows.get(0).articleId());
        assertEquals("Salt Lake Herald", rows.get(0).paper());
        assertEquals("Ore shipments, silver and lead", rows.get(0).text());
        assertEquals(1, rows.get(1).chunkIndex());
        assertEquals("Second \"quoted\" part", rows.get(1).text());
    }

    @Test
    void testMissingFieldsBecomeEmpty() throws IOException {
        ChunkRow row = reader.readRows(csv, true).get(2);

        assertEquals("", row.articleTitle());
        assertEquals("", row.date());
        assertEquals("", row.paper());
        assertEquals(0, row.chunkIndex());
    }

    @Test
    void testTextDroppedWhenNotRequested() throws IOException {
        List<ChunkRow> rows = reader.readRows(csv, false);

        assertEquals(3, rows.size());
        assertEquals("", rows.get(0).text());
        assertEquals("Mining News", rows.get(0).articleTitle());
    }

    @Test
    void testReadTextByRowOffset() throws IOException {
        assertEquals(Optional.of("Short note"), reader.readText(csv, 2));
        assertEquals(Optional.empty(), reader.readText(csv, 3));
        assertEquals(Optional.empty(), reader.readText(csv, -1));
    }

    @Test
    void testCountRowsSkipsBlankLines() throws IOException {
        assertEquals(3, reader.countRows(csv));
    }
}
