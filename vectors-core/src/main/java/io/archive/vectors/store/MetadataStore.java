package io.archive.vectors.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite table mapping global ids to chunk metadata.
 *
 * <p>A store opened for writing keeps one connection with auto-commit off: rows
 * written by {@link #insertAll(List)} become durable only at {@link #commit()}, which
 * lets the builder commit several source files as one unit together with an index
 * checkpoint. A store opened read-only holds no connection at all; every lookup
 * opens its own read-only connection, so concurrent queries share no JDBC state.</p>
 */
public class MetadataStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetadataStore.class);

    private static final String CREATE_DOCUMENTS = """
        CREATE TABLE IF NOT EXISTS documents (
            global_id     INTEGER PRIMARY KEY,
            article_id    TEXT,
            article_title TEXT,
            date          TEXT,
            paper         TEXT,
            source_file   TEXT NOT NULL,
            row_offset    INTEGER NOT NULL,
            chunk_text    TEXT
        )""";

    private static final String CREATE_INFO = """
        CREATE TABLE IF NOT EXISTS store_info (
            key   TEXT PRIMARY KEY,
            value TEXT
        )""";

    private static final String UPSERT = """
        INSERT OR REPLACE INTO documents
            (global_id, article_id, article_title, date, paper, source_file, row_offset, chunk_text)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String SELECT_COLUMNS =
        "SELECT global_id, article_id, article_title, date, paper, source_file, row_offset, chunk_text FROM documents";

    private static final String INLINE_TEXT_KEY = "inline_text";

    /** SQLite's default host-parameter limit is 999 */
    private static final int LOOKUP_CHUNK = 500;

    private final Path path;
    private final String url;
    private final Connection writer;
    private final boolean inlineText;

    private MetadataStore(Path path, Connection writer, boolean inlineText) {
        this.path = path;
        this.url = "jdbc:sqlite:" + path.toAbsolutePath();
        this.writer = writer;
        this.inlineText = inlineText;
    }

    // ==================== Factory Methods ====================

    /**
     * Opens the database for writing, creating it and its schema if needed.
     *
     * @param inlineText whether chunk text is stored with the metadata; only
     *                   applied when the database is new
     */
    public static MetadataStore openForWriting(Path path, boolean inlineText) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            SQLiteConfig config = new SQLiteConfig();
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
            config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
            Connection connection = DriverManager.getConnection(
                "jdbc:sqlite:" + path.toAbsolutePath(), config.toProperties());

            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_DOCUMENTS);
                statement.execute(CREATE_INFO);
            }
            boolean storedFlag = readInlineFlag(connection).orElseGet(() -> {
                writeInfo(connection, INLINE_TEXT_KEY, Boolean.toString(inlineText));
                return inlineText;
            });
            connection.setAutoCommit(false);

            log.info("Opened metadata store for writing: {} (inline text: {})", path, storedFlag);
            return new MetadataStore(path, connection, storedFlag);
        } catch (SQLException | IOException e) {
            throw new MetadataStoreException("Cannot open metadata store " + path, e);
        }
    }

    /**
     * Opens an existing database for lookups.
     *
     * @throws MetadataStoreException if the file does not exist or has no schema
     */
    public static MetadataStore openReadOnly(Path path) {
        if (!Files.exists(path)) {
            throw new MetadataStoreException("Metadata store not found: " + path);
        }
        MetadataStore probe = new MetadataStore(path, null, false);
        try (Connection connection = probe.readConnection()) {
            boolean inline = readInlineFlag(connection).orElse(false);
            log.info("Opened metadata store read-only: {} (inline text: {})", path, inline);
            return new MetadataStore(path, null, inline);
        } catch (SQLException e) {
            throw new MetadataStoreException("Cannot open metadata store " + path, e);
        }
    }

    // ==================== Writes ====================

    /**
     * Upserts rows inside the current transaction.
     */
    public void insertAll(List<ChunkRecord> records) {
        requireWriter();
        try (PreparedStatement statement = writer.prepareStatement(UPSERT)) {
            for (ChunkRecord record : records) {
                statement.setLong(1, record.globalId());
                statement.setString(2, record.articleId());
                statement.setString(3, record.articleTitle());
                statement.setString(4, record.date());
                statement.setString(5, record.paper());
                statement.setString(6, record.sourceFile());
                statement.setInt(7, record.rowOffset());
                statement.setString(8, inlineText ? record.text() : null);
                statement.addBatch();
            }
            statement.executeBatch();
        } catch (SQLException e) {
            throw new MetadataStoreException("Failed to write " + records.size() + " metadata rows", e);
        }
    }

    public void commit() {
        requireWriter();
        try {
            writer.commit();
        } catch (SQLException e) {
            throw new MetadataStoreException("Failed to commit metadata store " + path, e);
        }
    }

    public void rollback() {
        requireWriter();
        try {
            writer.rollback();
        } catch (SQLException e) {
            throw new MetadataStoreException("Failed to roll back metadata store " + path, e);
        }
    }

    /**
     * Deletes every row with {@code global_id >= firstId} and commits.
     *
     * @return number of rows removed
     */
    public int truncateFrom(long firstId) {
        requireWriter();
        try (PreparedStatement statement = writer.prepareStatement("DELETE FROM documents WHERE global_id >= ?")) {
            statement.setLong(1, firstId);
            int removed = statement.executeUpdate();
            writer.commit();
            return removed;
        } catch (SQLException e) {
            throw new MetadataStoreException("Failed to truncate metadata store at id " + firstId, e);
        }
    }

    // ==================== Reads ====================

    public Optional<ChunkRecord> find(long globalId) {
        return Optional.ofNullable(findAll(List.of(globalId)).get(globalId));
    }

    /**
     * Point lookups for a set of ids. Ids with no row are absent from the result.
     */
    public Map<Long, ChunkRecord> findAll(Collection<Long> globalIds) {
        Map<Long, ChunkRecord> found = new HashMap<>();
        if (globalIds.isEmpty()) {
            return found;
        }
        List<Long> ids = new ArrayList<>(globalIds);
        withConnection("Metadata lookup", connection -> {
            for (int start = 0; start < ids.size(); start += LOOKUP_CHUNK) {
                List<Long> slice = ids.subList(start, Math.min(ids.size(), start + LOOKUP_CHUNK));
                String placeholders = String.join(",", Collections.nCopies(slice.size(), "?"));
                try (PreparedStatement statement = connection.prepareStatement(
                        SELECT_COLUMNS + " WHERE global_id IN (" + placeholders + ")")) {
                    for (int i = 0; i < slice.size(); i++) {
                        statement.setLong(i + 1, slice.get(i));
                    }
                    try (ResultSet rs = statement.executeQuery()) {
                        while (rs.next()) {
                            ChunkRecord record = toRecord(rs);
                            found.put(record.globalId(), record);
                        }
                    }
                }
            }
            return null;
        });
        return found;
    }

    public long count() {
        return queryLong("SELECT COUNT(*) FROM documents");
    }

    /**
     * Highest stored id, or -1 when empty.
     */
    public long maxId() {
        return queryLong("SELECT COALESCE(MAX(global_id), -1) FROM documents");
    }

    /**
     * Row counts per source file, in first-id order.
     */
    public Map<String, Long> rowCountsBySource() {
        return withConnection("Row count by source", connection -> {
            Map<String, Long> counts = new LinkedHashMap<>();
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(
                     "SELECT source_file, COUNT(*) FROM documents GROUP BY source_file ORDER BY MIN(global_id)")) {
                while (rs.next()) {
                    counts.put(rs.getString(1), rs.getLong(2));
                }
            }
            return counts;
        });
    }

    public boolean storesInlineText() {
        return inlineText;
    }

    public Path getPath() {
        return path;
    }

    public boolean isReadOnly() {
        return writer == null;
    }

    /**
     * Closes the writer connection. Rows not yet committed are discarded.
     */
    @Override
    public void close() {
        if (writer == null) {
            return;
        }
        SQLException failure = null;
        try {
            if (!writer.isClosed()) {
                writer.rollback();
            }
        } catch (SQLException e) {
            failure = e;
        } finally {
            try {
                writer.close();
            } catch (SQLException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw new MetadataStoreException("Failed to close metadata store " + path, failure);
        }
    }

    // ==================== Helper Methods ====================

    private long queryLong(String sql) {
        return withConnection(sql, connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery(sql)) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    /**
     * Runs a read against the writer connection, which sees its own uncommitted
     * rows, or against a fresh read-only connection closed afterwards.
     */
    private <T> T withConnection(String operation, SqlWork<T> work) {
        try {
            if (writer != null) {
                return work.apply(writer);
            }
            try (Connection connection = readConnection()) {
                return work.apply(connection);
            }
        } catch (SQLException e) {
            throw new MetadataStoreException(operation + " failed on " + path, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private Connection readConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        return DriverManager.getConnection(url, config.toProperties());
    }

    private void requireWriter() {
        if (writer == null) {
            throw new IllegalStateException("Metadata store " + path + " is open read-only");
        }
    }

    private static Optional<Boolean> readInlineFlag(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT value FROM store_info WHERE key = ?")) {
            statement.setString(1, INLINE_TEXT_KEY);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(Boolean.parseBoolean(rs.getString(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new MetadataStoreException("Metadata store has no readable schema", e);
        }
    }

    private static void writeInfo(Connection connection, String key, String value) {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT OR REPLACE INTO store_info (key, value) VALUES (?, ?)")) {
            statement.setString(1, key);
            statement.setString(2, value);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new MetadataStoreException("Failed to write store info " + key, e);
        }
    }

    private static ChunkRecord toRecord(ResultSet rs) throws SQLException {
        return new ChunkRecord(
            rs.getLong(1),
            rs.getString(2),
            rs.getString(3),
            rs.getString(4),
            rs.getString(5),
            rs.getString(6),
            rs.getInt(7),
            rs.getString(8)
        );
    }
}
