package io.archive.vectors.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class IndexArtifactsTest {

    @TempDir
    Path tempDir;

    @Test
    void testDerivesSiblingPaths() {
        IndexArtifacts artifacts = IndexArtifacts.forBase(tempDir.resolve("udn.index"));

        assertEquals(tempDir.resolve("udn.index"), artifacts.index());
        assertEquals(tempDir.resolve("udn.db"), artifacts.database());
        assertEquals(tempDir.resolve("udn.committed"), artifacts.resumeLog());
        assertEquals(artifacts, IndexArtifacts.forBase(tempDir.resolve("udn")));
    }

    @Test
    void testDeleteAllRemovesSqliteSidecars() throws IOException {
        IndexArtifacts artifacts = IndexArtifacts.forBase(tempDir.resolve("lite.index"));
        Files.writeString(artifacts.index(), "x");
        Files.writeString(artifacts.database(), "x");
        Files.writeString(tempDir.resolve("lite.db-wal"), "x");
        Files.writeString(artifacts.resumeLog(), "x");

        artifacts.deleteAll();

        assertFalse(artifacts.indexExists());
        assertFalse(artifacts.databaseExists());
        assertFalse(Files.exists(tempDir.resolve("lite.db-wal")));
        assertFalse(Files.exists(artifacts.resumeLog()));
    }
}
