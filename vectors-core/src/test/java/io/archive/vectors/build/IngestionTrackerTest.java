package io.archive.vectors.build;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IngestionTrackerTest {

    @TempDir
    Path tempDir;

    @Test
    void testClaimReleaseCommit() throws IOException {
        IngestionTracker tracker = IngestionTracker.open(tempDir.resolve("udn.committed"));

        assertEquals(IngestionState.PENDING, tracker.state("a"));
        assertTrue(tracker.tryClaim("a"));
        assertFalse(tracker.tryClaim("a"));
        assertEquals(IngestionState.IN_PROGRESS, tracker.state("a"));

        tracker.release("a");
        assertEquals(IngestionState.PENDING, tracker.state("a"));

        assertTrue(tracker.tryClaim("a"));
        tracker.markCommitted(List.of("a"));
        assertTrue(tracker.isCommitted("a"));
        assertFalse(tracker.tryClaim("a"));
    }

    @Test
    void testCommittedNamesSurviveReopen() throws IOException {
        Path logFile = tempDir.resolve("udn.committed");
        IngestionTracker tracker = IngestionTracker.open(logFile);
        tracker.markCommitted(List.of("b", "a"));
        tracker.markCommitted(List.of("a", "c"));

        IngestionTracker reopened = IngestionTracker.open(logFile);

        assertEquals(Set.of("a", "b", "c"), reopened.committed());
        assertEquals(3, reopened.committedCount());
        assertEquals(3, Files.readAllLines(logFile).size());
    }

    @Test
    void testRetainCommittedRewritesLog() throws IOException {
        Path logFile = tempDir.resolve("udn.committed");
        IngestionTracker tracker = IngestionTracker.open(logFile);
        tracker.markCommitted(List.of("a", "b", "c"));

        Set<String> dropped = tracker.retainCommitted(Set.of("a", "c"));

        assertEquals(Set.of("b"), dropped);
        assertEquals(IngestionState.PENDING, tracker.state("b"));
        assertEquals(Set.of("a", "c"), IngestionTracker.open(logFile).committed());
    }

    @Test
    void testRetainCommittedReportsRewriteFailure() throws IOException {
        Path logFile = tempDir.resolve("udn.committed");
        IngestionTracker tracker = IngestionTracker.open(logFile);
        tracker.markCommitted(List.of("a", "b"));
        Files.createDirectories(tempDir.resolve("udn.committed.tmp").resolve("occupied"));

        assertThrows(IOException.class, () -> tracker.retainCommitted(Set.of("a")));
        assertEquals(Set.of("a", "b"), IngestionTracker.open(logFile).committed());
    }

    @Test
    void testBlankLinesIgnored() throws IOException {
        Path logFile = tempDir.resolve("udn.committed");
        Files.writeString(logFile, "a\n\n  \nb\n");

        assertEquals(Set.of("a", "b"), IngestionTracker.open(logFile).committed());
    }
}
