package io.archive.vectors.build;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Resume log of source files whose vectors and metadata rows are durably written.
 *
 * <p>The log is plain text, one committed file name per line, only ever appended to
 * (and fsynced) after the index checkpoint that contains those files is on disk.
 * In-memory claims let a file be owned by one writer at a time.</p>
 */
public class IngestionTracker {

    private static final Logger log = LoggerFactory.getLogger(IngestionTracker.class);

    private final Path logFile;
    private final ConcurrentHashMap<String, IngestionState> states = new ConcurrentHashMap<>();

    private IngestionTracker(Path logFile) {
        this.logFile = logFile;
    }

    /**
     * Opens the resume log, reading every committed name already recorded.
     */
    public static IngestionTracker open(Path logFile) throws IOException {
        IngestionTracker tracker = new IngestionTracker(logFile);
        if (Files.exists(logFile)) {
            for (String line : Files.readAllLines(logFile, StandardCharsets.UTF_8)) {
                String name = line.trim();
                if (!name.isEmpty()) {
                    tracker.states.put(name, IngestionState.COMMITTED);
                }
            }
            log.info("Resume log {} lists {} committed files", logFile, tracker.states.size());
        }
        return tracker;
    }

    public IngestionState state(String name) {
        return states.getOrDefault(name, IngestionState.PENDING);
    }

    public boolean isCommitted(String name) {
        return state(name) == IngestionState.COMMITTED;
    }

    /**
     * Atomically moves a pending file to in-progress.
     *
     * @return false if the file is already claimed or committed
     */
    public boolean tryClaim(String name) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        states.compute(name, (key, current) -> {
            if (current == null || current == IngestionState.PENDING) {
                claimed.set(true);
                return IngestionState.IN_PROGRESS;
            }
            return current;
        });
        return claimed.get();
    }

    /**
     * Returns a claimed file to pending, e.g. after it failed to load.
     */
    public void release(String name) {
        states.computeIfPresent(name, (key, current) ->
            current == IngestionState.IN_PROGRESS ? null : current);
    }

    /**
     * Appends names to the log and fsyncs it, then marks them committed.
     */
    public void markCommitted(Collection<String> names) throws IOException {
        List<String> fresh = names.stream()
            .filter(n -> !isCommitted(n))
            .distinct()
            .collect(Collectors.toList());
        if (fresh.isEmpty()) {
            return;
        }

        StringBuilder lines = new StringBuilder();
        for (String name : fresh) {
            lines.append(name).append('\n');
        }
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileChannel channel = FileChannel.open(logFile,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(lines.toString().getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        fresh.forEach(n -> states.put(n, IngestionState.COMMITTED));
    }

    /**
     * Drops committed names outside {@code keep} and rewrites the log to match.
     *
     * @return names that were dropped
     */
    public Set<String> retainCommitted(Set<String> keep) throws IOException {
        Set<String> dropped = committed().stream()
            .filter(n -> !keep.contains(n))
            .collect(Collectors.toCollection(TreeSet::new));
        if (dropped.isEmpty()) {
            return dropped;
        }
        dropped.forEach(states::remove);

        StringBuilder lines = new StringBuilder();
        committed().forEach(n -> lines.append(n).append('\n'));
        Path tmp = logFile.resolveSibling(logFile.getFileName() + ".tmp");
        Files.writeString(tmp, lines, StandardCharsets.UTF_8);
        Files.move(tmp, logFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return dropped;
    }

    /**
     * Committed names in sorted order.
     */
    public Set<String> committed() {
        return states.entrySet().stream()
            .filter(e -> e.getValue() == IngestionState.COMMITTED)
            .map(java.util.Map.Entry::getKey)
            .collect(Collectors.toCollection(TreeSet::new));
    }

    public int committedCount() {
        return (int) states.values().stream().filter(s -> s == IngestionState.COMMITTED).count();
    }

    public Path getLogFile() {
        return logFile;
    }
}
