package org.example.quizbot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.quizbot.model.QuestionFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Bounded FIFO record of recently delivered question fingerprints.
 * The deque and the membership set always hold the same entries; once the ceiling is
 * exceeded the oldest registration is evicted first.
 */
public class RecentQuestionCache {

    private static final Logger log = LoggerFactory.getLogger(RecentQuestionCache.class);

    private final int capacity;
    private final Path snapshotPath;    // nullable
    private final ObjectMapper objectMapper;
    private final Deque<QuestionFingerprint> order = new ArrayDeque<>();
    private final Set<QuestionFingerprint> members = new HashSet<>();
    private final Object persistLock = new Object();

    public RecentQuestionCache(int capacity) {
        this(capacity, null, new ObjectMapper());
    }

    public RecentQuestionCache(int capacity, Path snapshotPath, ObjectMapper objectMapper) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Recency cache capacity must be positive");
        }
        this.capacity = capacity;
        this.snapshotPath = snapshotPath;
        this.objectMapper = objectMapper;
    }

    /**
     * Insert if absent.
     *
     * @return true if the fingerprint was not present before
     */
    public synchronized boolean register(QuestionFingerprint fingerprint) {
        if (fingerprint == null || members.contains(fingerprint)) {
            return false;
        }
        order.addLast(fingerprint);
        members.add(fingerprint);
        evictOverflow();
        return true;
    }

    public synchronized boolean contains(QuestionFingerprint fingerprint) {
        return fingerprint != null && members.contains(fingerprint);
    }

    public synchronized int size() {
        return order.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Oldest first.
     */
    public synchronized List<QuestionFingerprint> snapshot() {
        return List.copyOf(order);
    }

    public boolean isPersistent() {
        return snapshotPath != null;
    }

    private void evictOverflow() {
        while (order.size() > capacity) {
            QuestionFingerprint evicted = order.pollFirst();
            members.remove(evicted);
        }
    }

    /**
     * Replace the in-memory state with the snapshot file contents, if a file exists.
     *
     * @return number of fingerprints loaded
     */
    public int load() {
        if (snapshotPath == null || !Files.exists(snapshotPath)) {
            return 0;
        }
        try {
            Snapshot snapshot = objectMapper.readValue(snapshotPath.toFile(), Snapshot.class);
            List<QuestionFingerprint> entries = snapshot.entries() == null ? List.of() : snapshot.entries();
            synchronized (this) {
                order.clear();
                members.clear();
                for (QuestionFingerprint entry : entries) {
                    if (entry != null && members.add(entry)) {
                        order.addLast(entry);
                    }
                }
                evictOverflow();
                log.info("Loaded {} recent question fingerprints from {}", order.size(), snapshotPath);
                return order.size();
            }
        } catch (IOException e) {
            log.warn("Failed to read recency snapshot {}; starting empty", snapshotPath, e);
            return 0;
        }
    }

    /**
     * Write the current state to the snapshot file. No-op without a snapshot path.
     * Concurrent callers write one at a time.
     */
    public void persist() {
        if (snapshotPath == null) {
            return;
        }
        synchronized (persistLock) {
            writeSnapshot();
        }
    }

    private void writeSnapshot() {
        Snapshot snapshot = new Snapshot(capacity, snapshot());
        try {
            Path parent = snapshotPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to write recency snapshot {}", snapshotPath, e);
        }
    }

    public record Snapshot(int capacity, List<QuestionFingerprint> entries) {
        public Snapshot {
            entries = entries == null ? new ArrayList<>() : entries;
        }
    }
}
