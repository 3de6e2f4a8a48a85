package org.example.quizbot.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.quizbot.model.QuestionFingerprint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecentQuestionCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void register_neverExceedsCapacityAndEvictsOldestFirst() {
        RecentQuestionCache cache = new RecentQuestionCache(3);

        for (int i = 1; i <= 5; i++) {
            cache.register(fingerprint("Q" + i));
            assertTrue(cache.size() <= 3);
        }

        assertEquals(3, cache.size());
        assertFalse(cache.contains(fingerprint("Q1")));
        assertFalse(cache.contains(fingerprint("Q2")));
        assertTrue(cache.contains(fingerprint("Q3")));
        assertEquals(List.of(fingerprint("Q3"), fingerprint("Q4"), fingerprint("Q5")), cache.snapshot());
    }

    @Test
    void register_isInsertIfAbsent() {
        RecentQuestionCache cache = new RecentQuestionCache(2);

        assertTrue(cache.register(fingerprint("Q1")));
        assertFalse(cache.register(fingerprint("Q1")));
        assertTrue(cache.register(fingerprint("Q2")));
        assertFalse(cache.register(new QuestionFingerprint("  Q2  ", 0)));

        assertEquals(2, cache.size());
        assertEquals(List.of(fingerprint("Q1"), fingerprint("Q2")), cache.snapshot());
    }

    @Test
    void contains_treatsSameTextWithDifferentIndexAsDistinct() {
        RecentQuestionCache cache = new RecentQuestionCache(10);
        cache.register(new QuestionFingerprint("Same text", 0));

        assertTrue(cache.contains(new QuestionFingerprint("Same text", 0)));
        assertFalse(cache.contains(new QuestionFingerprint("Same text", 1)));
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RecentQuestionCache(0));
    }

    @Test
    void persistAndLoad_roundTripsEntriesInOrder() {
        Path snapshot = tempDir.resolve("state/recent.json");
        RecentQuestionCache cache = new RecentQuestionCache(5, snapshot, new ObjectMapper());
        cache.register(fingerprint("Q1"));
        cache.register(fingerprint("Q2"));
        cache.persist();

        RecentQuestionCache restored = new RecentQuestionCache(5, snapshot, new ObjectMapper());
        int loaded = restored.load();

        assertEquals(2, loaded);
        assertEquals(cache.snapshot(), restored.snapshot());
        assertTrue(Files.exists(snapshot));
    }

    @Test
    void persist_concurrentWritersAlwaysLeaveCompleteSnapshot() throws Exception {
        Path snapshot = tempDir.resolve("recent.json");
        RecentQuestionCache cache = new RecentQuestionCache(500, snapshot, new ObjectMapper());
        for (int i = 0; i < 500; i++) {
            cache.register(fingerprint("Seed " + i));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 20; round++) {
                CountDownLatch start = new CountDownLatch(1);
                List<Future<?>> writers = new ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    int writer = t;
                    int currentRound = round;
                    writers.add(pool.submit(() -> {
                        start.await();
                        cache.register(fingerprint("Round " + currentRound + " writer " + writer));
                        cache.persist();
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : writers) {
                    future.get(10, TimeUnit.SECONDS);
                }

                RecentQuestionCache restored = new RecentQuestionCache(500, snapshot, new ObjectMapper());
                assertEquals(500, restored.load());
                assertEquals(cache.snapshot(), restored.snapshot());
            }
        } finally {
            pool.shutdownNow();
        }
        assertFalse(Files.exists(tempDir.resolve("recent.json.tmp")));
    }

    @Test
    void register_fromManyThreadsKeepsCapacityAndMembership() throws Exception {
        RecentQuestionCache cache = new RecentQuestionCache(100);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int writer = t;
                tasks.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        cache.register(fingerprint("W" + writer + "-" + i));
                    }
                    return null;
                }));
            }
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<QuestionFingerprint> entries = cache.snapshot();
        assertEquals(100, entries.size());
        assertEquals(100, new HashSet<>(entries).size());
        assertTrue(entries.stream().allMatch(cache::contains));
    }

    @Test
    void load_trimsOldestEntriesBeyondCapacity() {
        Path snapshot = tempDir.resolve("recent.json");
        RecentQuestionCache large = new RecentQuestionCache(4, snapshot, new ObjectMapper());
        for (int i = 1; i <= 4; i++) {
            large.register(fingerprint("Q" + i));
        }
        large.persist();

        RecentQuestionCache small = new RecentQuestionCache(2, snapshot, new ObjectMapper());
        small.load();

        assertEquals(List.of(fingerprint("Q3"), fingerprint("Q4")), small.snapshot());
    }

    @Test
    void load_withUnreadableFile_startsEmpty() throws Exception {
        Path snapshot = tempDir.resolve("recent.json");
        Files.writeString(snapshot, "not json");
        RecentQuestionCache cache = new RecentQuestionCache(5, snapshot, new ObjectMapper());

        assertEquals(0, cache.load());
        assertEquals(0, cache.size());
    }

    @Test
    void load_withoutSnapshotPath_isNoOp() {
        RecentQuestionCache cache = new RecentQuestionCache(5);
        cache.persist();

        assertEquals(0, cache.load());
        assertFalse(cache.isPersistent());
    }

    private QuestionFingerprint fingerprint(String text) {
        return new QuestionFingerprint(text, 0);
    }
}
