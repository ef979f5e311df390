package dev.mars.rehab.eventstore;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.rehab.api.error.ConcurrencyConflictException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStatistics;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class InMemoryStreamStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-05T12:00:00Z");

    private InMemoryStreamStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStreamStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void testAppendAssignsGaplessVersions() {
        for (int i = 1; i <= 5; i++) {
            Event event = store.append("p-1", EventFixtures.rep("ex-1", i, 70 + i), null, ExpectedVersion.ANY).join();
            assertEquals(i, event.getStreamVersion());
            assertEquals("p-1", event.getSubjectId());
            assertNotNull(event.getEventId());
            assertEquals(NOW, event.getMeta().getRecordedAt());
        }

        List<Long> versions = store.read("p-1", ReadOptions.all()).join().stream()
            .map(Event::getStreamVersion).collect(Collectors.toList());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), versions);
        assertEquals(5L, store.tailVersion("p-1").join());
    }

    @Test
    void testStaleExpectedVersionConflictsWithoutMutation() {
        for (int i = 0; i < 7; i++) {
            store.append("p-1", EventFixtures.rep("ex-1", i + 1, 80), null, ExpectedVersion.ANY).join();
        }

        CompletionException e = assertThrows(CompletionException.class,
            () -> store.append("p-1", EventFixtures.rep("ex-1", 8, 80), null, ExpectedVersion.exactly(5)).join());

        ConcurrencyConflictException conflict = assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
        assertEquals(5, conflict.getExpectedVersion());
        assertEquals(7, conflict.getActualVersion());
        assertEquals(7L, store.tailVersion("p-1").join());
    }

    @Test
    void testNoStreamExpectationOnlyMatchesEmptyStream() {
        Event first = store.append("p-1", EventFixtures.dataConsent("c-1"), null, ExpectedVersion.NO_STREAM).join();
        assertEquals(1, first.getStreamVersion());

        CompletionException e = assertThrows(CompletionException.class,
            () -> store.append("p-1", EventFixtures.dataConsent("c-2"), null, ExpectedVersion.NO_STREAM).join());
        assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
    }

    @Test
    void testConcurrentAppendsWithSameExpectedVersionExactlyOneWins() throws Exception {
        for (int i = 0; i < 5; i++) {
            store.append("p-1", EventFixtures.rep("ex-1", i + 1, 75), null, ExpectedVersion.ANY).join();
        }

        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                int n = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.append("p-1", EventFixtures.rep("ex-1", 100 + n, 60), null,
                            ExpectedVersion.exactly(5)).join();
                        successes.incrementAndGet();
                    } catch (CompletionException e) {
                        if (e.getCause() instanceof ConcurrencyConflictException) {
                            conflicts.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, successes.get());
        assertEquals(writers - 1, conflicts.get());
        assertEquals(6L, store.tailVersion("p-1").join());
    }

    @Test
    void testConcurrentAppendsToDifferentSubjectsAllSucceed() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int s = 0; s < 4; s++) {
                String subject = "p-" + s;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 250; i++) {
                        store.append(subject, EventFixtures.rep("ex-1", i + 1, 50), null, ExpectedVersion.ANY).join();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (int s = 0; s < 4; s++) {
            List<Event> events = store.read("p-" + s, ReadOptions.all()).join();
            assertEquals(250, events.size());
            for (int i = 0; i < events.size(); i++) {
                assertEquals(i + 1, events.get(i).getStreamVersion());
            }
        }
    }

    @Test
    void testReadRanges() {
        for (int i = 0; i < 10; i++) {
            store.append("p-1", EventFixtures.rep("ex-1", i + 1, 50), null, ExpectedVersion.ANY).join();
        }

        assertEquals(10, store.read("p-1", ReadOptions.from(0)).join().size());
        assertEquals(10, store.read("p-1", ReadOptions.from(1)).join().size());

        List<Event> slice = store.read("p-1", ReadOptions.of(4, 3)).join();
        assertEquals(List.of(4L, 5L, 6L), slice.stream().map(Event::getStreamVersion).collect(Collectors.toList()));

        assertTrue(store.read("p-1", ReadOptions.from(11)).join().isEmpty());
        assertTrue(store.read("unknown", ReadOptions.all()).join().isEmpty());
        assertEquals(0L, store.tailVersion("unknown").join());
    }

    @Test
    void testReadIsSnapshotUnaffectedByLaterAppends() {
        store.append("p-1", EventFixtures.rep("ex-1", 1, 50), null, ExpectedVersion.ANY).join();
        List<Event> before = store.read("p-1", ReadOptions.all()).join();
        store.append("p-1", EventFixtures.rep("ex-1", 2, 50), null, ExpectedVersion.ANY).join();

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
    }

    @Test
    void testMetadataIsPreserved() {
        EventMetadata meta = EventMetadata.builder()
            .phi(true).consentId("c-1").source("mobile").header("x-trace", "abc")
            .recordedAt(Instant.parse("2026-03-01T08:00:00Z"))
            .build();

        Event event = store.append("p-1", EventFixtures.pain("ex-1", 4), meta, ExpectedVersion.ANY).join();

        assertEquals(meta, event.getMeta());
        assertEquals("abc", store.read("p-1", ReadOptions.all()).join().get(0).getMeta().getHeaders().get("x-trace"));
    }

    @Test
    void testListenersAreNotifiedAfterAppendOnly() {
        List<Event> notified = new CopyOnWriteArrayList<>();
        store.addAppendListener(notified::add);
        store.addAppendListener(event -> {
            throw new IllegalStateException("listener failure");
        });

        Event appended = store.append("p-1", EventFixtures.dataConsent("c-1"), null, ExpectedVersion.ANY).join();
        assertThrows(CompletionException.class,
            () -> store.append("p-1", EventFixtures.dataConsent("c-2"), null, ExpectedVersion.exactly(0)).join());

        assertEquals(List.of(appended), notified);
    }

    @Test
    void testSubjectsAndStatistics() {
        store.append("p-1", EventFixtures.rep("ex-1", 1, 50), null, ExpectedVersion.ANY).join();
        store.append("p-1", EventFixtures.pain("ex-1", 2), null, ExpectedVersion.ANY).join();
        store.append("p-2", EventFixtures.rep("ex-1", 1, 50), null, ExpectedVersion.ANY).join();
        store.append("p-3", EventFixtures.rep("ex-1", 1, 50), null, ExpectedVersion.exactly(9)).exceptionally(e -> null).join();

        assertEquals(java.util.Set.of("p-1", "p-2"), store.subjects().join());

        StreamStatistics stats = store.statistics().join();
        assertEquals(2, stats.getSubjectCount());
        assertEquals(3, stats.getEventCount());
        assertEquals(2, stats.getEventCount(EventKind.REP_OBSERVATION));
        assertEquals(1, stats.getEventCount(EventKind.FEEDBACK));
        assertEquals(0, stats.getEventCount(EventKind.ALERT));
    }

    @Test
    void testClosedStoreIsUnavailable() {
        store.close();
        CompletionException e = assertThrows(CompletionException.class,
            () -> store.append("p-1", EventFixtures.dataConsent("c-1"), null, ExpectedVersion.ANY).join());
        assertInstanceOf(StorageUnavailableException.class, e.getCause());
        assertTrue(((StorageUnavailableException) e.getCause()).isRetryable());
    }
}
