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
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.RepObservation;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStatistics;
import dev.mars.rehab.eventstore.codec.EventJsonCodec;
import dev.mars.rehab.test.categories.TestCategories;
import dev.mars.rehab.test.fixtures.EventFixtures;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.sqlclient.PoolOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the stream store contract against a real PostgreSQL.
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers(disabledWithoutDocker = true)
class PgStreamStoreIntegrationTest {
    private static final Logger logger = LoggerFactory.getLogger(PgStreamStoreIntegrationTest.class);

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15.13-alpine3.20")
            .withDatabaseName("rehab_eventstore_test")
            .withUsername("rehab_test")
            .withPassword("rehab_test");

    private static PgStreamStore store;

    @BeforeAll
    static void setUpStore() throws Exception {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(postgres.getHost())
            .setPort(postgres.getFirstMappedPort())
            .setDatabase(postgres.getDatabaseName())
            .setUser(postgres.getUsername())
            .setPassword(postgres.getPassword());
        store = PgStreamStore.create(connectOptions, new PoolOptions().setMaxSize(8), new EventJsonCodec());
        store.initializeSchema().get(30, TimeUnit.SECONDS);
        logger.info("PostgreSQL stream store ready on {}", postgres.getJdbcUrl());
    }

    @AfterAll
    static void tearDownStore() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    void testSchemaInitializationIsRepeatable() throws Exception {
        store.initializeSchema().get(30, TimeUnit.SECONDS);
    }

    @Test
    void testAppendAndReadBack() throws Exception {
        String subject = newSubject();
        RepObservation rep = new RepObservation("s-1", "ex-1", 1, 82.5, 0.9, 1800L, false, List.of("hip_drop"));

        Event appended = store.append(subject, rep, EventFixtures.phiMeta("c-1"), ExpectedVersion.NO_STREAM)
            .get(10, TimeUnit.SECONDS);
        store.append(subject, EventFixtures.pain("ex-1", 3), null, ExpectedVersion.exactly(1)).get(10, TimeUnit.SECONDS);

        List<Event> events = store.read(subject, ReadOptions.all()).get(10, TimeUnit.SECONDS);
        assertEquals(2, events.size());
        Event first = events.get(0);
        assertEquals(appended.getEventId(), first.getEventId());
        assertEquals(rep, first.getBody());
        assertEquals(appended.getMeta(), first.getMeta());
        assertEquals(EventKind.FEEDBACK, events.get(1).getKind());
        assertEquals(2L, store.tailVersion(subject).get(10, TimeUnit.SECONDS));
    }

    @Test
    void testStaleVersionConflictLeavesStreamUnchanged() throws Exception {
        String subject = newSubject();
        for (int i = 0; i < 3; i++) {
            store.append(subject, EventFixtures.rep("ex-1", i + 1, 70), null, ExpectedVersion.ANY).get(10, TimeUnit.SECONDS);
        }

        CompletionException e = assertThrows(CompletionException.class,
            () -> store.append(subject, EventFixtures.rep("ex-1", 9, 70), null, ExpectedVersion.exactly(2)).join());

        ConcurrencyConflictException conflict = assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
        assertEquals(2, conflict.getExpectedVersion());
        assertEquals(3, conflict.getActualVersion());
        assertEquals(3, store.read(subject, ReadOptions.all()).get(10, TimeUnit.SECONDS).size());
    }

    @Test
    void testConcurrentSameVersionAppendsExactlyOneWins() throws Exception {
        String subject = newSubject();
        store.append(subject, EventFixtures.rep("ex-1", 1, 70), null, ExpectedVersion.ANY).get(10, TimeUnit.SECONDS);

        List<CompletableFuture<Event>> attempts = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            attempts.add(store.append(subject, EventFixtures.rep("ex-1", 10 + i, 60), null, ExpectedVersion.exactly(1)));
        }
        CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).handle((v, err) -> null)
            .get(20, TimeUnit.SECONDS);

        long won = attempts.stream().filter(f -> !f.isCompletedExceptionally()).count();
        assertEquals(1, won);
        assertEquals(2L, store.tailVersion(subject).get(10, TimeUnit.SECONDS));
    }

    @Test
    void testConcurrentAnyVersionAppendsStayGapless() throws Exception {
        String subject = newSubject();
        List<CompletableFuture<Event>> appends = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            appends.add(store.append(subject, EventFixtures.rep("ex-1", i + 1, 50), null, ExpectedVersion.ANY));
        }
        CompletableFuture.allOf(appends.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        List<Long> versions = store.read(subject, ReadOptions.all()).get(10, TimeUnit.SECONDS).stream()
            .map(Event::getStreamVersion).collect(Collectors.toList());
        List<Long> expected = new ArrayList<>();
        for (long v = 1; v <= 20; v++) {
            expected.add(v);
        }
        assertEquals(expected, versions);
    }

    @Test
    void testReadRangeAndStatistics() throws Exception {
        String subject = newSubject();
        for (int i = 0; i < 6; i++) {
            store.append(subject, EventFixtures.rep("ex-1", i + 1, 50), null, ExpectedVersion.ANY).get(10, TimeUnit.SECONDS);
        }

        List<Event> slice = store.read(subject, ReadOptions.of(3, 2)).get(10, TimeUnit.SECONDS);
        assertEquals(List.of(3L, 4L), slice.stream().map(Event::getStreamVersion).collect(Collectors.toList()));
        assertTrue(store.read(subject, ReadOptions.from(7)).get(10, TimeUnit.SECONDS).isEmpty());
        assertTrue(store.read(newSubject(), ReadOptions.all()).get(10, TimeUnit.SECONDS).isEmpty());

        Set<String> subjects = store.subjects().get(10, TimeUnit.SECONDS);
        assertTrue(subjects.contains(subject));

        StreamStatistics stats = store.statistics().get(10, TimeUnit.SECONDS);
        assertTrue(stats.getEventCount(EventKind.REP_OBSERVATION) >= 6);
        assertTrue(stats.getSubjectCount() >= 1);
    }

    private static String newSubject() {
        return "patient-" + UUID.randomUUID();
    }
}
