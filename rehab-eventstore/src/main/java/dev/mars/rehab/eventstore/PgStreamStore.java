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
import dev.mars.rehab.api.error.RehabException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.store.AppendListener;
import dev.mars.rehab.api.store.ExpectedVersion;
import dev.mars.rehab.api.store.ReadOptions;
import dev.mars.rehab.api.store.StreamStatistics;
import dev.mars.rehab.api.store.StreamStore;
import dev.mars.rehab.eventstore.codec.EventJsonCodec;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgException;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * PostgreSQL stream store built on the Vert.x reactive client.
 *
 * <p>An append runs in one transaction: it ensures the subject's row in
 * {@code rehab_streams} exists, locks it with {@code SELECT ... FOR UPDATE},
 * compares the stored version against the expectation, inserts the event and
 * advances the version. Appends to the same subject therefore serialize on the row
 * lock; the unique {@code (subject_id, stream_version)} constraint backs this up.
 * Appends to different subjects lock different rows and never contend.</p>
 *
 * <p>Body and metadata are stored as JSONB written by {@link EventJsonCodec}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class PgStreamStore implements StreamStore {

    private static final Logger logger = LoggerFactory.getLogger(PgStreamStore.class);

    static final String SCHEMA_RESOURCE = "/db/rehab-eventstore-schema.sql";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String ENSURE_STREAM_SQL =
        "INSERT INTO rehab_streams (subject_id, version) VALUES ($1, 0) ON CONFLICT (subject_id) DO NOTHING";
    private static final String LOCK_STREAM_SQL =
        "SELECT version FROM rehab_streams WHERE subject_id = $1 FOR UPDATE";
    private static final String INSERT_EVENT_SQL = """
        INSERT INTO rehab_events (event_id, subject_id, stream_version, kind, body, meta, recorded_at)
        VALUES ($1, $2, $3, $4, $5, $6, $7)
        """;
    private static final String ADVANCE_STREAM_SQL =
        "UPDATE rehab_streams SET version = $2, updated_at = NOW() WHERE subject_id = $1";
    private static final String READ_SQL = """
        SELECT event_id, subject_id, stream_version, kind, body, meta
        FROM rehab_events
        WHERE subject_id = $1 AND stream_version >= $2
        ORDER BY stream_version
        LIMIT $3
        """;
    private static final String TAIL_SQL = "SELECT version FROM rehab_streams WHERE subject_id = $1";
    private static final String SUBJECTS_SQL = "SELECT subject_id FROM rehab_streams WHERE version > 0";
    private static final String KIND_COUNTS_SQL = "SELECT kind, COUNT(*) AS cnt FROM rehab_events GROUP BY kind";

    private final Pool pool;
    private final Vertx ownedVertx;
    private final EventJsonCodec codec;
    private final Clock clock;
    private final AppendListeners listeners = new AppendListeners();
    private volatile boolean closed = false;

    /**
     * Uses a pool owned by the caller.
     */
    public PgStreamStore(Pool pool, EventJsonCodec codec) {
        this(pool, null, codec, Clock.systemUTC());
    }

    PgStreamStore(Pool pool, Vertx ownedVertx, EventJsonCodec codec, Clock clock) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.ownedVertx = ownedVertx;
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Creates a store with its own Vert.x instance and connection pool. Both are
     * closed with the store.
     */
    public static PgStreamStore create(PgConnectOptions connectOptions, PoolOptions poolOptions, EventJsonCodec codec) {
        Vertx vertx = Vertx.vertx();
        Pool pool = PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
        logger.info("Created PostgreSQL stream store pool: host={}, database={}, maxSize={}",
            connectOptions.getHost(), connectOptions.getDatabase(), poolOptions.getMaxSize());
        return new PgStreamStore(pool, vertx, codec, Clock.systemUTC());
    }

    /**
     * Creates the stream tables if they do not exist.
     */
    public CompletableFuture<Void> initializeSchema() {
        List<String> statements;
        try {
            statements = loadSchemaStatements();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(
                new StorageUnavailableException("Failed to load schema resource " + SCHEMA_RESOURCE, e));
        }
        Future<Void> chain = Future.succeededFuture();
        for (String statement : statements) {
            chain = chain.compose(v -> pool.query(statement).execute().<Void>mapEmpty());
        }
        return chain
            .onSuccess(v -> logger.info("Stream store schema ready ({} statements)", statements.size()))
            .recover(err -> Future.failedFuture(translate("initialize schema", err)))
            .toCompletionStage().toCompletableFuture();
    }

    @Override
    public CompletableFuture<Event> append(String subjectId, EventBody body, EventMetadata meta,
                                           ExpectedVersion expectedVersion) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageUnavailableException("Stream store is closed"));
        }
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
        ExpectedVersion expected = expectedVersion != null ? expectedVersion : ExpectedVersion.ANY;
        EventMetadata stamped = (meta != null ? meta : EventMetadata.defaults()).withRecordedAtIfAbsent(clock.instant());

        JsonObject bodyJson;
        JsonObject metaJson;
        try {
            bodyJson = new JsonObject(codec.writeBody(body));
            metaJson = new JsonObject(codec.writeMetadata(stamped));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        UUID eventId = UUID.randomUUID();

        return pool.withTransaction(connection -> lockStream(connection, subjectId)
                .compose(tail -> {
                    if (!expected.matches(tail)) {
                        return Future.failedFuture(
                            new ConcurrencyConflictException(subjectId, expected.getVersion(), tail));
                    }
                    long version = tail + 1;
                    Tuple params = Tuple.of(eventId, subjectId, version, body.kind().getWireName(),
                        bodyJson, metaJson, OffsetDateTime.ofInstant(stamped.getRecordedAt(), ZoneOffset.UTC));
                    return connection.preparedQuery(INSERT_EVENT_SQL).execute(params)
                        .compose(inserted -> connection.preparedQuery(ADVANCE_STREAM_SQL)
                            .execute(Tuple.of(subjectId, version)))
                        .map(updated -> new Event(eventId, subjectId, body, stamped, version));
                }))
            .recover(err -> Future.failedFuture(translateAppend(subjectId, expected, err)))
            .onSuccess(event -> {
                logger.debug("Appended {} to {} at version {}", event.getKind(), subjectId, event.getStreamVersion());
                listeners.notifyAppended(event);
            })
            .toCompletionStage().toCompletableFuture();
    }

    private Future<Long> lockStream(SqlConnection connection, String subjectId) {
        return connection.preparedQuery(ENSURE_STREAM_SQL).execute(Tuple.of(subjectId))
            .compose(ignored -> connection.preparedQuery(LOCK_STREAM_SQL).execute(Tuple.of(subjectId)))
            .map(rows -> rows.iterator().next().getLong("version"));
    }

    @Override
    public CompletableFuture<List<Event>> read(String subjectId, ReadOptions options) {
        ReadOptions range = options != null ? options : ReadOptions.all();
        return pool.preparedQuery(READ_SQL)
            .execute(Tuple.of(subjectId, range.getFromVersion(), (long) range.getLimit()))
            .map(this::toEvents)
            .recover(err -> Future.failedFuture(translate("read stream " + subjectId, err)))
            .toCompletionStage().toCompletableFuture();
    }

    @Override
    public CompletableFuture<Long> tailVersion(String subjectId) {
        return pool.preparedQuery(TAIL_SQL)
            .execute(Tuple.of(subjectId))
            .map(rows -> rows.size() == 0 ? 0L : rows.iterator().next().getLong("version"))
            .recover(err -> Future.failedFuture(translate("read tail of " + subjectId, err)))
            .toCompletionStage().toCompletableFuture();
    }

    @Override
    public CompletableFuture<Set<String>> subjects() {
        return pool.query(SUBJECTS_SQL).execute()
            .map(rows -> {
                Set<String> subjects = new HashSet<>();
                rows.forEach(row -> subjects.add(row.getString("subject_id")));
                return Set.copyOf(subjects);
            })
            .recover(err -> Future.failedFuture(translate("list subjects", err)))
            .toCompletionStage().toCompletableFuture();
    }

    @Override
    public CompletableFuture<StreamStatistics> statistics() {
        Future<Long> subjectCount = pool.query(SUBJECTS_SQL).execute().map(rows -> (long) rows.size());
        Future<Map<EventKind, Long>> kindCounts = pool.query(KIND_COUNTS_SQL).execute().map(rows -> {
            Map<EventKind, Long> counts = new EnumMap<>(EventKind.class);
            for (Row row : rows) {
                EventKind.fromName(row.getString("kind"))
                    .ifPresent(kind -> counts.put(kind, row.getLong("cnt")));
            }
            return counts;
        });
        return Future.all(subjectCount, kindCounts)
            .map(all -> {
                Map<EventKind, Long> counts = kindCounts.result();
                long total = counts.values().stream().mapToLong(Long::longValue).sum();
                return new StreamStatistics(subjectCount.result(), total, counts);
            })
            .recover(err -> Future.failedFuture(translate("compute statistics", err)))
            .toCompletionStage().toCompletableFuture();
    }

    @Override
    public void addAppendListener(AppendListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeAppendListener(AppendListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        listeners.clear();
        pool.close();
        if (ownedVertx != null) {
            ownedVertx.close();
        }
        logger.info("Closed PostgreSQL stream store");
    }

    private List<Event> toEvents(RowSet<Row> rows) {
        List<Event> events = new ArrayList<>(rows.size());
        for (Row row : rows) {
            EventKind kind = EventKind.fromName(row.getString("kind"))
                .orElseThrow(() -> new StorageUnavailableException("Unknown stored event kind: " + row.getString("kind")));
            EventBody body = codec.readBody(kind, row.getJsonObject("body").encode());
            JsonObject metaJson = row.getJsonObject("meta");
            EventMetadata meta = codec.readMetadata(metaJson != null ? metaJson.encode() : null);
            events.add(new Event(row.getUUID("event_id"), row.getString("subject_id"), body, meta,
                row.getLong("stream_version")));
        }
        return events;
    }

    private RehabException translateAppend(String subjectId, ExpectedVersion expected, Throwable err) {
        if (err instanceof PgException && UNIQUE_VIOLATION.equals(((PgException) err).getSqlState())) {
            // Only reachable if the row lock was bypassed; report it as a lost race.
            long expectedVersion = expected.isAny() ? -1 : expected.getVersion();
            return new ConcurrencyConflictException(subjectId, expectedVersion, expectedVersion + 1);
        }
        return translate("append to " + subjectId, err);
    }

    private static RehabException translate(String operation, Throwable err) {
        if (err instanceof RehabException) {
            return (RehabException) err;
        }
        logger.warn("Failed to {}: {}", operation, err.getMessage());
        return new StorageUnavailableException("Failed to " + operation + ": " + err.getMessage(), err);
    }

    static List<String> loadSchemaStatements() throws IOException {
        try (InputStream in = PgStreamStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IOException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            String withoutComments = Arrays.stream(script.split("\n"))
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
            return Arrays.stream(withoutComments.split(";"))
                .map(String::trim)
                .filter(statement -> !statement.isEmpty())
                .collect(Collectors.toList());
        }
    }
}
