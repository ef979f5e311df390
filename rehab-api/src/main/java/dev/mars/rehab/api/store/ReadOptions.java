package dev.mars.rehab.api.store;

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

/**
 * Range options for reading a stream. {@code fromVersion} is inclusive, and both
 * 0 and 1 mean the start of the stream.
 */
public final class ReadOptions {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    private static final ReadOptions ALL = new ReadOptions(1, UNLIMITED);

    private final long fromVersion;
    private final int limit;

    private ReadOptions(long fromVersion, int limit) {
        if (fromVersion < 0) {
            throw new IllegalArgumentException("fromVersion must be >= 0, was " + fromVersion);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, was " + limit);
        }
        this.fromVersion = Math.max(1, fromVersion);
        this.limit = limit;
    }

    public static ReadOptions all() {
        return ALL;
    }

    public static ReadOptions from(long fromVersion) {
        return new ReadOptions(fromVersion, UNLIMITED);
    }

    public static ReadOptions of(long fromVersion, int limit) {
        return new ReadOptions(fromVersion, limit);
    }

    public long getFromVersion() {
        return fromVersion;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "ReadOptions{fromVersion=" + fromVersion + ", limit=" + (limit == UNLIMITED ? "unlimited" : limit) + '}';
    }
}
