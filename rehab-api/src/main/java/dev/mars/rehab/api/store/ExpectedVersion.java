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
 * The stream version an append expects to find at the tail.
 *
 * <p>{@link #ANY} skips the optimistic concurrency check, {@link #NO_STREAM} requires
 * the stream to be empty, and {@link #exactly(long)} requires the tail to match.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public final class ExpectedVersion {

    public static final ExpectedVersion ANY = new ExpectedVersion(-1);
    public static final ExpectedVersion NO_STREAM = new ExpectedVersion(0);

    private final long version;

    private ExpectedVersion(long version) {
        this.version = version;
    }

    public static ExpectedVersion exactly(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("Expected version must be >= 0, was " + version);
        }
        return version == 0 ? NO_STREAM : new ExpectedVersion(version);
    }

    /**
     * Maps a nullable caller-supplied version to an expectation; {@code null} means {@link #ANY}.
     */
    public static ExpectedVersion ofNullable(Long version) {
        return version == null ? ANY : exactly(version);
    }

    public boolean isAny() {
        return version < 0;
    }

    /**
     * @return the expected tail version; meaningless when {@link #isAny()}
     */
    public long getVersion() {
        return version;
    }

    public boolean matches(long tailVersion) {
        return isAny() || version == tailVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return version == ((ExpectedVersion) o).version;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(version);
    }

    @Override
    public String toString() {
        return isAny() ? "ANY" : Long.toString(version);
    }
}
