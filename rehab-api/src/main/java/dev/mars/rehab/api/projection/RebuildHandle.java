package dev.mars.rehab.api.projection;

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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A running or finished projection rebuild.
 *
 * <p>The rebuilt state is built off to the side and swapped in only when the
 * rebuild completes. Cancelling before that leaves the live view untouched.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public interface RebuildHandle {

    enum State {
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED
    }

    String projectorId();

    /**
     * @return the subject being rebuilt, or empty for a rebuild of every subject
     */
    Optional<String> subjectId();

    State state();

    long eventsProcessed();

    /**
     * @return the number of events known to need replay when the rebuild started
     */
    long totalEvents();

    /**
     * Requests cancellation. The rebuild stops at the next event boundary.
     *
     * @return true if the rebuild was still running
     */
    boolean cancel();

    /**
     * Completes when the rebuild has been swapped in, or exceptionally with
     * {@link java.util.concurrent.CancellationException} or the failure cause.
     */
    CompletableFuture<Void> completion();
}
