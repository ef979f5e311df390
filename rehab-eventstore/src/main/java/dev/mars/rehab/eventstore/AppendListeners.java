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

import dev.mars.rehab.api.events.Event;
import dev.mars.rehab.api.store.AppendListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener registry shared by the stream store implementations.
 *
 * <p>A failing listener is logged and does not prevent the remaining listeners
 * from being notified; the append itself has already committed.</p>
 */
final class AppendListeners {

    private static final Logger logger = LoggerFactory.getLogger(AppendListeners.class);

    private final List<AppendListener> listeners = new CopyOnWriteArrayList<>();

    void add(AppendListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    void remove(AppendListener listener) {
        listeners.remove(listener);
    }

    void clear() {
        listeners.clear();
    }

    void notifyAppended(Event event) {
        for (AppendListener listener : listeners) {
            try {
                listener.onAppended(event);
            } catch (RuntimeException e) {
                logger.warn("Append listener {} failed for {}@{}: {}", listener.getClass().getSimpleName(),
                    event.getSubjectId(), event.getStreamVersion(), e.getMessage(), e);
            }
        }
    }
}
