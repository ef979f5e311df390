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

import dev.mars.rehab.api.events.Event;

/**
 * Notified after an event has been durably appended to a stream.
 *
 * <p>Listeners run on the appending thread and must return quickly. A notification
 * is only a hint that new data exists; consumers must read the stream for the
 * authoritative, gapless sequence.</p>
 */
@FunctionalInterface
public interface AppendListener {

    void onAppended(Event event);
}
