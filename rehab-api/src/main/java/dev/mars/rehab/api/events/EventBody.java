package dev.mars.rehab.api.events;

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
 * Base type of the kind-specific payload carried by an {@link Event}.
 *
 * <p>Bodies are immutable. The set of subclasses is fixed to the five kinds in
 * {@link EventKind}; the package-private constructor keeps it that way.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public abstract class EventBody {

    EventBody() {
    }

    /**
     * The kind this body belongs to.
     */
    public abstract EventKind kind();

    /**
     * Double-dispatches to the visitor method for this body's kind.
     */
    public abstract <R> R accept(EventBodyVisitor<R> visitor);
}
