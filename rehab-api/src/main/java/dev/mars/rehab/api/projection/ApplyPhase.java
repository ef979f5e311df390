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

/**
 * Where a projector is in applying a batch for one subject.
 *
 * <p>{@code IDLE -> APPLYING -> CHECKPOINTED}. A projector that fails while
 * {@code APPLYING} returns to the previous phase with its view and checkpoint
 * untouched.</p>
 */
public enum ApplyPhase {
    IDLE,
    APPLYING,
    CHECKPOINTED
}
