package dev.mars.rehab.api.consent;

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
 * Answers whether a subject holds a currently active consent grant.
 *
 * <p>Implementations may be remote; a failed lookup must surface as
 * {@link dev.mars.rehab.api.error.StorageUnavailableException} rather than a negative answer.</p>
 */
@FunctionalInterface
public interface ConsentRegistry {

    /**
     * @return true if the consent is active and was granted by {@code subjectId}
     */
    boolean isConsentActive(String consentId, String subjectId);
}
