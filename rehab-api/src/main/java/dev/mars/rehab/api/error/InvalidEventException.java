package dev.mars.rehab.api.error;

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

import dev.mars.rehab.api.validation.Violation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an event fails validation. Nothing has been written when this is raised.
 */
public class InvalidEventException extends RehabException {

    private final List<Violation> violations;

    public InvalidEventException(List<Violation> violations) {
        super(ErrorCode.VALIDATION_FAILED, describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String describe(List<Violation> violations) {
        return "Event rejected: " + violations.stream()
            .map(Violation::toString)
            .collect(Collectors.joining("; "));
    }
}
