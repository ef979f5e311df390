package dev.mars.rehab.api.validation;

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

import dev.mars.rehab.api.error.InvalidEventException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of validating an event: either valid, or the full list of violations.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

    private final List<Violation> violations;

    private ValidationResult(List<Violation> violations) {
        this.violations = violations;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<Violation> violations) {
        return violations.isEmpty() ? VALID : new ValidationResult(List.copyOf(violations));
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /**
     * Combines two results, keeping every violation from both.
     */
    public ValidationResult merge(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (isValid()) {
            return other;
        }
        List<Violation> all = new ArrayList<>(violations);
        all.addAll(other.violations);
        return new ValidationResult(Collections.unmodifiableList(all));
    }

    /**
     * @throws InvalidEventException if this result has violations
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new InvalidEventException(violations);
        }
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult{valid}" : "ValidationResult{violations=" + violations + '}';
    }
}
