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

/**
 * Stable error codes carried by every {@link RehabException}.
 *
 * Code ranges:
 * - RHBERR0001-0049: General errors
 * - RHBERR0050-0099: Ingestion and validation errors
 * - RHBERR0100-0149: Stream store errors
 * - RHBERR0150-0199: Projection errors
 */
public enum ErrorCode {

    INTERNAL_ERROR("RHBERR0001"),
    INVALID_QUERY("RHBERR0002"),

    VALIDATION_FAILED("RHBERR0050"),

    CONFLICT("RHBERR0100"),
    STORAGE_UNAVAILABLE("RHBERR0101"),

    PROJECTOR_FAILURE("RHBERR0150");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
