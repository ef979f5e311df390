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
 * Root of the unchecked exception hierarchy used across the tracking core.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class RehabException extends RuntimeException {

    private final ErrorCode errorCode;

    public RehabException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RehabException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Whether repeating the same operation later may succeed.
     */
    public boolean isRetryable() {
        return false;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + errorCode.getCode() + "]: " + getMessage();
    }
}
