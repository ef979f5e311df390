package dev.mars.rehab.eventstore.codec;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.rehab.api.error.InvalidEventException;
import dev.mars.rehab.api.error.StorageUnavailableException;
import dev.mars.rehab.api.events.EventBody;
import dev.mars.rehab.api.events.EventKind;
import dev.mars.rehab.api.events.EventMetadata;
import dev.mars.rehab.api.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts event bodies and metadata between their typed form, caller-supplied
 * attribute maps and the JSON stored in the database.
 *
 * <p>Attribute maps are strict: unknown fields and values of the wrong type are
 * rejected with an {@link InvalidEventException} naming the offending field.
 * Enum values are matched case-insensitively.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class EventJsonCodec {

    private static final Logger logger = LoggerFactory.getLogger(EventJsonCodec.class);

    private final ObjectMapper objectMapper;

    public EventJsonCodec() {
        this(createDefaultObjectMapper());
    }

    public EventJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    /**
     * Creates the ObjectMapper used for event JSON: JSR310 support with ISO-8601
     * timestamps, strict about unknown properties.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Builds a typed body of the given kind from caller attributes.
     *
     * @throws InvalidEventException if an attribute is unknown or has the wrong type
     */
    public EventBody toBody(EventKind kind, Map<String, ?> attrs) {
        Objects.requireNonNull(kind, "kind cannot be null");
        try {
            return objectMapper.convertValue(attrs != null ? attrs : Map.of(), kind.getBodyType());
        } catch (IllegalArgumentException e) {
            Violation violation = toViolation(e.getCause(), e.getMessage());
            logger.debug("Rejected {} attributes: {}", kind, violation);
            throw new InvalidEventException(List.of(violation));
        }
    }

    /**
     * Builds metadata from caller attributes, keyed by snake case names.
     *
     * @throws InvalidEventException if an attribute is unknown or has the wrong type
     */
    public EventMetadata toMetadata(Map<String, ?> attrs) {
        if (attrs == null || attrs.isEmpty()) {
            return EventMetadata.defaults();
        }
        try {
            return objectMapper.convertValue(attrs, EventMetadata.class);
        } catch (IllegalArgumentException e) {
            Violation violation = toViolation(e.getCause(), e.getMessage());
            throw new InvalidEventException(List.of(new Violation("meta." + violation.getField(),
                violation.getMessage())));
        }
    }

    public String writeBody(EventBody body) {
        return write(body);
    }

    public String writeMetadata(EventMetadata meta) {
        return write(meta);
    }

    /**
     * Reads a stored body. Stored JSON was written by this codec, so a failure here
     * means the stored data is unreadable.
     */
    public EventBody readBody(EventKind kind, String json) {
        try {
            return objectMapper.readValue(json, kind.getBodyType());
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Stored " + kind + " body could not be decoded", e);
        }
    }

    public EventMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return EventMetadata.defaults();
        }
        try {
            return objectMapper.readValue(json, EventMetadata.class);
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Stored event metadata could not be decoded", e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static Violation toViolation(Throwable cause, String fallback) {
        if (cause instanceof UnrecognizedPropertyException) {
            UnrecognizedPropertyException unknown = (UnrecognizedPropertyException) cause;
            return new Violation(unknown.getPropertyName(), "is not a recognized field");
        }
        if (cause instanceof InvalidFormatException) {
            InvalidFormatException format = (InvalidFormatException) cause;
            return new Violation(fieldPath(format), "has invalid value '" + format.getValue() + "' for type "
                + format.getTargetType().getSimpleName());
        }
        if (cause instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) cause;
            return new Violation(fieldPath(mapping), "has an invalid value: " + mapping.getOriginalMessage());
        }
        return new Violation("body", fallback != null ? fallback : "could not be read");
    }

    private static String fieldPath(JsonMappingException e) {
        String path = e.getPath().stream()
            .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
            .collect(Collectors.joining("."));
        return path.isEmpty() ? "body" : path;
    }
}
