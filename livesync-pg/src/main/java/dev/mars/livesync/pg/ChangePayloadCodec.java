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
package dev.mars.livesync.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.livesync.api.change.ChangeEvent;
import dev.mars.livesync.api.change.ChangeOperation;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Decodes the JSON payload published by {@code livesync_notify_change()}.
 *
 * <pre>
 * {"table": "notifications", "op": "UPDATE",
 *  "old": {...}, "new": {...},
 *  "commit_timestamp": "2026-02-10T09:15:02.123456+00:00",
 *  "event_id": "5d0c..."}
 * </pre>
 *
 * Row snapshots keep the JSON rendering Postgres gives them: timestamps stay
 * ISO-8601 strings and are parsed later by the row mapper.
 */
public class ChangePayloadCodec {

    static final String TABLE = "table";
    static final String OPERATION = "op";
    static final String OLD = "old";
    static final String NEW = "new";
    static final String COMMIT_TIMESTAMP = "commit_timestamp";
    static final String EVENT_ID = "event_id";

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public ChangePayloadCodec() {
        this(new ObjectMapper());
    }

    public ChangePayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    /**
     * Decodes one payload.
     *
     * @param payload the notification payload
     * @return the change event
     * @throws IllegalArgumentException if the payload is not a valid change event
     */
    public ChangeEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Empty change payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Change payload is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Change payload is not a JSON object");
        }

        String table = requiredText(root, TABLE);
        ChangeOperation operation = ChangeOperation.parse(requiredText(root, OPERATION));
        JsonObject oldRow = row(root, OLD);
        JsonObject newRow = row(root, NEW);

        if (operation != ChangeOperation.DELETE && newRow == null) {
            throw new IllegalArgumentException(operation + " payload for " + table + " has no new row");
        }

        return new ChangeEvent(table, operation, oldRow, newRow,
                               timestamp(root, COMMIT_TIMESTAMP), optionalText(root, EVENT_ID), null);
    }

    private JsonObject row(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Field '" + field + "' is not a JSON object");
        }
        return new JsonObject(objectMapper.convertValue(node, ROW_TYPE));
    }

    private static String requiredText(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Instant timestamp(JsonNode root, String field) {
        String value = optionalText(root, field);
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException ignored) {
                throw new IllegalArgumentException("Field '" + field + "' is not a timestamp: " + value, e);
            }
        }
    }
}
