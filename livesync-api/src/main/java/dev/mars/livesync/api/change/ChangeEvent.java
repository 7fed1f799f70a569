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
package dev.mars.livesync.api.change;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Immutable row-level change delivered by a {@link ChangeStreamClient}.
 *
 * <p>Row snapshots are copied on construction and on access, so one event
 * instance may be shared between the hold buffer, the write queue and callbacks.
 *
 * @param table           the table the change happened in
 * @param operation       INSERT, UPDATE or DELETE
 * @param oldRow          the row before the change (UPDATE/DELETE), may be null
 * @param newRow          the row after the change (INSERT/UPDATE), may be null
 * @param commitTimestamp when the backend committed the change, may be null
 * @param eventId         backend-assigned unique id of the change, may be null
 * @param receivedAt      when the client received the change
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public record ChangeEvent(
    String table,
    ChangeOperation operation,
    JsonObject oldRow,
    JsonObject newRow,
    Instant commitTimestamp,
    String eventId,
    Instant receivedAt
) {

    public ChangeEvent {
        oldRow = oldRow != null ? oldRow.copy() : null;
        newRow = newRow != null ? newRow.copy() : null;
        receivedAt = receivedAt != null ? receivedAt : Instant.now();
    }

    @Override
    public JsonObject oldRow() {
        return oldRow != null ? oldRow.copy() : null;
    }

    @Override
    public JsonObject newRow() {
        return newRow != null ? newRow.copy() : null;
    }

    public boolean hasOldRow() {
        return oldRow != null;
    }

    public boolean hasNewRow() {
        return newRow != null;
    }

    /**
     * Returns the row that best represents the changed entity: the new row for
     * INSERT/UPDATE, the old row for DELETE.
     */
    public JsonObject currentRow() {
        return newRow != null ? newRow() : oldRow();
    }

    /**
     * Reads a column value from the new row, falling back to the old row.
     *
     * @param column the column name
     * @return the value, or null when neither snapshot carries the column
     */
    public Object columnValue(String column) {
        if (newRow != null && newRow.containsKey(column)) {
            return newRow.getValue(column);
        }
        if (oldRow != null && oldRow.containsKey(column)) {
            return oldRow.getValue(column);
        }
        return null;
    }

    /**
     * Builds the key used to recognise a redelivered event.
     *
     * <p>The backend id wins when present. Otherwise the key combines table,
     * operation, primary key, commit timestamp and a hash of the row image, so
     * two updates of one row inside the same transaction stay distinct. Two
     * changes that leave identical row images in one transaction still share a
     * key. Without either an id or a commit timestamp there is nothing stable
     * to compare and null is returned.
     *
     * @param primaryKeyColumn the primary key column of the table
     * @return the deduplication key, or null if the event cannot be deduplicated
     */
    public String deduplicationKey(String primaryKeyColumn) {
        if (eventId != null) {
            return eventId;
        }
        if (commitTimestamp == null) {
            return null;
        }
        JsonObject image = newRow != null ? newRow : oldRow;
        return table + ":" + operation + ":" + columnValue(primaryKeyColumn) + ":" + commitTimestamp
            + ":" + Integer.toHexString(image != null ? image.hashCode() : 0);
    }

    public static ChangeEvent insert(String table, JsonObject newRow, Instant commitTimestamp) {
        return new ChangeEvent(table, ChangeOperation.INSERT, null, newRow, commitTimestamp, null, null);
    }

    public static ChangeEvent update(String table, JsonObject oldRow, JsonObject newRow, Instant commitTimestamp) {
        return new ChangeEvent(table, ChangeOperation.UPDATE, oldRow, newRow, commitTimestamp, null, null);
    }

    public static ChangeEvent delete(String table, JsonObject oldRow, Instant commitTimestamp) {
        return new ChangeEvent(table, ChangeOperation.DELETE, oldRow, null, commitTimestamp, null, null);
    }

    /**
     * Returns a copy of this event carrying the given backend id.
     */
    public ChangeEvent withEventId(String id) {
        return new ChangeEvent(table, operation, oldRow, newRow, commitTimestamp, id, receivedAt);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "table='" + table + '\'' +
                ", operation=" + operation +
                ", commitTimestamp=" + commitTimestamp +
                ", eventId='" + eventId + '\'' +
                ", receivedAt=" + receivedAt +
                '}';
    }
}
