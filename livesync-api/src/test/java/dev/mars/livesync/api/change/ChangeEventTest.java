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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChangeEvent.
 */
class ChangeEventTest {

    private static final Instant COMMIT = Instant.parse("2026-02-10T10:15:30Z");

    @Test
    @DisplayName("row snapshots are isolated from the caller")
    void rows_areCopied() {
        JsonObject row = new JsonObject().put("id", 1).put("is_read", false);
        ChangeEvent event = ChangeEvent.insert("notifications", row, COMMIT);

        row.put("is_read", true);
        event.newRow().put("is_read", true);

        assertFalse(event.newRow().getBoolean("is_read"));
    }

    @Test
    @DisplayName("deduplicationKey() prefers the backend event id")
    void deduplicationKey_prefersEventId() {
        ChangeEvent event = ChangeEvent.insert("notifications", new JsonObject().put("id", 1), COMMIT)
            .withEventId("evt-1");

        assertEquals("evt-1", event.deduplicationKey("id"));
    }

    @Test
    @DisplayName("deduplicationKey() falls back to table, operation, key, commit time and row image")
    void deduplicationKey_composite() {
        JsonObject row = new JsonObject().put("id", 9);
        ChangeEvent event = ChangeEvent.delete("notifications", row, COMMIT);

        assertEquals("notifications:DELETE:9:" + COMMIT + ":" + Integer.toHexString(row.hashCode()),
            event.deduplicationKey("id"));
    }

    @Test
    @DisplayName("deduplicationKey() separates two updates of one row in the same transaction")
    void deduplicationKey_distinguishesUpdatesInOneTransaction() {
        JsonObject unread = new JsonObject().put("id", 4).put("is_read", false).put("title", "a");
        JsonObject read = unread.copy().put("is_read", true);
        JsonObject retitled = read.copy().put("title", "b");
        ChangeEvent first = ChangeEvent.update("notifications", unread, read, COMMIT);
        ChangeEvent second = ChangeEvent.update("notifications", read, retitled, COMMIT);
        ChangeEvent redelivered = ChangeEvent.update("notifications", unread.copy(), read.copy(), COMMIT);

        assertNotEquals(first.deduplicationKey("id"), second.deduplicationKey("id"));
        assertEquals(first.deduplicationKey("id"), redelivered.deduplicationKey("id"));
    }

    @Test
    @DisplayName("deduplicationKey() is null without id or commit timestamp")
    void deduplicationKey_nullWhenUnidentifiable() {
        ChangeEvent event = ChangeEvent.insert("notifications", new JsonObject().put("id", 1), null);

        assertNull(event.deduplicationKey("id"));
    }

    @Test
    @DisplayName("currentRow() is the old row for DELETE")
    void currentRow_usesOldRowForDelete() {
        ChangeEvent event = ChangeEvent.delete("posts", new JsonObject().put("id", 3), COMMIT);

        assertEquals(3, event.currentRow().getInteger("id"));
        assertEquals(3, event.columnValue("id"));
        assertNull(event.columnValue("missing"));
        assertNotNull(event.receivedAt());
    }

    @Test
    @DisplayName("ChangeOperation.parse() is case-insensitive")
    void parse_caseInsensitive() {
        assertEquals(ChangeOperation.UPDATE, ChangeOperation.parse(" update "));
        assertThrows(IllegalArgumentException.class, () -> ChangeOperation.parse("TRUNCATE"));
        assertThrows(IllegalArgumentException.class, () -> ChangeOperation.parse(null));
    }

    @Test
    @DisplayName("CHANNEL_ERROR and CLOSED are terminal for a handle")
    void channelStatus_terminal() {
        assertFalse(ChannelStatus.CONNECTING.isTerminal());
        assertFalse(ChannelStatus.SUBSCRIBED.isTerminal());
        assertTrue(ChannelStatus.CHANNEL_ERROR.isTerminal());
        assertTrue(ChannelStatus.CLOSED.isTerminal());
    }
}
