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

import dev.mars.livesync.api.change.RowFilter;
import dev.mars.livesync.test.categories.TestCategories;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class PgStatementTest {

    @Test
    void countBindsFiltersInOrder() {
        PgStatement statement = PgStatement.count("notifications",
            List.of(RowFilter.eq("user_id", "alice"), RowFilter.eq("is_read", false)));

        assertEquals("SELECT count(*) AS value, now() AS as_of FROM \"notifications\""
            + " WHERE \"user_id\"::text = $1 AND \"is_read\" = $2", statement.sql());
        assertEquals(List.of("alice", false), statement.parameters());
        assertEquals(2, statement.tuple().size());
    }

    @Test
    void countWithoutFiltersHasNoWhereClause() {
        PgStatement statement = PgStatement.count("posts", List.of());

        assertEquals("SELECT count(*) AS value, now() AS as_of FROM \"posts\"", statement.sql());
        assertTrue(statement.parameters().isEmpty());
    }

    @Test
    void nullFilterValueUsesIsNull() {
        PgStatement statement = PgStatement.count("posts", List.of(RowFilter.eq("hidden_by", null)));

        assertTrue(statement.sql().endsWith("WHERE \"hidden_by\" IS NULL"));
        assertTrue(statement.parameters().isEmpty());
    }

    @Test
    void listAggregatesNewestRowsAsJson() {
        PgStatement statement = PgStatement.list("posts", List.of(RowFilter.eq("is_hidden", false)),
            "created_at", 20);

        assertEquals("SELECT now() AS as_of, coalesce(json_agg(t ORDER BY t.\"created_at\" DESC), '[]'::json) AS rows FROM"
            + " (SELECT * FROM \"posts\" WHERE \"is_hidden\" = $1"
            + " ORDER BY \"created_at\" DESC LIMIT 20) t", statement.sql());
        assertEquals(List.of(false), statement.parameters());
    }

    @Test
    void listRequiresPositiveLimit() {
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.list("posts", List.of(), "created_at", 0));
    }

    @Test
    void updateNumbersSetValuesBeforeFilters() {
        Instant readAt = Instant.parse("2026-02-10T09:00:00Z");
        PgStatement statement = PgStatement.update("notifications",
            List.of(RowFilter.eq("user_id", "alice"), RowFilter.eq("is_read", false)),
            new JsonObject().put("is_read", true).put("read_at", readAt));

        assertEquals("WITH updated AS (UPDATE \"notifications\" SET \"is_read\" = $1, \"read_at\" = $2"
            + " WHERE \"user_id\"::text = $3 AND \"is_read\" = $4 RETURNING 1)"
            + " SELECT count(*) AS value, now() AS as_of FROM updated", statement.sql());
        assertEquals(List.of(true, OffsetDateTime.of(2026, 2, 10, 9, 0, 0, 0, ZoneOffset.UTC), "alice", false),
            statement.parameters());
    }

    @Test
    void updateCanClearAColumn() {
        PgStatement statement = PgStatement.update("posts", List.of(RowFilter.eq("id", 3L)),
            new JsonObject().putNull("hidden_reason"));

        assertTrue(statement.sql().contains("SET \"hidden_reason\" = $1 WHERE \"id\" = $2"));
        assertNull(statement.parameters().get(0));
        assertEquals(3L, statement.parameters().get(1));
    }

    @Test
    void updateRequiresChanges() {
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.update("notifications", List.of(), new JsonObject()));
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.update("notifications", List.of(), null));
    }

    @Test
    void rejectsUnsafeIdentifiers() {
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.count("posts; DROP TABLE posts", List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.count("posts", List.of(RowFilter.eq("user_id\" OR 1=1 --", "x"))));
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.list("posts", List.of(), "created_at desc", 10));
        assertThrows(IllegalArgumentException.class,
            () -> PgStatement.update("posts", List.of(), new JsonObject().put("bad-name", 1)));
    }

    @Test
    void quotesChannelNames() {
        assertEquals("\"livesync_changes\"", PgIdentifiers.quoteChannel("livesync_changes"));
        assertThrows(IllegalArgumentException.class, () -> PgIdentifiers.quoteChannel("bad channel"));
        assertThrows(IllegalArgumentException.class, () -> PgIdentifiers.quoteChannel(""));
        assertThrows(IllegalArgumentException.class, () -> PgIdentifiers.quoteChannel("x".repeat(64)));
    }
}
