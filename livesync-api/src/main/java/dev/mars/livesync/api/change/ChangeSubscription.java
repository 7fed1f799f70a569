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

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * What a change-stream subscription asks the backend for: one table, an
 * optional row filter and a set of operations.
 *
 * @param table       the table to watch
 * @param filter      the row filter, or null for every row of the table
 * @param operations  the operations to deliver, never empty
 * @param ownerUserId the user the subscription is held for, or null for global feeds
 */
public record ChangeSubscription(
    String table,
    RowFilter filter,
    Set<ChangeOperation> operations,
    String ownerUserId
) {

    public ChangeSubscription {
        Objects.requireNonNull(table, "table cannot be null");
        Objects.requireNonNull(operations, "operations cannot be null");
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("At least one operation is required");
        }
        operations = Set.copyOf(EnumSet.copyOf(operations));
    }

    /**
     * Subscription scoped to the rows owned by one user ({@code ownerColumn = userId}).
     */
    public static ChangeSubscription forOwner(String table, String ownerColumn, String userId,
                                              Set<ChangeOperation> operations) {
        Objects.requireNonNull(userId, "userId cannot be null");
        return new ChangeSubscription(table, RowFilter.eq(ownerColumn, userId), operations, userId);
    }

    /**
     * Subscription to every row of a table.
     */
    public static ChangeSubscription forTable(String table, Set<ChangeOperation> operations) {
        return new ChangeSubscription(table, null, operations, null);
    }

    /**
     * Tests whether an event belongs to this subscription.
     *
     * <p>DELETE snapshots often carry only the primary key; a DELETE whose old
     * row lacks the filter column is accepted rather than silently lost.
     */
    public boolean matches(ChangeEvent event) {
        if (event == null || !table.equals(event.table()) || !operations.contains(event.operation())) {
            return false;
        }
        if (filter == null) {
            return true;
        }
        JsonObject row = event.currentRow();
        if (event.operation() == ChangeOperation.DELETE && (row == null || !row.containsKey(filter.column()))) {
            return true;
        }
        return filter.matches(row);
    }

    /**
     * Key identifying the (table, owner) pair; at most one active handle may exist per key.
     */
    public String key() {
        return table + "/" + (ownerUserId != null ? ownerUserId : "*");
    }
}
