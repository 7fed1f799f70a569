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
package dev.mars.livesync.core;

import dev.mars.livesync.api.change.ChangeOperation;
import dev.mars.livesync.api.change.RowFilter;
import dev.mars.livesync.api.model.PostRow;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Describes a list-shaped feed: which table it mirrors, how its rows are keyed,
 * ordered and filtered, and which cached queries depend on it.
 *
 * @param <T> the typed row
 */
public final class FeedDefinition<T> {

    /**
     * The global posts feed: every visible post, newest first.
     */
    public static final FeedDefinition<PostRow> POSTS = builder(PostRow.class)
        .name("posts")
        .table(PostRow.TABLE)
        .primaryKeyColumn(PostRow.ID)
        .orderByColumn(PostRow.CREATED_AT)
        .baselineFilters(List.of(RowFilter.eq(PostRow.IS_HIDDEN, false)))
        .keyOf(PostRow::id)
        .createdAtOf(PostRow::createdAt)
        .updatedAtOf(PostRow::updatedAt)
        .visible(post -> !post.hidden())
        .invalidationKey(List.of("posts", "list"))
        .build();

    private final String name;
    private final String table;
    private final Class<T> rowType;
    private final String primaryKeyColumn;
    private final String orderByColumn;
    private final List<RowFilter> baselineFilters;
    private final Set<ChangeOperation> operations;
    private final Function<T, Long> keyOf;
    private final Function<T, Instant> createdAtOf;
    private final Function<T, Instant> updatedAtOf;
    private final Predicate<T> visible;
    private final List<String> invalidationKey;

    private FeedDefinition(Builder<T> builder) {
        this.name = builder.name;
        this.table = builder.table;
        this.rowType = builder.rowType;
        this.primaryKeyColumn = builder.primaryKeyColumn;
        this.orderByColumn = builder.orderByColumn;
        this.baselineFilters = List.copyOf(builder.baselineFilters);
        this.operations = Set.copyOf(builder.operations);
        this.keyOf = builder.keyOf;
        this.createdAtOf = builder.createdAtOf;
        this.updatedAtOf = builder.updatedAtOf;
        this.visible = builder.visible;
        this.invalidationKey = List.copyOf(builder.invalidationKey);
    }

    public String name() { return name; }
    public String table() { return table; }
    public Class<T> rowType() { return rowType; }
    public String primaryKeyColumn() { return primaryKeyColumn; }
    public String orderByColumn() { return orderByColumn; }
    public List<RowFilter> baselineFilters() { return baselineFilters; }
    public Set<ChangeOperation> operations() { return operations; }
    public Function<T, Long> keyOf() { return keyOf; }
    public Function<T, Instant> createdAtOf() { return createdAtOf; }
    public List<String> invalidationKey() { return invalidationKey; }

    public boolean isVisible(T row) {
        return visible.test(row);
    }

    /**
     * @return the row's last-modified time, or null if the feed has none
     */
    public Instant updatedAt(T row) {
        return updatedAtOf != null ? updatedAtOf.apply(row) : null;
    }

    public static <T> Builder<T> builder(Class<T> rowType) {
        return new Builder<>(rowType);
    }

    public static class Builder<T> {
        private final Class<T> rowType;
        private String name;
        private String table;
        private String primaryKeyColumn = "id";
        private String orderByColumn = "created_at";
        private List<RowFilter> baselineFilters = List.of();
        private Set<ChangeOperation> operations = EnumSet.allOf(ChangeOperation.class);
        private Function<T, Long> keyOf;
        private Function<T, Instant> createdAtOf;
        private Function<T, Instant> updatedAtOf;
        private Predicate<T> visible = row -> true;
        private List<String> invalidationKey = List.of();

        private Builder(Class<T> rowType) {
            this.rowType = Objects.requireNonNull(rowType, "rowType cannot be null");
        }

        public Builder<T> name(String name) { this.name = name; return this; }
        public Builder<T> table(String table) { this.table = table; return this; }
        public Builder<T> primaryKeyColumn(String column) { this.primaryKeyColumn = column; return this; }
        public Builder<T> orderByColumn(String column) { this.orderByColumn = column; return this; }
        public Builder<T> baselineFilters(List<RowFilter> filters) { this.baselineFilters = filters; return this; }
        public Builder<T> operations(Set<ChangeOperation> operations) { this.operations = operations; return this; }
        public Builder<T> keyOf(Function<T, Long> keyOf) { this.keyOf = keyOf; return this; }
        public Builder<T> createdAtOf(Function<T, Instant> createdAtOf) { this.createdAtOf = createdAtOf; return this; }
        public Builder<T> updatedAtOf(Function<T, Instant> updatedAtOf) { this.updatedAtOf = updatedAtOf; return this; }
        public Builder<T> visible(Predicate<T> visible) { this.visible = visible; return this; }
        public Builder<T> invalidationKey(List<String> key) { this.invalidationKey = key; return this; }

        public FeedDefinition<T> build() {
            Objects.requireNonNull(name, "name cannot be null");
            Objects.requireNonNull(table, "table cannot be null");
            Objects.requireNonNull(primaryKeyColumn, "primaryKeyColumn cannot be null");
            Objects.requireNonNull(orderByColumn, "orderByColumn cannot be null");
            Objects.requireNonNull(keyOf, "keyOf cannot be null");
            Objects.requireNonNull(createdAtOf, "createdAtOf cannot be null");
            Objects.requireNonNull(visible, "visible cannot be null");
            if (operations == null || operations.isEmpty()) {
                throw new IllegalArgumentException("At least one operation is required");
            }
            return new FeedDefinition<>(this);
        }
    }
}
