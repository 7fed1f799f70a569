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

import java.util.List;
import java.util.Objects;

/**
 * Equality predicate on a single column, e.g. {@code user_id = 'abc'}.
 *
 * <p>Used for change-stream row filters, baseline queries and bulk mutations,
 * so that all three talk about the same rows.
 *
 * @param column the column name
 * @param value  the expected value (String, Boolean or Number)
 */
public record RowFilter(String column, Object value) {

    public RowFilter {
        Objects.requireNonNull(column, "column cannot be null");
        if (column.isBlank()) {
            throw new IllegalArgumentException("column cannot be blank");
        }
    }

    /**
     * Creates an equality filter.
     */
    public static RowFilter eq(String column, Object value) {
        return new RowFilter(column, value);
    }

    /**
     * Tests a row snapshot against this filter. Numbers are compared by value
     * so that an {@code Integer} column matches a {@code Long} filter.
     *
     * @param row the row snapshot, may be null
     * @return true if the row has the column and its value equals the filter value
     */
    public boolean matches(JsonObject row) {
        if (row == null || !row.containsKey(column)) {
            return false;
        }
        return valuesEqual(row.getValue(column), value);
    }

    /**
     * @return true if every filter matches the row
     */
    public static boolean matchesAll(List<RowFilter> filters, JsonObject row) {
        for (RowFilter filter : filters) {
            if (!filter.matches(row)) {
                return false;
            }
        }
        return true;
    }

    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            Number a = (Number) actual;
            Number b = (Number) expected;
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() == b.longValue();
            }
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (actual != null && expected != null && actual.getClass() != expected.getClass()) {
            // UUID and enum columns arrive as strings
            return actual.toString().equals(expected.toString());
        }
        return Objects.equals(actual, expected);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    /**
     * Renders the filter in the {@code column=eq.value} form used in logs.
     */
    @Override
    public String toString() {
        return column + "=eq." + value;
    }
}
