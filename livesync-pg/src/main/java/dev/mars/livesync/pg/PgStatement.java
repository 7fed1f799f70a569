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
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Tuple;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A parameterised statement together with its bind values.
 *
 * <p>Every statement also selects {@code now()} as {@code as_of}, the backend
 * time the result is consistent with. {@code now()} is the transaction start
 * time, which is also what the change trigger stamps on each event.
 */
final class PgStatement {

    static final String AS_OF = "as_of";
    static final String VALUE = "value";
    static final String ROWS = "rows";

    private final String sql;
    private final List<Object> parameters;

    private PgStatement(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    String sql() {
        return sql;
    }

    List<Object> parameters() {
        return parameters;
    }

    Tuple tuple() {
        return Tuple.tuple(new ArrayList<>(parameters));
    }

    static PgStatement count(String table, List<RowFilter> filters) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT count(*) AS " + VALUE + ", now() AS " + AS_OF
            + " FROM " + PgIdentifiers.quote(table)
            + where(filters, params);
        return new PgStatement(sql, params);
    }

    static PgStatement list(String table, List<RowFilter> filters, String orderByColumn, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<Object> params = new ArrayList<>();
        String orderBy = PgIdentifiers.quote(orderByColumn);
        String inner = "SELECT * FROM " + PgIdentifiers.quote(table)
            + where(filters, params)
            + " ORDER BY " + orderBy + " DESC"
            + " LIMIT " + limit;
        String sql = "SELECT now() AS " + AS_OF
            + ", coalesce(json_agg(t ORDER BY t." + orderBy + " DESC), '[]'::json) AS " + ROWS
            + " FROM (" + inner + ") t";
        return new PgStatement(sql, params);
    }

    static PgStatement update(String table, List<RowFilter> filters, JsonObject changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("changes cannot be empty");
        }
        List<Object> params = new ArrayList<>();
        StringBuilder set = new StringBuilder();
        for (Map.Entry<String, Object> change : changes.getMap().entrySet()) {
            if (set.length() > 0) {
                set.append(", ");
            }
            params.add(bindValue(change.getValue()));
            set.append(PgIdentifiers.quote(change.getKey())).append(" = $").append(params.size());
        }
        String sql = "WITH updated AS (UPDATE " + PgIdentifiers.quote(table)
            + " SET " + set
            + where(filters, params)
            + " RETURNING 1) SELECT count(*) AS " + VALUE + ", now() AS " + AS_OF + " FROM updated";
        return new PgStatement(sql, params);
    }

    private static String where(List<RowFilter> filters, List<Object> params) {
        if (filters == null || filters.isEmpty()) {
            return "";
        }
        StringBuilder clause = new StringBuilder(" WHERE ");
        for (int i = 0; i < filters.size(); i++) {
            RowFilter filter = filters.get(i);
            if (i > 0) {
                clause.append(" AND ");
            }
            String column = PgIdentifiers.quote(filter.column());
            Object value = filter.value();
            if (value == null) {
                clause.append(column).append(" IS NULL");
                continue;
            }
            params.add(bindValue(value));
            // uuid and enum columns compare against text parameters
            if (value instanceof String) {
                clause.append(column).append("::text = $").append(params.size());
            } else {
                clause.append(column).append(" = $").append(params.size());
            }
        }
        return clause.toString();
    }

    private static Object bindValue(Object value) {
        if (value instanceof Instant) {
            return ((Instant) value).atOffset(ZoneOffset.UTC);
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    @Override
    public String toString() {
        return sql;
    }
}
