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
import dev.mars.livesync.api.query.QuerySnapshot;
import dev.mars.livesync.api.query.RowQueryClient;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Baseline queries over the Vert.x reactive PostgreSQL pool.
 *
 * <p>Each query is a single statement, so the rows and the {@code as_of}
 * watermark come from the same snapshot.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class PgRowQueryClient implements RowQueryClient {

    private static final Logger logger = LoggerFactory.getLogger(PgRowQueryClient.class);

    private final Pool pool;

    public PgRowQueryClient(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
    }

    @Override
    public Future<QuerySnapshot<Long>> count(String table, List<RowFilter> filters) {
        PgStatement statement;
        try {
            statement = PgStatement.count(table, filters);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        logger.debug("count on {} with {}", table, filters);
        return pool.preparedQuery(statement.sql())
            .execute(statement.tuple())
            .map(rows -> {
                Row row = single(rows, statement);
                return QuerySnapshot.of(row.getLong(PgStatement.VALUE),
                                        row.getOffsetDateTime(PgStatement.AS_OF).toInstant());
            });
    }

    @Override
    public Future<QuerySnapshot<List<JsonObject>>> list(String table, List<RowFilter> filters,
                                                        String orderByColumn, int limit) {
        PgStatement statement;
        try {
            statement = PgStatement.list(table, filters, orderByColumn, limit);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        logger.debug("list on {} with {} ordered by {} limit {}", table, filters, orderByColumn, limit);
        return pool.preparedQuery(statement.sql())
            .execute(statement.tuple())
            .map(rows -> {
                Row row = single(rows, statement);
                JsonArray array = row.getJsonArray(PgStatement.ROWS);
                List<JsonObject> result = new ArrayList<>(array.size());
                for (int i = 0; i < array.size(); i++) {
                    result.add(array.getJsonObject(i));
                }
                return QuerySnapshot.of(result, row.getOffsetDateTime(PgStatement.AS_OF).toInstant());
            });
    }

    static Row single(RowSet<Row> rows, PgStatement statement) {
        if (rows.size() != 1) {
            throw new IllegalStateException("Expected one row from [" + statement + "] but got " + rows.size());
        }
        return rows.iterator().next();
    }
}
