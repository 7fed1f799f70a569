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
import dev.mars.livesync.api.mutation.RowMutationClient;
import dev.mars.livesync.api.query.QuerySnapshot;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Filtered row updates over the Vert.x reactive PostgreSQL pool.
 *
 * <p>The acknowledged {@code as_of} equals the commit timestamp the change
 * trigger stamps on the events of the same statement.
 */
public class PgRowMutationClient implements RowMutationClient {

    private static final Logger logger = LoggerFactory.getLogger(PgRowMutationClient.class);

    private final Pool pool;

    public PgRowMutationClient(Pool pool) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
    }

    @Override
    public Future<QuerySnapshot<Integer>> update(String table, List<RowFilter> filters, JsonObject changes) {
        PgStatement statement;
        try {
            statement = PgStatement.update(table, filters, changes);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        return pool.preparedQuery(statement.sql())
            .execute(statement.tuple())
            .map(rows -> {
                Row row = PgRowQueryClient.single(rows, statement);
                int updated = row.getLong(PgStatement.VALUE).intValue();
                logger.debug("Updated {} rows of {} where {}", updated, table, filters);
                return QuerySnapshot.of(updated, row.getOffsetDateTime(PgStatement.AS_OF).toInstant());
            });
    }
}
