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
package dev.mars.livesync.api.mutation;

import dev.mars.livesync.api.change.RowFilter;
import dev.mars.livesync.api.query.QuerySnapshot;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Request/response write access to backend tables.
 */
public interface RowMutationClient {

    /**
     * Applies {@code changes} to every row matching all filters.
     *
     * @param table   table name
     * @param filters equality filters, combined with AND
     * @param changes column values to set
     * @return the number of rows updated and the backend time of the write;
     *         change events committed at or before that time are already
     *         reflected in the new row state
     */
    Future<QuerySnapshot<Integer>> update(String table, List<RowFilter> filters, JsonObject changes);
}
