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
package dev.mars.livesync.api.query;

import dev.mars.livesync.api.change.RowFilter;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Request/response read access to backend tables.
 *
 * <p>All filters are combined with AND.
 */
public interface RowQueryClient {

    /**
     * Counts the rows matching all filters.
     *
     * @param table   table name
     * @param filters equality filters
     * @return the count and the backend time it is consistent with
     */
    Future<QuerySnapshot<Long>> count(String table, List<RowFilter> filters);

    /**
     * Lists rows matching all filters, newest first by {@code orderByColumn}.
     *
     * @param table         table name
     * @param filters       equality filters
     * @param orderByColumn column sorted descending
     * @param limit         maximum number of rows
     * @return the rows and the backend time they are consistent with
     */
    Future<QuerySnapshot<List<JsonObject>>> list(String table, List<RowFilter> filters,
                                                 String orderByColumn, int limit);
}
