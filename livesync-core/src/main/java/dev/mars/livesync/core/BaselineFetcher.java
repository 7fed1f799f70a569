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

import dev.mars.livesync.api.change.RowFilter;
import dev.mars.livesync.api.model.NotificationRow;
import dev.mars.livesync.api.query.QuerySnapshot;
import dev.mars.livesync.api.query.RowQueryClient;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time queries that seed local aggregates before the live stream is trusted.
 *
 * <p>Each result carries the backend time it reflects, which becomes the
 * watermark below which held change events are discarded.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-02-10
 * @version 1.0
 */
public class BaselineFetcher {
    private static final Logger logger = LoggerFactory.getLogger(BaselineFetcher.class);

    private final RowQueryClient queryClient;
    private final RowMapper rowMapper;

    public BaselineFetcher(RowQueryClient queryClient, RowMapper rowMapper) {
        this.queryClient = Objects.requireNonNull(queryClient, "queryClient cannot be null");
        this.rowMapper = Objects.requireNonNull(rowMapper, "rowMapper cannot be null");
    }

    /**
     * Counts the user's unread notifications.
     */
    public Future<QuerySnapshot<Long>> fetchUnreadCount(String userId) {
        Objects.requireNonNull(userId, "userId cannot be null");
        List<RowFilter> filters = List.of(
            RowFilter.eq(NotificationRow.USER_ID, userId),
            RowFilter.eq(NotificationRow.IS_READ, false));
        return queryClient.count(NotificationRow.TABLE, filters)
            .onSuccess(snapshot -> logger.debug("Unread baseline for user {}: {} as of {}",
                userId, snapshot.value(), snapshot.asOf()));
    }

    /**
     * Loads the newest page of a feed. Rows that cannot be mapped are skipped.
     */
    public <T> Future<QuerySnapshot<List<T>>> fetchLatest(FeedDefinition<T> feed, int limit) {
        return queryClient.list(feed.table(), feed.baselineFilters(), feed.orderByColumn(), limit)
            .map(snapshot -> {
                List<T> items = new ArrayList<>(snapshot.value().size());
                for (JsonObject row : snapshot.value()) {
                    try {
                        T item = rowMapper.map(row, feed.rowType());
                        if (feed.isVisible(item)) {
                            items.add(item);
                        }
                    } catch (MalformedEventException e) {
                        logger.warn("[{}] skipping unreadable baseline row: {}", feed.name(), e.getMessage());
                    }
                }
                logger.debug("[{}] baseline of {} items as of {}", feed.name(), items.size(), snapshot.asOf());
                return QuerySnapshot.of(items, snapshot.asOf());
            });
    }
}
