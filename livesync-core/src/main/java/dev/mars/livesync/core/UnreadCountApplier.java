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

import dev.mars.livesync.api.cache.CacheInvalidator;
import dev.mars.livesync.api.change.ChangeEvent;
import dev.mars.livesync.api.model.NotificationRow;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Keeps the unread notification counter in step with the change stream.
 *
 * <ul>
 *   <li>INSERT of an unread row: increment, invalidate {@code ["notifications"]}, notify listeners.</li>
 *   <li>UPDATE {@code is_read} false to true: decrement, clamped at zero.</li>
 *   <li>DELETE of an unread row: decrement, clamped at zero.</li>
 * </ul>
 * Everything else leaves the counter alone.
 */
public class UnreadCountApplier extends AbstractEventApplier<NotificationRow> {

    public static final List<String> INVALIDATION_KEY = List.of("notifications");

    private final UnreadCounter counter;
    private final CacheInvalidator cacheInvalidator;

    public UnreadCountApplier(UnreadCounter counter, RowMapper rowMapper, CacheInvalidator cacheInvalidator,
                              EventDeduplicator deduplicator) {
        super(counter.name(), NotificationRow.ID, rowMapper, deduplicator);
        this.counter = counter;
        this.cacheInvalidator = cacheInvalidator;
    }

    @Override
    protected ApplyOutcome applyScoped(ChangeEvent event) {
        switch (event.operation()) {
            case INSERT:
                return applyInsert(event);
            case UPDATE:
                return applyUpdate(event);
            case DELETE:
                return applyDelete(event);
            default:
                throw new MalformedEventException("Unsupported operation " + event.operation());
        }
    }

    private ApplyOutcome applyInsert(ChangeEvent event) {
        JsonObject row = requireNewRow(event);
        requireKey(row);
        NotificationRow notification = rowMapper.map(row, NotificationRow.class);
        if (notification.read()) {
            return ApplyOutcome.IGNORED;
        }
        counter.increment();
        CacheInvalidation.invalidate(cacheInvalidator, INVALIDATION_KEY);
        notifyNewItem(notification);
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome applyUpdate(ChangeEvent event) {
        boolean wasRead = requireBoolean(requireOldRow(event), NotificationRow.IS_READ);
        boolean isRead = requireBoolean(requireNewRow(event), NotificationRow.IS_READ);
        if (!wasRead && isRead) {
            counter.decrement();
            return ApplyOutcome.APPLIED;
        }
        return ApplyOutcome.IGNORED;
    }

    private ApplyOutcome applyDelete(ChangeEvent event) {
        if (!event.hasOldRow()) {
            return ApplyOutcome.IGNORED;
        }
        JsonObject oldRow = event.oldRow();
        if (Boolean.FALSE.equals(oldRow.getValue(NotificationRow.IS_READ))) {
            counter.decrement();
            return ApplyOutcome.APPLIED;
        }
        return ApplyOutcome.IGNORED;
    }
}
